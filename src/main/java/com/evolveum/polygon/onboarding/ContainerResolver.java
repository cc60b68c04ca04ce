/*
 * Copyright (c) 2024 Evolveum
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package com.evolveum.polygon.onboarding;

import static org.identityconnectors.common.StringUtil.isBlank;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.apache.directory.api.ldap.model.name.Dn;
import org.apache.directory.api.ldap.model.name.Rdn;

/**
 * Computes the DN of the container where new accounts are created.
 * Pure function of the configuration, does not touch the network.
 * <p>
 * Priority: explicit usersOuDn, then ouPath relative to the domain, then the CN=Users container.
 */
public class ContainerResolver {

    public static final String OU_PATH_SEPARATOR = "/";
    public static final String DEFAULT_USERS_CONTAINER_RDN = "CN=Users";

    public Dn resolveContainerDn(OnboardingConfiguration configuration) {
        String containerDn;
        if (!isBlank(configuration.getUsersOuDn())) {
            containerDn = configuration.getUsersOuDn();
        } else if (!isBlank(configuration.getOuPath())) {
            containerDn = ouPathToDn(configuration.getOuPath(), configuration.getBaseDn());
        } else {
            containerDn = DEFAULT_USERS_CONTAINER_RDN + "," + configuration.getBaseDn();
        }
        return LdapUtil.asDn(containerDn);
    }

    /**
     * "Employees/NewHires" becomes "OU=NewHires,OU=Employees,baseDn". Innermost OU goes first.
     */
    String ouPathToDn(String ouPath, String baseDn) {
        List<String> segments = new ArrayList<>();
        for (String segment : ouPath.split(OU_PATH_SEPARATOR)) {
            if (!segment.isBlank()) {
                segments.add(segment.trim());
            }
        }
        if (segments.isEmpty()) {
            return DEFAULT_USERS_CONTAINER_RDN + "," + baseDn;
        }
        Collections.reverse(segments);
        StringBuilder sb = new StringBuilder();
        for (String segment : segments) {
            sb.append("OU=").append(Rdn.escapeValue(segment)).append(",");
        }
        sb.append(baseDn);
        return sb.toString();
    }
}
