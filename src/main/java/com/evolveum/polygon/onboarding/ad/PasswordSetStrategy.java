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
package com.evolveum.polygon.onboarding.ad;

import org.apache.directory.api.ldap.model.name.Dn;
import org.identityconnectors.common.security.GuardedString;

import com.evolveum.polygon.onboarding.DirectorySession;
import com.evolveum.polygon.onboarding.ProvisioningException;

/**
 * One way of setting the initial password of a freshly created account.
 * Strategies are tried in order until one of them succeeds.
 */
public interface PasswordSetStrategy {

    String getName();

    /**
     * Sets the password or throws {@link ProvisioningException} with PASSWORD_SET_FAILED reason.
     * The password must not appear in the exception message or in the logs.
     */
    void setPassword(DirectorySession session, Dn accountDn, String loginName, GuardedString password);

}
