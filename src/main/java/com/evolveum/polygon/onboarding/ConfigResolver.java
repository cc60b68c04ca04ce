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

import org.identityconnectors.common.logging.Log;
import org.identityconnectors.common.security.GuardedString;

/**
 * Assembles validated {@link OnboardingConfiguration} from named parameters.
 * Parameters are read on every call, nothing is cached.
 */
public class ConfigResolver {

    private static final Log LOG = Log.getLog(ConfigResolver.class);

    public static final String PARAMETER_PREFIX = "onboarding.directory.";

    public static final String PARAM_SERVER = PARAMETER_PREFIX + "server";
    public static final String PARAM_DOMAIN = PARAMETER_PREFIX + "domain";
    public static final String PARAM_ADMIN_USER = PARAMETER_PREFIX + "adminUser";
    public static final String PARAM_ADMIN_PASSWORD = PARAMETER_PREFIX + "adminPassword";
    public static final String PARAM_USERS_OU = PARAMETER_PREFIX + "usersOu";
    public static final String PARAM_OU_PATH = PARAMETER_PREFIX + "ouPath";
    public static final String PARAM_TRANSPORT_MODE = PARAMETER_PREFIX + "transportMode";
    public static final String PARAM_PORT = PARAMETER_PREFIX + "port";
    public static final String PARAM_VALIDATE_CERTIFICATE = PARAMETER_PREFIX + "validateCertificate";
    public static final String PARAM_CONNECT_TIMEOUT = PARAMETER_PREFIX + "connectTimeout";
    public static final String PARAM_PASSWORD_RESET_ENDPOINT = PARAMETER_PREFIX + "passwordReset.endpoint";
    public static final String PARAM_PASSWORD_RESET_AUTHENTICATION_SCHEME = PARAMETER_PREFIX + "passwordReset.authenticationScheme";
    public static final String PARAM_PASSWORD_RESET_USE_HTTPS = PARAMETER_PREFIX + "passwordReset.useHttps";

    public static final String DEFAULT_SERVER = "localhost";
    public static final String DEFAULT_DOMAIN = "employee.local";
    public static final String DEFAULT_ADMIN_USER = "administrator";

    public OnboardingConfiguration resolve(ParameterStore parameterStore) {
        OnboardingConfiguration configuration = new OnboardingConfiguration();

        configuration.setServer(getString(parameterStore, PARAM_SERVER, DEFAULT_SERVER));
        configuration.setDomain(getString(parameterStore, PARAM_DOMAIN, DEFAULT_DOMAIN));
        configuration.setAdminUser(getString(parameterStore, PARAM_ADMIN_USER, DEFAULT_ADMIN_USER));

        String adminPassword = parameterStore.getParameter(PARAM_ADMIN_PASSWORD);
        if (isBlank(adminPassword)) {
            throw new DirectoryConfigurationException(DirectoryConfigurationException.Reason.MISSING_REQUIRED_FIELD,
                    "Directory admin password is not configured (" + PARAM_ADMIN_PASSWORD + ")");
        }
        configuration.setAdminPassword(new GuardedString(adminPassword.toCharArray()));

        configuration.setUsersOuDn(getString(parameterStore, PARAM_USERS_OU, null));
        configuration.setOuPath(getString(parameterStore, PARAM_OU_PATH, null));

        String transportMode = getString(parameterStore, PARAM_TRANSPORT_MODE, OnboardingConfiguration.TRANSPORT_MODE_LDAPS).toLowerCase();
        configuration.setTransportMode(transportMode);
        int defaultPort = OnboardingConfiguration.TRANSPORT_MODE_LDAPS.equals(transportMode)
                ? OnboardingConfiguration.DEFAULT_LDAPS_PORT : OnboardingConfiguration.DEFAULT_LDAP_PORT;
        configuration.setPort(getInt(parameterStore, PARAM_PORT, defaultPort));

        configuration.setValidateCertificate(getBoolean(parameterStore, PARAM_VALIDATE_CERTIFICATE, true));
        configuration.setConnectTimeoutSeconds(getInt(parameterStore, PARAM_CONNECT_TIMEOUT,
                OnboardingConfiguration.DEFAULT_CONNECT_TIMEOUT_SECONDS));

        configuration.setPasswordResetEndpoint(getString(parameterStore, PARAM_PASSWORD_RESET_ENDPOINT, null));
        configuration.setPasswordResetAuthenticationScheme(getString(parameterStore, PARAM_PASSWORD_RESET_AUTHENTICATION_SCHEME,
                OnboardingConfiguration.DEFAULT_PASSWORD_RESET_AUTHENTICATION_SCHEME));
        configuration.setPasswordResetUseHttps(getBoolean(parameterStore, PARAM_PASSWORD_RESET_USE_HTTPS, true));

        configuration.validate();

        LOG.ok("Resolved directory configuration: {0}", configuration);
        return configuration;
    }

    private String getString(ParameterStore parameterStore, String name, String defaultValue) {
        String value = parameterStore.getParameter(name);
        if (isBlank(value)) {
            return defaultValue;
        }
        return value.trim();
    }

    private int getInt(ParameterStore parameterStore, String name, int defaultValue) {
        String value = getString(parameterStore, name, null);
        if (value == null) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new DirectoryConfigurationException(DirectoryConfigurationException.Reason.INVALID_VALUE,
                    "Parameter " + name + " is not a number: " + value, e);
        }
    }

    private boolean getBoolean(ParameterStore parameterStore, String name, boolean defaultValue) {
        String value = getString(parameterStore, name, null);
        if (value == null) {
            return defaultValue;
        }
        String lowerCase = value.toLowerCase();
        return "true".equals(lowerCase) || "1".equals(lowerCase) || "yes".equals(lowerCase);
    }
}
