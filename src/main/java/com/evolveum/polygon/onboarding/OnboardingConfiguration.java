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
import java.util.List;

import org.apache.directory.api.ldap.model.exception.LdapInvalidDnException;
import org.apache.directory.api.ldap.model.name.Dn;
import org.identityconnectors.common.security.GuardedString;
import org.identityconnectors.framework.spi.AbstractConfiguration;
import org.identityconnectors.framework.spi.ConfigurationProperty;

/**
 * Configuration of the directory used for employee onboarding.
 * Instances are read-only once resolved, a fresh instance is created for each provisioning call.
 */
public class OnboardingConfiguration extends AbstractConfiguration {

    public static final int DEFAULT_LDAPS_PORT = 636;
    public static final int DEFAULT_LDAP_PORT = 389;
    public static final int DEFAULT_CONNECT_TIMEOUT_SECONDS = 10;

    public static final String TRANSPORT_MODE_LDAPS = "ldaps";
    public static final String TRANSPORT_MODE_STARTTLS = "starttls";
    public static final String TRANSPORT_MODE_PLAIN = "plain";

    public static final String DEFAULT_PASSWORD_RESET_AUTHENTICATION_SCHEME = "Negotiate";

    /**
     * Directory server hostname or IP address.
     */
    private String server;

    /**
     * DNS name of the directory domain, e.g. "corp.local".
     */
    private String domain;

    /**
     * Administrative login. Plain login names are qualified with the domain (user@domain) for bind.
     */
    private String adminUser;

    private GuardedString adminPassword;

    /**
     * Full DN of the container for new accounts. Takes precedence over ouPath.
     */
    private String usersOuDn;

    /**
     * Slash-separated OU path relative to the domain, e.g. "Employees/NewHires".
     */
    private String ouPath;

    /**
     * Possible values: "ldaps", "starttls", "plain".
     */
    private String transportMode = TRANSPORT_MODE_LDAPS;

    private int port = DEFAULT_LDAPS_PORT;

    /**
     * When set to false, server certificate is not checked in any TLS mode.
     * Do not use this option in the production.
     */
    private boolean validateCertificate = true;

    private int connectTimeoutSeconds = DEFAULT_CONNECT_TIMEOUT_SECONDS;

    /**
     * WinRM endpoint (host or host:port) used for administrative password reset.
     * Administrative reset is disabled when not set.
     */
    private String passwordResetEndpoint;

    private String passwordResetAuthenticationScheme = DEFAULT_PASSWORD_RESET_AUTHENTICATION_SCHEME;

    private boolean passwordResetUseHttps = true;

    @ConfigurationProperty(order = 1, required = true)
    public String getServer() {
        return server;
    }

    public void setServer(String server) {
        this.server = server;
    }

    @ConfigurationProperty(order = 2, required = true)
    public String getDomain() {
        return domain;
    }

    public void setDomain(String domain) {
        this.domain = domain;
    }

    @ConfigurationProperty(order = 3, required = true)
    public String getAdminUser() {
        return adminUser;
    }

    public void setAdminUser(String adminUser) {
        this.adminUser = adminUser;
    }

    @ConfigurationProperty(order = 4, required = true, confidential = true)
    public GuardedString getAdminPassword() {
        return adminPassword;
    }

    public void setAdminPassword(GuardedString adminPassword) {
        this.adminPassword = adminPassword;
    }

    @ConfigurationProperty(order = 5)
    public String getUsersOuDn() {
        return usersOuDn;
    }

    public void setUsersOuDn(String usersOuDn) {
        this.usersOuDn = usersOuDn;
    }

    @ConfigurationProperty(order = 6)
    public String getOuPath() {
        return ouPath;
    }

    public void setOuPath(String ouPath) {
        this.ouPath = ouPath;
    }

    @ConfigurationProperty(order = 7)
    public String getTransportMode() {
        return transportMode;
    }

    public void setTransportMode(String transportMode) {
        this.transportMode = transportMode;
    }

    @ConfigurationProperty(order = 8)
    public int getPort() {
        return port;
    }

    public void setPort(int port) {
        this.port = port;
    }

    @ConfigurationProperty(order = 9)
    public boolean isValidateCertificate() {
        return validateCertificate;
    }

    public void setValidateCertificate(boolean validateCertificate) {
        this.validateCertificate = validateCertificate;
    }

    @ConfigurationProperty(order = 10)
    public int getConnectTimeoutSeconds() {
        return connectTimeoutSeconds;
    }

    public void setConnectTimeoutSeconds(int connectTimeoutSeconds) {
        this.connectTimeoutSeconds = connectTimeoutSeconds;
    }

    @ConfigurationProperty(order = 11)
    public String getPasswordResetEndpoint() {
        return passwordResetEndpoint;
    }

    public void setPasswordResetEndpoint(String passwordResetEndpoint) {
        this.passwordResetEndpoint = passwordResetEndpoint;
    }

    @ConfigurationProperty(order = 12)
    public String getPasswordResetAuthenticationScheme() {
        return passwordResetAuthenticationScheme;
    }

    public void setPasswordResetAuthenticationScheme(String passwordResetAuthenticationScheme) {
        this.passwordResetAuthenticationScheme = passwordResetAuthenticationScheme;
    }

    @ConfigurationProperty(order = 13)
    public boolean isPasswordResetUseHttps() {
        return passwordResetUseHttps;
    }

    public void setPasswordResetUseHttps(boolean passwordResetUseHttps) {
        this.passwordResetUseHttps = passwordResetUseHttps;
    }

    public boolean isPasswordResetEnabled() {
        return !isBlank(passwordResetEndpoint);
    }

    /**
     * Base DN of the domain: "corp.local" becomes "DC=corp,DC=local".
     */
    public String getBaseDn() {
        List<String> components = new ArrayList<>();
        for (String label : domain.split("\\.")) {
            if (!label.isBlank()) {
                components.add("DC=" + label.trim());
            }
        }
        return String.join(",", components);
    }

    /**
     * Name used in the bind request. AD accepts user@domain in simple bind.
     */
    public String getBindPrincipal() {
        if (adminUser.contains("@") || adminUser.contains("=")) {
            return adminUser;
        }
        return adminUser + "@" + domain;
    }

    public boolean isLdaps() {
        return TRANSPORT_MODE_LDAPS.equals(transportMode);
    }

    public boolean isStartTls() {
        return TRANSPORT_MODE_STARTTLS.equals(transportMode);
    }

    public boolean isPlain() {
        return TRANSPORT_MODE_PLAIN.equals(transportMode);
    }

    public long getConnectTimeoutMillis() {
        return connectTimeoutSeconds * 1000L;
    }

    @Override
    public void validate() {
        validateNotBlank(server, "server");
        validateNotBlank(domain, "domain");
        validateNotBlank(adminUser, "adminUser");
        if (adminPassword == null) {
            throw new DirectoryConfigurationException(DirectoryConfigurationException.Reason.MISSING_REQUIRED_FIELD,
                    "Directory admin password is not configured (adminPassword)");
        }
        if (!isLdaps() && !isStartTls() && !isPlain()) {
            throw new DirectoryConfigurationException(DirectoryConfigurationException.Reason.INVALID_VALUE,
                    "Unknown value for transportMode: " + transportMode);
        }
        if (port < 1 || port > 65535) {
            throw new DirectoryConfigurationException(DirectoryConfigurationException.Reason.INVALID_VALUE,
                    "Illegal value for port: " + port);
        }
        if (connectTimeoutSeconds < 1) {
            throw new DirectoryConfigurationException(DirectoryConfigurationException.Reason.INVALID_VALUE,
                    "Illegal value for connectTimeoutSeconds: " + connectTimeoutSeconds);
        }
        if (isPasswordResetEnabled() && passwordResetEndpoint.indexOf(':') > 0) {
            String endpointPort = passwordResetEndpoint.substring(passwordResetEndpoint.lastIndexOf(':') + 1);
            try {
                Integer.parseInt(endpointPort);
            } catch (NumberFormatException e) {
                throw new DirectoryConfigurationException(DirectoryConfigurationException.Reason.INVALID_VALUE,
                        "Illegal port in passwordResetEndpoint: " + passwordResetEndpoint, e);
            }
        }
        if (!isBlank(usersOuDn)) {
            try {
                new Dn(usersOuDn);
            } catch (LdapInvalidDnException e) {
                throw new DirectoryConfigurationException(DirectoryConfigurationException.Reason.INVALID_VALUE,
                        "Wrong DN format in usersOuDn: " + e.getMessage(), e);
            }
        }
    }

    private void validateNotBlank(String value, String propertyName) {
        if (isBlank(value)) {
            throw new DirectoryConfigurationException(DirectoryConfigurationException.Reason.MISSING_REQUIRED_FIELD,
                    "Directory " + propertyName + " is not configured");
        }
    }

    @Override
    public String toString() {
        return "OnboardingConfiguration(server=" + server + ", port=" + port + ", domain=" + domain
                + ", adminUser=" + adminUser + ", transportMode=" + transportMode
                + ", validateCertificate=" + validateCertificate + ", usersOuDn=" + usersOuDn
                + ", ouPath=" + ouPath + ", connectTimeoutSeconds=" + connectTimeoutSeconds
                + ", passwordResetEndpoint=" + passwordResetEndpoint + ")";
    }
}
