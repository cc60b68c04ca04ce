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

import static org.testng.AssertJUnit.*;

import java.util.HashMap;
import java.util.Map;

import org.testng.annotations.BeforeMethod;
import org.testng.annotations.Test;

public class TestConfigResolver {

    private final ConfigResolver configResolver = new ConfigResolver();
    private Map<String, String> parameters;

    @BeforeMethod
    public void setUp() {
        parameters = new HashMap<>();
        parameters.put(ConfigResolver.PARAM_ADMIN_PASSWORD, "Adm1n!secret");
    }

    private OnboardingConfiguration resolve() {
        return configResolver.resolve(new MapParameterStore(parameters));
    }

    @Test
    public void testDefaults() throws Exception {
        OnboardingConfiguration configuration = resolve();

        assertEquals("localhost", configuration.getServer());
        assertEquals("employee.local", configuration.getDomain());
        assertEquals("administrator", configuration.getAdminUser());
        assertEquals("administrator@employee.local", configuration.getBindPrincipal());
        assertEquals("DC=employee,DC=local", configuration.getBaseDn());
        assertEquals(OnboardingConfiguration.TRANSPORT_MODE_LDAPS, configuration.getTransportMode());
        assertTrue(configuration.isLdaps());
        assertEquals(636, configuration.getPort());
        assertTrue("Certificate validation must be on by default", configuration.isValidateCertificate());
        assertEquals(10, configuration.getConnectTimeoutSeconds());
        assertEquals(10000L, configuration.getConnectTimeoutMillis());
        assertNull(configuration.getUsersOuDn());
        assertNull(configuration.getOuPath());
        assertFalse(configuration.isPasswordResetEnabled());
        assertEquals("Negotiate", configuration.getPasswordResetAuthenticationScheme());
        assertTrue(configuration.isPasswordResetUseHttps());
    }

    @Test
    public void testExplicitValues() throws Exception {
        parameters.put(ConfigResolver.PARAM_SERVER, " dc1.corp.local ");
        parameters.put(ConfigResolver.PARAM_DOMAIN, "corp.local");
        parameters.put(ConfigResolver.PARAM_ADMIN_USER, "svc-onboarding@corp.local");
        parameters.put(ConfigResolver.PARAM_OU_PATH, "Employees/NewHires");
        parameters.put(ConfigResolver.PARAM_TRANSPORT_MODE, "StartTLS");
        parameters.put(ConfigResolver.PARAM_VALIDATE_CERTIFICATE, "no");
        parameters.put(ConfigResolver.PARAM_CONNECT_TIMEOUT, "30");
        parameters.put(ConfigResolver.PARAM_PASSWORD_RESET_ENDPOINT, "dc1.corp.local");
        parameters.put(ConfigResolver.PARAM_PASSWORD_RESET_USE_HTTPS, "0");

        OnboardingConfiguration configuration = resolve();

        assertEquals("dc1.corp.local", configuration.getServer());
        assertEquals("svc-onboarding@corp.local", configuration.getBindPrincipal());
        assertEquals("Employees/NewHires", configuration.getOuPath());
        assertTrue(configuration.isStartTls());
        assertEquals(389, configuration.getPort());
        assertFalse(configuration.isValidateCertificate());
        assertEquals(30, configuration.getConnectTimeoutSeconds());
        assertTrue(configuration.isPasswordResetEnabled());
        assertFalse(configuration.isPasswordResetUseHttps());
    }

    @Test
    public void testPlainDefaultPort() throws Exception {
        parameters.put(ConfigResolver.PARAM_TRANSPORT_MODE, "plain");
        assertEquals(389, resolve().getPort());
    }

    @Test
    public void testExplicitPort() throws Exception {
        parameters.put(ConfigResolver.PARAM_PORT, "3269");
        assertEquals(3269, resolve().getPort());
    }

    @Test
    public void testBooleanValues() throws Exception {
        for (String value : new String[] {"true", "TRUE", "1", "Yes"}) {
            parameters.put(ConfigResolver.PARAM_VALIDATE_CERTIFICATE, value);
            assertTrue(value, resolve().isValidateCertificate());
        }
        for (String value : new String[] {"false", "0", "no", "whatever"}) {
            parameters.put(ConfigResolver.PARAM_VALIDATE_CERTIFICATE, value);
            assertFalse(value, resolve().isValidateCertificate());
        }
    }

    @Test
    public void testDnBindPrincipalIsNotQualified() throws Exception {
        parameters.put(ConfigResolver.PARAM_ADMIN_USER, "CN=Administrator,CN=Users,DC=corp,DC=local");
        assertEquals("CN=Administrator,CN=Users,DC=corp,DC=local", resolve().getBindPrincipal());
    }

    @Test
    public void testMissingPassword() throws Exception {
        parameters.remove(ConfigResolver.PARAM_ADMIN_PASSWORD);
        assertConfigurationError(DirectoryConfigurationException.Reason.MISSING_REQUIRED_FIELD);
    }

    @Test
    public void testBlankPassword() throws Exception {
        parameters.put(ConfigResolver.PARAM_ADMIN_PASSWORD, "  ");
        assertConfigurationError(DirectoryConfigurationException.Reason.MISSING_REQUIRED_FIELD);
    }

    @Test
    public void testInvalidPort() throws Exception {
        parameters.put(ConfigResolver.PARAM_PORT, "ldap");
        assertConfigurationError(DirectoryConfigurationException.Reason.INVALID_VALUE);
    }

    @Test
    public void testPortOutOfRange() throws Exception {
        parameters.put(ConfigResolver.PARAM_PORT, "70000");
        assertConfigurationError(DirectoryConfigurationException.Reason.INVALID_VALUE);
    }

    @Test
    public void testInvalidTimeout() throws Exception {
        parameters.put(ConfigResolver.PARAM_CONNECT_TIMEOUT, "0");
        assertConfigurationError(DirectoryConfigurationException.Reason.INVALID_VALUE);
    }

    @Test
    public void testUnknownTransportMode() throws Exception {
        parameters.put(ConfigResolver.PARAM_TRANSPORT_MODE, "ssh");
        assertConfigurationError(DirectoryConfigurationException.Reason.INVALID_VALUE);
    }

    @Test
    public void testInvalidUsersOu() throws Exception {
        parameters.put(ConfigResolver.PARAM_USERS_OU, "this is not a DN");
        assertConfigurationError(DirectoryConfigurationException.Reason.INVALID_VALUE);
    }

    @Test
    public void testInvalidPasswordResetEndpointPort() throws Exception {
        parameters.put(ConfigResolver.PARAM_PASSWORD_RESET_ENDPOINT, "dc1.corp.local:wsman");
        assertConfigurationError(DirectoryConfigurationException.Reason.INVALID_VALUE);
    }

    @Test
    public void testPasswordNotInToString() throws Exception {
        String configurationString = resolve().toString();
        assertFalse(configurationString, configurationString.contains("Adm1n!secret"));
    }

    @Test
    public void testPropertiesResource() throws Exception {
        OnboardingConfiguration configuration = configResolver.resolve(PropertiesParameterStore.fromResource("onboarding-test.properties"));

        assertEquals("dc1.corp.local", configuration.getServer());
        assertEquals("corp.local", configuration.getDomain());
        assertEquals("OU=NewHires,OU=Employees,DC=corp,DC=local", configuration.getUsersOuDn());
        assertTrue(configuration.isLdaps());
        assertEquals(636, configuration.getPort());
    }

    private void assertConfigurationError(DirectoryConfigurationException.Reason expectedReason) {
        try {
            resolve();
            fail("Unexpected success");
        } catch (DirectoryConfigurationException e) {
            assertEquals(e.getMessage(), expectedReason, e.getReason());
        }
    }
}
