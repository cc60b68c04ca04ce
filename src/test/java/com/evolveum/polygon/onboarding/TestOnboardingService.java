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

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import org.identityconnectors.common.security.GuardedString;
import org.testng.annotations.Test;

import com.evolveum.polygon.onboarding.ProvisioningResult.ErrorKind;
import com.evolveum.polygon.onboarding.ad.AdErrorHandler;
import com.evolveum.polygon.onboarding.ad.AdministrativeResetPasswordStrategy;
import com.evolveum.polygon.onboarding.ad.PasswordGenerator;
import com.evolveum.polygon.onboarding.ad.PasswordSetStrategy;
import com.evolveum.polygon.onboarding.ad.UnicodePwdPasswordStrategy;
import com.evolveum.polygon.onboarding.event.EmployeeRecord;
import com.evolveum.polygon.onboarding.event.OnboardingAccountRequested;
import com.evolveum.polygon.onboarding.event.OnboardingListener;
import com.evolveum.polygon.onboarding.event.OnboardingStatus;
import com.unboundid.ldap.sdk.SearchResultEntry;
import com.unboundid.ldap.sdk.SearchScope;

public class TestOnboardingService extends AbstractInMemoryDirectoryTest {

    private Map<String, String> createParameters() {
        Map<String, String> parameters = new HashMap<>();
        parameters.put(ConfigResolver.PARAM_SERVER, "localhost");
        parameters.put(ConfigResolver.PARAM_PORT, Integer.toString(port));
        parameters.put(ConfigResolver.PARAM_TRANSPORT_MODE, OnboardingConfiguration.TRANSPORT_MODE_PLAIN);
        parameters.put(ConfigResolver.PARAM_DOMAIN, DOMAIN);
        parameters.put(ConfigResolver.PARAM_ADMIN_USER, BIND_DN);
        parameters.put(ConfigResolver.PARAM_ADMIN_PASSWORD, BIND_PASSWORD);
        parameters.put(ConfigResolver.PARAM_CONNECT_TIMEOUT, "5");
        return parameters;
    }

    private OnboardingAccountRequested request(String id, String name, String email) {
        return new OnboardingAccountRequested(new EmployeeRecord(id, name, email, null));
    }

    @Test
    public void testCreateAccount() throws Exception {
        RecordingListener listener = new RecordingListener();
        OnboardingService service = new OnboardingService(new MapParameterStore(createParameters()), listener);

        ProvisioningResult result = service.handle(
                new OnboardingAccountRequested(new EmployeeRecord("E-1001", "John Doe", "john.doe@corp.com", "+421 900 123 456")));

        assertTrue("Unexpected failure: " + result, result.isSuccess());
        assertEquals("johndoe", result.getUsername());
        assertNotNull(result.getInitialPassword());

        SearchResultEntry entry = directoryServer.getEntry("CN=John Doe," + USERS_DN);
        assertNotNull("Entry not created", entry);
        assertEquals("johndoe", entry.getAttributeValue("sAMAccountName"));
        assertEquals("johndoe@corp.local", entry.getAttributeValue("userPrincipalName"));
        assertEquals("John", entry.getAttributeValue("givenName"));
        assertEquals("Doe", entry.getAttributeValue("sn"));
        assertEquals("john.doe@corp.com", entry.getAttributeValue("mail"));
        assertEquals("+421 900 123 456", entry.getAttributeValue("telephoneNumber"));
        assertEquals("512", entry.getAttributeValue("userAccountControl"));
        assertTrue(entry.hasAttribute("unicodePwd"));

        assertEquals(1, listener.created.size());
        assertEquals("johndoe", listener.created.get(0));
        assertSame(result.getInitialPassword(), listener.lastPassword);
        assertTrue(listener.failed.isEmpty());
        assertEquals(OnboardingStatus.PENDING, listener.statuses.get(0));
        assertEquals(OnboardingStatus.SUCCESS, listener.statuses.get(listener.statuses.size() - 1));
    }

    @Test
    public void testSecondRequestForSameLogin() throws Exception {
        RecordingListener listener = new RecordingListener();
        OnboardingService service = new OnboardingService(new MapParameterStore(createParameters()), listener);

        ProvisioningResult first = service.handle(request("E-1002", "Jane Roe", "jane.roe@corp.com"));
        assertTrue("Unexpected failure: " + first, first.isSuccess());

        ProvisioningResult second = service.handle(request("E-1099", "Jane Q. Roe", "Jane.Roe@other.example"));

        assertFalse(second.isSuccess());
        assertEquals(ErrorKind.ALREADY_EXISTS, second.getErrorKind());
        assertTrue(second.getErrorMessage(), second.getErrorMessage().contains("already exists"));
        assertNull("Second entry created", directoryServer.getEntry("CN=Jane Q. Roe," + USERS_DN));
        assertEquals(1, listener.failed.size());
        assertEquals(OnboardingStatus.ERROR, listener.statuses.get(listener.statuses.size() - 1));
    }

    @Test
    public void testSameNameWithDifferentLogin() throws Exception {
        RecordingListener listener = new RecordingListener();
        OnboardingService service = new OnboardingService(new MapParameterStore(createParameters()), listener);

        ProvisioningResult first = service.handle(request("E-1010", "John Smith", "john.smith@corp.com"));
        assertTrue("Unexpected failure: " + first, first.isSuccess());

        ProvisioningResult second = service.handle(request("E-1011", "John Smith", "jsmith2@corp.com"));

        assertEquals(ErrorKind.CREATE_REJECTED, second.getErrorKind());
        assertFalse(second.getErrorMessage(), second.getErrorMessage().contains("account already exists"));
        assertEquals(0, directoryServer.search(BASE_DN, SearchScope.SUB, "(sAMAccountName=jsmith2)").getEntryCount());
        assertEquals("johnsmith", directoryServer.getEntry("CN=John Smith," + USERS_DN).getAttributeValue("sAMAccountName"));
    }

    @Test
    public void testOuPath() throws Exception {
        Map<String, String> parameters = createParameters();
        parameters.put(ConfigResolver.PARAM_OU_PATH, "Employees/NewHires");
        OnboardingService service = new OnboardingService(new MapParameterStore(parameters), new RecordingListener());

        ProvisioningResult result = service.handle(request("E-1003", "Alice Smith", "alice.smith@corp.com"));

        assertTrue("Unexpected failure: " + result, result.isSuccess());
        assertNotNull(directoryServer.getEntry("CN=Alice Smith,OU=NewHires,OU=Employees," + BASE_DN));
    }

    @Test
    public void testMissingContainer() throws Exception {
        Map<String, String> parameters = createParameters();
        parameters.put(ConfigResolver.PARAM_USERS_OU, "OU=Missing," + BASE_DN);
        OnboardingService service = new OnboardingService(new MapParameterStore(parameters), new RecordingListener());

        ProvisioningResult result = service.handle(request("E-1004", "Bob Brown", "bob.brown@corp.com"));

        assertEquals(ErrorKind.CREATE_REJECTED, result.getErrorKind());
    }

    @Test
    public void testUnreachableServer() throws Exception {
        Map<String, String> parameters = createParameters();
        parameters.put(ConfigResolver.PARAM_PORT, Integer.toString(findClosedPort()));
        parameters.put(ConfigResolver.PARAM_CONNECT_TIMEOUT, "2");
        RecordingListener listener = new RecordingListener();
        OnboardingService service = new OnboardingService(new MapParameterStore(parameters), listener);

        ProvisioningResult result = service.handle(request("E-1005", "Carol White", "carol.white@corp.com"));

        assertEquals(ErrorKind.CONNECTION, result.getErrorKind());
        assertTrue(result.getErrorMessage(), result.getErrorMessage().startsWith("connection failed"));
        assertNull(directoryServer.getEntry("CN=Carol White," + USERS_DN));
        assertEquals(1, listener.failed.size());
    }

    @Test
    public void testWrongAdminPassword() throws Exception {
        Map<String, String> parameters = createParameters();
        parameters.put(ConfigResolver.PARAM_ADMIN_PASSWORD, "wrong");
        OnboardingService service = new OnboardingService(new MapParameterStore(parameters), new RecordingListener());

        ProvisioningResult result = service.handle(request("E-1006", "Dan Black", "dan.black@corp.com"));

        assertEquals(ErrorKind.CONNECTION, result.getErrorKind());
        assertTrue(result.getErrorMessage(), result.getErrorMessage().contains("AUTHENTICATION_REJECTED"));
        assertNull(directoryServer.getEntry("CN=Dan Black," + USERS_DN));
    }

    @Test
    public void testMissingConfiguration() throws Exception {
        Map<String, String> parameters = createParameters();
        parameters.remove(ConfigResolver.PARAM_ADMIN_PASSWORD);
        OnboardingService service = new OnboardingService(new MapParameterStore(parameters), new RecordingListener());

        ProvisioningResult result = service.handle(request("E-1007", "Eve Green", "eve.green@corp.com"));

        assertEquals(ErrorKind.CONFIGURATION, result.getErrorKind());
    }

    @Test
    public void testParameterStoreFault() throws Exception {
        RecordingListener listener = new RecordingListener();
        ParameterStore brokenStore = name -> {
            throw new IllegalStateException("configuration store unavailable");
        };
        OnboardingService service = new OnboardingService(brokenStore, listener);

        ProvisioningResult result = service.handle(request("E-1012", "Hank Blue", "hank.blue@corp.com"));

        assertEquals(ErrorKind.UNEXPECTED, result.getErrorKind());
        assertTrue(result.getErrorMessage(), result.getErrorMessage().contains("configuration store unavailable"));
        assertEquals(1, listener.failed.size());
        assertEquals(OnboardingStatus.ERROR, listener.statuses.get(listener.statuses.size() - 1));
    }

    @Test
    public void testConnectorFault() throws Exception {
        AdErrorHandler errorHandler = new AdErrorHandler();
        DirectoryConnector brokenConnector = new DirectoryConnector(errorHandler, new ConnectionLog()) {
            @Override
            public DirectorySession connect(OnboardingConfiguration configuration) {
                throw new IllegalStateException("no encryptor available");
            }
        };
        OnboardingService service = new OnboardingService(new MapParameterStore(createParameters()), new RecordingListener(),
                errorHandler, brokenConnector, new PasswordGenerator());

        ProvisioningResult result = service.handle(request("E-1013", "Ivy Red", "ivy.red@corp.com"));

        assertEquals(ErrorKind.UNEXPECTED, result.getErrorKind());
        assertTrue(result.getErrorMessage(), result.getErrorMessage().startsWith("unexpected error"));
        assertNull(directoryServer.getEntry("CN=Ivy Red," + USERS_DN));
    }

    @Test
    public void testMissingEmail() throws Exception {
        RecordingListener listener = new RecordingListener();
        OnboardingService service = new OnboardingService(new MapParameterStore(createParameters()), listener);

        ProvisioningResult result = service.handle(request("E-1008", "Frank Grey", null));

        assertEquals(ErrorKind.INVALID_REQUEST, result.getErrorKind());
        assertEquals(1, listener.failed.size());
    }

    @Test
    public void testListenerFailureDoesNotChangeResult() throws Exception {
        RecordingListener listener = new RecordingListener();
        listener.failOnCreated = true;
        OnboardingService service = new OnboardingService(new MapParameterStore(createParameters()), listener);

        ProvisioningResult result = service.handle(request("E-1009", "Grace Hopper", "grace.hopper@corp.com"));

        assertTrue("Unexpected failure: " + result, result.isSuccess());
        assertNotNull(directoryServer.getEntry("CN=Grace Hopper," + USERS_DN));
    }

    @Test
    public void testPasswordStrategies() throws Exception {
        OnboardingService service = new OnboardingService(new MapParameterStore(createParameters()), null);
        OnboardingConfiguration configuration = createConfiguration();

        List<PasswordSetStrategy> strategies = service.createPasswordSetStrategies(configuration);
        assertEquals(1, strategies.size());
        assertTrue(strategies.get(0) instanceof UnicodePwdPasswordStrategy);

        configuration.setPasswordResetEndpoint("dc1.corp.local");
        strategies = service.createPasswordSetStrategies(configuration);
        assertEquals(2, strategies.size());
        assertTrue(strategies.get(0) instanceof UnicodePwdPasswordStrategy);
        assertTrue(strategies.get(1) instanceof AdministrativeResetPasswordStrategy);
    }

    private static class RecordingListener implements OnboardingListener {

        private final List<String> created = new ArrayList<>();
        private final List<String> failed = new ArrayList<>();
        private final List<OnboardingStatus> statuses = new ArrayList<>();
        private GuardedString lastPassword;
        private boolean failOnCreated = false;

        @Override
        public void accountCreated(EmployeeRecord employee, String username, GuardedString initialPassword) {
            if (failOnCreated) {
                throw new IllegalStateException("Mail server is down");
            }
            created.add(username);
            lastPassword = initialPassword;
        }

        @Override
        public void accountFailed(EmployeeRecord employee, String errorMessage) {
            failed.add(errorMessage);
        }

        @Override
        public void statusChanged(EmployeeRecord employee, OnboardingStatus status) {
            statuses.add(status);
        }
    }
}
