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

import java.io.IOException;
import java.net.ServerSocket;

import org.identityconnectors.common.logging.Log;
import org.identityconnectors.common.security.GuardedString;
import org.testng.annotations.AfterClass;
import org.testng.annotations.BeforeClass;

import com.unboundid.ldap.listener.InMemoryDirectoryServer;
import com.unboundid.ldap.listener.InMemoryDirectoryServerConfig;
import com.unboundid.ldap.listener.InMemoryListenerConfig;
import com.unboundid.ldap.sdk.Attribute;

/**
 * Starts an in-memory LDAP server for the class. There is no schema checking, so the server
 * accepts AD attributes such as sAMAccountName or unicodePwd.
 */
public abstract class AbstractInMemoryDirectoryTest {

    private static final Log LOG = Log.getLog(AbstractInMemoryDirectoryTest.class);

    protected static final String DOMAIN = "corp.local";
    protected static final String BASE_DN = "DC=corp,DC=local";
    protected static final String USERS_DN = "CN=Users," + BASE_DN;
    protected static final String BIND_DN = "CN=Onboarding Admin,CN=Users," + BASE_DN;
    protected static final String BIND_PASSWORD = "Adm1n!secret";

    protected InMemoryDirectoryServer directoryServer;
    protected int port;

    @BeforeClass
    public void startServer() throws Exception {
        InMemoryDirectoryServerConfig config = new InMemoryDirectoryServerConfig(BASE_DN);
        config.setSchema(null);
        config.addAdditionalBindCredentials(BIND_DN, BIND_PASSWORD);
        config.setListenerConfigs(InMemoryListenerConfig.createLDAPConfig("default", 0));

        directoryServer = new InMemoryDirectoryServer(config);
        directoryServer.add(BASE_DN, new Attribute("objectClass", "top", "domain"), new Attribute("dc", "corp"));
        directoryServer.add(USERS_DN, new Attribute("objectClass", "top", "container"), new Attribute("cn", "Users"));
        directoryServer.add("OU=Employees," + BASE_DN, new Attribute("objectClass", "top", "organizationalUnit"),
                new Attribute("ou", "Employees"));
        directoryServer.add("OU=NewHires,OU=Employees," + BASE_DN, new Attribute("objectClass", "top", "organizationalUnit"),
                new Attribute("ou", "NewHires"));
        directoryServer.startListening();
        port = directoryServer.getListenPort();
        LOG.info("In-memory directory server listening on port {0}", port);
    }

    @AfterClass
    public void stopServer() {
        if (directoryServer != null) {
            directoryServer.shutDown(true);
        }
    }

    protected OnboardingConfiguration createConfiguration() {
        OnboardingConfiguration configuration = new OnboardingConfiguration();
        configuration.setServer("localhost");
        configuration.setPort(port);
        configuration.setDomain(DOMAIN);
        configuration.setAdminUser(BIND_DN);
        configuration.setAdminPassword(new GuardedString(BIND_PASSWORD.toCharArray()));
        configuration.setTransportMode(OnboardingConfiguration.TRANSPORT_MODE_PLAIN);
        configuration.setConnectTimeoutSeconds(5);
        return configuration;
    }

    /**
     * Port where nothing listens.
     */
    protected static int findClosedPort() throws IOException {
        try (ServerSocket socket = new ServerSocket(0)) {
            return socket.getLocalPort();
        }
    }
}
