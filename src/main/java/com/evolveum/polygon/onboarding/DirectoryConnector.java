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

import java.security.KeyStore;
import java.security.KeyStoreException;
import java.security.NoSuchAlgorithmException;

import javax.net.ssl.TrustManager;
import javax.net.ssl.TrustManagerFactory;

import org.apache.directory.api.ldap.model.exception.LdapException;
import org.apache.directory.api.ldap.model.message.BindRequest;
import org.apache.directory.api.ldap.model.message.BindRequestImpl;
import org.apache.directory.api.ldap.model.message.BindResponse;
import org.apache.directory.api.ldap.model.message.LdapResult;
import org.apache.directory.api.ldap.model.message.ResultCodeEnum;
import org.apache.directory.ldap.client.api.LdapConnectionConfig;
import org.apache.directory.ldap.client.api.LdapNetworkConnection;
import org.apache.directory.ldap.client.api.NoVerificationTrustManager;
import org.identityconnectors.common.logging.Log;

import com.evolveum.polygon.onboarding.DirectoryConnectionException.Reason;

/**
 * Opens an authenticated directory session using one of the supported transport modes:
 * LDAPS, StartTLS or plain LDAP.
 * <p>
 * A new connection is created for every call, there is no pooling. When connection fails
 * nothing is left open.
 */
public class DirectoryConnector {

    private static final Log LOG = Log.getLog(DirectoryConnector.class);

    private final ErrorHandler errorHandler;
    private final ConnectionLog connectionLog;

    public DirectoryConnector(ErrorHandler errorHandler, ConnectionLog connectionLog) {
        this.errorHandler = errorHandler;
        this.connectionLog = connectionLog;
    }

    public DirectorySession connect(OnboardingConfiguration configuration) {
        LdapConnectionConfig connectionConfig = createLdapConnectionConfig(configuration);
        LdapNetworkConnection connection = connectConnection(configuration, connectionConfig);
        try {
            if (configuration.isStartTls()) {
                startTls(connection);
            }
            bind(connection, configuration);
        } catch (RuntimeException e) {
            closeQuietly(connection, e);
            throw e;
        }
        return new LdapNetworkDirectorySession(connection, connectionLog);
    }

    private LdapConnectionConfig createLdapConnectionConfig(OnboardingConfiguration configuration) {
        LdapConnectionConfig connectionConfig = new LdapConnectionConfig();
        connectionConfig.setLdapHost(configuration.getServer());
        connectionConfig.setLdapPort(configuration.getPort());
        connectionConfig.setTimeout(configuration.getConnectTimeoutMillis());
        connectionConfig.setConnectTimeout(configuration.getConnectTimeoutMillis());

        if (configuration.isLdaps()) {
            connectionConfig.setUseSsl(true);
            connectionConfig.setTrustManagers(createTrustManager(configuration));
        } else if (configuration.isStartTls()) {
            // StartTLS is negotiated explicitly after connect, so the failure can be told apart
            connectionConfig.setTrustManagers(createTrustManager(configuration));
        } else if (configuration.isPlain()) {
            LOG.warn("Using plain LDAP connection to {0}:{1}, credentials are sent unencrypted",
                    configuration.getServer(), configuration.getPort());
        } else {
            throw new DirectoryConfigurationException(DirectoryConfigurationException.Reason.INVALID_VALUE,
                    "Unknown value for transportMode: " + configuration.getTransportMode());
        }
        return connectionConfig;
    }

    private TrustManager[] createTrustManager(OnboardingConfiguration configuration) {
        if (!configuration.isValidateCertificate()) {
            LOG.warn("Server certificate validation is disabled for {0}. Do not use this setting in production.",
                    configuration.getServer());
            return new TrustManager[]{new NoVerificationTrustManager()};
        }

        String defaultAlgorithm = TrustManagerFactory.getDefaultAlgorithm();
        try {
            TrustManagerFactory tmf = TrustManagerFactory.getInstance(defaultAlgorithm);
            tmf.init((KeyStore) null); // load system default keystore (e.g. JDK cacerts)
            return tmf.getTrustManagers();
        } catch (NoSuchAlgorithmException | KeyStoreException e) {
            LOG.error("Error creating trust manager: {0}", e.getMessage(), e);
            throw new DirectoryConnectionException(Reason.TLS_NEGOTIATION_FAILED,
                    "Unable to create trust manager: " + e.getMessage(), e);
        }
    }

    private LdapNetworkConnection connectConnection(OnboardingConfiguration configuration, LdapConnectionConfig connectionConfig) {
        LdapNetworkConnection connection = new LdapNetworkConnection(connectionConfig);
        String address = connectionConfig.getLdapHost() + ":" + connectionConfig.getLdapPort();
        try {
            LOG.info("Connecting to {0} ({1}) as {2}", address, configuration.getTransportMode(), configuration.getBindPrincipal());
            LOG.ok("Connection networking parameters: timeout={0}s, validateCertificate={1}",
                    configuration.getConnectTimeoutSeconds(), configuration.isValidateCertificate());
            boolean connected = connection.connect();
            LOG.ok("Connected ({0})", connected);
            if (!connected) {
                connectionLog.error(connection, "connect", "Not connected after connect", address);
                closeQuietly(connection, null);
                throw new DirectoryConnectionException(Reason.NETWORK_UNREACHABLE,
                        "Unable to connect to directory server " + address + " due to unknown reasons");
            }
            connectionLog.success(connection, "connect", address);
        } catch (LdapException e) {
            connectionLog.error(connection, "connect", e, address);
            closeQuietly(connection, e);
            throw errorHandler.processConnectionException("Unable to connect to directory server " + address, e);
        }
        return connection;
    }

    private void startTls(LdapNetworkConnection connection) {
        try {
            connection.startTls();
            connectionLog.success(connection, "startTLS");
        } catch (LdapException e) {
            connectionLog.error(connection, "startTLS", e, null);
            String message = "StartTLS negotiation with " + LdapUtil.formatConnectionInfo(connection) + " failed";
            LdapUtil.logOperationError(message, e, null);
            throw new DirectoryConnectionException(Reason.TLS_NEGOTIATION_FAILED,
                    message + ": " + errorHandler.formatDiagnostics(e), e);
        }
    }

    private void bind(LdapNetworkConnection connection, OnboardingConfiguration configuration) {
        final BindRequest bindRequest = new BindRequestImpl();
        String bindPrincipal = configuration.getBindPrincipal();
        bindRequest.setName(bindPrincipal);
        configuration.getAdminPassword().access(chars -> bindRequest.setCredentials(new String(chars)));

        BindResponse bindResponse;
        try {
            bindResponse = connection.bind(bindRequest);
        } catch (LdapException e) {
            connectionLog.error(connection, "bind", e, bindPrincipal);
            throw errorHandler.processConnectionException("Unable to bind to directory server "
                    + LdapUtil.formatConnectionInfo(connection) + " as " + bindPrincipal, e);
        }
        LdapResult ldapResult = bindResponse.getLdapResult();
        if (ldapResult.getResultCode() != ResultCodeEnum.SUCCESS) {
            connectionLog.error(connection, "bind", ldapResult, bindPrincipal);
            throw errorHandler.processBindResult("Unable to bind to directory server "
                    + LdapUtil.formatConnectionInfo(connection) + " as " + bindPrincipal, ldapResult);
        }
        LOG.info("Bound to {0} as {1}: {2} ({3})", LdapUtil.formatConnectionInfo(connection),
                bindPrincipal, ldapResult.getDiagnosticMessage(), ldapResult.getResultCode());
        connectionLog.success(connection, "bind", bindPrincipal);
    }

    private void closeQuietly(LdapNetworkConnection connection, Exception reason) {
        try {
            connection.close();
        } catch (Exception closeException) {
            connectionLog.error(connection, "close", "close after failure: " + closeException.getMessage(),
                    reason == null ? null : reason.getMessage());
            LOG.error("Error closing connection (handling error during creation of a new connection): {0}",
                    closeException.getMessage(), closeException);
        }
    }
}
