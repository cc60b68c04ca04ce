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

import org.apache.directory.api.ldap.model.message.LdapResult;
import org.apache.directory.ldap.client.api.LdapNetworkConnection;
import org.identityconnectors.common.logging.Log;

/**
 * Terse connection log.
 */
public class ConnectionLog {
    private static final Log LOG = Log.getLog(ConnectionLog.class);

    public boolean isSuccess() {
        return LOG.isInfo();
    }

    public boolean isError() {
        return LOG.isError();
    }

    public void success(LdapNetworkConnection connection, String operation, Object params) {
        if (!isSuccess()) { return; }
        LOG.info("CONN {0} {1} success ({2})", getConnectionDesc(connection), operation, params);
    }

    public void success(LdapNetworkConnection connection, String operation) {
        if (!isSuccess()) { return; }
        LOG.info("CONN {0} {1} success ", getConnectionDesc(connection), operation);
    }

    public void error(LdapNetworkConnection connection, String operation, Exception exception, Object params) {
        if (!isError()) { return; }
        LOG.info("CONN {0} {1} error: {2} ({3})", getConnectionDesc(connection), operation, exception.getMessage(), params);
    }

    public void error(LdapNetworkConnection connection, String operation, LdapResult ldapResult, Object params) {
        if (!isError()) { return; }
        LOG.info("CONN {0} {1} error: {2} ({3}) ({4})", getConnectionDesc(connection), operation, ldapResult.getDiagnosticMessage(), ldapResult.getResultCode(), params);
    }

    public void error(LdapNetworkConnection connection, String operation, String message, Object params) {
        if (!isError()) { return; }
        LOG.info("CONN {0} {1} error: {2} ({3})", getConnectionDesc(connection), operation, message, params);
    }

    public void errorTagged(LdapNetworkConnection connection, String operation, Exception exception, String tag) {
        if (!isError()) { return; }
        LOG.info("CONN {0} {1} error: {2} [{3}]", getConnectionDesc(connection), operation, exception.getMessage(), tag);
    }

    public void searchSuccess(LdapNetworkConnection connection, Object base, String filter, int numEntries) {
        if (!isSuccess()) { return; }
        LOG.info("CONN {0} search success ({1} {2}): {3} entries returned", getConnectionDesc(connection),
                base, filter, numEntries);
    }

    private String getConnectionDesc(LdapNetworkConnection connection) {
        if (connection == null) {
            return "-";
        }
        return LdapUtil.formatConnectionInfo(connection);
    }

}
