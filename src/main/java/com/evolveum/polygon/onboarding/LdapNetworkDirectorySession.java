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

import java.util.ArrayList;
import java.util.List;

import org.apache.directory.api.ldap.model.cursor.CursorException;
import org.apache.directory.api.ldap.model.cursor.EntryCursor;
import org.apache.directory.api.ldap.model.entry.Entry;
import org.apache.directory.api.ldap.model.exception.LdapException;
import org.apache.directory.api.ldap.model.exception.LdapNoSuchObjectException;
import org.apache.directory.api.ldap.model.message.AddRequest;
import org.apache.directory.api.ldap.model.message.AddRequestImpl;
import org.apache.directory.api.ldap.model.message.AddResponse;
import org.apache.directory.api.ldap.model.message.LdapResult;
import org.apache.directory.api.ldap.model.message.ModifyRequest;
import org.apache.directory.api.ldap.model.message.ModifyResponse;
import org.apache.directory.api.ldap.model.message.ResultCodeEnum;
import org.apache.directory.api.ldap.model.message.SearchScope;
import org.apache.directory.api.ldap.model.name.Dn;
import org.apache.directory.ldap.client.api.LdapNetworkConnection;
import org.identityconnectors.common.logging.Log;

/**
 * Directory session backed by Apache Directory API network connection.
 */
public class LdapNetworkDirectorySession implements DirectorySession {

    private static final Log LOG = Log.getLog(LdapNetworkDirectorySession.class);

    private final LdapNetworkConnection connection;
    private final ConnectionLog connectionLog;

    public LdapNetworkDirectorySession(LdapNetworkConnection connection, ConnectionLog connectionLog) {
        this.connection = connection;
        this.connectionLog = connectionLog;
    }

    LdapNetworkConnection getConnection() {
        return connection;
    }

    @Override
    public List<Entry> search(Dn baseDn, String filter, String... attributes) throws LdapException {
        List<Entry> entries = new ArrayList<>();
        EntryCursor cursor = connection.search(baseDn, filter, SearchScope.SUBTREE, attributes);
        try {
            while (cursor.next()) {
                entries.add(cursor.get());
            }
        } catch (CursorException e) {
            connectionLog.error(connection, "search", e, filter);
            throw new LdapException("Error reading search results for " + filter + " in " + baseDn + ": " + e.getMessage(), e);
        } finally {
            LdapUtil.closeCursor(cursor);
        }
        connectionLog.searchSuccess(connection, baseDn, filter, entries.size());
        return entries;
    }

    @Override
    public Entry lookup(Dn dn, String... attributes) throws LdapException {
        Entry entry;
        try {
            entry = connection.lookup(dn, attributes);
        } catch (LdapNoSuchObjectException e) {
            entry = null;
        }
        if (entry == null) {
            connectionLog.error(connection, "lookup", "no such object", dn);
        } else {
            connectionLog.success(connection, "lookup", dn);
        }
        return entry;
    }

    @Override
    public LdapResult add(Entry entry) throws LdapException {
        AddRequest addRequest = new AddRequestImpl();
        addRequest.setEntry(entry);
        AddResponse addResponse = connection.add(addRequest);
        LdapResult ldapResult = addResponse.getLdapResult();
        logResult("add", ldapResult, entry.getDn());
        return ldapResult;
    }

    @Override
    public LdapResult modify(ModifyRequest modifyRequest) throws LdapException {
        ModifyResponse modifyResponse = connection.modify(modifyRequest);
        LdapResult ldapResult = modifyResponse.getLdapResult();
        logResult("modify", ldapResult, modifyRequest.getName());
        return ldapResult;
    }

    private void logResult(String operation, LdapResult ldapResult, Dn dn) {
        if (ldapResult.getResultCode() == ResultCodeEnum.SUCCESS) {
            connectionLog.success(connection, operation, dn);
        } else {
            connectionLog.error(connection, operation, ldapResult, dn);
        }
    }

    @Override
    public void close() {
        if (connection.isConnected() && connection.isAuthenticated()) {
            try {
                LOG.ok("Unbinding connection {0}", LdapUtil.formatConnectionInfo(connection));
                connection.unBind();
                connectionLog.success(connection, "unbind");
            } catch (LdapException e) {
                connectionLog.errorTagged(connection, "unbind", e, "ignored");
                LOG.warn("Unbind operation failed on {0} (ignoring): {1}", LdapUtil.formatConnectionInfo(connection), e.getMessage());
            }
        }
        try {
            connection.close();
            connectionLog.success(connection, "close");
        } catch (Exception e) {
            connectionLog.errorTagged(connection, "close", e, "ignored");
            LOG.warn("Error closing connection {0} (ignoring): {1}", LdapUtil.formatConnectionInfo(connection), e.getMessage());
        }
    }

    @Override
    public String toString() {
        return "LdapNetworkDirectorySession(" + LdapUtil.formatConnectionInfo(connection) + ")";
    }
}
