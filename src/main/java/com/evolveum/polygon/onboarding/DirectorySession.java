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

import java.util.List;

import org.apache.directory.api.ldap.model.entry.Entry;
import org.apache.directory.api.ldap.model.exception.LdapException;
import org.apache.directory.api.ldap.model.message.LdapResult;
import org.apache.directory.api.ldap.model.message.ModifyRequest;
import org.apache.directory.api.ldap.model.name.Dn;

/**
 * Authenticated, open connection to the directory server.
 * <p>
 * A session is owned by a single provisioning call and it is closed when the call ends.
 * Write operations return the LDAP result instead of throwing, so the caller can inspect
 * the result code. Exceptions indicate transport or protocol failures.
 */
public interface DirectorySession extends AutoCloseable {

    /**
     * Subtree search.
     */
    List<Entry> search(Dn baseDn, String filter, String... attributes) throws LdapException;

    /**
     * Reads a single entry. Returns null if there is no such entry.
     */
    Entry lookup(Dn dn, String... attributes) throws LdapException;

    LdapResult add(Entry entry) throws LdapException;

    LdapResult modify(ModifyRequest modifyRequest) throws LdapException;

    /**
     * Unbinds and closes the connection. Never throws.
     */
    @Override
    void close();

}
