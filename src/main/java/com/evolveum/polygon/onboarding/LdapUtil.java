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

import org.apache.directory.api.ldap.model.cursor.EntryCursor;
import org.apache.directory.api.ldap.model.entry.Attribute;
import org.apache.directory.api.ldap.model.entry.Entry;
import org.apache.directory.api.ldap.model.entry.Value;
import org.apache.directory.api.ldap.model.exception.LdapException;
import org.apache.directory.api.ldap.model.exception.LdapInvalidDnException;
import org.apache.directory.api.ldap.model.exception.LdapOperationException;
import org.apache.directory.api.ldap.model.message.LdapResult;
import org.apache.directory.api.ldap.model.name.Dn;
import org.apache.directory.ldap.client.api.LdapConnectionConfig;
import org.apache.directory.ldap.client.api.LdapNetworkConnection;
import org.identityconnectors.common.logging.Log;
import org.identityconnectors.framework.common.exceptions.InvalidAttributeValueException;

/**
 * Static helpers for DNs, attribute values and LDAP error logging.
 */
public class LdapUtil {

    private static final Log LOG = Log.getLog(LdapUtil.class);

    public static Dn asDn(String stringDn) {
        try {
            return new Dn(stringDn);
        } catch (LdapInvalidDnException e) {
            throw new InvalidAttributeValueException("Invalid DN '" + stringDn + "': " + e.getMessage(), e);
        }
    }

    public static String getStringAttribute(Entry entry, String attrName) {
        Attribute attribute = entry.get(attrName);
        if (attribute == null) {
            return null;
        }
        Value value = attribute.get();
        if (value == null) {
            return null;
        }
        return value.getString();
    }

    public static Integer getIntegerAttribute(Entry entry, String attrName, Integer defaultVal) {
        String stringVal = getStringAttribute(entry, attrName);
        if (stringVal == null) {
            return defaultVal;
        }
        try {
            return Integer.parseInt(stringVal.trim());
        } catch (NumberFormatException e) {
            throw new InvalidAttributeValueException("Invalid integer value '" + stringVal + "' in attribute " + attrName + " of entry " + entry.getDn(), e);
        }
    }

    public static void logOperationError(String message, LdapResult ldapResult, String additionalErrorMessage) {
        if (LOG.isOk()) {
            if (additionalErrorMessage == null) {
                LOG.ok("Operation \"{0}\" ended with error ({1}): {2}", message, ldapResult.getResultCode().getResultCode(), ldapResult.getDiagnosticMessage());
            } else {
                LOG.ok("Operation \"{0}\" ended with error ({1}): {2}: {3}", message, ldapResult.getResultCode().getResultCode(), ldapResult.getDiagnosticMessage(), additionalErrorMessage);
            }
        }
    }

    public static void logOperationError(String message, LdapException exception, String additionalErrorMessage) {
        if (LOG.isOk()) {
            String exceptionMessage = null;
            if (exception.getMessage() != null) {
                exceptionMessage = sanitizeString(exception.getMessage());
            }
            Object code;
            if (exception instanceof LdapOperationException) {
                code = ((LdapOperationException) exception).getResultCode().getResultCode();
            } else {
                code = exception.getClass().getSimpleName();
            }
            if (additionalErrorMessage == null) {
                LOG.ok("Operation \"{0}\" ended with error ({1}): {2}", message, code, exceptionMessage);
            } else {
                LOG.ok("Operation \"{0}\" ended with error ({1}): {2}: {3}", message, code, exceptionMessage, additionalErrorMessage);
            }
        }
    }

    public static String formatLdapMessage(LdapResult ldapResult) {
        return sanitizeString(ldapResult.getResultCode().getMessage()) +
                ": " + sanitizeString(ldapResult.getDiagnosticMessage()) + " (" + ldapResult.getResultCode().getResultCode() + ")";
    }

    /**
     * AD returns non-printable chars in the diagnostic messages.
     */
    public static String sanitizeString(String in) {
        if (in == null) {
            return null;
        }
        return in.replaceAll("\\p{C}", "?");
    }

    public static String formatConnectionInfo(LdapNetworkConnection connection) {
        return formatConnectionInfo(connection.getConfig());
    }

    public static String formatConnectionInfo(LdapConnectionConfig config) {
        StringBuilder sb = new StringBuilder();
        Integer port = null;
        if (config.isUseSsl()) {
            sb.append("ldaps://");
            if (config.getLdapPort() != OnboardingConfiguration.DEFAULT_LDAPS_PORT) {
                port = config.getLdapPort();
            }
        } else {
            sb.append("ldap://");
            if (config.getLdapPort() != OnboardingConfiguration.DEFAULT_LDAP_PORT) {
                port = config.getLdapPort();
            }
        }
        sb.append(config.getLdapHost());
        if (port != null) {
            sb.append(":").append(port);
        }
        sb.append("/");
        return sb.toString();
    }

    public static void closeCursor(EntryCursor cursor) {
        try {
            cursor.close();
        } catch (IOException e) {
            // Unlikely to cause any harm to the operation.
            LOG.warn("Error closing the search cursor (continuing the operation anyway):", e);
        }
    }
}
