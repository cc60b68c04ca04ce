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

import java.security.GeneralSecurityException;

import javax.net.ssl.SSLException;

import org.apache.directory.api.ldap.model.exception.LdapAuthenticationException;
import org.apache.directory.api.ldap.model.exception.LdapAuthenticationNotSupportedException;
import org.apache.directory.api.ldap.model.exception.LdapException;
import org.apache.directory.api.ldap.model.exception.LdapStrongAuthenticationRequiredException;
import org.apache.directory.api.ldap.model.message.LdapResult;
import org.apache.directory.api.ldap.model.message.ResultCodeEnum;

import com.evolveum.polygon.onboarding.DirectoryConnectionException.Reason;

/**
 * Translates LDAP errors to readable messages and failure reasons.
 * Subclasses may understand server-specific diagnostic messages.
 */
public class ErrorHandler {

    /**
     * Failure of connect or bind that was reported as an exception by the LDAP API.
     */
    public DirectoryConnectionException processConnectionException(String message, LdapException ldapException) {
        Reason reason;
        if (ldapException instanceof LdapAuthenticationException
                || ldapException instanceof LdapAuthenticationNotSupportedException
                || ldapException instanceof LdapStrongAuthenticationRequiredException) {
            reason = Reason.AUTHENTICATION_REJECTED;
        } else if (isTlsFailure(ldapException)) {
            reason = Reason.TLS_NEGOTIATION_FAILED;
        } else {
            reason = Reason.NETWORK_UNREACHABLE;
        }
        LdapUtil.logOperationError(message, ldapException, reason.name());
        return new DirectoryConnectionException(reason, message + ": " + formatDiagnostics(ldapException), ldapException);
    }

    /**
     * Bind that was answered by the server with an error result.
     */
    public DirectoryConnectionException processBindResult(String message, LdapResult ldapResult) {
        Reason reason;
        switch (ldapResult.getResultCode()) {
            case BUSY:
            case UNAVAILABLE:
                reason = Reason.NETWORK_UNREACHABLE;
                break;
            default:
                reason = Reason.AUTHENTICATION_REJECTED;
                break;
        }
        LdapUtil.logOperationError(message, ldapResult, reason.name());
        return new DirectoryConnectionException(reason, message + ": " + formatDiagnostics(ldapResult));
    }

    /**
     * Returns true if the add result may mean that the account is already present.
     * The caller still has to confirm that by looking for the login,
     * an entry with the same name but a different login gives the same result codes.
     */
    public boolean isAlreadyExists(LdapResult ldapResult) {
        ResultCodeEnum resultCode = ldapResult.getResultCode();
        return resultCode == ResultCodeEnum.ENTRY_ALREADY_EXISTS || resultCode == ResultCodeEnum.CONSTRAINT_VIOLATION;
    }

    /**
     * Server diagnostics in a form suitable for the provisioning result.
     */
    public String formatDiagnostics(LdapResult ldapResult) {
        return LdapUtil.formatLdapMessage(ldapResult);
    }

    public String formatDiagnostics(LdapException ldapException) {
        return LdapUtil.sanitizeString(ldapException.getMessage());
    }

    /**
     * TLS handshake failures are reported by the API as generic LDAP exceptions.
     * The SSL cause is somewhere deep in the exception chain.
     */
    public static boolean isTlsFailure(Throwable exception) {
        Throwable cause = exception;
        int depth = 0;
        while (cause != null && depth < 20) {
            if (cause instanceof SSLException || cause instanceof GeneralSecurityException) {
                return true;
            }
            String className = cause.getClass().getSimpleName();
            if (className.contains("Tls") || className.contains("Ssl")) {
                return true;
            }
            if (cause.getCause() == cause) {
                break;
            }
            cause = cause.getCause();
            depth++;
        }
        return false;
    }
}
