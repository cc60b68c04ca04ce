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
package com.evolveum.polygon.onboarding.ad;

import org.apache.directory.api.ldap.model.message.LdapResult;
import org.apache.directory.api.ldap.model.message.ResultCodeEnum;
import org.identityconnectors.framework.common.exceptions.AlreadyExistsException;

import com.evolveum.polygon.onboarding.ErrorHandler;

/**
 * Error handler that understands Windows error codes in AD diagnostic messages.
 */
public class AdErrorHandler extends ErrorHandler {

    @Override
    public boolean isAlreadyExists(LdapResult ldapResult) {
        WindowsErrorCode errorCode = WindowsErrorCode.parseDiagnosticMessage(ldapResult.getDiagnosticMessage());
        if (errorCode != null && ldapResult.getResultCode() != ResultCodeEnum.SUCCESS) {
            // AD also uses constraint violation for things that have nothing to do with uniqueness
            return AlreadyExistsException.class.equals(errorCode.getExceptionClass());
        }
        return super.isAlreadyExists(ldapResult);
    }

    @Override
    public String formatDiagnostics(LdapResult ldapResult) {
        WindowsErrorCode errorCode = WindowsErrorCode.parseDiagnosticMessage(ldapResult.getDiagnosticMessage());
        if (errorCode == null) {
            return super.formatDiagnostics(ldapResult);
        }
        return super.formatDiagnostics(ldapResult) + ": " + errorCode.name() + ": " + errorCode.getMessage();
    }
}
