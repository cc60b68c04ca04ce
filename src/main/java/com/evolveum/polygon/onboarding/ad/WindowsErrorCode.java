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

import org.identityconnectors.framework.common.exceptions.AlreadyExistsException;
import org.identityconnectors.framework.common.exceptions.InvalidAttributeValueException;
import org.identityconnectors.framework.common.exceptions.InvalidPasswordException;
import org.identityconnectors.framework.common.exceptions.PermissionDeniedException;
import org.identityconnectors.framework.common.exceptions.UnknownUidException;

/**
 * Windows error codes that AD puts at the beginning of LDAP diagnostic messages, e.g.
 * "0000052D: Constraint violation - check_password_restrictions: ...".
 * Based on https://msdn.microsoft.com/en-us/library/windows/desktop/ms681390(v=vs.85).aspx
 */
public enum WindowsErrorCode {

    ERROR_ACCESS_DENIED(0x5, "Access is denied.", PermissionDeniedException.class),
    // Returned for unicodePwd modification over a connection that is not encrypted
    ERROR_GEN_FAILURE(0x1F, "The directory refused the operation, password changes require an encrypted connection.", PermissionDeniedException.class),
    ERROR_USER_EXISTS(0x524, "The specified account already exists.", AlreadyExistsException.class),
    ERROR_PASSWORD_RESTRICTION(0x52D, "The password does not meet the length, complexity, or history requirements of the domain.", InvalidPasswordException.class),
    ERROR_DS_INSUFF_ACCESS_RIGHTS(0x200A, "Insufficient access rights to perform the operation.", PermissionDeniedException.class),
    ERROR_DS_CONSTRAINT_VIOLATION(0x202F, "A constraint violation occurred.", InvalidAttributeValueException.class),
    ERROR_DS_NO_PARENT_OBJECT(0x2089, "The operation could not be performed because the object's parent is either uninstantiated or deleted.", UnknownUidException.class),
    ERROR_DS_OBJ_NOT_FOUND(0x208D, "Directory object not found.", UnknownUidException.class);

    private final int code;
    private final String message;
    private final Class<? extends RuntimeException> exceptionClass;

    WindowsErrorCode(int code, String message, Class<? extends RuntimeException> exceptionClass) {
        this.code = code;
        this.message = message;
        this.exceptionClass = exceptionClass;
    }

    public int getCode() {
        return code;
    }

    public String getMessage() {
        return message;
    }

    public Class<? extends RuntimeException> getExceptionClass() {
        return exceptionClass;
    }

    public static WindowsErrorCode parseDiagnosticMessage(String diagnosticMessage) {
        if (diagnosticMessage == null) {
            return null;
        }
        int indexColon = diagnosticMessage.indexOf(':');
        if (indexColon < 1) {
            return null;
        }
        String codeString = diagnosticMessage.substring(0,  indexColon).trim();
        int code;
        try {
            code = Integer.parseInt(codeString, 16);
        } catch (NumberFormatException e) {
            return null;
        }
        return getByCode(code);
    }

    private static WindowsErrorCode getByCode(int code) {
        for (WindowsErrorCode val: values()) {
            if (code == val.code) {
                return val;
            }
        }
        return null;
    }
}
