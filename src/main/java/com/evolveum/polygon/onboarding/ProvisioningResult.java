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

import org.identityconnectors.common.security.GuardedString;

/**
 * Outcome of one provisioning call. Either a success with the login name and the initial password,
 * or an error with a readable message. Never both.
 * <p>
 * The initial password is handed out only through {@link #getInitialPassword()}.
 * It is not part of {@link #toString()}.
 */
public final class ProvisioningResult {

    public enum ErrorKind {
        /**
         * The onboarding request itself is incomplete, e.g. missing e-mail.
         */
        INVALID_REQUEST,
        CONFIGURATION,
        CONNECTION,
        ALREADY_EXISTS,
        CREATE_REJECTED,
        PASSWORD_SET_FAILED,
        ENABLE_FAILED,
        VERIFY_MISMATCH,
        UNEXPECTED
    }

    private final String username;
    private final GuardedString initialPassword;
    private final String errorMessage;
    private final ErrorKind errorKind;

    private ProvisioningResult(String username, GuardedString initialPassword, String errorMessage, ErrorKind errorKind) {
        this.username = username;
        this.initialPassword = initialPassword;
        this.errorMessage = errorMessage;
        this.errorKind = errorKind;
    }

    public static ProvisioningResult success(String username, GuardedString initialPassword) {
        if (username == null || username.isEmpty()) {
            throw new IllegalArgumentException("Successful result needs username");
        }
        if (initialPassword == null) {
            throw new IllegalArgumentException("Successful result needs initial password");
        }
        return new ProvisioningResult(username, initialPassword, null, null);
    }

    public static ProvisioningResult error(ErrorKind errorKind, String errorMessage) {
        if (errorKind == null) {
            throw new IllegalArgumentException("Error result needs error kind");
        }
        if (errorMessage == null || errorMessage.isEmpty()) {
            errorMessage = errorKind.name().toLowerCase().replace('_', ' ');
        }
        return new ProvisioningResult(null, null, errorMessage, errorKind);
    }

    public boolean isSuccess() {
        return errorKind == null;
    }

    public String getUsername() {
        return username;
    }

    public GuardedString getInitialPassword() {
        return initialPassword;
    }

    public String getErrorMessage() {
        return errorMessage;
    }

    public ErrorKind getErrorKind() {
        return errorKind;
    }

    @Override
    public String toString() {
        if (isSuccess()) {
            return "ProvisioningResult(SUCCESS: " + username + ")";
        }
        return "ProvisioningResult(" + errorKind + ": " + errorMessage + ")";
    }
}
