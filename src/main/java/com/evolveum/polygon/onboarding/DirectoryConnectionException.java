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

import org.identityconnectors.framework.common.exceptions.ConnectionFailedException;

/**
 * Connection to the directory server could not be established.
 * There is never an open session when this is thrown.
 */
public class DirectoryConnectionException extends ConnectionFailedException {

    private static final long serialVersionUID = 1L;

    public enum Reason {
        NETWORK_UNREACHABLE, TLS_NEGOTIATION_FAILED, AUTHENTICATION_REJECTED
    }

    private final Reason reason;

    public DirectoryConnectionException(Reason reason, String message) {
        super(message);
        this.reason = reason;
    }

    public DirectoryConnectionException(Reason reason, String message, Throwable cause) {
        super(message, cause);
        this.reason = reason;
    }

    public Reason getReason() {
        return reason;
    }
}
