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

import org.identityconnectors.framework.common.exceptions.ConnectorException;

/**
 * One of the account provisioning steps failed. The message carries
 * the diagnostic text reported by the directory server.
 */
public class ProvisioningException extends ConnectorException {

    private static final long serialVersionUID = 1L;

    public enum Reason {
        ALREADY_EXISTS, CREATE_REJECTED, PASSWORD_SET_FAILED, ENABLE_FAILED, VERIFY_MISMATCH
    }

    private final Reason reason;

    public ProvisioningException(Reason reason, String message) {
        super(message);
        this.reason = reason;
    }

    public ProvisioningException(Reason reason, String message, Throwable cause) {
        super(message, cause);
        this.reason = reason;
    }

    public Reason getReason() {
        return reason;
    }
}
