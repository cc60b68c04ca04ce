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
package com.evolveum.polygon.onboarding.event;

import org.identityconnectors.common.security.GuardedString;

/**
 * Host callback for the outcome of an onboarding request.
 * <p>
 * The initial password is passed to {@link #accountCreated} only. The host is expected
 * to deliver it to the employee and forget it.
 * </p>
 */
public interface OnboardingListener {

    void accountCreated(EmployeeRecord employee, String username, GuardedString initialPassword);

    void accountFailed(EmployeeRecord employee, String errorMessage);

    default void statusChanged(EmployeeRecord employee, OnboardingStatus status) {
    }

}
