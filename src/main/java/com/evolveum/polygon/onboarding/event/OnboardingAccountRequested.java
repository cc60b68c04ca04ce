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

import java.time.Instant;

/**
 * The host asks for a directory account for an employee, typically when the
 * "create directory account" onboarding activity is completed.
 */
public class OnboardingAccountRequested {

    private final EmployeeRecord employee;
    private final Instant requestedAt;

    public OnboardingAccountRequested(EmployeeRecord employee) {
        this(employee, Instant.now());
    }

    public OnboardingAccountRequested(EmployeeRecord employee, Instant requestedAt) {
        this.employee = employee;
        this.requestedAt = requestedAt;
    }

    public EmployeeRecord getEmployee() {
        return employee;
    }

    public Instant getRequestedAt() {
        return requestedAt;
    }

    @Override
    public String toString() {
        return "OnboardingAccountRequested(" + employee + " at " + requestedAt + ")";
    }
}
