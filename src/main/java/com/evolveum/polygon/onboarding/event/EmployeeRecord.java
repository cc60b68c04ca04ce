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

/**
 * Employee data as maintained by the host HR system.
 */
public class EmployeeRecord {

    private final String id;
    private final String name;
    private final String workEmail;
    private final String workPhone;

    public EmployeeRecord(String id, String name, String workEmail, String workPhone) {
        this.id = id;
        this.name = name;
        this.workEmail = workEmail;
        this.workPhone = workPhone;
    }

    public String getId() {
        return id;
    }

    /**
     * Full name, given name first.
     */
    public String getName() {
        return name;
    }

    public String getWorkEmail() {
        return workEmail;
    }

    public String getWorkPhone() {
        return workPhone;
    }

    @Override
    public String toString() {
        return "EmployeeRecord(" + id + ": " + name + ", " + workEmail + ")";
    }
}
