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

import static org.testng.AssertJUnit.*;

import org.identityconnectors.framework.common.exceptions.InvalidAttributeValueException;
import org.testng.annotations.Test;

import com.evolveum.polygon.onboarding.event.EmployeeRecord;

public class TestIdentityDerivation {

    @Test
    public void testTwoPartName() throws Exception {
        PersonIdentity identity = OnboardingService.deriveIdentity(new EmployeeRecord("E-1", "John Doe", "john.doe@corp.com", null));
        assertEquals("John", identity.getGivenName());
        assertEquals("Doe", identity.getSurname());
        assertEquals("johndoe", identity.getLoginName());
        assertEquals("john.doe@corp.com", identity.getEmailAddress());
        assertEquals("John Doe", identity.getDisplayName());
        assertEquals("johndoe@corp.local", identity.getUserPrincipalName("corp.local"));
        assertNull(identity.getTelephoneNumber());
    }

    @Test
    public void testMultiPartName() throws Exception {
        PersonIdentity identity = OnboardingService.deriveIdentity(new EmployeeRecord("E-2", "  Maria  de la Cruz ", "M.DelaCruz@corp.com", "123"));
        assertEquals("Maria", identity.getGivenName());
        assertEquals("de la Cruz", identity.getSurname());
        assertEquals("mdelacruz", identity.getLoginName());
        assertEquals("123", identity.getTelephoneNumber());
    }

    @Test
    public void testSingleName() throws Exception {
        PersonIdentity identity = OnboardingService.deriveIdentity(new EmployeeRecord("E-3", "Madonna", "madonna@corp.com", null));
        assertEquals("Madonna", identity.getGivenName());
        assertEquals("Madonna", identity.getSurname());
    }

    @Test(expectedExceptions = InvalidAttributeValueException.class)
    public void testNoEmail() throws Exception {
        OnboardingService.deriveIdentity(new EmployeeRecord("E-4", "John Doe", " ", null));
    }

    @Test(expectedExceptions = InvalidAttributeValueException.class)
    public void testNoName() throws Exception {
        OnboardingService.deriveIdentity(new EmployeeRecord("E-5", null, "john.doe@corp.com", null));
    }

    @Test(expectedExceptions = InvalidAttributeValueException.class)
    public void testEmptyLocalPart() throws Exception {
        OnboardingService.deriveIdentity(new EmployeeRecord("E-6", "John Doe", "...@corp.com", null));
    }

    @Test(expectedExceptions = InvalidAttributeValueException.class)
    public void testNoEmployee() throws Exception {
        OnboardingService.deriveIdentity(null);
    }
}
