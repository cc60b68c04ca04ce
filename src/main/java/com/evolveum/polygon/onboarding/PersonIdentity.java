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

import static org.identityconnectors.common.StringUtil.isBlank;

import org.identityconnectors.framework.common.exceptions.InvalidAttributeValueException;

/**
 * The person for whom the account is provisioned.
 */
public class PersonIdentity {

    private final String givenName;
    private final String surname;
    private final String loginName;
    private final String emailAddress;
    private final String telephoneNumber;

    public PersonIdentity(String givenName, String surname, String loginName, String emailAddress) {
        this(givenName, surname, loginName, emailAddress, null);
    }

    public PersonIdentity(String givenName, String surname, String loginName, String emailAddress, String telephoneNumber) {
        if (isBlank(loginName)) {
            throw new InvalidAttributeValueException("Login name must not be empty");
        }
        this.givenName = givenName;
        this.surname = surname;
        this.loginName = loginName;
        this.emailAddress = emailAddress;
        this.telephoneNumber = isBlank(telephoneNumber) ? null : telephoneNumber;
    }

    public String getGivenName() {
        return givenName;
    }

    public String getSurname() {
        return surname;
    }

    public String getLoginName() {
        return loginName;
    }

    public String getEmailAddress() {
        return emailAddress;
    }

    public String getTelephoneNumber() {
        return telephoneNumber;
    }

    public String getDisplayName() {
        return givenName + " " + surname;
    }

    public String getUserPrincipalName(String domain) {
        return loginName + "@" + domain;
    }

    @Override
    public String toString() {
        return "PersonIdentity(" + loginName + ": " + getDisplayName() + ", " + emailAddress + ")";
    }
}
