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

/**
 * Attribute names and flags of Active Directory user accounts.
 */
public class AdConstants {

    public static final String ATTRIBUTE_OBJECT_CLASS_NAME = "objectClass";
    public static final String ATTRIBUTE_CN_NAME = "cn";
    public static final String ATTRIBUTE_GIVEN_NAME_NAME = "givenName";
    public static final String ATTRIBUTE_SN_NAME = "sn";
    public static final String ATTRIBUTE_DISPLAY_NAME_NAME = "displayName";
    public static final String ATTRIBUTE_SAM_ACCOUNT_NAME_NAME = "sAMAccountName";
    public static final String ATTRIBUTE_USER_PRINCIPAL_NAME_NAME = "userPrincipalName";
    public static final String ATTRIBUTE_MAIL_NAME = "mail";
    public static final String ATTRIBUTE_TELEPHONE_NUMBER_NAME = "telephoneNumber";
    public static final String ATTRIBUTE_UNICODE_PWD_NAME = "unicodePwd";
    public static final String ATTRIBUTE_USER_ACCOUNT_CONTROL_NAME = "userAccountControl";

    public static final String OBJECT_CLASS_NAME_TOP = "top";
    public static final String OBJECT_CLASS_NAME_PERSON = "person";
    public static final String OBJECT_CLASS_NAME_ORGANIZATIONAL_PERSON = "organizationalPerson";
    public static final String OBJECT_CLASS_NAME_USER = "user";

    public static final String[] USER_OBJECT_CLASSES = {
            OBJECT_CLASS_NAME_TOP, OBJECT_CLASS_NAME_PERSON, OBJECT_CLASS_NAME_ORGANIZATIONAL_PERSON, OBJECT_CLASS_NAME_USER
    };

    /*
     * https://docs.microsoft.com/en-us/windows/desktop/adschema/a-useraccountcontrol
     */
    public enum UAC {
        //Typical user : 0x200 (512)

        ADS_UF_SCRIPT (0x00000001), //int: 1 //The logon script is executed.
        ADS_UF_ACCOUNTDISABLE (0x00000002), //int: 2 //The user account is disabled.
        ADS_UF_HOMEDIR_REQUIRED (0x00000008), //int: 8 //The home directory is required.
        ADS_UF_LOCKOUT (0x00000010), //int: 16 //The account is currently locked out.
        ADS_UF_PASSWD_NOTREQD (0x00000020), //int: 32 //No password is required.
        ADS_UF_PASSWD_CANT_CHANGE (0x00000040), //int: 64 //The user cannot change the password.
        ADS_UF_NORMAL_ACCOUNT (0x00000200), //int: 512 //This is a default account type that represents a typical user.
        ADS_UF_DONT_EXPIRE_PASSWD (0x00010000), //int: 65536 //The password for this account will never expire.
        ADS_UF_PASSWORD_EXPIRED (0x00800000); //int: 8388608 //The user password has expired.

        private final int bit;

        UAC(final int bit)
        {
            this.bit = bit;
        }

        public int getBit()
        {
            return bit;
        }

        public boolean isSet(int userAccountControl) {
            return (userAccountControl & bit) != 0;
        }
    }

}
