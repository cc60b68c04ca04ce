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

import java.nio.charset.StandardCharsets;
import java.util.Arrays;

import org.apache.directory.api.ldap.model.exception.LdapException;
import org.apache.directory.api.ldap.model.message.LdapResult;
import org.apache.directory.api.ldap.model.message.ModifyRequest;
import org.apache.directory.api.ldap.model.message.ModifyRequestImpl;
import org.apache.directory.api.ldap.model.message.ResultCodeEnum;
import org.apache.directory.api.ldap.model.name.Dn;
import org.identityconnectors.common.logging.Log;
import org.identityconnectors.common.security.GuardedString;

import com.evolveum.polygon.onboarding.DirectorySession;
import com.evolveum.polygon.onboarding.ErrorHandler;
import com.evolveum.polygon.onboarding.LdapUtil;
import com.evolveum.polygon.onboarding.ProvisioningException;

/**
 * Sets the password by replacing the unicodePwd attribute.
 * AD expects the password enclosed in double quotes, encoded as UTF-16LE.
 * AD refuses this unless the connection is encrypted.
 */
public class UnicodePwdPasswordStrategy implements PasswordSetStrategy {

    private static final Log LOG = Log.getLog(UnicodePwdPasswordStrategy.class);

    private final ErrorHandler errorHandler;

    public UnicodePwdPasswordStrategy(ErrorHandler errorHandler) {
        this.errorHandler = errorHandler;
    }

    @Override
    public String getName() {
        return AdConstants.ATTRIBUTE_UNICODE_PWD_NAME;
    }

    @Override
    public void setPassword(DirectorySession session, Dn accountDn, String loginName, GuardedString password) {
        byte[] encodedPassword = encodePassword(password);
        ModifyRequest modifyRequest = new ModifyRequestImpl();
        modifyRequest.setName(accountDn);
        modifyRequest.replace(AdConstants.ATTRIBUTE_UNICODE_PWD_NAME, encodedPassword);

        LdapResult ldapResult;
        try {
            ldapResult = session.modify(modifyRequest);
        } catch (LdapException e) {
            LdapUtil.logOperationError("set password of " + accountDn, e, null);
            throw new ProvisioningException(ProvisioningException.Reason.PASSWORD_SET_FAILED,
                    "Setting " + getName() + " of " + accountDn + " failed: " + LdapUtil.sanitizeString(e.getMessage()), e);
        } finally {
            Arrays.fill(encodedPassword, (byte) 0);
        }
        if (ldapResult.getResultCode() != ResultCodeEnum.SUCCESS) {
            LdapUtil.logOperationError("set password of " + accountDn, ldapResult, null);
            throw new ProvisioningException(ProvisioningException.Reason.PASSWORD_SET_FAILED,
                    "Setting " + getName() + " of " + accountDn + " failed: " + errorHandler.formatDiagnostics(ldapResult));
        }
        LOG.ok("Password of {0} set using {1}", accountDn, getName());
    }

    static byte[] encodePassword(GuardedString password) {
        StringBuilder quoted = new StringBuilder();
        password.access(chars -> quoted.append('"').append(chars).append('"'));
        byte[] bytes = quoted.toString().getBytes(StandardCharsets.UTF_16LE);
        quoted.setLength(0);
        return bytes;
    }
}
