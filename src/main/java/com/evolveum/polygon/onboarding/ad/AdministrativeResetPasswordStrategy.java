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

import org.apache.directory.api.ldap.model.name.Dn;
import org.identityconnectors.common.logging.Log;
import org.identityconnectors.common.security.GuardedString;

import com.evolveum.polygon.onboarding.DirectorySession;
import com.evolveum.polygon.onboarding.ProvisioningException;

/**
 * Resets the password with the ActiveDirectory PowerShell module on the domain controller.
 * Used when the directory refuses the password over LDAP.
 */
public class AdministrativeResetPasswordStrategy implements PasswordSetStrategy {

    private static final Log LOG = Log.getLog(AdministrativeResetPasswordStrategy.class);

    private final AdministrativeCommandRunner commandRunner;

    public AdministrativeResetPasswordStrategy(AdministrativeCommandRunner commandRunner) {
        this.commandRunner = commandRunner;
    }

    @Override
    public String getName() {
        return "administrative reset";
    }

    @Override
    public void setPassword(DirectorySession session, Dn accountDn, String loginName, GuardedString password) {
        String description = "Set-ADAccountPassword -Identity '" + loginName + "' -Reset";
        StringBuilder script = new StringBuilder();
        script.append("$ErrorActionPreference = 'Stop'; Import-Module ActiveDirectory; ");
        script.append("Set-ADAccountPassword -Identity ").append(quote(loginName));
        script.append(" -Reset -NewPassword (ConvertTo-SecureString ");
        password.access(chars -> script.append(quote(new String(chars))));
        script.append(" -AsPlainText -Force)");

        try {
            commandRunner.runPowerShell(script.toString(), description);
        } catch (AdministrativeCommandException e) {
            LOG.ok("Administrative password reset of {0} failed: {1} (stderr: {2})", loginName, e.getMessage(), e.getStderr());
            throw new ProvisioningException(ProvisioningException.Reason.PASSWORD_SET_FAILED,
                    "Administrative password reset of " + loginName + " failed: " + e.getMessage(), e);
        } finally {
            script.setLength(0);
        }
        LOG.ok("Password of {0} set using {1}", accountDn, getName());
    }

    /**
     * PowerShell single-quoted string, no variable expansion.
     */
    static String quote(String value) {
        return "'" + value.replace("'", "''") + "'";
    }
}
