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

import java.util.ArrayList;
import java.util.List;

import org.apache.directory.api.ldap.model.entry.DefaultEntry;
import org.apache.directory.api.ldap.model.entry.Entry;
import org.apache.directory.api.ldap.model.exception.LdapEntryAlreadyExistsException;
import org.apache.directory.api.ldap.model.exception.LdapException;
import org.apache.directory.api.ldap.model.filter.FilterEncoder;
import org.apache.directory.api.ldap.model.message.LdapResult;
import org.apache.directory.api.ldap.model.message.ModifyRequest;
import org.apache.directory.api.ldap.model.message.ModifyRequestImpl;
import org.apache.directory.api.ldap.model.message.ResultCodeEnum;
import org.apache.directory.api.ldap.model.name.Dn;
import org.apache.directory.api.ldap.model.name.Rdn;
import org.identityconnectors.common.logging.Log;
import org.identityconnectors.common.security.GuardedString;
import org.identityconnectors.framework.common.exceptions.ConnectorException;
import org.identityconnectors.framework.common.exceptions.ConnectorIOException;

import com.evolveum.polygon.onboarding.ProvisioningException.Reason;
import com.evolveum.polygon.onboarding.ProvisioningResult.ErrorKind;
import com.evolveum.polygon.onboarding.ad.AdConstants;
import com.evolveum.polygon.onboarding.ad.PasswordGenerator;
import com.evolveum.polygon.onboarding.ad.PasswordSetStrategy;

/**
 * Creates a new enabled user account in the directory.
 * <p>
 * The steps run in strict order over a single session: existence check, create,
 * password, enable, verify. The first failing step ends the call. Nothing is rolled back,
 * an entry that was created stays in the directory even if a later step fails.
 * Calling provision again for the same login stops at the existence check.
 * </p>
 */
public class AccountProvisioner {

    private static final Log LOG = Log.getLog(AccountProvisioner.class);

    public static final String NORMAL_ACCOUNT_USER_ACCOUNT_CONTROL = Integer.toString(AdConstants.UAC.ADS_UF_NORMAL_ACCOUNT.getBit());

    enum State {
        START, CHECKED, CREATED, PASSWORD_SET, ENABLED, VERIFIED, FAILED
    }

    private final OnboardingConfiguration configuration;
    private final ErrorHandler errorHandler;
    private final PasswordGenerator passwordGenerator;
    private final List<PasswordSetStrategy> passwordSetStrategies;

    public AccountProvisioner(OnboardingConfiguration configuration, ErrorHandler errorHandler,
            PasswordGenerator passwordGenerator, List<PasswordSetStrategy> passwordSetStrategies) {
        if (passwordSetStrategies == null || passwordSetStrategies.isEmpty()) {
            throw new IllegalArgumentException("At least one password set strategy is needed");
        }
        this.configuration = configuration;
        this.errorHandler = errorHandler;
        this.passwordGenerator = passwordGenerator;
        this.passwordSetStrategies = new ArrayList<>(passwordSetStrategies);
    }

    public ProvisioningResult provision(DirectorySession session, Dn containerDn, PersonIdentity identity) {
        String loginName = identity.getLoginName();
        State state = State.START;
        LOG.info("Provisioning account {0} in {1}", loginName, containerDn);
        try {

            checkAccountDoesNotExist(session, loginName);
            state = transition(loginName, state, State.CHECKED);

            Dn accountDn = createAccount(session, containerDn, identity);
            state = transition(loginName, state, State.CREATED);

            GuardedString initialPassword = passwordGenerator.generate();
            setPassword(session, accountDn, loginName, initialPassword);
            state = transition(loginName, state, State.PASSWORD_SET);

            enableAccount(session, accountDn);
            state = transition(loginName, state, State.ENABLED);

            verifyAccount(session, accountDn);
            state = transition(loginName, state, State.VERIFIED);

            LOG.info("Account {0} provisioned as {1}", loginName, accountDn);
            return ProvisioningResult.success(loginName, initialPassword);

        } catch (ProvisioningException e) {
            transition(loginName, state, State.FAILED);
            LOG.warn("Provisioning of {0} failed after {1}: {2}", loginName, state, e.getMessage());
            return ProvisioningResult.error(toErrorKind(e.getReason()), e.getMessage());
        } catch (ConnectorException e) {
            transition(loginName, state, State.FAILED);
            LOG.error("Provisioning of {0} failed unexpectedly after {1}: {2}", loginName, state, e.getMessage(), e);
            return ProvisioningResult.error(ErrorKind.UNEXPECTED, e.getMessage());
        }
    }

    private State transition(String loginName, State from, State to) {
        LOG.ok("Account {0}: {1} -> {2}", loginName, from, to);
        return to;
    }

    private void checkAccountDoesNotExist(DirectorySession session, String loginName) {
        Dn existingDn = findAccount(session, loginName);
        if (existingDn != null) {
            throw new ProvisioningException(Reason.ALREADY_EXISTS, "account already exists: " + existingDn);
        }
    }

    private Dn findAccount(DirectorySession session, String loginName) {
        Dn baseDn = LdapUtil.asDn(configuration.getBaseDn());
        String filter = FilterEncoder.format("(" + AdConstants.ATTRIBUTE_SAM_ACCOUNT_NAME_NAME + "={0})", loginName);
        List<Entry> entries;
        try {
            entries = session.search(baseDn, filter, AdConstants.ATTRIBUTE_SAM_ACCOUNT_NAME_NAME);
        } catch (LdapException e) {
            String message = "Error searching for account " + loginName;
            LdapUtil.logOperationError(message, e, null);
            throw new ConnectorIOException(message + ": " + errorHandler.formatDiagnostics(e), e);
        }
        if (entries.isEmpty()) {
            return null;
        }
        return entries.get(0).getDn();
    }

    Dn createAccount(DirectorySession session, Dn containerDn, PersonIdentity identity) {
        String displayName = identity.getDisplayName();
        Dn accountDn = LdapUtil.asDn(AdConstants.ATTRIBUTE_CN_NAME + "=" + Rdn.escapeValue(displayName) + "," + containerDn.getName());

        Entry entry = new DefaultEntry(accountDn);
        try {
            entry.put(AdConstants.ATTRIBUTE_OBJECT_CLASS_NAME, AdConstants.USER_OBJECT_CLASSES);
            entry.put(AdConstants.ATTRIBUTE_CN_NAME, displayName);
            putIfPresent(entry, AdConstants.ATTRIBUTE_GIVEN_NAME_NAME, identity.getGivenName());
            putIfPresent(entry, AdConstants.ATTRIBUTE_SN_NAME, identity.getSurname());
            entry.put(AdConstants.ATTRIBUTE_DISPLAY_NAME_NAME, displayName);
            entry.put(AdConstants.ATTRIBUTE_SAM_ACCOUNT_NAME_NAME, identity.getLoginName());
            entry.put(AdConstants.ATTRIBUTE_USER_PRINCIPAL_NAME_NAME, identity.getUserPrincipalName(configuration.getDomain()));
            putIfPresent(entry, AdConstants.ATTRIBUTE_MAIL_NAME, identity.getEmailAddress());
            putIfPresent(entry, AdConstants.ATTRIBUTE_TELEPHONE_NUMBER_NAME, identity.getTelephoneNumber());
        } catch (LdapException e) {
            throw new ProvisioningException(Reason.CREATE_REJECTED,
                    "create rejected: cannot prepare entry " + accountDn + ": " + e.getMessage(), e);
        }

        if (LOG.isOk()) {
            LOG.ok("Adding entry: {0}", entry);
        }

        LdapResult ldapResult;
        try {
            ldapResult = session.add(entry);
        } catch (LdapEntryAlreadyExistsException e) {
            LdapUtil.logOperationError("Error adding entry " + accountDn, e, null);
            throw processAddConflict(session, accountDn, identity.getLoginName(), errorHandler.formatDiagnostics(e), e);
        } catch (LdapException e) {
            LdapUtil.logOperationError("Error adding entry " + accountDn, e, null);
            throw new ProvisioningException(Reason.CREATE_REJECTED,
                    "create rejected: " + accountDn + ": " + LdapUtil.sanitizeString(e.getMessage()), e);
        }

        if (ldapResult.getResultCode() != ResultCodeEnum.SUCCESS) {
            LdapUtil.logOperationError("Error adding entry " + accountDn, ldapResult, null);
            if (errorHandler.isAlreadyExists(ldapResult)) {
                throw processAddConflict(session, accountDn, identity.getLoginName(),
                        errorHandler.formatDiagnostics(ldapResult), null);
            }
            throw new ProvisioningException(Reason.CREATE_REJECTED,
                    "create rejected: " + accountDn + ": " + errorHandler.formatDiagnostics(ldapResult));
        }
        return accountDn;
    }

    /**
     * The add collided with an existing entry. That is the same account created by a concurrent
     * onboarding after our existence check only if the login can be found now. Otherwise it is
     * a different account with the same name (or another unique value) and the create is rejected.
     */
    private ProvisioningException processAddConflict(DirectorySession session, Dn accountDn, String loginName,
            String diagnostics, Throwable cause) {
        Dn existingDn;
        try {
            existingDn = findAccount(session, loginName);
        } catch (ConnectorIOException e) {
            LOG.warn("Cannot check whether {0} was created concurrently: {1}", loginName, e.getMessage());
            existingDn = null;
        }
        if (existingDn != null) {
            return new ProvisioningException(Reason.ALREADY_EXISTS,
                    "account already exists: " + existingDn + " (" + diagnostics + ")", cause);
        }
        return new ProvisioningException(Reason.CREATE_REJECTED,
                "create rejected: " + accountDn + ": " + diagnostics, cause);
    }

    private void putIfPresent(Entry entry, String attributeName, String value) throws LdapException {
        if (!isBlank(value)) {
            entry.put(attributeName, value);
        }
    }

    private void setPassword(DirectorySession session, Dn accountDn, String loginName, GuardedString password) {
        List<String> failures = new ArrayList<>();
        for (PasswordSetStrategy strategy : passwordSetStrategies) {
            try {
                strategy.setPassword(session, accountDn, loginName, password);
                return;
            } catch (ProvisioningException e) {
                LOG.warn("Setting password of {0} using {1} failed: {2}", accountDn, strategy.getName(), e.getMessage());
                failures.add(strategy.getName() + ": " + e.getMessage());
            }
        }
        throw new ProvisioningException(Reason.PASSWORD_SET_FAILED,
                "password set failed: " + String.join("; ", failures));
    }

    private void enableAccount(DirectorySession session, Dn accountDn) {
        ModifyRequest modifyRequest = new ModifyRequestImpl();
        modifyRequest.setName(accountDn);
        modifyRequest.replace(AdConstants.ATTRIBUTE_USER_ACCOUNT_CONTROL_NAME, NORMAL_ACCOUNT_USER_ACCOUNT_CONTROL);

        LdapResult ldapResult;
        try {
            ldapResult = session.modify(modifyRequest);
        } catch (LdapException e) {
            LdapUtil.logOperationError("Error enabling " + accountDn, e, null);
            throw new ProvisioningException(Reason.ENABLE_FAILED,
                    "enable failed: " + accountDn + ": " + LdapUtil.sanitizeString(e.getMessage()), e);
        }
        if (ldapResult.getResultCode() != ResultCodeEnum.SUCCESS) {
            LdapUtil.logOperationError("Error enabling " + accountDn, ldapResult, null);
            throw new ProvisioningException(Reason.ENABLE_FAILED,
                    "enable failed: " + accountDn + ": " + errorHandler.formatDiagnostics(ldapResult));
        }
    }

    private void verifyAccount(DirectorySession session, Dn accountDn) {
        Entry entry;
        try {
            entry = session.lookup(accountDn, AdConstants.ATTRIBUTE_USER_ACCOUNT_CONTROL_NAME);
        } catch (LdapException e) {
            throw new ProvisioningException(Reason.VERIFY_MISMATCH,
                    "verify mismatch: cannot read " + accountDn + ": " + LdapUtil.sanitizeString(e.getMessage()), e);
        }
        if (entry == null) {
            throw new ProvisioningException(Reason.VERIFY_MISMATCH, "verify mismatch: entry " + accountDn + " not found");
        }
        Integer userAccountControl = LdapUtil.getIntegerAttribute(entry, AdConstants.ATTRIBUTE_USER_ACCOUNT_CONTROL_NAME, null);
        if (userAccountControl == null) {
            throw new ProvisioningException(Reason.VERIFY_MISMATCH,
                    "verify mismatch: no " + AdConstants.ATTRIBUTE_USER_ACCOUNT_CONTROL_NAME + " in " + accountDn);
        }
        if (AdConstants.UAC.ADS_UF_ACCOUNTDISABLE.isSet(userAccountControl)) {
            throw new ProvisioningException(Reason.VERIFY_MISMATCH,
                    "verify mismatch: account " + accountDn + " is still disabled ("
                    + AdConstants.ATTRIBUTE_USER_ACCOUNT_CONTROL_NAME + "=" + userAccountControl + ")");
        }
    }

    static ErrorKind toErrorKind(Reason reason) {
        switch (reason) {
            case ALREADY_EXISTS:
                return ErrorKind.ALREADY_EXISTS;
            case CREATE_REJECTED:
                return ErrorKind.CREATE_REJECTED;
            case PASSWORD_SET_FAILED:
                return ErrorKind.PASSWORD_SET_FAILED;
            case ENABLE_FAILED:
                return ErrorKind.ENABLE_FAILED;
            case VERIFY_MISMATCH:
                return ErrorKind.VERIFY_MISMATCH;
            default:
                return ErrorKind.UNEXPECTED;
        }
    }
}
