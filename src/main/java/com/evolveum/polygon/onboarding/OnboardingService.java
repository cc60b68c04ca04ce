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
import java.util.Locale;

import org.apache.commons.lang3.StringUtils;
import org.apache.directory.api.ldap.model.name.Dn;
import org.identityconnectors.common.logging.Log;
import org.identityconnectors.framework.common.exceptions.ConfigurationException;
import org.identityconnectors.framework.common.exceptions.ConnectionFailedException;
import org.identityconnectors.framework.common.exceptions.InvalidAttributeValueException;

import com.evolveum.polygon.onboarding.ProvisioningResult.ErrorKind;
import com.evolveum.polygon.onboarding.ad.AdErrorHandler;
import com.evolveum.polygon.onboarding.ad.AdministrativeResetPasswordStrategy;
import com.evolveum.polygon.onboarding.ad.PasswordGenerator;
import com.evolveum.polygon.onboarding.ad.PasswordSetStrategy;
import com.evolveum.polygon.onboarding.ad.UnicodePwdPasswordStrategy;
import com.evolveum.polygon.onboarding.ad.WinRmCommandRunner;
import com.evolveum.polygon.onboarding.event.EmployeeRecord;
import com.evolveum.polygon.onboarding.event.OnboardingAccountRequested;
import com.evolveum.polygon.onboarding.event.OnboardingListener;
import com.evolveum.polygon.onboarding.event.OnboardingStatus;

/**
 * Entry point for the host: turns an onboarding request into a directory account.
 * <p>
 * Configuration is read again for every request. Every failure ends up as an error
 * {@link ProvisioningResult}, this method does not throw.
 * </p>
 */
public class OnboardingService {

    private static final Log LOG = Log.getLog(OnboardingService.class);

    public static final String DEFAULT_GIVEN_NAME = "User";
    public static final String DEFAULT_SURNAME = "Unknown";

    private final ParameterStore parameterStore;
    private final OnboardingListener listener;
    private final ConfigResolver configResolver = new ConfigResolver();
    private final ContainerResolver containerResolver = new ContainerResolver();
    private final ErrorHandler errorHandler;
    private final DirectoryConnector directoryConnector;
    private final PasswordGenerator passwordGenerator;

    public OnboardingService(ParameterStore parameterStore, OnboardingListener listener) {
        this(parameterStore, listener, new AdErrorHandler(), new PasswordGenerator());
    }

    public OnboardingService(ParameterStore parameterStore, OnboardingListener listener,
            ErrorHandler errorHandler, PasswordGenerator passwordGenerator) {
        this(parameterStore, listener, errorHandler, new DirectoryConnector(errorHandler, new ConnectionLog()), passwordGenerator);
    }

    public OnboardingService(ParameterStore parameterStore, OnboardingListener listener, ErrorHandler errorHandler,
            DirectoryConnector directoryConnector, PasswordGenerator passwordGenerator) {
        this.parameterStore = parameterStore;
        this.listener = listener;
        this.errorHandler = errorHandler;
        this.directoryConnector = directoryConnector;
        this.passwordGenerator = passwordGenerator;
    }

    public ProvisioningResult handle(OnboardingAccountRequested event) {
        EmployeeRecord employee = event == null ? null : event.getEmployee();
        LOG.info("Onboarding account requested for {0}", employee);
        notifyStatus(employee, OnboardingStatus.PENDING);

        ProvisioningResult result = provision(employee);

        if (result.isSuccess()) {
            LOG.info("Onboarding of {0} finished, account {1}", employee, result.getUsername());
        } else {
            LOG.warn("Onboarding of {0} failed ({1}): {2}", employee, result.getErrorKind(), result.getErrorMessage());
        }
        notifyListener(employee, result);
        return result;
    }

    private ProvisioningResult provision(EmployeeRecord employee) {
        PersonIdentity identity;
        try {
            identity = deriveIdentity(employee);
        } catch (InvalidAttributeValueException e) {
            return ProvisioningResult.error(ErrorKind.INVALID_REQUEST, "invalid onboarding request: " + e.getMessage());
        }

        OnboardingConfiguration configuration;
        Dn containerDn;
        try {
            configuration = configResolver.resolve(parameterStore);
            containerDn = containerResolver.resolveContainerDn(configuration);
        } catch (ConfigurationException | InvalidAttributeValueException e) {
            return ProvisioningResult.error(ErrorKind.CONFIGURATION, "configuration error: " + e.getMessage());
        } catch (RuntimeException e) {
            return unexpectedError(identity, e);
        }
        LOG.ok("Using {0}, container {1}", configuration, containerDn);

        DirectorySession session;
        try {
            session = directoryConnector.connect(configuration);
        } catch (DirectoryConnectionException e) {
            return ProvisioningResult.error(ErrorKind.CONNECTION,
                    "connection failed (" + e.getReason() + "): " + e.getMessage());
        } catch (ConnectionFailedException e) {
            return ProvisioningResult.error(ErrorKind.CONNECTION, "connection failed: " + e.getMessage());
        } catch (ConfigurationException e) {
            return ProvisioningResult.error(ErrorKind.CONFIGURATION, "configuration error: " + e.getMessage());
        } catch (RuntimeException e) {
            return unexpectedError(identity, e);
        }

        try {
            AccountProvisioner provisioner = new AccountProvisioner(configuration, errorHandler, passwordGenerator,
                    createPasswordSetStrategies(configuration));
            return provisioner.provision(session, containerDn, identity);
        } catch (RuntimeException e) {
            return unexpectedError(identity, e);
        } finally {
            session.close();
        }
    }

    private ProvisioningResult unexpectedError(PersonIdentity identity, RuntimeException e) {
        LOG.error("Unexpected error while provisioning {0}: {1}", identity.getLoginName(), e.getMessage(), e);
        return ProvisioningResult.error(ErrorKind.UNEXPECTED, "unexpected error: " + e.getMessage());
    }

    /**
     * Password strategies in the order of preference. The administrative reset is used
     * only when its endpoint is configured.
     */
    protected List<PasswordSetStrategy> createPasswordSetStrategies(OnboardingConfiguration configuration) {
        List<PasswordSetStrategy> strategies = new ArrayList<>();
        strategies.add(new UnicodePwdPasswordStrategy(errorHandler));
        if (configuration.isPasswordResetEnabled()) {
            strategies.add(new AdministrativeResetPasswordStrategy(createCommandRunner(configuration)));
        }
        return strategies;
    }

    private WinRmCommandRunner createCommandRunner(OnboardingConfiguration configuration) {
        String adminUser = configuration.getAdminUser();
        String domainName = configuration.getDomain();
        String userName = adminUser;
        if (adminUser.indexOf('@') > 0) {
            userName = StringUtils.substringBefore(adminUser, "@");
            domainName = StringUtils.substringAfter(adminUser, "@");
        } else if (adminUser.indexOf('\\') > 0) {
            domainName = StringUtils.substringBefore(adminUser, "\\");
            userName = StringUtils.substringAfter(adminUser, "\\");
        }
        return new WinRmCommandRunner(configuration.getPasswordResetEndpoint(), configuration.isPasswordResetUseHttps(),
                configuration.getPasswordResetAuthenticationScheme(), domainName, userName,
                configuration.getAdminPassword(), !configuration.isValidateCertificate());
    }

    /**
     * Name is split at the first whitespace into given name and surname, a single name is used for both.
     * Login name is the local part of the work e-mail, lowercased, without dots.
     */
    public static PersonIdentity deriveIdentity(EmployeeRecord employee) {
        if (employee == null) {
            throw new InvalidAttributeValueException("No employee in the request");
        }
        String workEmail = employee.getWorkEmail();
        if (isBlank(workEmail)) {
            throw new InvalidAttributeValueException("Employee " + employee.getId() + " has no work e-mail");
        }
        if (isBlank(employee.getName())) {
            throw new InvalidAttributeValueException("Employee " + employee.getId() + " has no name");
        }
        workEmail = workEmail.trim();

        String givenName;
        String surname;
        String name = employee.getName().trim();
        String[] parts = name.split("\\s+", 2);
        if (parts.length == 2) {
            givenName = parts[0];
            surname = parts[1];
        } else {
            givenName = name;
            surname = name;
        }
        if (givenName.isEmpty()) {
            givenName = DEFAULT_GIVEN_NAME;
        }
        if (surname.isEmpty()) {
            surname = DEFAULT_SURNAME;
        }

        String localPart = StringUtils.substringBefore(workEmail, "@");
        String loginName = StringUtils.remove(localPart.toLowerCase(Locale.ROOT), '.');
        if (loginName.isEmpty()) {
            throw new InvalidAttributeValueException("Cannot derive login name from e-mail " + workEmail);
        }
        return new PersonIdentity(givenName, surname, loginName, workEmail, employee.getWorkPhone());
    }

    private void notifyStatus(EmployeeRecord employee, OnboardingStatus status) {
        if (listener == null) {
            return;
        }
        try {
            listener.statusChanged(employee, status);
        } catch (RuntimeException e) {
            LOG.warn("Onboarding listener failed to record status {0} of {1}: {2}", status, employee, e.getMessage());
        }
    }

    private void notifyListener(EmployeeRecord employee, ProvisioningResult result) {
        if (listener == null) {
            return;
        }
        try {
            if (result.isSuccess()) {
                listener.accountCreated(employee, result.getUsername(), result.getInitialPassword());
            } else {
                listener.accountFailed(employee, result.getErrorMessage());
            }
        } catch (RuntimeException e) {
            LOG.warn("Onboarding listener failed for {0}: {1}", employee, e.getMessage());
        }
        notifyStatus(employee, result.isSuccess() ? OnboardingStatus.SUCCESS : OnboardingStatus.ERROR);
    }
}
