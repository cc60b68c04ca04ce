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

import org.identityconnectors.common.logging.Log;
import org.identityconnectors.common.security.GuardedString;

import io.cloudsoft.winrm4j.winrm.WinRmTool;
import io.cloudsoft.winrm4j.winrm.WinRmToolResponse;

/**
 * Runs PowerShell commands remotely using WinRM (WS-MAN).
 * <p>
 * Each command is executed in a new PowerShell process. Administrative password reset
 * is a single command per provisioning, there is no point in keeping the shell running.
 * </p>
 */
public class WinRmCommandRunner implements AdministrativeCommandRunner {

	private static final Log LOG = Log.getLog(WinRmCommandRunner.class);

	public static final int DEFAULT_HTTP_PORT = 5985;
	public static final int DEFAULT_HTTPS_PORT = 5986;

	private final String host;
	private final int port;
	private final boolean useHttps;
	private final String authenticationScheme;
	private final String domainName;
	private final String userName;
	private final GuardedString password;
	private final boolean disableCertificateChecks;

	public WinRmCommandRunner(String endpoint, boolean useHttps, String authenticationScheme,
			String domainName, String userName, GuardedString password, boolean disableCertificateChecks) {
		int indexColon = endpoint.lastIndexOf(':');
		if (indexColon > 0) {
			this.host = endpoint.substring(0, indexColon);
			this.port = Integer.parseInt(endpoint.substring(indexColon + 1));
		} else {
			this.host = endpoint;
			this.port = useHttps ? DEFAULT_HTTPS_PORT : DEFAULT_HTTP_PORT;
		}
		this.useHttps = useHttps;
		this.authenticationScheme = authenticationScheme;
		this.domainName = domainName;
		this.userName = userName;
		this.password = password;
		this.disableCertificateChecks = disableCertificateChecks;
	}

	public String getHost() {
		return host;
	}

	public int getPort() {
		return port;
	}

	@Override
	public String runPowerShell(String script, String description) throws AdministrativeCommandException {
		StringBuilder clearPassword = new StringBuilder();
		password.access(chars -> clearPassword.append(chars));

		WinRmTool.Builder builder = WinRmTool.Builder.builder(host, domainName, userName, clearPassword.toString());
		builder.authenticationScheme(authenticationScheme);
		builder.useHttps(useHttps);
		builder.port(port);
		builder.disableCertificateChecks(disableCertificateChecks);
		clearPassword.setLength(0);

		LOG.ok("Executing PowerShell command on {0}:{1}: {2}", host, port, description);
		long tsStart = System.currentTimeMillis();

		WinRmToolResponse response;
		try {
			WinRmTool tool = builder.build();
			response = tool.executePs(script);
		} catch (RuntimeException e) {
			// WinRM faults do not have useful information on their own, the cause usually has
			Throwable cause = e.getCause() != null ? e.getCause() : e;
			throw new AdministrativeCommandException("WinRM execution of " + description + " on " + host + " failed: "
					+ cause.getMessage(), e);
		}

		LOG.ok("Command {0} run time: {1} ms, exit code {2}", description, System.currentTimeMillis() - tsStart,
				response.getStatusCode());
		logData("O<", response.getStdOut());
		logData("E<", response.getStdErr());

		if (response.getStatusCode() != 0) {
			AdministrativeCommandException e = new AdministrativeCommandException(
					"Command " + description + " failed with exit code " + response.getStatusCode(), response.getStatusCode());
			e.setStdout(response.getStdOut());
			e.setStderr(response.getStdErr());
			throw e;
		}
		return response.getStdOut();
	}

	private void logData(String prefix, String data) {
		if (LOG.isOk()) {
			if (data != null && !data.isEmpty()) {
				LOG.ok("{0} {1}", prefix, data);
			}
		}
	}

	@Override
	public String toString() {
		return "WinRmCommandRunner(" + (useHttps ? "https" : "http") + "://" + host + ":" + port + ", " + authenticationScheme + ")";
	}
}
