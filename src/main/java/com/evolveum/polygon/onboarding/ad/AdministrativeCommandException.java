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
 * Administrative command could not be run or finished with a non-zero exit code.
 */
public class AdministrativeCommandException extends Exception {

	private static final long serialVersionUID = 1L;

	private Integer exitCode;
	private String stdout;
	private String stderr;

	public AdministrativeCommandException(String message, Throwable cause) {
		super(message, cause);
	}

	public AdministrativeCommandException(String message) {
		super(message);
	}

	public AdministrativeCommandException(String message, Integer exitCode) {
		super(message);
		this.exitCode = exitCode;
	}

	public Integer getExitCode() {
		return exitCode;
	}

	public String getStdout() {
		return stdout;
	}

	public void setStdout(String stdout) {
		this.stdout = stdout;
	}

	public String getStderr() {
		return stderr;
	}

	public void setStderr(String stderr) {
		this.stderr = stderr;
	}

}
