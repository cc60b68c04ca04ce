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
 * Executes administrative PowerShell commands on a domain controller.
 */
public interface AdministrativeCommandRunner {

	/**
	 * Runs the script and returns its standard output.
	 *
	 * @param script PowerShell script, may contain secrets
	 * @param description safe description of the script, used for logging instead of the script itself
	 */
	String runPowerShell(String script, String description) throws AdministrativeCommandException;

}
