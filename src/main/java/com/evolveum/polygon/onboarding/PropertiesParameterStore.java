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

import java.io.IOException;
import java.io.InputStream;
import java.util.Properties;

import org.identityconnectors.framework.common.exceptions.ConfigurationException;

/**
 * Parameters stored in a Java properties file.
 */
public class PropertiesParameterStore implements ParameterStore {

    private final Properties properties;

    public PropertiesParameterStore(Properties properties) {
        this.properties = properties;
    }

    /**
     * Loads parameters from a classpath resource.
     */
    public static PropertiesParameterStore fromResource(String resourceName) {
        Properties properties = new Properties();
        try (InputStream inputStream = PropertiesParameterStore.class.getClassLoader().getResourceAsStream(resourceName)) {
            if (inputStream == null) {
                throw new ConfigurationException("Configuration resource " + resourceName + " not found");
            }
            properties.load(inputStream);
        } catch (IOException e) {
            throw new ConfigurationException("Cannot read configuration resource " + resourceName + ": " + e.getMessage(), e);
        }
        return new PropertiesParameterStore(properties);
    }

    @Override
    public String getParameter(String name) {
        return properties.getProperty(name);
    }
}
