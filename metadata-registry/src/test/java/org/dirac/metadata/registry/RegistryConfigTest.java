// Licensed to the Apache Software Foundation (ASF) under one
// or more contributor license agreements.  See the NOTICE file
// distributed with this work for additional information
// regarding copyright ownership.  The ASF licenses this file
// to you under the Apache License, Version 2.0 (the
// "License"); you may not use this file except in compliance
// with the License.  You may obtain a copy of the License at
//
//   http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing,
// software distributed under the License is distributed on an
// "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
// KIND, either express or implied.  See the License for the
// specific language governing permissions and limitations
// under the License.

package org.dirac.metadata.registry;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.net.URL;
import java.net.URLClassLoader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Properties;

/**
 * Unit tests for {@link RegistryConfig}.
 */
@DisplayName("RegistryConfig Unit Tests")
public class RegistryConfigTest {

    @Test
    @DisplayName("UT-CFG-001: Defaults discover the core plugin package")
    void testDefaults() {
        RegistryConfig config = RegistryConfig.defaults();

        Assertions.assertTrue(config.isDiscoveryEnabled());
        Assertions.assertEquals(Collections.singletonList("org.dirac.metadata.plugin.core"),
                config.getDiscoveryPackages());
        Assertions.assertTrue(config.getPluginRoots().isEmpty());
    }

    @Test
    @DisplayName("UT-CFG-002: Lists are split on commas, trimmed and empty items dropped")
    void testFromProperties() {
        // Given
        Map<String, String> properties = new HashMap<>();
        properties.put(RegistryConfig.DISCOVERY_ENABLED_KEY, "false");
        properties.put(RegistryConfig.DISCOVERY_PACKAGES_KEY, " org.lhcb.metadata , ,org.dirac.metadata.plugin.core");
        properties.put(RegistryConfig.PLUGIN_ROOTS_KEY, "/opt/dirac/plugins,");

        // When
        RegistryConfig config = RegistryConfig.fromProperties(properties);

        // Then
        Assertions.assertFalse(config.isDiscoveryEnabled());
        Assertions.assertEquals(Arrays.asList("org.lhcb.metadata", "org.dirac.metadata.plugin.core"),
                config.getDiscoveryPackages());
        Assertions.assertEquals(Collections.singletonList(Paths.get("/opt/dirac/plugins")), config.getPluginRoots());
    }

    @Test
    @DisplayName("UT-CFG-003: Blank package list falls back to the default")
    void testBlankPackages() {
        RegistryConfig config = RegistryConfig.fromProperties(
                Collections.singletonMap(RegistryConfig.DISCOVERY_PACKAGES_KEY, "  "));

        Assertions.assertEquals(Collections.singletonList(RegistryConfig.DEFAULT_DISCOVERY_PACKAGES),
                config.getDiscoveryPackages());
    }

    @Test
    @DisplayName("UT-CFG-004: Invalid boolean is rejected with the key in the message")
    void testInvalidBoolean() {
        IllegalArgumentException exception = Assertions.assertThrows(IllegalArgumentException.class,
                () -> RegistryConfig.fromProperties(
                        Collections.singletonMap(RegistryConfig.DISCOVERY_ENABLED_KEY, "maybe")));

        Assertions.assertTrue(exception.getMessage().contains(RegistryConfig.DISCOVERY_ENABLED_KEY));
    }

    @Test
    @DisplayName("UT-CFG-005: Classpath resource is read and overridden by system properties")
    void testLoadResourceWithOverrides() throws Exception {
        // Given
        Path dir = Files.createTempDirectory("registry-config");
        Files.write(dir.resolve(RegistryConfig.RESOURCE_NAME), String.join("\n",
                RegistryConfig.DISCOVERY_PACKAGES_KEY + "=org.lhcb.metadata",
                RegistryConfig.DISCOVERY_ENABLED_KEY + "=false").getBytes(StandardCharsets.ISO_8859_1));
        Properties overrides = new Properties();
        overrides.setProperty(RegistryConfig.DISCOVERY_ENABLED_KEY, "true");
        overrides.setProperty("unrelated.key", "ignored");

        // When
        RegistryConfig config;
        try (URLClassLoader loader = new URLClassLoader(new URL[] {dir.toUri().toURL()}, null)) {
            config = RegistryConfig.load(loader, overrides);
        }

        // Then
        Assertions.assertTrue(config.isDiscoveryEnabled());
        Assertions.assertEquals(Collections.singletonList("org.lhcb.metadata"), config.getDiscoveryPackages());
    }

    @Test
    @DisplayName("UT-CFG-006: Missing resource yields the defaults")
    void testLoadWithoutResource() throws Exception {
        RegistryConfig config;
        try (URLClassLoader loader = new URLClassLoader(new URL[0], null)) {
            config = RegistryConfig.load(loader, new Properties());
        }

        Assertions.assertEquals(RegistryConfig.defaults().getDiscoveryPackages(), config.getDiscoveryPackages());
        Assertions.assertTrue(config.isDiscoveryEnabled());
    }
}
