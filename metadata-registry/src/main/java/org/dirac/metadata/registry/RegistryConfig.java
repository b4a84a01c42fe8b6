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

import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;
import org.apache.commons.lang3.BooleanUtils;
import org.apache.commons.lang3.StringUtils;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Properties;

/**
 * Discovery settings of the process-wide registry.
 *
 * <p>Keys:
 * <ul>
 *   <li>{@value #DISCOVERY_ENABLED_KEY}: run discovery at bootstrap, default true</li>
 *   <li>{@value #DISCOVERY_PACKAGES_KEY}: comma separated packages, default
 *       {@value #DEFAULT_DISCOVERY_PACKAGES}</li>
 *   <li>{@value #PLUGIN_ROOTS_KEY}: comma separated plugin root directories, default none</li>
 * </ul>
 */
public final class RegistryConfig {
    public static final String RESOURCE_NAME = "metadata-registry.properties";

    public static final String DISCOVERY_ENABLED_KEY = "metadata.discovery.enabled";
    public static final String DISCOVERY_PACKAGES_KEY = "metadata.discovery.packages";
    public static final String PLUGIN_ROOTS_KEY = "metadata.discovery.plugin_roots";

    public static final String DEFAULT_DISCOVERY_PACKAGES = "org.dirac.metadata.plugin.core";

    private static final Splitter LIST_SPLITTER = Splitter.on(',').trimResults().omitEmptyStrings();

    private final boolean discoveryEnabled;
    private final List<String> discoveryPackages;
    private final List<Path> pluginRoots;

    private RegistryConfig(boolean discoveryEnabled, List<String> discoveryPackages, List<Path> pluginRoots) {
        this.discoveryEnabled = discoveryEnabled;
        this.discoveryPackages = discoveryPackages;
        this.pluginRoots = pluginRoots;
    }

    public static RegistryConfig defaults() {
        return fromProperties(new HashMap<>());
    }

    /**
     * Builds the config from key/value properties. Missing keys take their defaults.
     *
     * @param properties properties
     * @return config
     * @throws IllegalArgumentException if {@value #DISCOVERY_ENABLED_KEY} is not a boolean
     */
    public static RegistryConfig fromProperties(Map<String, String> properties) {
        Objects.requireNonNull(properties, "properties");
        boolean enabled = getBooleanProperty(properties, DISCOVERY_ENABLED_KEY, true);
        String packages = properties.get(DISCOVERY_PACKAGES_KEY);
        if (StringUtils.isBlank(packages)) {
            packages = DEFAULT_DISCOVERY_PACKAGES;
        }
        ImmutableList.Builder<Path> roots = ImmutableList.builder();
        for (String root : LIST_SPLITTER.split(StringUtils.defaultString(properties.get(PLUGIN_ROOTS_KEY)))) {
            roots.add(Paths.get(root));
        }
        return new RegistryConfig(enabled, ImmutableList.copyOf(LIST_SPLITTER.split(packages)), roots.build());
    }

    /**
     * Loads the config from the classpath resource {@value #RESOURCE_NAME}, if present, overlaid by JVM
     * system properties with the same keys.
     *
     * @return config
     */
    public static RegistryConfig load() {
        return load(RegistryConfig.class.getClassLoader(), System.getProperties());
    }

    static RegistryConfig load(ClassLoader classLoader, Properties overrides) {
        Map<String, String> properties = new HashMap<>();
        try (InputStream in = classLoader.getResourceAsStream(RESOURCE_NAME)) {
            if (in != null) {
                Properties resource = new Properties();
                resource.load(in);
                copy(resource, properties);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + RESOURCE_NAME, e);
        }
        copy(overrides, properties);
        return fromProperties(properties);
    }

    private static void copy(Properties source, Map<String, String> target) {
        for (String key : new String[] {DISCOVERY_ENABLED_KEY, DISCOVERY_PACKAGES_KEY, PLUGIN_ROOTS_KEY}) {
            String value = source.getProperty(key);
            if (value != null) {
                target.put(key, value);
            }
        }
    }

    private static boolean getBooleanProperty(Map<String, String> properties, String key, boolean defaultValue) {
        String value = properties.get(key);
        if (value == null) {
            return defaultValue;
        }
        Boolean parsed = BooleanUtils.toBooleanObject(value.trim());
        if (parsed == null) {
            throw new IllegalArgumentException("The parameter " + key + " is wrong, value is " + value);
        }
        return parsed;
    }

    public boolean isDiscoveryEnabled() {
        return discoveryEnabled;
    }

    public List<String> getDiscoveryPackages() {
        return discoveryPackages;
    }

    public List<Path> getPluginRoots() {
        return pluginRoots;
    }

    @Override
    public String toString() {
        return "RegistryConfig{discoveryEnabled=" + discoveryEnabled
                + ", discoveryPackages=" + discoveryPackages
                + ", pluginRoots=" + pluginRoots + '}';
    }
}
