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

import org.dirac.extension.loader.PluginLoader;
import org.dirac.metadata.DuplicateRegistrationException;
import org.dirac.metadata.MetadataModelDescriptor;
import org.dirac.metadata.ModelValidationException;
import org.dirac.metadata.PluginKey;
import org.dirac.metadata.UnknownPluginException;
import org.dirac.metadata.spi.MetadataModel;
import org.dirac.metadata.spi.ModelIdentity;

import org.apache.commons.lang3.StringUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Registry of metadata model plugins.
 *
 * <p>Responsibilities:
 * <ul>
 *   <li>Hold model classes keyed by (virtual organization, plugin name)</li>
 *   <li>Discover models from classpath packages and plugin roots</li>
 *   <li>Instantiate models from {@link MetadataModelDescriptor}s with validated parameters</li>
 * </ul>
 *
 * <p>Lookup is exact: a plugin registered for a virtual organization is not visible in the global
 * scope, and a global plugin is not visible when a vo is given.
 *
 * <p>Reads never block. Registration and discovery are serialized so that a collision check and
 * the following insert are atomic. Plugins cannot be unregistered.
 */
public class MetadataPluginRegistry {
    private static final Logger LOG = LogManager.getLogger(MetadataPluginRegistry.class);

    /** Model classes by (vo, name) */
    private final Map<PluginKey, Class<? extends MetadataModel>> plugins = new ConcurrentHashMap<>();

    /** Virtual organizations with at least one registered plugin */
    private final Set<String> virtualOrganizations = ConcurrentHashMap.newKeySet();

    private final Object lifecycleLock = new Object();
    private final ModelBinder binder;
    private final PluginDiscovery discovery;

    public MetadataPluginRegistry() {
        this(new ModelBinder(), new PluginDiscovery());
    }

    public MetadataPluginRegistry(ModelBinder binder, PluginDiscovery discovery) {
        this.binder = Objects.requireNonNull(binder, "binder");
        this.discovery = Objects.requireNonNull(discovery, "discovery");
    }

    /**
     * Registers a model class without override.
     *
     * @param pluginClass model class
     * @throws DuplicateRegistrationException if a class is already registered under the same key
     * @see #registerPlugin(Class, boolean)
     */
    public void registerPlugin(Class<? extends MetadataModel> pluginClass) throws DuplicateRegistrationException {
        registerPlugin(pluginClass, false);
    }

    /**
     * Registers a model class under its (vo, name) key.
     *
     * @param pluginClass model class
     * @param override replace an existing registration instead of failing
     * @throws DuplicateRegistrationException if the key is taken and {@code override} is false
     * @throws IllegalArgumentException if the class cannot be instantiated as a model
     */
    public void registerPlugin(Class<? extends MetadataModel> pluginClass, boolean override)
            throws DuplicateRegistrationException {
        checkInstantiable(pluginClass);
        PluginKey key = ModelIdentity.of(pluginClass).toKey();
        synchronized (lifecycleLock) {
            Class<? extends MetadataModel> existing = plugins.get(key);
            if (existing != null && !override) {
                throw new DuplicateRegistrationException(key, existing, pluginClass);
            }
            plugins.put(key, pluginClass);
            key.getVo().ifPresent(virtualOrganizations::add);
            if (existing != null) {
                LOG.info("Replaced metadata plugin: key={}, previous={}, class={}",
                        key, existing.getName(), pluginClass.getName());
            } else {
                LOG.info("Registered metadata plugin: key={}, class={}", key, pluginClass.getName());
            }
        }
    }

    /**
     * Looks up a global plugin.
     *
     * @param name plugin name
     * @return the model class, or empty if not found
     */
    public Optional<Class<? extends MetadataModel>> getPlugin(String name) {
        return getPlugin(name, null);
    }

    /**
     * Looks up a plugin in one scope.
     *
     * @param name plugin name
     * @param vo virtual organization, null or blank for the global scope
     * @return the model class, or empty if not found
     */
    public Optional<Class<? extends MetadataModel>> getPlugin(String name, String vo) {
        if (StringUtils.isBlank(name)) {
            return Optional.empty();
        }
        return Optional.ofNullable(plugins.get(PluginKey.of(vo, name)));
    }

    /**
     * Lists plugin names across all scopes.
     *
     * @return sorted, distinct plugin names
     */
    public List<String> listPlugins() {
        return listPlugins(null);
    }

    /**
     * Lists plugin names of one virtual organization.
     *
     * @param vo virtual organization, null or blank for all scopes
     * @return sorted, distinct plugin names
     */
    public List<String> listPlugins(String vo) {
        String scope = StringUtils.trimToNull(vo);
        SortedSet<String> names = new TreeSet<>();
        for (PluginKey key : plugins.keySet()) {
            if (scope == null || scope.equals(key.getVo().orElse(null))) {
                names.add(key.getName());
            }
        }
        return new ArrayList<>(names);
    }

    public SortedSet<String> listVirtualOrganizations() {
        return Collections.unmodifiableSortedSet(new TreeSet<>(virtualOrganizations));
    }

    /**
     * Creates a model from a descriptor.
     *
     * @param descriptor names the plugin, its scope and the parameters
     * @return new model instance
     * @throws UnknownPluginException if no plugin is registered under the descriptor's key
     * @throws ModelValidationException if the parameters do not fit the model's fields
     */
    public MetadataModel instantiatePlugin(MetadataModelDescriptor descriptor)
            throws UnknownPluginException, ModelValidationException {
        Objects.requireNonNull(descriptor, "descriptor");
        String vo = descriptor.getVo().orElse(null);
        Optional<Class<? extends MetadataModel>> pluginClass = getPlugin(descriptor.getMetadataClass(), vo);
        if (!pluginClass.isPresent()) {
            throw new UnknownPluginException(descriptor.getMetadataClass(), vo);
        }
        MetadataModel model = binder.bind(pluginClass.get(), descriptor.getParameters());
        LOG.debug("Instantiated metadata plugin {} with parameters {}", model.name(),
                descriptor.getParameters().keySet());
        return model;
    }

    /**
     * Describes the fields of a registered plugin.
     *
     * @param name plugin name
     * @param vo virtual organization, null for the global scope
     * @return schema, or empty if not found
     * @throws ModelValidationException if the plugin's default instance cannot be created
     */
    public Optional<ModelSchema> describePlugin(String name, String vo) throws ModelValidationException {
        Optional<Class<? extends MetadataModel>> pluginClass = getPlugin(name, vo);
        if (!pluginClass.isPresent()) {
            return Optional.empty();
        }
        return Optional.of(binder.describe(pluginClass.get()));
    }

    /**
     * Discovers and registers the models under the given packages.
     *
     * <p>Packages that cannot be scanned are logged and skipped.
     *
     * @param packageNames package names
     * @return number of newly registered plugins
     */
    public int discoverPlugins(List<String> packageNames) {
        return discoverPlugins(packageNames, defaultClassLoader());
    }

    public int discoverPlugins(List<String> packageNames, ClassLoader classLoader) {
        synchronized (lifecycleLock) {
            return discovery.discoverPackages(this, packageNames, classLoader).getRegisteredCount();
        }
    }

    /**
     * Discovers and registers the models of the plugin directories under the given roots.
     *
     * <p>Layout: {@code root/<pluginDir>/*.jar} plus optional {@code root/<pluginDir>/lib/*.jar}.
     * Directories that cannot be loaded are logged and skipped.
     *
     * @param pluginRoots plugin root directories
     * @return number of newly registered plugins
     */
    public int discoverPluginRoots(List<Path> pluginRoots) {
        synchronized (lifecycleLock) {
            return discovery.discoverPluginRoots(this, pluginRoots, defaultClassLoader()).getRegisteredCount();
        }
    }

    public int size() {
        return plugins.size();
    }

    private static ClassLoader defaultClassLoader() {
        ClassLoader contextClassLoader = Thread.currentThread().getContextClassLoader();
        return contextClassLoader != null ? contextClassLoader : MetadataPluginRegistry.class.getClassLoader();
    }

    private static void checkInstantiable(Class<? extends MetadataModel> pluginClass) {
        Objects.requireNonNull(pluginClass, "pluginClass");
        if (!PluginLoader.isCandidate(pluginClass, MetadataModel.class)) {
            throw new IllegalArgumentException(pluginClass.getName()
                    + " is not a concrete top-level or static nested MetadataModel class");
        }
        try {
            pluginClass.getDeclaredConstructor();
        } catch (NoSuchMethodException e) {
            throw new IllegalArgumentException(pluginClass.getName() + " has no no-argument constructor", e);
        } catch (LinkageError e) {
            throw new IllegalArgumentException(pluginClass.getName() + " cannot be linked: " + e, e);
        }
    }
}
