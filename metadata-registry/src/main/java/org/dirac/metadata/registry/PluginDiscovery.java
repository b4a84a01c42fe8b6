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

import org.dirac.extension.loader.ClassLoadingPolicy;
import org.dirac.extension.loader.ClasspathPackageScanner;
import org.dirac.extension.loader.DirectoryPluginRuntimeManager;
import org.dirac.extension.loader.LoadFailure;
import org.dirac.extension.loader.LoadReport;
import org.dirac.extension.loader.PluginHandle;
import org.dirac.metadata.DuplicateRegistrationException;
import org.dirac.metadata.spi.MetadataModel;
import org.dirac.metadata.spi.ModelIdentity;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Finds metadata models and registers them.
 *
 * <p>Two sources are supported:
 * <ul>
 *   <li>Java packages on the classpath, scanned recursively in directories and jars.</li>
 *   <li>Plugin roots whose subdirectories follow {@code pluginDir/*.jar + pluginDir/lib/*.jar}, each
 *       loaded with its own child-first classloader.</li>
 * </ul>
 *
 * <p>Every concrete {@link MetadataModel} found is registered without override. Nothing found along
 * the way is thrown: unreadable locations, classes that fail to load and name collisions become
 * {@link LoadFailure}s of the returned {@link DiscoveryResult} and are logged.
 */
public class PluginDiscovery {
    private static final Logger LOG = LogManager.getLogger(PluginDiscovery.class);

    /** Contract and registry packages shared with plugins loaded from plugin roots */
    static final List<String> METADATA_PARENT_FIRST_PREFIXES = Collections.singletonList("org.dirac.metadata.");

    private final ClasspathPackageScanner packageScanner;
    private final DirectoryPluginRuntimeManager<MetadataModel> runtimeManager;
    private final ClassLoadingPolicy classLoadingPolicy;

    public PluginDiscovery() {
        this(new ClasspathPackageScanner(), new DirectoryPluginRuntimeManager<MetadataModel>(),
                new ClassLoadingPolicy(METADATA_PARENT_FIRST_PREFIXES));
    }

    public PluginDiscovery(ClasspathPackageScanner packageScanner,
            DirectoryPluginRuntimeManager<MetadataModel> runtimeManager, ClassLoadingPolicy classLoadingPolicy) {
        this.packageScanner = Objects.requireNonNull(packageScanner, "packageScanner");
        this.runtimeManager = Objects.requireNonNull(runtimeManager, "runtimeManager");
        this.classLoadingPolicy = classLoadingPolicy != null
                ? classLoadingPolicy
                : ClassLoadingPolicy.defaultPolicy();
    }

    /**
     * Registers the models found under the given packages.
     *
     * @param registry registry to populate
     * @param packageNames package names such as {@code org.dirac.metadata.plugin.core}
     * @param classLoader loader to scan and load with
     * @return discovery outcome
     */
    public DiscoveryResult discoverPackages(MetadataPluginRegistry registry, List<String> packageNames,
            ClassLoader classLoader) {
        Objects.requireNonNull(registry, "registry");
        Objects.requireNonNull(packageNames, "packageNames");
        Objects.requireNonNull(classLoader, "classLoader");
        LoadReport<MetadataModel> report = packageScanner.scan(packageNames, classLoader, MetadataModel.class);
        return register(registry, report);
    }

    /**
     * Registers the models found in the plugin directories under the given roots.
     *
     * @param registry registry to populate
     * @param pluginRoots plugin root directories
     * @param parent parent classloader of the plugin classloaders
     * @return discovery outcome
     */
    public DiscoveryResult discoverPluginRoots(MetadataPluginRegistry registry, List<Path> pluginRoots,
            ClassLoader parent) {
        Objects.requireNonNull(registry, "registry");
        Objects.requireNonNull(pluginRoots, "pluginRoots");
        Objects.requireNonNull(parent, "parent");
        LoadReport<MetadataModel> report = runtimeManager.loadAll(
                pluginRoots,
                parent,
                MetadataModel.class,
                classLoadingPolicy);
        return register(registry, report);
    }

    private DiscoveryResult register(MetadataPluginRegistry registry, LoadReport<MetadataModel> report) {
        List<String> registered = new ArrayList<>();
        List<LoadFailure> failures = new ArrayList<>(report.getFailures());
        for (PluginHandle<MetadataModel> handle : report.getSuccesses()) {
            for (Class<? extends MetadataModel> type : handle.getTypes()) {
                try {
                    registry.registerPlugin(type, false);
                    registered.add(ModelIdentity.of(type).getName());
                } catch (DuplicateRegistrationException e) {
                    failures.add(new LoadFailure(handle.getLocation(), LoadFailure.STAGE_CONFLICT,
                            e.getMessage(), e));
                } catch (RuntimeException | LinkageError e) {
                    failures.add(new LoadFailure(handle.getLocation(), LoadFailure.STAGE_REGISTER,
                            "Cannot register " + type.getName() + ": " + e.getMessage(), e));
                }
            }
        }

        for (LoadFailure failure : failures) {
            if (failure.isConflict()) {
                LOG.warn("Skip metadata plugin already registered: location={}, message={}",
                        failure.getLocation(), failure.getMessage());
            } else {
                LOG.warn("Skip metadata plugin location due to load failure: location={}, stage={}, message={}",
                        failure.getLocation(), failure.getStage(), failure.getMessage(), failure.getCause());
            }
        }
        LOG.info("Metadata plugin discovery finished: locations={}, registered={}, failures={}",
                report.getLocationsScanned(), registered.size(), failures.size());
        return new DiscoveryResult(registered, failures, report.getLocationsScanned());
    }
}
