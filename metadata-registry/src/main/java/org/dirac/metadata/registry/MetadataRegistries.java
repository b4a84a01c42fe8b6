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

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Process-wide {@link MetadataPluginRegistry}.
 *
 * <p>The registry is created on first access and populated once from {@link RegistryConfig#load()}.
 * Bootstrap problems are logged, never thrown: callers always get a usable registry, possibly with
 * fewer plugins than configured.
 */
public final class MetadataRegistries {
    private static final Logger LOG = LogManager.getLogger(MetadataRegistries.class);

    private MetadataRegistries() {
    }

    public static MetadataPluginRegistry get() {
        return Holder.INSTANCE;
    }

    private static final class Holder {
        private static final MetadataPluginRegistry INSTANCE = bootstrap();
    }

    private static MetadataPluginRegistry bootstrap() {
        RegistryConfig config;
        try {
            config = RegistryConfig.load();
        } catch (RuntimeException e) {
            LOG.warn("Invalid metadata registry configuration, using defaults", e);
            config = RegistryConfig.defaults();
        }
        return bootstrap(new MetadataPluginRegistry(), config);
    }

    static MetadataPluginRegistry bootstrap(MetadataPluginRegistry registry, RegistryConfig config) {
        if (!config.isDiscoveryEnabled()) {
            LOG.info("Metadata plugin discovery disabled by {}", RegistryConfig.DISCOVERY_ENABLED_KEY);
            return registry;
        }
        try {
            int fromPackages = registry.discoverPlugins(config.getDiscoveryPackages());
            int fromRoots = config.getPluginRoots().isEmpty()
                    ? 0
                    : registry.discoverPluginRoots(config.getPluginRoots());
            LOG.info("Metadata registry ready: {} plugin(s) from packages {}, {} from plugin roots {}",
                    fromPackages, config.getDiscoveryPackages(), fromRoots, config.getPluginRoots());
        } catch (RuntimeException | LinkageError e) {
            LOG.warn("Metadata plugin discovery failed, registry keeps {} plugin(s)", registry.size(), e);
        }
        return registry;
    }
}
