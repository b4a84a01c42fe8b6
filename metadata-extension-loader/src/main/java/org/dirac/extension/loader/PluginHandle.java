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

package org.dirac.extension.loader;

import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Runtime handle for one scanned plugin source: a classpath package or a plugin directory.
 *
 * @param <T> contract type the discovered classes implement
 */
public final class PluginHandle<T> {

    private final String name;
    private final String location;
    private final List<Path> resolvedJars;
    private final ClassLoader classLoader;
    private final List<Class<? extends T>> types;
    private final Instant loadedAt;

    public PluginHandle(String name, String location, List<Path> resolvedJars,
            ClassLoader classLoader, List<Class<? extends T>> types, Instant loadedAt) {
        this.name = requireNonBlank(name, "name");
        this.location = requireNonBlank(location, "location");
        this.resolvedJars = Collections.unmodifiableList(new ArrayList<>(
                Objects.requireNonNull(resolvedJars, "resolvedJars")));
        this.classLoader = Objects.requireNonNull(classLoader, "classLoader");
        this.types = Collections.unmodifiableList(new ArrayList<>(Objects.requireNonNull(types, "types")));
        this.loadedAt = Objects.requireNonNull(loadedAt, "loadedAt");
    }

    /**
     * Package name for classpath sources, directory name for plugin directories.
     */
    public String getName() {
        return name;
    }

    public String getLocation() {
        return location;
    }

    /**
     * Jars backing a plugin directory; empty for classpath sources.
     */
    public List<Path> getResolvedJars() {
        return resolvedJars;
    }

    public ClassLoader getClassLoader() {
        return classLoader;
    }

    public List<Class<? extends T>> getTypes() {
        return types;
    }

    public Instant getLoadedAt() {
        return loadedAt;
    }

    private static String requireNonBlank(String value, String fieldName) {
        Objects.requireNonNull(value, fieldName);
        String trimmed = value.trim();
        if (trimmed.isEmpty()) {
            throw new IllegalArgumentException(fieldName + " is blank");
        }
        return trimmed;
    }
}
