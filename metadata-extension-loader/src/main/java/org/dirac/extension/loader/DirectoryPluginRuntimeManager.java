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

import java.io.Closeable;
import java.io.IOException;
import java.net.MalformedURLException;
import java.net.URL;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.jar.JarFile;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Directory-driven plugin runtime manager.
 *
 * <p>Loads implementations of a contract type from plugin packages installed outside the
 * application classpath.
 *
 * <h2>Responsibilities</h2>
 *
 * <p>The {@link #loadAll(List, ClassLoader, Class, ClassLoadingPolicy)} flow:
 * <ol>
 *   <li>Scans each root in {@code pluginRoots} and treats its direct
 *       subdirectories as plugin directories.</li>
 *   <li>Resolves plugin jars using the convention:
 *       {@code pluginDir/*.jar + pluginDir/lib/*.jar}.</li>
 *   <li>Creates a per-plugin classloader (child-first) with a configurable
 *       parent-first package-prefix policy.</li>
 *   <li>Lists every class of the plugin's own jars ({@code pluginDir/*.jar}) and keeps the
 *       concrete implementations of the contract type. No service descriptor is required.</li>
 *   <li>Records load outcomes and returns a {@link LoadReport} with successes and failures.</li>
 * </ol>
 *
 * <p>The {@link #get(String)} and {@link #list()} methods provide read-only
 * access to successfully loaded plugin handles.
 *
 * <h2>Failure Semantics</h2>
 *
 * <p>Failures are staged: {@code scan}, {@code resolve}, {@code createClassLoader},
 * {@code discover} and {@code conflict}. Per-directory failures do not stop
 * other directories from loading.
 *
 * <h2>Conflict Strategy</h2>
 *
 * <p>If a plugin directory name was already loaded (from another root, or by an earlier
 * {@code loadAll}), the first one is kept. Later ones are skipped before any classloader is
 * created for them and recorded as {@code conflict}.
 *
 * <h2>Thread Safety</h2>
 *
 * <p>Handles live in a concurrent map. The load lifecycle is guarded by a lock so concurrent
 * {@code loadAll} invocations do not interleave.
 */
public class DirectoryPluginRuntimeManager<T> {

    private final ConcurrentMap<String, PluginHandle<T>> handlesByName = new ConcurrentHashMap<>();
    private final Object lifecycleLock = new Object();

    public LoadReport<T> loadAll(List<Path> pluginRoots, ClassLoader parent, Class<T> contractType,
            ClassLoadingPolicy policy) {
        Objects.requireNonNull(pluginRoots, "pluginRoots");
        Objects.requireNonNull(parent, "parent");
        Objects.requireNonNull(contractType, "contractType");
        ClassLoadingPolicy effectivePolicy = policy != null ? policy : ClassLoadingPolicy.forContract(contractType);
        PluginLoader pluginLoader = new PluginLoader(effectivePolicy.toParentFirstPackages());

        List<Path> pluginDirs = new ArrayList<>();
        List<LoadFailure> failures = new ArrayList<>();
        for (Path root : pluginRoots) {
            if (root != null) {
                collectPluginDirs(root, pluginDirs, failures);
            }
        }

        List<PluginHandle<T>> successes = new ArrayList<>();
        synchronized (lifecycleLock) {
            for (Path pluginDir : pluginDirs) {
                String pluginName = pluginDir.getFileName().toString();
                if (handlesByName.containsKey(pluginName)) {
                    failures.add(new LoadFailure(
                            pluginDir.toString(),
                            LoadFailure.STAGE_CONFLICT,
                            "Duplicate plugin directory name: " + pluginName,
                            null));
                    continue;
                }
                try {
                    PluginHandle<T> handle = loadFromPluginDir(pluginDir, parent, contractType, pluginLoader,
                            failures);
                    handlesByName.put(handle.getName(), handle);
                    successes.add(handle);
                } catch (PluginLoadException e) {
                    failures.add(e.toLoadFailure());
                }
            }
        }
        return new LoadReport<>(successes, failures, pluginDirs.size());
    }

    public Optional<PluginHandle<T>> get(String pluginName) {
        return Optional.ofNullable(handlesByName.get(pluginName));
    }

    public List<PluginHandle<T>> list() {
        Collection<PluginHandle<T>> handles = handlesByName.values();
        List<PluginHandle<T>> results = new ArrayList<>(handles);
        Collections.sort(results, Comparator.comparing(PluginHandle::getName));
        return results;
    }

    private void collectPluginDirs(Path root, List<Path> pluginDirs, List<LoadFailure> failures) {
        Path normalized = normalize(root);
        if (!Files.exists(normalized)) {
            failures.add(new LoadFailure(
                    normalized.toString(),
                    LoadFailure.STAGE_SCAN,
                    "Plugin root does not exist: " + normalized,
                    null));
            return;
        }
        if (!Files.isDirectory(normalized)) {
            failures.add(new LoadFailure(
                    normalized.toString(),
                    LoadFailure.STAGE_SCAN,
                    "Plugin root is not a directory: " + normalized,
                    null));
            return;
        }

        try (Stream<Path> stream = Files.list(normalized)) {
            pluginDirs.addAll(stream.filter(Files::isDirectory)
                    .map(this::normalize)
                    .sorted(Comparator.comparing(path -> path.getFileName().toString()))
                    .collect(Collectors.toList()));
        } catch (IOException e) {
            failures.add(new LoadFailure(
                    normalized.toString(),
                    LoadFailure.STAGE_SCAN,
                    "Failed to list plugin root: " + normalized,
                    e));
        }
    }

    private PluginHandle<T> loadFromPluginDir(Path pluginDir, ClassLoader parent, Class<T> contractType,
            PluginLoader pluginLoader, List<LoadFailure> failures) throws PluginLoadException {
        List<Path> ownJars = listJars(pluginDir);
        if (ownJars.isEmpty()) {
            throw new PluginLoadException(
                    pluginDir,
                    LoadFailure.STAGE_RESOLVE,
                    "No jar found under plugin directory: " + pluginDir,
                    null);
        }
        List<Path> resolvedJars = new ArrayList<>(ownJars);
        Path libDir = pluginDir.resolve("lib");
        if (Files.isDirectory(libDir)) {
            resolvedJars.addAll(listJars(libDir));
        }
        URL[] urls = toUrls(resolvedJars, pluginDir);

        ClassLoader classLoader;
        try {
            classLoader = pluginLoader.createClassLoader(urls, parent);
        } catch (RuntimeException e) {
            throw new PluginLoadException(
                    pluginDir,
                    LoadFailure.STAGE_CREATE_CLASSLOADER,
                    "Failed to create classloader for " + pluginDir,
                    e);
        }

        List<String> classNames = new ArrayList<>();
        for (Path jar : ownJars) {
            try (JarFile jarFile = new JarFile(jar.toFile())) {
                classNames.addAll(PluginLoader.listClassNames(jarFile, ""));
            } catch (IOException e) {
                closeClassLoader(classLoader);
                throw new PluginLoadException(
                        pluginDir,
                        LoadFailure.STAGE_RESOLVE,
                        "Failed to read jar " + jar,
                        e);
            }
        }
        Collections.sort(classNames);

        List<Class<? extends T>> types = pluginLoader.loadTypes(
                classLoader, classNames, contractType, pluginDir.toString(), failures);
        if (types.isEmpty()) {
            closeClassLoader(classLoader);
            throw new PluginLoadException(
                    pluginDir,
                    LoadFailure.STAGE_DISCOVER,
                    "No " + contractType.getName() + " implementation found in " + pluginDir,
                    null);
        }

        return new PluginHandle<>(
                pluginDir.getFileName().toString(),
                pluginDir.toString(),
                resolvedJars,
                classLoader,
                types,
                Instant.now());
    }

    private List<Path> listJars(Path directory) throws PluginLoadException {
        try (Stream<Path> stream = Files.list(directory)) {
            return stream.filter(Files::isRegularFile)
                    .filter(path -> path.getFileName().toString().endsWith(".jar"))
                    .map(this::normalize)
                    .sorted(Comparator.comparing(Path::toString))
                    .collect(Collectors.toList());
        } catch (IOException e) {
            throw new PluginLoadException(
                    directory,
                    LoadFailure.STAGE_RESOLVE,
                    "Failed to resolve jars under " + directory,
                    e);
        }
    }

    private URL[] toUrls(List<Path> jars, Path pluginDir) throws PluginLoadException {
        URL[] urls = new URL[jars.size()];
        for (int i = 0; i < jars.size(); i++) {
            try {
                urls[i] = jars.get(i).toUri().toURL();
            } catch (MalformedURLException e) {
                throw new PluginLoadException(
                        pluginDir,
                        LoadFailure.STAGE_RESOLVE,
                        "Invalid jar path: " + jars.get(i),
                        e);
            }
        }
        return urls;
    }

    /**
     * Closes a plugin classloader, ignoring close errors.
     */
    static void closeClassLoader(ClassLoader classLoader) {
        if (!(classLoader instanceof Closeable)) {
            return;
        }
        try {
            ((Closeable) classLoader).close();
        } catch (IOException ignored) {
            // Best effort close.
        }
    }

    private Path normalize(Path path) {
        return path.toAbsolutePath().normalize();
    }

    private static final class PluginLoadException extends Exception {

        private final Path pluginDir;
        private final String stage;

        private PluginLoadException(Path pluginDir, String stage, String message, Throwable cause) {
            super(message, cause);
            this.pluginDir = pluginDir;
            this.stage = stage;
        }

        private LoadFailure toLoadFailure() {
            return new LoadFailure(pluginDir.toString(), stage, getMessage(), getCause());
        }
    }
}
