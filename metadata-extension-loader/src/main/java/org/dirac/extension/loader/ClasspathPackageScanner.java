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

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.net.JarURLConnection;
import java.net.URISyntaxException;
import java.net.URL;
import java.net.URLConnection;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.TreeSet;
import java.util.jar.JarFile;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Finds implementations of a contract type inside Java packages of a classloader's classpath.
 *
 * <p>Each source location is a package name. Its classes, including those of sub-packages, are
 * listed from every classpath root that contains the package, whether a directory or a jar.
 * Classes are loaded without initialization and filtered with
 * {@link PluginLoader#isCandidate(Class, Class)}; no manifest or service file is needed.
 *
 * <h2>Failure Semantics</h2>
 *
 * <p>A malformed or absent package is a {@code scan} failure, an unreadable classpath root a
 * {@code resolve} failure, a class that cannot be loaded a {@code discover} failure. Each is
 * recorded in the returned {@link LoadReport}; one failing package never stops the others.
 */
public class ClasspathPackageScanner {

    private static final Logger LOG = LogManager.getLogger(ClasspathPackageScanner.class);

    private static final Pattern PACKAGE_NAME =
            Pattern.compile("[A-Za-z_$][A-Za-z0-9_$]*(\\.[A-Za-z_$][A-Za-z0-9_$]*)*");

    private final PluginLoader pluginLoader = new PluginLoader(null);

    public <T> LoadReport<T> scan(List<String> packageNames, ClassLoader classLoader, Class<T> contractType) {
        Objects.requireNonNull(packageNames, "packageNames");
        Objects.requireNonNull(classLoader, "classLoader");
        Objects.requireNonNull(contractType, "contractType");

        List<PluginHandle<T>> successes = new ArrayList<>();
        List<LoadFailure> failures = new ArrayList<>();
        int scanned = 0;
        for (String packageName : packageNames) {
            if (packageName == null) {
                continue;
            }
            scanned++;
            String trimmed = packageName.trim();
            if (!PACKAGE_NAME.matcher(trimmed).matches()) {
                failures.add(new LoadFailure(
                        packageName,
                        LoadFailure.STAGE_SCAN,
                        "Malformed package name: '" + packageName + "'",
                        null));
                continue;
            }
            PluginHandle<T> handle = scanPackage(trimmed, classLoader, contractType, failures);
            if (handle != null) {
                successes.add(handle);
            }
        }
        return new LoadReport<>(successes, failures, scanned);
    }

    private <T> PluginHandle<T> scanPackage(String packageName, ClassLoader classLoader, Class<T> contractType,
            List<LoadFailure> failures) {
        String resourcePath = packageName.replace('.', '/');
        List<URL> roots;
        try {
            roots = Collections.list(classLoader.getResources(resourcePath));
        } catch (IOException e) {
            failures.add(new LoadFailure(
                    packageName,
                    LoadFailure.STAGE_SCAN,
                    "Failed to look up package " + packageName,
                    e));
            return null;
        }
        if (roots.isEmpty()) {
            failures.add(new LoadFailure(
                    packageName,
                    LoadFailure.STAGE_SCAN,
                    "Package not found on classpath: " + packageName,
                    null));
            return null;
        }

        // sorted and de-duplicated across roots
        TreeSet<String> classNames = new TreeSet<>();
        for (URL root : roots) {
            try {
                classNames.addAll(listClassNames(root, resourcePath));
            } catch (IOException | URISyntaxException | RuntimeException e) {
                failures.add(new LoadFailure(
                        packageName,
                        LoadFailure.STAGE_RESOLVE,
                        "Failed to list classes of " + packageName + " under " + root,
                        e));
            }
        }
        LOG.debug("Scanning {} classes of package {}", classNames.size(), packageName);

        List<Class<? extends T>> types = pluginLoader.loadTypes(
                classLoader, classNames, contractType, packageName, failures);
        return new PluginHandle<>(
                packageName,
                packageName,
                Collections.emptyList(),
                classLoader,
                types,
                Instant.now());
    }

    private List<String> listClassNames(URL root, String resourcePath) throws IOException, URISyntaxException {
        String protocol = root.getProtocol();
        if ("file".equals(protocol)) {
            return listDirectory(Paths.get(root.toURI()), resourcePath);
        }
        if ("jar".equals(protocol)) {
            URLConnection connection = root.openConnection();
            if (!(connection instanceof JarURLConnection)) {
                throw new IOException("Not a jar connection: " + root);
            }
            JarURLConnection jarConnection = (JarURLConnection) connection;
            jarConnection.setUseCaches(false);
            try (JarFile jar = jarConnection.getJarFile()) {
                return PluginLoader.listClassNames(jar, resourcePath + "/");
            }
        }
        throw new IOException("Unsupported classpath root protocol '" + protocol + "': " + root);
    }

    private List<String> listDirectory(Path packageDir, String resourcePath) throws IOException {
        // classes root = package directory minus the package path segments
        Path classesRoot = packageDir;
        for (int i = 0; i < resourcePath.split("/").length; i++) {
            classesRoot = classesRoot.getParent();
        }
        final Path base = classesRoot;
        try (Stream<Path> stream = Files.walk(packageDir)) {
            return stream.filter(Files::isRegularFile)
                    .filter(path -> path.getFileName().toString().endsWith(PluginLoader.CLASS_SUFFIX))
                    .map(path -> PluginLoader.toClassName(base.relativize(path).toString()))
                    .filter(Objects::nonNull)
                    .collect(Collectors.toList());
        }
    }
}
