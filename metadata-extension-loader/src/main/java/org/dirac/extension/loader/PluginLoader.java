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

import java.lang.reflect.Modifier;
import java.net.URL;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Enumeration;
import java.util.List;
import java.util.Objects;
import java.util.jar.JarEntry;
import java.util.jar.JarFile;

/**
 * Loads candidate plugin classes by name and filters them against a contract type.
 *
 * <p>This class wires classloading and type filtering but does not scan locations itself.</p>
 */
public final class PluginLoader {

    private static final Logger LOG = LogManager.getLogger(PluginLoader.class);

    static final String CLASS_SUFFIX = ".class";

    private final List<String> parentFirstPackages;

    public PluginLoader(List<String> parentFirstPackages) {
        this.parentFirstPackages = parentFirstPackages != null
                ? new ArrayList<>(parentFirstPackages)
                : ChildFirstClassLoader.DEFAULT_PARENT_FIRST_PACKAGES;
    }

    public ClassLoader createClassLoader(URL[] urls, ClassLoader parent) {
        return new ChildFirstClassLoader(urls, parent, parentFirstPackages);
    }

    /**
     * Loads the named classes without initializing them and keeps the plugin candidates.
     *
     * <p>Classes that fail to load are recorded as {@link LoadFailure#STAGE_DISCOVER} failures
     * and skipped.
     *
     * @param classLoader loader to define the classes with
     * @param classNames binary class names
     * @param contractType type candidates must implement
     * @param location source being scanned, for failure records
     * @param failures sink for per-class failures
     * @return candidate types in the order of {@code classNames}
     */
    public <T> List<Class<? extends T>> loadTypes(ClassLoader classLoader, Collection<String> classNames,
            Class<T> contractType, String location, List<LoadFailure> failures) {
        Objects.requireNonNull(classLoader, "classLoader");
        Objects.requireNonNull(contractType, "contractType");
        List<Class<? extends T>> types = new ArrayList<>();
        for (String className : classNames) {
            Class<?> loaded;
            try {
                loaded = Class.forName(className, false, classLoader);
            } catch (ClassNotFoundException | LinkageError e) {
                failures.add(new LoadFailure(
                        location,
                        LoadFailure.STAGE_DISCOVER,
                        "Failed to load class " + className + " from " + location,
                        e));
                continue;
            }
            if (isCandidate(loaded, contractType)) {
                LOG.debug("Found {} candidate {} in {}", contractType.getSimpleName(), className, location);
                types.add(loaded.asSubclass(contractType));
            }
        }
        return types;
    }

    /**
     * Whether {@code type} is a concrete, nameable implementation of {@code contractType}.
     */
    public static boolean isCandidate(Class<?> type, Class<?> contractType) {
        if (type == contractType || !contractType.isAssignableFrom(type)) {
            return false;
        }
        int modifiers = type.getModifiers();
        if (type.isInterface() || Modifier.isAbstract(modifiers) || type.isSynthetic()) {
            return false;
        }
        if (type.isAnonymousClass() || type.isLocalClass()) {
            return false;
        }
        return !type.isMemberClass() || Modifier.isStatic(modifiers);
    }

    /**
     * Lists the binary names of the classes in {@code jar} under a resource prefix.
     *
     * @param jar jar to list
     * @param resourcePrefix path prefix such as {@code org/dirac/}, empty for all entries
     * @return class names
     */
    static List<String> listClassNames(JarFile jar, String resourcePrefix) {
        List<String> classNames = new ArrayList<>();
        Enumeration<JarEntry> entries = jar.entries();
        while (entries.hasMoreElements()) {
            JarEntry entry = entries.nextElement();
            String entryName = entry.getName();
            if (entry.isDirectory() || !entryName.endsWith(CLASS_SUFFIX) || !entryName.startsWith(resourcePrefix)) {
                continue;
            }
            if (entryName.startsWith("META-INF/")) {
                continue;
            }
            String className = toClassName(entryName);
            if (className != null) {
                classNames.add(className);
            }
        }
        return classNames;
    }

    /**
     * Converts a class resource path to a binary class name.
     *
     * @return the class name, or null for module and package descriptors
     */
    static String toClassName(String resourcePath) {
        String withoutSuffix = resourcePath.substring(0, resourcePath.length() - CLASS_SUFFIX.length());
        if (withoutSuffix.endsWith("module-info") || withoutSuffix.endsWith("package-info")) {
            return null;
        }
        return withoutSuffix.replace('/', '.').replace('\\', '.');
    }
}
