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

import org.dirac.extension.loader.testing.Greeter;
import org.dirac.plugins.sample.AbstractGreeter;
import org.dirac.plugins.sample.EnglishGreeter;
import org.dirac.plugins.sample.FrenchGreeter;
import org.dirac.plugins.sample.NotAGreeter;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.net.URLClassLoader;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Unit tests for {@link DirectoryPluginRuntimeManager}.
 */
@DisplayName("DirectoryPluginRuntimeManager Unit Tests")
public class DirectoryPluginRuntimeManagerTest {

    private DirectoryPluginRuntimeManager<Greeter> manager;
    private ClassLoader parent;

    @BeforeEach
    void setUp() {
        manager = new DirectoryPluginRuntimeManager<>();
        parent = Thread.currentThread().getContextClassLoader();
    }

    @Test
    @DisplayName("UT-LOADER-DPRM-001: Implementations are loaded child-first from a plugin directory")
    void testLoadPluginDirectory() throws Exception {
        // Given
        Path root = Files.createTempDirectory("plugin-root");
        TestJars.createJar(root.resolve("greeters").resolve("greeters.jar"),
                EnglishGreeter.class, AbstractGreeter.class, FrenchGreeter.class, NotAGreeter.class);

        // When
        LoadReport<Greeter> report = manager.loadAll(Collections.singletonList(root), parent, Greeter.class, null);

        // Then
        Assertions.assertTrue(report.getFailures().isEmpty(), () -> report.getFailures().toString());
        Assertions.assertEquals(1, report.getLocationsScanned());
        PluginHandle<Greeter> handle = report.getSuccesses().get(0);
        Assertions.assertEquals("greeters", handle.getName());
        Assertions.assertEquals(1, handle.getResolvedJars().size());

        List<String> names = handle.getTypes().stream().map(Class::getName).collect(Collectors.toList());
        Assertions.assertEquals(List.of(EnglishGreeter.class.getName(), FrenchGreeter.class.getName()), names);

        Class<? extends Greeter> english = handle.getTypes().get(0);
        Assertions.assertSame(handle.getClassLoader(), english.getClassLoader());
        Assertions.assertNotSame(EnglishGreeter.class, english);
        Greeter greeter = english.getDeclaredConstructor().newInstance();
        Assertions.assertEquals("Hello, DIRAC", greeter.greet("DIRAC"));
        Assertions.assertTrue(manager.get("greeters").isPresent());
    }

    @Test
    @DisplayName("UT-LOADER-DPRM-002: Dependency jars under lib are on the plugin classpath")
    void testLoadWithLibDirectory() throws Exception {
        // Given - the abstract base class ships in lib/
        Path root = Files.createTempDirectory("plugin-root-lib");
        Path pluginDir = root.resolve("french");
        TestJars.createJar(pluginDir.resolve("french.jar"), FrenchGreeter.class);
        TestJars.createJar(pluginDir.resolve("lib").resolve("base.jar"), AbstractGreeter.class);

        // When
        LoadReport<Greeter> report = manager.loadAll(Collections.singletonList(root), parent, Greeter.class, null);

        // Then - only classes of the plugin's own jars are candidates
        Assertions.assertEquals(2, report.getSuccesses().get(0).getResolvedJars().size());
        Assertions.assertEquals(1, report.getTypes().size());
        Assertions.assertEquals("Bonjour, DIRAC",
                report.getTypes().get(0).getDeclaredConstructor().newInstance().greet("DIRAC"));
    }

    @Test
    @DisplayName("UT-LOADER-DPRM-003: Missing plugin root is a scan failure")
    void testMissingRoot() throws Exception {
        Path missing = Files.createTempDirectory("plugin-root-missing").resolve("absent");

        LoadReport<Greeter> report = manager.loadAll(Collections.singletonList(missing), parent, Greeter.class, null);

        Assertions.assertTrue(report.getSuccesses().isEmpty());
        Assertions.assertEquals(LoadFailure.STAGE_SCAN, report.getFailures().get(0).getStage());
    }

    @Test
    @DisplayName("UT-LOADER-DPRM-004: Plugin root that is a file is a scan failure")
    void testRootIsFile() throws Exception {
        Path file = Files.createTempFile("plugin-root", ".txt");

        LoadReport<Greeter> report = manager.loadAll(Collections.singletonList(file), parent, Greeter.class, null);

        Assertions.assertEquals(1, report.getFailures().size());
        Assertions.assertTrue(report.getFailures().get(0).getMessage().contains("not a directory"));
    }

    @Test
    @DisplayName("UT-LOADER-DPRM-005: Plugin directory without jars is a resolve failure")
    void testDirectoryWithoutJars() throws Exception {
        Path root = Files.createTempDirectory("plugin-root-empty");
        Files.createDirectories(root.resolve("empty"));

        LoadReport<Greeter> report = manager.loadAll(Collections.singletonList(root), parent, Greeter.class, null);

        Assertions.assertEquals(1, report.getFailures().size());
        Assertions.assertEquals(LoadFailure.STAGE_RESOLVE, report.getFailures().get(0).getStage());
    }

    @Test
    @DisplayName("UT-LOADER-DPRM-006: Jar without implementations is a discover failure")
    void testJarWithoutImplementations() throws Exception {
        Path root = Files.createTempDirectory("plugin-root-none");
        TestJars.createJar(root.resolve("plain").resolve("plain.jar"), NotAGreeter.class);

        LoadReport<Greeter> report = manager.loadAll(Collections.singletonList(root), parent, Greeter.class, null);

        Assertions.assertTrue(report.getSuccesses().isEmpty());
        Assertions.assertEquals(LoadFailure.STAGE_DISCOVER, report.getFailures().get(0).getStage());
        Assertions.assertFalse(manager.get("plain").isPresent());
    }

    @Test
    @DisplayName("UT-LOADER-DPRM-007: Loading the same directory twice keeps the first and records a conflict")
    void testLoadTwiceConflicts() throws Exception {
        // Given
        Path root = Files.createTempDirectory("plugin-root-twice");
        TestJars.createJar(root.resolve("english").resolve("english.jar"), EnglishGreeter.class);
        manager.loadAll(Collections.singletonList(root), parent, Greeter.class, null);
        PluginHandle<Greeter> first = manager.get("english").get();

        // When
        LoadReport<Greeter> second = manager.loadAll(Collections.singletonList(root), parent, Greeter.class, null);

        // Then
        Assertions.assertTrue(second.getSuccesses().isEmpty());
        Assertions.assertTrue(second.getFailures().get(0).isConflict());
        Assertions.assertNull(second.getFailures().get(0).getCause());
        Assertions.assertSame(first, manager.get("english").get());
        Assertions.assertEquals(1, manager.list().size());
        String greeterResource = EnglishGreeter.class.getName().replace('.', '/') + ".class";
        Assertions.assertNotNull(((URLClassLoader) first.getClassLoader()).findResource(greeterResource));
    }

    @Test
    @DisplayName("UT-LOADER-DPRM-008: One broken directory does not stop the others")
    void testPartialFailure() throws Exception {
        // Given
        Path root = Files.createTempDirectory("plugin-root-partial");
        Files.createDirectories(root.resolve("a-broken"));
        TestJars.createJar(root.resolve("b-english").resolve("english.jar"), EnglishGreeter.class);

        // When
        LoadReport<Greeter> report = manager.loadAll(Collections.singletonList(root), parent, Greeter.class, null);

        // Then
        Assertions.assertEquals(2, report.getLocationsScanned());
        Assertions.assertEquals(1, report.getSuccesses().size());
        Assertions.assertEquals(1, report.getFailures().size());
        Assertions.assertEquals(List.of("b-english"),
                manager.list().stream().map(PluginHandle::getName).collect(Collectors.toList()));
    }
}
