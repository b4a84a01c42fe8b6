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

/**
 * Class discovery infrastructure for plugin packages.
 *
 * <p>This package finds concrete implementations of a contract type in two kinds of source:
 * Java packages already on the application classpath
 * ({@link org.dirac.extension.loader.ClasspathPackageScanner}) and plugin directories of jars
 * loaded through child-first classloaders
 * ({@link org.dirac.extension.loader.DirectoryPluginRuntimeManager}). Outcomes are reported via
 * {@link org.dirac.extension.loader.LoadReport},
 * {@link org.dirac.extension.loader.LoadFailure}, and
 * {@link org.dirac.extension.loader.PluginHandle}.
 *
 * <p>Scope is load-only: classes are found and loaded, never instantiated. Runtime
 * {@code reload}/{@code unload} and directory watching are out of scope.
 *
 * <p>This package provides generic runtime capability only and does not carry
 * business-domain semantics.
 */
package org.dirac.extension.loader;
