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

package org.dirac.metadata.spi;

import java.nio.file.Path;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Metadata model contract.
 *
 * <p>A metadata model describes how a class of jobs resolves its input and output data and how
 * its execution is pre- and post-processed. Every hook is optional: the defaults leave the command
 * unchanged, report success and do not participate in data resolution.
 *
 * <p>Implementations must:
 * <ul>
 *   <li>expose a no-argument constructor (any visibility)</li>
 *   <li>declare their parameters as plain instance fields whose initializers are the defaults</li>
 *   <li>keep construction free of side effects: no network, no filesystem</li>
 * </ul>
 *
 * <p>Hooks may perform I/O; sequencing them is the job executor's responsibility.
 */
public interface MetadataModel {

    // ==================== Identity ====================

    /**
     * Plugin name, unique within its virtual organization.
     *
     * @return plugin name
     */
    default String name() {
        return ModelIdentity.of(getClass()).getName();
    }

    default String description() {
        return ModelIdentity.of(getClass()).getDescription();
    }

    /**
     * Owning virtual organization.
     *
     * @return the vo, or empty when globally visible
     */
    default Optional<String> vo() {
        return ModelIdentity.of(getClass()).getVo();
    }

    // ==================== Job Hooks ====================

    /**
     * Adjusts the command before the job runs.
     *
     * @param jobPath job working directory
     * @param command command line
     * @return the command to execute
     */
    default List<String> preProcess(Path jobPath, List<String> command) {
        return command;
    }

    /**
     * Post-processes job outputs.
     *
     * @param jobPath job working directory
     * @return true on success
     */
    default boolean postProcess(Path jobPath) {
        return true;
    }

    // ==================== Data Resolution ====================

    /**
     * Resolves the data locations of one job input.
     *
     * <p>Returned paths are opaque identifiers, the caller resolves them against the data catalog.
     *
     * @param inputName input name
     * @param queryParameters additional query parameters
     * @return resolved paths, or empty when this model does not resolve the input
     */
    default Optional<List<Path>> getInputQuery(String inputName, Map<String, Object> queryParameters) {
        return Optional.empty();
    }

    default Optional<List<Path>> getInputQuery(String inputName) {
        return getInputQuery(inputName, Collections.emptyMap());
    }

    /**
     * Resolves the data location of one job output.
     *
     * @param outputName output name
     * @param queryParameters additional query parameters
     * @return resolved path, or empty when this model does not resolve the output
     */
    default Optional<Path> getOutputQuery(String outputName, Map<String, Object> queryParameters) {
        return Optional.empty();
    }

    default Optional<Path> getOutputQuery(String outputName) {
        return getOutputQuery(outputName, Collections.emptyMap());
    }
}
