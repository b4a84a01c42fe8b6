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

package org.dirac.metadata.plugin.core;

import org.dirac.metadata.spi.BaseMetadataModel;
import org.dirac.metadata.spi.MetadataPlugin;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Administrative metadata model with configurable job logging.
 *
 * <p>Parameters:
 * <ul>
 *   <li><b>log_level</b> - log level passed to the job, default: INFO</li>
 *   <li><b>enable_monitoring</b> - report job completion, default: true</li>
 *   <li><b>admin_level</b> - administrative privilege level, default: 1</li>
 * </ul>
 */
@MetadataPlugin(description = "Administrative metadata with enhanced logging")
public class AdminMetadata extends BaseMetadataModel {

    private static final Logger LOG = LogManager.getLogger(AdminMetadata.class);

    static final String DEFAULT_LOG_LEVEL = "INFO";
    static final String LOG_LEVEL_OPTION = "--log-level";

    private String logLevel = DEFAULT_LOG_LEVEL;
    private boolean enableMonitoring = true;
    private int adminLevel = 1;

    /**
     * Appends {@code --log-level <level>} unless the level is the default.
     */
    @Override
    public List<String> preProcess(Path jobPath, List<String> command) {
        if (DEFAULT_LOG_LEVEL.equals(logLevel)) {
            return command;
        }
        List<String> adjusted = new ArrayList<>(command);
        adjusted.add(LOG_LEVEL_OPTION);
        adjusted.add(logLevel);
        return adjusted;
    }

    @Override
    public boolean postProcess(Path jobPath) {
        if (enableMonitoring) {
            LOG.info("Job finished under monitoring: jobPath={}, adminLevel={}", jobPath, adminLevel);
        }
        return true;
    }

    public String getLogLevel() {
        return logLevel;
    }

    public boolean isEnableMonitoring() {
        return enableMonitoring;
    }

    public int getAdminLevel() {
        return adminLevel;
    }
}
