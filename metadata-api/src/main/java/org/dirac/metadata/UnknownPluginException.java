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

package org.dirac.metadata;

import java.util.Objects;
import java.util.Optional;

/**
 * Thrown when a descriptor names a plugin that is not registered in the requested scope.
 */
public class UnknownPluginException extends MetadataRegistryException {

    private final String pluginName;
    private final String vo;

    public UnknownPluginException(String pluginName, String vo) {
        super(buildMessage(pluginName, vo));
        this.pluginName = pluginName;
        this.vo = vo;
    }

    public String getPluginName() {
        return pluginName;
    }

    public Optional<String> getVo() {
        return Optional.ofNullable(vo);
    }

    private static String buildMessage(String pluginName, String vo) {
        Objects.requireNonNull(pluginName, "pluginName");
        if (vo == null) {
            return "Unknown metadata plugin: " + pluginName;
        }
        return "Unknown metadata plugin: " + pluginName + " (vo=" + vo + ")";
    }
}
