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

package org.dirac.vo.sample;

import org.dirac.metadata.spi.BaseMetadataModel;
import org.dirac.metadata.spi.MetadataPlugin;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * VO plugin shipped in a plugin directory jar.
 */
@MetadataPlugin(description = "LHCb bookkeeping model", vo = "lhcb")
public class LhcbMetadata extends BaseMetadataModel {

    private String bookkeepingPath = "/lhcb/MC";

    @Override
    public Optional<List<Path>> getInputQuery(String inputName, Map<String, Object> queryParameters) {
        return Optional.of(Collections.singletonList(Paths.get(bookkeepingPath, inputName)));
    }
}
