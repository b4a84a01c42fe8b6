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

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Example model resolving inputs from the {@code site} and {@code campaign} query parameters.
 *
 * <p>A real implementation would query the metadata catalog and return logical file names.
 */
@MetadataPlugin(description = "Example metadata plugin with query-based input resolution")
public class TaskWithMetadataQueryPlugin extends BaseMetadataModel {

    static final String SITE = "site";
    static final String CAMPAIGN = "campaign";

    /**
     * Resolves {@code filecatalog/<campaign>/<site>} when both are given, {@code filecatalog/<site>}
     * when only the site is given, and nothing otherwise.
     */
    @Override
    public Optional<List<Path>> getInputQuery(String inputName, Map<String, Object> queryParameters) {
        String site = stringParameter(queryParameters, SITE);
        String campaign = stringParameter(queryParameters, CAMPAIGN);
        if (site.isEmpty()) {
            return Optional.empty();
        }
        if (campaign.isEmpty()) {
            return Optional.of(Collections.singletonList(Paths.get(QueryBasedMetadata.FILE_CATALOG, site)));
        }
        return Optional.of(Collections.singletonList(Paths.get(QueryBasedMetadata.FILE_CATALOG, campaign, site)));
    }

    private static String stringParameter(Map<String, Object> queryParameters, String key) {
        Object value = queryParameters == null ? null : queryParameters.get(key);
        return value == null ? "" : value.toString();
    }
}
