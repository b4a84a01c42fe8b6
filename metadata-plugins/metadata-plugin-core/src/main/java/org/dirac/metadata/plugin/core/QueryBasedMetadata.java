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

import com.google.common.base.Strings;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Metadata model resolving inputs and outputs from query parameters.
 *
 * <p>Inputs resolve to {@code <query_root>/<campaign>/<site>/<data_type>}, skipping unset parts.
 * Outputs resolve under {@code filecatalog/outputs}.
 */
@MetadataPlugin(description = "Metadata with query-based input resolution")
public class QueryBasedMetadata extends BaseMetadataModel {

    static final String FILE_CATALOG = "filecatalog";
    static final String OUTPUTS = "outputs";

    private String queryRoot;
    private String site;
    private String campaign;
    private String dataType;

    /**
     * Returns the input location built from campaign, site and data type.
     *
     * @return the location, or empty when none of the three is set
     */
    @Override
    public Optional<List<Path>> getInputQuery(String inputName, Map<String, Object> queryParameters) {
        List<String> parts = new ArrayList<>();
        for (String part : new String[] {campaign, site, dataType}) {
            if (!Strings.isNullOrEmpty(part)) {
                parts.add(part);
            }
        }
        if (parts.isEmpty()) {
            return Optional.empty();
        }
        String root = Strings.isNullOrEmpty(queryRoot) ? FILE_CATALOG : queryRoot;
        return Optional.of(Collections.singletonList(Paths.get(root, parts.toArray(new String[0]))));
    }

    /**
     * Returns {@code filecatalog/outputs/<campaign>/<site>}, {@code filecatalog/outputs/<campaign>} or
     * {@code filecatalog/outputs/default}, depending on which parameters are set.
     */
    @Override
    public Optional<Path> getOutputQuery(String outputName, Map<String, Object> queryParameters) {
        Path base = Paths.get(FILE_CATALOG, OUTPUTS);
        if (Strings.isNullOrEmpty(campaign)) {
            return Optional.of(base.resolve("default"));
        }
        if (Strings.isNullOrEmpty(site)) {
            return Optional.of(base.resolve(campaign));
        }
        return Optional.of(base.resolve(campaign).resolve(site));
    }

    public String getQueryRoot() {
        return queryRoot;
    }

    public String getSite() {
        return site;
    }

    public String getCampaign() {
        return campaign;
    }

    public String getDataType() {
        return dataType;
    }
}
