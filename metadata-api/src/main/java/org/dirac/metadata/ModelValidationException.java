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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Thrown when descriptor parameters cannot be bound onto a model's declared fields.
 *
 * <p>Either the parameters name fields the model does not declare ({@link #getUnknownFields()}
 * is non-empty), or a value does not fit the declared type of its field.
 */
public class ModelValidationException extends MetadataRegistryException {

    private final String pluginName;
    private final List<String> unknownFields;

    public ModelValidationException(String pluginName, String message, Throwable cause) {
        super(message, cause);
        this.pluginName = pluginName;
        this.unknownFields = Collections.emptyList();
    }

    private ModelValidationException(String pluginName, String message, List<String> unknownFields) {
        super(message);
        this.pluginName = pluginName;
        this.unknownFields = Collections.unmodifiableList(new ArrayList<>(unknownFields));
    }

    /**
     * Creates the exception for parameters that match no declared field.
     *
     * @param pluginName plugin being instantiated
     * @param unknownFields offending parameter names
     * @param knownFields declared field names, listed in the message as a hint
     * @return exception
     */
    public static ModelValidationException unknownFields(String pluginName, List<String> unknownFields,
            List<String> knownFields) {
        String message = "Unknown field(s) " + unknownFields + " for metadata plugin " + pluginName
                + "; declared fields: " + knownFields;
        return new ModelValidationException(pluginName, message, unknownFields);
    }

    public String getPluginName() {
        return pluginName;
    }

    public List<String> getUnknownFields() {
        return unknownFields;
    }
}
