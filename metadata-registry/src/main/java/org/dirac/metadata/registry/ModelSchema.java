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

package org.dirac.metadata.registry;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Declarative description of a metadata model: its identity and the fields a descriptor may set.
 */
public final class ModelSchema {

    private final String pluginName;
    private final String description;
    private final String vo;
    private final Class<?> modelClass;
    private final List<ModelField> fields;

    public ModelSchema(String pluginName, String description, String vo, Class<?> modelClass,
            List<ModelField> fields) {
        this.pluginName = Objects.requireNonNull(pluginName, "pluginName");
        this.description = Objects.requireNonNull(description, "description");
        this.vo = vo;
        this.modelClass = Objects.requireNonNull(modelClass, "modelClass");
        this.fields = Collections.unmodifiableList(new ArrayList<>(Objects.requireNonNull(fields, "fields")));
    }

    public String getPluginName() {
        return pluginName;
    }

    public String getDescription() {
        return description;
    }

    public Optional<String> getVo() {
        return Optional.ofNullable(vo);
    }

    public Class<?> getModelClass() {
        return modelClass;
    }

    /**
     * Returns the declared fields in declaration order.
     *
     * @return immutable field list
     */
    public List<ModelField> getFields() {
        return fields;
    }

    public Optional<ModelField> getField(String name) {
        for (ModelField field : fields) {
            if (field.getName().equals(name)) {
                return Optional.of(field);
            }
        }
        return Optional.empty();
    }

    @Override
    public String toString() {
        return "ModelSchema{"
                + "pluginName='" + pluginName + '\''
                + ", vo=" + (vo == null ? "<global>" : "'" + vo + "'")
                + ", modelClass=" + modelClass.getName()
                + ", fields=" + fields
                + '}';
    }
}
