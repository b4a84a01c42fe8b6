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

import java.lang.reflect.Type;
import java.util.Objects;

/**
 * One declared field of a metadata model: parameter name, declared type and default value.
 */
public final class ModelField {

    private final String name;
    private final Type type;
    private final Object defaultValue;

    public ModelField(String name, Type type, Object defaultValue) {
        this.name = Objects.requireNonNull(name, "name");
        this.type = Objects.requireNonNull(type, "type");
        this.defaultValue = defaultValue;
    }

    /**
     * Returns the parameter name, the snake_case form of the Java field name.
     *
     * @return parameter name
     */
    public String getName() {
        return name;
    }

    public Type getType() {
        return type;
    }

    public String getTypeName() {
        return type.getTypeName();
    }

    public Object getDefaultValue() {
        return defaultValue;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        ModelField that = (ModelField) o;
        return name.equals(that.name)
                && type.equals(that.type)
                && Objects.equals(defaultValue, that.defaultValue);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, type, defaultValue);
    }

    @Override
    public String toString() {
        return name + ": " + getTypeName() + " = " + defaultValue;
    }
}
