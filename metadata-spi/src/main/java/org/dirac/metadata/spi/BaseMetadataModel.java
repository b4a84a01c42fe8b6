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

import java.lang.reflect.Field;
import java.lang.reflect.Modifier;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Convenience base for metadata models.
 *
 * <p>Adds value semantics over the declared fields: two instances of the same class are equal when
 * all their fields are equal.
 */
public abstract class BaseMetadataModel implements MetadataModel {

    /**
     * Returns the declared field values, superclass fields first.
     *
     * @return field name to value
     */
    protected Map<String, Object> fieldValues() {
        Map<String, Object> values = new LinkedHashMap<>();
        for (Field field : declaredFields(getClass())) {
            try {
                values.put(field.getName(), field.get(this));
            } catch (IllegalAccessException e) {
                throw new IllegalStateException("Cannot read field " + field.getName() + " of " + getClass(), e);
            }
        }
        return values;
    }

    private static List<Field> declaredFields(Class<?> type) {
        List<Class<?>> hierarchy = new ArrayList<>();
        for (Class<?> current = type; current != null && current != BaseMetadataModel.class;
                current = current.getSuperclass()) {
            hierarchy.add(0, current);
        }
        List<Field> fields = new ArrayList<>();
        for (Class<?> current : hierarchy) {
            for (Field field : current.getDeclaredFields()) {
                int modifiers = field.getModifiers();
                if (Modifier.isStatic(modifiers) || Modifier.isTransient(modifiers) || field.isSynthetic()) {
                    continue;
                }
                field.setAccessible(true);
                fields.add(field);
            }
        }
        return fields;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        return fieldValues().equals(((BaseMetadataModel) o).fieldValues());
    }

    @Override
    public int hashCode() {
        return Objects.hash(getClass(), fieldValues());
    }

    @Override
    public String toString() {
        return name() + fieldValues();
    }
}
