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

import org.dirac.metadata.PluginKey;

import com.google.common.base.Strings;

import java.util.Objects;
import java.util.Optional;

/**
 * Declared identity of a metadata model class: name, description and owning virtual organization.
 *
 * <p>Name resolution:
 * <ol>
 *   <li>{@link MetadataPlugin#name()} when set</li>
 *   <li>otherwise the simple class name, minus a trailing {@value #NAME_SUFFIX} when
 *       something remains ({@code UserMetadata} becomes {@code User})</li>
 * </ol>
 */
public final class ModelIdentity {

    static final String NAME_SUFFIX = "Metadata";

    private static final ClassValue<ModelIdentity> CACHE = new ClassValue<ModelIdentity>() {
        @Override
        protected ModelIdentity computeValue(Class<?> type) {
            return compute(type);
        }
    };

    private final String name;
    private final String description;
    private final String vo;

    private ModelIdentity(String name, String description, String vo) {
        this.name = name;
        this.description = description;
        this.vo = vo;
    }

    /**
     * Returns the identity of a model class.
     *
     * @param modelType model class
     * @return identity
     */
    public static ModelIdentity of(Class<?> modelType) {
        Objects.requireNonNull(modelType, "modelType");
        return CACHE.get(modelType);
    }

    private static ModelIdentity compute(Class<?> modelType) {
        MetadataPlugin annotation = modelType.getAnnotation(MetadataPlugin.class);
        String declaredName = annotation == null ? null : Strings.emptyToNull(annotation.name().trim());
        String name = declaredName != null ? declaredName : deriveName(modelType);
        String declaredDescription = annotation == null ? null : Strings.emptyToNull(annotation.description().trim());
        String description = declaredDescription != null ? declaredDescription : "Metadata model: " + name;
        String vo = annotation == null ? null : Strings.emptyToNull(annotation.vo().trim());
        return new ModelIdentity(name, description, vo);
    }

    static String deriveName(Class<?> modelType) {
        String simpleName = modelType.getSimpleName();
        if (simpleName.isEmpty()) {
            // anonymous classes have no simple name
            String fullName = modelType.getName();
            simpleName = fullName.substring(fullName.lastIndexOf('.') + 1);
        }
        if (simpleName.endsWith(NAME_SUFFIX) && simpleName.length() > NAME_SUFFIX.length()) {
            return simpleName.substring(0, simpleName.length() - NAME_SUFFIX.length());
        }
        return simpleName;
    }

    public String getName() {
        return name;
    }

    public String getDescription() {
        return description;
    }

    public Optional<String> getVo() {
        return Optional.ofNullable(vo);
    }

    public PluginKey toKey() {
        return PluginKey.of(vo, name);
    }

    @Override
    public String toString() {
        return "ModelIdentity{name='" + name + "', vo=" + (vo == null ? PluginKey.GLOBAL : vo) + '}';
    }
}
