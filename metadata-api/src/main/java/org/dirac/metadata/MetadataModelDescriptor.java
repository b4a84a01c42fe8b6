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

import com.google.common.base.Strings;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Metadata model descriptor - the request used to resolve and instantiate a registered model.
 *
 * <p>A descriptor names the plugin to resolve ({@code metadata_class}), optionally narrows the
 * lookup to one virtual organization ({@code vo}) and carries the free-form parameters that are
 * bound onto the model's declared fields.
 *
 * <p>Example job description fragment:
 * <pre>{@code
 * metadata:
 *   metadata_class: QueryBased
 *   vo: lhcb
 *   campaign: Run3
 *   site: CERN
 * }</pre>
 *
 * <p>Design principles:
 * <ul>
 *   <li>Pure data, no behavior</li>
 *   <li>Immutable after creation (use builder for construction)</li>
 *   <li>A blank vo means "no vo", lookup then targets the global scope</li>
 * </ul>
 */
public final class MetadataModelDescriptor {

    /** Reserved key holding the plugin name in a flat mapping */
    public static final String METADATA_CLASS_KEY = "metadata_class";

    /** Reserved key holding the virtual organization in a flat mapping */
    public static final String VO_KEY = "vo";

    /** Registered plugin name */
    private final String metadataClass;

    /** Owning virtual organization, null for the global scope */
    private final String vo;

    /** Constructor arguments for the resolved model */
    private final Map<String, Object> parameters;

    private MetadataModelDescriptor(Builder builder) {
        Objects.requireNonNull(builder.metadataClass, "metadataClass is required");
        String trimmed = builder.metadataClass.trim();
        if (trimmed.isEmpty()) {
            throw new IllegalArgumentException("metadataClass is blank");
        }
        this.metadataClass = trimmed;
        this.vo = Strings.emptyToNull(builder.vo == null ? null : builder.vo.trim());
        this.parameters = Collections.unmodifiableMap(new LinkedHashMap<>(builder.parameters));
    }

    /**
     * Builds a descriptor from one flat mapping.
     *
     * <p>{@value #METADATA_CLASS_KEY} and {@value #VO_KEY} are read as the descriptor's own
     * attributes, every other entry becomes a parameter.
     *
     * @param values flat mapping
     * @return descriptor
     * @throws NullPointerException if {@value #METADATA_CLASS_KEY} is missing
     */
    public static MetadataModelDescriptor fromMap(Map<String, ?> values) {
        Objects.requireNonNull(values, "values");
        Builder builder = builder();
        for (Map.Entry<String, ?> entry : values.entrySet()) {
            String key = entry.getKey();
            Object value = entry.getValue();
            if (METADATA_CLASS_KEY.equals(key)) {
                builder.metadataClass(value == null ? null : value.toString());
            } else if (VO_KEY.equals(key)) {
                builder.vo(value == null ? null : value.toString());
            } else {
                builder.parameter(key, value);
            }
        }
        return builder.build();
    }

    public String getMetadataClass() {
        return metadataClass;
    }

    public Optional<String> getVo() {
        return Optional.ofNullable(vo);
    }

    /**
     * Returns the parameters.
     *
     * @return immutable map of parameters, in insertion order
     */
    public Map<String, Object> getParameters() {
        return parameters;
    }

    /**
     * Returns the descriptor as one flat mapping, the inverse of {@link #fromMap(Map)}.
     *
     * @return flat mapping
     */
    public Map<String, Object> toMap() {
        Map<String, Object> values = new LinkedHashMap<>();
        values.put(METADATA_CLASS_KEY, metadataClass);
        if (vo != null) {
            values.put(VO_KEY, vo);
        }
        values.putAll(parameters);
        return values;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        MetadataModelDescriptor that = (MetadataModelDescriptor) o;
        return metadataClass.equals(that.metadataClass)
                && Objects.equals(vo, that.vo)
                && parameters.equals(that.parameters);
    }

    @Override
    public int hashCode() {
        return Objects.hash(metadataClass, vo, parameters);
    }

    @Override
    public String toString() {
        return "MetadataModelDescriptor{"
                + "metadataClass='" + metadataClass + '\''
                + ", vo=" + (vo == null ? "<global>" : "'" + vo + "'")
                + ", parameters=" + parameters.keySet()
                + '}';
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Creates a builder initialized with values from this descriptor.
     *
     * @return builder with copied values
     */
    public Builder toBuilder() {
        return new Builder()
                .metadataClass(metadataClass)
                .vo(vo)
                .parameters(parameters);
    }

    /**
     * Builder for {@link MetadataModelDescriptor}.
     */
    public static final class Builder {
        private String metadataClass;
        private String vo;
        private Map<String, Object> parameters = new LinkedHashMap<>();

        private Builder() {
        }

        public Builder metadataClass(String metadataClass) {
            this.metadataClass = metadataClass;
            return this;
        }

        public Builder vo(String vo) {
            this.vo = vo;
            return this;
        }

        /**
         * Replaces all parameters.
         *
         * @param parameters field name to value
         * @return this builder
         */
        public Builder parameters(Map<String, ?> parameters) {
            this.parameters = parameters != null ? new LinkedHashMap<>(parameters) : new LinkedHashMap<>();
            return this;
        }

        public Builder parameter(String name, Object value) {
            Objects.requireNonNull(name, "parameter name");
            this.parameters.put(name, value);
            return this;
        }

        /**
         * Builds the descriptor.
         *
         * @return built descriptor
         * @throws NullPointerException if metadataClass is null
         * @throws IllegalArgumentException if metadataClass is blank
         */
        public MetadataModelDescriptor build() {
            return new MetadataModelDescriptor(this);
        }
    }
}
