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

import org.dirac.metadata.ModelValidationException;
import org.dirac.metadata.spi.MetadataModel;
import org.dirac.metadata.spi.ModelIdentity;

import com.fasterxml.jackson.annotation.JsonAutoDetect;
import com.fasterxml.jackson.annotation.PropertyAccessor;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.BeanDescription;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.cfg.CoercionAction;
import com.fasterxml.jackson.databind.cfg.CoercionInputShape;
import com.fasterxml.jackson.databind.introspect.AnnotatedField;
import com.fasterxml.jackson.databind.introspect.BeanPropertyDefinition;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.databind.type.LogicalType;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Binds descriptor parameters onto the declared fields of a metadata model.
 *
 * <p>Binding rules:
 * <ul>
 *   <li>Parameter names are the snake_case form of the Java field names
 *       ({@code testParam} is set by {@code test_param}).</li>
 *   <li>Fields absent from the parameters keep the value of their initializer.</li>
 *   <li>Values must fit the declared type: no string-to-number, number-to-string,
 *       boolean-to-string or float-to-int coercion, no null for primitives.</li>
 *   <li>Parameters matching no declared field are rejected, every offending name is reported.</li>
 * </ul>
 *
 * <p>Only instance fields take part in binding. Getters and setters are ignored, so hook methods
 * such as {@link MetadataModel#name()} never surface as parameters.
 */
public class ModelBinder {

    private static final TypeReference<LinkedHashMap<String, Object>> PARAMETERS_TYPE =
            new TypeReference<LinkedHashMap<String, Object>>() {
            };

    private final ObjectMapper mapper;

    public ModelBinder() {
        this(JsonMapper.builder()
                .propertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE)
                .visibility(PropertyAccessor.GETTER, JsonAutoDetect.Visibility.NONE)
                .visibility(PropertyAccessor.IS_GETTER, JsonAutoDetect.Visibility.NONE)
                .visibility(PropertyAccessor.SETTER, JsonAutoDetect.Visibility.NONE)
                .visibility(PropertyAccessor.FIELD, JsonAutoDetect.Visibility.ANY)
                .disable(MapperFeature.ALLOW_COERCION_OF_SCALARS)
                .enable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                .enable(DeserializationFeature.FAIL_ON_NULL_FOR_PRIMITIVES)
                .disable(DeserializationFeature.ACCEPT_FLOAT_AS_INT)
                .withCoercionConfig(LogicalType.Textual, cfg -> cfg
                        .setCoercion(CoercionInputShape.Integer, CoercionAction.Fail)
                        .setCoercion(CoercionInputShape.Float, CoercionAction.Fail)
                        .setCoercion(CoercionInputShape.Boolean, CoercionAction.Fail))
                .disable(SerializationFeature.FAIL_ON_EMPTY_BEANS)
                .build());
    }

    ModelBinder(ObjectMapper mapper) {
        this.mapper = Objects.requireNonNull(mapper, "mapper");
    }

    /**
     * Creates a model instance from descriptor parameters.
     *
     * @param modelClass model class
     * @param parameters parameter name to value, may be empty
     * @return new model instance
     * @throws ModelValidationException if a parameter is unknown or does not fit its field
     */
    public <T extends MetadataModel> T bind(Class<T> modelClass, Map<String, ?> parameters)
            throws ModelValidationException {
        Objects.requireNonNull(modelClass, "modelClass");
        Map<String, ?> values = parameters != null ? parameters : Collections.<String, Object>emptyMap();
        String pluginName = ModelIdentity.of(modelClass).getName();

        List<String> known = parameterNames(modelClass);
        List<String> unknown = values.keySet().stream()
                .map(String::valueOf)
                .filter(key -> !known.contains(key))
                .sorted()
                .collect(Collectors.toList());
        if (!unknown.isEmpty()) {
            throw ModelValidationException.unknownFields(pluginName, unknown, known);
        }

        try {
            return mapper.convertValue(values, modelClass);
        } catch (IllegalArgumentException e) {
            throw new ModelValidationException(pluginName, describeFailure(pluginName, e), e);
        }
    }

    /**
     * Describes the declared fields of a model class with their defaults.
     *
     * @param modelClass model class
     * @return schema
     * @throws ModelValidationException if the default instance cannot be created
     */
    public ModelSchema describe(Class<? extends MetadataModel> modelClass) throws ModelValidationException {
        Objects.requireNonNull(modelClass, "modelClass");
        ModelIdentity identity = ModelIdentity.of(modelClass);
        Map<String, Object> defaults = toParameters(bind(modelClass, Collections.emptyMap()));

        List<ModelField> fields = new ArrayList<>();
        for (BeanPropertyDefinition property : properties(modelClass)) {
            AnnotatedField field = property.getField();
            if (field == null) {
                continue;
            }
            fields.add(new ModelField(property.getName(), field.getAnnotated().getGenericType(),
                    defaults.get(property.getName())));
        }
        return new ModelSchema(identity.getName(), identity.getDescription(), identity.getVo().orElse(null),
                modelClass, fields);
    }

    /**
     * Returns the field values of a model instance keyed by parameter name.
     *
     * <p>Binding the result onto the same class yields an equal instance.
     *
     * @param model model instance
     * @return parameter name to value, in declaration order
     */
    public Map<String, Object> toParameters(MetadataModel model) {
        Objects.requireNonNull(model, "model");
        try {
            return mapper.convertValue(model, PARAMETERS_TYPE);
        } catch (IllegalArgumentException e) {
            throw new IllegalStateException("Cannot read fields of metadata plugin " + model.name(), e);
        }
    }

    /**
     * Returns the parameter names a model class accepts.
     *
     * @param modelClass model class
     * @return parameter names in declaration order
     */
    public List<String> parameterNames(Class<? extends MetadataModel> modelClass) {
        return properties(modelClass).stream()
                .filter(BeanPropertyDefinition::hasField)
                .map(BeanPropertyDefinition::getName)
                .collect(Collectors.toList());
    }

    private List<BeanPropertyDefinition> properties(Class<?> modelClass) {
        BeanDescription description = mapper.getDeserializationConfig()
                .introspect(mapper.constructType(modelClass));
        return description.findProperties();
    }

    private static String describeFailure(String pluginName, IllegalArgumentException e) {
        if (!(e.getCause() instanceof JsonMappingException)) {
            return "Invalid parameters for metadata plugin " + pluginName + ": " + e.getMessage();
        }
        JsonMappingException mappingException = (JsonMappingException) e.getCause();
        String field = mappingException.getPath().stream()
                .map(JsonMappingException.Reference::getFieldName)
                .filter(Objects::nonNull)
                .collect(Collectors.joining("."));
        if (field.isEmpty()) {
            return "Invalid parameters for metadata plugin " + pluginName + ": "
                    + mappingException.getOriginalMessage();
        }
        return "Invalid value for field " + field + " of metadata plugin " + pluginName + ": "
                + mappingException.getOriginalMessage();
    }
}
