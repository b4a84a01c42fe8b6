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
import org.dirac.metadata.registry.fixture.TestPluginMetadata;
import org.dirac.metadata.registry.fixture.TypedModel;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Unit tests for {@link ModelBinder}.
 */
@DisplayName("ModelBinder Unit Tests")
public class ModelBinderTest {

    private final ModelBinder binder = new ModelBinder();

    @Test
    @DisplayName("UT-BIND-001: Values of every declared type are bound, including inherited fields")
    void testBindTypedValues() throws Exception {
        // Given
        Map<String, Object> parameters = new LinkedHashMap<>();
        parameters.put("count", 3);
        parameters.put("enabled", true);
        parameters.put("ratio", 2);
        parameters.put("label", "run3");
        parameters.put("tags", Arrays.asList("a", "b"));
        parameters.put("shared", "overridden");

        // When
        TypedModel model = binder.bind(TypedModel.class, parameters);

        // Then
        Assertions.assertEquals(3, model.getCount());
        Assertions.assertTrue(model.isEnabled());
        Assertions.assertEquals(2.0, model.getRatio());
        Assertions.assertEquals("run3", model.getLabel());
        Assertions.assertEquals(Arrays.asList("a", "b"), model.getTags());
        Assertions.assertEquals("overridden", model.getShared());
    }

    @Test
    @DisplayName("UT-BIND-002: Empty or null parameters keep every default")
    void testBindDefaults() throws Exception {
        TypedModel fromEmpty = binder.bind(TypedModel.class, Collections.emptyMap());
        TypedModel fromNull = binder.bind(TypedModel.class, null);

        Assertions.assertEquals(1, fromEmpty.getCount());
        Assertions.assertFalse(fromEmpty.isEnabled());
        Assertions.assertNull(fromEmpty.getLabel());
        Assertions.assertEquals("shared", fromEmpty.getShared());
        Assertions.assertEquals(fromEmpty, fromNull);
    }

    @Test
    @DisplayName("UT-BIND-003: Every unknown key is reported, sorted, with the plugin name")
    void testUnknownKeysReported() {
        // Given - camelCase field names are not parameter names
        Map<String, Object> parameters = new HashMap<>();
        parameters.put("zeta", 1);
        parameters.put("testParam", "x");
        parameters.put("alpha", 2);

        // When
        ModelValidationException exception = Assertions.assertThrows(ModelValidationException.class,
                () -> binder.bind(TestPluginMetadata.class, parameters));

        // Then
        Assertions.assertEquals(Arrays.asList("alpha", "testParam", "zeta"), exception.getUnknownFields());
        Assertions.assertEquals("TestPlugin", exception.getPluginName());
        Assertions.assertTrue(exception.getMessage().contains("test_param"));
    }

    @Test
    @DisplayName("UT-BIND-004: Values that do not fit the declared type are rejected")
    void testTypeMismatch() {
        ModelValidationException notANumber = Assertions.assertThrows(ModelValidationException.class,
                () -> binder.bind(TypedModel.class, Collections.singletonMap("count", "abc")));
        Assertions.assertTrue(notANumber.getMessage().contains("count"), notANumber.getMessage());
        Assertions.assertEquals("typed", notANumber.getPluginName());
        Assertions.assertTrue(notANumber.getUnknownFields().isEmpty());

        Assertions.assertThrows(ModelValidationException.class,
                () -> binder.bind(TypedModel.class, Collections.singletonMap("count", 1.5)));
        Assertions.assertThrows(ModelValidationException.class,
                () -> binder.bind(TypedModel.class, Collections.singletonMap("count", null)));
        Assertions.assertThrows(ModelValidationException.class,
                () -> binder.bind(TypedModel.class,
                        Collections.singletonMap("tags", Collections.singletonMap("k", 1))));

        ModelValidationException numberAsLabel = Assertions.assertThrows(ModelValidationException.class,
                () -> binder.bind(TypedModel.class, Collections.singletonMap("label", 5)));
        Assertions.assertTrue(numberAsLabel.getMessage().contains("label"), numberAsLabel.getMessage());
        Assertions.assertThrows(ModelValidationException.class,
                () -> binder.bind(TypedModel.class, Collections.singletonMap("label", 2.5)));
        Assertions.assertThrows(ModelValidationException.class,
                () -> binder.bind(TypedModel.class, Collections.singletonMap("label", true)));
    }

    @Test
    @DisplayName("UT-BIND-005: Schema lists snake_case fields with declared types and defaults")
    void testDescribe() throws Exception {
        // When
        ModelSchema schema = binder.describe(TypedModel.class);

        // Then
        Assertions.assertEquals("typed", schema.getPluginName());
        Assertions.assertEquals("test_exp", schema.getVo().get());
        List<String> names = schema.getFields().stream().map(ModelField::getName).collect(Collectors.toList());
        Assertions.assertTrue(names.containsAll(Arrays.asList("shared", "count", "enabled", "ratio", "label", "tags")));
        Assertions.assertEquals(6, names.size());

        ModelField count = schema.getField("count").get();
        Assertions.assertEquals(int.class, count.getType());
        Assertions.assertEquals(1, count.getDefaultValue());
        Assertions.assertEquals("java.util.List<java.lang.String>", schema.getField("tags").get().getTypeName());
        Assertions.assertNull(schema.getField("label").get().getDefaultValue());
        Assertions.assertFalse(schema.getField("missing").isPresent());
    }

    @Test
    @DisplayName("UT-BIND-006: Parameters of an instance bind back to an equal instance")
    void testToParameters() throws Exception {
        // Given
        TestPluginMetadata original = binder.bind(TestPluginMetadata.class,
                Collections.singletonMap("test_param", "custom"));

        // When
        Map<String, Object> parameters = binder.toParameters(original);

        // Then
        Assertions.assertEquals(Collections.singletonMap("test_param", "custom"), parameters);
        Assertions.assertEquals(original, binder.bind(TestPluginMetadata.class, parameters));
        Assertions.assertEquals("TestPlugin{testParam=custom}", original.toString());
    }
}
