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

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Declares the identity of a {@link MetadataModel} implementation.
 *
 * <p>The annotation is optional: without it the plugin name is derived from the class name and
 * the plugin is globally visible. See {@link ModelIdentity}.
 */
@Documented
@Retention(RetentionPolicy.RUNTIME)
@Target(ElementType.TYPE)
public @interface MetadataPlugin {

    /**
     * Plugin name, unique within its virtual organization. Empty derives it from the class name.
     */
    String name() default "";

    /**
     * Human-readable description. Empty uses a generic description.
     */
    String description() default "";

    /**
     * Owning virtual organization. Empty means globally visible.
     */
    String vo() default "";
}
