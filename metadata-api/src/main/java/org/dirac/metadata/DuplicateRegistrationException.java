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

import java.util.Objects;

/**
 * Thrown when a plugin is registered at an occupied key without override.
 */
public class DuplicateRegistrationException extends MetadataRegistryException {

    private final PluginKey key;

    public DuplicateRegistrationException(PluginKey key, Class<?> existing, Class<?> rejected) {
        super("Metadata plugin " + Objects.requireNonNull(key, "key") + " is already registered by "
                + (existing == null ? "<unknown>" : existing.getName())
                + "; refusing " + (rejected == null ? "<unknown>" : rejected.getName())
                + " without override");
        this.key = key;
    }

    public PluginKey getKey() {
        return key;
    }
}
