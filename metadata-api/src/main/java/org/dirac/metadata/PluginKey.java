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
import java.util.Optional;

/**
 * Identity of a registered metadata model: owning virtual organization plus plugin name.
 *
 * <p>Plugins without a virtual organization live in the {@link #GLOBAL} scope.
 */
public final class PluginKey {

    /** Scope label used for plugins registered without a virtual organization */
    public static final String GLOBAL = "<global>";

    private final String vo;
    private final String name;

    private PluginKey(String vo, String name) {
        this.vo = vo;
        this.name = name;
    }

    /**
     * Creates a key.
     *
     * @param vo virtual organization, null or blank for the global scope
     * @param name plugin name
     * @return key
     */
    public static PluginKey of(String vo, String name) {
        Objects.requireNonNull(name, "name");
        String trimmedName = name.trim();
        if (trimmedName.isEmpty()) {
            throw new IllegalArgumentException("name is blank");
        }
        String trimmedVo = vo == null ? null : vo.trim();
        return new PluginKey(trimmedVo == null || trimmedVo.isEmpty() ? null : trimmedVo, trimmedName);
    }

    public static PluginKey global(String name) {
        return of(null, name);
    }

    public Optional<String> getVo() {
        return Optional.ofNullable(vo);
    }

    public String getName() {
        return name;
    }

    public boolean isGlobal() {
        return vo == null;
    }

    /**
     * Returns the scope label: the vo, or {@link #GLOBAL}.
     *
     * @return scope label
     */
    public String scope() {
        return vo == null ? GLOBAL : vo;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        PluginKey that = (PluginKey) o;
        return Objects.equals(vo, that.vo) && name.equals(that.name);
    }

    @Override
    public int hashCode() {
        return Objects.hash(vo, name);
    }

    @Override
    public String toString() {
        return "(" + scope() + ", " + name + ")";
    }
}
