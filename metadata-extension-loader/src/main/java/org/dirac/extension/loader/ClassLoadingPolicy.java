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

package org.dirac.extension.loader;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;

/**
 * Classloading policy for plugin directories.
 *
 * <p>Mandatory parent-first prefixes always contain
 * {@link ChildFirstClassLoader#DEFAULT_PARENT_FIRST_PACKAGES}.
 * Callers may append the prefixes of their own contract types.
 */
public final class ClassLoadingPolicy {

    private final List<String> parentFirstPrefixes;

    public ClassLoadingPolicy(List<String> additionalParentFirstPrefixes) {
        LinkedHashSet<String> prefixes = new LinkedHashSet<>(ChildFirstClassLoader.DEFAULT_PARENT_FIRST_PACKAGES);
        if (additionalParentFirstPrefixes != null) {
            for (String prefix : additionalParentFirstPrefixes) {
                String trimmed = prefix == null ? "" : prefix.trim();
                if (!trimmed.isEmpty()) {
                    prefixes.add(trimmed);
                }
            }
        }
        this.parentFirstPrefixes = Collections.unmodifiableList(new ArrayList<>(prefixes));
    }

    public static ClassLoadingPolicy defaultPolicy() {
        return new ClassLoadingPolicy(null);
    }

    /**
     * Policy that also loads the package of {@code contractType} parent-first.
     *
     * @param contractType type plugin classes must implement
     * @return policy
     */
    public static ClassLoadingPolicy forContract(Class<?> contractType) {
        String packageName = contractType.getPackage() == null ? "" : contractType.getPackage().getName();
        if (packageName.isEmpty()) {
            return new ClassLoadingPolicy(Collections.singletonList(contractType.getName()));
        }
        return new ClassLoadingPolicy(Collections.singletonList(packageName + "."));
    }

    public List<String> toParentFirstPackages() {
        return parentFirstPrefixes;
    }
}
