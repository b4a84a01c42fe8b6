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
import java.util.List;
import java.util.Objects;

/**
 * Result summary of one scan over a list of plugin sources.
 */
public final class LoadReport<T> {

    private final List<PluginHandle<T>> successes;
    private final List<LoadFailure> failures;
    private final int locationsScanned;

    public LoadReport(List<PluginHandle<T>> successes, List<LoadFailure> failures, int locationsScanned) {
        this.successes = Collections.unmodifiableList(new ArrayList<>(Objects.requireNonNull(successes, "successes")));
        this.failures = Collections.unmodifiableList(new ArrayList<>(Objects.requireNonNull(failures, "failures")));
        this.locationsScanned = locationsScanned;
    }

    public List<PluginHandle<T>> getSuccesses() {
        return successes;
    }

    public List<LoadFailure> getFailures() {
        return failures;
    }

    public int getLocationsScanned() {
        return locationsScanned;
    }

    /**
     * All discovered types, in source order.
     *
     * @return discovered types
     */
    public List<Class<? extends T>> getTypes() {
        List<Class<? extends T>> types = new ArrayList<>();
        for (PluginHandle<T> handle : successes) {
            types.addAll(handle.getTypes());
        }
        return types;
    }
}
