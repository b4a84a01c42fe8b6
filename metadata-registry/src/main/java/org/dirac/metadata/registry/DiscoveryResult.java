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

import org.dirac.extension.loader.LoadFailure;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Outcome of one discovery run: the plugins it registered and everything it skipped.
 */
public final class DiscoveryResult {

    private final List<String> registered;
    private final List<LoadFailure> failures;
    private final int locationsScanned;

    public DiscoveryResult(List<String> registered, List<LoadFailure> failures, int locationsScanned) {
        this.registered = Collections.unmodifiableList(new ArrayList<>(Objects.requireNonNull(registered,
                "registered")));
        this.failures = Collections.unmodifiableList(new ArrayList<>(Objects.requireNonNull(failures, "failures")));
        this.locationsScanned = locationsScanned;
    }

    /**
     * Returns the names of the newly registered plugins, in registration order.
     *
     * @return plugin names
     */
    public List<String> getRegistered() {
        return registered;
    }

    public int getRegisteredCount() {
        return registered.size();
    }

    public List<LoadFailure> getFailures() {
        return failures;
    }

    public boolean hasFailures() {
        return !failures.isEmpty();
    }

    public int getLocationsScanned() {
        return locationsScanned;
    }

    @Override
    public String toString() {
        return "DiscoveryResult{registered=" + registered + ", failures=" + failures.size()
                + ", locationsScanned=" + locationsScanned + '}';
    }
}
