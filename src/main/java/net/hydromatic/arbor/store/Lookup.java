/*
 * Licensed to Julian Hyde under one or more contributor license
 * agreements.  See the NOTICE file distributed with this work
 * for additional information regarding copyright ownership.
 * Julian Hyde licenses this file to you under the Apache
 * License, Version 2.0 (the "License"); you may not use this
 * file except in compliance with the License.  You may obtain a
 * copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND,
 * either express or implied.  See the License for the specific
 * language governing permissions and limitations under the
 * License.
 */
package net.hydromatic.arbor.store;

import com.google.common.collect.ImmutableList;

import java.util.List;
import java.util.Objects;

/** One conjunction of conditions that a node must satisfy. A search is a
 * union of lookups. */
public class Lookup {
  public final ImmutableList<FeatureMatch> features;
  public final ImmutableList<NodeFilter> filters;

  public Lookup(List<FeatureMatch> features, List<NodeFilter> filters) {
    this.features = ImmutableList.copyOf(features);
    this.filters = ImmutableList.copyOf(filters);
  }

  @Override public String toString() {
    return "Lookup{features=" + features + ", filters=" + filters + "}";
  }

  @Override public int hashCode() {
    return Objects.hash(features, filters);
  }

  @Override public boolean equals(Object o) {
    return o == this
        || o instanceof Lookup
        && features.equals(((Lookup) o).features)
        && filters.equals(((Lookup) o).filters);
  }
}

// End Lookup.java
