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
package net.hydromatic.arbor.eval;

import com.google.common.base.CaseFormat;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;

import static net.hydromatic.arbor.Matchers.throwsA;

import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.CoreMatchers.nullValue;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.junit.jupiter.api.Assertions.fail;

/** Tests {@link Prop}. */
public class PropTest {
  /** Runs a task that sets a property, and checks the error it throws. */
  private static void assertSetFails(Runnable runnable, String message) {
    try {
      runnable.run();
      fail("expected error");
    } catch (IllegalArgumentException e) {
      assertThat(e, throwsA(message));
    }
  }

  @Test void testNames() {
    for (Prop prop : Prop.values()) {
      assertThat(prop.camelName,
          is(CaseFormat.UPPER_UNDERSCORE.to(CaseFormat.LOWER_CAMEL,
              prop.name())));
      assertThat(Prop.lookup(prop.name()), is(prop));
      assertThat(Prop.lookup(prop.camelName), is(prop));
    }
    assertThat(Prop.BY_NAME.size(), is(2 * Prop.values().length));
    assertThat(Prop.BY_CAMEL_NAME.get(0), is(Prop.JOIN_ORDER_SAMPLE_SIZE));
    assertSetFails(() -> Prop.lookup("threads"), "property threads not found");
  }

  @Test void testDefaults() {
    final Map<Prop, Object> map = new HashMap<>();
    assertThat(Prop.PARALLELISM.intValue(map), is(1));
    assertThat(Prop.JOIN_ORDER_SAMPLE_SIZE.intValue(map), is(100));
    assertThat(Prop.SHARE_CURSORS.booleanValue(map), is(true));
    assertThat(Prop.SORT_RESULTS.booleanValue(map), is(false));
    assertThat(Prop.RESULT_QUEUE_CAPACITY.intValue(map), is(64));
    assertThat(map.isEmpty(), is(true));
  }

  @Test void testSet() {
    final Map<Prop, Object> map = new HashMap<>();
    Prop.PARALLELISM.set(map, 8);
    assertThat(Prop.PARALLELISM.intValue(map), is(8));
    Prop.SHARE_CURSORS.set(map, false);
    assertThat(Prop.SHARE_CURSORS.booleanValue(map), is(false));
    assertThat(Prop.SHARE_CURSORS.remove(map), is(false));
    assertThat(Prop.SHARE_CURSORS.booleanValue(map), is(true));
    assertThat(Prop.SHARE_CURSORS.remove(map), nullValue());

    assertSetFails(() -> Prop.PARALLELISM.set(map, null),
        "property parallelism is required");
    assertSetFails(() -> Prop.PARALLELISM.set(map, "8"),
        "value for property parallelism must have type Integer");
    assertSetFails(() -> Prop.JOIN_ORDER_SAMPLE_SIZE.set(map, -1),
        "value for property joinOrderSampleSize must not be negative");
    assertSetFails(() -> Prop.SORT_RESULTS.intValue(map),
        "invalid type class java.lang.Boolean for property sortResults");
    assertThat(Prop.PARALLELISM.intValue(map), is(8));
  }

  @Test void testSetLenient() {
    final Map<Prop, Object> map = new HashMap<>();
    Prop.SORT_RESULTS.setLenient(map, "TRUE");
    assertThat(Prop.SORT_RESULTS.booleanValue(map), is(true));
    Prop.RESULT_QUEUE_CAPACITY.setLenient(map, " 8 ");
    assertThat(Prop.RESULT_QUEUE_CAPACITY.intValue(map), is(8));
    Prop.PARALLELISM.setLenient(map, 0);
    assertThat(Prop.PARALLELISM.intValue(map), is(0));

    assertSetFails(() -> Prop.SORT_RESULTS.setLenient(map, "yes"),
        "value for property sortResults must be true or false");
    assertSetFails(() -> Prop.PARALLELISM.setLenient(map, "many"),
        "value for property parallelism must be an integer");
    assertSetFails(() -> Prop.PARALLELISM.setLenient(map, "-2"),
        "value for property parallelism must not be negative");
  }
}

// End PropTest.java
