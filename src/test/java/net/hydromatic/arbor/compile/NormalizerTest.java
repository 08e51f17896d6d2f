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
package net.hydromatic.arbor.compile;

import net.hydromatic.arbor.TreebankFixtures;
import net.hydromatic.arbor.ast.Ast;
import net.hydromatic.arbor.parse.Parsers;
import net.hydromatic.arbor.store.CorpusSchema;

import org.junit.jupiter.api.Test;

import static net.hydromatic.arbor.Aq.aq;
import static net.hydromatic.arbor.Matchers.throwsA;

import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.junit.jupiter.api.Assertions.fail;

/** Tests {@link Normalizer}. */
public class NormalizerTest {
  @Test void testNegatedConstraint() {
    // A terminal has no "cat", so it satisfies the negation.
    aq("[!(cat=\"NP\")]").assertNormalize("[T | cat!=\"NP\"]");
    aq("[!(word=\"the\")]").assertNormalize("[NT | word!=\"the\"]");
    aq("[!(cat!=\"NP\")]").assertNormalize("[T | cat=\"NP\"]");
  }

  @Test void testNegatedRecord() {
    aq("[!T]").assertNormalize("[NT]");
    aq("[!!NT]").assertNormalize("[NT]");
  }

  @Test void testDeMorgan() {
    aq("[!(pos=\"DT\" & word=\"the\")]")
        .assertNormalize("[NT | pos!=\"DT\" | NT | word!=\"the\"]");
    aq("[!(T | cat=\"NP\")]")
        .assertNormalize("[NT & T | NT & cat!=\"NP\"]");
  }

  @Test void testValueSplitting() {
    aq("[cat=(\"NP\" | \"PP\")]")
        .assertNormalize("[cat=\"NP\" | cat=\"PP\"]");
    aq("[cat!=(\"NP\" | \"PP\")]")
        .assertNormalize("[cat=(!\"NP\" & !\"PP\")]");
    aq("[word=(/a.*/ & !\"ab\")]")
        .assertNormalize("[word=(/a.*/ & !\"ab\")]");
  }

  @Test void testDistribution() {
    aq("[(cat=\"NP\" | cat=\"PP\") & !T]")
        .assertNormalize("[cat=\"NP\" & NT | cat=\"PP\" & NT]");
    aq("[(pos=\"DT\" | pos=\"NN\") & (word=\"a\" | word=\"b\")]")
        .assertNormalize("[pos=\"DT\" & word=\"a\""
            + " | pos=\"DT\" & word=\"b\""
            + " | pos=\"NN\" & word=\"a\""
            + " | pos=\"NN\" & word=\"b\"]");
    aq("[T & (pos=\"DT\" & word=\"a\")]")
        .assertNormalize("[T & pos=\"DT\" & word=\"a\"]");
  }

  @Test void testQuery() {
    aq("#a:[!T] > [cat=(\"NP\" | \"PP\")] & root(#a)")
        .assertNormalize("#a:[NT] > [cat=\"NP\" | cat=\"PP\"] & root(#a)");
    aq("[]").assertNormalize("[]");
  }

  @Test void testUndefinedFeatureInNegation() {
    final CorpusSchema schema =
        TreebankFixtures.treebank(TreebankFixtures.DOG).schema();
    final Normalizer normalizer = new Normalizer(schema);
    final Ast.Query query = Parsers.parse("[!(lemma=\"go\")]");
    try {
      normalizer.normalizeQuery(query);
      fail("expected error");
    } catch (UndefinedNameException e) {
      assertThat(e, throwsA("feature 'lemma' is not defined"));
      assertThat(e.kind, is(UndefinedNameException.Kind.FEATURE));
    }
  }
}

// End NormalizerTest.java
