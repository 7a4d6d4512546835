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
package net.hydromatic.stanc.compile;

import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.hasItem;
import static org.hamcrest.Matchers.not;

import java.util.HashSet;
import java.util.Set;
import org.junit.jupiter.api.Test;

/** Tests for {@link DeprecatedNames} and {@link StanMathSignatures}. */
public class DeprecatedNamesTest {
  @Test void testRenameFunction() {
    assertThat(DeprecatedNames.renameFunction("multiply_log"),
        is("lmultiply"));
    assertThat(DeprecatedNames.renameFunction("binomial_coefficient_log"),
        is("lchoose"));
    assertThat(DeprecatedNames.renameFunction("integrate_ode"),
        is("integrate_ode_rk45"));
    assertThat(DeprecatedNames.renameFunction("exp"), is("exp"));
  }

  @Test void testRenameDistribution() {
    assertThat(DeprecatedNames.renameDistribution("normal_log"),
        is("normal_lpdf"));
    assertThat(DeprecatedNames.renameDistribution("normal_cdf_log"),
        is("normal_lcdf"));
    assertThat(DeprecatedNames.renameDistribution("normal_ccdf_log"),
        is("normal_lccdf"));
    assertThat(DeprecatedNames.renameDistribution("poisson_log"),
        is("poisson_lpmf"));
    assertThat(DeprecatedNames.renameDistribution("poisson_log_log"),
        is("poisson_log_lpmf"));
    assertThat(DeprecatedNames.renameDistribution("bernoulli_ccdf_log"),
        is("bernoulli_lccdf"));

    // distributions without a cumulative function have no "_cdf_log"
    assertThat(DeprecatedNames.isDeprecatedDistribution("dirichlet_log"),
        is(true));
    assertThat(DeprecatedNames.isDeprecatedDistribution("dirichlet_cdf_log"),
        is(false));
    assertThat(DeprecatedNames.renameDistribution("foo_log"), is("foo_log"));
  }

  @Test void testSuffixes() {
    assertThat(DeprecatedNames.hasDistributionSuffix("normal_lpdf"), is(true));
    assertThat(DeprecatedNames.hasDistributionSuffix("poisson_lpmf"),
        is(true));
    assertThat(DeprecatedNames.hasDistributionSuffix("normal_lcdf"), is(true));
    assertThat(DeprecatedNames.hasDistributionSuffix("normal_lccdf"),
        is(true));
    assertThat(DeprecatedNames.hasDistributionSuffix("normal_rng"),
        is(false));
    assertThat(DeprecatedNames.hasDistributionSuffix("normal_log"),
        is(false));

    assertThat(DeprecatedNames.withoutSuffix("normal_lpdf"), is("normal"));
    assertThat(DeprecatedNames.withoutSuffix("poisson_lpmf"), is("poisson"));
    assertThat(DeprecatedNames.withoutSuffix("normal_lcdf"),
        is("normal_lcdf"));
    assertThat(DeprecatedNames.withoutSuffix("normal"), is("normal"));
  }

  @Test void testDistributionNames() {
    assertThat(DeprecatedNames.isDistributionName("normal_lpdf"), is(true));
    assertThat(DeprecatedNames.isDistributionName("normal_log"), is(true));
    assertThat(DeprecatedNames.isDistributionName("normal_lcdf"), is(false));
    assertThat(DeprecatedNames.isProptoDistribution("normal_propto_lpdf"),
        is(true));
    assertThat(DeprecatedNames.isProptoDistribution("normal_lpdf"),
        is(false));
    assertThat(DeprecatedNames.stdlibDistributionName("normal_propto_lpdf"),
        is("normal_lpdf"));
    assertThat(DeprecatedNames.stdlibDistributionName("poisson_propto_lpmf"),
        is("poisson_lpmf"));
    assertThat(DeprecatedNames.stdlibDistributionName("foo_propto_log"),
        is("foo_log"));
    assertThat(DeprecatedNames.stdlibDistributionName("normal_lpdf"),
        is("normal_lpdf"));
  }

  /** Each distribution has a density or a mass function, not both, and
   * names are unique. */
  @Test void testSignatures() {
    final Set<String> names = new HashSet<>();
    for (StanMathSignatures.Distribution d : StanMathSignatures.DISTRIBUTIONS) {
      assertThat(d.name, names.add(d.name), is(true));
      final boolean lpdf =
          d.kinds.contains(StanMathSignatures.DistributionKind.LPDF);
      final boolean lpmf =
          d.kinds.contains(StanMathSignatures.DistributionKind.LPMF);
      assertThat(d.name, lpdf != lpmf, is(true));
    }
    assertThat(names, hasItem("bernoulli_logit_glm"));
    assertThat(names, hasItem("normal"));
    assertThat(names, not(hasItem("normal_lpdf")));
  }
}

// End DeprecatedNamesTest.java
