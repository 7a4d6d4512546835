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

import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Sets;
import java.util.Set;

/** Distributions in the Stan math library, and the kinds of function that
 * each provides. */
public abstract class StanMathSignatures {
  private StanMathSignatures() {}

  private static final ImmutableList<DistributionKind> FULL_LPDF =
      ImmutableList.of(DistributionKind.LPDF, DistributionKind.RNG,
          DistributionKind.CCDF, DistributionKind.CDF);

  private static final ImmutableList<DistributionKind> FULL_LPMF =
      ImmutableList.of(DistributionKind.LPMF, DistributionKind.RNG,
          DistributionKind.CCDF, DistributionKind.CDF);

  private static final ImmutableList<DistributionKind> LPDF_RNG =
      ImmutableList.of(DistributionKind.LPDF, DistributionKind.RNG);

  private static final ImmutableList<DistributionKind> LPMF_RNG =
      ImmutableList.of(DistributionKind.LPMF, DistributionKind.RNG);

  private static final ImmutableList<DistributionKind> LPDF =
      ImmutableList.of(DistributionKind.LPDF);

  private static final ImmutableList<DistributionKind> LPMF =
      ImmutableList.of(DistributionKind.LPMF);

  /** All distributions. */
  public static final ImmutableList<Distribution> DISTRIBUTIONS =
      ImmutableList.<Distribution>builder()
          // discrete
          .add(new Distribution(FULL_LPMF, "bernoulli"))
          .add(new Distribution(LPMF_RNG, "bernoulli_logit"))
          .add(new Distribution(LPMF, "bernoulli_logit_glm"))
          .add(new Distribution(FULL_LPMF, "beta_binomial"))
          .add(new Distribution(FULL_LPMF, "binomial"))
          .add(new Distribution(LPMF, "binomial_logit"))
          .add(new Distribution(LPMF_RNG, "categorical"))
          .add(new Distribution(LPMF_RNG, "categorical_logit"))
          .add(new Distribution(LPMF, "categorical_logit_glm"))
          .add(new Distribution(FULL_LPMF, "discrete_range"))
          .add(new Distribution(LPMF_RNG, "hypergeometric"))
          .add(new Distribution(LPMF_RNG, "multinomial"))
          .add(new Distribution(FULL_LPMF, "neg_binomial"))
          .add(new Distribution(FULL_LPMF, "neg_binomial_2"))
          .add(new Distribution(LPMF_RNG, "neg_binomial_2_log"))
          .add(new Distribution(LPMF, "neg_binomial_2_log_glm"))
          .add(new Distribution(LPMF_RNG, "ordered_logistic"))
          .add(new Distribution(LPMF_RNG, "ordered_probit"))
          .add(new Distribution(FULL_LPMF, "poisson"))
          .add(new Distribution(LPMF_RNG, "poisson_log"))
          .add(new Distribution(LPMF, "poisson_log_glm"))
          // continuous
          .add(new Distribution(FULL_LPDF, "beta"))
          .add(new Distribution(FULL_LPDF, "cauchy"))
          .add(new Distribution(FULL_LPDF, "chi_square"))
          .add(new Distribution(LPDF_RNG, "dirichlet"))
          .add(new Distribution(FULL_LPDF, "double_exponential"))
          .add(new Distribution(FULL_LPDF, "exp_mod_normal"))
          .add(new Distribution(FULL_LPDF, "exponential"))
          .add(new Distribution(FULL_LPDF, "frechet"))
          .add(new Distribution(FULL_LPDF, "gamma"))
          .add(new Distribution(LPDF, "gaussian_dlm_obs"))
          .add(new Distribution(FULL_LPDF, "gumbel"))
          .add(new Distribution(FULL_LPDF, "inv_chi_square"))
          .add(new Distribution(FULL_LPDF, "inv_gamma"))
          .add(new Distribution(LPDF_RNG, "inv_wishart"))
          .add(new Distribution(LPDF_RNG, "lkj_corr"))
          .add(new Distribution(LPDF_RNG, "lkj_corr_cholesky"))
          .add(new Distribution(FULL_LPDF, "logistic"))
          .add(new Distribution(FULL_LPDF, "lognormal"))
          .add(new Distribution(LPDF, "multi_gp"))
          .add(new Distribution(LPDF, "multi_gp_cholesky"))
          .add(new Distribution(LPDF_RNG, "multi_normal"))
          .add(new Distribution(LPDF_RNG, "multi_normal_cholesky"))
          .add(new Distribution(LPDF, "multi_normal_prec"))
          .add(new Distribution(LPDF_RNG, "multi_student_t"))
          .add(new Distribution(FULL_LPDF, "normal"))
          .add(new Distribution(LPDF, "normal_id_glm"))
          .add(new Distribution(FULL_LPDF, "pareto"))
          .add(new Distribution(FULL_LPDF, "pareto_type_2"))
          .add(new Distribution(FULL_LPDF, "rayleigh"))
          .add(new Distribution(FULL_LPDF, "scaled_inv_chi_square"))
          .add(new Distribution(FULL_LPDF, "skew_normal"))
          .add(new Distribution(FULL_LPDF, "std_normal"))
          .add(new Distribution(FULL_LPDF, "student_t"))
          .add(new Distribution(FULL_LPDF, "uniform"))
          .add(new Distribution(LPDF, "von_mises"))
          .add(new Distribution(FULL_LPDF, "weibull"))
          .add(new Distribution(LPDF, "wiener"))
          .add(new Distribution(LPDF_RNG, "wishart"))
          .build();

  /** Kind of function that a distribution provides. */
  public enum DistributionKind {
    /** Log probability density function, "name_lpdf". */
    LPDF("_lpdf"),
    /** Log probability mass function, "name_lpmf". */
    LPMF("_lpmf"),
    /** Cumulative distribution function, "name_cdf" and "name_lcdf". */
    CDF("_lcdf"),
    /** Complementary cumulative distribution function, "name_lccdf". */
    CCDF("_lccdf"),
    /** Random number generator, "name_rng". */
    RNG("_rng");

    /** Suffix of the function's name; for CDF, the suffix of the log
     * form. */
    public final String suffix;

    DistributionKind(String suffix) {
      this.suffix = suffix;
    }
  }

  /** A distribution family and the functions it provides. */
  public static class Distribution {
    public final Set<DistributionKind> kinds;
    public final String name;

    Distribution(Iterable<DistributionKind> kinds, String name) {
      this.kinds = Sets.immutableEnumSet(kinds);
      this.name = requireNonNull(name);
    }

    @Override public String toString() {
      return name + kinds;
    }

    /** Returns the name of the function of a given kind, such as
     * "normal_lpdf". */
    public String functionName(DistributionKind kind) {
      return name + kind.suffix;
    }
  }
}

// End StanMathSignatures.java
