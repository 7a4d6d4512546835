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
package net.hydromatic.stanc.mir;

import static net.hydromatic.stanc.mir.MirBuilder.isType;
import static net.hydromatic.stanc.mir.MirBuilder.mir;

import com.google.common.collect.ImmutableList;
import java.util.List;
import net.hydromatic.stanc.type.ArrayType;
import net.hydromatic.stanc.type.PrimitiveType;
import net.hydromatic.stanc.type.UnsizedType;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Smart constructors for calls to distributions in the math library.
 *
 * <p>When the parameter of a distribution is a link function applied to a
 * linear predictor, the constructors generate a call to the specialized
 * form of the distribution. Rules are tried in order, and the first that
 * matches wins:
 *
 * <ol>
 *   <li>{@code link(alpha + x * beta)}, {@code x} a matrix &rarr;
 *       {@code glm(y, x, alpha, beta)}
 *   <li>{@code link(x * beta + alpha)}, {@code x} a matrix &rarr;
 *       {@code glm(y, x, alpha, beta)}
 *   <li>{@code link(x * beta)}, {@code x} a matrix &rarr;
 *       {@code glm(y, x, 0, beta)}
 *   <li>{@code link(alpha)} &rarr; {@code linked(y, alpha)}
 *   <li>otherwise, the plain call
 * </ol>
 *
 * <p>Only those two orderings of the sum are recognized; a linear predictor
 * that is grouped differently, such as {@code (alpha + x * beta) + gamma},
 * is left alone.
 */
public abstract class Distributions {
  private Distributions() {}

  /** Linear predictor {@code alpha + x * beta} where {@code x} is a
   * matrix. */
  static class LinearPredictor {
    final Expr<TypedMeta> x;
    final Expr<TypedMeta> alpha;
    final Expr<TypedMeta> beta;

    LinearPredictor(Expr<TypedMeta> x, Expr<TypedMeta> alpha,
        Expr<TypedMeta> beta) {
      this.x = x;
      this.alpha = alpha;
      this.beta = beta;
    }

    /** Matches rules 1, 2 and 3, in that order; returns null if none
     * matches. */
    static @Nullable LinearPredictor match(Expr<TypedMeta> eta) {
      if (mir.isOperator(eta, Operator.PLUS)) {
        final List<Expr<TypedMeta>> args = eta.pattern.children();
        final Expr<TypedMeta> right = args.get(1);
        if (isMatrixProduct(right)) {
          return of(right, args.get(0));
        }
        final Expr<TypedMeta> left = args.get(0);
        if (isMatrixProduct(left)) {
          return of(left, args.get(1));
        }
        return null;
      }
      if (isMatrixProduct(eta)) {
        return of(eta, mir.zero());
      }
      return null;
    }

    private static LinearPredictor of(Expr<TypedMeta> product,
        Expr<TypedMeta> alpha) {
      final List<Expr<TypedMeta>> args = product.pattern.children();
      return new LinearPredictor(args.get(0), alpha, args.get(1));
    }

    private static boolean isMatrixProduct(Expr<TypedMeta> e) {
      return mir.isOperator(e, Operator.TIMES)
          && isType(e.pattern.children().get(0), PrimitiveType.MATRIX);
    }
  }

  /** Returns the argument of a call to a given one-argument link function,
   * or null. */
  private static @Nullable Expr<TypedMeta> linkArg(Expr<TypedMeta> e,
      String link) {
    return mir.isFun(e, FunKind.STAN_LIB, link)
        && e.pattern.children().size() == 1
        ? e.pattern.children().get(0)
        : null;
  }

  /** Builds a call to a GLM function: the observations, the predictor's
   * matrix, intercept and coefficients, then any trailing arguments. */
  private static Expr<TypedMeta> glm(TypedMeta meta, String name,
      Expr<TypedMeta> y, LinearPredictor p, List<Expr<TypedMeta>> rest) {
    return mir.stanLibFun(meta, name,
        ImmutableList.<Expr<TypedMeta>>builder()
            .add(y, p.x, p.alpha, p.beta)
            .addAll(rest)
            .build());
  }

  /** Builds a call whose arguments are the leading arguments, the
   * parameter, then the trailing arguments. */
  private static Expr<TypedMeta> call(TypedMeta meta, String name,
      List<Expr<TypedMeta>> leading, Expr<TypedMeta> param,
      List<Expr<TypedMeta>> trailing) {
    return mir.stanLibFun(meta, name,
        ImmutableList.<Expr<TypedMeta>>builder()
            .addAll(leading)
            .add(param)
            .addAll(trailing)
            .build());
  }

  /** Applies rules 1 to 5 to a density whose parameter is
   * {@code param}. If {@code glmName} is null, rules 1 to 3 are skipped. */
  private static Expr<TypedMeta> linked(TypedMeta meta, String link,
      @Nullable String glmName, String linkedName, String plainName,
      Expr<TypedMeta> y, List<Expr<TypedMeta>> leading,
      Expr<TypedMeta> param, List<Expr<TypedMeta>> trailing) {
    final Expr<TypedMeta> eta = linkArg(param, link);
    if (eta == null) {
      return call(meta, plainName, leading(y, leading), param, trailing);
    }
    return fused(meta, glmName, linkedName, y, leading, eta, trailing);
  }

  /** Applies rules 1 to 4 to a linear predictor that is already on the
   * scale of the link function. */
  private static Expr<TypedMeta> fused(TypedMeta meta,
      @Nullable String glmName, String linkedName, Expr<TypedMeta> y,
      List<Expr<TypedMeta>> leading, Expr<TypedMeta> eta,
      List<Expr<TypedMeta>> trailing) {
    if (glmName != null) {
      final LinearPredictor p = LinearPredictor.match(eta);
      if (p != null) {
        return glm(meta, glmName, y, p, trailing);
      }
    }
    return call(meta, linkedName, leading(y, leading), eta, trailing);
  }

  private static List<Expr<TypedMeta>> leading(Expr<TypedMeta> y,
      List<Expr<TypedMeta>> leading) {
    return ImmutableList.<Expr<TypedMeta>>builder().add(y).addAll(leading)
        .build();
  }

  /** Bernoulli distribution. */
  public static class Bernoulli {
    private Bernoulli() {}

    /** Creates {@code bernoulli_logit_glm_lpmf(y | x, alpha, beta)}. */
    public static Expr<TypedMeta> logitGlmLpmf(TypedMeta meta,
        Expr<TypedMeta> y, Expr<TypedMeta> x, Expr<TypedMeta> alpha,
        Expr<TypedMeta> beta) {
      return glm(meta, "bernoulli_logit_glm_lpmf", y,
          new LinearPredictor(x, alpha, beta), ImmutableList.of());
    }

    /** Creates {@code bernoulli_logit_glm_lpmf(y | x, alpha, beta)} if the
     * arguments have the types that the function accepts, otherwise returns
     * null. */
    public static @Nullable Expr<TypedMeta> logitGlmLpmfChecked(
        TypedMeta meta, Expr<TypedMeta> y, Expr<TypedMeta> x,
        Expr<TypedMeta> alpha, Expr<TypedMeta> beta) {
      final UnsizedType alphaType = alpha.meta.type;
      if (y.meta.type.equals(ArrayType.of(PrimitiveType.INT))
          && isType(x, PrimitiveType.MATRIX)
          && (alphaType == PrimitiveType.REAL
              || alphaType == PrimitiveType.VECTOR)
          && isType(beta, PrimitiveType.VECTOR)) {
        return logitGlmLpmf(meta, y, x, alpha, beta);
      }
      return null;
    }

    /** Creates {@code bernoulli_logit_lpmf(y | alpha)}, fusing a linear
     * predictor into the GLM form. */
    public static Expr<TypedMeta> logitLpmf(TypedMeta meta, Expr<TypedMeta> y,
        Expr<TypedMeta> alpha) {
      return fused(meta, "bernoulli_logit_glm_lpmf", "bernoulli_logit_lpmf",
          y, ImmutableList.of(), alpha, ImmutableList.of());
    }

    /** As {@link #logitLpmf}, but returns null unless {@code alpha} is
     * real. */
    public static @Nullable Expr<TypedMeta> logitLpmfChecked(TypedMeta meta,
        Expr<TypedMeta> y, Expr<TypedMeta> alpha) {
      return isType(alpha, PrimitiveType.REAL)
          ? logitLpmf(meta, y, alpha)
          : null;
    }

    /** Creates {@code bernoulli_lpmf(y | theta)}; if {@code theta} is
     * {@code inv_logit(eta)}, creates the logit or GLM form. */
    public static Expr<TypedMeta> lpmf(TypedMeta meta, Expr<TypedMeta> y,
        Expr<TypedMeta> theta) {
      return linked(meta, "inv_logit", "bernoulli_logit_glm_lpmf",
          "bernoulli_logit_lpmf", "bernoulli_lpmf", y, ImmutableList.of(),
          theta, ImmutableList.of());
    }

    public static Expr<TypedMeta> cdf(TypedMeta meta, Expr<TypedMeta> y,
        Expr<TypedMeta> theta) {
      return mir.stanLibFun(meta, "bernoulli_cdf", ImmutableList.of(y, theta));
    }

    public static Expr<TypedMeta> lcdf(TypedMeta meta, Expr<TypedMeta> y,
        Expr<TypedMeta> theta) {
      return mir.stanLibFun(meta, "bernoulli_lcdf",
          ImmutableList.of(y, theta));
    }

    public static Expr<TypedMeta> lccdf(TypedMeta meta, Expr<TypedMeta> y,
        Expr<TypedMeta> theta) {
      return mir.stanLibFun(meta, "bernoulli_lccdf",
          ImmutableList.of(y, theta));
    }

    public static Expr<TypedMeta> logitRng(TypedMeta meta,
        Expr<TypedMeta> alpha) {
      return mir.stanLibFun(meta, "bernoulli_logit_rng",
          ImmutableList.of(alpha));
    }

    /** Creates {@code bernoulli_rng(theta)}, or
     * {@code bernoulli_logit_rng(alpha)} if {@code theta} is
     * {@code inv_logit(alpha)}. */
    public static Expr<TypedMeta> rng(TypedMeta meta, Expr<TypedMeta> theta) {
      final Expr<TypedMeta> alpha = linkArg(theta, "inv_logit");
      return alpha != null
          ? logitRng(meta, alpha)
          : mir.stanLibFun(meta, "bernoulli_rng", ImmutableList.of(theta));
    }
  }

  /** Poisson distribution. */
  public static class Poisson {
    private Poisson() {}

    /** Creates {@code poisson_log_lpmf(y | alpha)}, fusing a linear
     * predictor into the GLM form. */
    public static Expr<TypedMeta> logLpmf(TypedMeta meta, Expr<TypedMeta> y,
        Expr<TypedMeta> alpha) {
      return fused(meta, "poisson_log_glm_lpmf", "poisson_log_lpmf", y,
          ImmutableList.of(), alpha, ImmutableList.of());
    }

    /** Creates {@code poisson_lpmf(y | lambda)}; if {@code lambda} is
     * {@code exp(eta)}, creates the log or GLM form. */
    public static Expr<TypedMeta> lpmf(TypedMeta meta, Expr<TypedMeta> y,
        Expr<TypedMeta> lambda) {
      return linked(meta, "exp", "poisson_log_glm_lpmf", "poisson_log_lpmf",
          "poisson_lpmf", y, ImmutableList.of(), lambda, ImmutableList.of());
    }

    public static Expr<TypedMeta> rng(TypedMeta meta, Expr<TypedMeta> lambda) {
      final Expr<TypedMeta> alpha = linkArg(lambda, "exp");
      return alpha != null
          ? mir.stanLibFun(meta, "poisson_log_rng", ImmutableList.of(alpha))
          : mir.stanLibFun(meta, "poisson_rng", ImmutableList.of(lambda));
    }
  }

  /** Negative binomial distribution, parameterized by mean and
   * overdispersion. */
  public static class NegBinomial2 {
    private NegBinomial2() {}

    public static Expr<TypedMeta> logLpmf(TypedMeta meta, Expr<TypedMeta> y,
        Expr<TypedMeta> eta, Expr<TypedMeta> phi) {
      return fused(meta, "neg_binomial_2_log_glm_lpmf",
          "neg_binomial_2_log_lpmf", y, ImmutableList.of(), eta,
          ImmutableList.of(phi));
    }

    /** Creates {@code neg_binomial_2_lpmf(y | mu, phi)}; if {@code mu} is
     * {@code exp(eta)}, creates the log or GLM form. */
    public static Expr<TypedMeta> lpmf(TypedMeta meta, Expr<TypedMeta> y,
        Expr<TypedMeta> mu, Expr<TypedMeta> phi) {
      return linked(meta, "exp", "neg_binomial_2_log_glm_lpmf",
          "neg_binomial_2_log_lpmf", "neg_binomial_2_lpmf", y,
          ImmutableList.of(), mu, ImmutableList.of(phi));
    }

    public static Expr<TypedMeta> rng(TypedMeta meta, Expr<TypedMeta> mu,
        Expr<TypedMeta> phi) {
      final Expr<TypedMeta> eta = linkArg(mu, "exp");
      return eta != null
          ? mir.stanLibFun(meta, "neg_binomial_2_log_rng",
              ImmutableList.of(eta, phi))
          : mir.stanLibFun(meta, "neg_binomial_2_rng",
              ImmutableList.of(mu, phi));
    }
  }

  /** Binomial distribution. It has no GLM form. */
  public static class Binomial {
    private Binomial() {}

    /** Creates {@code binomial_lpmf(y | n, theta)}; if {@code theta} is
     * {@code inv_logit(alpha)}, creates
     * {@code binomial_logit_lpmf(y | n, alpha)}. */
    public static Expr<TypedMeta> lpmf(TypedMeta meta, Expr<TypedMeta> y,
        Expr<TypedMeta> n, Expr<TypedMeta> theta) {
      return linked(meta, "inv_logit", null, "binomial_logit_lpmf",
          "binomial_lpmf", y, ImmutableList.of(n), theta, ImmutableList.of());
    }
  }

  /** Categorical distribution. It has no GLM form. */
  public static class Categorical {
    private Categorical() {}

    /** Creates {@code categorical_lpmf(y | theta)}; if {@code theta} is
     * {@code softmax(beta)}, creates
     * {@code categorical_logit_lpmf(y | beta)}. */
    public static Expr<TypedMeta> lpmf(TypedMeta meta, Expr<TypedMeta> y,
        Expr<TypedMeta> theta) {
      return linked(meta, "softmax", null, "categorical_logit_lpmf",
          "categorical_lpmf", y, ImmutableList.of(), theta,
          ImmutableList.of());
    }

    public static Expr<TypedMeta> rng(TypedMeta meta, Expr<TypedMeta> theta) {
      final Expr<TypedMeta> beta = linkArg(theta, "softmax");
      return beta != null
          ? mir.stanLibFun(meta, "categorical_logit_rng",
              ImmutableList.of(beta))
          : mir.stanLibFun(meta, "categorical_rng", ImmutableList.of(theta));
    }
  }

  /** Normal distribution. Its link function is the identity, so there is
   * no linked form, only the GLM form. */
  public static class Normal {
    private Normal() {}

    /** Creates {@code normal_lpdf(y | mu, sigma)}, or
     * {@code normal_id_glm_lpdf(y | x, alpha, beta, sigma)} if {@code mu} is
     * a linear predictor. */
    public static Expr<TypedMeta> lpdf(TypedMeta meta, Expr<TypedMeta> y,
        Expr<TypedMeta> mu, Expr<TypedMeta> sigma) {
      final LinearPredictor p = LinearPredictor.match(mu);
      if (p != null) {
        return glm(meta, "normal_id_glm_lpdf", y, p, ImmutableList.of(sigma));
      }
      return call(meta, "normal_lpdf", ImmutableList.of(y), mu,
          ImmutableList.of(sigma));
    }
  }
}

// End Distributions.java
