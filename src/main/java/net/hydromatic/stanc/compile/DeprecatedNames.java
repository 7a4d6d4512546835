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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import net.hydromatic.stanc.compile.StanMathSignatures.Distribution;
import net.hydromatic.stanc.compile.StanMathSignatures.DistributionKind;

/** Tables of deprecated function names, and utilities for the suffixes of
 * distribution function names.
 *
 * <p>The tables are built once, when the class is loaded, and never
 * change. */
public abstract class DeprecatedNames {
  private DeprecatedNames() {}

  /** Deprecated functions and their replacements. */
  public static final ImmutableMap<String, String> FUNCTIONS =
      ImmutableMap.of("multiply_log", "lmultiply",
          "binomial_coefficient_log", "lchoose",
          "integrate_ode", "integrate_ode_rk45");

  /** Deprecated spellings of distribution functions and their replacements;
   * for example "normal_log" &rarr; "normal_lpdf",
   * "normal_cdf_log" &rarr; "normal_lcdf". */
  public static final ImmutableMap<String, String> DISTRIBUTIONS =
      buildDistributions();

  /** Suffixes that mark the name of a density, mass or cumulative
   * distribution function. */
  private static final ImmutableList<String> DISTRIBUTION_SUFFIXES =
      ImmutableList.of("_lpdf", "_lpmf", "_lcdf", "_lccdf");

  /** Suffixes of names that the library treats as distributions, and that
   * may have "_propto" before the suffix. */
  private static final ImmutableList<String> PROPTO_SUFFIXES =
      ImmutableList.of("_log", "_lpmf", "_lpdf");

  private static final String PROPTO = "_propto";

  private static ImmutableMap<String, String> buildDistributions() {
    // Builder.build throws if two distributions generate the same name
    final ImmutableMap.Builder<String, String> b = ImmutableMap.builder();
    for (Distribution d : StanMathSignatures.DISTRIBUTIONS) {
      for (DistributionKind kind : d.kinds) {
        switch (kind) {
        case LPDF:
        case LPMF:
          b.put(d.name + "_log", d.functionName(kind));
          break;
        case CDF:
          b.put(d.name + "_cdf_log", d.functionName(kind));
          break;
        case CCDF:
          b.put(d.name + "_ccdf_log", d.functionName(kind));
          break;
        default:
          break;
        }
      }
    }
    return b.build();
  }

  /** Returns whether a name is a deprecated spelling of a distribution
   * function. */
  public static boolean isDeprecatedDistribution(String name) {
    return DISTRIBUTIONS.containsKey(name);
  }

  /** Returns the modern name of a distribution function, or the name
   * itself if it is not deprecated. */
  public static String renameDistribution(String name) {
    return DISTRIBUTIONS.getOrDefault(name, name);
  }

  /** Returns the modern name of a function, or the name itself if it is
   * not deprecated. */
  public static String renameFunction(String name) {
    return FUNCTIONS.getOrDefault(name, name);
  }

  /** Returns whether a name ends with "_lpdf", "_lpmf", "_lcdf" or
   * "_lccdf", and is therefore called with a conditioning bar. */
  public static boolean hasDistributionSuffix(String name) {
    for (String suffix : DISTRIBUTION_SUFFIXES) {
      if (name.endsWith(suffix)) {
        return true;
      }
    }
    return false;
  }

  /** Removes an "_lpdf" or "_lpmf" suffix; "normal_lpdf" becomes
   * "normal". Other names are returned unchanged. */
  public static String withoutSuffix(String name) {
    return name.endsWith("_lpdf") || name.endsWith("_lpmf")
        ? name.substring(0, name.length() - "_lpdf".length())
        : name;
  }

  /** Returns whether a name ends with "_log", "_lpmf" or "_lpdf". */
  public static boolean isDistributionName(String name) {
    return isDistributionName(name, "");
  }

  /** Returns whether a name ends with "_propto_log", "_propto_lpmf" or
   * "_propto_lpdf". */
  public static boolean isProptoDistribution(String name) {
    return isDistributionName(name, PROPTO);
  }

  private static boolean isDistributionName(String name, String infix) {
    for (String suffix : PROPTO_SUFFIXES) {
      if (name.endsWith(infix + suffix)) {
        return true;
      }
    }
    return false;
  }

  /** Returns the name of the library function that implements a
   * distribution; "normal_propto_lpdf" becomes "normal_lpdf". Names without
   * "_propto" are returned unchanged. */
  public static String stdlibDistributionName(String name) {
    for (String suffix : PROPTO_SUFFIXES) {
      if (name.endsWith(PROPTO + suffix)) {
        return name.substring(0, name.length() - (PROPTO + suffix).length())
            + suffix;
      }
    }
    return name;
  }
}

// End DeprecatedNames.java
