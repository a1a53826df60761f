package com.spectralid.similarity;

import org.apache.commons.math3.stat.StatUtils;

import java.util.Arrays;

/**
 * Per-spectrum intensity transforms applied before spectra are compared.
 */
public class IntensityTransforms {

  private IntensityTransforms() {
  }

  /**
   * Scales a spectrum by its own total intensity.
   *
   * @param naRm If true the total skips missing readings; otherwise a single missing reading makes every value missing.
   * @return A new array; missing readings stay missing.
   */
  public static double[] makeRelative(double[] intensities, boolean naRm) {
    double total = naRm ? StatUtils.sum(present(intensities)) : StatUtils.sum(intensities);
    double[] relative = new double[intensities.length];
    for (int i = 0; i < intensities.length; i++) {
      relative[i] = intensities[i] / total;
    }
    return relative;
  }

  /**
   * Replaces every missing reading by the mean of the present ones.  A spectrum with no present readings is returned
   * unchanged (all NaN).
   */
  public static double[] meanReplace(double[] intensities) {
    double[] present = present(intensities);
    double[] replaced = intensities.clone();
    if (present.length == 0 || present.length == intensities.length) {
      return replaced;
    }
    double mean = StatUtils.mean(present);
    for (int i = 0; i < replaced.length; i++) {
      if (Double.isNaN(replaced[i])) {
        replaced[i] = mean;
      }
    }
    return replaced;
  }

  static double[] present(double[] intensities) {
    return Arrays.stream(intensities).filter(v -> !Double.isNaN(v)).toArray();
  }
}
