package com.spectralid.conform;

import com.spectralid.spectra.SpectralDataset;
import com.spectralid.spectra.SpectrumValidationException;
import org.apache.commons.math3.analysis.interpolation.LinearInterpolator;
import org.apache.commons.math3.analysis.polynomials.PolynomialSplineFunction;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Resamples spectra onto a target wavenumber series so they can be compared with a library measured on that series.
 */
public class GridConformer {
  private static final Logger LOGGER = LogManager.getFormatterLogger(GridConformer.class);

  public enum Type {
    // Linear interpolation between neighbouring readings.
    INTERP,
    // Nearest original reading.
    ROLL
  }

  private final Type type;

  public GridConformer() {
    this(Type.INTERP);
  }

  public GridConformer(Type type) {
    this.type = type;
  }

  /**
   * @param dataset The spectra to resample.
   * @param range Target wavenumbers.  With a resolution only the extremes matter; without one, each value inside the
   *   data's range becomes a grid point.
   * @param resolution Spacing of a regular target grid, or null to use {@code range} as given.
   * @return A new dataset on the conformed grid, with the same spectrum ids and metadata.
   */
  public SpectralDataset conform(SpectralDataset dataset, double[] range, Double resolution) {
    if (dataset == null) {
      throw new SpectrumValidationException("A spectral dataset is required");
    }
    double[] source = dataset.getWavenumbers();
    if (source.length < 2) {
      throw new SpectrumValidationException("Need at least 2 wavenumbers to conform, got %d", source.length);
    }
    double[] target = targetGrid(source, range == null ? source : range, resolution);
    LOGGER.debug("Conforming %d spectra from %d to %d wavenumbers (%s)",
        dataset.getSpectrumCount(), source.length, target.length, type);

    SpectralDataset.Builder builder = SpectralDataset.builder().setWavenumbers(target);
    for (int s = 0; s < dataset.getSpectrumCount(); s++) {
      double[] y = dataset.getIntensities(s);
      double[] conformed = type == Type.INTERP ? interpolate(source, y, target) : nearest(source, y, target);
      builder.addSpectrum(dataset.getSpectrumIds().get(s), conformed, dataset.getMetadata(s));
    }
    return builder.build();
  }

  static double[] targetGrid(double[] source, double[] range, Double resolution) {
    double dataMin = source[0];
    double dataMax = source[source.length - 1];
    if (resolution != null) {
      if (!(resolution > 0)) {
        throw new SpectrumValidationException("Resolution must be positive, got %s", resolution);
      }
      double lo = Math.max(Arrays.stream(range).min().orElse(dataMin), dataMin);
      double hi = Math.min(Arrays.stream(range).max().orElse(dataMax), dataMax);
      List<Double> grid = new ArrayList<>();
      // Multiply rather than accumulate so rounding error doesn't drift along the grid.
      for (int i = 0; lo + i * resolution <= hi + resolution * 1e-9; i++) {
        grid.add(Math.min(lo + i * resolution, hi));
      }
      return grid.stream().mapToDouble(Double::doubleValue).toArray();
    }
    return Arrays.stream(range).filter(w -> w >= dataMin && w <= dataMax).sorted().distinct().toArray();
  }

  /* Missing readings are left out of the interpolation; with fewer than two readings left the spectrum is all NaN. */
  static double[] interpolate(double[] x, double[] y, double[] target) {
    List<Double> xs = new ArrayList<>();
    List<Double> ys = new ArrayList<>();
    for (int i = 0; i < x.length; i++) {
      if (!Double.isNaN(y[i])) {
        xs.add(x[i]);
        ys.add(y[i]);
      }
    }
    double[] out = new double[target.length];
    if (xs.size() < 2) {
      Arrays.fill(out, Double.NaN);
      return out;
    }
    PolynomialSplineFunction f = new LinearInterpolator().interpolate(
        xs.stream().mapToDouble(Double::doubleValue).toArray(),
        ys.stream().mapToDouble(Double::doubleValue).toArray());
    for (int i = 0; i < target.length; i++) {
      out[i] = f.isValidPoint(target[i]) ? f.value(target[i]) : Double.NaN;
    }
    return out;
  }

  static double[] nearest(double[] x, double[] y, double[] target) {
    double[] out = new double[target.length];
    for (int i = 0; i < target.length; i++) {
      int idx = Arrays.binarySearch(x, target[i]);
      if (idx < 0) {
        int insertion = -idx - 1;
        if (insertion == 0) {
          idx = 0;
        } else if (insertion == x.length) {
          idx = x.length - 1;
        } else {
          idx = target[i] - x[insertion - 1] <= x[insertion] - target[i] ? insertion - 1 : insertion;
        }
      }
      out[i] = y[idx];
    }
    return out;
  }

  public Type getType() {
    return type;
  }
}
