package com.spectralid.quality;

import com.spectralid.diagnostics.Diagnostic;
import com.spectralid.diagnostics.Diagnostics;
import com.spectralid.spectra.SpectralDataset;
import com.spectralid.spectra.SpectrumValidationException;
import org.apache.commons.math3.stat.StatUtils;
import org.apache.commons.math3.stat.descriptive.moment.StandardDeviation;
import org.apache.commons.math3.stat.descriptive.rank.Median;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Signal and noise metrics per spectrum, used to judge whether a spectrum is worth identifying at all.
 */
public class SignalNoise {
  private static final Logger LOGGER = LogManager.getFormatterLogger(SignalNoise.class);

  // Readings needed before any metric is trusted; also the rolling window of RUN_SIG_OVER_NOISE.
  public static final int MIN_READINGS = 20;

  public enum Metric {
    // Mean intensity.
    SIG,
    // Sample standard deviation of intensity.
    NOISE,
    SIG_TIMES_NOISE,
    SIG_OVER_NOISE,
    // Peak of a rolling maximum over the median of that rolling maximum.
    RUN_SIG_OVER_NOISE,
    // Sum of exponentiated intensities, for spectra in log units.
    LOG_TOT_SIG,
    TOT_SIG
  }

  private final Metric metric;
  private final boolean naRm;

  public SignalNoise() {
    this(Metric.RUN_SIG_OVER_NOISE, true);
  }

  public SignalNoise(Metric metric, boolean naRm) {
    this.metric = metric;
    this.naRm = naRm;
  }

  public static class Result {
    private final Map<String, Optional<Double>> values;
    private final List<Diagnostic> diagnostics;

    Result(Map<String, Optional<Double>> values, List<Diagnostic> diagnostics) {
      this.values = Collections.unmodifiableMap(values);
      this.diagnostics = Collections.unmodifiableList(diagnostics);
    }

    /**
     * @return The metric per spectrum id, in dataset order; empty where it could not be computed.
     */
    public Map<String, Optional<Double>> getValues() {
      return values;
    }

    public Optional<Double> get(String spectrumId) {
      Optional<Double> v = values.get(spectrumId);
      return v == null ? Optional.empty() : v;
    }

    public List<Diagnostic> getDiagnostics() {
      return diagnostics;
    }
  }

  public Result compute(SpectralDataset dataset) {
    if (dataset == null) {
      throw new SpectrumValidationException("A spectral dataset is required");
    }
    Diagnostics diagnostics = new Diagnostics(LOGGER);
    Map<String, Optional<Double>> values = new LinkedHashMap<>();
    for (int s = 0; s < dataset.getSpectrumCount(); s++) {
      String id = dataset.getSpectrumIds().get(s);
      double[] y = dataset.getIntensities(s);
      double[] present = Arrays.stream(y).filter(v -> !Double.isNaN(v)).toArray();
      if (present.length < MIN_READINGS) {
        diagnostics.warn(Diagnostic.Code.INSUFFICIENT_VALUES,
            "Spectrum '%s' has %d readings; at least %d are needed to estimate signal or noise",
            id, present.length, MIN_READINGS);
        values.put(id, Optional.empty());
        continue;
      }
      values.put(id, compute(y, present));
    }
    return new Result(values, diagnostics.toList());
  }

  Optional<Double> compute(double[] y, double[] present) {
    switch (metric) {
      case TOT_SIG:
        return defined(StatUtils.sum(y));
      case LOG_TOT_SIG: {
        double total = 0.0;
        for (double v : y) {
          total += Math.exp(v);
        }
        return defined(total);
      }
      case RUN_SIG_OVER_NOISE:
        return runningSignalOverNoise(present);
      default:
        break;
    }

    double[] basis = naRm ? present : y;
    double signal = StatUtils.mean(basis);
    double noise = new StandardDeviation(true).evaluate(basis);
    switch (metric) {
      case SIG:
        return defined(signal);
      case NOISE:
        return defined(noise);
      case SIG_TIMES_NOISE:
        return defined(Math.abs(signal * noise));
      case SIG_OVER_NOISE:
        return defined(Math.abs(signal / noise));
      default:
        throw new IllegalStateException("Unhandled metric " + metric);
    }
  }

  /* Signal is the highest 20-point rolling maximum, noise the median of the non-zero rolling maxima.  The last 20
   * rolling values are discarded, which keeps the tail of the spectrum out of both estimates. */
  private Optional<Double> runningSignalOverNoise(double[] present) {
    List<Double> rolling = new ArrayList<>();
    int last = present.length - MIN_READINGS;
    for (int end = MIN_READINGS - 1; end < last; end++) {
      double max = Double.NEGATIVE_INFINITY;
      for (int i = end - MIN_READINGS + 1; i <= end; i++) {
        max = Math.max(max, present[i]);
      }
      rolling.add(max);
    }
    if (rolling.isEmpty()) {
      LOGGER.debug("Spectrum too short for a rolling signal estimate (%d readings)", present.length);
      return Optional.empty();
    }

    double signal = Double.NEGATIVE_INFINITY;
    List<Double> nonZero = new ArrayList<>();
    for (Double m : rolling) {
      signal = Math.max(signal, m);
      if (m != 0.0) {
        nonZero.add(m);
      }
    }
    if (nonZero.isEmpty()) {
      return Optional.empty();
    }
    double noise = new Median().evaluate(nonZero.stream().mapToDouble(Double::doubleValue).toArray());
    return defined(Math.abs(signal / noise));
  }

  private static Optional<Double> defined(double v) {
    return Double.isNaN(v) ? Optional.empty() : Optional.of(v);
  }

  public Metric getMetric() {
    return metric;
  }
}
