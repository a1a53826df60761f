package com.spectralid.classify;

import com.spectralid.diagnostics.Diagnostic;
import com.spectralid.diagnostics.Diagnostics;
import com.spectralid.spectra.SpectralDataset;
import com.spectralid.spectra.SpectrumValidationException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Arrays;

/**
 * Moves unknown spectra onto a model's wavenumber grid.
 *
 * The output grid is the fill reference's grid.  Where an unknown has a reading at (or within {@code tolerance} of) a
 * grid wavenumber, the output takes that reading; every other grid position takes the fill reference's own intensity
 * there.  Readings of the unknown that land on no grid wavenumber are dropped.
 */
public class AlignmentFiller {
  private static final Logger LOGGER = LogManager.getFormatterLogger(AlignmentFiller.class);

  public static final double DEFAULT_TOLERANCE = 1e-6;

  private final double tolerance;

  public AlignmentFiller() {
    this(DEFAULT_TOLERANCE);
  }

  public AlignmentFiller(double tolerance) {
    if (!(tolerance >= 0.0)) {
      throw new SpectrumValidationException("Tolerance must be non-negative, got %f", tolerance);
    }
    this.tolerance = tolerance;
  }

  public SpectralDataset fill(SpectralDataset x, SpectralDataset fillReference) {
    return fill(x, fillReference, new Diagnostics(LOGGER));
  }

  /**
   * @param x The unknowns to realign.  Left untouched.
   * @param fillReference A dataset whose grid is the target grid and whose first spectrum supplies the padding.
   * @param diagnostics Receives recoverable alignment problems.
   * @return A new dataset on the reference grid, with x's spectrum ids and metadata.
   */
  public SpectralDataset fill(SpectralDataset x, SpectralDataset fillReference, Diagnostics diagnostics) {
    if (x == null || fillReference == null) {
      throw new SpectrumValidationException("Alignment needs both an unknown dataset and a fill reference");
    }
    if (fillReference.isEmpty()) {
      throw new SpectrumValidationException("The fill reference holds no spectrum to pad with");
    }
    if (fillReference.getSpectrumCount() > 1) {
      diagnostics.warn(Diagnostic.Code.MULTIPLE_FILL_SPECTRA,
          "Fill reference holds %d spectra; padding with the first one ('%s')",
          fillReference.getSpectrumCount(), fillReference.getSpectrumIds().get(0));
    }

    double[] targetGrid = fillReference.getWavenumbers();
    double[] padding = fillReference.getIntensities(0);
    int[] targetPositions = mapOntoGrid(x.getWavenumbers(), targetGrid);

    int unmatched = 0;
    for (int pos : targetPositions) {
      if (pos < 0) unmatched++;
    }
    if (unmatched > 0) {
      diagnostics.warn(Diagnostic.Code.UNMATCHED_ALIGNMENT_WAVENUMBERS,
          "%d of %d wavenumbers of the unknowns have no counterpart on the %d-point target grid and were dropped",
          unmatched, targetPositions.length, targetGrid.length);
    }

    SpectralDataset.Builder builder = fillReference.toEmptyBuilder();
    for (int s = 0; s < x.getSpectrumCount(); s++) {
      double[] source = x.getIntensities(s);
      double[] aligned = padding.clone();
      for (int i = 0; i < source.length; i++) {
        if (targetPositions[i] >= 0) {
          aligned[targetPositions[i]] = source[i];
        }
      }
      builder.addSpectrum(x.getSpectrumIds().get(s), aligned, x.getMetadata(s));
    }
    return builder.build();
  }

  /**
   * For each source wavenumber, finds the nearest target wavenumber within tolerance.  A target position is claimed by
   * at most one source wavenumber (the first to reach it); later claimants count as unmatched.
   *
   * @return Target positions parallel to {@code source}; -1 where there is no match.
   */
  int[] mapOntoGrid(double[] source, double[] target) {
    int[] positions = new int[source.length];
    boolean[] claimed = new boolean[target.length];
    for (int i = 0; i < source.length; i++) {
      int nearest = nearestIndex(target, source[i]);
      if (nearest >= 0 && !claimed[nearest] && Math.abs(target[nearest] - source[i]) <= tolerance) {
        positions[i] = nearest;
        claimed[nearest] = true;
      } else {
        positions[i] = -1;
      }
    }
    return positions;
  }

  static int nearestIndex(double[] sortedGrid, double value) {
    if (sortedGrid.length == 0) {
      return -1;
    }
    int idx = Arrays.binarySearch(sortedGrid, value);
    if (idx >= 0) {
      return idx;
    }
    int insertion = -idx - 1;
    if (insertion == 0) {
      return 0;
    }
    if (insertion == sortedGrid.length) {
      return sortedGrid.length - 1;
    }
    double below = value - sortedGrid[insertion - 1];
    double above = sortedGrid[insertion] - value;
    return below <= above ? insertion - 1 : insertion;
  }

  public double getTolerance() {
    return tolerance;
  }
}
