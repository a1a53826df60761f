package com.spectralid.similarity;

import com.spectralid.diagnostics.Diagnostic;
import com.spectralid.diagnostics.Diagnostics;
import com.spectralid.spectra.SpectralDataset;
import com.spectralid.spectra.SpectrumValidationException;
import org.apache.commons.lang3.StringUtils;
import org.apache.commons.math3.stat.correlation.PearsonsCorrelation;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Correlates unknown spectra against library spectra.
 *
 * Both sides are restricted to the wavenumbers they share, scaled to relative intensity, and have missing readings
 * replaced by the spectrum mean; then every library spectrum is correlated (Pearson) with every unknown.  Each cell
 * depends only on its two vectors, so cells may be computed in any order without changing the result.
 */
public class SimilarityEngine {
  private static final Logger LOGGER = LogManager.getFormatterLogger(SimilarityEngine.class);

  public static final int MIN_SHARED_WAVENUMBERS = 3;

  private final boolean naRm;
  private final PearsonsCorrelation pearson = new PearsonsCorrelation();

  public SimilarityEngine() {
    this(true);
  }

  /**
   * @param naRm Whether relative intensities are computed from the total of the present readings only.
   */
  public SimilarityEngine(boolean naRm) {
    this.naRm = naRm;
  }

  /**
   * @param x The unknowns; they become the columns of the result.
   * @param library The reference spectra; they become the rows of the result.
   * @return A (library spectra x unknown spectra) matrix of correlations.
   * @throws SpectrumValidationException if either dataset is missing or they share fewer than
   *   {@link #MIN_SHARED_WAVENUMBERS} wavenumbers.
   */
  public SimilarityMatrix correlate(SpectralDataset x, SpectralDataset library) {
    if (x == null || library == null) {
      throw new SpectrumValidationException("Both an unknown dataset and a library dataset are required");
    }

    double[] xGrid = x.getWavenumbers();
    double[] libGrid = library.getWavenumbers();
    boolean[] xShared = sharedMask(xGrid, libGrid);
    boolean[] libShared = sharedMask(libGrid, xGrid);
    int shared = count(xShared);

    if (shared < MIN_SHARED_WAVENUMBERS) {
      throw new SpectrumValidationException(
          "There are %d matching wavenumbers between the unknowns and the library, but correlation needs at least %d; " +
              "consider conforming the spectra to the same wavenumbers first", shared, MIN_SHARED_WAVENUMBERS);
    }

    Diagnostics diagnostics = new Diagnostics(LOGGER);
    if (shared < xGrid.length || shared < libGrid.length) {
      diagnostics.warn(Diagnostic.Code.PARTIAL_WAVENUMBER_OVERLAP,
          "Only %d of %d unknown and %d library wavenumbers are shared; ignoring unknown-only wavenumbers [%s] " +
              "and %d library-only wavenumbers",
          shared, xGrid.length, libGrid.length, StringUtils.join(unshared(xGrid, xShared), " "),
          libGrid.length - count(libShared));
    }

    double[][] libVectors = prepare(library, libShared, shared);
    double[][] xVectors = prepare(x, xShared, shared);

    double[][] values = new double[libVectors.length][xVectors.length];
    for (int row = 0; row < libVectors.length; row++) {
      for (int col = 0; col < xVectors.length; col++) {
        values[row][col] = pearson.correlation(libVectors[row], xVectors[col]);
      }
    }
    LOGGER.debug("Correlated %d unknowns against %d library spectra over %d wavenumbers",
        xVectors.length, libVectors.length, shared);

    return new SimilarityMatrix(library.getSpectrumIds(), x.getSpectrumIds(), values, diagnostics.toList());
  }

  private double[][] prepare(SpectralDataset dataset, boolean[] keep, int keptCount) {
    double[][] prepared = new double[dataset.getSpectrumCount()][];
    for (int s = 0; s < prepared.length; s++) {
      double[] all = dataset.getIntensities(s);
      double[] restricted = new double[keptCount];
      int j = 0;
      for (int i = 0; i < all.length; i++) {
        if (keep[i]) {
          restricted[j++] = all[i];
        }
      }
      prepared[s] = IntensityTransforms.meanReplace(IntensityTransforms.makeRelative(restricted, naRm));
    }
    return prepared;
  }

  /**
   * Flags the positions of {@code grid} whose exact value also appears in {@code other}.
   */
  static boolean[] sharedMask(double[] grid, double[] other) {
    Set<Double> otherValues = new HashSet<>(other.length);
    for (double v : other) {
      otherValues.add(v);
    }
    boolean[] mask = new boolean[grid.length];
    for (int i = 0; i < grid.length; i++) {
      mask[i] = otherValues.contains(grid[i]);
    }
    return mask;
  }

  private static int count(boolean[] mask) {
    int n = 0;
    for (boolean b : mask) {
      if (b) n++;
    }
    return n;
  }

  private static List<String> unshared(double[] grid, boolean[] mask) {
    List<String> out = new ArrayList<>();
    for (int i = 0; i < grid.length; i++) {
      if (!mask[i]) {
        out.add(Double.toString(grid[i]));
      }
    }
    return out;
  }

  public boolean isNaRm() {
    return naRm;
  }
}
