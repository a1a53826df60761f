package com.spectralid.classify;

import com.spectralid.spectra.SpectralDataset;
import com.spectralid.spectra.SpectrumValidationException;
import org.apache.commons.math3.stat.StatUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Runs a trained classifier over a dataset that is already on the model's grid, and reduces its raw output to the most
 * probable class of each spectrum.
 */
public class ClassificationAdapter {
  private static final Logger LOGGER = LogManager.getFormatterLogger(ClassificationAdapter.class);

  /**
   * @param aligned Spectra on the model's wavenumber grid (see {@link AlignmentFiller}).
   * @param model The classifier; it is evaluated at the smallest lambda of its path.
   * @param classLabels Names of the model's classes, keyed by class index.  Classes without a name get a null label.
   * @return One or more results per spectrum, ordered by spectrum position.  A spectrum has several results only when
   *   several classes tie for the highest probability.
   * @throws SpectrumValidationException if the dataset's grid differs from the model's.
   */
  public List<ClassificationResult> classify(SpectralDataset aligned, ClassificationModel model,
                                             Map<Integer, String> classLabels) {
    if (aligned == null || model == null) {
      throw new SpectrumValidationException("Classification needs a dataset and a model");
    }
    double[] modelGrid = model.getWavenumbers();
    if (aligned.getGridSize() != modelGrid.length) {
      throw new SpectrumValidationException(
          "Dataset has %d wavenumbers but the model expects %d; align the spectra to the model grid first",
          aligned.getGridSize(), modelGrid.length);
    }
    double[] grid = aligned.getWavenumbers();
    for (int i = 0; i < grid.length; i++) {
      if (Math.abs(grid[i] - modelGrid[i]) > AlignmentFiller.DEFAULT_TOLERANCE) {
        throw new SpectrumValidationException(
            "Dataset wavenumber %f at position %d differs from the model's %f; align the spectra to the model grid " +
                "first",
            grid[i], i, modelGrid[i]);
      }
    }
    double[] lambdas = model.getLambdas();
    if (lambdas == null || lambdas.length == 0) {
      throw new SpectrumValidationException("Model has no regularization path to predict along");
    }
    double lambda = StatUtils.min(lambdas);

    int n = aligned.getSpectrumCount();
    double[][] features = new double[n][];
    for (int s = 0; s < n; s++) {
      features[s] = aligned.getIntensities(s);
    }

    // Failures inside the model are the caller's to handle.
    List<PointPrediction> predictions = model.predict(features, lambda);
    LOGGER.debug("Model returned %d predictions for %d spectra at lambda %g", predictions.size(), n, lambda);

    List<List<PointPrediction>> bySpectrum = new ArrayList<>(n);
    for (int s = 0; s < n; s++) {
      bySpectrum.add(new ArrayList<>());
    }
    for (PointPrediction p : predictions) {
      if (p.getSpectrumIndex() < 0 || p.getSpectrumIndex() >= n) {
        String msg = String.format("Model returned a prediction for row %d, but only %d rows were given",
            p.getSpectrumIndex(), n);
        LOGGER.error(msg);
        throw new IllegalStateException(msg);
      }
      bySpectrum.get(p.getSpectrumIndex()).add(p);
    }

    Map<Integer, String> labels = classLabels == null ? Collections.emptyMap() : classLabels;
    List<ClassificationResult> results = new ArrayList<>(n);
    for (int s = 0; s < n; s++) {
      String id = aligned.getSpectrumIds().get(s);
      for (PointPrediction best : bestOf(s, bySpectrum.get(s))) {
        String label = best.getClassIndex() == null ? null : labels.get(best.getClassIndex());
        results.add(new ClassificationResult(s, id, best.getClassIndex(), label, best.getProbability()));
      }
    }
    return results;
  }

  /* Every prediction tied at the highest probability, in model output order; a single NaN placeholder when nothing
   * valid came back for this spectrum. */
  static List<PointPrediction> bestOf(int spectrumIndex, List<PointPrediction> candidates) {
    double max = Double.NEGATIVE_INFINITY;
    boolean anyValid = false;
    for (PointPrediction p : candidates) {
      if (p.isValid()) {
        anyValid = true;
        max = Math.max(max, p.getProbability());
      }
    }
    if (!anyValid) {
      return Collections.singletonList(PointPrediction.missing(spectrumIndex));
    }
    List<PointPrediction> best = new ArrayList<>();
    for (PointPrediction p : candidates) {
      if (p.isValid() && p.getProbability() == max) {
        best.add(p);
      }
    }
    return best;
  }
}
