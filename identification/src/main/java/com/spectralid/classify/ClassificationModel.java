package com.spectralid.classify;

import java.util.List;

/**
 * A trained, regularized classifier over spectra sampled on a fixed wavenumber grid.
 */
public interface ClassificationModel {

  /**
   * Scores each row of {@code features} against every class.
   *
   * @param features One row per spectrum, one column per wavenumber of {@link #getWavenumbers()}.
   * @param lambda The regularization value to predict at; one of {@link #getLambdas()} or a value between them.
   * @return Class probabilities keyed by row position.  Rows the model cannot score may be left out entirely.
   */
  List<PointPrediction> predict(double[][] features, double lambda);

  /**
   * @return The regularization path the model was fit along.
   */
  double[] getLambdas();

  /**
   * @return The wavenumber grid the model expects its inputs on; its length is the feature count.
   */
  double[] getWavenumbers();
}
