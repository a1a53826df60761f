package com.spectralid.classify;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * A multinomial logistic regression fit along a regularization path, as exported from an elastic-net trainer.
 *
 * Serialized form (JSON):
 * <pre>
 * {
 *   "wavenumbers":  [w_0, ..., w_p-1],
 *   "lambdas":      [l_0, ..., l_k-1],
 *   "intercepts":   [[b_class0, b_class1, ...] per lambda],
 *   "coefficients": [[[beta_w0, ..., beta_wp-1] per class] per lambda],
 *   "class_labels": {"0": "polyethylene", "1": "polystyrene", ...}
 * }
 * </pre>
 */
public class MultinomialModel implements ClassificationModel {
  private static final Logger LOGGER = LogManager.getFormatterLogger(MultinomialModel.class);
  private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();

  @JsonProperty("wavenumbers")
  private double[] wavenumbers;

  @JsonProperty("lambdas")
  private double[] lambdas;

  @JsonProperty("intercepts")
  private double[][] intercepts;

  @JsonProperty("coefficients")
  private double[][][] coefficients;

  @JsonProperty("class_labels")
  private Map<Integer, String> classLabels;

  // Required by Jackson.
  protected MultinomialModel() {
  }

  public MultinomialModel(double[] wavenumbers, double[] lambdas, double[][] intercepts, double[][][] coefficients,
                          Map<Integer, String> classLabels) {
    this.wavenumbers = wavenumbers.clone();
    this.lambdas = lambdas.clone();
    this.intercepts = intercepts;
    this.coefficients = coefficients;
    this.classLabels = classLabels == null ? new HashMap<>() : new HashMap<>(classLabels);
    validate();
  }

  public static MultinomialModel readFromJsonFile(File file) throws IOException {
    MultinomialModel model = OBJECT_MAPPER.readValue(file, MultinomialModel.class);
    model.validate();
    LOGGER.info("Loaded model from %s: %d classes, %d wavenumbers, %d lambdas",
        file.getAbsolutePath(), model.getClassCount(), model.wavenumbers.length, model.lambdas.length);
    return model;
  }

  public static MultinomialModel readFromJson(InputStream in) throws IOException {
    MultinomialModel model = OBJECT_MAPPER.readValue(in, MultinomialModel.class);
    model.validate();
    return model;
  }

  public void writeToJsonFile(File file) throws IOException {
    OBJECT_MAPPER.writeValue(file, this);
  }

  private void validate() {
    if (wavenumbers == null || lambdas == null || intercepts == null || coefficients == null) {
      throw new IllegalArgumentException("Model is missing wavenumbers, lambdas, intercepts or coefficients");
    }
    if (lambdas.length == 0) {
      throw new IllegalArgumentException("Model has an empty regularization path");
    }
    if (intercepts.length != lambdas.length || coefficients.length != lambdas.length) {
      throw new IllegalArgumentException(String.format(
          "Model has %d lambdas but %d intercept sets and %d coefficient sets",
          lambdas.length, intercepts.length, coefficients.length));
    }
    int classes = intercepts[0].length;
    for (int l = 0; l < lambdas.length; l++) {
      if (intercepts[l].length != classes || coefficients[l].length != classes) {
        throw new IllegalArgumentException(String.format("Inconsistent class count at lambda %d", l));
      }
      for (int c = 0; c < classes; c++) {
        if (coefficients[l][c].length != wavenumbers.length) {
          throw new IllegalArgumentException(String.format(
              "Coefficients for class %d at lambda %d have %d entries, expected %d",
              c, l, coefficients[l][c].length, wavenumbers.length));
        }
      }
    }
    if (classLabels == null) {
      classLabels = new HashMap<>();
    }
  }

  @Override
  public List<PointPrediction> predict(double[][] features, double lambda) {
    double[] intercept = new double[getClassCount()];
    double[][] beta = new double[getClassCount()][wavenumbers.length];
    interpolateAt(lambda, intercept, beta);

    List<PointPrediction> predictions = new ArrayList<>(features.length * intercept.length);
    double[] eta = new double[intercept.length];
    for (int row = 0; row < features.length; row++) {
      double[] x = features[row];
      if (x.length != wavenumbers.length) {
        throw new IllegalArgumentException(String.format("Row %d has %d features, model expects %d",
            row, x.length, wavenumbers.length));
      }
      if (!allFinite(x)) {
        LOGGER.debug("Row %d has missing readings; leaving it unscored", row);
        continue;
      }

      double maxEta = Double.NEGATIVE_INFINITY;
      for (int c = 0; c < intercept.length; c++) {
        double sum = intercept[c];
        for (int j = 0; j < x.length; j++) {
          sum += beta[c][j] * x[j];
        }
        eta[c] = sum;
        maxEta = Math.max(maxEta, sum);
      }
      // Shift by the max before exponentiating to keep the softmax finite.
      double norm = 0.0;
      for (int c = 0; c < intercept.length; c++) {
        eta[c] = Math.exp(eta[c] - maxEta);
        norm += eta[c];
      }
      for (int c = 0; c < intercept.length; c++) {
        predictions.add(new PointPrediction(row, c, eta[c] / norm));
      }
    }
    return predictions;
  }

  /* Linear interpolation of the fit between the two lambdas that bracket the requested one; values outside the path
   * are clamped to its ends. */
  private void interpolateAt(double lambda, double[] intercept, double[][] beta) {
    int lo = 0;
    int hi = 0;
    double frac = 0.0;
    // Trainers usually emit the path in decreasing order, but don't rely on it.
    Integer[] order = new Integer[lambdas.length];
    for (int i = 0; i < order.length; i++) {
      order[i] = i;
    }
    Arrays.sort(order, (a, b) -> Double.compare(lambdas[a], lambdas[b]));

    if (lambda <= lambdas[order[0]]) {
      lo = hi = order[0];
    } else if (lambda >= lambdas[order[order.length - 1]]) {
      lo = hi = order[order.length - 1];
    } else {
      for (int i = 0; i < order.length - 1; i++) {
        double a = lambdas[order[i]];
        double b = lambdas[order[i + 1]];
        if (lambda >= a && lambda <= b) {
          lo = order[i];
          hi = order[i + 1];
          frac = b == a ? 0.0 : (lambda - a) / (b - a);
          break;
        }
      }
    }

    for (int c = 0; c < intercept.length; c++) {
      intercept[c] = (1 - frac) * intercepts[lo][c] + frac * intercepts[hi][c];
      for (int j = 0; j < wavenumbers.length; j++) {
        beta[c][j] = (1 - frac) * coefficients[lo][c][j] + frac * coefficients[hi][c][j];
      }
    }
  }

  private static boolean allFinite(double[] values) {
    for (double v : values) {
      if (!Double.isFinite(v)) {
        return false;
      }
    }
    return true;
  }

  @Override
  public double[] getLambdas() {
    return lambdas.clone();
  }

  @Override
  public double[] getWavenumbers() {
    return wavenumbers.clone();
  }

  @JsonIgnore
  public int getClassCount() {
    return intercepts[0].length;
  }

  @JsonIgnore
  public Map<Integer, String> getClassLabels() {
    return Collections.unmodifiableMap(classLabels);
  }
}
