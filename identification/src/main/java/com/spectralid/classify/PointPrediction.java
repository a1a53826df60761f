package com.spectralid.classify;

import java.util.Objects;

/**
 * A single model output: the probability that one input row belongs to one class.  A row the model could not score is
 * represented by a null class and a NaN probability.
 */
public class PointPrediction {
  private final int spectrumIndex;
  private final Integer classIndex;
  private final double probability;

  public PointPrediction(int spectrumIndex, Integer classIndex, double probability) {
    this.spectrumIndex = spectrumIndex;
    this.classIndex = classIndex;
    this.probability = probability;
  }

  public static PointPrediction missing(int spectrumIndex) {
    return new PointPrediction(spectrumIndex, null, Double.NaN);
  }

  public int getSpectrumIndex() {
    return spectrumIndex;
  }

  public Integer getClassIndex() {
    return classIndex;
  }

  public double getProbability() {
    return probability;
  }

  public boolean isValid() {
    return classIndex != null && !Double.isNaN(probability);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (o == null || getClass() != o.getClass()) return false;
    PointPrediction that = (PointPrediction) o;
    return spectrumIndex == that.spectrumIndex &&
        Double.compare(that.probability, probability) == 0 &&
        Objects.equals(classIndex, that.classIndex);
  }

  @Override
  public int hashCode() {
    return Objects.hash(spectrumIndex, classIndex, probability);
  }

  @Override
  public String toString() {
    return String.format("PointPrediction{row=%d, class=%s, p=%f}", spectrumIndex, classIndex, probability);
  }
}
