package com.spectralid.classify;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * The best class found for one spectrum.  Spectra the model could not score carry a null class and label and a NaN
 * probability.
 */
public class ClassificationResult {
  public static final String FIELD_SPECTRUM_INDEX = "spectrum_index";
  public static final String FIELD_OBJECT_ID = "object_id";
  public static final String FIELD_CLASS_INDEX = "class_index";
  public static final String FIELD_CLASS_LABEL = "class_label";
  public static final String FIELD_PROBABILITY = "probability";

  private final int spectrumIndex;
  private final String spectrumId;
  private final Integer classIndex;
  private final String classLabel;
  private final double probability;

  public ClassificationResult(int spectrumIndex, String spectrumId, Integer classIndex, String classLabel,
                              double probability) {
    this.spectrumIndex = spectrumIndex;
    this.spectrumId = spectrumId;
    this.classIndex = classIndex;
    this.classLabel = classLabel;
    this.probability = probability;
  }

  public int getSpectrumIndex() {
    return spectrumIndex;
  }

  public String getSpectrumId() {
    return spectrumId;
  }

  public Integer getClassIndex() {
    return classIndex;
  }

  public String getClassLabel() {
    return classLabel;
  }

  public double getProbability() {
    return probability;
  }

  public Map<String, Object> toRow() {
    Map<String, Object> row = new LinkedHashMap<>();
    row.put(FIELD_SPECTRUM_INDEX, spectrumIndex);
    row.put(FIELD_OBJECT_ID, spectrumId);
    row.put(FIELD_CLASS_INDEX, classIndex);
    row.put(FIELD_CLASS_LABEL, classLabel);
    row.put(FIELD_PROBABILITY, probability);
    return row;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (o == null || getClass() != o.getClass()) return false;
    ClassificationResult that = (ClassificationResult) o;
    return spectrumIndex == that.spectrumIndex &&
        Double.compare(that.probability, probability) == 0 &&
        Objects.equals(spectrumId, that.spectrumId) &&
        Objects.equals(classIndex, that.classIndex) &&
        Objects.equals(classLabel, that.classLabel);
  }

  @Override
  public int hashCode() {
    return Objects.hash(spectrumIndex, spectrumId, classIndex, classLabel, probability);
  }

  @Override
  public String toString() {
    return String.format("ClassificationResult{index=%d, id=%s, class=%s (%s), p=%f}",
        spectrumIndex, spectrumId, classIndex, classLabel, probability);
  }
}
