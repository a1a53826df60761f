package com.spectralid.match;

import com.spectralid.classify.ClassificationModel;
import com.spectralid.classify.MultinomialModel;
import com.spectralid.spectra.SpectralDataset;
import com.spectralid.spectra.SpectrumValidationException;

import java.io.File;
import java.io.IOException;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * A trained classifier together with the names of its classes and, optionally, a spectrum on the model's grid used to
 * pad unknowns that do not cover the whole grid.
 */
public class ModelLibrary extends ReferenceLibrary {
  private final ClassificationModel model;
  private final Map<Integer, String> classLabels;
  private final SpectralDataset fillReference;

  public ModelLibrary(ClassificationModel model, Map<Integer, String> classLabels, SpectralDataset fillReference) {
    if (model == null) {
      throw new SpectrumValidationException("A model library needs a model");
    }
    this.model = model;
    this.classLabels = classLabels == null ? Collections.emptyMap() : new HashMap<>(classLabels);
    this.fillReference = fillReference;
  }

  public ModelLibrary(ClassificationModel model, Map<Integer, String> classLabels) {
    this(model, classLabels, null);
  }

  /**
   * Loads a {@link MultinomialModel} file; the class names stored in the file become the library's labels.
   */
  public static ModelLibrary fromModelFile(File modelFile, SpectralDataset fillReference) throws IOException {
    MultinomialModel model = MultinomialModel.readFromJsonFile(modelFile);
    return new ModelLibrary(model, model.getClassLabels(), fillReference);
  }

  public ClassificationModel getModel() {
    return model;
  }

  public Map<Integer, String> getClassLabels() {
    return Collections.unmodifiableMap(classLabels);
  }

  public Optional<SpectralDataset> getFillReference() {
    return Optional.ofNullable(fillReference);
  }

  @Override
  public Kind getKind() {
    return Kind.TRAINED_MODEL;
  }

  @Override
  public ModelLibrary asModelLibrary() {
    return this;
  }
}
