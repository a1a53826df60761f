package com.spectralid.match;

/**
 * What unknowns are identified against: either a set of labeled reference spectra or a trained classifier.
 */
public abstract class ReferenceLibrary {

  public enum Kind {
    SPECTRAL_LIBRARY,
    TRAINED_MODEL
  }

  public abstract Kind getKind();

  public SpectralLibrary asSpectralLibrary() {
    throw new IllegalStateException(String.format("A %s library is not a spectral library", getKind()));
  }

  public ModelLibrary asModelLibrary() {
    throw new IllegalStateException(String.format("A %s library is not a trained model", getKind()));
  }
}
