package com.spectralid.match;

import com.spectralid.spectra.SpectralDataset;
import com.spectralid.spectra.SpectrumValidationException;

/**
 * A reference library of known spectra, matched by correlation.
 */
public class SpectralLibrary extends ReferenceLibrary {
  private final SpectralDataset spectra;

  public SpectralLibrary(SpectralDataset spectra) {
    if (spectra == null) {
      throw new SpectrumValidationException("A spectral library needs a dataset of reference spectra");
    }
    this.spectra = spectra;
  }

  public SpectralDataset getSpectra() {
    return spectra;
  }

  @Override
  public Kind getKind() {
    return Kind.SPECTRAL_LIBRARY;
  }

  @Override
  public SpectralLibrary asSpectralLibrary() {
    return this;
  }
}
