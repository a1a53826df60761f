package com.spectralid.spectra;

/**
 * Thrown when inputs to a matching operation are unusable: a missing or mistyped library, malformed datasets, too few
 * shared wavenumbers, or selectors that point outside a dataset.  Always raised before any computation starts.
 */
public class SpectrumValidationException extends RuntimeException {
  public SpectrumValidationException(String msg) {
    super(msg);
  }

  public SpectrumValidationException(String format, Object... args) {
    super(String.format(format, args));
  }
}
