package com.spectralid.diagnostics;

import java.util.Objects;

/**
 * A recoverable condition encountered during a computation.  The computation carried on with reduced or adjusted
 * inputs, and the diagnostic travels with its result so callers can tell "adjusted" apart from "clean".
 */
public class Diagnostic {

  public enum Code {
    // Compared datasets share some, but not all, wavenumbers.
    PARTIAL_WAVENUMBER_OVERLAP,
    // More matches were requested per spectrum than the library holds.
    TOP_N_EXCEEDS_LIBRARY,
    // Too few readings to compute a derived statistic.
    INSUFFICIENT_VALUES,
    // Some wavenumbers of an unknown have no counterpart on a model's grid.
    UNMATCHED_ALIGNMENT_WAVENUMBERS,
    // A fill reference held more than one spectrum; only the first is used.
    MULTIPLE_FILL_SPECTRA
  }

  private final Code code;
  private final String message;

  public Diagnostic(Code code, String message) {
    this.code = code;
    this.message = message;
  }

  public Code getCode() {
    return code;
  }

  public String getMessage() {
    return message;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (o == null || getClass() != o.getClass()) return false;
    Diagnostic that = (Diagnostic) o;
    return code == that.code && Objects.equals(message, that.message);
  }

  @Override
  public int hashCode() {
    return Objects.hash(code, message);
  }

  @Override
  public String toString() {
    return String.format("%s: %s", code, message);
  }
}
