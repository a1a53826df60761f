package com.spectralid.match;

import com.spectralid.classify.ClassificationResult;
import com.spectralid.diagnostics.Diagnostic;
import com.spectralid.ranking.MatchRecord;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * The outcome of identifying a set of unknowns.  Correlation matching yields {@link MatchRecord}s; classification yields
 * {@link ClassificationResult}s.  Exactly one of the two lists is populated, according to {@link #getKind()}.
 */
public class MatchResult {
  private final ReferenceLibrary.Kind kind;
  private final List<MatchRecord> matches;
  private final List<ClassificationResult> classifications;
  private final List<Diagnostic> diagnostics;

  private MatchResult(ReferenceLibrary.Kind kind, List<MatchRecord> matches,
                      List<ClassificationResult> classifications, List<Diagnostic> diagnostics) {
    this.kind = kind;
    this.matches = Collections.unmodifiableList(new ArrayList<>(matches));
    this.classifications = Collections.unmodifiableList(new ArrayList<>(classifications));
    this.diagnostics = Collections.unmodifiableList(new ArrayList<>(diagnostics));
  }

  public static MatchResult ofMatches(List<MatchRecord> matches, List<Diagnostic> diagnostics) {
    return new MatchResult(ReferenceLibrary.Kind.SPECTRAL_LIBRARY, matches, Collections.emptyList(), diagnostics);
  }

  public static MatchResult ofClassifications(List<ClassificationResult> classifications,
                                              List<Diagnostic> diagnostics) {
    return new MatchResult(ReferenceLibrary.Kind.TRAINED_MODEL, Collections.emptyList(), classifications, diagnostics);
  }

  public ReferenceLibrary.Kind getKind() {
    return kind;
  }

  public List<MatchRecord> getMatches() {
    return matches;
  }

  public List<ClassificationResult> getClassifications() {
    return classifications;
  }

  public List<Diagnostic> getDiagnostics() {
    return diagnostics;
  }

  public boolean hasDiagnostic(Diagnostic.Code code) {
    for (Diagnostic d : diagnostics) {
      if (d.getCode() == code) {
        return true;
      }
    }
    return false;
  }

  public int size() {
    return kind == ReferenceLibrary.Kind.SPECTRAL_LIBRARY ? matches.size() : classifications.size();
  }

  /**
   * @return The unknown each row is about, in row order.
   */
  public List<String> getObjectIds() {
    List<String> ids = new ArrayList<>(size());
    if (kind == ReferenceLibrary.Kind.SPECTRAL_LIBRARY) {
      for (MatchRecord r : matches) {
        ids.add(r.getObjectId());
      }
    } else {
      for (ClassificationResult r : classifications) {
        ids.add(r.getSpectrumId());
      }
    }
    return ids;
  }

  /**
   * @return Every row flattened to named fields, suitable for tabular output.
   */
  public List<Map<String, Object>> toRows() {
    List<Map<String, Object>> rows = new ArrayList<>(size());
    if (kind == ReferenceLibrary.Kind.SPECTRAL_LIBRARY) {
      for (MatchRecord r : matches) {
        rows.add(r.toRow());
      }
    } else {
      for (ClassificationResult r : classifications) {
        rows.add(r.toRow());
      }
    }
    return rows;
  }

  /**
   * Rearranges rows by position.
   *
   * @param rowOrder A permutation of row positions.
   */
  MatchResult permute(List<Integer> rowOrder) {
    if (kind == ReferenceLibrary.Kind.SPECTRAL_LIBRARY) {
      List<MatchRecord> reordered = new ArrayList<>(matches.size());
      for (Integer i : rowOrder) {
        reordered.add(matches.get(i));
      }
      return ofMatches(reordered, diagnostics);
    }
    List<ClassificationResult> reordered = new ArrayList<>(classifications.size());
    for (Integer i : rowOrder) {
      reordered.add(classifications.get(i));
    }
    return ofClassifications(reordered, diagnostics);
  }
}
