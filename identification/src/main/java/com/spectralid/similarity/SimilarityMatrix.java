package com.spectralid.similarity;

import com.spectralid.diagnostics.Diagnostic;
import org.apache.commons.lang3.tuple.Pair;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Dense similarity values between library spectra (rows) and object spectra (columns), with row and column labels.
 * Cells are NaN where a correlation is undefined.
 */
public class SimilarityMatrix {

  private final List<String> libraryIds;
  private final List<String> objectIds;
  private final Map<String, Integer> libraryIndex;
  private final Map<String, Integer> objectIndex;
  private final double[][] values;
  private final List<Diagnostic> diagnostics;

  public SimilarityMatrix(List<String> libraryIds, List<String> objectIds, double[][] values,
                          List<Diagnostic> diagnostics) {
    if (values.length != libraryIds.size()) {
      throw new IllegalArgumentException(String.format("Expected %d rows but got %d",
          libraryIds.size(), values.length));
    }
    this.libraryIds = Collections.unmodifiableList(new ArrayList<>(libraryIds));
    this.objectIds = Collections.unmodifiableList(new ArrayList<>(objectIds));
    this.values = new double[values.length][];
    for (int i = 0; i < values.length; i++) {
      if (values[i].length != objectIds.size()) {
        throw new IllegalArgumentException(String.format("Row %d has %d columns, expected %d",
            i, values[i].length, objectIds.size()));
      }
      this.values[i] = values[i].clone();
    }
    this.libraryIndex = indexLabels(this.libraryIds);
    this.objectIndex = indexLabels(this.objectIds);
    this.diagnostics = Collections.unmodifiableList(new ArrayList<>(diagnostics));
  }

  public SimilarityMatrix(List<String> libraryIds, List<String> objectIds, double[][] values) {
    this(libraryIds, objectIds, values, Collections.emptyList());
  }

  private static Map<String, Integer> indexLabels(List<String> labels) {
    Map<String, Integer> index = new HashMap<>(labels.size());
    for (int i = 0; i < labels.size(); i++) {
      index.put(labels.get(i), i);
    }
    return index;
  }

  public List<String> getLibraryIds() {
    return libraryIds;
  }

  public List<String> getObjectIds() {
    return objectIds;
  }

  public int getRowCount() {
    return libraryIds.size();
  }

  public int getColumnCount() {
    return objectIds.size();
  }

  public double get(int row, int column) {
    return values[row][column];
  }

  public double get(String libraryId, String objectId) {
    return values[rowOf(libraryId)][columnOf(objectId)];
  }

  public int rowOf(String libraryId) {
    Integer row = libraryIndex.get(libraryId);
    if (row == null) {
      throw new IllegalArgumentException(String.format("No library spectrum labelled '%s'", libraryId));
    }
    return row;
  }

  public int columnOf(String objectId) {
    Integer column = objectIndex.get(objectId);
    if (column == null) {
      throw new IllegalArgumentException(String.format("No object spectrum labelled '%s'", objectId));
    }
    return column;
  }

  public double[][] toArray() {
    double[][] copy = new double[values.length][];
    for (int i = 0; i < values.length; i++) {
      copy[i] = values[i].clone();
    }
    return copy;
  }

  public List<Diagnostic> getDiagnostics() {
    return diagnostics;
  }

  /**
   * Finds, for each object spectrum, the best scoring library spectrum.  When several rows share the maximum the first
   * one wins.  NaN cells never win; a column with no defined values maps to a null label and a NaN value.
   *
   * @return One (library id, value) pair per column, in column order.
   */
  public List<Pair<String, Double>> maxPerColumn() {
    List<Pair<String, Double>> best = new ArrayList<>(objectIds.size());
    for (int col = 0; col < objectIds.size(); col++) {
      int bestRow = -1;
      for (int row = 0; row < libraryIds.size(); row++) {
        double v = values[row][col];
        if (Double.isNaN(v)) {
          continue;
        }
        if (bestRow == -1 || v > values[bestRow][col]) {
          bestRow = row;
        }
      }
      if (bestRow == -1) {
        best.add(Pair.of(null, Double.NaN));
      } else {
        best.add(Pair.of(libraryIds.get(bestRow), values[bestRow][col]));
      }
    }
    return best;
  }
}
