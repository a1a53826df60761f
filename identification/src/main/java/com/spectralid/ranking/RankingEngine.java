package com.spectralid.ranking;

import com.spectralid.diagnostics.Diagnostic;
import com.spectralid.diagnostics.Diagnostics;
import com.spectralid.similarity.SimilarityMatrix;
import com.spectralid.spectra.SpectralDataset;
import com.spectralid.spectra.SpectrumValidationException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * Turns a similarity matrix into a tidy table of matches: one record per (unknown, library spectrum) pair, optionally
 * cut down to the best few per unknown and decorated with metadata from either side.
 */
public class RankingEngine {
  private static final Logger LOGGER = LogManager.getFormatterLogger(RankingEngine.class);

  /* Descending by value with NaN after every defined value.  List.sort is stable, so equal values keep the library
   * order they were unpivoted in. */
  static final Comparator<MatchRecord> BEST_FIRST = (a, b) -> {
    boolean aNaN = Double.isNaN(a.getMatchVal());
    boolean bNaN = Double.isNaN(b.getMatchVal());
    if (aNaN || bNaN) {
      return Boolean.compare(aNaN, bNaN);
    }
    return Double.compare(b.getMatchVal(), a.getMatchVal());
  };

  /**
   * @param matrix Similarities with library spectra as rows and unknowns as columns.
   * @param x The unknowns the matrix was computed from; only used for metadata joins.
   * @param library The library the matrix was computed from; bounds top-N and feeds metadata joins.
   * @param options Truncation and join settings.
   * @return Records grouped by unknown, in the matrix's column order.
   */
  public MatchTable rank(SimilarityMatrix matrix, SpectralDataset x, SpectralDataset library, RankingOptions options) {
    if (matrix == null) {
      throw new SpectrumValidationException("A similarity matrix is required");
    }
    if (options == null) {
      options = RankingOptions.defaults();
    }
    Diagnostics diagnostics = new Diagnostics(LOGGER);
    diagnostics.addAll(matrix.getDiagnostics());

    Integer topN = options.getTopN();
    int librarySize = library != null ? library.getSpectrumCount() : matrix.getRowCount();
    if (topN != null && topN > librarySize) {
      diagnostics.notice(Diagnostic.Code.TOP_N_EXCEEDS_LIBRARY,
          "topN (%d) is larger than the number of spectra in the library (%d); returning all matches",
          topN, librarySize);
      topN = null;
    }

    List<MatchRecord> records = new ArrayList<>(matrix.getRowCount() * matrix.getColumnCount());
    for (int col = 0; col < matrix.getColumnCount(); col++) {
      List<MatchRecord> group = new ArrayList<>(matrix.getRowCount());
      String objectId = matrix.getObjectIds().get(col);
      for (int row = 0; row < matrix.getRowCount(); row++) {
        group.add(new MatchRecord(objectId, matrix.getLibraryIds().get(row), matrix.get(row, col)));
      }
      if (topN != null) {
        group.sort(BEST_FIRST);
        group = group.subList(0, Math.min(topN, group.size()));
      }
      records.addAll(group);
    }

    if (options.getLibraryMetadataKey() != null) {
      records = joinMetadata(records, library, options.getLibraryMetadataKey(), MatchRecord::getLibraryId, true);
    }
    if (options.getObjectMetadataKey() != null) {
      records = joinMetadata(records, x, options.getObjectMetadataKey(), MatchRecord::getObjectId, false);
    }

    return new MatchTable(records, diagnostics.toList());
  }

  /* Left join: every record survives.  Records without a partner row get every joined column as null.  When several
   * metadata rows carry the same key the first one is used. */
  private List<MatchRecord> joinMetadata(List<MatchRecord> records, SpectralDataset dataset, String keyColumn,
                                         Function<MatchRecord, String> recordKey, boolean librarySide) {
    if (dataset == null) {
      throw new SpectrumValidationException("A dataset is required to join metadata on column '%s'", keyColumn);
    }
    if (!dataset.getMetadataColumns().contains(keyColumn)) {
      LOGGER.warn("Metadata has no column '%s'; joined fields will all be empty", keyColumn);
    }

    List<String> joinedColumns = new ArrayList<>();
    for (String column : dataset.getMetadataColumns()) {
      if (!column.equals(keyColumn)) {
        joinedColumns.add(column);
      }
    }

    Map<String, Map<String, Object>> rowsByKey = new HashMap<>();
    for (String id : dataset.getSpectrumIds()) {
      Map<String, Object> metadata = dataset.getMetadata(id);
      Object key = metadata.get(keyColumn);
      if (key != null && !rowsByKey.containsKey(key.toString())) {
        rowsByKey.put(key.toString(), metadata);
      }
    }

    List<MatchRecord> joined = new ArrayList<>(records.size());
    for (MatchRecord record : records) {
      Map<String, Object> partner = rowsByKey.get(recordKey.apply(record));
      Map<String, Object> fields = new LinkedHashMap<>();
      for (String column : joinedColumns) {
        fields.put(column, partner == null ? null : partner.get(column));
      }
      joined.add(librarySide ? record.withLibraryMetadata(fields) : record.withObjectMetadata(fields));
    }
    return joined;
  }
}
