package com.spectralid.spectra;

import org.apache.commons.lang3.StringUtils;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Selection and projection over {@link SpectralDataset}s.
 */
public class SpectraFilter {

  private SpectraFilter() {
  }

  /**
   * Builds a new dataset holding only the selected spectra (and their metadata), on the same grid.  An empty selection
   * is valid and yields an empty dataset that keeps the source's metadata columns.
   */
  public static SpectralDataset filter(SpectralDataset dataset, SpectrumSelector selector) {
    requireDataset(dataset);
    int[] positions = selector.resolve(dataset);

    SpectralDataset.Builder builder = dataset.toEmptyBuilder().addMetadataColumns(dataset.getMetadataColumns());
    for (int pos : positions) {
      builder.addSpectrum(dataset.getSpectrumIds().get(pos), dataset.getIntensities(pos), dataset.getMetadata(pos));
    }
    return builder.build();
  }

  /**
   * Projects the metadata of the selected spectra, in selection order.
   *
   * @param rmEmpty When true, columns that are null or blank for every selected spectrum are left out of every row.
   * @return One ordered record per selected spectrum.
   */
  public static List<Map<String, Object>> getMetadata(SpectralDataset dataset, SpectrumSelector selector,
                                                      boolean rmEmpty) {
    requireDataset(dataset);
    int[] positions = selector.resolve(dataset);

    List<String> keptColumns = new ArrayList<>();
    for (String column : dataset.getMetadataColumns()) {
      if (!rmEmpty || !isEmptyColumn(dataset, positions, column)) {
        keptColumns.add(column);
      }
    }

    List<Map<String, Object>> rows = new ArrayList<>(positions.length);
    for (int pos : positions) {
      Map<String, Object> record = dataset.getMetadata(pos);
      Map<String, Object> row = new LinkedHashMap<>();
      for (String column : keptColumns) {
        row.put(column, record.get(column));
      }
      rows.add(row);
    }
    return rows;
  }

  private static boolean isEmptyColumn(SpectralDataset dataset, int[] positions, String column) {
    for (int pos : positions) {
      Object value = dataset.getMetadata(pos).get(column);
      if (!isEmptyValue(value)) {
        return false;
      }
    }
    return true;
  }

  static boolean isEmptyValue(Object value) {
    if (value == null) {
      return true;
    }
    if (value instanceof Double && ((Double) value).isNaN()) {
      return true;
    }
    return value instanceof CharSequence && StringUtils.isBlank((CharSequence) value);
  }

  private static void requireDataset(SpectralDataset dataset) {
    if (dataset == null) {
      throw new SpectrumValidationException("A spectral dataset is required");
    }
  }
}
