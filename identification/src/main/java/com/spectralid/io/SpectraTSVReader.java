package com.spectralid.io;

import com.spectralid.spectra.SpectralDataset;
import com.spectralid.spectra.SpectrumValidationException;
import com.spectralid.utils.TSVParser;
import org.apache.commons.lang3.StringUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Reads spectra stored as a wide TSV: a {@code wavenumber} column followed by one intensity column per spectrum.
 * Metadata lives in a separate TSV keyed by a {@code spectrum_id} column.
 */
public class SpectraTSVReader {
  private static final Logger LOGGER = LogManager.getFormatterLogger(SpectraTSVReader.class);

  public static final String WAVENUMBER_COLUMN = "wavenumber";
  public static final String SPECTRUM_ID_COLUMN = "spectrum_id";

  // Spellings of a missing reading.
  private static final Set<String> MISSING = new HashSet<String>() {{
    add("");
    add("NA");
    add("NaN");
    add("null");
  }};

  public SpectralDataset read(File spectraFile, File metadataFile) throws IOException {
    TSVParser spectraParser = new TSVParser();
    spectraParser.parse(spectraFile);
    TSVParser metadataParser = null;
    if (metadataFile != null) {
      metadataParser = new TSVParser();
      metadataParser.parse(metadataFile);
    }
    LOGGER.info("Read %d wavenumber rows from %s", spectraParser.getResults().size(), spectraFile.getPath());
    return build(spectraParser, metadataParser);
  }

  public SpectralDataset read(InputStream spectra, InputStream metadata) throws IOException {
    TSVParser spectraParser = new TSVParser();
    spectraParser.parse(spectra);
    TSVParser metadataParser = null;
    if (metadata != null) {
      metadataParser = new TSVParser();
      metadataParser.parse(metadata);
    }
    return build(spectraParser, metadataParser);
  }

  SpectralDataset build(TSVParser spectraParser, TSVParser metadataParser) {
    List<String> header = spectraParser.getHeader();
    if (header == null || !header.contains(WAVENUMBER_COLUMN)) {
      throw new SpectrumValidationException("Spectra file must have a '%s' column", WAVENUMBER_COLUMN);
    }
    List<String> ids = new ArrayList<>();
    for (String column : header) {
      if (!WAVENUMBER_COLUMN.equals(column)) {
        ids.add(column);
      }
    }

    // Rows are allowed in any order; the grid is sorted before building.
    List<Map<String, String>> rows = new ArrayList<>(spectraParser.getResults());
    for (Map<String, String> row : rows) {
      parseWavenumber(row.get(WAVENUMBER_COLUMN));
    }
    rows.sort(Comparator.comparingDouble(r -> parseWavenumber(r.get(WAVENUMBER_COLUMN))));

    double[] wavenumbers = new double[rows.size()];
    double[][] intensities = new double[ids.size()][rows.size()];
    for (int w = 0; w < rows.size(); w++) {
      Map<String, String> row = rows.get(w);
      wavenumbers[w] = parseWavenumber(row.get(WAVENUMBER_COLUMN));
      for (int s = 0; s < ids.size(); s++) {
        intensities[s][w] = parseIntensity(row.get(ids.get(s)), ids.get(s), wavenumbers[w]);
      }
    }

    Map<String, Map<String, Object>> metadata = metadataParser == null ?
        new LinkedHashMap<>() : indexMetadata(metadataParser);

    SpectralDataset.Builder builder = SpectralDataset.builder().setWavenumbers(wavenumbers);
    for (int s = 0; s < ids.size(); s++) {
      builder.addSpectrum(ids.get(s), intensities[s], metadata.get(ids.get(s)));
    }
    for (String id : metadata.keySet()) {
      if (!ids.contains(id)) {
        LOGGER.warn("Metadata row for '%s' has no matching spectrum, ignoring", id);
      }
    }
    return builder.build();
  }

  private Map<String, Map<String, Object>> indexMetadata(TSVParser parser) {
    if (parser.getHeader() == null || !parser.getHeader().contains(SPECTRUM_ID_COLUMN)) {
      throw new SpectrumValidationException("Metadata file must have a '%s' column", SPECTRUM_ID_COLUMN);
    }
    Map<String, Map<String, Object>> byId = new LinkedHashMap<>();
    for (Map<String, String> row : parser.getResults()) {
      String id = row.get(SPECTRUM_ID_COLUMN);
      if (byId.containsKey(id)) {
        LOGGER.warn("Duplicate metadata row for '%s', keeping the first", id);
        continue;
      }
      Map<String, Object> fields = new LinkedHashMap<>();
      for (String column : parser.getHeader()) {
        String value = row.get(column);
        fields.put(column, StringUtils.isBlank(value) || "NA".equals(value) ? null : value);
      }
      byId.put(id, fields);
    }
    return byId;
  }

  private static double parseWavenumber(String value) {
    if (value == null) {
      throw new SpectrumValidationException("Missing wavenumber");
    }
    try {
      return Double.parseDouble(StringUtils.trim(value));
    } catch (NumberFormatException e) {
      throw new SpectrumValidationException("Unparseable wavenumber '%s'", value);
    }
  }

  private static double parseIntensity(String value, String id, double wavenumber) {
    String trimmed = StringUtils.trimToEmpty(value);
    if (MISSING.contains(trimmed)) {
      return Double.NaN;
    }
    try {
      return Double.parseDouble(trimmed);
    } catch (NumberFormatException e) {
      throw new SpectrumValidationException("Unparseable intensity '%s' for spectrum '%s' at wavenumber %f",
          value, id, wavenumber);
    }
  }
}
