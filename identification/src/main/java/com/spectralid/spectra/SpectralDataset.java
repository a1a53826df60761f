package com.spectralid.spectra;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * A set of spectra sharing one wavenumber grid, with one metadata record per spectrum.
 *
 * Intensities are stored spectrum-major: {@code getIntensities(i)[j]} is the reading of spectrum i at
 * {@code getWavenumbers()[j]}.  Missing readings are NaN.  Instances are immutable; every accessor returning an array
 * hands out a copy.
 */
public class SpectralDataset {

  private final double[] wavenumbers;
  private final List<String> spectrumIds;
  private final Map<String, Integer> idToIndex;
  private final double[][] intensities;
  private final List<String> metadataColumns;
  private final Map<String, Map<String, Object>> metadata;

  private SpectralDataset(double[] wavenumbers, List<String> spectrumIds, double[][] intensities,
                          List<String> metadataColumns, Map<String, Map<String, Object>> metadata) {
    this.wavenumbers = wavenumbers;
    this.spectrumIds = Collections.unmodifiableList(spectrumIds);
    this.intensities = intensities;
    this.metadataColumns = Collections.unmodifiableList(metadataColumns);
    this.metadata = metadata;

    this.idToIndex = new HashMap<>(spectrumIds.size());
    for (int i = 0; i < spectrumIds.size(); i++) {
      idToIndex.put(spectrumIds.get(i), i);
    }
  }

  public static Builder builder() {
    return new Builder();
  }

  public double[] getWavenumbers() {
    return wavenumbers.clone();
  }

  public int getGridSize() {
    return wavenumbers.length;
  }

  public int getSpectrumCount() {
    return spectrumIds.size();
  }

  public boolean isEmpty() {
    return spectrumIds.isEmpty();
  }

  public List<String> getSpectrumIds() {
    return spectrumIds;
  }

  public boolean containsSpectrum(String id) {
    return idToIndex.containsKey(id);
  }

  /**
   * @return The position of the spectrum with this id, or -1 if the dataset does not contain it.
   */
  public int indexOf(String id) {
    Integer idx = idToIndex.get(id);
    return idx == null ? -1 : idx;
  }

  public double[] getIntensities(int spectrumIndex) {
    return intensities[spectrumIndex].clone();
  }

  public double[] getIntensities(String id) {
    return getIntensities(requireIndex(id));
  }

  public List<String> getMetadataColumns() {
    return metadataColumns;
  }

  /**
   * Returns the metadata record of a spectrum.  Records always hold every metadata column; fields a spectrum never had
   * are present with a null value.
   */
  public Map<String, Object> getMetadata(String id) {
    requireIndex(id);
    return Collections.unmodifiableMap(metadata.get(id));
  }

  public Map<String, Object> getMetadata(int spectrumIndex) {
    return getMetadata(spectrumIds.get(spectrumIndex));
  }

  private int requireIndex(String id) {
    Integer idx = idToIndex.get(id);
    if (idx == null) {
      throw new SpectrumValidationException("Unknown spectrum id '%s'", id);
    }
    return idx;
  }

  /**
   * Starts a builder that copies this dataset's grid, leaving spectra and metadata to the caller.
   */
  public Builder toEmptyBuilder() {
    return new Builder().setWavenumbers(wavenumbers);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (o == null || getClass() != o.getClass()) return false;
    SpectralDataset that = (SpectralDataset) o;
    return Arrays.equals(wavenumbers, that.wavenumbers) &&
        spectrumIds.equals(that.spectrumIds) &&
        Arrays.deepEquals(intensities, that.intensities) &&
        metadataColumns.equals(that.metadataColumns) &&
        metadata.equals(that.metadata);
  }

  @Override
  public int hashCode() {
    return Objects.hash(Arrays.hashCode(wavenumbers), spectrumIds, Arrays.deepHashCode(intensities), metadata);
  }

  @Override
  public String toString() {
    return String.format("SpectralDataset{spectra=%d, gridSize=%d, metadataColumns=%s}",
        spectrumIds.size(), wavenumbers.length, metadataColumns);
  }

  public static class Builder {
    private double[] wavenumbers;
    private final List<String> ids = new ArrayList<>();
    private final List<double[]> spectra = new ArrayList<>();
    private final Map<String, Map<String, Object>> metadata = new HashMap<>();
    private final Set<String> metadataColumns = new LinkedHashSet<>();

    public Builder setWavenumbers(double[] wavenumbers) {
      this.wavenumbers = wavenumbers == null ? null : wavenumbers.clone();
      return this;
    }

    public Builder addSpectrum(String id, double[] intensities) {
      return addSpectrum(id, intensities, Collections.emptyMap());
    }

    public Builder addSpectrum(String id, double[] intensities, Map<String, Object> fields) {
      if (id == null) {
        throw new SpectrumValidationException("Spectrum ids must not be null");
      }
      if (metadata.containsKey(id)) {
        throw new SpectrumValidationException("Duplicate spectrum id '%s'", id);
      }
      if (intensities == null) {
        throw new SpectrumValidationException("Spectrum '%s' has no intensities", id);
      }
      ids.add(id);
      spectra.add(intensities.clone());
      metadata.put(id, new LinkedHashMap<>());
      putMetadata(id, fields);
      return this;
    }

    /**
     * Declares metadata columns up front so they survive even when no spectrum is added.
     */
    public Builder addMetadataColumns(Collection<String> columns) {
      metadataColumns.addAll(columns);
      return this;
    }

    /**
     * Adds (or overwrites) metadata fields of a spectrum that was already added.
     */
    public Builder putMetadata(String id, Map<String, Object> fields) {
      Map<String, Object> record = metadata.get(id);
      if (record == null) {
        throw new SpectrumValidationException("Metadata given for unknown spectrum '%s'", id);
      }
      if (fields != null) {
        for (Map.Entry<String, Object> entry : fields.entrySet()) {
          metadataColumns.add(entry.getKey());
          record.put(entry.getKey(), entry.getValue());
        }
      }
      return this;
    }

    public SpectralDataset build() {
      if (wavenumbers == null) {
        throw new SpectrumValidationException("A wavenumber grid is required");
      }
      for (int i = 0; i < wavenumbers.length; i++) {
        if (!Double.isFinite(wavenumbers[i])) {
          throw new SpectrumValidationException("Wavenumber at position %d is not finite", i);
        }
        if (i > 0 && wavenumbers[i] <= wavenumbers[i - 1]) {
          throw new SpectrumValidationException(
              "Wavenumbers must be strictly increasing: %f follows %f at position %d",
              wavenumbers[i], wavenumbers[i - 1], i);
        }
      }

      double[][] intensities = new double[spectra.size()][];
      for (int i = 0; i < spectra.size(); i++) {
        if (spectra.get(i).length != wavenumbers.length) {
          throw new SpectrumValidationException("Spectrum '%s' has %d readings but the grid has %d wavenumbers",
              ids.get(i), spectra.get(i).length, wavenumbers.length);
        }
        intensities[i] = spectra.get(i).clone();
      }

      // Every record carries every column, in first-seen order.
      List<String> columns = new ArrayList<>(metadataColumns);
      Map<String, Map<String, Object>> records = new HashMap<>(metadata.size());
      for (String id : ids) {
        Map<String, Object> source = metadata.get(id);
        Map<String, Object> record = new LinkedHashMap<>();
        for (String column : columns) {
          record.put(column, source.get(column));
        }
        records.put(id, record);
      }

      return new SpectralDataset(wavenumbers.clone(), new ArrayList<>(ids), intensities, columns, records);
    }
  }
}
