package com.spectralid.match;

import com.spectralid.classify.AlignmentFiller;
import com.spectralid.ranking.RankingOptions;
import com.spectralid.spectra.SpectralDataset;
import com.spectralid.spectra.SpectrumValidationException;

/**
 * Settings for {@link MatchOrchestrator#match}.  Everything is optional; the defaults return all correlation matches
 * unjoined and unsorted, and classify with the library's own fill reference.
 */
public class MatchOptions {
  private boolean naRm = true;
  private Integer topN;
  private String libraryMetadataKey;
  private String objectMetadataKey;
  private SpectralDataset order;
  private SpectralDataset fill;
  private double alignmentTolerance = AlignmentFiller.DEFAULT_TOLERANCE;

  public static MatchOptions defaults() {
    return new MatchOptions();
  }

  public MatchOptions setNaRm(boolean naRm) {
    this.naRm = naRm;
    return this;
  }

  /**
   * @throws SpectrumValidationException if topN is less than 1.
   */
  public MatchOptions setTopN(Integer topN) {
    if (topN != null && topN < 1) {
      throw new SpectrumValidationException("topN must be positive, got %d", topN);
    }
    this.topN = topN;
    return this;
  }

  public MatchOptions setLibraryMetadataKey(String column) {
    this.libraryMetadataKey = column;
    return this;
  }

  public MatchOptions setObjectMetadataKey(String column) {
    this.objectMetadataKey = column;
    return this;
  }

  /**
   * @param order A dataset whose spectrum order the results should follow, typically the unprocessed unknowns.
   */
  public MatchOptions setOrder(SpectralDataset order) {
    this.order = order;
    return this;
  }

  /**
   * @param fill A spectrum on the model grid used for padding; overrides the library's own fill reference.
   */
  public MatchOptions setFill(SpectralDataset fill) {
    this.fill = fill;
    return this;
  }

  public MatchOptions setAlignmentTolerance(double tolerance) {
    if (!(tolerance >= 0.0)) {
      throw new SpectrumValidationException("Tolerance must be non-negative, got %f", tolerance);
    }
    this.alignmentTolerance = tolerance;
    return this;
  }

  public boolean isNaRm() {
    return naRm;
  }

  public Integer getTopN() {
    return topN;
  }

  public String getLibraryMetadataKey() {
    return libraryMetadataKey;
  }

  public String getObjectMetadataKey() {
    return objectMetadataKey;
  }

  public SpectralDataset getOrder() {
    return order;
  }

  public SpectralDataset getFill() {
    return fill;
  }

  public double getAlignmentTolerance() {
    return alignmentTolerance;
  }

  public RankingOptions toRankingOptions() {
    return RankingOptions.defaults()
        .setTopN(topN)
        .setLibraryMetadataKey(libraryMetadataKey)
        .setObjectMetadataKey(objectMetadataKey);
  }
}
