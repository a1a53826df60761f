package com.spectralid.ranking;

import com.spectralid.spectra.SpectrumValidationException;

/**
 * How a similarity matrix is turned into a match table.  Unset fields mean "return every match" and "join nothing".
 */
public class RankingOptions {
  private Integer topN;
  private String libraryMetadataKey;
  private String objectMetadataKey;

  public static RankingOptions defaults() {
    return new RankingOptions();
  }

  /**
   * @param topN How many best matches to keep per unknown; null keeps all of them.
   * @throws SpectrumValidationException if topN is less than 1.
   */
  public RankingOptions setTopN(Integer topN) {
    if (topN != null && topN < 1) {
      throw new SpectrumValidationException("topN must be positive, got %d", topN);
    }
    this.topN = topN;
    return this;
  }

  /**
   * @param column The library metadata column whose values are library spectrum ids; null skips the join.
   */
  public RankingOptions setLibraryMetadataKey(String column) {
    this.libraryMetadataKey = column;
    return this;
  }

  /**
   * @param column The object metadata column whose values are unknown spectrum ids; null skips the join.
   */
  public RankingOptions setObjectMetadataKey(String column) {
    this.objectMetadataKey = column;
    return this;
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
}
