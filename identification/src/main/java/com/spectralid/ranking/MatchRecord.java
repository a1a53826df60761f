package com.spectralid.ranking;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * One (unknown, library spectrum) pairing with its similarity, plus any metadata joined onto it.
 */
public class MatchRecord {
  public static final String FIELD_OBJECT_ID = "object_id";
  public static final String FIELD_LIBRARY_ID = "library_id";
  public static final String FIELD_MATCH_VAL = "match_val";

  private final String objectId;
  private final String libraryId;
  private final double matchVal;
  private final Map<String, Object> libraryMetadata;
  private final Map<String, Object> objectMetadata;

  public MatchRecord(String objectId, String libraryId, double matchVal) {
    this(objectId, libraryId, matchVal, Collections.emptyMap(), Collections.emptyMap());
  }

  public MatchRecord(String objectId, String libraryId, double matchVal,
                     Map<String, Object> libraryMetadata, Map<String, Object> objectMetadata) {
    this.objectId = objectId;
    this.libraryId = libraryId;
    this.matchVal = matchVal;
    this.libraryMetadata = Collections.unmodifiableMap(new LinkedHashMap<>(libraryMetadata));
    this.objectMetadata = Collections.unmodifiableMap(new LinkedHashMap<>(objectMetadata));
  }

  public String getObjectId() {
    return objectId;
  }

  public String getLibraryId() {
    return libraryId;
  }

  /**
   * @return The similarity, NaN when it is undefined.
   */
  public double getMatchVal() {
    return matchVal;
  }

  public boolean hasMatchVal() {
    return !Double.isNaN(matchVal);
  }

  /**
   * @return Library metadata fields joined onto this record; every field is null if the join found no row.
   */
  public Map<String, Object> getLibraryMetadata() {
    return libraryMetadata;
  }

  public Map<String, Object> getObjectMetadata() {
    return objectMetadata;
  }

  public MatchRecord withLibraryMetadata(Map<String, Object> fields) {
    return new MatchRecord(objectId, libraryId, matchVal, fields, objectMetadata);
  }

  public MatchRecord withObjectMetadata(Map<String, Object> fields) {
    return new MatchRecord(objectId, libraryId, matchVal, libraryMetadata, fields);
  }

  /**
   * Flattens this record into a single row: the three match fields, then library metadata, then object metadata.
   * Metadata fields whose names collide with earlier fields are suffixed with ".library" or ".object".
   */
  public Map<String, Object> toRow() {
    Map<String, Object> row = new LinkedHashMap<>();
    row.put(FIELD_OBJECT_ID, objectId);
    row.put(FIELD_LIBRARY_ID, libraryId);
    row.put(FIELD_MATCH_VAL, matchVal);
    for (Map.Entry<String, Object> entry : libraryMetadata.entrySet()) {
      String key = row.containsKey(entry.getKey()) ? entry.getKey() + ".library" : entry.getKey();
      row.put(key, entry.getValue());
    }
    for (Map.Entry<String, Object> entry : objectMetadata.entrySet()) {
      String key = row.containsKey(entry.getKey()) ? entry.getKey() + ".object" : entry.getKey();
      row.put(key, entry.getValue());
    }
    return row;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (o == null || getClass() != o.getClass()) return false;
    MatchRecord that = (MatchRecord) o;
    return Double.compare(that.matchVal, matchVal) == 0 &&
        Objects.equals(objectId, that.objectId) &&
        Objects.equals(libraryId, that.libraryId) &&
        Objects.equals(libraryMetadata, that.libraryMetadata) &&
        Objects.equals(objectMetadata, that.objectMetadata);
  }

  @Override
  public int hashCode() {
    return Objects.hash(objectId, libraryId, matchVal, libraryMetadata, objectMetadata);
  }

  @Override
  public String toString() {
    return String.format("MatchRecord{object=%s, library=%s, match=%.6f}", objectId, libraryId, matchVal);
  }
}
