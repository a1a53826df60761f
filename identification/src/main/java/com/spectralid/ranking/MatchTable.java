package com.spectralid.ranking;

import com.spectralid.diagnostics.Diagnostic;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * An ordered list of match records, together with the diagnostics raised while producing it.
 */
public class MatchTable {
  private final List<MatchRecord> records;
  private final List<Diagnostic> diagnostics;

  public MatchTable(List<MatchRecord> records, List<Diagnostic> diagnostics) {
    this.records = Collections.unmodifiableList(new ArrayList<>(records));
    this.diagnostics = Collections.unmodifiableList(new ArrayList<>(diagnostics));
  }

  public List<MatchRecord> getRecords() {
    return records;
  }

  public List<Diagnostic> getDiagnostics() {
    return diagnostics;
  }

  public int size() {
    return records.size();
  }

  public List<MatchRecord> forObject(String objectId) {
    return records.stream().filter(r -> r.getObjectId().equals(objectId)).collect(Collectors.toList());
  }
}
