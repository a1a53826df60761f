package com.spectralid.utils;

import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import java.io.File;
import java.util.Arrays;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.Assert.assertEquals;

public class TSVWriterTest {

  @Rule
  public TemporaryFolder tempFolder = new TemporaryFolder();

  @Test
  public void testWrittenRowsParseBack() throws Exception {
    // Arrange
    File out = tempFolder.newFile("matches.tsv");
    List<String> header = Arrays.asList("object_id", "library_id", "match_val");
    Map<String, Object> row = new HashMap<>();
    row.put("object_id", "u1");
    row.put("library_id", "pe");
    row.put("match_val", 0.5);

    // Act
    try (TSVWriter<String, Object> writer = new TSVWriter<>(header)) {
      writer.open(out);
      writer.append(Arrays.asList(row));
    }
    TSVParser parser = new TSVParser();
    parser.parse(out);

    // Assert
    assertEquals("Header order is kept", header, parser.getHeader());
    assertEquals("One data row", 1, parser.getResults().size());
    assertEquals("Values are written as text", "0.5", parser.getResults().get(0).get("match_val"));
  }

  @Test
  public void testHeaderForRowsIsTheUnionOfKeysInFirstSeenOrder() throws Exception {
    Map<String, Object> first = new LinkedHashMap<>();
    first.put("object_id", "u1");
    first.put("material", "nylon");
    Map<String, Object> second = new LinkedHashMap<>();
    second.put("object_id", "u2");
    second.put("site", "beach");
    second.put("material", "polystyrene");

    TSVWriter<String, Object> writer = TSVWriter.forRows(Arrays.asList(first, second));

    assertEquals("Each key once, in the order first seen",
        Arrays.asList("object_id", "material", "site"), writer.getHeader());
  }
}
