package com.spectralid.utils;

import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;

import java.io.File;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

public class TSVParser {
  private List<Map<String, String>> results = null;
  private List<String> header = null;

  public static final CSVFormat TSV_FORMAT = CSVFormat.newFormat('\t').
      withRecordSeparator('\n').withQuote('"').withIgnoreEmptyLines(true).withHeader();

  public void parse(File file) throws IOException {
    try (InputStream in = new FileInputStream(file)) {
      parse(in);
    }
  }

  public void parse(InputStream inStream) throws IOException {
    List<Map<String, String>> results = new ArrayList<>();
    try (CSVParser parser = new CSVParser(new InputStreamReader(inStream, StandardCharsets.UTF_8), TSV_FORMAT)) {
      header = new ArrayList<>(parser.getHeaderNames());
      Iterator<CSVRecord> iter = parser.iterator();
      while (iter.hasNext()) {
        CSVRecord r = iter.next();
        results.add(r.toMap());
      }
    }
    this.results = results;
  }

  public List<Map<String, String>> getResults() {
    return this.results;
  }

  /**
   * @return Column names in file order.
   */
  public List<String> getHeader() {
    return this.header;
  }
}
