package com.spectralid.utils;

import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVPrinter;

import java.io.File;
import java.io.FileOutputStream;
import java.io.IOException;
import java.io.OutputStreamWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

public class TSVWriter<K, V> implements AutoCloseable {
  public static final CSVFormat TSV_FORMAT = CSVFormat.newFormat('\t').
      withRecordSeparator('\n').withQuote('"').withIgnoreEmptyLines(true).withHeader();

  private final List<K> header;
  private CSVPrinter printer;

  public TSVWriter(List<K> header) {
    this.header = header;
  }

  /**
   * Builds a writer whose header is every key appearing in {@code rows}, in first-seen order.  Rows lacking a key get
   * an empty field.
   */
  public static <K, V> TSVWriter<K, V> forRows(List<Map<K, V>> rows) {
    Set<K> columns = new LinkedHashSet<>();
    for (Map<K, V> row : rows) {
      columns.addAll(row.keySet());
    }
    return new TSVWriter<>(new ArrayList<>(columns));
  }

  public List<K> getHeader() {
    return header;
  }

  public void open(File f) throws IOException {
    open(new OutputStreamWriter(new FileOutputStream(f), StandardCharsets.UTF_8));
  }

  public void open(Writer writer) throws IOException {
    String[] headerStrings = new String[header.size()];
    for (int i = 0; i < header.size(); i++) {
      headerStrings[i] = header.get(i).toString();
    }
    printer = new CSVPrinter(writer, TSV_FORMAT.withHeader(headerStrings));
  }

  @Override
  public void close() throws IOException {
    if (printer != null) {
      printer.close();
      printer = null;
    }
  }

  public void append(Map<K, V> row) throws IOException {
    List<V> vals = new ArrayList<>(header.size());
    for (K field : header) {
      vals.add(row.get(field));
    }
    printer.printRecord(vals);
  }

  public void append(List<Map<K, V>> rows) throws IOException {
    for (Map<K, V> row : rows) {
      append(row);
    }
    printer.flush();
  }

}
