package com.spectralid.diagnostics;

import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Collects diagnostics while a computation runs, logging each one as it is raised.
 */
public class Diagnostics {
  private final Logger logger;
  private final List<Diagnostic> collected = new ArrayList<>();

  public Diagnostics(Logger logger) {
    this.logger = logger;
  }

  public void warn(Diagnostic.Code code, String format, Object... args) {
    raise(Level.WARN, code, format, args);
  }

  public void notice(Diagnostic.Code code, String format, Object... args) {
    raise(Level.INFO, code, format, args);
  }

  private void raise(Level level, Diagnostic.Code code, String format, Object... args) {
    String msg = String.format(format, args);
    // Formatter loggers would re-interpret '%' in an already formatted message.
    logger.log(level, "%s", msg);
    collected.add(new Diagnostic(code, msg));
  }

  public void addAll(List<Diagnostic> diagnostics) {
    collected.addAll(diagnostics);
  }

  public List<Diagnostic> toList() {
    return Collections.unmodifiableList(new ArrayList<>(collected));
  }
}
