package com.spectralid.cli;

import com.spectralid.conform.GridConformer;
import com.spectralid.diagnostics.Diagnostic;
import com.spectralid.io.SpectraTSVReader;
import com.spectralid.match.MatchOptions;
import com.spectralid.match.MatchOrchestrator;
import com.spectralid.match.MatchResult;
import com.spectralid.match.ModelLibrary;
import com.spectralid.match.ReferenceLibrary;
import com.spectralid.match.SpectralLibrary;
import com.spectralid.quality.SignalNoise;
import com.spectralid.spectra.SpectraFilter;
import com.spectralid.spectra.SpectralDataset;
import com.spectralid.spectra.SpectrumSelector;
import com.spectralid.spectra.SpectrumValidationException;
import com.spectralid.utils.CLIUtil;
import com.spectralid.utils.TSVWriter;
import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.Option;
import org.apache.commons.lang3.StringUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.joda.time.DateTime;

import java.io.File;
import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Identifies unknown spectra against a spectral library or a trained classifier and writes one row per match.
 */
public class SpectrumMatcher {
  private static final Logger LOGGER = LogManager.getFormatterLogger(SpectrumMatcher.class);

  public static final String OPTION_INPUT = "i";
  public static final String OPTION_INPUT_METADATA = "m";
  public static final String OPTION_LIBRARY = "l";
  public static final String OPTION_LIBRARY_METADATA = "L";
  public static final String OPTION_MODEL = "M";
  public static final String OPTION_FILL = "f";
  public static final String OPTION_TOP_N = "n";
  public static final String OPTION_LIBRARY_KEY = "k";
  public static final String OPTION_OBJECT_KEY = "K";
  public static final String OPTION_KEEP_INPUT_ORDER = "r";
  public static final String OPTION_CONFORM = "c";
  public static final String OPTION_MIN_SIGNAL_NOISE = "s";
  public static final String OPTION_OUTPUT = "o";

  public static final String HELP_MESSAGE = StringUtils.join(new String[]{
      "This class identifies unknown spectra.  With a spectral library every unknown is correlated against every ",
      "library spectrum and the best matches are written out; with a model file the unknowns are classified and the ",
      "most probable class is written out.  Spectra files are wide TSVs with a 'wavenumber' column followed by one ",
      "column per spectrum; metadata files are TSVs keyed by a 'spectrum_id' column."
  }, "");

  public static final List<Option.Builder> OPTION_BUILDERS = new ArrayList<Option.Builder>() {{
    add(Option.builder(OPTION_INPUT)
        .argName("input file")
        .desc("A wide TSV of unknown spectra to identify")
        .hasArg().required()
        .longOpt("input")
    );
    add(Option.builder(OPTION_INPUT_METADATA)
        .argName("input metadata file")
        .desc("A TSV of metadata about the unknown spectra")
        .hasArg()
        .longOpt("input-metadata")
    );
    add(Option.builder(OPTION_LIBRARY)
        .argName("library file")
        .desc("A wide TSV of reference spectra; exclusive with -M")
        .hasArg()
        .longOpt("library")
    );
    add(Option.builder(OPTION_LIBRARY_METADATA)
        .argName("library metadata file")
        .desc("A TSV of metadata about the library spectra")
        .hasArg()
        .longOpt("library-metadata")
    );
    add(Option.builder(OPTION_MODEL)
        .argName("model file")
        .desc("A JSON multinomial classifier; exclusive with -l")
        .hasArg()
        .longOpt("model")
    );
    add(Option.builder(OPTION_FILL)
        .argName("fill file")
        .desc("A wide TSV whose first spectrum pads wavenumbers the unknowns lack before classification")
        .hasArg()
        .longOpt("fill")
    );
    add(Option.builder(OPTION_TOP_N)
        .argName("count")
        .desc("Keep only this many best library matches per unknown")
        .hasArg()
        .longOpt("top-n")
    );
    add(Option.builder(OPTION_LIBRARY_KEY)
        .argName("column")
        .desc("Library metadata column matched against library ids (default: spectrum_id)")
        .hasArg()
        .longOpt("library-key")
    );
    add(Option.builder(OPTION_OBJECT_KEY)
        .argName("column")
        .desc("Input metadata column matched against unknown ids (default: spectrum_id)")
        .hasArg()
        .longOpt("object-key")
    );
    add(Option.builder(OPTION_KEEP_INPUT_ORDER)
        .desc("Order output rows by the column order of the input file")
        .longOpt("keep-input-order")
    );
    add(Option.builder(OPTION_CONFORM)
        .desc("Resample the unknowns onto the library's wavenumbers before matching")
        .longOpt("conform")
    );
    add(Option.builder(OPTION_MIN_SIGNAL_NOISE)
        .argName("ratio")
        .desc("Drop unknowns whose rolling signal to noise ratio is below this value")
        .hasArg()
        .longOpt("min-signal-noise")
    );
    add(Option.builder(OPTION_OUTPUT)
        .argName("output file")
        .desc("Where to write the result TSV")
        .hasArg().required()
        .longOpt("output")
    );
  }};

  private static final CLIUtil CLI_UTIL = new CLIUtil(SpectrumMatcher.class, HELP_MESSAGE, OPTION_BUILDERS);

  public static void main(String[] args) throws Exception {
    CommandLine cl = CLI_UTIL.parseCommandLine(args);

    if (cl.hasOption(OPTION_LIBRARY) == cl.hasOption(OPTION_MODEL)) {
      CLI_UTIL.failWithMessage("Exactly one of a library (-%s) or a model (-%s) must be specified",
          OPTION_LIBRARY, OPTION_MODEL);
    }

    MatchOptions options = null;
    Double minSignalNoise = null;
    try {
      options = buildOptions(cl);
      minSignalNoise = parseMinSignalNoise(cl);
    } catch (NumberFormatException | SpectrumValidationException e) {
      CLI_UTIL.failWithMessage("Invalid option value: %s", e.getMessage());
    }

    DateTime start = DateTime.now();
    SpectraTSVReader reader = new SpectraTSVReader();
    SpectralDataset unknowns = reader.read(
        CLI_UTIL.getExistingFile(cl, OPTION_INPUT), CLI_UTIL.getExistingFile(cl, OPTION_INPUT_METADATA));
    LOGGER.info("Loaded %d unknown spectra on %d wavenumbers", unknowns.getSpectrumCount(), unknowns.getGridSize());

    if (cl.hasOption(OPTION_KEEP_INPUT_ORDER)) {
      options.setOrder(unknowns);
    }

    ReferenceLibrary library;
    if (cl.hasOption(OPTION_LIBRARY)) {
      SpectralDataset librarySpectra = reader.read(
          CLI_UTIL.getExistingFile(cl, OPTION_LIBRARY), CLI_UTIL.getExistingFile(cl, OPTION_LIBRARY_METADATA));
      LOGGER.info("Loaded %d library spectra", librarySpectra.getSpectrumCount());
      library = new SpectralLibrary(librarySpectra);
      if (cl.hasOption(OPTION_CONFORM)) {
        unknowns = new GridConformer().conform(unknowns, librarySpectra.getWavenumbers(), null);
      }
    } else {
      SpectralDataset fill = null;
      if (cl.hasOption(OPTION_FILL)) {
        fill = reader.read(CLI_UTIL.getExistingFile(cl, OPTION_FILL), null);
      }
      library = ModelLibrary.fromModelFile(CLI_UTIL.getExistingFile(cl, OPTION_MODEL), fill);
    }

    if (minSignalNoise != null) {
      unknowns = dropNoisy(unknowns, minSignalNoise);
    }

    MatchResult result = new MatchOrchestrator().match(unknowns, library, options);
    for (Diagnostic d : result.getDiagnostics()) {
      LOGGER.info("Diagnostic: %s", d);
    }

    File outputFile = new File(cl.getOptionValue(OPTION_OUTPUT));
    writeResult(result, outputFile);
    DateTime end = DateTime.now();
    LOGGER.info("Wrote %d rows to %s in %d ms", result.size(), outputFile.getPath(),
        end.getMillis() - start.getMillis());
  }

  /**
   * Turns ranking and join options into match settings without touching any input file.
   *
   * @throws NumberFormatException if top-n is not an integer.
   * @throws SpectrumValidationException if top-n is less than 1.
   */
  static MatchOptions buildOptions(CommandLine cl) {
    MatchOptions options = MatchOptions.defaults()
        .setLibraryMetadataKey(cl.getOptionValue(OPTION_LIBRARY_KEY, SpectraTSVReader.SPECTRUM_ID_COLUMN))
        .setObjectMetadataKey(cl.getOptionValue(OPTION_OBJECT_KEY, SpectraTSVReader.SPECTRUM_ID_COLUMN));
    if (cl.hasOption(OPTION_TOP_N)) {
      options.setTopN(Integer.valueOf(cl.getOptionValue(OPTION_TOP_N)));
    }
    return options;
  }

  static Double parseMinSignalNoise(CommandLine cl) {
    if (!cl.hasOption(OPTION_MIN_SIGNAL_NOISE)) {
      return null;
    }
    return Double.valueOf(cl.getOptionValue(OPTION_MIN_SIGNAL_NOISE));
  }

  static SpectralDataset dropNoisy(SpectralDataset unknowns, double minSignalNoise) {
    SignalNoise.Result quality = new SignalNoise().compute(unknowns);
    Set<String> kept = new LinkedHashSet<>();
    for (Map.Entry<String, Optional<Double>> entry : quality.getValues().entrySet()) {
      // Spectra too short to score are kept; the matcher reports on them itself.
      if (!entry.getValue().isPresent() || entry.getValue().get() >= minSignalNoise) {
        kept.add(entry.getKey());
      } else {
        LOGGER.info("Dropping '%s': signal to noise %.3f is below %.3f",
            entry.getKey(), entry.getValue().get(), minSignalNoise);
      }
    }
    return SpectraFilter.filter(unknowns, SpectrumSelector.byName(kept));
  }

  static void writeResult(MatchResult result, File outputFile) throws IOException {
    List<Map<String, Object>> rows = result.toRows();
    try (TSVWriter<String, Object> writer = TSVWriter.forRows(rows)) {
      writer.open(outputFile);
      writer.append(rows);
    }
  }
}
