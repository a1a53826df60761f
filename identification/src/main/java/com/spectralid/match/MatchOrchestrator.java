package com.spectralid.match;

import com.spectralid.classify.AlignmentFiller;
import com.spectralid.classify.ClassificationAdapter;
import com.spectralid.classify.ClassificationResult;
import com.spectralid.diagnostics.Diagnostics;
import com.spectralid.ranking.MatchTable;
import com.spectralid.ranking.RankingEngine;
import com.spectralid.similarity.SimilarityEngine;
import com.spectralid.similarity.SimilarityMatrix;
import com.spectralid.spectra.SpectralDataset;
import com.spectralid.spectra.SpectrumValidationException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Entry point for identifying unknown spectra.
 *
 * Against a {@link SpectralLibrary} the unknowns are correlated with every reference spectrum and the matches ranked;
 * against a {@link ModelLibrary} they are realigned to the model's grid and classified.  Either way the rows can be
 * put into the spectrum order of a reference dataset afterwards.
 */
public class MatchOrchestrator {
  private static final Logger LOGGER = LogManager.getFormatterLogger(MatchOrchestrator.class);

  private final RankingEngine rankingEngine;
  private final ClassificationAdapter classificationAdapter;

  public MatchOrchestrator() {
    this(new RankingEngine(), new ClassificationAdapter());
  }

  public MatchOrchestrator(RankingEngine rankingEngine, ClassificationAdapter classificationAdapter) {
    this.rankingEngine = rankingEngine;
    this.classificationAdapter = classificationAdapter;
  }

  public MatchResult match(SpectralDataset x, ReferenceLibrary library) {
    return match(x, library, MatchOptions.defaults());
  }

  /**
   * @param x The unknowns.
   * @param library Reference spectra or a trained model.
   * @param options Ranking, alignment and ordering settings.
   * @throws SpectrumValidationException if the unknowns or the library are missing, or the inputs can't be compared.
   */
  public MatchResult match(SpectralDataset x, ReferenceLibrary library, MatchOptions options) {
    if (x == null) {
      throw new SpectrumValidationException("A dataset of unknown spectra is required");
    }
    if (library == null) {
      throw new SpectrumValidationException("A library (reference spectra or trained model) is required");
    }
    if (options == null) {
      options = MatchOptions.defaults();
    }

    MatchResult result;
    switch (library.getKind()) {
      case SPECTRAL_LIBRARY:
        result = matchByCorrelation(x, library.asSpectralLibrary(), options);
        break;
      case TRAINED_MODEL:
        result = matchByClassification(x, library.asModelLibrary(), options);
        break;
      default:
        throw new SpectrumValidationException("Unsupported library kind %s", library.getKind());
    }

    if (options.getOrder() != null) {
      result = reorder(result, options.getOrder());
    }
    return result;
  }

  private MatchResult matchByCorrelation(SpectralDataset x, SpectralLibrary library, MatchOptions options) {
    LOGGER.info("Correlating %d unknowns against %d library spectra",
        x.getSpectrumCount(), library.getSpectra().getSpectrumCount());
    SimilarityMatrix matrix = new SimilarityEngine(options.isNaRm()).correlate(x, library.getSpectra());
    MatchTable table = rankingEngine.rank(matrix, x, library.getSpectra(), options.toRankingOptions());
    return MatchResult.ofMatches(table.getRecords(), table.getDiagnostics());
  }

  private MatchResult matchByClassification(SpectralDataset x, ModelLibrary library, MatchOptions options) {
    Diagnostics diagnostics = new Diagnostics(LOGGER);
    SpectralDataset fill = options.getFill() != null ? options.getFill() : library.getFillReference().orElse(null);

    SpectralDataset aligned = x;
    if (fill != null) {
      aligned = new AlignmentFiller(options.getAlignmentTolerance()).fill(x, fill, diagnostics);
    }
    LOGGER.info("Classifying %d unknowns on a %d-point grid", aligned.getSpectrumCount(), aligned.getGridSize());
    List<ClassificationResult> results =
        classificationAdapter.classify(aligned, library.getModel(), library.getClassLabels());
    return MatchResult.ofClassifications(results, diagnostics.toList());
  }

  /**
   * Stably sorts rows by the position of their unknown in {@code order}.  Rows whose unknown is not in {@code order}
   * go after all others, keeping their relative order.
   */
  static MatchResult reorder(MatchResult result, SpectralDataset order) {
    List<String> objectIds = result.getObjectIds();
    List<Integer> rows = new ArrayList<>(objectIds.size());
    for (int i = 0; i < objectIds.size(); i++) {
      rows.add(i);
    }
    rows.sort(Comparator.comparingInt(row -> {
      int pos = order.indexOf(objectIds.get(row));
      return pos < 0 ? Integer.MAX_VALUE : pos;
    }));
    return result.permute(rows);
  }
}
