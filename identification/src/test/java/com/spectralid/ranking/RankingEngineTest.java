package com.spectralid.ranking;

import com.spectralid.diagnostics.Diagnostic;
import com.spectralid.similarity.SimilarityMatrix;
import com.spectralid.spectra.SpectralDataset;
import com.spectralid.spectra.SpectrumValidationException;
import org.junit.Before;
import org.junit.Test;

import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

public class RankingEngineTest {

  private SpectralDataset library;
  private SpectralDataset unknowns;
  private SimilarityMatrix matrix;
  private RankingEngine engine;

  @Before
  public void setUp() throws Exception {
    double[] grid = {1.0, 2.0, 3.0};
    library = SpectralDataset.builder()
        .setWavenumbers(grid)
        .addSpectrum("L1", grid, fields("L1", "polyethylene"))
        .addSpectrum("L2", grid, fields("L2", "nylon"))
        .addSpectrum("L3", grid, fields("L3", "polystyrene"))
        .addSpectrum("L4", grid, fields("other", "cellulose"))
        .build();
    unknowns = SpectralDataset.builder()
        .setWavenumbers(grid)
        .addSpectrum("U1", grid)
        .addSpectrum("U2", grid)
        .build();
    matrix = new SimilarityMatrix(
        Arrays.asList("L1", "L2", "L3", "L4"), Arrays.asList("U1", "U2"),
        new double[][]{
            {0.2, Double.NaN},
            {0.8, 0.4},
            {0.5, 0.4},
            {0.8, 0.9},
        });
    engine = new RankingEngine();
  }

  private static Map<String, Object> fields(String id, String material) {
    Map<String, Object> f = new HashMap<>();
    f.put("spectrum_id", id);
    f.put("material", material);
    return f;
  }

  @Test
  public void testWithoutTopNEveryPairIsReturnedInMatrixOrder() throws Exception {
    MatchTable table = engine.rank(matrix, unknowns, library, RankingOptions.defaults());

    assertEquals("All pairs expected", 8, table.size());
    assertEquals("Object-major order", "U1", table.getRecords().get(3).getObjectId());
    assertEquals("Library order inside an object", "L4", table.getRecords().get(3).getLibraryId());
    assertTrue("Undefined values are kept", Double.isNaN(table.getRecords().get(4).getMatchVal()));
  }

  @Test
  public void testTopNKeepsBestMatchesWithStableTies() throws Exception {
    MatchTable table = engine.rank(matrix, unknowns, library, RankingOptions.defaults().setTopN(2));

    List<MatchRecord> u1 = table.forObject("U1");
    assertEquals("Two matches per unknown", 2, u1.size());
    assertEquals("Tied best keeps library order", "L2", u1.get(0).getLibraryId());
    assertEquals("Tied best keeps library order", "L4", u1.get(1).getLibraryId());

    List<MatchRecord> u2 = table.forObject("U2");
    assertEquals("Best first", "L4", u2.get(0).getLibraryId());
    assertEquals("Then the first of the tied runners up", "L2", u2.get(1).getLibraryId());
  }

  @Test
  public void testUndefinedValuesSortLast() throws Exception {
    MatchTable table = engine.rank(matrix, unknowns, library, RankingOptions.defaults().setTopN(4));
    List<MatchRecord> u2 = table.forObject("U2");
    assertEquals("All four kept", 4, u2.size());
    assertEquals("NaN goes last", "L1", u2.get(3).getLibraryId());
  }

  @Test
  public void testTopNLargerThanLibraryReturnsAllWithNotice() throws Exception {
    MatchTable table = engine.rank(matrix, unknowns, library, RankingOptions.defaults().setTopN(10));

    assertEquals("Every pair should be returned", 8, table.size());
    assertEquals("One diagnostic expected", 1, table.getDiagnostics().size());
    assertEquals("The oversize request should be reported",
        Diagnostic.Code.TOP_N_EXCEEDS_LIBRARY, table.getDiagnostics().get(0).getCode());
  }

  @Test(expected = SpectrumValidationException.class)
  public void testNonPositiveTopNIsRejected() throws Exception {
    RankingOptions.defaults().setTopN(0);
  }

  @Test
  public void testLibraryMetadataIsLeftJoined() throws Exception {
    MatchTable table = engine.rank(matrix, unknowns, library,
        RankingOptions.defaults().setTopN(1).setLibraryMetadataKey("spectrum_id"));

    MatchRecord u1 = table.forObject("U1").get(0);
    assertEquals("Joined field from L2", "nylon", u1.getLibraryMetadata().get("material"));
    assertTrue("The key column itself is not joined", !u1.getLibraryMetadata().containsKey("spectrum_id"));

    // L4's metadata row is keyed "other", so nothing joins onto it.
    MatchRecord u2 = table.forObject("U2").get(0);
    assertEquals("The record survives the join", "L4", u2.getLibraryId());
    assertTrue("Unmatched joins carry the column", u2.getLibraryMetadata().containsKey("material"));
    assertNull("Unmatched joins carry a null value", u2.getLibraryMetadata().get("material"));
  }

  @Test
  public void testToRowFlattensJoinedFields() throws Exception {
    MatchTable table = engine.rank(matrix, unknowns, library,
        RankingOptions.defaults().setTopN(1).setLibraryMetadataKey("spectrum_id"));
    Map<String, Object> row = table.forObject("U1").get(0).toRow();

    assertEquals("Object id column", "U1", row.get(MatchRecord.FIELD_OBJECT_ID));
    assertEquals("Match value column", 0.8, (Double) row.get(MatchRecord.FIELD_MATCH_VAL), 0.0);
    assertEquals("Joined column", "nylon", row.get("material"));
  }

  @Test
  public void testObjectMetadataIsLeftJoined() throws Exception {
    // Arrange
    double[] grid = {1.0, 2.0, 3.0};
    Map<String, Object> u1 = new HashMap<>();
    u1.put("spectrum_id", "U1");
    u1.put("site", "beach");
    Map<String, Object> u2 = new HashMap<>();
    u2.put("spectrum_id", "unlisted");
    u2.put("site", "river");
    SpectralDataset annotated = SpectralDataset.builder()
        .setWavenumbers(grid)
        .addSpectrum("U1", grid, u1)
        .addSpectrum("U2", grid, u2)
        .build();

    // Act
    MatchTable table = engine.rank(matrix, annotated, library,
        RankingOptions.defaults().setTopN(2).setObjectMetadataKey("spectrum_id"));

    // Assert
    for (MatchRecord record : table.forObject("U1")) {
      assertEquals("U1 is joined to its own row", "beach", record.getObjectMetadata().get("site"));
      assertTrue("The key column itself is not joined", !record.getObjectMetadata().containsKey("spectrum_id"));
    }
    for (MatchRecord record : table.forObject("U2")) {
      assertTrue("Unmatched joins carry the column", record.getObjectMetadata().containsKey("site"));
      assertNull("U2's row is keyed 'unlisted', so nothing joins", record.getObjectMetadata().get("site"));
    }
    assertEquals("Library side is untouched", 0, table.forObject("U1").get(0).getLibraryMetadata().size());
  }

  @Test
  public void testCollidingMetadataColumnsAreSuffixed() throws Exception {
    // Arrange
    double[] grid = {1.0, 2.0, 3.0};
    SpectralDataset annotated = SpectralDataset.builder()
        .setWavenumbers(grid)
        .addSpectrum("U1", grid, fields("U1", "unknown fibre"))
        .addSpectrum("U2", grid, fields("U2", "unknown fragment"))
        .build();

    // Act
    MatchTable table = engine.rank(matrix, annotated, library, RankingOptions.defaults().setTopN(1)
        .setLibraryMetadataKey("spectrum_id").setObjectMetadataKey("spectrum_id"));
    Map<String, Object> row = table.forObject("U1").get(0).toRow();

    // Assert
    assertEquals("Library field keeps the plain name", "nylon", row.get("material"));
    assertEquals("Object field is suffixed", "unknown fibre", row.get("material.object"));
    assertEquals("Three match fields and two joined fields", 5, row.size());
  }

  @Test
  public void testMatchFieldCollisionSuffixesLibraryColumn() throws Exception {
    Map<String, Object> libraryFields = new HashMap<>();
    libraryFields.put(MatchRecord.FIELD_MATCH_VAL, "curated");
    MatchRecord record = new MatchRecord("U1", "L1", 0.5, libraryFields, new HashMap<>());

    Map<String, Object> row = record.toRow();

    assertEquals("The match value wins the plain name", 0.5, (Double) row.get(MatchRecord.FIELD_MATCH_VAL), 0.0);
    assertEquals("The library field is suffixed", "curated", row.get(MatchRecord.FIELD_MATCH_VAL + ".library"));
  }
}
