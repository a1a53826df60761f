package com.spectralid.similarity;

import org.apache.commons.lang3.tuple.Pair;
import org.junit.Test;

import java.util.Arrays;
import java.util.List;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

public class SimilarityMatrixTest {

  @Test
  public void testMaxPerColumnPicksBestLibrarySpectrum() throws Exception {
    SimilarityMatrix matrix = new SimilarityMatrix(
        Arrays.asList("a", "b", "c"), Arrays.asList("x", "y"),
        new double[][]{
            {0.1, 0.5},
            {0.9, Double.NaN},
            {0.3, 0.5},
        });

    List<Pair<String, Double>> best = matrix.maxPerColumn();

    assertEquals("Column x should pick b", Pair.of("b", 0.9), best.get(0));
    assertEquals("Ties go to the first row and NaN never wins", Pair.of("a", 0.5), best.get(1));
  }

  @Test
  public void testMaxPerColumnWithAllEqualValuesReturnsFirstLabel() throws Exception {
    SimilarityMatrix matrix = new SimilarityMatrix(
        Arrays.asList("first", "second"), Arrays.asList("x"), new double[][]{{0.7}, {0.7}});
    assertEquals("The first library spectrum should win", "first", matrix.maxPerColumn().get(0).getLeft());
  }

  @Test
  public void testAllNaNColumnHasNoWinner() throws Exception {
    SimilarityMatrix matrix = new SimilarityMatrix(
        Arrays.asList("a"), Arrays.asList("x"), new double[][]{{Double.NaN}});
    Pair<String, Double> best = matrix.maxPerColumn().get(0);
    assertNull("No label", best.getLeft());
    assertTrue("No value", best.getRight().isNaN());
  }

  @Test(expected = IllegalArgumentException.class)
  public void testUnknownLabelIsRejected() throws Exception {
    new SimilarityMatrix(Arrays.asList("a"), Arrays.asList("x"), new double[][]{{1.0}}).get("a", "nope");
  }
}
