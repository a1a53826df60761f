package com.spectralid.classify;

import org.junit.Before;
import org.junit.Test;

import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

public class MultinomialModelTest {

  private static final String MODEL_JSON = "{" +
      "\"wavenumbers\": [100.0, 200.0]," +
      "\"lambdas\": [1.0, 0.0]," +
      "\"intercepts\": [[0.0, 0.0], [0.0, 0.0]]," +
      "\"coefficients\": [[[0.0, 0.0], [0.0, 0.0]], [[2.0, 0.0], [0.0, 2.0]]]," +
      "\"class_labels\": {\"0\": \"polyethylene\", \"1\": \"nylon\"}" +
      "}";

  private MultinomialModel model;

  @Before
  public void setUp() throws Exception {
    model = MultinomialModel.readFromJson(new ByteArrayInputStream(MODEL_JSON.getBytes(StandardCharsets.UTF_8)));
  }

  @Test
  public void testModelIsReadFromJson() throws Exception {
    assertArrayEquals("Grid", new double[]{100.0, 200.0}, model.getWavenumbers(), 0.0);
    assertEquals("Class count", 2, model.getClassCount());
    assertEquals("Labels", "nylon", model.getClassLabels().get(1));
  }

  @Test
  public void testSoftmaxProbabilitiesSumToOne() throws Exception {
    List<PointPrediction> p = model.predict(new double[][]{{1.0, 0.0}}, 0.0);

    assertEquals("One prediction per class", 2, p.size());
    double expected = Math.exp(2.0) / (Math.exp(2.0) + 1.0);
    assertEquals("Class 0 probability", expected, p.get(0).getProbability(), 1e-12);
    assertEquals("Probabilities sum to one", 1.0, p.get(0).getProbability() + p.get(1).getProbability(), 1e-12);
  }

  @Test
  public void testLambdaIsInterpolatedAlongPath() throws Exception {
    List<PointPrediction> p = model.predict(new double[][]{{1.0, 0.0}}, 0.5);
    double expected = Math.exp(1.0) / (Math.exp(1.0) + 1.0);
    assertEquals("Halfway coefficients", expected, p.get(0).getProbability(), 1e-12);
  }

  @Test
  public void testRowsWithMissingReadingsAreNotScored() throws Exception {
    List<PointPrediction> p = model.predict(new double[][]{{Double.NaN, 1.0}, {0.0, 1.0}}, 0.0);
    assertEquals("Only the complete row is scored", 2, p.size());
    assertTrue("Predictions belong to row 1", p.stream().allMatch(x -> x.getSpectrumIndex() == 1));
  }

  @Test(expected = IllegalArgumentException.class)
  public void testInconsistentModelIsRejected() throws Exception {
    new MultinomialModel(new double[]{1.0, 2.0}, new double[]{0.1},
        new double[][]{{0.0, 0.0}}, new double[][][]{{{1.0}, {1.0}}}, null);
  }
}
