package com.spectralid.match;

import com.spectralid.classify.MultinomialModel;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import java.io.File;
import java.util.HashMap;
import java.util.Map;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;

public class ModelLibraryTest {

  @Rule
  public TemporaryFolder tempFolder = new TemporaryFolder();

  @Test
  public void testModelFileLabelsBecomeLibraryLabels() throws Exception {
    // Arrange
    Map<Integer, String> labels = new HashMap<>();
    labels.put(0, "polyethylene");
    labels.put(1, "nylon");
    MultinomialModel model = new MultinomialModel(new double[]{100.0, 200.0}, new double[]{0.1},
        new double[][]{{0.0, 0.5}}, new double[][][]{{{1.0, 0.0}, {0.0, 1.0}}}, labels);
    File modelFile = new File(tempFolder.getRoot(), "model.json");
    model.writeToJsonFile(modelFile);

    // Act
    ModelLibrary library = ModelLibrary.fromModelFile(modelFile, null);

    // Assert
    assertEquals("Kind", ReferenceLibrary.Kind.TRAINED_MODEL, library.getKind());
    assertEquals("Labels come from the file", "nylon", library.getClassLabels().get(1));
    assertEquals("Model grid comes from the file", 2, library.getModel().getWavenumbers().length);
    assertFalse("No fill reference was given", library.getFillReference().isPresent());
  }
}
