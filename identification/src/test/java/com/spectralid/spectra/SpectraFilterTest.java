package com.spectralid.spectra;

import org.junit.Before;
import org.junit.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

public class SpectraFilterTest {

  private SpectralDataset dataset;

  @Before
  public void setUp() throws Exception {
    dataset = SpectralDataset.builder()
        .setWavenumbers(new double[]{500.0, 600.0, 700.0})
        .addSpectrum("s1", new double[]{1.0, 2.0, 3.0}, metadata("s1", "red", null))
        .addSpectrum("s2", new double[]{3.0, 2.0, 1.0}, metadata("s2", "blue", " "))
        .addSpectrum("s3", new double[]{2.0, 2.0, 2.0}, metadata("s3", null, Double.NaN))
        .build();
  }

  private static Map<String, Object> metadata(String id, Object color, Object note) {
    Map<String, Object> fields = new HashMap<>();
    fields.put("spectrum_id", id);
    fields.put("color", color);
    fields.put("note", note);
    return fields;
  }

  @Test
  public void testFilterAllReproducesTheDataset() throws Exception {
    assertEquals("Selecting everything should give an equal dataset",
        dataset, SpectraFilter.filter(dataset, SpectrumSelector.all()));
  }

  @Test
  public void testFilterSubsetKeepsIntensitiesAndMetadata() throws Exception {
    // Arrange
    SpectrumSelector selector = SpectrumSelector.byName("s3", "s1");

    // Act
    SpectralDataset subset = SpectraFilter.filter(dataset, selector);

    // Assert
    assertEquals("Subset ids should follow dataset order", Arrays.asList("s1", "s3"), subset.getSpectrumIds());
    assertEquals("Intensities should be carried over", 2.0, subset.getIntensities("s3")[0], 0.0);
    assertEquals("Metadata should be carried over", "red", subset.getMetadata("s1").get("color"));
  }

  @Test
  public void testEmptySelectionIsValid() throws Exception {
    SpectralDataset empty = SpectraFilter.filter(dataset, SpectrumSelector.byName(new ArrayList<String>()));
    assertTrue("The result should be empty", empty.isEmpty());
    assertEquals("The grid should survive", 3, empty.getGridSize());
    assertEquals("The metadata columns should survive",
        dataset.getMetadataColumns(), empty.getMetadataColumns());
  }

  @Test
  public void testGetMetadataDropsEmptyColumnsOnlyWhenAsked() throws Exception {
    List<Map<String, Object>> kept = SpectraFilter.getMetadata(dataset, SpectrumSelector.all(), false);
    List<Map<String, Object>> trimmed = SpectraFilter.getMetadata(dataset, SpectrumSelector.all(), true);

    assertEquals("One row per spectrum", 3, kept.size());
    assertTrue("Without rmEmpty the blank column should stay", kept.get(0).containsKey("note"));
    assertFalse("With rmEmpty the blank column should go", trimmed.get(0).containsKey("note"));
    assertTrue("Partially filled columns should stay", trimmed.get(2).containsKey("color"));
  }

  @Test
  public void testGetMetadataFollowsSelectionOrder() throws Exception {
    List<Map<String, Object>> rows = SpectraFilter.getMetadata(dataset, SpectrumSelector.byIndex(2, 0), false);
    assertEquals("First row should be s3", "s3", rows.get(0).get("spectrum_id"));
    assertEquals("Second row should be s1", "s1", rows.get(1).get("spectrum_id"));
  }
}
