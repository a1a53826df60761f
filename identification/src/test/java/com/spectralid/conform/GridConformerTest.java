package com.spectralid.conform;

import com.spectralid.spectra.SpectralDataset;
import com.spectralid.spectra.SpectrumValidationException;
import org.junit.Before;
import org.junit.Test;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

public class GridConformerTest {

  private SpectralDataset dataset;

  @Before
  public void setUp() throws Exception {
    dataset = SpectralDataset.builder()
        .setWavenumbers(new double[]{100.0, 110.0, 120.0, 130.0})
        .addSpectrum("line", new double[]{0.0, 10.0, 20.0, 30.0})
        .addSpectrum("gap", new double[]{0.0, Double.NaN, 20.0, 30.0})
        .build();
  }

  @Test
  public void testInterpolationOntoExplicitGrid() throws Exception {
    SpectralDataset conformed = new GridConformer().conform(dataset, new double[]{95.0, 105.0, 115.0, 125.0}, null);

    assertArrayEquals("Targets outside the data are dropped",
        new double[]{105.0, 115.0, 125.0}, conformed.getWavenumbers(), 0.0);
    assertArrayEquals("Linear values", new double[]{5.0, 15.0, 25.0}, conformed.getIntensities("line"), 1e-12);
    assertArrayEquals("Missing readings are skipped, not propagated",
        new double[]{5.0, 15.0, 25.0}, conformed.getIntensities("gap"), 1e-12);
  }

  @Test
  public void testRegularGridFromResolution() throws Exception {
    double[] grid = GridConformer.targetGrid(new double[]{100.0, 110.0, 120.0, 130.0}, new double[]{90.0, 125.0}, 5.0);
    assertArrayEquals("Grid clipped to the data range",
        new double[]{100.0, 105.0, 110.0, 115.0, 120.0, 125.0}, grid, 1e-9);
  }

  @Test
  public void testNearestNeighbourResampling() throws Exception {
    SpectralDataset conformed = new GridConformer(GridConformer.Type.ROLL)
        .conform(dataset, new double[]{103.0, 117.0}, null);
    assertArrayEquals("Nearest readings", new double[]{0.0, 20.0}, conformed.getIntensities("line"), 0.0);
  }

  @Test
  public void testIdsAndMetadataSurvive() throws Exception {
    SpectralDataset conformed = new GridConformer().conform(dataset, null, 10.0);
    assertEquals("Same spectra", dataset.getSpectrumIds(), conformed.getSpectrumIds());
    assertEquals("Same grid when resampling at the native step", 4, conformed.getGridSize());
  }

  @Test(expected = SpectrumValidationException.class)
  public void testNonPositiveResolutionFails() throws Exception {
    new GridConformer().conform(dataset, null, 0.0);
  }

  @Test
  public void testTooFewReadingsGiveMissingSpectrum() throws Exception {
    double[] out = GridConformer.interpolate(new double[]{1.0, 2.0}, new double[]{Double.NaN, 3.0},
        new double[]{1.5});
    assertTrue("One reading is not enough to interpolate", Double.isNaN(out[0]));
  }
}
