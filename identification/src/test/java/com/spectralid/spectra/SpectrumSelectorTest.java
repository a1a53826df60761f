package com.spectralid.spectra;

import org.junit.Before;
import org.junit.Test;

import java.util.Arrays;

import static org.junit.Assert.assertArrayEquals;

public class SpectrumSelectorTest {

  private SpectralDataset dataset;

  @Before
  public void setUp() throws Exception {
    dataset = SpectralDataset.builder()
        .setWavenumbers(new double[]{1.0, 2.0})
        .addSpectrum("a", new double[]{1.0, 1.0})
        .addSpectrum("b", new double[]{2.0, 2.0})
        .addSpectrum("c", new double[]{3.0, 3.0})
        .build();
  }

  @Test
  public void testByNameFollowsDatasetOrderAndIgnoresUnknownNames() throws Exception {
    assertArrayEquals("Names should resolve in dataset order",
        new int[]{0, 2}, SpectrumSelector.byName(Arrays.asList("c", "zzz", "a")).resolve(dataset));
  }

  @Test
  public void testByIndexKeepsCallerOrderWithoutDuplicates() throws Exception {
    assertArrayEquals("Indices should keep caller order",
        new int[]{2, 0}, SpectrumSelector.byIndex(2, 0, 2).resolve(dataset));
  }

  @Test(expected = SpectrumValidationException.class)
  public void testByIndexRejectsOutOfRange() throws Exception {
    SpectrumSelector.byIndex(3).resolve(dataset);
  }

  @Test
  public void testByPredicateAndMask() throws Exception {
    assertArrayEquals("Predicate should select matching ids",
        new int[]{1}, SpectrumSelector.byPredicate(id -> id.equals("b")).resolve(dataset));
    assertArrayEquals("Mask should select flagged positions",
        new int[]{0, 1}, SpectrumSelector.byMask(new boolean[]{true, true, false}).resolve(dataset));
    assertArrayEquals("All should select everything", new int[]{0, 1, 2}, SpectrumSelector.all().resolve(dataset));
  }

  @Test(expected = SpectrumValidationException.class)
  public void testMaskOfWrongLengthIsRejected() throws Exception {
    SpectrumSelector.byMask(new boolean[]{true}).resolve(dataset);
  }
}
