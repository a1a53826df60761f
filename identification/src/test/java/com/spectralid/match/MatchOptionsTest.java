package com.spectralid.match;

import com.spectralid.spectra.SpectrumValidationException;
import org.junit.Test;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNull;

public class MatchOptionsTest {

  @Test(expected = SpectrumValidationException.class)
  public void testZeroTopNIsRejectedWhenSet() throws Exception {
    MatchOptions.defaults().setTopN(0);
  }

  @Test
  public void testTopNCanBeCleared() throws Exception {
    MatchOptions options = MatchOptions.defaults().setTopN(3).setTopN(null);
    assertNull("A null topN keeps every match", options.getTopN());
  }

  @Test
  public void testPositiveTopNIsKept() throws Exception {
    assertEquals("topN should be stored", Integer.valueOf(1), MatchOptions.defaults().setTopN(1).getTopN());
  }

  @Test(expected = SpectrumValidationException.class)
  public void testNegativeAlignmentToleranceIsRejected() throws Exception {
    MatchOptions.defaults().setAlignmentTolerance(-0.5);
  }

  @Test(expected = SpectrumValidationException.class)
  public void testNaNAlignmentToleranceIsRejected() throws Exception {
    MatchOptions.defaults().setAlignmentTolerance(Double.NaN);
  }
}
