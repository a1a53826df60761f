package com.spectralid.spectra;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.function.Predicate;

/**
 * Picks spectra out of a dataset by id, by position, by a predicate on the id, or by a boolean mask.  A selector is
 * resolved against one dataset into a canonical array of positions before it is used.
 */
public abstract class SpectrumSelector {

  /**
   * @param dataset The dataset to select from.
   * @return Positions of the selected spectra, free of duplicates, in the order the selection yields them.
   * @throws SpectrumValidationException if the selector refers to positions the dataset does not have.
   */
  public abstract int[] resolve(SpectralDataset dataset);

  /**
   * Selects the spectra whose id is in {@code names}.  Ids absent from the dataset are ignored, and the result follows
   * the dataset's own order rather than the order of {@code names}.
   */
  public static SpectrumSelector byName(Collection<String> names) {
    return new ByName(names);
  }

  public static SpectrumSelector byName(String... names) {
    return new ByName(Arrays.asList(names));
  }

  /**
   * Selects spectra by position, keeping the caller's order.  Repeated positions are kept once, at their first
   * occurrence.
   */
  public static SpectrumSelector byIndex(int... indices) {
    return new ByIndex(indices);
  }

  public static SpectrumSelector byPredicate(Predicate<String> idPredicate) {
    return new ByPredicate(idPredicate);
  }

  /**
   * Selects the spectra whose mask entry is true; the mask must be exactly as long as the dataset.
   */
  public static SpectrumSelector byMask(boolean[] mask) {
    return new ByMask(mask);
  }

  public static SpectrumSelector all() {
    return new ByPredicate(id -> true);
  }

  static class ByName extends SpectrumSelector {
    private final Set<String> names;

    ByName(Collection<String> names) {
      if (names == null) {
        throw new SpectrumValidationException("Selected names must not be null");
      }
      this.names = new HashSet<>(names);
    }

    @Override
    public int[] resolve(SpectralDataset dataset) {
      List<String> ids = dataset.getSpectrumIds();
      List<Integer> selected = new ArrayList<>();
      for (int i = 0; i < ids.size(); i++) {
        if (names.contains(ids.get(i))) {
          selected.add(i);
        }
      }
      return toArray(selected);
    }
  }

  static class ByIndex extends SpectrumSelector {
    private final int[] indices;

    ByIndex(int[] indices) {
      if (indices == null) {
        throw new SpectrumValidationException("Selected indices must not be null");
      }
      this.indices = indices.clone();
    }

    @Override
    public int[] resolve(SpectralDataset dataset) {
      Set<Integer> selected = new LinkedHashSet<>();
      for (int idx : indices) {
        if (idx < 0 || idx >= dataset.getSpectrumCount()) {
          throw new SpectrumValidationException("Index %d is out of range for a dataset of %d spectra",
              idx, dataset.getSpectrumCount());
        }
        selected.add(idx);
      }
      return toArray(selected);
    }
  }

  static class ByPredicate extends SpectrumSelector {
    private final Predicate<String> predicate;

    ByPredicate(Predicate<String> predicate) {
      if (predicate == null) {
        throw new SpectrumValidationException("Selection predicate must not be null");
      }
      this.predicate = predicate;
    }

    @Override
    public int[] resolve(SpectralDataset dataset) {
      List<String> ids = dataset.getSpectrumIds();
      List<Integer> selected = new ArrayList<>();
      for (int i = 0; i < ids.size(); i++) {
        if (predicate.test(ids.get(i))) {
          selected.add(i);
        }
      }
      return toArray(selected);
    }
  }

  static class ByMask extends SpectrumSelector {
    private final boolean[] mask;

    ByMask(boolean[] mask) {
      if (mask == null) {
        throw new SpectrumValidationException("Selection mask must not be null");
      }
      this.mask = mask.clone();
    }

    @Override
    public int[] resolve(SpectralDataset dataset) {
      if (mask.length != dataset.getSpectrumCount()) {
        throw new SpectrumValidationException("Mask of length %d does not fit a dataset of %d spectra",
            mask.length, dataset.getSpectrumCount());
      }
      List<Integer> selected = new ArrayList<>();
      for (int i = 0; i < mask.length; i++) {
        if (mask[i]) {
          selected.add(i);
        }
      }
      return toArray(selected);
    }
  }

  private static int[] toArray(Collection<Integer> values) {
    return values.stream().mapToInt(Integer::intValue).toArray();
  }
}
