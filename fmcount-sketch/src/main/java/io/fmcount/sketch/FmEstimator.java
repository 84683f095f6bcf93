package io.fmcount.sketch;

/**
 * Turns {@link FmBitmaps} into a distinct count estimate.
 *
 * <p>Sums the run of leading ones {@code L_i} of every bitmap into {@code S} and returns
 * {@code ceil(m / PHI * 2^(S / m))} for {@code m} bitmaps. Relative error is a few percent and worse for
 * small cardinalities, which is why small inputs are counted exactly.
 */
public final class FmEstimator
{
  // Flajolet-Martin bias correction
  public static final double PHI = 0.77351;

  private FmEstimator()
  {
  }

  public static long estimate(FmBitmaps sketch)
  {
    final int m = sketch.numMaps();
    long sum = 0;
    for (int i = 0; i < m; i++) {
      sum += sketch.leadingOnes(i);
    }
    return (long) Math.ceil((m / PHI) * Math.pow(2.0, (double) sum / m));
  }
}
