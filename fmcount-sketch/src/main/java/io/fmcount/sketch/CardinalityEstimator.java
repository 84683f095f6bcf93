package io.fmcount.sketch;

public interface CardinalityEstimator<T>
{
  void add(byte[] value);
  void add(long value);

  /**
   * Folds {@code that} into this estimator. {@code that} is consumed and must not be used afterwards.
   */
  void merge(T that);
  long cardinality();
  long memoryFootprint();

  String name();
}
