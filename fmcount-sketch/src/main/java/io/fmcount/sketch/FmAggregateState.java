package io.fmcount.sketch;

import com.google.common.base.Preconditions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Partial state of a distinct count: either an {@link Exact} set of the distinct values seen so far, or
 * a {@link Sketch} once more than {@link #MINVALS} distinct values have arrived. A state only ever moves
 * from exact to sketch.
 *
 * <p>Operations that change a state consume the receiver and return the state to use from then on,
 * which is either the receiver itself or a new object. A state is not thread-safe; each partition
 * owns its own and states are combined with {@link FmMerger}.
 */
public abstract class FmAggregateState
{
  private static final Logger log = LoggerFactory.getLogger(FmAggregateState.class);

  /**
   * Estimates of the sketch fall below 1% error at around 12k distinct values, so everything up to
   * that is counted exactly.
   */
  public static final int MINVALS = 1024 * 12;

  // guess 8 bytes per value, the set grows if that is too low
  private static final int INITIAL_STORAGE_SIZE = 8 * 16;

  public enum Mode
  {
    EXACT((byte) 0),
    SKETCH((byte) 1);

    private final byte tag;

    Mode(byte tag)
    {
      this.tag = tag;
    }

    public byte tag()
    {
      return tag;
    }

    public static Mode fromTag(byte tag)
    {
      for (Mode mode : values()) {
        if (mode.tag == tag) {
          return mode;
        }
      }
      throw new IllegalArgumentException("unknown mode tag " + tag);
    }
  }

  FmAggregateState()
  {
  }

  /**
   * @return an empty exact state, the starting point of every group
   */
  public static FmAggregateState newState()
  {
    return new Exact(new SortedByteArraySet(MINVALS, INITIAL_STORAGE_SIZE));
  }

  public abstract Mode mode();

  /**
   * Adds one value. The receiver is consumed.
   *
   * @return the state holding {@code value}
   */
  public abstract FmAggregateState insert(byte[] value, ValueDigester digester);

  /**
   * @return the exact number of distinct values in exact mode, the sketch estimate otherwise
   */
  public abstract long count();

  /**
   * @return true if nothing was ever inserted
   */
  public abstract boolean isEmpty();

  public abstract long memoryFootprint();

  /**
   * Feeds every value of {@code values} into {@code sketch}, in directory order. The sketch update does
   * not depend on order.
   */
  static void replay(SortedByteArraySet values, FmBitmaps sketch, ValueDigester digester)
  {
    for (int i = 0; i < values.size(); i++) {
      sketch.insert(digester.digest(values.get(i)));
    }
  }

  public static final class Exact extends FmAggregateState
  {
    private final SortedByteArraySet values;

    Exact(SortedByteArraySet values)
    {
      this.values = Preconditions.checkNotNull(values, "values");
    }

    public SortedByteArraySet values()
    {
      return values;
    }

    @Override
    public Mode mode()
    {
      return Mode.EXACT;
    }

    @Override
    public FmAggregateState insert(byte[] value, ValueDigester digester)
    {
      if (!values.isFull()) {
        values.insert(value);
        return this;
      }
      if (values.contains(value)) {
        return this;
      }

      // a new distinct value at a full set: catch up on the past as if sketching from the start
      log.debug("Switching to sketch after {} distinct values", values.size());
      FmBitmaps sketch = new FmBitmaps();
      replay(values, sketch, digester);
      return new Sketch(sketch).insert(value, digester);
    }

    @Override
    public long count()
    {
      return values.size();
    }

    @Override
    public boolean isEmpty()
    {
      return values.isEmpty();
    }

    @Override
    public long memoryFootprint()
    {
      return values.memoryFootprint();
    }

    @Override
    public String toString()
    {
      return "Exact{count=" + values.size() + ", storage=" + values.storageSize() + "}";
    }
  }

  public static final class Sketch extends FmAggregateState
  {
    private final FmBitmaps bitmaps;

    Sketch(FmBitmaps bitmaps)
    {
      this.bitmaps = Preconditions.checkNotNull(bitmaps, "bitmaps");
    }

    public FmBitmaps bitmaps()
    {
      return bitmaps;
    }

    @Override
    public Mode mode()
    {
      return Mode.SKETCH;
    }

    @Override
    public FmAggregateState insert(byte[] value, ValueDigester digester)
    {
      bitmaps.insert(digester.digest(value));
      return this;
    }

    @Override
    public long count()
    {
      return FmEstimator.estimate(bitmaps);
    }

    @Override
    public boolean isEmpty()
    {
      return false;
    }

    @Override
    public long memoryFootprint()
    {
      return bitmaps.memoryFootprint();
    }

    @Override
    public String toString()
    {
      return "Sketch{maps=" + bitmaps.numMaps() + "}";
    }
  }
}
