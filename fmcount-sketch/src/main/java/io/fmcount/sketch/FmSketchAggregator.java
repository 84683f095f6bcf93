package io.fmcount.sketch;

import com.google.common.base.Function;
import com.google.common.base.Preconditions;

import java.nio.charset.StandardCharsets;

/**
 * Distinct count of one group: counts exactly up to {@link FmAggregateState#MINVALS} distinct values,
 * then switches to a Flajolet-Martin sketch.
 *
 * <p>Values are identified by their canonical bytes, produced by a stringify function for
 * {@link #addValue(Object)}. Nulls are ignored. An aggregator passed to {@link #merge(FmSketchAggregator)}
 * is consumed and rejects any further call.
 */
public class FmSketchAggregator implements CardinalityEstimator<FmSketchAggregator>
{
  private static final Function<Object, byte[]> DEFAULT_STRINGIFIER = value -> {
    if (value instanceof byte[]) {
      return (byte[]) value;
    }
    return String.valueOf(value).getBytes(StandardCharsets.UTF_8);
  };

  private final ValueDigester digester;
  private final FmMerger merger;
  private final Function<Object, byte[]> stringifier;

  private FmAggregateState state;

  public FmSketchAggregator()
  {
    this(ValueDigester.md5(), DEFAULT_STRINGIFIER);
  }

  public FmSketchAggregator(ValueDigester digester, Function<Object, byte[]> stringifier)
  {
    this(digester, stringifier, FmAggregateState.newState());
  }

  private FmSketchAggregator(ValueDigester digester, Function<Object, byte[]> stringifier, FmAggregateState state)
  {
    this.digester = Preconditions.checkNotNull(digester, "digester");
    this.stringifier = Preconditions.checkNotNull(stringifier, "stringifier");
    this.merger = new FmMerger(digester);
    this.state = state;
  }

  public static FmSketchAggregator fromBytes(byte[] bytes)
  {
    return fromBytes(bytes, ValueDigester.md5(), DEFAULT_STRINGIFIER);
  }

  public static FmSketchAggregator fromBytes(byte[] bytes, ValueDigester digester, Function<Object, byte[]> stringifier)
  {
    return new FmSketchAggregator(digester, stringifier, FmStateSerde.deserialize(bytes));
  }

  @Override
  public void add(byte[] value)
  {
    if (value == null) {
      return;
    }
    state = checkUsable().insert(value, digester);
  }

  @Override
  public void add(long value)
  {
    add(Long.toString(value).getBytes(StandardCharsets.UTF_8));
  }

  public void addValue(Object value)
  {
    if (value == null) {
      return;
    }
    add(stringifier.apply(value));
  }

  @Override
  public void merge(FmSketchAggregator that)
  {
    Preconditions.checkState(this != that, "cannot merge an aggregator into itself");
    FmAggregateState mine = checkUsable();
    FmAggregateState theirs = that.checkUsable();
    state = merger.merge(mine, theirs);
    that.state = null;
  }

  @Override
  public long cardinality()
  {
    FmAggregateState current = checkUsable();
    if (current.isEmpty()) {
      return 0;
    }
    return current.count();
  }

  @Override
  public long memoryFootprint()
  {
    return checkUsable().memoryFootprint();
  }

  @Override
  public String name()
  {
    return "fmsketch";
  }

  public FmAggregateState.Mode mode()
  {
    return checkUsable().mode();
  }

  public byte[] toBytes()
  {
    return FmStateSerde.serialize(checkUsable());
  }

  private FmAggregateState checkUsable()
  {
    Preconditions.checkState(state != null, "aggregator was consumed by a merge");
    return state;
  }
}
