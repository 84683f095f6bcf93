package io.fmcount.sketch;

import com.google.common.base.Preconditions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Combines two partial states computed over different partitions.
 *
 * <p>Both inputs are consumed: the result may be either input, modified, or a new state. The set of
 * distinct values the result stands for is the union of the two inputs whatever the argument order,
 * only the representation picked for it may differ.
 */
public final class FmMerger
{
  private static final Logger log = LoggerFactory.getLogger(FmMerger.class);

  private final ValueDigester digester;

  public FmMerger(ValueDigester digester)
  {
    this.digester = Preconditions.checkNotNull(digester, "digester");
  }

  public FmAggregateState merge(FmAggregateState left, FmAggregateState right)
  {
    Preconditions.checkNotNull(left, "left");
    Preconditions.checkNotNull(right, "right");
    Preconditions.checkArgument(left != right, "cannot merge a state with itself");

    if (left.isEmpty()) {
      return right;
    }
    if (right.isEmpty()) {
      return left;
    }

    if (left instanceof FmAggregateState.Sketch && right instanceof FmAggregateState.Sketch) {
      FmBitmaps union = ((FmAggregateState.Sketch) left).bitmaps();
      union.unionInPlace(((FmAggregateState.Sketch) right).bitmaps());
      return left;
    }

    if (left instanceof FmAggregateState.Exact && right instanceof FmAggregateState.Exact) {
      return mergeExact((FmAggregateState.Exact) left, (FmAggregateState.Exact) right);
    }

    // one side is a sketch: it becomes the base and takes the values of the other side
    FmAggregateState.Sketch sketch;
    FmAggregateState.Exact exact;
    if (left instanceof FmAggregateState.Sketch) {
      sketch = (FmAggregateState.Sketch) left;
      exact = (FmAggregateState.Exact) right;
    } else {
      sketch = (FmAggregateState.Sketch) right;
      exact = (FmAggregateState.Exact) left;
    }
    FmAggregateState.replay(exact.values(), sketch.bitmaps(), digester);
    return sketch;
  }

  private FmAggregateState mergeExact(FmAggregateState.Exact left, FmAggregateState.Exact right)
  {
    FmAggregateState.Exact big = left.count() >= right.count() ? left : right;
    FmAggregateState.Exact small = big == left ? right : left;
    SortedByteArraySet bigValues = big.values();
    SortedByteArraySet smallValues = small.values();

    if (bigValues.size() + smallValues.size() <= bigValues.capacity()) {
      // room in the bigger set; duplicates are dropped by the insert
      for (int i = 0; i < smallValues.size(); i++) {
        bigValues.insert(smallValues.get(i));
      }
      return big;
    }

    log.debug(
        "Merging exact states of {} and {} values into a sketch",
        bigValues.size(),
        smallValues.size()
    );
    FmBitmaps sketch = new FmBitmaps();
    FmAggregateState.replay(bigValues, sketch, digester);
    FmAggregateState.replay(smallValues, sketch, digester);
    return new FmAggregateState.Sketch(sketch);
  }
}
