package io.fmcount.sketch;

import com.google.common.base.Preconditions;

import java.nio.BufferUnderflowException;
import java.nio.ByteBuffer;

/**
 * Flat byte layout of {@link FmAggregateState}, for shipping partial states between workers.
 *
 * <pre>
 * empty state:  zero bytes
 * exact state:  [tag 0][capacity int][count int][storage size int][count x (offset int, length int)][stored bytes]
 * sketch state: [tag 1][numMaps x 16 bytes of bitmaps]
 * </pre>
 *
 * All integers are big-endian. The directory is written in sorted order and offsets point into the
 * stored bytes that follow it.
 */
public final class FmStateSerde
{
  private static final int EXACT_HEADER_BYTES = 1 + 3 * Integer.BYTES;
  private static final int DIRECTORY_ENTRY_BYTES = 2 * Integer.BYTES;

  private FmStateSerde()
  {
  }

  public static byte[] serialize(FmAggregateState state)
  {
    if (state.isEmpty()) {
      return new byte[0];
    }

    if (state instanceof FmAggregateState.Sketch) {
      byte[] bitmaps = ((FmAggregateState.Sketch) state).bitmaps().toBytes();
      ByteBuffer buffer = ByteBuffer.allocate(1 + bitmaps.length);
      buffer.put(FmAggregateState.Mode.SKETCH.tag());
      buffer.put(bitmaps);
      return buffer.array();
    }

    SortedByteArraySet values = ((FmAggregateState.Exact) state).values();
    int count = values.size();
    int storageUsed = values.storageUsed();
    ByteBuffer buffer = ByteBuffer.allocate(EXACT_HEADER_BYTES + count * DIRECTORY_ENTRY_BYTES + storageUsed);
    buffer.put(FmAggregateState.Mode.EXACT.tag());
    buffer.putInt(values.capacity());
    buffer.putInt(count);
    buffer.putInt(storageUsed);
    for (int i = 0; i < count; i++) {
      buffer.putInt(values.offsetAt(i));
      buffer.putInt(values.lengthAt(i));
    }
    buffer.put(values.rawStorage(), 0, storageUsed);
    return buffer.array();
  }

  /**
   * @throws IllegalArgumentException if {@code bytes} is not a valid serialized state
   */
  public static FmAggregateState deserialize(byte[] bytes)
  {
    if (bytes.length == 0) {
      return FmAggregateState.newState();
    }

    FmAggregateState.Mode mode = FmAggregateState.Mode.fromTag(bytes[0]);
    if (mode == FmAggregateState.Mode.SKETCH) {
      return new FmAggregateState.Sketch(FmBitmaps.fromBytes(bytes, 1, bytes.length - 1));
    }

    try {
      ByteBuffer buffer = ByteBuffer.wrap(bytes, 1, bytes.length - 1);
      int capacity = buffer.getInt();
      int count = buffer.getInt();
      int storageSize = buffer.getInt();
      Preconditions.checkArgument(
          capacity == FmAggregateState.MINVALS,
          "exact state capacity %s does not match %s",
          capacity,
          FmAggregateState.MINVALS
      );
      Preconditions.checkArgument(count >= 0 && count <= capacity, "invalid count %s for capacity %s", count, capacity);
      Preconditions.checkArgument(
          storageSize >= 0 && (long) count * DIRECTORY_ENTRY_BYTES + storageSize == buffer.remaining(),
          "exact state of %s values and %s stored bytes does not match buffer of %s bytes",
          count,
          storageSize,
          bytes.length
      );

      int[] offsets = new int[count];
      int[] lengths = new int[count];
      for (int i = 0; i < count; i++) {
        offsets[i] = buffer.getInt();
        lengths[i] = buffer.getInt();
      }
      byte[] storage = new byte[storageSize];
      buffer.get(storage);
      return new FmAggregateState.Exact(SortedByteArraySet.restore(capacity, offsets, lengths, storage));
    } catch (BufferUnderflowException e) {
      throw new IllegalArgumentException("truncated exact state of " + bytes.length + " bytes", e);
    }
  }
}
