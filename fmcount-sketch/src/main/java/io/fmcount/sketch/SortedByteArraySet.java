package io.fmcount.sketch;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Preconditions;
import com.google.common.primitives.UnsignedBytes;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * A set of byte strings kept as a sorted directory over a separate storage area.
 *
 * <p>The directory holds an (offset, length) pair per value, ordered by unsigned lexicographic
 * comparison of the referenced bytes, so membership is a binary search. Values are appended to the
 * storage area in arrival order and never move. The directory has a fixed slot limit
 * ({@link #capacity()}); callers must check {@link #isFull()} before inserting a new value.
 *
 * <p>Lengths are explicit, values may contain zero bytes.
 */
public final class SortedByteArraySet
{
  private static final Logger log = LoggerFactory.getLogger(SortedByteArraySet.class);

  private static final int INITIAL_DIRECTORY_SIZE = 16;
  private static final int BYTES_PER_DIRECTORY_ENTRY = 2 * Integer.BYTES;

  public enum InsertResult
  {
    INSERTED,
    ALREADY_PRESENT,
    INSUFFICIENT_STORAGE
  }

  private final int capacity;

  // directory, sorted by the bytes each entry refers to
  private int[] offsets;
  private int[] lengths;
  private int numVals;

  private byte[] storage;
  private int storageUsed;

  public SortedByteArraySet(int capacity, int initialStorageSize)
  {
    Preconditions.checkArgument(capacity > 0, "capacity must be positive, got %s", capacity);
    Preconditions.checkArgument(initialStorageSize >= 0, "negative storage size %s", initialStorageSize);
    this.capacity = capacity;
    int directorySize = Math.min(capacity, INITIAL_DIRECTORY_SIZE);
    this.offsets = new int[directorySize];
    this.lengths = new int[directorySize];
    this.storage = new byte[initialStorageSize];
  }

  /**
   * Inserts {@code value} unless it is already present or the storage area is too small for it.
   * Nothing is changed unless the result is {@link InsertResult#INSERTED}.
   *
   * @throws IllegalStateException if the directory is full
   */
  public InsertResult tryInsert(byte[] value)
  {
    Preconditions.checkState(
        numVals < capacity,
        "attempt to insert into full set (capacity %s)",
        capacity
    );

    int pos = search(value);
    if (pos >= 0) {
      return InsertResult.ALREADY_PRESENT;
    }
    if (storage.length - storageUsed < value.length) {
      return InsertResult.INSUFFICIENT_STORAGE;
    }

    int insertAt = -(pos + 1);
    ensureDirectorySize(numVals + 1);
    System.arraycopy(offsets, insertAt, offsets, insertAt + 1, numVals - insertAt);
    System.arraycopy(lengths, insertAt, lengths, insertAt + 1, numVals - insertAt);
    offsets[insertAt] = storageUsed;
    lengths[insertAt] = value.length;
    System.arraycopy(value, 0, storage, storageUsed, value.length);
    storageUsed += value.length;
    numVals++;
    return InsertResult.INSERTED;
  }

  /**
   * Like {@link #tryInsert(byte[])}, but grows the storage area when it is too small. The new area is
   * at least twice the old one plus the size of {@code value}, so a single retry always succeeds.
   *
   * @return {@link InsertResult#INSERTED} or {@link InsertResult#ALREADY_PRESENT}
   */
  public InsertResult insert(byte[] value)
  {
    InsertResult result = tryInsert(value);
    if (result != InsertResult.INSUFFICIENT_STORAGE) {
      return result;
    }

    int newSize = 2 * storage.length + value.length;
    log.debug("Growing storage from {} to {} bytes for {} values", storage.length, newSize, numVals);
    storage = Arrays.copyOf(storage, newSize);

    result = tryInsert(value);
    Preconditions.checkState(result == InsertResult.INSERTED, "insert after growth returned %s", result);
    return result;
  }

  public boolean contains(byte[] value)
  {
    return search(value) >= 0;
  }

  public int size()
  {
    return numVals;
  }

  public int capacity()
  {
    return capacity;
  }

  public boolean isEmpty()
  {
    return numVals == 0;
  }

  public boolean isFull()
  {
    return numVals >= capacity;
  }

  /**
   * @return the {@code i}-th smallest value
   */
  public byte[] get(int i)
  {
    Preconditions.checkElementIndex(i, numVals);
    return Arrays.copyOfRange(storage, offsets[i], offsets[i] + lengths[i]);
  }

  /**
   * @return all values in sorted order
   */
  public List<byte[]> values()
  {
    List<byte[]> values = new ArrayList<>(numVals);
    for (int i = 0; i < numVals; i++) {
      values.add(get(i));
    }
    return values;
  }

  /**
   * Size of the allocated storage area, used or not.
   */
  public int storageSize()
  {
    return storage.length;
  }

  public int storageUsed()
  {
    return storageUsed;
  }

  int offsetAt(int i)
  {
    return offsets[i];
  }

  int lengthAt(int i)
  {
    return lengths[i];
  }

  byte[] rawStorage()
  {
    return storage;
  }

  public long memoryFootprint()
  {
    return storage.length + (long) BYTES_PER_DIRECTORY_ENTRY * offsets.length;
  }

  /**
   * Rebuilds a set from a serialized directory. The directory must be strictly sorted and every entry
   * must lie inside {@code storageUsed}.
   */
  static SortedByteArraySet restore(int capacity, int[] offsets, int[] lengths, byte[] storage)
  {
    Preconditions.checkArgument(offsets.length == lengths.length, "directory arrays differ in length");
    Preconditions.checkArgument(
        offsets.length <= capacity,
        "%s values exceed capacity %s",
        offsets.length,
        capacity
    );
    SortedByteArraySet set = new SortedByteArraySet(capacity, 0);
    set.offsets = Arrays.copyOf(offsets, Math.max(offsets.length, Math.min(capacity, INITIAL_DIRECTORY_SIZE)));
    set.lengths = Arrays.copyOf(lengths, set.offsets.length);
    set.numVals = offsets.length;
    set.storage = storage;
    set.storageUsed = storage.length;

    for (int i = 0; i < set.numVals; i++) {
      Preconditions.checkArgument(
          offsets[i] >= 0 && lengths[i] >= 0 && (long) offsets[i] + lengths[i] <= storage.length,
          "directory entry %s [%s, +%s) outside storage of %s bytes",
          i,
          offsets[i],
          lengths[i],
          storage.length
      );
      if (i > 0) {
        Preconditions.checkArgument(set.compareEntry(i - 1, set.get(i)) < 0, "directory not strictly sorted at %s", i);
      }
    }
    return set;
  }

  // binary search over the directory; same contract as Arrays.binarySearch
  private int search(byte[] value)
  {
    int low = 0;
    int high = numVals - 1;
    while (low <= high) {
      int mid = (low + high) >>> 1;
      int cmp = compareEntry(mid, value);
      if (cmp < 0) {
        low = mid + 1;
      } else if (cmp > 0) {
        high = mid - 1;
      } else {
        return mid;
      }
    }
    return -(low + 1);
  }

  private int compareEntry(int i, byte[] value)
  {
    int offset = offsets[i];
    int length = lengths[i];
    int minLength = Math.min(length, value.length);
    for (int j = 0; j < minLength; j++) {
      int cmp = UnsignedBytes.compare(storage[offset + j], value[j]);
      if (cmp != 0) {
        return cmp;
      }
    }
    return length - value.length;
  }

  private void ensureDirectorySize(int required)
  {
    if (offsets.length >= required) {
      return;
    }
    int newSize = (int) Math.min((long) capacity, Math.max(required, 2L * offsets.length));
    offsets = Arrays.copyOf(offsets, newSize);
    lengths = Arrays.copyOf(lengths, newSize);
  }

  @VisibleForTesting
  int directorySize()
  {
    return offsets.length;
  }
}
