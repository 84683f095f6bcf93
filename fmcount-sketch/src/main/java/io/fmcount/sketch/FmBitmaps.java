package io.fmcount.sketch;

import com.google.common.base.Preconditions;
import com.google.common.hash.HashCode;
import com.google.common.primitives.Longs;
import com.google.common.primitives.UnsignedLongs;

import java.util.Arrays;

/**
 * Flajolet-Martin probabilistic counting bitmaps, described in
 * http://algo.inria.fr/flajolet/Publications/FlMa85.pdf.
 *
 * <p>Holds {@code numMaps} bitmaps of {@link #BITS_PER_MAP} bits. Each digest turns on one bit in one
 * bitmap: the bitmap is chosen by the high-order 64 bits of the digest, the bit by the position
 * {@code r} of the rightmost one in the digest. The bit turned on is the {@code r}-th counting from the
 * left edge of the bitmap, so the expected number of values able to set a bit halves with each step to
 * the right. Bits are never cleared.
 *
 * <p>Each bitmap is stored as two longs, most significant first.
 */
public final class FmBitmaps
{
  public static final int DEFAULT_NUM_MAPS = 256;
  public static final int BITS_PER_MAP = ValueDigester.DIGEST_BITS;
  public static final int BYTES_PER_MAP = BITS_PER_MAP / Byte.SIZE;

  private static final int WORDS_PER_MAP = BITS_PER_MAP / Long.SIZE;

  private final int numMaps;
  private final long[] words;

  public FmBitmaps()
  {
    this(DEFAULT_NUM_MAPS);
  }

  public FmBitmaps(int numMaps)
  {
    Preconditions.checkArgument(numMaps > 0, "number of bitmaps must be positive, got %s", numMaps);
    this.numMaps = numMaps;
    this.words = new long[numMaps * WORDS_PER_MAP];
  }

  private FmBitmaps(int numMaps, long[] words)
  {
    this.numMaps = numMaps;
    this.words = words;
  }

  public void insert(HashCode digest)
  {
    Preconditions.checkArgument(
        digest.bits() == BITS_PER_MAP,
        "digest has %s bits, expected %s",
        digest.bits(),
        BITS_PER_MAP
    );
    byte[] bytes = digest.asBytes();
    long high = Longs.fromBytes(bytes[0], bytes[1], bytes[2], bytes[3], bytes[4], bytes[5], bytes[6], bytes[7]);
    long low = Longs.fromBytes(bytes[8], bytes[9], bytes[10], bytes[11], bytes[12], bytes[13], bytes[14], bytes[15]);

    int rightmostOne;
    if (low != 0) {
      rightmostOne = Long.numberOfTrailingZeros(low);
    } else if (high != 0) {
      rightmostOne = Long.SIZE + Long.numberOfTrailingZeros(high);
    } else {
      // all-zero digest, no bit to turn on
      return;
    }

    int map = (int) UnsignedLongs.remainder(high, numMaps);
    setBitFromLeft(map, rightmostOne);
  }

  /**
   * @return a new sketch holding the bitwise OR of this and {@code that}
   * @throws IllegalArgumentException if the two sketches have a different number of bitmaps
   */
  public FmBitmaps union(FmBitmaps that)
  {
    FmBitmaps result = copy();
    result.unionInPlace(that);
    return result;
  }

  /**
   * ORs {@code that} into this sketch.
   *
   * @throws IllegalArgumentException if the two sketches have a different number of bitmaps
   */
  public void unionInPlace(FmBitmaps that)
  {
    Preconditions.checkArgument(
        numMaps == that.numMaps,
        "attempting to OR two different-sized sketches: %s and %s bitmaps",
        numMaps,
        that.numMaps
    );
    for (int i = 0; i < words.length; i++) {
      words[i] |= that.words[i];
    }
  }

  /**
   * @return the number of consecutive set bits at the left edge of bitmap {@code map}
   */
  public int leadingOnes(int map)
  {
    Preconditions.checkElementIndex(map, numMaps);
    long high = words[map * WORDS_PER_MAP];
    int ones = Long.numberOfLeadingZeros(~high);
    if (ones < Long.SIZE) {
      return ones;
    }
    return Long.SIZE + Long.numberOfLeadingZeros(~words[map * WORDS_PER_MAP + 1]);
  }

  public boolean isBitSet(int map, int positionFromLeft)
  {
    Preconditions.checkElementIndex(map, numMaps);
    Preconditions.checkElementIndex(positionFromLeft, BITS_PER_MAP);
    int word = map * WORDS_PER_MAP + positionFromLeft / Long.SIZE;
    return (words[word] & bitMask(positionFromLeft)) != 0;
  }

  public int numMaps()
  {
    return numMaps;
  }

  public FmBitmaps copy()
  {
    return new FmBitmaps(numMaps, words.clone());
  }

  public long memoryFootprint()
  {
    return (long) numMaps * BYTES_PER_MAP;
  }

  /**
   * Packs the bitmaps densely, bitmap 0 first, each bitmap most significant bit first.
   */
  public byte[] toBytes()
  {
    byte[] bytes = new byte[numMaps * BYTES_PER_MAP];
    for (int i = 0; i < words.length; i++) {
      System.arraycopy(Longs.toByteArray(words[i]), 0, bytes, i * Long.BYTES, Long.BYTES);
    }
    return bytes;
  }

  public static FmBitmaps fromBytes(byte[] bytes, int offset, int length)
  {
    Preconditions.checkArgument(
        length > 0 && length % BYTES_PER_MAP == 0,
        "sketch area of %s bytes is not a positive multiple of %s",
        length,
        BYTES_PER_MAP
    );
    long[] words = new long[length / Long.BYTES];
    for (int i = 0; i < words.length; i++) {
      int p = offset + i * Long.BYTES;
      words[i] = Longs.fromBytes(
          bytes[p], bytes[p + 1], bytes[p + 2], bytes[p + 3],
          bytes[p + 4], bytes[p + 5], bytes[p + 6], bytes[p + 7]
      );
    }
    return new FmBitmaps(length / BYTES_PER_MAP, words);
  }

  private void setBitFromLeft(int map, int positionFromLeft)
  {
    words[map * WORDS_PER_MAP + positionFromLeft / Long.SIZE] |= bitMask(positionFromLeft);
  }

  private static long bitMask(int positionFromLeft)
  {
    return 1L << (Long.SIZE - 1 - positionFromLeft % Long.SIZE);
  }

  @Override
  public boolean equals(Object o)
  {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    FmBitmaps that = (FmBitmaps) o;
    return numMaps == that.numMaps && Arrays.equals(words, that.words);
  }

  @Override
  public int hashCode()
  {
    return 31 * numMaps + Arrays.hashCode(words);
  }
}
