package io.fmcount.sketch;

import com.google.common.hash.HashFunction;
import com.google.common.hash.Hashing;

import java.nio.ByteBuffer;
import java.util.Random;

/**
 * Generates distinct synthetic values: the sha1 of a (counter, seed) pair, which is much faster than
 * UUID#randomUUID().
 *
 * <p>see http://antirez.com/news/99
 */
public class FastRandomIdGenerator
{
  private static final HashFunction SHA1 = Hashing.sha1();

  private final ByteBuffer buffer = ByteBuffer.allocate(2 * Long.BYTES);
  private long counter = 0;

  public FastRandomIdGenerator()
  {
    this(new Random().nextLong());
  }

  /**
   * Generators built with the same seed produce the same sequence.
   */
  public FastRandomIdGenerator(long seed)
  {
    buffer.putLong(Long.BYTES, seed);
  }

  /**
   * @return a 20 bytes id with a very low collision rate
   */
  public byte[] generate()
  {
    buffer.putLong(0, counter++);
    return SHA1.hashBytes(buffer.array()).asBytes();
  }

  public long generated()
  {
    return counter;
  }
}
