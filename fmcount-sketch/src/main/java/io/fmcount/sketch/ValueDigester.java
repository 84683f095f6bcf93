package io.fmcount.sketch;

import com.google.common.base.Preconditions;
import com.google.common.hash.HashCode;
import com.google.common.hash.HashFunction;
import com.google.common.hash.Hashing;

/**
 * Computes the 128-bit digest of a value's canonical bytes.
 *
 * <p>Every worker taking part in one aggregation must use the same hash function, otherwise
 * their sketches can not be merged meaningfully.
 */
public final class ValueDigester
{
  public static final int DIGEST_BITS = 128;

  private static final ValueDigester MD5 = new ValueDigester(Hashing.md5());

  private final HashFunction hashFunction;

  public ValueDigester(HashFunction hashFunction)
  {
    Preconditions.checkArgument(
        hashFunction.bits() == DIGEST_BITS,
        "hash function %s produces %s bits, expected %s",
        hashFunction,
        hashFunction.bits(),
        DIGEST_BITS
    );
    this.hashFunction = hashFunction;
  }

  public static ValueDigester md5()
  {
    return MD5;
  }

  public HashCode digest(byte[] value)
  {
    return hashFunction.hashBytes(value);
  }

  @Override
  public String toString()
  {
    return "ValueDigester{" + hashFunction + "}";
  }
}
