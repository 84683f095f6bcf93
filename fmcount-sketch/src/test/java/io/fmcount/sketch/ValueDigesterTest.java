package io.fmcount.sketch;

import com.google.common.hash.Hashing;
import org.junit.Assert;
import org.junit.Test;

import java.nio.charset.StandardCharsets;

public class ValueDigesterTest
{
  @Test
  public void testMd5IsStable()
  {
    ValueDigester digester = ValueDigester.md5();
    byte[] value = "a".getBytes(StandardCharsets.UTF_8);

    Assert.assertEquals("0cc175b9c0f1b6a831c399e269772661", digester.digest(value).toString());
    Assert.assertEquals(digester.digest(value), digester.digest(value.clone()));
    Assert.assertEquals(ValueDigester.DIGEST_BITS, digester.digest(new byte[0]).bits());
  }

  @Test
  public void testAcceptsOther128BitFunctions()
  {
    ValueDigester digester = new ValueDigester(Hashing.murmur3_128());
    Assert.assertEquals(128, digester.digest(new byte[]{1, 2, 3}).bits());
  }

  @Test(expected = IllegalArgumentException.class)
  public void testRejectsNarrowHashFunction()
  {
    new ValueDigester(Hashing.sipHash24());
  }
}
