package io.fmcount.sketch;

import org.junit.Assert;
import org.junit.Test;

import java.nio.charset.StandardCharsets;
import java.util.List;

import static io.fmcount.sketch.SortedByteArraySet.InsertResult.ALREADY_PRESENT;
import static io.fmcount.sketch.SortedByteArraySet.InsertResult.INSERTED;
import static io.fmcount.sketch.SortedByteArraySet.InsertResult.INSUFFICIENT_STORAGE;

public class SortedByteArraySetTest
{
  private static byte[] bytes(String s)
  {
    return s.getBytes(StandardCharsets.UTF_8);
  }

  @Test
  public void testDeduplicatesAndKeepsOrder()
  {
    SortedByteArraySet set = new SortedByteArraySet(100, 64);
    Assert.assertEquals(INSERTED, set.insert(bytes("pear")));
    Assert.assertEquals(INSERTED, set.insert(bytes("apple")));
    Assert.assertEquals(ALREADY_PRESENT, set.insert(bytes("pear")));
    Assert.assertEquals(INSERTED, set.insert(bytes("fig")));
    Assert.assertEquals(INSERTED, set.insert(bytes("app")));

    Assert.assertEquals(4, set.size());
    List<byte[]> values = set.values();
    Assert.assertArrayEquals(bytes("app"), values.get(0));
    Assert.assertArrayEquals(bytes("apple"), values.get(1));
    Assert.assertArrayEquals(bytes("fig"), values.get(2));
    Assert.assertArrayEquals(bytes("pear"), values.get(3));
    Assert.assertTrue(set.contains(bytes("fig")));
    Assert.assertFalse(set.contains(bytes("figs")));
    // stored once each, in arrival order
    Assert.assertEquals("pearapplefigapp".length(), set.storageUsed());
  }

  @Test
  public void testComparesBytesUnsigned()
  {
    SortedByteArraySet set = new SortedByteArraySet(10, 16);
    set.insert(new byte[]{(byte) 0xff});
    set.insert(new byte[]{0x01});
    set.insert(new byte[]{(byte) 0x80});

    Assert.assertArrayEquals(new byte[]{0x01}, set.get(0));
    Assert.assertArrayEquals(new byte[]{(byte) 0x80}, set.get(1));
    Assert.assertArrayEquals(new byte[]{(byte) 0xff}, set.get(2));
  }

  @Test
  public void testEmbeddedZeroBytesAreDistinct()
  {
    SortedByteArraySet set = new SortedByteArraySet(10, 16);
    Assert.assertEquals(INSERTED, set.insert(new byte[]{'a'}));
    Assert.assertEquals(INSERTED, set.insert(new byte[]{'a', 0}));
    Assert.assertEquals(INSERTED, set.insert(new byte[]{'a', 0, 'b'}));
    Assert.assertEquals(INSERTED, set.insert(new byte[0]));
    Assert.assertEquals(ALREADY_PRESENT, set.insert(new byte[]{'a', 0}));

    Assert.assertEquals(4, set.size());
    Assert.assertArrayEquals(new byte[0], set.get(0));
    Assert.assertArrayEquals(new byte[]{'a', 0, 'b'}, set.get(3));
  }

  @Test
  public void testTryInsertReportsInsufficientStorageWithoutChange()
  {
    SortedByteArraySet set = new SortedByteArraySet(10, 4);
    Assert.assertEquals(INSERTED, set.tryInsert(bytes("abc")));
    Assert.assertEquals(INSUFFICIENT_STORAGE, set.tryInsert(bytes("xy")));
    Assert.assertEquals(1, set.size());
    Assert.assertEquals(3, set.storageUsed());
    Assert.assertEquals(4, set.storageSize());
    // a duplicate is found before storage is considered
    Assert.assertEquals(ALREADY_PRESENT, set.tryInsert(bytes("abc")));
  }

  @Test
  public void testInsertGrowsStorageGeometrically()
  {
    SortedByteArraySet set = new SortedByteArraySet(10, 4);
    set.insert(bytes("abc"));
    Assert.assertEquals(INSERTED, set.insert(bytes("0123456789")));
    Assert.assertEquals(2 * 4 + 10, set.storageSize());
    Assert.assertEquals(2, set.size());

    // room left, no growth
    set.insert(bytes("z"));
    Assert.assertEquals(18, set.storageSize());
    Assert.assertArrayEquals(bytes("0123456789"), set.get(0));
    Assert.assertArrayEquals(bytes("abc"), set.get(1));
    Assert.assertArrayEquals(bytes("z"), set.get(2));
  }

  @Test
  public void testGrowsFromEmptyStorage()
  {
    SortedByteArraySet set = new SortedByteArraySet(10, 0);
    Assert.assertEquals(INSERTED, set.insert(bytes("hello")));
    Assert.assertEquals(5, set.storageSize());
  }

  @Test
  public void testDirectoryGrowsUpToCapacity()
  {
    SortedByteArraySet set = new SortedByteArraySet(40, 8);
    for (int i = 0; i < 40; i++) {
      set.insert(bytes(String.format("%03d", i)));
    }
    Assert.assertTrue(set.isFull());
    Assert.assertEquals(40, set.directorySize());
    Assert.assertTrue(set.contains(bytes("039")));
  }

  @Test(expected = IllegalStateException.class)
  public void testInsertIntoFullSetFails()
  {
    SortedByteArraySet set = new SortedByteArraySet(2, 8);
    set.insert(bytes("a"));
    set.insert(bytes("b"));
    set.insert(bytes("c"));
  }

  @Test
  public void testRestoreRejectsUnsortedDirectory()
  {
    byte[] storage = bytes("ba");
    try {
      SortedByteArraySet.restore(10, new int[]{0, 1}, new int[]{1, 1}, storage);
      Assert.fail("expected unsorted directory to be rejected");
    } catch (IllegalArgumentException expected) {
      Assert.assertTrue(expected.getMessage().contains("sorted"));
    }

    SortedByteArraySet set = SortedByteArraySet.restore(10, new int[]{1, 0}, new int[]{1, 1}, storage);
    Assert.assertArrayEquals(bytes("a"), set.get(0));
    Assert.assertEquals(INSERTED, set.insert(bytes("c")));
  }
}
