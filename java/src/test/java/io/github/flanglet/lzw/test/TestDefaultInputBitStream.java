/*
Copyright 2011-2025 Frederic Langlet
Licensed under the Apache License, Version 2.0 (the "License");
you may not use this file except in compliance with the License.
you may obtain a copy of the License at

                http://www.apache.org/licenses/LICENSE-2.0

Unless required by applicable law or agreed to in writing, software
distributed under the License is distributed on an "AS IS" BASIS,
WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
See the License for the specific language governing permissions and
limitations under the License.
*/

package io.github.flanglet.lzw.test;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.Random;
import io.github.flanglet.lzw.BitOrder;
import io.github.flanglet.lzw.BitStreamException;
import io.github.flanglet.lzw.InputBitStream;
import io.github.flanglet.lzw.bitstream.DefaultInputBitStream;
import org.junit.Assert;
import org.junit.Test;


public class TestDefaultInputBitStream
{
   private final static Random RANDOM = new Random(Long.MAX_VALUE);


   private static InputBitStream newStream(BitOrder order, int... bytes)
   {
      byte[] buf = new byte[bytes.length];

      for (int i=0; i<bytes.length; i++)
         buf[i] = (byte) bytes[i];

      return new DefaultInputBitStream(new ByteArrayInputStream(buf), order);
   }


   @Test
   public void testLittleEndian()
   {
      // 0x4c = 01001100, 0x01 = 00000001
      InputBitStream ibs = newStream(BitOrder.LITTLE_ENDIAN, 0x4c, 0x01);
      Assert.assertEquals(4, ibs.readBits(3));
      Assert.assertEquals(1, ibs.readBits(3));
      Assert.assertEquals(5, ibs.readBits(3)); // crosses the byte boundary
      Assert.assertEquals(9, ibs.read());
      Assert.assertEquals(0, ibs.readBits(7));
      Assert.assertEquals(16, ibs.read());
      Assert.assertFalse(ibs.hasMoreToRead());
   }


   @Test
   public void testBigEndian()
   {
      // 0x85 = 10000101, 0x50 = 01010000
      InputBitStream ibs = newStream(BitOrder.BIG_ENDIAN, 0x85, 0x50);
      Assert.assertEquals(4, ibs.readBits(3));
      Assert.assertEquals(1, ibs.readBits(3));
      Assert.assertEquals(2, ibs.readBits(3)); // crosses the byte boundary
      Assert.assertEquals(5, ibs.readBits(3));
      Assert.assertEquals(12, ibs.read());
      Assert.assertTrue(ibs.hasMoreToRead());
   }


   @Test
   public void testReadBit()
   {
      InputBitStream ibs1 = newStream(BitOrder.LITTLE_ENDIAN, 0x81, 0x02);
      InputBitStream ibs2 = newStream(BitOrder.BIG_ENDIAN, 0x81, 0x02);
      int[] expected1 = { 1,0,0,0,0,0,0,1, 0,1,0,0,0,0,0,0 };
      int[] expected2 = { 1,0,0,0,0,0,0,1, 0,0,0,0,0,0,1,0 };

      for (int i=0; i<16; i++)
      {
         Assert.assertEquals(expected1[i], ibs1.readBit());
         Assert.assertEquals(expected2[i], ibs2.readBit());
      }

      try
      {
         ibs1.readBit();
         Assert.fail("Read past the end of the stream");
      }
      catch (BitStreamException e)
      {
         Assert.assertEquals(BitStreamException.END_OF_STREAM, e.getErrorCode());
      }
   }


   @Test
   public void testShortRead()
   {
      for (BitOrder order : BitOrder.values())
      {
         InputBitStream ibs = newStream(order, 0xA5);
         Assert.assertEquals(5, ibs.readBits(3));
         long before = ibs.read();
         long value = ibs.readBits(12);
         Assert.assertEquals(5, ibs.read() - before);

         // The 5 remaining bits of 0xA5 = 10100101
         long expected = (order == BitOrder.LITTLE_ENDIAN) ? (0xA5 >>> 3) : (0xA5 & 0x1F);
         Assert.assertEquals(expected, value);

         // Nothing left: no bit read, no error
         before = ibs.read();
         Assert.assertEquals(0, ibs.readBits(8));
         Assert.assertEquals(before, ibs.read());
      }
   }


   @Test
   public void testSplitReads()
   {
      // Reading n bits then m bits and combining them equals reading n+m bits
      for (BitOrder order : BitOrder.values())
      {
         for (int test=0; test<200; test++)
         {
            byte[] buf = new byte[8];
            RANDOM.nextBytes(buf);
            final int skip = RANDOM.nextInt(8);
            final int total = 2 + RANDOM.nextInt(40);
            final int head = 1 + RANDOM.nextInt(total-1);

            InputBitStream ibs1 = new DefaultInputBitStream(new ByteArrayInputStream(buf), order);
            InputBitStream ibs2 = new DefaultInputBitStream(new ByteArrayInputStream(buf), order);

            if (skip > 0)
            {
               ibs1.readBits(skip);
               ibs2.readBits(skip);
            }

            long whole = ibs1.readBits(total);
            long h = ibs2.readBits(head);
            long t = ibs2.readBits(total-head);
            Assert.assertEquals(whole, order.combine(h, head, t, total-head));
            Assert.assertEquals(ibs1.read(), ibs2.read());
         }
      }
   }


   @Test
   public void testClose()
   {
      InputBitStream ibs = newStream(BitOrder.LITTLE_ENDIAN, 0xFF, 0xFF);
      ibs.readBits(4);
      ibs.close();
      Assert.assertFalse(ibs.hasMoreToRead());

      try
      {
         ibs.readBits(4);
         Assert.fail("Read from a closed stream");
      }
      catch (BitStreamException e)
      {
         Assert.assertEquals(BitStreamException.STREAM_CLOSED, e.getErrorCode());
      }
   }


   @Test
   public void testInputFailure()
   {
      InputStream failing = new InputStream()
      {
         @Override
         public int read() throws IOException
         {
            throw new IOException("device failure");
         }
      };

      InputBitStream ibs = new DefaultInputBitStream(failing, BitOrder.BIG_ENDIAN);

      try
      {
         ibs.readBits(5);
         Assert.fail("I/O error not reported");
      }
      catch (BitStreamException e)
      {
         Assert.assertEquals(BitStreamException.INPUT_OUTPUT, e.getErrorCode());
         Assert.assertTrue(e.getCause() instanceof IOException);
      }
   }


   @Test
   public void testInvalidBitCount()
   {
      InputBitStream ibs = newStream(BitOrder.LITTLE_ENDIAN, 0x00);

      for (int count : new int[] { 0, -1, 57 })
      {
         try
         {
            ibs.readBits(count);
            Assert.fail("Invalid bit count accepted: "+count);
         }
         catch (IllegalArgumentException e)
         {
            // Expected
         }
      }
   }


   @Test
   public void testBitOrderNames()
   {
      Assert.assertEquals(BitOrder.LITTLE_ENDIAN, BitOrder.getOrder("little"));
      Assert.assertEquals(BitOrder.LITTLE_ENDIAN, BitOrder.getOrder(" LSB "));
      Assert.assertEquals(BitOrder.BIG_ENDIAN, BitOrder.getOrder("Big"));
      Assert.assertEquals(BitOrder.BIG_ENDIAN, BitOrder.getOrder("BIG_ENDIAN"));

      try
      {
         BitOrder.getOrder("middle");
         Assert.fail("Unknown bit order accepted");
      }
      catch (IllegalArgumentException e)
      {
         // Expected
      }
   }
}
