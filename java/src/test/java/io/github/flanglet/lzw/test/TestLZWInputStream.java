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
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Random;
import io.github.flanglet.lzw.BitOrder;
import io.github.flanglet.lzw.Error;
import io.github.flanglet.lzw.Event;
import io.github.flanglet.lzw.io.LZWIOException;
import io.github.flanglet.lzw.io.LZWInputStream;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.function.Executable;


public class TestLZWInputStream {
  private final static Random RANDOM = new Random(Long.MAX_VALUE);

  private static byte[] randomData(int length, int range) {
    byte[] data = new byte[length];

    for (int i = 0; i < length; i++)
      data[i] = (byte) RANDOM.nextInt(range);

    return data;
  }

  private static byte[] readAll(InputStream is, int bufSize) throws IOException {
    ByteArrayOutputStream baos = new ByteArrayOutputStream();
    byte[] buf = new byte[bufSize];
    int n;

    while ((n = is.read(buf, 0, buf.length)) > 0)
      baos.write(buf, 0, n);

    return baos.toByteArray();
  }

  @Test
  void testCorrectness() throws IOException {
    for (int test = 1; test <= 20; test++) {
      final int length = 1 + RANDOM.nextInt(40000);
      final int rootBits = 2 + RANDOM.nextInt(7);
      final BitOrder order = ((test & 1) == 0) ? BitOrder.LITTLE_ENDIAN : BitOrder.BIG_ENDIAN;
      byte[] data = randomData(length, Math.min(1 << rootBits, 4 * test));
      byte[] input = new GifLzwEncoder(rootBits, order).encode(data);
      final int bufferSize = 1 + RANDOM.nextInt(512);
      final int readSize = 1 + RANDOM.nextInt(4096);

      LZWInputStream lis = new LZWInputStream(new ByteArrayInputStream(input), rootBits, order, bufferSize);
      byte[] output = readAll(lis, readSize);

      Assertions.assertArrayEquals(data, output, "Mismatch on test=" + test);
      Assertions.assertTrue(lis.isComplete(), "Missing end of information on test=" + test);
      Assertions.assertEquals(input.length, lis.getRead());
      Assertions.assertEquals(length, lis.getWritten());
      Assertions.assertEquals(-1, lis.read());
      lis.close();
    }
  }

  @Test
  void testSingleByteReads() throws IOException {
    byte[] data = randomData(3000, 16);
    byte[] input = new GifLzwEncoder(4, BitOrder.LITTLE_ENDIAN).encode(data);
    LZWInputStream lis = new LZWInputStream(new ByteArrayInputStream(input), 4, BitOrder.LITTLE_ENDIAN, 7);
    ByteArrayOutputStream baos = new ByteArrayOutputStream();
    int b;

    while ((b = lis.read()) != -1)
      baos.write(b);

    lis.close();
    Assertions.assertArrayEquals(data, baos.toByteArray());
    Assertions.assertEquals(data.length, lis.getWritten());
  }

  @Test
  void testContext() throws IOException {
    byte[] data = randomData(10000, 256);
    byte[] input = new GifLzwEncoder(8, BitOrder.BIG_ENDIAN).encode(data);
    HashMap<String, Object> ctx = new HashMap<>();
    ctx.put("codeSize", 8);
    ctx.put("bitOrder", "big");
    ctx.put("bufferSize", 100);
    LZWInputStream lis = new LZWInputStream(new ByteArrayInputStream(input), ctx);
    Assertions.assertArrayEquals(data, readAll(lis, 333));
    Assertions.assertTrue(lis.isComplete());
    lis.close();

    // Defaults: 8 bit roots, little endian
    input = new GifLzwEncoder(8, BitOrder.LITTLE_ENDIAN).encode(data);
    lis = new LZWInputStream(new ByteArrayInputStream(input), new HashMap<>());
    Assertions.assertArrayEquals(data, readAll(lis, 65536));
    lis.close();
  }

  @Test
  void testListeners() throws IOException {
    byte[] data = randomData(20000, 4);
    byte[] input = new GifLzwEncoder(2, BitOrder.LITTLE_ENDIAN, 0, true).encode(data);
    LZWInputStream lis = new LZWInputStream(new ByteArrayInputStream(input), 2, BitOrder.LITTLE_ENDIAN, 64);
    final List<Event.Type> types = new ArrayList<>();
    lis.addListener(evt -> types.add(evt.getType()));
    Assertions.assertArrayEquals(data, readAll(lis, 1000));
    lis.close();

    Assertions.assertEquals(Event.Type.DECOMPRESSION_START, types.get(0));
    Assertions.assertEquals(Event.Type.DECOMPRESSION_END, types.get(types.size() - 1));
    Assertions.assertTrue(types.contains(Event.Type.CODE_WIDTH_CHANGE));
    Assertions.assertTrue(types.contains(Event.Type.CLEAR_CODE));
  }

  @Test
  void testTruncatedStream() throws IOException {
    byte[] data = randomData(5000, 32);
    byte[] input = new GifLzwEncoder(5, BitOrder.BIG_ENDIAN).encode(data);
    byte[] truncated = Arrays.copyOf(input, input.length / 2);
    LZWInputStream lis = new LZWInputStream(new ByteArrayInputStream(truncated), 5, BitOrder.BIG_ENDIAN, 50);
    byte[] output = readAll(lis, 100);
    lis.close();

    Assertions.assertFalse(lis.isComplete());
    Assertions.assertTrue(output.length > 0);
    Assertions.assertTrue(output.length < data.length);
    Assertions.assertArrayEquals(Arrays.copyOf(data, output.length), output);
  }

  @Test
  void testInvalidStream() {
    // Clear code then code 7 while the next free code is 6
    final byte[] input = GifLzwEncoder.pack(BitOrder.LITTLE_ENDIAN, new int[] { 4, 7 }, new int[] { 3, 3 });
    final LZWInputStream lis = new LZWInputStream(new ByteArrayInputStream(input), 2, BitOrder.LITTLE_ENDIAN);

    LZWIOException e = Assertions.assertThrows(LZWIOException.class, new Executable() {
      @Override
      public void execute() throws Throwable {
        lis.read();
      }
    });

    Assertions.assertEquals(Error.ERR_INVALID_FILE, e.getErrorCode());
  }

  @Test
  void testReadAfterClose() throws IOException {
    byte[] input = new GifLzwEncoder(8, BitOrder.LITTLE_ENDIAN).encode(randomData(100, 256));
    final LZWInputStream lis = new LZWInputStream(new ByteArrayInputStream(input), 8, BitOrder.LITTLE_ENDIAN);
    lis.read();
    lis.close();
    lis.close();

    Assertions.assertThrows(IOException.class, new Executable() {
      @Override
      public void execute() throws Throwable {
        lis.read(new byte[16], 0, 16);
      }
    });

    Assertions.assertThrows(IOException.class, new Executable() {
      @Override
      public void execute() throws Throwable {
        lis.available();
      }
    });
  }

  @Test
  void testInvalidParameters() {
    final InputStream is = new ByteArrayInputStream(new byte[0]);
    Assertions.assertThrows(IllegalArgumentException.class, () -> new LZWInputStream(is, 1, BitOrder.LITTLE_ENDIAN));
    Assertions.assertThrows(IllegalArgumentException.class, () -> new LZWInputStream(is, 9, BitOrder.LITTLE_ENDIAN));
    Assertions.assertThrows(IllegalArgumentException.class, () -> new LZWInputStream(is, 8, BitOrder.LITTLE_ENDIAN, 0));
    Assertions.assertThrows(NullPointerException.class, () -> new LZWInputStream(null, 8, BitOrder.LITTLE_ENDIAN));
    Assertions.assertThrows(NullPointerException.class, () -> new LZWInputStream(is, null));
  }
}
