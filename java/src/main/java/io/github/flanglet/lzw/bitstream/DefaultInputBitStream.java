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

package io.github.flanglet.lzw.bitstream;

import java.io.IOException;
import java.io.InputStream;
import io.github.flanglet.lzw.BitOrder;
import io.github.flanglet.lzw.BitStreamException;
import io.github.flanglet.lzw.InputBitStream;


/**
 * A default implementation of the {@link InputBitStream} interface
 * that reads bits from an input stream.
 * <p>
 * Bytes are pulled from the input stream one at a time, so that no more
 * than the byte holding the current bit is ever taken from the source.
 * Wrap the source in a {@code BufferedInputStream} when it is expensive
 * to read byte by byte.
 * </p>
 * <p>
 * Multi-bit reads stop quietly at the end of the input and return the bits
 * obtained so far. The input stream is borrowed: closing this bit stream
 * does not close it.
 * </p>
 */
public final class DefaultInputBitStream implements InputBitStream {
    private static final int MAX_BITS = 56;

    private final InputStream is;
    private final BitOrder order;
    private int current;     // Last byte pulled from the input stream
    private int availBits;   // Bits not consumed in current
    private long read;       // Total bits read so far
    private boolean closed;
    private boolean eos;     // End of input stream seen


    /**
     * Constructs a DefaultInputBitStream with the specified input stream
     * and bit order.
     *
     * @param is the InputStream to read bits from
     * @param order the order in which bits are extracted from each byte
     * @throws NullPointerException if a parameter is null
     */
    public DefaultInputBitStream(InputStream is, BitOrder order) {
       if (is == null)
          throw new NullPointerException("Invalid null input stream parameter");

       if (order == null)
          throw new NullPointerException("Invalid null bit order parameter");

       this.is = is;
       this.order = order;
    }


    /**
     * Reads a single bit from the input stream.
     *
     * @return 1 or 0
     * @throws BitStreamException if the stream is closed, exhausted or an error occurs
     */
    @Override
    public int readBit() throws BitStreamException {
        if ((this.availBits == 0) && (this.pullCurrent() == false))
            throw new BitStreamException("No more data to read in the bitstream", BitStreamException.END_OF_STREAM);

        this.availBits--;
        this.read++;

        if (this.order == BitOrder.LITTLE_ENDIAN)
           return (this.current >>> (7-this.availBits)) & 1;

        return (this.current >>> this.availBits) & 1;
    }


    /**
     * Reads up to {@code count} bits from the input stream.
     *
     * @param count the number of bits to read (must be in the range [1..56])
     * @return the value of the read bits as a long, right aligned
     * @throws BitStreamException if the stream is closed or an error occurs
     */
    @Override
    public long readBits(int count) throws BitStreamException {
       if ((count < 1) || (count > MAX_BITS))
          throw new IllegalArgumentException("Invalid bit count: "+count+" (must be in [1.."+MAX_BITS+"])");

       long res = 0;
       int got = 0;

       while (got < count) {
          if ((this.availBits == 0) && (this.pullCurrent() == false))
             break;

          final int n = Math.min(count-got, this.availBits);
          final int mask = (1 << n) - 1;

          if (this.order == BitOrder.LITTLE_ENDIAN) {
             // Consume from bit 0 upward
             final long bits = (this.current >>> (8-this.availBits)) & mask;
             res |= (bits << got);
          }
          else {
             // Consume from bit 7 downward
             final long bits = (this.current >>> (this.availBits-n)) & mask;
             res = (res << n) | bits;
          }

          this.availBits -= n;
          got += n;
       }

       this.read += got;
       return res;
    }


    /**
     * Pulls the next byte from the input stream.
     *
     * @return false if the end of the input stream has been reached
     */
    private boolean pullCurrent() {
       if (this.closed == true)
          throw new BitStreamException("Stream closed", BitStreamException.STREAM_CLOSED);

       if (this.eos == true)
          return false;

       final int b;

       try {
          b = this.is.read();
       }
       catch (IOException e) {
          throw new BitStreamException(e.getMessage(), e, BitStreamException.INPUT_OUTPUT);
       }

       if (b < 0) {
          this.eos = true;
          return false;
       }

       this.current = b;
       this.availBits = 8;
       return true;
    }


    /**
     * Closes the bit stream. Further reads fail with {@link BitStreamException#STREAM_CLOSED}.
     */
    @Override
    public void close() {
       if (this.closed == true)
          return;

       this.closed = true;
       this.availBits = 0;
    }


    /**
     * Returns the total number of bits read so far from the input stream.
     *
     * @return the total bits read
     */
    @Override
    public long read() {
       return this.read;
    }


    /**
     * Checks if there are more bits to read from the input stream.
     * May pull one byte from the input stream (kept for the next read).
     *
     * @return true if there are more bits to read, false otherwise
     */
    @Override
    public boolean hasMoreToRead() {
       if (this.closed == true)
          return false;

       if (this.availBits > 0)
          return true;

       try {
          return this.pullCurrent();
       }
       catch (BitStreamException e) {
          return false;
       }
    }


    @Override
    public BitOrder getBitOrder() {
       return this.order;
    }


    /**
     * Checks if the bit stream is closed.
     *
     * @return true if the stream is closed, false otherwise
     */
    public boolean isClosed() {
        return this.closed;
    }
}
