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

package io.github.flanglet.lzw.io;

import java.io.IOException;
import java.io.InputStream;
import java.util.Map;
import io.github.flanglet.lzw.BitOrder;
import io.github.flanglet.lzw.BitStreamException;
import io.github.flanglet.lzw.Error;
import io.github.flanglet.lzw.Listener;
import io.github.flanglet.lzw.codec.LZWDecoder;


/**
 * Input stream delivering the decompressed content of a raw LZW code stream.
 * <p>
 * The compressed source is read in chunks of {@code bufferSize} bytes, each
 * chunk being handed to an {@link LZWDecoder}. The stream ends when the end
 * of information code is decoded or when the source is exhausted (see
 * {@link #isComplete()} to tell both cases apart).
 * </p>
 * <p>
 * Accepted context keys: "codeSize" (Integer, default 8), "bitOrder"
 * ({@link BitOrder} or its name, default little endian) and "bufferSize"
 * (Integer, default 65536).
 * </p>
 */
public class LZWInputStream extends InputStream {
    private static final int DEFAULT_BUFFER_SIZE = 65536;
    private static final int DEFAULT_CODE_SIZE = 8;
    private static final int MAX_BUFFER_SIZE = 1 << 28;
    private static final byte[] EMPTY_BYTE_ARRAY = new byte[0];

    private final InputStream is;
    private final LZWDecoder decoder;
    private final byte[] chunk;
    private byte[] output;
    private int index;
    private long read;    // compressed bytes pulled from the source
    private long written; // decompressed bytes returned to the caller
    private boolean eos;
    private boolean closed;


    public LZWInputStream(InputStream is, int codeSize, BitOrder order) {
       this(is, codeSize, order, DEFAULT_BUFFER_SIZE);
    }


    /**
     * Creates a decompressing stream.
     *
     * @param is the source of compressed bytes
     * @param codeSize the root code size in bits
     * @param order the bit order of the code stream
     * @param bufferSize the number of compressed bytes decoded per chunk
     */
    public LZWInputStream(InputStream is, int codeSize, BitOrder order, int bufferSize) {
       if (is == null)
          throw new NullPointerException("Invalid null input stream parameter");

       if ((bufferSize < 1) || (bufferSize > MAX_BUFFER_SIZE))
          throw new IllegalArgumentException("Invalid buffer size: "+bufferSize+
             " (must be in [1.."+MAX_BUFFER_SIZE+"])");

       this.is = is;
       this.decoder = new LZWDecoder(codeSize, order);
       this.chunk = new byte[bufferSize];
       this.output = EMPTY_BYTE_ARRAY;
    }


    /**
     * Creates a decompressing stream configured from a context map.
     *
     * @param is the source of compressed bytes
     * @param ctx the configuration (see class documentation)
     */
    public LZWInputStream(InputStream is, Map<String, Object> ctx) {
       this(is, getCodeSize(ctx), getBitOrder(ctx), getBufferSize(ctx));
    }


    private static int getCodeSize(Map<String, Object> ctx) {
       if (ctx == null)
          throw new NullPointerException("Invalid null context parameter");

       return (Integer) ctx.getOrDefault("codeSize", DEFAULT_CODE_SIZE);
    }


    private static BitOrder getBitOrder(Map<String, Object> ctx) {
       Object order = ctx.getOrDefault("bitOrder", BitOrder.LITTLE_ENDIAN);
       return (order instanceof BitOrder) ? (BitOrder) order : BitOrder.getOrder(String.valueOf(order));
    }


    private static int getBufferSize(Map<String, Object> ctx) {
       return (Integer) ctx.getOrDefault("bufferSize", DEFAULT_BUFFER_SIZE);
    }


    /**
     * Adds a listener to be notified of decoding events.
     *
     * @param bl The listener to add.
     * @return {@code true} if the listener was added successfully, {@code false} otherwise.
     */
    public boolean addListener(Listener bl) {
       return this.decoder.addListener(bl);
    }


    public boolean removeListener(Listener bl) {
       return this.decoder.removeListener(bl);
    }


    @Override
    public int read() throws IOException {
       if (this.fill() == false)
          return -1;

       this.written++;
       return this.output[this.index++] & 0xFF;
    }


    @Override
    public int read(byte[] data, int off, int len) throws IOException {
       if (data == null)
          throw new NullPointerException();

       if ((off < 0) || (len < 0) || (len + off > data.length))
          throw new IndexOutOfBoundsException();

       if (len == 0)
          return 0;

       int remaining = len;

       while (remaining > 0) {
          if (this.fill() == false)
             break;

          final int lenChunk = Math.min(remaining, this.output.length-this.index);
          System.arraycopy(this.output, this.index, data, off, lenChunk);
          this.index += lenChunk;
          off += lenChunk;
          remaining -= lenChunk;
       }

       final int n = len - remaining;
       this.written += n;
       return (n == 0) ? -1 : n;
    }


    // Decode chunks until some output is available. Return false at end of stream.
    private boolean fill() throws IOException {
       if (this.closed == true)
          throw new LZWIOException("Stream closed", Error.ERR_READ_FILE);

       while (this.index >= this.output.length) {
          if ((this.eos == true) || (this.decoder.isFinished() == true))
             return false;

          final int n = this.is.read(this.chunk, 0, this.chunk.length);

          if (n < 0) {
             this.eos = true;
             return false;
          }

          this.read += n;

          try {
             this.output = this.decoder.decode(this.chunk, 0, n);
             this.index = 0;
          }
          catch (BitStreamException e) {
             final int code = (e.getErrorCode() == BitStreamException.INVALID_STREAM) ?
                Error.ERR_INVALID_FILE : Error.ERR_READ_FILE;
             throw new LZWIOException(e.getMessage(), e, code);
          }
       }

       return true;
    }


    /**
     * Returns the number of decoded bytes that can be read without touching
     * the compressed source.
     */
    @Override
    public int available() throws IOException {
       if (this.closed == true)
          throw new LZWIOException("Stream closed", Error.ERR_READ_FILE);

       return this.output.length - this.index;
    }


    /**
     * Closes this stream and the compressed source, and releases the decoder.
     */
    @Override
    public void close() throws IOException {
       if (this.closed == true)
          return;

       this.closed = true;
       this.output = EMPTY_BYTE_ARRAY;
       this.index = 0;
       this.decoder.dispose();
       this.is.close();
    }


    /**
     * Tells whether the end of information code has been decoded.
     *
     * @return false if the source ended before the end marker or if the
     *         marker has not been reached yet
     */
    public boolean isComplete() {
       return this.decoder.isFinished();
    }


    /**
     * Returns the number of compressed bytes read from the source so far.
     *
     * @return the number of compressed bytes consumed
     */
    public long getRead() {
       return this.read;
    }


    /**
     * Returns the number of decompressed bytes delivered so far.
     *
     * @return the number of decompressed bytes read from this stream
     */
    public long getWritten() {
       return this.written;
    }
}
