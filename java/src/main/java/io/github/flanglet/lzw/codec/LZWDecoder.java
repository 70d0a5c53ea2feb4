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

package io.github.flanglet.lzw.codec;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import io.github.flanglet.lzw.BitOrder;
import io.github.flanglet.lzw.BitStreamException;
import io.github.flanglet.lzw.Event;
import io.github.flanglet.lzw.InputBitStream;
import io.github.flanglet.lzw.Listener;
import io.github.flanglet.lzw.StreamDecoder;
import io.github.flanglet.lzw.bitstream.DefaultInputBitStream;


/**
 * Variable width LZW decoder for the GIF/TIFF family of code streams.
 * <p>
 * Codes start at {@code initCodeSize+1} bits and grow by one bit each time
 * the dictionary fills the current code space, up to 12 bits. Code
 * {@code 1<<initCodeSize} clears the dictionary and the next one ends the
 * stream. Compressed data can be supplied in chunks of any size: a code cut
 * by the end of a chunk is completed by the next call to {@code decode}.
 * </p>
 * <p>
 * Instances are not thread safe.
 * </p>
 */
public class LZWDecoder implements StreamDecoder {
    /**
     * Maximum width of a code in bits.
     */
    public static final int MAX_CODE_SIZE = 12;

    /**
     * Number of codes the dictionary can hold.
     */
    public static final int MAX_CODES = 1 << MAX_CODE_SIZE;

    public static final int MIN_ROOT_BITS = 2;
    public static final int MAX_ROOT_BITS = 8;

    private static final int NO_CODE = -1;
    private static final byte[] EMPTY_BYTE_ARRAY = new byte[0];

    private final BitOrder order;
    private final int initCodeSize;
    private final int clearCode;
    private final int endInfoCode;
    private final CodeTable table;
    private final List<Listener> listeners;
    private int codeSize;     // read width is codeSize+1
    private int nextCode;
    private int prevCode;     // NO_CODE at start of session
    private long pendingCode; // bits of a code cut by the end of a chunk
    private int pendingBits;  // 0 if no code is pending
    private long decoded;
    private boolean started;
    private boolean finished;
    private boolean disposed;


    /**
     * Creates a decoder reading codes least significant bit first (GIF).
     *
     * @param initCodeSize the root code size in bits (in [2..8])
     */
    public LZWDecoder(int initCodeSize) {
       this(initCodeSize, BitOrder.LITTLE_ENDIAN);
    }


    /**
     * Creates a decoder.
     *
     * @param initCodeSize the root code size in bits (in [2..8])
     * @param order the order in which code bits are packed into bytes
     * @throws IllegalArgumentException if the code size is out of range
     */
    public LZWDecoder(int initCodeSize, BitOrder order) {
       if (order == null)
          throw new NullPointerException("Invalid null bit order parameter");

       if ((initCodeSize < MIN_ROOT_BITS) || (initCodeSize > MAX_ROOT_BITS))
          throw new IllegalArgumentException("Invalid initial code size: "+initCodeSize+
             " (must be in ["+MIN_ROOT_BITS+".."+MAX_ROOT_BITS+"])");

       this.order = order;
       this.initCodeSize = initCodeSize;
       this.clearCode = 1 << initCodeSize;
       this.endInfoCode = this.clearCode + 1;
       this.table = new CodeTable(MAX_CODES);
       this.listeners = new ArrayList<>(4);
       this.reset();
    }


    /**
     * Brings the decoder back to its state right after construction: root
     * entries only, initial code width, no previous code, no pending partial
     * code. Calling it repeatedly has the same effect as calling it once.
     */
    @Override
    public void reset() {
       this.checkOpen();
       this.resetTable();
       this.prevCode = NO_CODE;
       this.pendingCode = 0;
       this.pendingBits = 0;
       this.decoded = 0;
       this.started = false;
       this.finished = false;
    }


    // Restore root entries, code width and next free code
    private void resetTable() {
       this.table.reset(this.initCodeSize);
       this.codeSize = this.initCodeSize;
       this.nextCode = this.clearCode + 2;
    }


    /**
     * Decodes a chunk of compressed bytes.
     *
     * @param buf the array holding the chunk
     * @param off the offset of the chunk in the array
     * @param len the length of the chunk
     * @return the bytes decoded during this call
     */
    public byte[] decode(byte[] buf, int off, int len) {
       if (buf == null)
          throw new NullPointerException("Invalid null buffer parameter");

       if ((off < 0) || (len < 0) || (off+len > buf.length))
          throw new IndexOutOfBoundsException("Invalid chunk: offset="+off+", length="+len);

       return this.decode(new ByteArrayInputStream(buf, off, len));
    }


    /**
     * Decodes compressed bytes read from the provided input stream until it
     * ends or the end of information code is met. The stream is not closed.
     *
     * @param is the source of compressed bytes
     * @return the bytes decoded during this call
     */
    public byte[] decode(InputStream is) {
       return this.decode(new DefaultInputBitStream(is, this.order));
    }


    @Override
    public byte[] decode(InputBitStream ibs) throws BitStreamException {
       if (ibs == null)
          throw new NullPointerException("Invalid null bitstream parameter");

       this.checkOpen();

       if (ibs.getBitOrder() != this.order)
          throw new IllegalArgumentException("Invalid bit order: "+ibs.getBitOrder()+" (expected "+this.order+")");

       if (this.finished == true)
          return EMPTY_BYTE_ARRAY;

       if (this.started == false) {
          this.started = true;
          this.notifyListeners(Event.Type.DECOMPRESSION_START, NO_CODE, this.initCodeSize);
       }

       final ByteArrayOutputStream out = new ByteArrayOutputStream(1024);
       int width = this.codeSize + 1;

       try {
          while (true) {
             final int code = this.readCode(ibs, width);

             if (code < 0) {
                this.notifyListeners(Event.Type.INPUT_EXHAUSTED, NO_CODE, this.pendingBits);
                break;
             }

             if (code == this.clearCode) {
                final int dropped = this.nextCode - this.clearCode - 2;
                this.resetTable();
                this.prevCode = this.clearCode;
                width = this.codeSize + 1;
                this.notifyListeners(Event.Type.CLEAR_CODE, code, dropped);
                continue;
             }

             if (code == this.endInfoCode) {
                this.finished = true;
                this.decoded += out.size();
                this.notifyListeners(Event.Type.DECOMPRESSION_END, code, this.decoded);
                return out.toByteArray();
             }

             final byte[] value = this.table.get(code);

             if (value != null) {
                out.write(value, 0, value.length);
                this.extend(this.prevCode, value[0]);
             }
             else if (code == this.nextCode) {
                // Code defined by this very step: previous value + its first byte
                final byte[] prevValue = this.table.get(this.prevCode);

                if (prevValue != null) {
                   final byte[] newValue = this.extend(this.prevCode, prevValue[0]);
                   out.write(newValue, 0, newValue.length);
                }
                else {
                   this.notifyListeners(Event.Type.UNRESOLVED_CODE, code, 0);
                }
             }
             else {
                throw new BitStreamException("Invalid LZW code: "+code+" (next code is "+this.nextCode+")",
                   BitStreamException.INVALID_STREAM);
             }

             this.prevCode = code;
             width = this.codeSize + 1;
          }
       }
       finally {
          if (this.finished == false)
             this.decoded += out.size();
       }

       return out.toByteArray();
    }


    // Read a code of 'width' bits. Return -1 if the bit stream runs dry first,
    // in which case the bits obtained are kept for the next call.
    private int readCode(InputBitStream ibs, int width) {
       final int count = width - this.pendingBits;
       final long before = ibs.read();
       final long bits = ibs.readBits(count);
       final int got = (int) (ibs.read() - before);

       if (got == 0)
          return -1;

       final long value = this.order.combine(this.pendingCode, this.pendingBits, bits, got);

       if (got < count) {
          this.pendingCode = value;
          this.pendingBits += got;
          return -1;
       }

       this.pendingCode = 0;
       this.pendingBits = 0;
       return (int) (value & ((1 << width) - 1));
    }


    // Add value(prefix)+suffix at nextCode and grow the code width when the
    // code space is full. Return null (no entry added) if the prefix has no
    // value or the dictionary is full.
    private byte[] extend(int prefix, byte suffix) {
       if ((this.nextCode >= MAX_CODES) || (this.table.contains(prefix) == false))
          return null;

       final byte[] value = this.table.add(this.nextCode, prefix, suffix);
       this.nextCode++;

       if ((this.nextCode == (1 << (this.codeSize+1))) && (this.codeSize+1 < MAX_CODE_SIZE)) {
          this.codeSize++;
          this.notifyListeners(Event.Type.CODE_WIDTH_CHANGE, this.nextCode, this.codeSize+1);
       }

       return value;
    }


    /**
     * Releases all dictionary entries. Any later call fails with an
     * {@code IllegalStateException}.
     */
    @Override
    public void dispose() {
       if (this.disposed == true)
          return;

       this.disposed = true;
       this.table.clear();
       this.listeners.clear();
    }


    private void checkOpen() {
       if (this.disposed == true)
          throw new IllegalStateException("Decoder disposed");
    }


    /**
     * Adds a listener to be notified of decoding events.
     *
     * @param bl The listener to add.
     * @return {@code true} if the listener was added successfully, {@code false} otherwise.
     */
    public boolean addListener(Listener bl) {
       return (bl != null) ? this.listeners.add(bl) : false;
    }


    /**
     * Removes a listener that was previously added.
     *
     * @param bl The listener to remove.
     * @return {@code true} if the listener was removed successfully, {@code false} otherwise.
     */
    public boolean removeListener(Listener bl) {
       return (bl != null) ? this.listeners.remove(bl) : false;
    }


    private void notifyListeners(Event.Type type, int code, long size) {
       if (this.listeners.isEmpty() == true)
          return;

       // Protect against concurrent modification of the list by a listener
       final Listener[] array = this.listeners.toArray(new Listener[this.listeners.size()]);
       final Event evt = new Event(type, code, size);

       for (Listener bl : array) {
          try {
             bl.processEvent(evt);
          }
          catch (Exception e) {
             // Ignore exceptions in listeners
          }
       }
    }


    /**
     * Returns a copy of the dictionary value of a code.
     *
     * @param code the code to look up
     * @return the bytes the code stands for, or null if the code is not
     *         in the dictionary (control codes never are)
     */
    public byte[] lookup(int code) {
       this.checkOpen();
       final byte[] value = this.table.get(code);
       return (value == null) ? null : Arrays.copyOf(value, value.length);
    }


    /**
     * Returns the number of codes in the dictionary, control codes excluded.
     *
     * @return root entries plus learned entries
     */
    public int getDictionarySize() {
       return this.table.size();
    }


    @Override
    public boolean isFinished() {
       return this.finished;
    }


    /**
     * Tells whether the last chunk ended in the middle of a code.
     *
     * @return true if some bits of the next code are pending
     */
    public boolean hasPendingCode() {
       return this.pendingBits > 0;
    }


    public int getPendingBits() {
       return this.pendingBits;
    }


    /**
     * Returns the number of bits used to read the next code.
     *
     * @return the current code width
     */
    public int getCodeWidth() {
       return this.codeSize + 1;
    }


    public int getCodeSize() {
       return this.codeSize;
    }


    public int getInitCodeSize() {
       return this.initCodeSize;
    }


    public int getClearCode() {
       return this.clearCode;
    }


    public int getEndInfoCode() {
       return this.endInfoCode;
    }


    public int getNextCode() {
       return this.nextCode;
    }


    /**
     * Returns the total number of bytes decoded since the start of the session.
     *
     * @return the number of bytes decoded
     */
    public long getDecoded() {
       return this.decoded;
    }


    @Override
    public BitOrder getBitOrder() {
       return this.order;
    }
}
