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

import java.util.Arrays;


/**
 * LZW dictionary: maps each code to the byte sequence it stands for.
 * <p>
 * Entries live in slots indexed by code. Every entry is its own array,
 * never shared with another slot, so that the whole table can be dropped
 * at once on reset.
 * </p>
 */
public final class CodeTable {
    private byte[][] entries;
    private int count;


    /**
     * Creates an empty table.
     *
     * @param capacity the number of codes the table can hold
     */
    public CodeTable(int capacity) {
       if (capacity < 1)
          throw new IllegalArgumentException("Invalid capacity: "+capacity+" (must be at least 1)");

       this.entries = new byte[capacity][];
    }


    /**
     * Drops every entry, then maps each code in [0..2^rootBits-1] to the
     * single byte equal to its low byte.
     *
     * @param rootBits the number of bits of the root codes
     */
    public void reset(int rootBits) {
       if ((rootBits < 0) || (rootBits > 30) || ((1 << rootBits) > this.capacity()))
          throw new IllegalArgumentException("Invalid root size: "+rootBits+" bits");

       final int roots = 1 << rootBits;

       this.clear();

       for (int i=0; i<roots; i++)
          this.entries[i] = new byte[] { (byte) i };

       this.count = roots;
    }


    /**
     * Drops every entry.
     */
    public void clear() {
       Arrays.fill(this.entries, null);
       this.count = 0;
    }


    /**
     * Returns the value of a code. The returned array belongs to the table
     * and must not be modified.
     *
     * @param code the code to look up
     * @return the byte sequence for the code, or null if there is none
     */
    public byte[] get(int code) {
       if ((code < 0) || (code >= this.entries.length))
          return null;

       return this.entries[code];
    }


    public boolean contains(int code) {
       return this.get(code) != null;
    }


    /**
     * Stores a new entry made of the value of {@code prefixCode} followed
     * by {@code suffix}. The slot is only written once the copy is complete.
     *
     * @param code the free slot to fill
     * @param prefixCode a code present in the table
     * @param suffix the byte to append
     * @return the new entry
     */
    public byte[] add(int code, int prefixCode, byte suffix) {
       if ((code < 0) || (code >= this.entries.length))
          throw new IllegalArgumentException("Invalid code: "+code+" (must be in [0.."+(this.entries.length-1)+"])");

       if (this.entries[code] != null)
          throw new IllegalStateException("Code "+code+" is already defined");

       final byte[] prefix = this.get(prefixCode);

       if (prefix == null)
          throw new IllegalArgumentException("Undefined prefix code: "+prefixCode);

       final byte[] value = Arrays.copyOf(prefix, prefix.length+1);
       value[prefix.length] = suffix;
       this.entries[code] = value;
       this.count++;
       return value;
    }


    /**
     * Returns the number of defined entries.
     *
     * @return the number of entries
     */
    public int size() {
       return this.count;
    }


    public int capacity() {
       return this.entries.length;
    }
}
