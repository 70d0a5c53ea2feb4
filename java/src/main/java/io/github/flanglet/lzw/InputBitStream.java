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

package io.github.flanglet.lzw;

/**
 * The {@code InputBitStream} interface defines methods for reading bits from a
 * bit stream in a fixed {@link BitOrder}.
 * <p>
 * Multi-bit reads are tolerant of the end of the input: they return whatever
 * bits are left. Callers compare {@link #read()} before and after the call to
 * learn how many bits were actually obtained.
 * </p>
 */
public interface InputBitStream {

    /**
     * Reads a single bit from the bitstream.
     *
     * @return the bit read (0 or 1)
     * @throws BitStreamException
     *             if no bit is left, if an error occurs or the stream is closed
     */
    public int readBit() throws BitStreamException;

    /**
     * Reads up to {@code count} bits from the bitstream and returns them as a
     * long, right aligned. If the input ends first, the bits obtained so far are
     * returned (possibly none, in which case the value is 0).
     *
     * @param count
     *            the number of bits to read (between 1 and 56)
     * @return the bits read as a long
     * @throws BitStreamException
     *             if an error occurs or the stream is closed
     */
    public long readBits(int count) throws BitStreamException;

    /**
     * Closes the bitstream. The underlying byte source is not closed.
     *
     * @throws BitStreamException
     *             if an error occurs while closing the stream
     */
    public void close() throws BitStreamException;

    /**
     * Returns the total number of bits read from the bitstream.
     *
     * @return the total number of bits read
     */
    public long read();

    /**
     * Checks if there are more bits to read in the bitstream.
     *
     * @return {@code false} if the bitstream is closed or the end of the stream has
     *         been reached, {@code true} otherwise
     */
    public boolean hasMoreToRead();

    /**
     * Returns the order in which bits are extracted from each byte.
     *
     * @return the bit order
     */
    public BitOrder getBitOrder();
}
