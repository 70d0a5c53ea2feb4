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
 * This interface defines a resumable decoder fed with successive chunks
 * of a compressed bit stream.
 */
public interface StreamDecoder {

    /**
     * Decodes as much as possible from the provided bit stream. If the stream
     * runs out in the middle of a code, the bits already read are kept and
     * completed by the next call.
     *
     * @param ibs
     *            the bit stream holding the next chunk of compressed data,
     *            borrowed for the duration of the call
     * @return the bytes decoded during this call (possibly empty)
     * @throws BitStreamException
     *             if the code stream is malformed or the bit stream fails
     */
    public byte[] decode(InputBitStream ibs) throws BitStreamException;

    /**
     * Tells whether the end of the compressed stream has been reached.
     *
     * @return true once the end marker has been decoded
     */
    public boolean isFinished();

    /**
     * Returns the bit order expected from the bit streams passed to
     * {@link #decode(InputBitStream)}.
     *
     * @return the bit order
     */
    public BitOrder getBitOrder();

    /**
     * Brings the decoder back to its initial state, ready for a new stream.
     */
    public void reset();

    /**
     * Releases the resources held by this decoder. The decoder cannot be
     * used afterwards.
     */
    public void dispose();
}
