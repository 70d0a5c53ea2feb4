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
 * Order in which the bits of each byte are consumed by an {@link InputBitStream}.
 * <p>
 * GIF packs codes least significant bit first, TIFF and PDF pack them
 * most significant bit first.
 * </p>
 */
public enum BitOrder {

    /**
     * Least significant bit first: the first bit read lands in bit 0 of the value.
     */
    LITTLE_ENDIAN {
        @Override
        public long combine(long head, int headBits, long tail, int tailBits) {
            return head | (tail << headBits);
        }
    },

    /**
     * Most significant bit first: the first bit read lands in the top bit of the value.
     */
    BIG_ENDIAN {
        @Override
        public long combine(long head, int headBits, long tail, int tailBits) {
            return (head << tailBits) | tail;
        }
    };


    /**
     * Joins two consecutive bit runs read from a stream in this order.
     *
     * @param head
     *            the bits read first, right aligned
     * @param headBits
     *            the number of bits in {@code head}
     * @param tail
     *            the bits read next, right aligned
     * @param tailBits
     *            the number of bits in {@code tail}
     * @return the value a single read of {@code headBits+tailBits} bits would have returned
     */
    public abstract long combine(long head, int headBits, long tail, int tailBits);


    /**
     * Parses a bit order name as given on the command line.
     *
     * @param name
     *            "little", "le", "lsb", "big", "be" or "msb" (case insensitive),
     *            or the enum constant name
     * @return the matching bit order
     * @throws IllegalArgumentException
     *             if the name is unknown
     */
    public static BitOrder getOrder(String name) {
        if (name == null)
            throw new NullPointerException("Invalid null bit order name");

        switch (name.trim().toUpperCase()) {
            case "LITTLE":
            case "LE":
            case "LSB":
            case "LITTLE_ENDIAN":
                return LITTLE_ENDIAN;

            case "BIG":
            case "BE":
            case "MSB":
            case "BIG_ENDIAN":
                return BIG_ENDIAN;

            default:
                throw new IllegalArgumentException("Unknown bit order: " + name);
        }
    }
}
