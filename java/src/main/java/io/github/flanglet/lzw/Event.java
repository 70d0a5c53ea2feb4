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
 * This class represents events that occur while decoding an LZW code stream.
 * Each event carries a type, a code, a size and a timestamp.
 * The meaning of code and size depends on the type (see {@link Type}).
 */
public class Event {

    /**
     * Enum representing the types of events that can occur.
     */
    public enum Type {
        /**
         * First decode call of a session. Size is the root code size.
         */
        DECOMPRESSION_START,

        /**
         * A clear code was read. Code is the clear code, size the number
         * of dictionary entries dropped.
         */
        CLEAR_CODE,

        /**
         * The read width grew. Code is the next free code, size the new width in bits.
         */
        CODE_WIDTH_CHANGE,

        /**
         * A code equal to the next free code arrived with no previous entry
         * to derive it from. It was skipped. Code is the offending code.
         */
        UNRESOLVED_CODE,

        /**
         * The input chunk ran out. Size is the number of bits of the pending
         * partial code (0 if the chunk ended on a code boundary).
         */
        INPUT_EXHAUSTED,

        /**
         * End of information code read. Size is the total number of bytes decoded.
         */
        DECOMPRESSION_END
    }

    private final int code;
    private final long size;
    private final Type type;
    private final long time;


    /**
     * Constructs an Event with the specified type, code, and size.
     *
     * @param type
     *            the type of event
     * @param code
     *            the LZW code the event relates to, or -1
     * @param size
     *            the size attached to the event
     */
    public Event(Type type, int code, long size) {
        this(type, code, size, 0);
    }

    /**
     * Constructs an Event with the specified type, code, size, and time.
     *
     * @param type
     *            the type of event
     * @param code
     *            the LZW code the event relates to, or -1
     * @param size
     *            the size attached to the event
     * @param time
     *            the event timestamp (nanoseconds), or 0 to use the current time
     */
    public Event(Type type, int code, long size, long time) {
        this.type = type;
        this.code = code;
        this.size = size;
        this.time = (time > 0) ? time : System.nanoTime();
    }

    /**
     * Returns the code attached to the event.
     *
     * @return the code, or -1
     */
    public int getCode() {
        return this.code;
    }

    /**
     * Returns the size attached to the event.
     *
     * @return the event size
     */
    public long getSize() {
        return this.size;
    }

    /**
     * Returns the timestamp of the event.
     *
     * @return the event timestamp
     */
    public long getTime() {
        return this.time;
    }

    /**
     * Returns the type of the event.
     *
     * @return the event type
     */
    public Type getType() {
        return this.type;
    }

    /**
     * Returns a string representation of the event.
     *
     * @return a string representation of the event
     */
    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder(100);
        sb.append("{ \"type\":\"").append(this.getType()).append("\"");

        if (this.code >= 0) {
            sb.append(", \"code\":").append(this.getCode());
        }

        sb.append(", \"size\":").append(this.getSize());
        sb.append(", \"time\":").append(this.getTime());
        sb.append(" }");
        return sb.toString();
    }
}
