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


/**
 * I/O exception raised by the LZW streams. It carries one of the
 * {@link io.github.flanglet.lzw.Error} codes.
 */
public class LZWIOException extends java.io.IOException {
    private static final long serialVersionUID = 3378420925162085870L;

    private final int code;

    /**
     * Constructs a new {@code LZWIOException} with the specified detail message
     * and error code.
     *
     * @param msg the detail message explaining the reason for the exception
     * @param code an integer error code that provides additional context about the error
     */
    public LZWIOException(String msg, int code) {
        super(msg);
        this.code = code;
    }

    /**
     * Constructs a new {@code LZWIOException} with the specified detail message,
     * cause and error code.
     *
     * @param msg the detail message explaining the reason for the exception
     * @param cause the underlying failure
     * @param code an integer error code that provides additional context about the error
     */
    public LZWIOException(String msg, Throwable cause, int code) {
        super(msg, cause);
        this.code = code;
    }

    /**
     * Returns the error code associated with this exception.
     *
     * @return the error code indicating the type of I/O error
     */
    public int getErrorCode() {
        return this.code;
    }
}
