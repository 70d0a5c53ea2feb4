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
 * This final class defines constants for the error codes returned by the
 * command line tool and carried by {@code LZWIOException}.
 */
public final class Error {

    /**
     *  Missing parameter
     */
    public static final int ERR_MISSING_PARAM = 1;

    /**
     * Failure to create a decompressor
     */
    public static final int ERR_CREATE_DECOMPRESSOR = 5;

    /**
     * The output is a folder
     */
    public static final int ERR_OUTPUT_IS_DIR = 6;

    /**
     * Failure to overwrite a file
     */
    public static final int ERR_OVERWRITE_FILE = 7;

    /**
     * Failure to create a file
     */
    public static final int ERR_CREATE_FILE = 8;

    /**
     * Failure to open a file
     */
    public static final int ERR_OPEN_FILE = 10;

    /**
     * Failure to read a file
     */
    public static final int ERR_READ_FILE = 11;

    /**
     * Failure to write a file
     */
    public static final int ERR_WRITE_FILE = 12;

    /**
     *  Invalid code stream
     */
    public static final int ERR_INVALID_FILE = 15;

    /**
     * Invalid parameter
     */
    public static final int ERR_INVALID_PARAM = 18;

    /**
     *  Unknown error
     */
    public static final int ERR_UNKNOWN = 127;


    private Error() {
    }
}
