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

import java.io.OutputStream;


/**
 * An output stream that discards all data written to it. Used when the
 * decompressed data only needs to be checked, not stored.
 */
public class NullOutputStream extends OutputStream {

    @Override
    public void write(int b) {
        // Discard
    }

    @Override
    public void write(byte[] b, int offs, int len) {
        // Discard
    }
}
