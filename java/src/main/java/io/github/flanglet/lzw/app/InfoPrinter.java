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

package io.github.flanglet.lzw.app;

import java.io.PrintStream;
import io.github.flanglet.lzw.Event;
import io.github.flanglet.lzw.Listener;


/**
 * Listener printing decoding events to a {@code PrintStream}.
 * <p>
 * Level 3 prints the start and end of decoding, level 4 adds dictionary
 * clears and skipped codes, level 5 prints every event.
 * </p>
 */
public class InfoPrinter implements Listener {
    private final PrintStream ps;
    private final int level;
    private long startTime;
    private int clears;
    private int widthChanges;
    private int unresolved;


    /**
     * Constructs an {@code InfoPrinter} with the specified information level
     * and output stream.
     *
     * @param infoLevel
     *            the level of information to be printed
     * @param ps
     *            the {@code PrintStream} to which information will be printed
     */
    public InfoPrinter(int infoLevel, PrintStream ps) {
        if (ps == null)
            throw new NullPointerException("Invalid null print stream parameter");

        this.ps = ps;
        this.level = infoLevel;
    }


    @Override
    public void processEvent(Event evt) {
        switch (evt.getType()) {
            case DECOMPRESSION_START:
                this.startTime = evt.getTime();
                this.clears = 0;
                this.widthChanges = 0;
                this.unresolved = 0;

                if (this.level >= 3)
                    this.ps.println("Root code size: " + evt.getSize() + " bits");

                break;

            case CLEAR_CODE:
                this.clears++;

                if (this.level >= 5)
                    this.ps.println(evt);
                else if (this.level >= 4)
                    this.ps.println(String.format("Clear code: %d entries dropped", evt.getSize()));

                break;

            case CODE_WIDTH_CHANGE:
                this.widthChanges++;

                if (this.level >= 5)
                    this.ps.println(evt);

                break;

            case UNRESOLVED_CODE:
                this.unresolved++;

                if (this.level >= 4)
                    this.ps.println(String.format("Warning: skipped code %d (no previous entry)", evt.getCode()));

                break;

            case DECOMPRESSION_END:
                if (this.level >= 5)
                    this.ps.println(evt);

                if (this.level >= 3) {
                    long duration_ms = (evt.getTime() - this.startTime) / 1000000L;
                    this.ps.println(String.format("Decoded %d bytes [%d ms], %d clear code(s), %d width change(s)",
                            evt.getSize(), duration_ms, this.clears, this.widthChanges));

                    if (this.unresolved > 0)
                        this.ps.println(String.format("%d code(s) skipped", this.unresolved));
                }

                break;

            default:
                if (this.level >= 5)
                    this.ps.println(evt);
        }
    }
}
