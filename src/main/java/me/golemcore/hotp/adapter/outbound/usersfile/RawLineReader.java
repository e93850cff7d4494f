/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

package me.golemcore.hotp.adapter.outbound.usersfile;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;

/**
 * Reads lines while keeping their terminators, unlike
 * {@link BufferedReader#readLine()}. A line ends after {@code '\n'}; a final
 * line without one is returned as is. Never closes the underlying reader.
 */
class RawLineReader {

    private final BufferedReader reader;
    private final StringBuilder buffer = new StringBuilder(128);

    RawLineReader(Reader reader) {
        this.reader = reader instanceof BufferedReader ? (BufferedReader) reader : new BufferedReader(reader);
    }

    /**
     * @return the next line including its terminator, or {@code null} at end of
     *         input
     */
    String nextLine() throws IOException {
        buffer.setLength(0);
        int ch;
        while ((ch = reader.read()) != -1) {
            buffer.append((char) ch);
            if (ch == '\n') {
                break;
            }
        }
        return buffer.length() == 0 ? null : buffer.toString();
    }
}
