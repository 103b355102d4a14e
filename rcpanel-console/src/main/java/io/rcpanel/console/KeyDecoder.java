/*
 * Copyright DataStax, Inc.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package io.rcpanel.console;

import org.jline.utils.NonBlockingReader;

import java.io.IOException;

/**
 * Turns raw terminal input into key names: printable characters map to themselves, and
 * special keys to names such as {@code "enter"}, {@code "space"}, {@code "up"} or
 * {@code "ctrl-c"}. Escape sequences are completed with short follow-up reads.
 */
public final class KeyDecoder {

    static final int ESC = 27;
    private static final long SEQUENCE_TIMEOUT_MS = 10;

    private KeyDecoder() {
    }

    /**
     * @param c      the first character read
     * @param reader the source of any follow-up characters
     * @return the key name, or null for an unrecognized escape sequence
     * @throws IOException if a follow-up read fails
     */
    public static String decode(int c, NonBlockingReader reader) throws IOException {
        switch (c) {
            case '\r':
            case '\n':
                return "enter";
            case ' ':
                return "space";
            case '\t':
                return "tab";
            case 8:
            case 127:
                return "backspace";
            case ESC:
                return decodeEscape(reader);
            default:
                break;
        }
        if (c < 32) {
            return "ctrl-" + (char) (c + 96);
        }
        return String.valueOf((char) c);
    }

    private static String decodeEscape(NonBlockingReader reader) throws IOException {
        int next = reader.read(SEQUENCE_TIMEOUT_MS);
        if (next == NonBlockingReader.READ_EXPIRED || next == NonBlockingReader.EOF) {
            return "escape";
        }
        if (next != '[' && next != 'O') {
            return null;
        }
        int key = reader.read(SEQUENCE_TIMEOUT_MS);
        switch (key) {
            case 'A':
                return "up";
            case 'B':
                return "down";
            case 'C':
                return "right";
            case 'D':
                return "left";
            case 'H':
                return "home";
            case 'F':
                return "end";
            case '5':
                return reader.read(SEQUENCE_TIMEOUT_MS) == '~' ? "pageup" : null;
            case '6':
                return reader.read(SEQUENCE_TIMEOUT_MS) == '~' ? "pagedown" : null;
            default:
                return null;
        }
    }
}
