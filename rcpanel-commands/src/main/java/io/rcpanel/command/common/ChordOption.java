/*
 * Copyright (c) nosqlbench
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package io.rcpanel.command.common;

import io.rcpanel.keys.KeySequence;
import picocli.CommandLine;

import java.util.ArrayList;
import java.util.List;

/**
 * Repeatable {@code --chord SRC=TGT} option adding chord bindings on top of the defaults.
 * Both sides are space separated key names, e.g. {@code --chord "g g=home"}.
 */
public class ChordOption {

    /**
     * One chord binding from the command line.
     *
     * @param source the keys to type
     * @param target the keys delivered instead
     */
    public record Chord(KeySequence source, KeySequence target) {

        public Chord {
            if (source == null || source.isEmpty()) {
                throw new IllegalArgumentException("Chord source must contain at least one key");
            }
            if (target == null) {
                throw new IllegalArgumentException("Chord target must not be null");
            }
        }

        @Override
        public String toString() {
            return source + "=" + target;
        }
    }

    /**
     * Picocli type converter for {@link Chord} specifications of the form {@code SRC=TGT}.
     * The first {@code =} separates the two sides.
     */
    public static class ChordConverter implements CommandLine.ITypeConverter<Chord> {

        @Override
        public Chord convert(String value) {
            if (value == null || value.trim().isEmpty()) {
                throw new IllegalArgumentException("Chord specification cannot be empty");
            }
            int separator = value.indexOf('=');
            if (separator < 0) {
                throw new IllegalArgumentException(
                    "Invalid chord format: " + value + ". Expected: SRC=TGT, e.g. \"g g=home\""
                );
            }
            String source = value.substring(0, separator);
            String target = value.substring(separator + 1);
            if (source.isBlank() || target.isBlank()) {
                throw new IllegalArgumentException(
                    "Invalid chord format: " + value + ". Both sides need at least one key"
                );
            }
            return new Chord(KeySequence.parse(source), KeySequence.parse(target));
        }
    }

    @CommandLine.Option(
        names = {"--chord"},
        paramLabel = "SRC=TGT",
        description = "Extra chord binding, keys separated by spaces (repeatable), e.g. --chord \"g g=home\"",
        converter = ChordConverter.class
    )
    private List<Chord> chords = new ArrayList<>();

    /**
     * Gets the chords given on the command line, in order.
     */
    public List<Chord> getChords() {
        return List.copyOf(chords);
    }
}
