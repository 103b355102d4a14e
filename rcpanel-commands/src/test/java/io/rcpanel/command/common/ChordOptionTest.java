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
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import picocli.CommandLine;

import static org.assertj.core.api.Assertions.*;

@DisplayName("ChordOption")
class ChordOptionTest {

    @CommandLine.Command(name = "test")
    static class TestCommand {
        @CommandLine.Mixin
        ChordOption chordOption = new ChordOption();
    }

    @Nested
    @DisplayName("Chord Record")
    class ChordRecordTest {

        @Test
        @DisplayName("should reject an empty source")
        void shouldRejectEmptySource() {
            assertThatThrownBy(() -> new ChordOption.Chord(KeySequence.EMPTY, KeySequence.of("q")))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("at least one key");
        }

        @Test
        @DisplayName("should print as SRC=TGT")
        void shouldPrintAsSpec() {
            ChordOption.Chord chord = new ChordOption.Chord(KeySequence.of("g", "g"), KeySequence.of("home"));
            assertThat(chord).hasToString("g g=home");
        }
    }

    @Nested
    @DisplayName("ChordConverter")
    class ChordConverterTest {

        private final ChordOption.ChordConverter converter = new ChordOption.ChordConverter();

        @Test
        @DisplayName("should split keys on spaces")
        void shouldSplitKeys() {
            ChordOption.Chord chord = converter.convert("g g=home");

            assertThat(chord.source()).isEqualTo(KeySequence.of("g", "g"));
            assertThat(chord.target()).isEqualTo(KeySequence.of("home"));
        }

        @Test
        @DisplayName("should allow a multi-key target")
        void shouldAllowMultiKeyTarget() {
            ChordOption.Chord chord = converter.convert("x=: q enter");

            assertThat(chord.source()).isEqualTo(KeySequence.of("x"));
            assertThat(chord.target()).isEqualTo(KeySequence.of(":", "q", "enter"));
        }

        @ParameterizedTest
        @ValueSource(strings = {"", "   ", "gg", "=q", "g g=", " = "})
        @DisplayName("should reject malformed specifications")
        void shouldRejectMalformed(String spec) {
            assertThatThrownBy(() -> converter.convert(spec))
                .isInstanceOf(IllegalArgumentException.class);
        }
    }

    @Nested
    @DisplayName("Picocli Integration")
    class PicocliIntegrationTest {

        @Test
        @DisplayName("should collect repeated chords in order")
        void shouldCollectRepeatedChords() {
            TestCommand cmd = new TestCommand();
            new CommandLine(cmd).parseArgs("--chord", "a a=enter", "--chord", "g g=home");

            assertThat(cmd.chordOption.getChords())
                .extracting(ChordOption.Chord::toString)
                .containsExactly("a a=enter", "g g=home");
        }

        @Test
        @DisplayName("should have no chords when the option is absent")
        void shouldDefaultToNoChords() {
            TestCommand cmd = new TestCommand();
            new CommandLine(cmd).parseArgs();

            assertThat(cmd.chordOption.getChords()).isEmpty();
        }

        @Test
        @DisplayName("should fail parsing for an invalid chord")
        void shouldFailForInvalidChord() {
            TestCommand cmd = new TestCommand();

            assertThatThrownBy(() -> new CommandLine(cmd).parseArgs("--chord", "nope"))
                .isInstanceOf(CommandLine.ParameterException.class);
        }
    }
}
