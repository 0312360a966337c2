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

package io.nosqlbench.nbframes.command.common;

import io.nosqlbench.nbframes.reduce.RebinFactors;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;
import picocli.CommandLine;

import static org.assertj.core.api.Assertions.*;

@DisplayName("RebinFactorsOption")
class RebinFactorsOptionTest {

    @CommandLine.Command(name = "test")
    static class TestCommand implements Runnable {
        @CommandLine.Mixin
        RebinFactorsOption rebin = new RebinFactorsOption();

        @Override
        public void run() {
        }
    }

    private static RebinFactorsOption parse(String... args) {
        TestCommand command = new TestCommand();
        new CommandLine(command).parseArgs(args);
        return command.rebin;
    }

    @Nested
    @DisplayName("Converter")
    class ConverterTest {

        private final RebinFactorsOption.RebinFactorsConverter converter =
            new RebinFactorsOption.RebinFactorsConverter();

        @ParameterizedTest
        @CsvSource({
            "2, 2, 2",
            "2x4, 2, 4",
            "3X1, 3, 1",
            "'4,8', 4, 8",
            "' 5 x 6 ', 5, 6"
        })
        @DisplayName("should parse supported formats")
        void shouldParseFormats(String input, int channels, int ticks) {
            assertThat(converter.convert(input)).isEqualTo(new RebinFactors(channels, ticks));
        }

        @ParameterizedTest
        @ValueSource(strings = {"", "  ", "x", "2x3x4", "2,y", "two", "0", "2x-1"})
        @DisplayName("should reject malformed or non-positive factors")
        void shouldRejectInvalid(String input) {
            assertThatThrownBy(() -> converter.convert(input))
                .isInstanceOf(IllegalArgumentException.class);
        }
    }

    @Nested
    @DisplayName("Option parsing")
    class OptionParsingTest {

        @Test
        @DisplayName("should default to 2x2")
        void shouldDefault() {
            assertThat(parse().getFactors()).isEqualTo(new RebinFactors(2, 2));
        }

        @Test
        @DisplayName("should combine separate factors with defaults")
        void shouldUseSeparateFactors() {
            assertThat(parse("--rebin-time", "5").getFactors()).isEqualTo(new RebinFactors(2, 5));
            assertThat(parse("--rebin-channel", "3", "--rebin-time", "1").getFactors())
                .isEqualTo(new RebinFactors(3, 1));
        }

        @Test
        @DisplayName("should accept the combined form")
        void shouldUseCombinedForm() {
            RebinFactorsOption option = parse("-r", "4x2");
            option.validate();
            assertThat(option.getFactors()).isEqualTo(new RebinFactors(4, 2));
        }

        @Test
        @DisplayName("should reject mixing both forms")
        void shouldRejectMixedForms() {
            assertThatThrownBy(() -> parse("--rebin", "4", "--rebin-time", "2").validate())
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("not both");
        }

        @Test
        @DisplayName("should report conversion failures as parameter errors")
        void shouldReportConversionFailures() {
            assertThatThrownBy(() -> parse("--rebin", "2x3x4"))
                .isInstanceOf(CommandLine.ParameterException.class);
        }
    }
}
