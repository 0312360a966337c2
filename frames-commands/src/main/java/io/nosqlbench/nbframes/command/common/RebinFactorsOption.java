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
import picocli.CommandLine;

/**
 * Shared block shape options.
 * Either {@code --rebin} with a combined block shape, or the separate
 * {@code --rebin-channel} and {@code --rebin-time} factors, which both default to 2.
 */
public class RebinFactorsOption {

    /** Factor used for a dimension that is not given on the command line. */
    public static final int DEFAULT_FACTOR = 2;

    /**
     * Picocli type converter for {@link RebinFactors}.
     * Supports formats: {@code n} (n channels by n ticks), {@code CxT} and {@code C,T}.
     */
    public static class RebinFactorsConverter implements CommandLine.ITypeConverter<RebinFactors> {

        @Override
        public RebinFactors convert(String value) {
            if (value == null || value.trim().isEmpty()) {
                throw new IllegalArgumentException("Rebin block shape cannot be empty");
            }
            String trimmed = value.trim().toLowerCase();
            String[] parts = trimmed.split("[x,]");
            try {
                if (parts.length == 1) {
                    return RebinFactors.of(Integer.parseInt(parts[0].trim()));
                }
                if (parts.length == 2) {
                    return new RebinFactors(
                        Integer.parseInt(parts[0].trim()),
                        Integer.parseInt(parts[1].trim())
                    );
                }
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException(
                    "Invalid rebin format: " + value + ". Could not parse numbers: " + e.getMessage()
                );
            }
            throw new IllegalArgumentException(
                "Invalid rebin format: " + value + ". Expected: n, CxT or C,T"
            );
        }
    }

    @CommandLine.Option(
        names = {"-r", "--rebin"},
        description = "Block shape as channels x ticks. Formats: 'n', 'CxT', 'C,T'",
        converter = RebinFactorsConverter.class
    )
    private RebinFactors rebin;

    @CommandLine.Option(
        names = {"--rebin-channel"},
        description = "Number of adjacent channels summed into one output row (default: "
            + DEFAULT_FACTOR + ")"
    )
    private Integer channelFactor;

    @CommandLine.Option(
        names = {"--rebin-time"},
        description = "Number of adjacent ticks summed into one output column (default: "
            + DEFAULT_FACTOR + ")"
    )
    private Integer tickFactor;

    /**
     * Gets the block shape from whichever options were given.
     *
     * @return the rebin factors
     * @throws IllegalArgumentException if a factor is not positive
     */
    public RebinFactors getFactors() {
        if (rebin != null) {
            return rebin;
        }
        return new RebinFactors(
            channelFactor != null ? channelFactor : DEFAULT_FACTOR,
            tickFactor != null ? tickFactor : DEFAULT_FACTOR
        );
    }

    /**
     * Validates that the combined and separate forms are not mixed.
     *
     * @throws IllegalStateException if both forms are given
     */
    public void validate() {
        if (rebin != null && (channelFactor != null || tickFactor != null)) {
            throw new IllegalStateException(
                "Use either --rebin or --rebin-channel/--rebin-time, not both"
            );
        }
        getFactors();
    }

    @Override
    public String toString() {
        return getFactors().toString();
    }
}
