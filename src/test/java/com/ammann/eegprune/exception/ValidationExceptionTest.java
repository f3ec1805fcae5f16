/* (C)2026 */
package com.ammann.eegprune.exception;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class ValidationExceptionTest {

    @Test
    void sizeMismatchNamesFieldAndCounts() {
        ValidationException e = ValidationException.sizeMismatch("timestampsMillis", 1000, 999);

        assertThat(e).isInstanceOf(PruningException.class);
        assertThat(e.getMessage())
                .isEqualTo("Size mismatch for timestampsMillis: expected 1000, but got 999");
    }

    @Test
    void invalidParameterNamesExpectation() {
        ValidationException e =
                ValidationException.invalidParameter("bufferSamples", -2, "non-negative integer");

        assertThat(e.getMessage())
                .isEqualTo("Invalid parameter 'bufferSamples': got '-2', expected non-negative integer");
    }

    @Test
    void spanExceptionsKeepBounds() {
        InvalidSpanException e = InvalidSpanException.beforeFirstSample(0, 4);

        assertThat(e.getStart()).isZero();
        assertThat(e.getEnd()).isEqualTo(4);
        assertThat(e.getMessage()).contains("[0, 4]");
    }
}
