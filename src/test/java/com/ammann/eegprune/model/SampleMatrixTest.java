/* (C)2026 */
package com.ammann.eegprune.model;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.ammann.eegprune.exception.ValidationException;
import org.junit.jupiter.api.Test;

class SampleMatrixTest {

    @Test
    void invalidColumnWhenAnyChannelIsNaN() {
        SampleMatrix matrix = new SampleMatrix(new double[][] {{1, 2, 3}, {1, Double.NaN, 3}});

        assertThat(matrix.isInvalidColumn(1)).isFalse();
        assertThat(matrix.isInvalidColumn(2)).isTrue();
    }

    @Test
    void copiesInputDefensively() {
        double[][] data = {{1, 2, 3}};
        SampleMatrix matrix = new SampleMatrix(data);
        data[0][0] = 99;

        assertThat(matrix.value(0, 1)).isEqualTo(1.0);
        matrix.toArray()[0][1] = 99;
        assertThat(matrix.value(0, 2)).isEqualTo(2.0);
    }

    @Test
    void rejectsRaggedChannels() {
        assertThatThrownBy(() -> new SampleMatrix(new double[][] {{1, 2}, {1}}))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("channel 2");
    }

    @Test
    void rejectsMissingChannels() {
        assertThatThrownBy(() -> new SampleMatrix(new double[0][]))
                .isInstanceOf(ValidationException.class);
    }

    @Test
    void retainColumnsKeepsFlaggedColumnsInOrder() {
        SampleMatrix matrix = new SampleMatrix(new double[][] {{1, 2, 3, 4}, {5, 6, 7, 8}});

        SampleMatrix pruned = matrix.retainColumns(new boolean[] {true, false, true, true}, 3);

        assertThat(pruned.sampleCount()).isEqualTo(3);
        assertThat(pruned.toArray()[0]).containsExactly(1.0, 3.0, 4.0);
        assertThat(pruned.toArray()[1]).containsExactly(5.0, 7.0, 8.0);
    }
}
