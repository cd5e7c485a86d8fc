package com.gridcalc.app.util;

import com.gridcalc.app.exceptions.InvalidIndexException;
import com.gridcalc.app.exceptions.InvalidLabelException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.assertj.core.api.Assertions.*;

class ColumnLabelsTest {

    // ===== labelToIndex =====

    @ParameterizedTest
    @CsvSource({
        "A, 1",
        "Z, 26",
        "AA, 27",
        "AB, 28",
        "AZ, 52",
        "BA, 53",
        "ZZ, 702",
        "AAA, 703",
        "aA, 27",
        "zz, 702"
    })
    void labelToIndex_validLabels(String label, int expected) {
        assertThat(ColumnLabels.labelToIndex(label)).isEqualTo(expected);
    }

    @Test
    void labelToIndex_empty_returnsZero() {
        assertThat(ColumnLabels.labelToIndex("")).isZero();
    }

    @Test
    void labelToIndex_invalidChars_throws() {
        assertThatThrownBy(() -> ColumnLabels.labelToIndex("A1"))
                .isInstanceOf(InvalidLabelException.class)
                .hasMessageContaining("A1");
        assertThatThrownBy(() -> ColumnLabels.labelToIndex("@"))
                .isInstanceOf(InvalidLabelException.class);
        assertThatThrownBy(() -> ColumnLabels.labelToIndex("A B"))
                .isInstanceOf(InvalidLabelException.class);
        assertThatThrownBy(() -> ColumnLabels.labelToIndex("Ä"))
                .isInstanceOf(InvalidLabelException.class);
    }

    @Test
    void labelToIndex_null_throws() {
        assertThatThrownBy(() -> ColumnLabels.labelToIndex(null))
                .isInstanceOf(InvalidLabelException.class);
    }

    @Test
    void labelToIndex_tooLong_throws() {
        assertThatThrownBy(() -> ColumnLabels.labelToIndex("ZZZZZZZZZZ"))
                .isInstanceOf(InvalidLabelException.class);
    }

    // ===== indexToLabel =====

    @ParameterizedTest
    @CsvSource({
        "1, A",
        "26, Z",
        "27, AA",
        "52, AZ",
        "53, BA",
        "702, ZZ",
        "703, AAA"
    })
    void indexToLabel_validIndices(int index, String expected) {
        assertThat(ColumnLabels.indexToLabel(index)).isEqualTo(expected);
    }

    @Test
    void indexToLabel_zero_returnsEmpty() {
        assertThat(ColumnLabels.indexToLabel(0)).isEmpty();
    }

    @Test
    void indexToLabel_negativeIndex_throws() {
        assertThatThrownBy(() -> ColumnLabels.indexToLabel(-1))
                .isInstanceOf(InvalidIndexException.class)
                .hasMessageContaining("-1");
    }

    // ===== round trips =====

    @Test
    void indexToLabel_labelToIndex_roundTrip() {
        for (int i = 1; i <= 20_000; i++) {
            String label = ColumnLabels.indexToLabel(i);
            assertThat(ColumnLabels.labelToIndex(label)).isEqualTo(i);
        }
    }

    @Test
    void labelToIndex_indexToLabel_roundTrip() {
        for (String label : new String[]{"A", "M", "Z", "AA", "QX", "ZY", "ABC", "XFD"}) {
            assertThat(ColumnLabels.indexToLabel(ColumnLabels.labelToIndex(label))).isEqualTo(label);
        }
    }

    @Test
    void lowercaseLabel_normalizesToUppercase() {
        assertThat(ColumnLabels.indexToLabel(ColumnLabels.labelToIndex("xfd"))).isEqualTo("XFD");
    }
}
