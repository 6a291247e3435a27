package com.pipeline.battery.reader;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
class CellValuesTest {

    @Test
    void stepNumberAcceptsIntegralFloatNotation() {
        assertThat(CellValues.parseStepNumber("2")).isEqualTo(2);
        assertThat(CellValues.parseStepNumber(" 2.0 ")).isEqualTo(2);
        assertThat(CellValues.parseStepNumber("")).isNull();
    }

    @Test
    void stepNumberRejectsFractionsAndText() {
        assertThatThrownBy(() -> CellValues.parseStepNumber("2.5")).isInstanceOf(NumberFormatException.class);
        assertThatThrownBy(() -> CellValues.parseStepNumber("abc")).isInstanceOf(NumberFormatException.class);
    }

    @Test
    void blankNumbersAreMissingAndTextIsAnError() {
        assertThat(CellValues.parseDouble("  ")).isNull();
        assertThat(CellValues.tryParseDouble("n/a")).isNull();
        assertThatThrownBy(() -> CellValues.parseDouble("n/a")).isInstanceOf(NumberFormatException.class);
        assertThatThrownBy(() -> CellValues.parseDouble("NaN")).isInstanceOf(NumberFormatException.class);
    }

    @Test
    void dateTimeFormatsAreRecognised() {
        LocalDateTime expected = LocalDateTime.of(2024, 3, 1, 8, 0, 5);
        assertThat(CellValues.parseDateTime("2024-03-01 08:00:05")).isEqualTo(expected);
        assertThat(CellValues.parseDateTime("2024/03/01 08:00:05")).isEqualTo(expected);
        assertThat(CellValues.parseDateTime("2024-03-01T08:00:05")).isEqualTo(expected);
        assertThat(CellValues.parseDateTime("not a time")).isNull();
        assertThat(CellValues.parseDateTime(null)).isNull();
    }

    @Test
    void epochSecondsAreRecognised() {
        assertThat(CellValues.parseDateTime("1709280005")).isNotNull();
    }

    @Test
    void roundingIsHalfUp() {
        assertThat(CellValues.round(3.14159, 3)).isEqualTo(3.142);
        assertThat(CellValues.round(25.05, 1)).isEqualTo(25.1);
        assertThat(CellValues.round((Double) null, 1)).isNull();
    }
}
