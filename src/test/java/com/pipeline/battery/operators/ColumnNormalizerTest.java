package com.pipeline.battery.operators;

import com.pipeline.battery.model.RowFrame;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.pipeline.battery.TestFrames.frame;
import static com.pipeline.battery.TestFrames.row;
import static org.assertj.core.api.Assertions.assertThat;

@Tag("unit")
class ColumnNormalizerTest {

    private final ColumnNormalizer normalizer = new ColumnNormalizer();

    @Test
    void bilingualHeadersAreCopiedToCanonicalColumns() {
        RowFrame raw = frame(List.of("工步", "工步執行時間(秒)", "電壓(V)", "電流(A)", "Aux T1", "電量(Ah)", "能量(Wh)"),
                row("1", "0", "3.7", "1.0", "24.5", "0.0", "0.0"));

        RowFrame normalized = normalizer.normalize(raw);

        assertThat(normalized.getColumns()).contains(
                "step_number", "execution_time", "voltage", "current", "temperature", "capacity", "energy");
        assertThat(normalized.getValue(0, "voltage")).isEqualTo("3.7");
        assertThat(normalized.getValue(0, "temperature")).isEqualTo("24.5");
        // 原始列保留
        assertThat(normalized.hasColumn("電壓(V)")).isTrue();
    }

    @Test
    void englishAndInstrumentHeadersAreRecognised() {
        RowFrame english = normalizer.normalize(frame(List.of("Step_Index", "Step_Time", "Date_Time", "Voltage"),
                row("2", "5", "2024-03-01 08:00:00", "3.6")));
        RowFrame instrument = normalizer.normalize(frame(List.of("Step Index", "DateTime [s]", "Voltage [V]", "Aux T1 [oC]"),
                row("2", "1709280000", "3.6", "25")));

        assertThat(english.getValue(0, "step_number")).isEqualTo("2");
        assertThat(english.getValue(0, "execution_time")).isEqualTo("5");
        assertThat(english.getValue(0, "timestamp")).isEqualTo("2024-03-01 08:00:00");
        assertThat(instrument.getValue(0, "voltage")).isEqualTo("3.6");
        assertThat(instrument.getValue(0, "temperature")).isEqualTo("25");
    }

    @Test
    void existingCanonicalColumnIsNeverOverwritten() {
        RowFrame raw = frame(List.of("voltage", "Voltage"), row("1.111", "9.999"));

        RowFrame normalized = normalizer.normalize(raw);

        assertThat(normalized.getValue(0, "voltage")).isEqualTo("1.111");
    }

    @Test
    void firstAlternateInTableOrderWins() {
        RowFrame raw = frame(List.of("電壓(V)", "Voltage"), row("3.3", "4.4"));

        RowFrame normalized = normalizer.normalize(raw);

        assertThat(normalized.getValue(0, "voltage")).isEqualTo("4.4");
    }

    @Test
    void unknownHeadersPassThroughAndInputIsUntouched() {
        RowFrame raw = frame(List.of("Custom", "工步"), row("x", "1"));

        RowFrame normalized = normalizer.normalize(raw);

        assertThat(normalized.getValue(0, "Custom")).isEqualTo("x");
        assertThat(raw.hasColumn("step_number")).isFalse();
    }

    @Test
    void canonicalOfResolvesAliasesAndCanonicalNames() {
        assertThat(normalizer.canonicalOf("Step_Index")).isEqualTo("step_number");
        assertThat(normalizer.canonicalOf("工步")).isEqualTo("step_number");
        assertThat(normalizer.canonicalOf("step_number")).isEqualTo("step_number");
        assertThat(normalizer.canonicalOf("Date_Time")).isEqualTo("timestamp");
        assertThat(normalizer.canonicalOf("whatever")).isNull();
    }
}
