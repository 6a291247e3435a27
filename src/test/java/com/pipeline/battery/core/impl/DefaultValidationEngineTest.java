package com.pipeline.battery.core.impl;

import com.pipeline.battery.model.RowFrame;
import com.pipeline.battery.model.ValidationReport;
import com.pipeline.battery.operators.ColumnNormalizer;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static com.pipeline.battery.TestFrames.frame;
import static com.pipeline.battery.TestFrames.row;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.InstanceOfAssertFactories.LIST;
import static org.assertj.core.api.Assertions.offset;

@Tag("unit")
class DefaultValidationEngineTest {

    private final ColumnNormalizer normalizer = new ColumnNormalizer();
    private final DefaultValidationEngine engine = new DefaultValidationEngine(
            List.of("Step_Index", "Step_Type", "Step_Name", "Status"),
            List.of("Date_Time", "Voltage", "Current"),
            normalizer);

    private static RowFrame stepFrame() {
        return frame(List.of("Step_Index", "Step_Type", "Step_Name", "Status"),
                row("1", "CC_Chg", "Charge", "Done"),
                row("2", "Rest", "Rest", "Done"),
                row("3", "CC_Chg", "Charge", "Done"));
    }

    private static RowFrame detailFrame() {
        return frame(List.of("Date_Time", "Voltage", "Current", "Capacity"),
                row("2024-03-01 08:00:00", "3.5", "1.0", "0.1"),
                row("2024-03-01 08:00:10", "3.7", "-1.0", "0.3"));
    }

    @Test
    void completeFilesAreValid() {
        ValidationReport report = engine.validate(stepFrame(), detailFrame());

        assertThat(report.isOverallValid()).isTrue();
        assertThat(report.getErrors()).isEmpty();

        Map<String, Object> step = report.getStepReport();
        assertThat(step.get("row_count")).isEqualTo(3);
        assertThat(step.get("column_count")).isEqualTo(4);
        assertThat(step.get("has_required_columns")).isEqualTo(true);
        assertThat(step.get("missing_columns")).asInstanceOf(LIST).isEmpty();
        assertThat(step.get("step_types")).isEqualTo(Map.of("CC_Chg", 2, "Rest", 1));
    }

    @Test
    void detailStatisticsAreComputed() {
        Map<String, Object> detail = engine.validate(stepFrame(), detailFrame()).getDetailReport();

        assertThat(detail.get("Voltage_min")).isEqualTo(3.5);
        assertThat(detail.get("Voltage_max")).isEqualTo(3.7);
        assertThat((Double) detail.get("Voltage_mean")).isCloseTo(3.6, offset(1e-9));
        assertThat(detail.get("Current_valid")).isEqualTo(true);
        assertThat(detail.get("Capacity_max")).isEqualTo(0.3);
    }

    @Test
    void timeRangeIsReported() {
        Map<String, Object> detail = engine.validate(stepFrame(), detailFrame()).getDetailReport();

        assertThat(detail.get("time_range_valid")).isEqualTo(true);
        assertThat(detail.get("start_time")).isEqualTo("2024-03-01T08:00");
        assertThat(detail.get("end_time")).isEqualTo("2024-03-01T08:00:10");
    }

    @Test
    void missingRequiredColumnIsAnError() {
        RowFrame detail = frame(List.of("Date_Time", "Voltage"), row("2024-03-01 08:00:00", "3.5"));

        ValidationReport report = engine.validate(stepFrame(), detail);

        assertThat(report.isOverallValid()).isFalse();
        assertThat(report.getDetailReport().get("missing_columns")).asInstanceOf(LIST).containsExactly("Current");
        assertThat(report.getErrors()).anyMatch(e -> e.contains("Current"));
    }

    @Test
    void emptyFileIsInvalid() {
        RowFrame emptyDetail = frame(List.of("Date_Time", "Voltage", "Current"));

        ValidationReport report = engine.validate(stepFrame(), emptyDetail);

        assertThat(report.isOverallValid()).isFalse();
        assertThat(report.getDetailReport().get("row_count")).isEqualTo(0);
    }

    @Test
    void absentOrNonNumericStatisticIsFlaggedNotZeroed() {
        RowFrame detail = frame(List.of("Date_Time", "Voltage", "Current"),
                row("2024-03-01 08:00:00", "3.5", "oops"));

        ValidationReport report = engine.validate(stepFrame(), detail);
        Map<String, Object> stats = report.getDetailReport();

        assertThat(stats.get("Current_valid")).isEqualTo(false);
        assertThat(stats).doesNotContainKey("Current_min");
        assertThat(stats.get("Capacity_valid")).isEqualTo(false);
        assertThat(report.isOverallValid()).isTrue();
        assertThat(report.getWarnings()).isNotEmpty();
    }

    @Test
    void unparseableTimeMakesRangeInvalidWithoutThrowing() {
        RowFrame detail = frame(List.of("Date_Time", "Voltage", "Current"),
                row("yesterday", "3.5", "1.0"));

        Map<String, Object> report = engine.validate(stepFrame(), detail).getDetailReport();

        assertThat(report.get("time_range_valid")).isEqualTo(false);
        assertThat(report).doesNotContainKey("start_time");
    }

    @Test
    void bilingualHeadersSatisfyRequiredColumnsAfterNormalization() {
        RowFrame detail = normalizer.normalize(frame(List.of("工步", "絕對時間", "電壓(V)", "電流(A)"),
                row("1", "2024-03-02 09:00:00", "3.7", "1.0")));
        RowFrame steps = normalizer.normalize(frame(List.of("工步", "工步種類", "工步名稱", "狀態"),
                row("1", "CC充電", "充電", "完成")));

        ValidationReport report = engine.validate(steps, detail);

        assertThat(report.isOverallValid()).isTrue();
        assertThat(report.getDetailReport().get("Voltage_max")).isEqualTo(3.7);
    }
}
