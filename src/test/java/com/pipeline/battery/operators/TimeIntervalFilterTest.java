package com.pipeline.battery.operators;

import com.pipeline.battery.model.RowFrame;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static com.pipeline.battery.TestFrames.frame;
import static com.pipeline.battery.TestFrames.row;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
class TimeIntervalFilterTest {

    private static final List<String> COLUMNS = List.of("step_number", "execution_time", "voltage");

    private final TimeIntervalFilter filter = new TimeIntervalFilter(0, 3600);

    private static RowFrame samples(int step, int count, double spacing) {
        List<String[]> rows = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            rows.add(row(String.valueOf(step), String.valueOf(i * spacing), "3.7"));
        }
        return frame(COLUMNS, rows.toArray(new String[0][]));
    }

    private static List<Double> times(RowFrame frame) {
        List<Double> times = new ArrayList<>();
        for (String value : frame.getColumnValues("execution_time")) {
            times.add(Double.parseDouble(value));
        }
        return times;
    }

    @Test
    void hundredSamplesAtFiveSecondsKeepsGridPlusLast() {
        RowFrame result = filter.filter(samples(1, 100, 1.0), 5);

        assertThat(result.size()).isEqualTo(21);
        assertThat(times(result)).startsWith(0.0, 5.0, 10.0).endsWith(95.0, 99.0);
    }

    @Test
    void zeroIntervalIsIdentity() {
        RowFrame input = samples(1, 10, 1.0);

        assertThat(filter.filter(input, 0)).isSameAs(input);
    }

    @Test
    void negativeIntervalIsRejected() {
        assertThatThrownBy(() -> filter.filter(samples(1, 3, 1.0), -1))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void firstAndLastOfEveryStepAreKept() {
        RowFrame input = frame(COLUMNS,
                row("1", "0", "3.0"), row("1", "2", "3.1"), row("1", "4", "3.2"),
                row("2", "0", "3.3"), row("2", "1", "3.4"));

        RowFrame result = filter.filter(input, 100);

        assertThat(result.getColumnValues("step_number")).containsExactly("1", "1", "2", "2");
        assertThat(times(result)).containsExactly(0.0, 4.0, 0.0, 1.0);
    }

    @Test
    void singleSampleStepIsKept() {
        RowFrame result = filter.filter(frame(COLUMNS, row("7", "3", "3.0")), 10);

        assertThat(result.size()).isEqualTo(1);
    }

    @Test
    void rowsAreSortedByExecutionTimeWithinStep() {
        RowFrame input = frame(COLUMNS,
                row("1", "10", "a"), row("1", "0", "b"), row("1", "5", "c"));

        RowFrame result = filter.filter(input, 5);

        assertThat(result.getColumnValues("voltage")).containsExactly("b", "c", "a");
    }

    @Test
    void stepNumbersWrittenDifferentlyShareOnePartition() {
        RowFrame input = frame(COLUMNS,
                row("1", "0", "a"), row("1.0", "1", "b"), row("1", "2", "c"));

        RowFrame result = filter.filter(input, 10);

        assertThat(result.getColumnValues("voltage")).containsExactly("a", "c");
    }

    @Test
    void outputNeverGrowsAndShrinksAsIntervalGrows() {
        RowFrame input = samples(1, 200, 0.5);

        int previous = input.size();
        for (double interval : new double[]{0.5, 1, 2, 10, 60}) {
            int size = filter.filter(input, interval).size();
            assertThat(size).isLessThanOrEqualTo(previous);
            previous = size;
        }
    }

    @Test
    void intervalAboveMaximumIsClamped() {
        TimeIntervalFilter bounded = new TimeIntervalFilter(0, 10);
        RowFrame input = samples(1, 100, 1.0);

        assertThat(bounded.filter(input, 5000).size()).isEqualTo(bounded.filter(input, 10).size());
    }

    @Test
    void unparseableTimesAreKept() {
        RowFrame input = frame(COLUMNS,
                row("1", "0", "a"), row("1", "", "b"), row("1", "1", "c"), row("1", "2", "d"));

        RowFrame result = filter.filter(input, 5);

        assertThat(result.getColumnValues("voltage")).containsExactly("a", "d", "b");
    }
}
