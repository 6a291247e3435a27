package com.pipeline.battery.reader;

import com.pipeline.battery.TestFrames;
import com.pipeline.battery.core.StructuralException;
import com.pipeline.battery.model.RowFrame;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
class CsvFrameReaderTest {

    private final CsvFrameReader reader = new CsvFrameReader(StandardCharsets.UTF_8);

    @Test
    void readsHeaderAndRows() {
        RowFrame frame = reader.read(TestFrames.fixture("step.csv"), "step.csv");

        assertThat(frame.getColumns()).startsWith("Step_Index", "Step_Type", "Step_Name", "Status");
        assertThat(frame.size()).isEqualTo(3);
        assertThat(frame.getValue(2, "Step_Type")).isEqualTo("CC_DChg");
    }

    @Test
    void stripsByteOrderMarkFromFirstHeader() {
        RowFrame frame = reader.read(TestFrames.fixture("detail_bilingual.csv"), "detail_bilingual.csv");

        assertThat(frame.getColumns().get(0)).isEqualTo("工步");
        assertThat(frame.hasColumn("電壓(V)")).isTrue();
        assertThat(frame.size()).isEqualTo(6);
    }

    @Test
    void blankCellsAndShortRowsBecomeNull() {
        byte[] csv = "a,b,c\n1,,3\n4\n".getBytes(StandardCharsets.UTF_8);

        RowFrame frame = reader.read(csv, "short.csv");

        assertThat(frame.getValue(0, "b")).isNull();
        assertThat(frame.getValue(1, "a")).isEqualTo("4");
        assertThat(frame.getValue(1, "c")).isNull();
    }

    @Test
    void duplicateHeaderKeepsFirstColumn() {
        byte[] csv = "x,x,y\n1,2,3\n".getBytes(StandardCharsets.UTF_8);

        RowFrame frame = reader.read(csv, "dup.csv");

        assertThat(frame.getColumns()).containsExactly("x", "y");
        assertThat(frame.getValue(0, "x")).isEqualTo("1");
    }

    @Test
    void emptyFileIsStructuralError() {
        assertThatThrownBy(() -> reader.read(new byte[0], "empty.csv"))
                .isInstanceOf(StructuralException.class)
                .hasMessageContaining("empty.csv");
    }

    @Test
    void headerOnlyFileHasNoRows() {
        RowFrame frame = reader.read("a,b\n".getBytes(StandardCharsets.UTF_8), "header.csv");

        assertThat(frame.isEmpty()).isTrue();
        assertThat(frame.getColumns()).containsExactly("a", "b");
    }
}
