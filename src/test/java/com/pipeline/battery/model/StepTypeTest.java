package com.pipeline.battery.model;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

@Tag("unit")
class StepTypeTest {

    @Test
    void instrumentLabelsMapToCanonicalTypes() {
        assertThat(StepType.normalizeLabel("CC_Chg")).isEqualTo("charge");
        assertThat(StepType.normalizeLabel("CCCV_Chg")).isEqualTo("charge");
        assertThat(StepType.normalizeLabel("CC_DChg")).isEqualTo("discharge");
        assertThat(StepType.normalizeLabel("Rest")).isEqualTo("rest");
        assertThat(StepType.normalizeLabel("Pause")).isEqualTo("rest");
    }

    @Test
    void chineseLabelsMapToCanonicalTypes() {
        assertThat(StepType.normalizeLabel("CC放電")).isEqualTo("discharge");
        assertThat(StepType.normalizeLabel("CCCV充電")).isEqualTo("charge");
        assertThat(StepType.normalizeLabel("靜置")).isEqualTo("rest");
    }

    @Test
    void unknownLabelIsKeptTrimmedAndBlankIsNull() {
        assertThat(StepType.normalizeLabel("  Cycle ")).isEqualTo("Cycle");
        assertThat(StepType.normalizeLabel("  ")).isNull();
        assertThat(StepType.normalizeLabel(null)).isNull();
    }
}
