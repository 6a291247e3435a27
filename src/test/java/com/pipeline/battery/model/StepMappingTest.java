package com.pipeline.battery.model;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
class StepMappingTest {

    private static Step step(int number, Long id) {
        Step step = new Step();
        step.setStepNumber(number);
        step.setId(id);
        return step;
    }

    @Test
    void stepsWithoutIdAreLeftOut() {
        StepMapping mapping = StepMapping.of(List.of(step(1, 10L), step(2, null), step(3, 30L)));

        assertThat(mapping.stepNumbers()).containsExactly(1, 3);
        assertThat(mapping.stepIdFor(3)).isEqualTo(30L);
        assertThat(mapping.stepIdFor(2)).isNull();
        assertThat(mapping.contains(2)).isFalse();
    }

    @Test
    void missingFromListsUnmappedSelectionInAscendingOrder() {
        StepMapping mapping = StepMapping.of(Map.of(1, 10L, 2, 20L));

        assertThat(mapping.missingFrom(List.of(5, 1, 3, 2))).containsExactly(3, 5);
        assertThat(mapping.missingFrom(List.of(1, 2))).isEmpty();
    }

    @Test
    void mappingIsImmutable() {
        StepMapping mapping = StepMapping.of(Map.of(1, 10L));

        assertThatThrownBy(() -> mapping.asMap().put(2, 20L))
                .isInstanceOf(UnsupportedOperationException.class);
    }
}
