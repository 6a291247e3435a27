package com.pipeline.battery.core.impl;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.pipeline.battery.core.StorageException;
import com.pipeline.battery.core.StoreSession;
import com.pipeline.battery.core.StructuralException;
import com.pipeline.battery.model.Experiment;
import com.pipeline.battery.model.RowFrame;
import com.pipeline.battery.model.Step;
import com.pipeline.battery.model.StepMapping;
import com.pipeline.battery.storage.SQLiteIngestionStore;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static com.pipeline.battery.TestFrames.frame;
import static com.pipeline.battery.TestFrames.row;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.offset;
import static org.assertj.core.api.Assertions.tuple;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

@Tag("integration")
class DefaultStepRegistrarTest {

    private static final List<String> COLUMNS = List.of(
            "step_number", "step_type", "start_time", "end_time", "current", "capacity", "temperature");

    @TempDir
    Path tempDir;

    private SQLiteIngestionStore store;
    private DefaultStepRegistrar registrar;
    private long experimentId;

    @BeforeEach
    void setUp() {
        store = new SQLiteIngestionStore(tempDir.toString(), "steps.db");
        registrar = new DefaultStepRegistrar(store, new ObjectMapper());
        try (StoreSession session = store.openSession()) {
            Experiment experiment = new Experiment();
            experiment.setName("exp");
            experiment.setStartDate(LocalDateTime.of(2024, 3, 1, 8, 0));
            experimentId = session.insertExperiment(experiment);
            session.commit();
        }
    }

    @AfterEach
    void tearDown() {
        store.shutdown();
    }

    private static RowFrame threeSteps() {
        return frame(COLUMNS,
                row("1", "CC_Chg", "2024-03-01 08:00:00", "2024-03-01 08:10:00", "2.5", "0.4", "25.3"),
                row("2", "Rest", "2024-03-01 08:10:00", "2024-03-01 08:20:00", "0", "0", "25.1"),
                row("3", "CC_DChg", "2024-03-01 08:20:00", "2024-03-01 08:30:00", "-2.5", "0.4", ""));
    }

    @Test
    void registeredStepsAreCommittedAndMapped() {
        List<Step> steps = registrar.register(experimentId, threeSteps(), 5.0);

        assertThat(steps).extracting(Step::getId).doesNotContainNull();

        // 新会话可以读到，说明已提交
        try (StoreSession session = store.openSession()) {
            assertThat(session.findSteps(experimentId))
                    .extracting(Step::getStepNumber, Step::getStepType)
                    .containsExactly(
                            tuple(1, "charge"),
                            tuple(2, "rest"),
                            tuple(3, "discharge"));
        }

        StepMapping mapping = registrar.buildMapping(steps);
        assertThat(mapping.stepNumbers()).containsExactlyInAnyOrder(1, 2, 3);
        for (Step step : steps) {
            assertThat(mapping.stepIdFor(step.getStepNumber())).isEqualTo(step.getId());
        }
    }

    @Test
    void derivedFieldsAreComputed() {
        List<Step> steps = registrar.register(experimentId, threeSteps(), 5.0);
        Step charge = steps.get(0);

        assertThat(charge.getCRate()).isCloseTo(0.5, offset(1e-9));
        assertThat(charge.getDuration()).isEqualTo(600.0);
        assertThat(charge.getTemperatureAvg()).isEqualTo(25.3);
        assertThat(charge.getStartTime()).isEqualTo(LocalDateTime.of(2024, 3, 1, 8, 0));
        assertThat(steps.get(2).getCRate()).isCloseTo(0.5, offset(1e-9));
        assertThat(steps.get(2).getTemperatureAvg()).isNull();
    }

    @Test
    void zeroNominalCapacityGivesZeroCRate() {
        List<Step> steps = registrar.register(experimentId, threeSteps(), 0.0);

        assertThat(steps).extracting(Step::getCRate).containsOnly(0.0);
    }

    @Test
    void sourceRowIsKeptAsJson() throws Exception {
        Step first = registrar.register(experimentId, threeSteps(), 5.0).get(0);

        Map<?, ?> meta = new ObjectMapper().readValue(first.getDataMeta(), Map.class);
        assertThat(meta.get("step_type")).isEqualTo("CC_Chg");
        assertThat(meta.get("current")).isEqualTo("2.5");
    }

    @Test
    void incompleteAndDuplicateRowsAreSkipped() {
        RowFrame rows = frame(COLUMNS,
                row("1", "CC_Chg"),
                row("", "Rest"),
                row("2", ""),
                row("x", "Rest"),
                row("1", "CC_DChg"),
                row("4.0", "Pause"));

        List<Step> steps = registrar.register(experimentId, rows, 1.0);

        assertThat(steps).extracting(Step::getStepNumber).containsExactly(1, 4);
        assertThat(steps.get(0).getStepType()).isEqualTo("charge");
        assertThat(steps.get(1).getStepType()).isEqualTo("rest");
    }

    @Test
    void unknownStepTypeIsKeptVerbatim() {
        RowFrame rows = frame(COLUMNS, row("1", " Cycle_Start "));

        assertThat(registrar.register(experimentId, rows, 1.0))
                .extracting(Step::getStepType).containsExactly("Cycle_Start");
    }

    @Test
    void mappingEqualsParsedStepNumbers() {
        RowFrame rows = frame(COLUMNS, row("5", "Rest"), row("7", "CC_Chg"), row("9", "CC_DChg"));

        StepMapping mapping = registrar.buildMapping(registrar.register(experimentId, rows, 1.0));

        assertThat(mapping.stepNumbers()).containsExactlyInAnyOrder(5, 7, 9);
    }

    @Test
    void requireCompleteNamesMissingSteps() {
        StepMapping mapping = StepMapping.of(Map.of(1, 10L, 2, 20L));

        registrar.requireComplete(mapping, Set.of(1, 2));
        assertThatThrownBy(() -> registrar.requireComplete(mapping, Set.of(1, 2, 3)))
                .isInstanceOf(StructuralException.class)
                .hasMessageContaining("[3]");
    }

    @Test
    void storageFailureRollsBackAndPropagates() {
        StoreSession session = mock(StoreSession.class);
        doThrow(new StorageException("constraint failed")).when(session).insertSteps(anyList());

        assertThatThrownBy(() -> registrar.register(session, experimentId, threeSteps(), 1.0))
                .isInstanceOf(StorageException.class);
        verify(session).rollback();
        verify(session, never()).commit();
    }

    @Test
    void rollbackFailureIsSuppressedUnderOriginalError() {
        StoreSession session = mock(StoreSession.class);
        StorageException rollbackError = new StorageException("connection closed");
        doThrow(new StorageException("constraint failed")).when(session).insertSteps(anyList());
        doThrow(rollbackError).when(session).rollback();

        assertThatThrownBy(() -> registrar.register(session, experimentId, threeSteps(), 1.0))
                .isInstanceOf(StorageException.class)
                .hasMessage("constraint failed")
                .satisfies(e -> assertThat(e.getSuppressed()).containsExactly(rollbackError));
    }
}
