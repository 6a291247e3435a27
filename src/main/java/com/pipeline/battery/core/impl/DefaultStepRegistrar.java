package com.pipeline.battery.core.impl;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.pipeline.battery.core.IngestionStore;
import com.pipeline.battery.core.StepRegistrar;
import com.pipeline.battery.core.StorageException;
import com.pipeline.battery.core.StoreSession;
import com.pipeline.battery.core.StructuralException;
import com.pipeline.battery.model.RowFrame;
import com.pipeline.battery.model.Step;
import com.pipeline.battery.model.StepMapping;
import com.pipeline.battery.model.StepType;
import com.pipeline.battery.reader.CellValues;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static com.pipeline.battery.model.CanonicalColumns.*;

/**
 * 工步登记默认实现。
 *
 * 每行工步数据生成一个{@link Step}：
 * - 缺少工步号或工步类型的行跳过并记录警告
 * - 重复的工步号只保留第一次出现的行
 * - 工步类型归一化为 charge / discharge / rest
 * - c_rate = |current| / 标称容量，容量不为正时为0
 * - 原始行以JSON存入data_meta
 */
public class DefaultStepRegistrar implements StepRegistrar {

    private static final Logger log = LoggerFactory.getLogger(DefaultStepRegistrar.class);

    private final IngestionStore store;
    private final ObjectMapper objectMapper;

    public DefaultStepRegistrar(IngestionStore store, ObjectMapper objectMapper) {
        this.store = store;
        this.objectMapper = objectMapper;
    }

    @Override
    public List<Step> register(long experimentId, RowFrame stepRows, double nominalCapacity) {
        try (StoreSession session = store.openSession()) {
            return register(session, experimentId, stepRows, nominalCapacity);
        }
    }

    @Override
    public List<Step> register(StoreSession session, long experimentId, RowFrame stepRows, double nominalCapacity) {
        List<Step> steps = buildSteps(experimentId, stepRows, nominalCapacity);
        if (steps.isEmpty()) {
            log.warn("No registrable steps for experiment {}", experimentId);
            return steps;
        }

        try {
            session.insertSteps(steps);
            session.commit();
        } catch (StorageException e) {
            try {
                session.rollback();
            } catch (StorageException rollbackError) {
                e.addSuppressed(rollbackError);
            }
            throw e;
        }

        log.info("Registered {} steps for experiment {}", steps.size(), experimentId);
        return steps;
    }

    @Override
    public StepMapping buildMapping(List<Step> steps) {
        return StepMapping.of(steps);
    }

    @Override
    public void requireComplete(StepMapping mapping, Collection<Integer> selectedStepNumbers) {
        Set<Integer> missing = mapping.missingFrom(selectedStepNumbers);
        if (!missing.isEmpty()) {
            throw new StructuralException("Selected steps are not registered: " + missing
                    + " (registered: " + mapping.stepNumbers() + ")");
        }
    }

    private List<Step> buildSteps(long experimentId, RowFrame stepRows, double nominalCapacity) {
        List<Step> steps = new ArrayList<>();
        Set<Integer> seen = new HashSet<>();

        int rowIndex = 0;
        for (Map<String, String> row : stepRows.getRows()) {
            rowIndex++;
            Integer stepNumber = stepNumberOf(row);
            String stepType = StepType.normalizeLabel(row.get(STEP_TYPE));
            if (stepNumber == null || stepType == null) {
                log.warn("Skipping step row {}: step_number={}, step_type={}",
                        rowIndex, row.get(STEP_NUMBER), row.get(STEP_TYPE));
                continue;
            }
            if (!seen.add(stepNumber)) {
                log.warn("Skipping step row {}: duplicate step_number {}", rowIndex, stepNumber);
                continue;
            }
            steps.add(toStep(experimentId, stepNumber, stepType, row, nominalCapacity));
        }
        return steps;
    }

    private Step toStep(long experimentId, int stepNumber, String stepType,
                        Map<String, String> row, double nominalCapacity) {
        Step step = new Step();
        step.setExperimentId(experimentId);
        step.setStepNumber(stepNumber);
        step.setStepType(stepType);

        LocalDateTime start = CellValues.parseDateTime(row.get(START_TIME));
        LocalDateTime end = CellValues.parseDateTime(row.get(END_TIME));
        step.setStartTime(start);
        step.setEndTime(end);

        Double duration = CellValues.tryParseDouble(row.get(DURATION));
        if (duration == null && start != null && end != null) {
            duration = Duration.between(start, end).toMillis() / 1000.0;
        }
        step.setDuration(duration == null ? 0.0 : duration);

        double current = numberOr(row, CURRENT, 0.0);
        step.setVoltageStart(numberOr(row, VOLTAGE_START, 0.0));
        step.setVoltageEnd(numberOr(row, VOLTAGE_END, 0.0));
        step.setCurrent(current);
        step.setCapacity(numberOr(row, CAPACITY, 0.0));
        step.setEnergy(numberOr(row, ENERGY, 0.0));

        Double temperatureAvg = CellValues.tryParseDouble(row.get(TEMPERATURE_AVG));
        if (temperatureAvg == null) {
            temperatureAvg = CellValues.tryParseDouble(row.get(TEMPERATURE));
        }
        step.setTemperatureAvg(temperatureAvg);
        step.setTemperatureMin(CellValues.tryParseDouble(row.get(TEMPERATURE_MIN)));
        step.setTemperatureMax(CellValues.tryParseDouble(row.get(TEMPERATURE_MAX)));

        step.setCRate(nominalCapacity > 0 ? Math.abs(current) / nominalCapacity : 0.0);
        step.setSocStart(CellValues.tryParseDouble(row.get(SOC_START)));
        step.setSocEnd(CellValues.tryParseDouble(row.get(SOC_END)));
        step.setOcv(CellValues.tryParseDouble(row.get(OCV)));
        step.setDataMeta(toJson(row));
        return step;
    }

    private static Integer stepNumberOf(Map<String, String> row) {
        try {
            return CellValues.parseStepNumber(row.get(STEP_NUMBER));
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private static double numberOr(Map<String, String> row, String column, double fallback) {
        Double value = CellValues.tryParseDouble(row.get(column));
        return value == null ? fallback : value;
    }

    private String toJson(Map<String, String> row) {
        try {
            return objectMapper.writeValueAsString(row);
        } catch (JsonProcessingException e) {
            log.warn("Failed to serialize step row as data_meta: {}", e.getMessage());
            return null;
        }
    }
}
