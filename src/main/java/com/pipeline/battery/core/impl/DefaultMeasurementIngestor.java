package com.pipeline.battery.core.impl;

import com.pipeline.battery.AppConfig;
import com.pipeline.battery.core.MeasurementIngestor;
import com.pipeline.battery.core.StorageException;
import com.pipeline.battery.core.StoreSession;
import com.pipeline.battery.core.StructuralException;
import com.pipeline.battery.model.Measurement;
import com.pipeline.battery.model.MeasurementIngestResult;
import com.pipeline.battery.model.RowFrame;
import com.pipeline.battery.model.Step;
import com.pipeline.battery.model.StepMapping;
import com.pipeline.battery.reader.CellValues;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static com.pipeline.battery.model.CanonicalColumns.*;

/**
 * 测量数据导入默认实现。
 *
 * 处理流程：
 * 1. 结构检查（必需列、映射非空且属于本实验、工步号可转为整数），全部通过后才写入
 * 2. 按批构建测量实体，未映射工步的行计入skipped，无法解析的行计入errors
 * 3. 每批插入后立即提交；失败则回滚并重试一次，仍失败则整批计入errors后继续
 */
public class DefaultMeasurementIngestor implements MeasurementIngestor {

    private static final Logger log = LoggerFactory.getLogger(DefaultMeasurementIngestor.class);

    private final int voltageScale;
    private final int currentScale;
    private final int temperatureScale;
    private final int capacityScale;
    private final int energyScale;
    private final int socScale;
    private final double defaultTemperature;

    public DefaultMeasurementIngestor(AppConfig config) {
        this.voltageScale = config.getVoltagePrecision();
        this.currentScale = config.getCurrentPrecision();
        this.temperatureScale = config.getTemperaturePrecision();
        this.capacityScale = config.getCapacityPrecision();
        this.energyScale = config.getEnergyPrecision();
        this.socScale = config.getSocPrecision();
        this.defaultTemperature = config.getDefaultTemperature();
    }

    @Override
    public MeasurementIngestResult ingest(StoreSession session, long experimentId, RowFrame detailFrame,
                                          StepMapping stepMapping, double nominalCapacity, int batchSize) {
        if (batchSize <= 0) {
            throw new IllegalArgumentException("Batch size must be positive: " + batchSize);
        }
        int[] stepNumbers = checkFrame(detailFrame);
        checkMapping(session, experimentId, stepMapping);

        int total = detailFrame.size();
        MeasurementIngestResult result = new MeasurementIngestResult(total);
        log.info("Ingesting {} measurement rows for experiment {} in batches of {}",
                total, experimentId, batchSize);

        for (int from = 0; from < total; from += batchSize) {
            if (Thread.currentThread().isInterrupted()) {
                log.warn("Measurement ingestion for experiment {} cancelled after {} rows",
                        experimentId, from);
                result.setCancelled(true);
                break;
            }
            int to = Math.min(from + batchSize, total);

            List<Measurement> batch = new ArrayList<>(to - from);
            for (int i = from; i < to; i++) {
                Long stepId = stepMapping.stepIdFor(stepNumbers[i]);
                if (stepId == null) {
                    result.addSkipped(1);
                    continue;
                }
                Measurement measurement = toMeasurement(stepId, detailFrame.getRow(i), i);
                if (measurement == null) {
                    result.addErrors(1);
                } else {
                    batch.add(measurement);
                }
            }
            if (batch.isEmpty()) continue;

            if (writeBatch(session, batch, from, to)) {
                result.addSaved(batch.size());
                result.batchCommitted();
                for (Measurement m : batch) {
                    result.offerTimestamp(m.getTimestamp());
                }
            } else {
                result.addErrors(batch.size());
                result.batchFailed();
            }
        }

        log.info("Measurement ingestion for experiment {} finished: {}", experimentId, result);
        return result;
    }

    @Override
    public int[] checkFrame(RowFrame frame) {
        List<String> missing = new ArrayList<>();
        for (String column : MEASUREMENT_REQUIRED) {
            if (!frame.hasColumn(column)) missing.add(column);
        }
        if (!missing.isEmpty()) {
            throw new StructuralException("Detail data is missing required columns: " + missing);
        }

        int[] stepNumbers = new int[frame.size()];
        for (int i = 0; i < frame.size(); i++) {
            String raw = frame.getValue(i, STEP_NUMBER);
            Integer parsed;
            try {
                parsed = CellValues.parseStepNumber(raw);
            } catch (NumberFormatException e) {
                throw new StructuralException("step_number '" + raw + "' at detail row " + (i + 1)
                        + " is not an integer", e);
            }
            if (parsed == null) {
                throw new StructuralException("step_number is blank at detail row " + (i + 1));
            }
            stepNumbers[i] = parsed;
        }
        return stepNumbers;
    }

    /**
     * 映射非空，且映射中的工步id全部属于本实验
     */
    private void checkMapping(StoreSession session, long experimentId, StepMapping mapping) {
        if (mapping.isEmpty()) {
            throw new StructuralException("Step mapping is empty, no measurement can be bound to a step");
        }

        Set<Long> ownStepIds = new HashSet<>();
        for (Step step : session.findSteps(experimentId)) {
            ownStepIds.add(step.getId());
        }
        for (Map.Entry<Integer, Long> entry : mapping.asMap().entrySet()) {
            if (!ownStepIds.contains(entry.getValue())) {
                throw new StructuralException("Step mapping entry " + entry.getKey() + " -> " + entry.getValue()
                        + " does not belong to experiment " + experimentId);
            }
        }
    }

    /**
     * @return 测量实体；行数据无法解析时返回null
     */
    private Measurement toMeasurement(long stepId, Map<String, String> row, int rowIndex) {
        try {
            Double executionTime = CellValues.parseDouble(row.get(EXECUTION_TIME));
            Double voltage = CellValues.parseDouble(row.get(VOLTAGE));
            Double current = CellValues.parseDouble(row.get(CURRENT));
            if (executionTime == null || voltage == null || current == null) {
                log.debug("Detail row {} lacks execution_time/voltage/current", rowIndex + 1);
                return null;
            }
            Double temperature = CellValues.parseDouble(row.get(TEMPERATURE));
            Double capacity = CellValues.parseDouble(row.get(CAPACITY));
            Double energy = CellValues.parseDouble(row.get(ENERGY));
            Double soc = CellValues.parseDouble(row.get(SOC));

            Measurement m = new Measurement(stepId, executionTime,
                    CellValues.round(voltage, voltageScale),
                    CellValues.round(current, currentScale));
            m.setTemperature(CellValues.round(temperature == null ? defaultTemperature : temperature, temperatureScale));
            m.setCapacity(CellValues.round(capacity == null ? 0.0 : capacity, capacityScale));
            m.setEnergy(CellValues.round(energy == null ? 0.0 : energy, energyScale));
            m.setSoc(CellValues.round(soc, socScale));
            m.setTimestamp(CellValues.parseDateTime(row.get(TIMESTAMP)));
            return m;
        } catch (NumberFormatException e) {
            log.debug("Detail row {} has a non-numeric value: {}", rowIndex + 1, e.getMessage());
            return null;
        }
    }

    /**
     * 写入并提交一批，失败时回滚并重试一次
     *
     * @return 是否最终提交成功
     */
    private boolean writeBatch(StoreSession session, List<Measurement> batch, int from, int to) {
        for (int attempt = 1; attempt <= 2; attempt++) {
            try {
                session.insertMeasurements(batch);
                session.commit();
                return true;
            } catch (StorageException e) {
                log.warn("Batch rows {}-{} failed on attempt {}: {}", from + 1, to, attempt, e.getMessage());
                rollbackQuietly(session);
            }
        }
        log.error("Batch rows {}-{} dropped after retry ({} measurements)", from + 1, to, batch.size());
        return false;
    }

    private void rollbackQuietly(StoreSession session) {
        try {
            session.rollback();
        } catch (StorageException e) {
            log.warn("Rollback failed: {}", e.getMessage());
        }
    }
}
