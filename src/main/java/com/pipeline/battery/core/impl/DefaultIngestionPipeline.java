package com.pipeline.battery.core.impl;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.pipeline.battery.core.FileIdentity;
import com.pipeline.battery.core.IngestionPipeline;
import com.pipeline.battery.core.IngestionStore;
import com.pipeline.battery.core.MeasurementIngestor;
import com.pipeline.battery.core.StepRegistrar;
import com.pipeline.battery.core.StorageException;
import com.pipeline.battery.core.StoreSession;
import com.pipeline.battery.core.StructuralException;
import com.pipeline.battery.core.ValidationEngine;
import com.pipeline.battery.model.Experiment;
import com.pipeline.battery.model.ExperimentMetadata;
import com.pipeline.battery.model.FileType;
import com.pipeline.battery.model.IngestionRequest;
import com.pipeline.battery.model.IngestionRun;
import com.pipeline.battery.model.IngestionStage;
import com.pipeline.battery.model.IngestionStatus;
import com.pipeline.battery.model.IntervalRecommendation;
import com.pipeline.battery.model.MeasurementIngestResult;
import com.pipeline.battery.model.RowFrame;
import com.pipeline.battery.model.Step;
import com.pipeline.battery.model.StepMapping;
import com.pipeline.battery.model.UploadedFile;
import com.pipeline.battery.model.ValidationReport;
import com.pipeline.battery.operators.ColumnNormalizer;
import com.pipeline.battery.operators.IntervalRecommender;
import com.pipeline.battery.operators.TimeIntervalFilter;
import com.pipeline.battery.reader.CellValues;
import com.pipeline.battery.reader.CsvFrameReader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static com.pipeline.battery.model.CanonicalColumns.STEP_NUMBER;
import static com.pipeline.battery.model.CanonicalColumns.TEMPERATURE;

/**
 * 导入流水线默认实现。
 *
 * 执行顺序：
 * 1. 指纹去重：任一文件已处理过即返回DUPLICATE
 * 2. 解析、表头归一化、给出建议降采样间隔、校验（校验不通过且请求要求遵守时返回INVALID）
 * 3. 明细数据结构检查（必需列与工步号），不通过时返回ABORTED且不写入任何数据
 * 4. 创建实验并提交
 * 5. 登记选中工步并提交，构建映射并检查完整性
 * 6. 降采样后分批导入测量数据
 * 7. 写入已处理文件记录，回填实验结束时间
 *
 * 结构性错误返回ABORTED，存储故障返回FAILED；
 * 已提交的阶段记录在结果中，不做自动回滚。
 */
public class DefaultIngestionPipeline implements IngestionPipeline {

    private static final Logger log = LoggerFactory.getLogger(DefaultIngestionPipeline.class);

    private static final double DEFAULT_TEMPERATURE = 25.0;

    private final IngestionStore store;
    private final FileIdentity fileIdentity;
    private final CsvFrameReader reader;
    private final ColumnNormalizer normalizer;
    private final ValidationEngine validationEngine;
    private final StepRegistrar stepRegistrar;
    private final TimeIntervalFilter intervalFilter;
    private final IntervalRecommender intervalRecommender;
    private final MeasurementIngestor measurementIngestor;
    private final ObjectMapper objectMapper;
    private final int batchSize;

    public DefaultIngestionPipeline(IngestionStore store,
                                    FileIdentity fileIdentity,
                                    CsvFrameReader reader,
                                    ColumnNormalizer normalizer,
                                    ValidationEngine validationEngine,
                                    StepRegistrar stepRegistrar,
                                    TimeIntervalFilter intervalFilter,
                                    IntervalRecommender intervalRecommender,
                                    MeasurementIngestor measurementIngestor,
                                    ObjectMapper objectMapper,
                                    int batchSize) {
        this.store = store;
        this.fileIdentity = fileIdentity;
        this.reader = reader;
        this.normalizer = normalizer;
        this.validationEngine = validationEngine;
        this.stepRegistrar = stepRegistrar;
        this.intervalFilter = intervalFilter;
        this.intervalRecommender = intervalRecommender;
        this.measurementIngestor = measurementIngestor;
        this.objectMapper = objectMapper;
        this.batchSize = batchSize;
    }

    @Override
    public IngestionRun run(IngestionRequest request) {
        IngestionRun run = new IngestionRun();
        UploadedFile stepFile = request.getStepFile();
        UploadedFile detailFile = request.getDetailFile();
        if (stepFile == null || detailFile == null || request.getMetadata() == null) {
            throw new IllegalArgumentException("Request needs a step file, a detail file and experiment metadata");
        }
        if (request.getIntervalSeconds() < 0) {
            throw new IllegalArgumentException("Interval must not be negative: " + request.getIntervalSeconds());
        }

        // ---- 1. 去重 ----
        String stepHash = fileIdentity.fingerprint(stepFile.getContent());
        String detailHash = fileIdentity.fingerprint(detailFile.getContent());
        if (fileIdentity.isAlreadyProcessed(stepHash) || fileIdentity.isAlreadyProcessed(detailHash)) {
            log.info("Skipping '{}' / '{}': already processed", stepFile.getFilename(), detailFile.getFilename());
            return finish(run, IngestionStatus.DUPLICATE, "Files were already processed");
        }

        try {
            // ---- 2. 解析、归一化、校验 ----
            RowFrame stepFrame = normalizer.normalize(reader.read(stepFile.getContent(), stepFile.getFilename()));
            RowFrame detailFrame = normalizer.normalize(reader.read(detailFile.getContent(), detailFile.getFilename()));
            run.setDetailRowsRead(detailFrame.size());
            IntervalRecommendation recommendation = intervalRecommender.recommend(detailFrame.size());
            run.setIntervalRecommendation(recommendation);
            if (request.getIntervalSeconds() == 0 && recommendation.getIntervalSeconds() > 0) {
                log.info("No interval requested for {} detail rows, recommended {}s",
                        detailFrame.size(), recommendation.getIntervalSeconds());
            }

            ValidationReport report = validationEngine.validate(stepFrame, detailFrame);
            run.setValidationReport(report);
            if (!report.isOverallValid() && request.isHonorValidation()) {
                return finish(run, IngestionStatus.INVALID, "Validation failed: " + report.getErrors());
            }

            // ---- 3. 结构检查，先于任何写入 ----
            measurementIngestor.checkFrame(detailFrame);

            // 未指定工步时登记全部有效工步，完整性以实际登记结果为准
            boolean selectAll = request.getSelectedStepNumbers().isEmpty();
            Set<Integer> selected = new LinkedHashSet<>(request.getSelectedStepNumbers());
            RowFrame selectedSteps = selectAll ? stepFrame : selectSteps(stepFrame, selected);

            try (StoreSession session = store.openSession()) {
                // ---- 4. 实验 ----
                Experiment experiment = buildExperiment(request, detailFrame, report);
                long experimentId = session.insertExperiment(experiment);
                session.commit();
                run.setExperimentId(experimentId);
                run.markCommitted(IngestionStage.EXPERIMENT_CREATED);
                log.info("Experiment '{}' created with id {}", experiment.getName(), experimentId);

                // ---- 5. 工步 ----
                List<Step> steps = stepRegistrar.register(session, experimentId, selectedSteps,
                        request.getNominalCapacity());
                run.markCommitted(IngestionStage.STEPS_COMMITTED);
                StepMapping mapping = stepRegistrar.buildMapping(steps);
                if (selectAll) {
                    selected = mapping.stepNumbers();
                }
                stepRegistrar.requireComplete(mapping, selected);

                // ---- 6. 测量 ----
                RowFrame filtered = intervalFilter.filter(detailFrame, request.getIntervalSeconds());
                run.setDetailRowsAfterFilter(filtered.size());
                MeasurementIngestResult result = measurementIngestor.ingest(session, experimentId, filtered,
                        mapping, request.getNominalCapacity(), batchSize);
                run.setMeasurementResult(result);
                if (result.getBatchesCommitted() > 0) {
                    run.markCommitted(IngestionStage.MEASUREMENTS_COMMITTED);
                }
                if (result.isCancelled()) {
                    return finish(run, IngestionStatus.ABORTED, "Measurement ingestion was cancelled");
                }

                // ---- 7. 已处理文件与结束时间 ----
                recordFiles(request, experimentId, stepHash, detailHash, stepFrame.size(), run);
                run.markCommitted(IngestionStage.PROCESSED_FILES_RECORDED);

                LocalDateTime endDate = resolveEndDate(result, steps);
                if (endDate != null) {
                    session.updateExperimentEndDate(experimentId, endDate);
                    session.commit();
                    run.markCommitted(IngestionStage.END_DATE_UPDATED);
                } else {
                    log.warn("No timestamps available, end date of experiment {} left empty", experimentId);
                }
            }

            return finish(run, IngestionStatus.COMPLETED, "Ingested " + run.getMeasurementResult());

        } catch (StructuralException e) {
            log.error("Ingestion aborted: {}", e.getMessage());
            return finish(run, IngestionStatus.ABORTED, e.getMessage());
        } catch (StorageException e) {
            log.error("Ingestion failed on storage: {}", e.getMessage(), e);
            return finish(run, IngestionStatus.FAILED, e.getMessage());
        }
    }

    private IngestionRun finish(IngestionRun run, IngestionStatus status, String message) {
        run.setStatus(status);
        run.setMessage(message);
        log.info("Ingestion run finished: {}", run);
        return run;
    }

    private RowFrame selectSteps(RowFrame stepFrame, Set<Integer> selected) {
        List<Map<String, String>> rows = new ArrayList<>();
        for (Map<String, String> row : stepFrame.getRows()) {
            Integer number = tryStepNumber(row.get(STEP_NUMBER));
            if (number != null && selected.contains(number)) {
                rows.add(row);
            }
        }
        return stepFrame.withRows(rows);
    }

    private static Integer tryStepNumber(String raw) {
        try {
            return CellValues.parseStepNumber(raw);
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private Experiment buildExperiment(IngestionRequest request, RowFrame detailFrame, ValidationReport report) {
        ExperimentMetadata meta = request.getMetadata();
        Experiment experiment = new Experiment();
        experiment.setName(meta.getName());
        experiment.setDescription(meta.getDescription());
        experiment.setOperator(meta.getOperator());
        experiment.setStartDate(meta.getStartDate());
        experiment.setBatteryType(meta.getBatteryType());
        experiment.setCellId(meta.getCellId());
        experiment.setMachineId(meta.getMachineId());
        experiment.setNominalCapacity(request.getNominalCapacity());
        experiment.setTemperatureAvg(averageTemperature(detailFrame));
        experiment.setValidationValid(report.isOverallValid());

        Map<String, Object> blob = new LinkedHashMap<>();
        blob.put("valid", report.isOverallValid());
        blob.put("step_validation", report.getStepReport());
        blob.put("detail_validation", report.getDetailReport());
        blob.put("errors", report.getErrors());
        blob.put("warnings", report.getWarnings());
        blob.put("timestamp", LocalDateTime.now().toString());
        experiment.setValidationReport(toJson(blob));
        return experiment;
    }

    private double averageTemperature(RowFrame detailFrame) {
        double sum = 0;
        int count = 0;
        for (String raw : detailFrame.getColumnValues(TEMPERATURE)) {
            Double value = CellValues.tryParseDouble(raw);
            if (value != null) {
                sum += value;
                count++;
            }
        }
        return count == 0 ? DEFAULT_TEMPERATURE : CellValues.round(sum / count, 1);
    }

    private void recordFiles(IngestionRequest request, long experimentId, String stepHash, String detailHash,
                             int stepRows, IngestionRun run) {
        Map<String, Object> meta = new LinkedHashMap<>();
        meta.put("experiment_name", request.getMetadata().getName());
        meta.put("interval_seconds", request.getIntervalSeconds());
        meta.put("selected_steps", request.getSelectedStepNumbers());
        meta.put("rows_after_filter", run.getDetailRowsAfterFilter());
        meta.put("saved", run.getMeasurementResult().getSaved());
        String metadata = toJson(meta);

        fileIdentity.recordProcessed(experimentId, request.getStepFile().getFilename(), FileType.STEP,
                stepHash, stepRows, metadata);
        if (!detailHash.equals(stepHash)) {
            fileIdentity.recordProcessed(experimentId, request.getDetailFile().getFilename(), FileType.DETAIL,
                    detailHash, run.getDetailRowsRead(), metadata);
        }
    }

    private LocalDateTime resolveEndDate(MeasurementIngestResult result, List<Step> steps) {
        if (result.getLastTimestamp() != null) {
            return result.getLastTimestamp();
        }
        LocalDateTime latest = null;
        for (Step step : steps) {
            LocalDateTime end = step.getEndTime();
            if (end != null && (latest == null || end.isAfter(latest))) {
                latest = end;
            }
        }
        return latest;
    }

    private String toJson(Map<String, Object> value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            log.warn("Failed to serialize metadata: {}", e.getMessage());
            return null;
        }
    }
}
