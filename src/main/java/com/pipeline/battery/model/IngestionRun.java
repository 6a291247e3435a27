package com.pipeline.battery.model;

import java.io.Serializable;
import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

/**
 * 导入运行结果。
 * 明确列出已提交的阶段：工步与测量批次分别提交，
 * 中途失败时调用方可据此续跑或删除实验进行补偿。
 */
public class IngestionRun implements Serializable {
    private IngestionStatus status;
    private Long experimentId;
    private final EnumSet<IngestionStage> committedStages = EnumSet.noneOf(IngestionStage.class);
    private ValidationReport validationReport;
    private MeasurementIngestResult measurementResult;
    private int detailRowsRead;
    private int detailRowsAfterFilter;
    /** 按明细行数给出的建议降采样间隔，仅供参考 */
    private IntervalRecommendation intervalRecommendation;
    private String message;

    public IngestionRun() {}

    public void markCommitted(IngestionStage stage) {
        committedStages.add(stage);
    }

    public boolean hasCommitted(IngestionStage stage) {
        return committedStages.contains(stage);
    }

    public IngestionStatus getStatus() { return status; }
    public void setStatus(IngestionStatus status) { this.status = status; }
    public Long getExperimentId() { return experimentId; }
    public void setExperimentId(Long experimentId) { this.experimentId = experimentId; }
    public Set<IngestionStage> getCommittedStages() { return Collections.unmodifiableSet(committedStages); }
    public ValidationReport getValidationReport() { return validationReport; }
    public void setValidationReport(ValidationReport validationReport) { this.validationReport = validationReport; }
    public MeasurementIngestResult getMeasurementResult() { return measurementResult; }
    public void setMeasurementResult(MeasurementIngestResult measurementResult) { this.measurementResult = measurementResult; }
    public int getDetailRowsRead() { return detailRowsRead; }
    public void setDetailRowsRead(int detailRowsRead) { this.detailRowsRead = detailRowsRead; }
    public int getDetailRowsAfterFilter() { return detailRowsAfterFilter; }
    public void setDetailRowsAfterFilter(int detailRowsAfterFilter) { this.detailRowsAfterFilter = detailRowsAfterFilter; }
    public IntervalRecommendation getIntervalRecommendation() { return intervalRecommendation; }
    public void setIntervalRecommendation(IntervalRecommendation intervalRecommendation) { this.intervalRecommendation = intervalRecommendation; }
    public String getMessage() { return message; }
    public void setMessage(String message) { this.message = message; }

    @Override
    public String toString() {
        return "IngestionRun{status=" + status
                + ", experimentId=" + experimentId
                + ", stages=" + committedStages
                + (measurementResult != null ? ", " + measurementResult : "")
                + (message != null ? ", message='" + message + "'" : "") + "}";
    }
}
