package com.pipeline.battery.model;

import java.io.Serializable;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * 一次导入请求，承载调用方的全部选择。
 * 流水线只从这里读取工步选择、标称容量和实验元数据，不依赖任何全局状态。
 */
public class IngestionRequest implements Serializable {
    private UploadedFile stepFile;
    private UploadedFile detailFile;
    /** 选中的工步号；为空表示全部已解析工步 */
    private Set<Integer> selectedStepNumbers = new LinkedHashSet<>();
    /** 标称容量（Ah） */
    private double nominalCapacity;
    private ExperimentMetadata metadata;
    /** 降采样间隔（秒），0表示不降采样 */
    private double intervalSeconds;
    /** 校验不通过时是否拒绝导入 */
    private boolean honorValidation = true;

    public IngestionRequest() {}

    public IngestionRequest(UploadedFile stepFile, UploadedFile detailFile,
                            double nominalCapacity, ExperimentMetadata metadata) {
        this.stepFile = stepFile;
        this.detailFile = detailFile;
        this.nominalCapacity = nominalCapacity;
        this.metadata = metadata;
    }

    public UploadedFile getStepFile() { return stepFile; }
    public void setStepFile(UploadedFile stepFile) { this.stepFile = stepFile; }
    public UploadedFile getDetailFile() { return detailFile; }
    public void setDetailFile(UploadedFile detailFile) { this.detailFile = detailFile; }
    public Set<Integer> getSelectedStepNumbers() { return Collections.unmodifiableSet(selectedStepNumbers); }
    public void setSelectedStepNumbers(Set<Integer> selectedStepNumbers) {
        this.selectedStepNumbers = new LinkedHashSet<>(selectedStepNumbers);
    }
    public double getNominalCapacity() { return nominalCapacity; }
    public void setNominalCapacity(double nominalCapacity) { this.nominalCapacity = nominalCapacity; }
    public ExperimentMetadata getMetadata() { return metadata; }
    public void setMetadata(ExperimentMetadata metadata) { this.metadata = metadata; }
    public double getIntervalSeconds() { return intervalSeconds; }
    public void setIntervalSeconds(double intervalSeconds) { this.intervalSeconds = intervalSeconds; }
    public boolean isHonorValidation() { return honorValidation; }
    public void setHonorValidation(boolean honorValidation) { this.honorValidation = honorValidation; }
}
