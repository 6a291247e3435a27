package com.pipeline.battery.model;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 工步文件与明细文件的校验报告。
 *
 * 报告按严重程度分级：
 * - errors：结构性问题（缺少必需列、空文件），会使overallValid为false
 * - warnings：统计或时间范围缺失，仅供参考
 *
 * 报告本身是建议性的，是否据此拦截导入由调用方决定。
 */
public class ValidationReport implements Serializable {
    private boolean overallValid;
    private final Map<String, Object> stepReport;
    private final Map<String, Object> detailReport;
    private final List<String> errors;
    private final List<String> warnings;

    public ValidationReport() {
        this.stepReport = new LinkedHashMap<>();
        this.detailReport = new LinkedHashMap<>();
        this.errors = new ArrayList<>();
        this.warnings = new ArrayList<>();
    }

    public void addError(String error) {
        this.errors.add(error);
    }

    public void addWarning(String warning) {
        this.warnings.add(warning);
    }

    public boolean isOverallValid() { return overallValid; }
    public void setOverallValid(boolean overallValid) { this.overallValid = overallValid; }
    public Map<String, Object> getStepReport() { return stepReport; }
    public Map<String, Object> getDetailReport() { return detailReport; }
    public List<String> getErrors() { return errors; }
    public List<String> getWarnings() { return warnings; }
}
