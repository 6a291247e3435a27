package com.pipeline.battery.core.impl;

import com.pipeline.battery.core.ValidationEngine;
import com.pipeline.battery.model.RowFrame;
import com.pipeline.battery.model.ValidationReport;
import com.pipeline.battery.operators.ColumnNormalizer;
import com.pipeline.battery.reader.CellValues;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * 校验引擎默认实现。
 *
 * 检查项：
 * - 结构：行数、列数、列名、缺失的必需列
 * - 统计（明细）：Voltage / Current / Capacity 的最小、最大、均值
 * - 分类（工步）：工步类型频次
 * - 时间：Date_Time 的起止范围
 */
public class DefaultValidationEngine implements ValidationEngine {

    private static final Logger log = LoggerFactory.getLogger(DefaultValidationEngine.class);

    private static final List<String> STAT_COLUMNS = List.of("Voltage", "Current", "Capacity");
    private static final String TIME_COLUMN = "Date_Time";
    private static final String STEP_TYPE_COLUMN = "Step_Type";

    private final List<String> stepRequiredColumns;
    private final List<String> detailRequiredColumns;
    private final ColumnNormalizer normalizer;

    public DefaultValidationEngine(List<String> stepRequiredColumns, List<String> detailRequiredColumns,
                                   ColumnNormalizer normalizer) {
        this.stepRequiredColumns = List.copyOf(stepRequiredColumns);
        this.detailRequiredColumns = List.copyOf(detailRequiredColumns);
        this.normalizer = normalizer;
    }

    @Override
    public ValidationReport validate(RowFrame stepFrame, RowFrame detailFrame) {
        ValidationReport report = new ValidationReport();

        checkStructure("step", stepFrame, stepRequiredColumns, report.getStepReport(), report);
        checkStepTypes(stepFrame, report.getStepReport());
        checkTimeRange("step", stepFrame, report.getStepReport(), report);

        checkStructure("detail", detailFrame, detailRequiredColumns, report.getDetailReport(), report);
        checkStatistics(detailFrame, report.getDetailReport(), report);
        checkTimeRange("detail", detailFrame, report.getDetailReport(), report);

        boolean valid = Boolean.TRUE.equals(report.getStepReport().get("has_required_columns"))
                && Boolean.TRUE.equals(report.getDetailReport().get("has_required_columns"))
                && stepFrame.size() > 0
                && detailFrame.size() > 0;
        report.setOverallValid(valid);

        log.info("Validation finished: valid={}, errors={}, warnings={}",
                valid, report.getErrors().size(), report.getWarnings().size());
        return report;
    }

    // ==================== 结构 ====================

    private void checkStructure(String label, RowFrame frame, List<String> required,
                                Map<String, Object> target, ValidationReport report) {
        target.put("row_count", frame.size());
        target.put("column_count", frame.columnCount());
        target.put("columns", new ArrayList<>(frame.getColumns()));

        List<String> missing = new ArrayList<>();
        for (String column : required) {
            if (resolveColumn(frame, column) == null) {
                missing.add(column);
            }
        }
        target.put("missing_columns", missing);
        target.put("has_required_columns", missing.isEmpty());

        if (!missing.isEmpty()) {
            report.addError(label + " file is missing required columns: " + missing);
        }
        if (frame.isEmpty()) {
            report.addError(label + " file contains no data rows");
        }
    }

    /**
     * 解析列：表头本身存在，或存在归一化到同一规范字段的列
     *
     * @return 实际可用的列名；不存在时返回null
     */
    private String resolveColumn(RowFrame frame, String column) {
        if (frame.hasColumn(column)) {
            return column;
        }
        String canonical = normalizer.canonicalOf(column);
        if (canonical == null) {
            return null;
        }
        if (frame.hasColumn(canonical)) {
            return canonical;
        }
        for (String present : frame.getColumns()) {
            if (Objects.equals(canonical, normalizer.canonicalOf(present))) {
                return present;
            }
        }
        return null;
    }

    // ==================== 分类 ====================

    private void checkStepTypes(RowFrame frame, Map<String, Object> target) {
        Map<String, Integer> frequencies = new LinkedHashMap<>();
        String column = resolveColumn(frame, STEP_TYPE_COLUMN);
        if (column != null) {
            for (String value : frame.getColumnValues(column)) {
                if (!CellValues.isBlank(value)) {
                    frequencies.merge(value.trim(), 1, Integer::sum);
                }
            }
        }
        target.put("step_types", frequencies);
    }

    // ==================== 统计 ====================

    private void checkStatistics(RowFrame frame, Map<String, Object> target, ValidationReport report) {
        for (String name : STAT_COLUMNS) {
            String column = resolveColumn(frame, name);
            if (column == null) {
                target.put(name + "_valid", false);
                report.addWarning("detail file has no " + name + " column");
                continue;
            }

            double min = Double.POSITIVE_INFINITY;
            double max = Double.NEGATIVE_INFINITY;
            double sum = 0;
            int count = 0;
            boolean numeric = true;
            for (String value : frame.getColumnValues(column)) {
                if (CellValues.isBlank(value)) continue;
                Double parsed = CellValues.tryParseDouble(value);
                if (parsed == null) {
                    numeric = false;
                    break;
                }
                min = Math.min(min, parsed);
                max = Math.max(max, parsed);
                sum += parsed;
                count++;
            }

            if (!numeric || count == 0) {
                target.put(name + "_valid", false);
                report.addWarning("detail column " + name + (numeric ? " has no values" : " is not numeric"));
                continue;
            }
            target.put(name + "_min", min);
            target.put(name + "_max", max);
            target.put(name + "_mean", sum / count);
            target.put(name + "_valid", true);
        }
    }

    // ==================== 时间 ====================

    private void checkTimeRange(String label, RowFrame frame, Map<String, Object> target, ValidationReport report) {
        String column = resolveColumn(frame, TIME_COLUMN);
        if (column == null) {
            target.put("time_range_valid", false);
            report.addWarning(label + " file has no " + TIME_COLUMN + " column");
            return;
        }

        LocalDateTime start = null;
        LocalDateTime end = null;
        for (String value : frame.getColumnValues(column)) {
            if (CellValues.isBlank(value)) continue;
            LocalDateTime parsed = CellValues.parseDateTime(value);
            if (parsed == null) {
                target.put("time_range_valid", false);
                report.addWarning(label + " file has an unparseable time value: '" + value + "'");
                return;
            }
            if (start == null || parsed.isBefore(start)) start = parsed;
            if (end == null || parsed.isAfter(end)) end = parsed;
        }

        if (start == null) {
            target.put("time_range_valid", false);
            report.addWarning(label + " file has no time values");
            return;
        }
        target.put("start_time", start.toString());
        target.put("end_time", end.toString());
        target.put("time_range_valid", true);
    }
}
