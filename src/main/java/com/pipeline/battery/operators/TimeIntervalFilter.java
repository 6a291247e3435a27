package com.pipeline.battery.operators;

import com.pipeline.battery.model.RowFrame;
import com.pipeline.battery.reader.CellValues;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static com.pipeline.battery.model.CanonicalColumns.EXECUTION_TIME;
import static com.pipeline.battery.model.CanonicalColumns.STEP_NUMBER;

/**
 * 时间间隔降采样算子。
 *
 * 按工步分组，组内按执行时间排序后贪心保留：
 * 与上一个保留点的时间差不小于间隔的点被保留，
 * 每个工步的第一个和最后一个采样点总是保留。
 *
 * 参数：
 * - intervalSeconds: 最小时间间隔（秒），0表示不降采样，
 *   超出配置范围时被钳位到[min, max]
 */
public class TimeIntervalFilter {

    private static final Logger log = LoggerFactory.getLogger(TimeIntervalFilter.class);

    private final double minIntervalSeconds;
    private final double maxIntervalSeconds;

    public TimeIntervalFilter(double minIntervalSeconds, double maxIntervalSeconds) {
        if (minIntervalSeconds < 0 || maxIntervalSeconds < minIntervalSeconds) {
            throw new IllegalArgumentException("Invalid interval bounds: ["
                    + minIntervalSeconds + ", " + maxIntervalSeconds + "]");
        }
        this.minIntervalSeconds = minIntervalSeconds;
        this.maxIntervalSeconds = maxIntervalSeconds;
    }

    /**
     * @param frame           已归一化的明细数据帧
     * @param intervalSeconds 最小时间间隔（秒）
     * @return 降采样后的数据帧；间隔为0或缺少分组/时间列时原样返回
     * @throws IllegalArgumentException 间隔为负数
     */
    public RowFrame filter(RowFrame frame, double intervalSeconds) {
        if (intervalSeconds < 0 || Double.isNaN(intervalSeconds)) {
            throw new IllegalArgumentException("Interval must not be negative: " + intervalSeconds);
        }
        if (intervalSeconds == 0 || frame.isEmpty()) {
            return frame;
        }
        if (!frame.hasColumn(STEP_NUMBER) || !frame.hasColumn(EXECUTION_TIME)) {
            log.warn("Cannot downsample: columns '{}' and '{}' are required", STEP_NUMBER, EXECUTION_TIME);
            return frame;
        }

        double interval = clamp(intervalSeconds);
        if (interval != intervalSeconds) {
            log.info("Interval {}s clamped to {}s", intervalSeconds, interval);
        }
        if (interval == 0) {
            return frame;
        }

        // 工步号 -> 该工步的行，保持首次出现顺序
        Map<String, List<Map<String, String>>> partitions = new LinkedHashMap<>();
        for (Map<String, String> row : frame.getRows()) {
            partitions.computeIfAbsent(partitionKey(row.get(STEP_NUMBER)), k -> new ArrayList<>()).add(row);
        }

        List<Map<String, String>> kept = new ArrayList<>();
        for (List<Map<String, String>> rows : partitions.values()) {
            kept.addAll(sample(rows, interval));
        }

        log.info("Downsampled {} -> {} rows ({} steps, interval {}s)",
                frame.size(), kept.size(), partitions.size(), interval);
        return frame.withRows(kept);
    }

    private List<Map<String, String>> sample(List<Map<String, String>> rows, double interval) {
        List<TimedRow> timed = new ArrayList<>();
        List<Map<String, String>> untimed = new ArrayList<>();
        for (Map<String, String> row : rows) {
            Double time = CellValues.tryParseDouble(row.get(EXECUTION_TIME));
            if (time == null) {
                untimed.add(row);
            } else {
                timed.add(new TimedRow(time, row));
            }
        }
        // List.sort是稳定排序，同一时刻的行保持原有顺序
        timed.sort(Comparator.comparingDouble(TimedRow::time));

        List<Map<String, String>> kept = new ArrayList<>();
        int last = timed.size() - 1;
        double lastKeptTime = 0;
        for (int i = 0; i <= last; i++) {
            TimedRow current = timed.get(i);
            if (i == 0 || i == last || current.time() - lastKeptTime >= interval) {
                kept.add(current.row());
                lastKeptTime = current.time();
            }
        }
        // 时间无法解析的行不参与降采样
        kept.addAll(untimed);
        return kept;
    }

    private double clamp(double interval) {
        return Math.max(minIntervalSeconds, Math.min(maxIntervalSeconds, interval));
    }

    private static String partitionKey(String stepNumber) {
        if (stepNumber == null) return "";
        try {
            Integer parsed = CellValues.parseStepNumber(stepNumber);
            return parsed == null ? "" : String.valueOf(parsed);
        } catch (NumberFormatException e) {
            return stepNumber.trim();
        }
    }

    private static final class TimedRow {
        private final double time;
        private final Map<String, String> row;

        TimedRow(double time, Map<String, String> row) {
            this.time = time;
            this.row = row;
        }

        double time() { return time; }
        Map<String, String> row() { return row; }
    }
}
