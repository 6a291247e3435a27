package com.pipeline.battery.model;

import java.io.Serializable;
import java.time.LocalDateTime;

/**
 * 测量数据导入统计。
 *
 * saved + errors 不一定等于总行数：未映射工步的行计入skipped而非errors。
 */
public class MeasurementIngestResult implements Serializable {
    private int totalRows;
    private int saved;
    private int errors;
    private int skipped;
    private int batchesCommitted;
    private int batchesFailed;
    private boolean cancelled;
    /** 已保存测量中最晚的绝对时间，用于回填实验结束时间 */
    private LocalDateTime lastTimestamp;

    public MeasurementIngestResult() {}

    public MeasurementIngestResult(int totalRows) {
        this.totalRows = totalRows;
    }

    public void addSaved(int count) { this.saved += count; }
    public void addErrors(int count) { this.errors += count; }
    public void addSkipped(int count) { this.skipped += count; }
    public void batchCommitted() { this.batchesCommitted++; }
    public void batchFailed() { this.batchesFailed++; }

    public void offerTimestamp(LocalDateTime timestamp) {
        if (timestamp != null && (lastTimestamp == null || timestamp.isAfter(lastTimestamp))) {
            lastTimestamp = timestamp;
        }
    }

    public int getTotalRows() { return totalRows; }
    public int getSaved() { return saved; }
    public int getErrors() { return errors; }
    public int getSkipped() { return skipped; }
    public int getBatchesCommitted() { return batchesCommitted; }
    public int getBatchesFailed() { return batchesFailed; }
    public boolean isCancelled() { return cancelled; }
    public void setCancelled(boolean cancelled) { this.cancelled = cancelled; }
    public LocalDateTime getLastTimestamp() { return lastTimestamp; }

    @Override
    public String toString() {
        return "MeasurementIngestResult{total=" + totalRows
                + ", saved=" + saved
                + ", errors=" + errors
                + ", skipped=" + skipped
                + ", batches=" + batchesCommitted + "/" + (batchesCommitted + batchesFailed)
                + (cancelled ? ", cancelled" : "") + "}";
    }
}
