package com.pipeline.battery.model;

import java.io.Serializable;

/**
 * 降采样间隔建议
 */
public class IntervalRecommendation implements Serializable {
    private final double intervalSeconds;
    private final String message;
    /** 数据量等级：small / medium / large / very_large */
    private final String sizeCategory;
    private final long dataSize;

    public IntervalRecommendation(double intervalSeconds, String message, String sizeCategory, long dataSize) {
        this.intervalSeconds = intervalSeconds;
        this.message = message;
        this.sizeCategory = sizeCategory;
        this.dataSize = dataSize;
    }

    public double getIntervalSeconds() { return intervalSeconds; }
    public String getMessage() { return message; }
    public String getSizeCategory() { return sizeCategory; }
    public long getDataSize() { return dataSize; }

    @Override
    public String toString() {
        return "IntervalRecommendation{interval=" + intervalSeconds + "s, category=" + sizeCategory
                + ", rows=" + dataSize + "}";
    }
}
