package com.pipeline.battery.operators;

import com.pipeline.battery.model.IntervalRecommendation;

/**
 * 根据明细数据量与测试类型给出降采样间隔建议。
 *
 * 数据量分级：
 * - small (≤1K行)：0s，保留全部数据
 * - medium (≤10K行)：1s
 * - large (≤100K行)：10s
 * - very_large：60s
 *
 * 指定测试类型时，基于数据量的建议超过该类型上限则取上限，
 * 否则取基础建议与类型推荐值中的较大者。
 */
public class IntervalRecommender {

    private static final long SMALL_THRESHOLD = 1_000;
    private static final long MEDIUM_THRESHOLD = 10_000;
    private static final long LARGE_THRESHOLD = 100_000;

    /**
     * 测试数据类型
     */
    public enum TestDataType {
        CHARGE_DISCHARGE_CYCLE("charge_discharge_cycle", 1.0, 10.0, "充放电循环需要保留足够的电压电流变化细节"),
        CAPACITY_TEST("capacity_test", 5.0, 30.0, "容量测试重点关注容量变化趋势"),
        IMPEDANCE_TEST("impedance_test", 0.1, 1.0, "阻抗测试需要高频响应数据"),
        AGING_TEST("aging_test", 60.0, 300.0, "老化测试关注长期趋势变化"),
        TEMPERATURE_TEST("temperature_test", 10.0, 60.0, "温度测试需要监控温度响应");

        private final String code;
        private final double recommendedInterval;
        private final double maxRecommended;
        private final String reason;

        TestDataType(String code, double recommendedInterval, double maxRecommended, String reason) {
            this.code = code;
            this.recommendedInterval = recommendedInterval;
            this.maxRecommended = maxRecommended;
            this.reason = reason;
        }

        public String getCode() { return code; }
        public double getRecommendedInterval() { return recommendedInterval; }
        public double getMaxRecommended() { return maxRecommended; }
        public String getReason() { return reason; }

        /** @return 对应的类型；未知代码返回null */
        public static TestDataType fromCode(String code) {
            if (code == null) return null;
            for (TestDataType type : values()) {
                if (type.code.equalsIgnoreCase(code.trim())) return type;
            }
            return null;
        }
    }

    public IntervalRecommendation recommend(long dataSize) {
        return recommend(dataSize, null);
    }

    public IntervalRecommendation recommend(long dataSize, TestDataType dataType) {
        String category;
        double baseInterval;
        String baseMessage;
        if (dataSize <= SMALL_THRESHOLD) {
            category = "small";
            baseInterval = 0.0;
            baseMessage = "数据量较小，建议保留所有数据点";
        } else if (dataSize <= MEDIUM_THRESHOLD) {
            category = "medium";
            baseInterval = 1.0;
            baseMessage = "中等数据量，建议1秒间隔筛选";
        } else if (dataSize <= LARGE_THRESHOLD) {
            category = "large";
            baseInterval = 10.0;
            baseMessage = "大数据量，建议10秒间隔筛选";
        } else {
            category = "very_large";
            baseInterval = 60.0;
            baseMessage = "超大数据量，建议1分钟间隔筛选";
        }

        if (dataType == null) {
            return new IntervalRecommendation(baseInterval, baseMessage, category, dataSize);
        }
        if (baseInterval > dataType.getMaxRecommended()) {
            return new IntervalRecommendation(dataType.getMaxRecommended(),
                    "根据数据类型 '" + dataType.getCode() + "' 调整: " + dataType.getReason(),
                    category, dataSize);
        }
        return new IntervalRecommendation(Math.max(baseInterval, dataType.getRecommendedInterval()),
                baseMessage, category, dataSize);
    }
}
