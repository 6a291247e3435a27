package com.pipeline.battery.model;

import java.util.List;

/**
 * 规范列名。两套表头词汇在入口处统一翻译为这些名称，下游只认规范列。
 */
public final class CanonicalColumns {

    public static final String STEP_NUMBER = "step_number";
    public static final String STEP_TYPE = "step_type";
    public static final String STEP_NAME = "step_name";
    public static final String STATUS = "status";
    public static final String EXECUTION_TIME = "execution_time";
    public static final String TIMESTAMP = "timestamp";
    public static final String VOLTAGE = "voltage";
    public static final String CURRENT = "current";
    public static final String TEMPERATURE = "temperature";
    public static final String CAPACITY = "capacity";
    public static final String ENERGY = "energy";
    public static final String SOC = "soc";

    // 工步汇总字段
    public static final String START_TIME = "start_time";
    public static final String END_TIME = "end_time";
    public static final String DURATION = "duration";
    public static final String VOLTAGE_START = "voltage_start";
    public static final String VOLTAGE_END = "voltage_end";
    public static final String TEMPERATURE_AVG = "temperature_avg";
    public static final String TEMPERATURE_MIN = "temperature_min";
    public static final String TEMPERATURE_MAX = "temperature_max";
    public static final String SOC_START = "soc_start";
    public static final String SOC_END = "soc_end";
    public static final String OCV = "ocv";

    /** 只要源文件存在语义等价列，归一化后必定存在的字段 */
    public static final List<String> GUARANTEED = List.of(
            STEP_NUMBER, EXECUTION_TIME, VOLTAGE, CURRENT, TEMPERATURE, CAPACITY, ENERGY);

    /** 测量导入的必需列 */
    public static final List<String> MEASUREMENT_REQUIRED = List.of(
            STEP_NUMBER, EXECUTION_TIME, VOLTAGE, CURRENT);

    private CanonicalColumns() {}
}
