package com.pipeline.battery.operators;

import com.pipeline.battery.model.RowFrame;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.AbstractMap.SimpleImmutableEntry;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static com.pipeline.battery.model.CanonicalColumns.*;

/**
 * 表头归一化算子。
 *
 * 设备导出有三套表头词汇：英文下划线风格（Step_Index、Voltage）、
 * 仪器导出风格（Step Index、Voltage [V]）和中英混合风格（工步、電壓(V)）。
 * 本算子按声明顺序查表，把第一个出现的等价列复制为规范列。
 *
 * 规则：
 * - 只在规范列缺失时复制，已存在的规范列不会被覆盖
 * - 原始列保留，无法识别的列原样透传
 */
public class ColumnNormalizer {

    private static final Logger log = LoggerFactory.getLogger(ColumnNormalizer.class);

    /** 等价列 -> 规范列，按优先级排列 */
    private static final List<Map.Entry<String, String>> ALIASES = List.of(
            alias("Step_Index", STEP_NUMBER),
            alias("Step Index", STEP_NUMBER),
            alias("工步", STEP_NUMBER),

            alias("Step_Type", STEP_TYPE),
            alias("Step Type", STEP_TYPE),
            alias("工步種類", STEP_TYPE),
            alias("工步种类", STEP_TYPE),

            alias("Step_Name", STEP_NAME),
            alias("Step Name", STEP_NAME),
            alias("工步名稱", STEP_NAME),

            alias("Status", STATUS),
            alias("狀態", STATUS),

            alias("Step_Time", EXECUTION_TIME),
            alias("Step Time [s]", EXECUTION_TIME),
            alias("工步執行時間(秒)", EXECUTION_TIME),
            alias("工步执行时间(秒)", EXECUTION_TIME),

            alias("Date_Time", TIMESTAMP),
            alias("DateTime [s]", TIMESTAMP),
            alias("DateTime", TIMESTAMP),
            alias("絕對時間", TIMESTAMP),

            alias("Voltage", VOLTAGE),
            alias("Voltage [V]", VOLTAGE),
            alias("電壓(V)", VOLTAGE),
            alias("电压(V)", VOLTAGE),

            alias("Current", CURRENT),
            alias("Current [A]", CURRENT),
            alias("電流(A)", CURRENT),
            alias("电流(A)", CURRENT),

            alias("Temperature", TEMPERATURE),
            alias("Aux T1 [oC]", TEMPERATURE),
            alias("Aux T1", TEMPERATURE),
            alias("T", TEMPERATURE),

            alias("Capacity", CAPACITY),
            alias("Capacity [Ah]", CAPACITY),
            alias("電量(Ah)", CAPACITY),
            alias("电量(Ah)", CAPACITY),

            alias("Energy", ENERGY),
            alias("Energy [Wh]", ENERGY),
            alias("能量(Wh)", ENERGY),

            alias("SOC", SOC),
            alias("SOC [%]", SOC),

            alias("Start_Time", START_TIME),
            alias("Start DateTime [s]", START_TIME),
            alias("End_Time", END_TIME),
            alias("End DateTime [s]", END_TIME),
            alias("Duration", DURATION),
            alias("Start_Voltage", VOLTAGE_START),
            alias("Start Voltage [V]", VOLTAGE_START),
            alias("End_Voltage", VOLTAGE_END),
            alias("End Voltage [V]", VOLTAGE_END),
            alias("OCV", OCV),
            alias("OCV [V]", OCV));

    private static final Map<String, String> CANONICAL_BY_ALIAS;

    static {
        Map<String, String> lookup = new LinkedHashMap<>();
        for (Map.Entry<String, String> entry : ALIASES) {
            lookup.putIfAbsent(entry.getKey(), entry.getValue());
            lookup.putIfAbsent(entry.getValue(), entry.getValue());
        }
        CANONICAL_BY_ALIAS = Collections.unmodifiableMap(lookup);
    }

    private static Map.Entry<String, String> alias(String alternate, String canonical) {
        return new SimpleImmutableEntry<>(alternate, canonical);
    }

    /**
     * 归一化表头
     *
     * @param frame 原始数据帧，不会被修改
     * @return 补齐规范列后的新数据帧
     */
    public RowFrame normalize(RowFrame frame) {
        RowFrame result = frame.copy();
        List<String> copied = new ArrayList<>();
        for (Map.Entry<String, String> entry : ALIASES) {
            if (result.copyColumn(entry.getKey(), entry.getValue())) {
                copied.add(entry.getKey() + "->" + entry.getValue());
            }
        }
        if (!copied.isEmpty()) {
            log.debug("Normalized columns: {}", copied);
        }
        return result;
    }

    /**
     * 查询表头对应的规范列名
     *
     * @return 规范列名；表头本身是规范列时返回其自身；无法识别时返回null
     */
    public String canonicalOf(String header) {
        if (header == null) return null;
        return CANONICAL_BY_ALIAS.get(header.trim());
    }
}
