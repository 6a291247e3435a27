package com.pipeline.battery.model;

import java.util.Locale;

/**
 * 工步类型归一化。
 * 设备导出的类型标签五花八门（CC_Chg、CCCV_Chg、CC放電、Rest、Pause……），
 * 入库前统一映射为 charge / discharge / rest。
 */
public enum StepType {
    CHARGE("charge"),
    DISCHARGE("discharge"),
    REST("rest");

    private final String label;

    StepType(String label) {
        this.label = label;
    }

    public String getLabel() { return label; }

    /**
     * 将源标签映射为归一化标签。
     * 无法识别的标签去除首尾空白后原样返回；空白标签返回null。
     */
    public static String normalizeLabel(String raw) {
        if (raw == null || raw.isBlank()) return null;
        String trimmed = raw.trim();
        String lower = trimmed.toLowerCase(Locale.ROOT);

        // 放电必须先于充电判断："dchg" 同时包含 "chg"
        if (lower.contains("dchg") || lower.contains("discharge") || trimmed.contains("放電") || trimmed.contains("放电")) {
            return DISCHARGE.label;
        }
        if (lower.contains("chg") || lower.contains("charge") || trimmed.contains("充電") || trimmed.contains("充电")) {
            return CHARGE.label;
        }
        if (lower.contains("rest") || lower.contains("pause") || trimmed.contains("靜置") || trimmed.contains("静置")
                || trimmed.contains("擱置") || trimmed.contains("搁置")) {
            return REST.label;
        }
        return trimmed;
    }
}
