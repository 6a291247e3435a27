package com.pipeline.battery.model;

/**
 * 输入文件类型
 */
public enum FileType {
    /** 工步汇总文件 */
    STEP("step"),
    /** 明细测量文件 */
    DETAIL("detail");

    private final String code;

    FileType(String code) {
        this.code = code;
    }

    public String getCode() { return code; }

    public static FileType fromCode(String code) {
        for (FileType type : values()) {
            if (type.code.equalsIgnoreCase(code)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown file type: " + code);
    }
}
