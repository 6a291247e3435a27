package com.pipeline.battery.core;

/**
 * 结构性错误：必需列缺失、工步映射不完整、工步号类型转换失败等。
 * 一旦抛出，导入必须在后续写入之前中止。
 */
public class StructuralException extends RuntimeException {

    public StructuralException(String message) {
        super(message);
    }

    public StructuralException(String message, Throwable cause) {
        super(message, cause);
    }
}
