package com.pipeline.battery.model;

/**
 * 一次导入运行的最终状态
 */
public enum IngestionStatus {
    /** 全部阶段完成 */
    COMPLETED,
    /** 文件已导入过，未做任何写入 */
    DUPLICATE,
    /** 校验未通过且请求要求遵守校验结果，未做任何写入 */
    INVALID,
    /** 结构性错误中止（缺列、映射不完整、工步号类型错误） */
    ABORTED,
    /** 存储故障 */
    FAILED
}
