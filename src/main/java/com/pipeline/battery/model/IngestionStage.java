package com.pipeline.battery.model;

/**
 * 导入流程中已提交的阶段。
 * 各阶段分别提交而非一个全局事务，调用方据此判断需要续跑还是补偿。
 */
public enum IngestionStage {
    /** 实验记录已创建 */
    EXPERIMENT_CREATED,
    /** 工步已提交，映射可用 */
    STEPS_COMMITTED,
    /** 测量数据批次处理完毕（可能存在部分失败批次） */
    MEASUREMENTS_COMMITTED,
    /** 去重台账已写入 */
    PROCESSED_FILES_RECORDED,
    /** 实验结束时间已回填 */
    END_DATE_UPDATED
}
