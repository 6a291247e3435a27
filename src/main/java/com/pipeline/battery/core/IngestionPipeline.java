package com.pipeline.battery.core;

import com.pipeline.battery.model.IngestionRequest;
import com.pipeline.battery.model.IngestionRun;

/**
 * 导入流水线接口 —— 串联去重、解析、归一化、校验、工步登记、降采样与测量导入。
 *
 * 单次运行单线程顺序执行。同一实验不应被并发导入，系统内部不为此加锁。
 */
public interface IngestionPipeline {

    /**
     * 执行一次导入
     *
     * @param request 导入请求
     * @return 运行结果，列出已提交的阶段；结构性错误与存储故障以状态形式返回
     */
    IngestionRun run(IngestionRequest request);
}
