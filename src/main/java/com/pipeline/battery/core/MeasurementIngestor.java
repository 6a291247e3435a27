package com.pipeline.battery.core;

import com.pipeline.battery.model.MeasurementIngestResult;
import com.pipeline.battery.model.RowFrame;
import com.pipeline.battery.model.StepMapping;

/**
 * 测量数据导入接口。
 *
 * 按固定大小分批写入，每批独立提交：某批失败只回滚该批，
 * 之前已提交的批次保持有效。行级问题只计数不抛出，
 * 只有结构性问题（缺列、工步号类型错误、映射为空或不属于本实验）才会抛出。
 */
public interface MeasurementIngestor {

    int DEFAULT_BATCH_SIZE = 1000;

    /**
     * 写入前的结构检查：必需列齐全，且每行工步号都能转为整数。
     * 不访问存储，调用方应在创建实验之前调用。
     *
     * @return 每行的整数工步号，与数据帧行序一致
     * @throws StructuralException 缺少必需列或工步号无法转换
     */
    int[] checkFrame(RowFrame detailFrame);

    /**
     * @param session         存储会话，每批结束时提交
     * @param experimentId    所属实验
     * @param detailFrame     已归一化的明细数据帧
     * @param stepMapping     工步号 → 工步id 映射
     * @param nominalCapacity 标称容量（Ah）
     * @param batchSize       批大小
     * @return 导入统计
     * @throws StructuralException 结构性错误，发生在任何写入之前
     */
    MeasurementIngestResult ingest(StoreSession session, long experimentId, RowFrame detailFrame,
                                   StepMapping stepMapping, double nominalCapacity, int batchSize);

    default MeasurementIngestResult ingest(StoreSession session, long experimentId, RowFrame detailFrame,
                                           StepMapping stepMapping, double nominalCapacity) {
        return ingest(session, experimentId, detailFrame, stepMapping, nominalCapacity, DEFAULT_BATCH_SIZE);
    }
}
