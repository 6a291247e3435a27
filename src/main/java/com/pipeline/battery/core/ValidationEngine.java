package com.pipeline.battery.core;

import com.pipeline.battery.model.RowFrame;
import com.pipeline.battery.model.ValidationReport;

/**
 * 校验引擎接口。
 *
 * 对工步文件与明细文件做结构、统计、分类和时间范围检查，
 * 生成分级报告。报告是建议性的：引擎本身从不拦截导入，
 * overallValid为false时是否继续由调用方决定。
 */
public interface ValidationEngine {

    /**
     * @param stepFrame   工步数据帧
     * @param detailFrame 明细数据帧
     * @return 校验报告，任何输入都不会抛出异常
     */
    ValidationReport validate(RowFrame stepFrame, RowFrame detailFrame);
}
