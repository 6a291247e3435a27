package com.pipeline.battery.core;

import com.pipeline.battery.model.RowFrame;
import com.pipeline.battery.model.Step;
import com.pipeline.battery.model.StepMapping;

import java.util.Collection;
import java.util.List;

/**
 * 工步登记接口。
 *
 * 将工步数据写入指定实验并在返回前提交，
 * 提交后的工步id是构建工步映射、进而导入测量数据的前提。
 * 仅flush而不提交会留下id被回滚的窗口，因此这里必须commit。
 */
public interface StepRegistrar {

    /**
     * 在自有会话中登记工步并提交
     *
     * @return 已持久化的工步，id均非null
     */
    List<Step> register(long experimentId, RowFrame stepRows, double nominalCapacity);

    /**
     * 在调用方的会话中登记工步并提交该会话
     *
     * @return 已持久化的工步，id均非null
     */
    List<Step> register(StoreSession session, long experimentId, RowFrame stepRows, double nominalCapacity);

    /**
     * 由已提交的工步构建映射
     */
    StepMapping buildMapping(List<Step> steps);

    /**
     * 校验映射覆盖了全部选中的工步号。
     *
     * @throws StructuralException 存在未映射的选中工步时抛出，消息中列出缺失的工步号
     */
    void requireComplete(StepMapping mapping, Collection<Integer> selectedStepNumbers);
}
