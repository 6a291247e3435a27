package com.pipeline.battery.core;

import com.pipeline.battery.model.Experiment;
import com.pipeline.battery.model.Measurement;
import com.pipeline.battery.model.ProcessedFile;
import com.pipeline.battery.model.Step;

import java.time.LocalDateTime;
import java.util.Collection;
import java.util.List;

/**
 * 存储会话 —— 一个事务作用域。
 *
 * 所有方法在失败时抛出{@link StorageException}。
 * 插入方法会将生成的主键回写到传入的实体上。
 */
public interface StoreSession extends AutoCloseable {

    /**
     * 插入实验记录并回写id
     *
     * @return 新实验id
     */
    long insertExperiment(Experiment experiment);

    /**
     * @return 实验记录；不存在时返回null
     */
    Experiment findExperiment(long experimentId);

    void updateExperimentEndDate(long experimentId, LocalDateTime endDate);

    /**
     * 批量插入工步并逐个回写id
     */
    void insertSteps(List<Step> steps);

    /**
     * @return 指定实验的全部工步，按工步号升序
     */
    List<Step> findSteps(long experimentId);

    /**
     * 批量插入测量数据。测量数据量大，不回写id。
     */
    void insertMeasurements(List<Measurement> measurements);

    /**
     * @return 指定工步的测量数据，按工步、执行时间升序
     */
    List<Measurement> findMeasurements(Collection<Long> stepIds);

    long countMeasurements(long experimentId);

    void insertProcessedFile(ProcessedFile processedFile);

    /**
     * @return 哈希精确匹配的已处理文件记录；不存在时返回null
     */
    ProcessedFile findProcessedFile(String fileHash);

    /**
     * 删除实验及其全部工步、测量和已处理文件记录。
     * 用于对中途失败的导入进行补偿。
     *
     * @return 是否删除了实验记录
     */
    boolean deleteExperiment(long experimentId);

    void commit();

    void rollback();

    /**
     * 关闭会话；未提交的修改被丢弃
     */
    @Override
    void close();
}
