package com.pipeline.battery.core;

/**
 * 数据存储接口 —— 导入流水线的持久化层。
 *
 * 对上层只暴露会话级的CRUD与提交/回滚语义，不假设任何SQL方言。
 * 底层默认由SQLite实现，切换适配层即可对接其他关系数据库。
 *
 * 每次openSession都会拿到一条新的连接，
 * 因此"换一条连接重试"只需重新打开会话。
 */
public interface IngestionStore {

    /**
     * 打开一个新的存储会话。
     * 会话内的写入在commit之前不可见，关闭未提交的会话等同于回滚。
     *
     * @return 新会话，调用方负责关闭
     * @throws StorageException 无法建立连接时抛出
     */
    StoreSession openSession();

    /**
     * 释放存储资源
     */
    void shutdown();
}
