package com.pipeline.battery.core;

import com.pipeline.battery.model.FileType;

/**
 * 文件身份接口 —— 基于内容指纹的重复上传防护。
 *
 * 指纹基于原始字节而非解析后的行计算，
 * 任何字节级差异（包括空白）都会产生不同的指纹。
 * 这是严格的重复上传判定，不是语义等价判定。
 */
public interface FileIdentity {

    /**
     * 计算原始文件内容的指纹
     *
     * @param content 原始字节
     * @return 十六进制指纹字符串
     */
    String fingerprint(byte[] content);

    /**
     * 查询该指纹是否已被导入过。
     * 存储故障时重试一次；重试仍失败则视为未处理（fail-open），
     * 宁可放行也不阻塞导入。
     *
     * @param fileHash 文件指纹
     * @return 已存在精确匹配的记录时返回true
     */
    boolean isAlreadyProcessed(String fileHash);

    /**
     * 写入已处理文件记录。只应在测量数据全部提交之后调用。
     *
     * @throws StorageException 写入失败（例如哈希已存在）时抛出
     */
    void recordProcessed(long experimentId, String filename, FileType fileType,
                         String fileHash, int rowCount, String metadata);
}
