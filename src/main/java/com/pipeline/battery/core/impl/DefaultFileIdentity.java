package com.pipeline.battery.core.impl;

import com.pipeline.battery.core.FileIdentity;
import com.pipeline.battery.core.IngestionStore;
import com.pipeline.battery.core.StorageException;
import com.pipeline.battery.core.StoreSession;
import com.pipeline.battery.model.FileType;
import com.pipeline.battery.model.ProcessedFile;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * 文件身份默认实现：MD5指纹 + 已处理文件表精确匹配。
 */
public class DefaultFileIdentity implements FileIdentity {

    private static final Logger log = LoggerFactory.getLogger(DefaultFileIdentity.class);

    private final IngestionStore store;

    /** 存储故障后重试前的等待时间（毫秒） */
    private final long retryDelayMs;

    public DefaultFileIdentity(IngestionStore store, long retryDelayMs) {
        this.store = store;
        this.retryDelayMs = retryDelayMs;
    }

    @Override
    public String fingerprint(byte[] content) {
        try {
            MessageDigest md5 = MessageDigest.getInstance("MD5");
            return HexFormat.of().formatHex(md5.digest(content));
        } catch (NoSuchAlgorithmException e) {
            // 每个JRE都必须提供MD5
            throw new IllegalStateException("MD5 digest not available", e);
        }
    }

    @Override
    public boolean isAlreadyProcessed(String fileHash) {
        if (fileHash == null || fileHash.isBlank()) {
            return false;
        }
        try {
            return lookup(fileHash);
        } catch (StorageException first) {
            log.warn("Duplicate check for {} failed, retrying with a fresh session: {}",
                    fileHash, first.getMessage());
        }

        if (!pause()) {
            log.warn("Duplicate check for {} interrupted, treating file as not processed", fileHash);
            return false;
        }
        try {
            return lookup(fileHash);
        } catch (StorageException second) {
            log.warn("Duplicate check for {} failed again, treating file as not processed: {}",
                    fileHash, second.getMessage());
            return false;
        }
    }

    @Override
    public void recordProcessed(long experimentId, String filename, FileType fileType,
                                String fileHash, int rowCount, String metadata) {
        ProcessedFile record = new ProcessedFile(experimentId, filename, fileType, fileHash, rowCount);
        record.setMetadata(metadata);
        try (StoreSession session = store.openSession()) {
            session.insertProcessedFile(record);
            session.commit();
        }
        log.info("Recorded processed {} file '{}' ({} rows, hash {})",
                fileType.getCode(), filename, rowCount, fileHash);
    }

    private boolean lookup(String fileHash) {
        try (StoreSession session = store.openSession()) {
            return session.findProcessedFile(fileHash) != null;
        }
    }

    private boolean pause() {
        if (retryDelayMs <= 0) return true;
        try {
            Thread.sleep(retryDelayMs);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }
}
