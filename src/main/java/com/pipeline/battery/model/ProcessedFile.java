package com.pipeline.battery.model;

import java.io.Serializable;
import java.time.LocalDateTime;

/**
 * 已处理文件记录，是去重判定的唯一依据。
 * file_hash 全局唯一，已存在的哈希不允许再次导入。
 */
public class ProcessedFile implements Serializable {
    private Long id;
    private long experimentId;
    private String filename;
    private FileType fileType;
    private String fileHash;
    private int rowCount;
    private LocalDateTime processedAt;
    /** 文件元数据（JSON） */
    private String metadata;

    public ProcessedFile() {}

    public ProcessedFile(long experimentId, String filename, FileType fileType, String fileHash, int rowCount) {
        this.experimentId = experimentId;
        this.filename = filename;
        this.fileType = fileType;
        this.fileHash = fileHash;
        this.rowCount = rowCount;
        this.processedAt = LocalDateTime.now();
    }

    public Long getId() { return id; }
    public void setId(Long id) { this.id = id; }
    public long getExperimentId() { return experimentId; }
    public void setExperimentId(long experimentId) { this.experimentId = experimentId; }
    public String getFilename() { return filename; }
    public void setFilename(String filename) { this.filename = filename; }
    public FileType getFileType() { return fileType; }
    public void setFileType(FileType fileType) { this.fileType = fileType; }
    public String getFileHash() { return fileHash; }
    public void setFileHash(String fileHash) { this.fileHash = fileHash; }
    public int getRowCount() { return rowCount; }
    public void setRowCount(int rowCount) { this.rowCount = rowCount; }
    public LocalDateTime getProcessedAt() { return processedAt; }
    public void setProcessedAt(LocalDateTime processedAt) { this.processedAt = processedAt; }
    public String getMetadata() { return metadata; }
    public void setMetadata(String metadata) { this.metadata = metadata; }
}
