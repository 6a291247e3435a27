package com.pipeline.battery.model;

import java.io.IOException;
import java.io.Serializable;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/**
 * 待导入的原始文件：文件名 + 原始字节
 */
public final class UploadedFile implements Serializable {
    private final String filename;
    private final byte[] content;

    public UploadedFile(String filename, byte[] content) {
        this.filename = Objects.requireNonNull(filename, "filename");
        this.content = Objects.requireNonNull(content, "content");
    }

    public static UploadedFile fromPath(Path path) throws IOException {
        return new UploadedFile(path.getFileName().toString(), Files.readAllBytes(path));
    }

    public String getFilename() { return filename; }
    public byte[] getContent() { return content; }
    public int size() { return content.length; }
}
