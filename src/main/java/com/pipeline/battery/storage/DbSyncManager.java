package com.pipeline.battery.storage;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;

/**
 * 共享数据库同步管理。
 *
 * 数据库文件放在网络共享目录时，写入流程为：
 * 加锁 → 下载到本地 → 本地写入 → 上传回共享目录 → 解锁。
 *
 * 锁是共享库旁边的 {@code <db>.lock} 文件，仅为建议锁：
 * 超过超时时间的锁视为残留并被删除。锁不可重入。
 */
public class DbSyncManager {

    private static final Logger log = LoggerFactory.getLogger(DbSyncManager.class);

    /**
     * 在本地副本上执行的写入逻辑
     */
    @FunctionalInterface
    public interface LocalWrite<T> {
        T write(Path localDbPath) throws IOException;
    }

    private final Path sharedDbPath;
    private final Path localDbPath;
    private final Path lockPath;
    private final Duration lockTimeout;

    public DbSyncManager(Path sharedDbPath, Path localDbPath, Duration lockTimeout) {
        this.sharedDbPath = sharedDbPath;
        this.localDbPath = localDbPath;
        this.lockPath = sharedDbPath.resolveSibling(sharedDbPath.getFileName() + ".lock");
        this.lockTimeout = lockTimeout;
    }

    /**
     * @return 存在未过期的锁时返回true；过期的锁会被删除
     */
    public boolean isLocked() throws IOException {
        if (!Files.exists(lockPath)) {
            return false;
        }
        Instant modified = Files.getLastModifiedTime(lockPath).toInstant();
        Duration age = Duration.between(modified, Instant.now());
        if (age.compareTo(lockTimeout) > 0) {
            log.warn("Removing stale lock {} (age {}s > {}s)", lockPath, age.getSeconds(), lockTimeout.getSeconds());
            Files.deleteIfExists(lockPath);
            return false;
        }
        return true;
    }

    /**
     * @throws DatabaseLockedException 其他进程持有未过期的锁
     */
    public void acquireLock() throws IOException {
        if (isLocked()) {
            throw new DatabaseLockedException("Shared database " + sharedDbPath
                    + " is being written by someone else, try again later");
        }
        String owner = System.getProperty("user.name", "unknown");
        Path parent = lockPath.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        try {
            Files.createFile(lockPath);
        } catch (FileAlreadyExistsException e) {
            // 另一进程在检查之后抢先创建了锁
            throw new DatabaseLockedException("Shared database " + sharedDbPath + " was locked concurrently");
        }
        Files.writeString(lockPath, "locked by " + owner + " at " + LocalDateTime.now(), StandardCharsets.UTF_8);
        log.info("Lock acquired: {}", lockPath);
    }

    public void releaseLock() throws IOException {
        if (Files.deleteIfExists(lockPath)) {
            log.info("Lock released: {}", lockPath);
        }
    }

    /**
     * 将共享库复制到本地。共享库尚不存在时跳过，写入后上传即创建。
     */
    public void download() throws IOException {
        if (!Files.exists(sharedDbPath)) {
            log.info("Shared database {} does not exist yet, starting from local copy", sharedDbPath);
            return;
        }
        Path parent = localDbPath.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Files.copy(sharedDbPath, localDbPath, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.COPY_ATTRIBUTES);
        log.info("Downloaded {} -> {}", sharedDbPath, localDbPath);
    }

    /**
     * 将本地库上传回共享目录，先写临时文件再整体替换。
     */
    public void upload() throws IOException {
        Path temp = sharedDbPath.resolveSibling(sharedDbPath.getFileName() + ".uploading");
        Files.copy(localDbPath, temp, StandardCopyOption.REPLACE_EXISTING);
        Files.move(temp, sharedDbPath, StandardCopyOption.REPLACE_EXISTING);
        log.info("Uploaded {} -> {}", localDbPath, sharedDbPath);
    }

    /**
     * 加锁、下载、写入、上传、解锁。写入失败时不上传，锁总会释放。
     */
    public <T> T safeWrite(LocalWrite<T> action) throws IOException {
        acquireLock();
        try {
            download();
            T result = action.write(localDbPath);
            upload();
            return result;
        } finally {
            releaseLock();
        }
    }

    public Path getLockPath() {
        return lockPath;
    }

    public Path getLocalDbPath() {
        return localDbPath;
    }
}
