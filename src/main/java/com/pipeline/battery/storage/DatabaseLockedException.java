package com.pipeline.battery.storage;

/**
 * 共享数据库正被其他进程写入
 */
public class DatabaseLockedException extends RuntimeException {

    public DatabaseLockedException(String message) {
        super(message);
    }
}
