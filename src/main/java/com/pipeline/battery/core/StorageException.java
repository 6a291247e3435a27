package com.pipeline.battery.core;

/**
 * 存储层故障，包装底层的SQLException等异常
 */
public class StorageException extends RuntimeException {

    public StorageException(String message) {
        super(message);
    }

    public StorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
