package com.pipeline.battery;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;
import java.util.Properties;

/**
 * 应用配置类。
 * 对应配置文件中的系统级参数，所有键均有默认值。
 */
public class AppConfig {

    private static final Logger log = LoggerFactory.getLogger(AppConfig.class);

    /** 随包发布的默认配置 */
    static final String DEFAULT_RESOURCE = "application.properties";

    private static final String DEFAULT_STEP_REQUIRED = "Step_Index,Step_Type,Step_Name,Status";
    private static final String DEFAULT_DETAIL_REQUIRED = "Date_Time,Voltage,Current";

    // ---- 存储 ----
    private String storageRoot = "data/storage";
    private String databaseName = "battery.db";

    // ---- 测量导入 ----
    private int batchSize = 1000;
    private int voltagePrecision = 3;
    private int currentPrecision = 3;
    private int temperaturePrecision = 1;
    private int capacityPrecision = 3;
    private int energyPrecision = 3;
    private int socPrecision = 1;
    private double defaultTemperature = 25.0;

    // ---- 降采样 ----
    private double intervalMinSeconds = 0.0;
    private double intervalMaxSeconds = 3600.0;

    // ---- 校验 ----
    private List<String> stepRequiredColumns = splitList(DEFAULT_STEP_REQUIRED);
    private List<String> detailRequiredColumns = splitList(DEFAULT_DETAIL_REQUIRED);

    // ---- 去重 ----
    private long dedupRetryDelayMs = 500;

    // ---- 文件读取 ----
    private String csvCharset = "UTF-8";

    // ---- 共享库同步 ----
    private String syncSharedPath;
    private String syncLocalPath;
    private long syncLockTimeoutSeconds = 600;

    public static AppConfig defaults() {
        return new AppConfig();
    }

    /**
     * 从文件加载配置；文件不可读时回退到类路径上的 application.properties
     */
    public static AppConfig load(String configPath) {
        Properties props = new Properties();
        try (InputStream in = new FileInputStream(configPath)) {
            props.load(in);
        } catch (IOException e) {
            log.warn("Failed to load config from {}, using bundled {}. Error: {}",
                    configPath, DEFAULT_RESOURCE, e.getMessage());
            return fromClasspath(DEFAULT_RESOURCE);
        }
        return fromProperties(props);
    }

    /**
     * 从类路径资源加载配置；资源不存在或不可读时使用内置默认值
     */
    public static AppConfig fromClasspath(String resource) {
        Properties props = new Properties();
        try (InputStream in = AppConfig.class.getClassLoader().getResourceAsStream(resource)) {
            if (in == null) {
                log.warn("Config resource {} not found on classpath, using defaults.", resource);
                return defaults();
            }
            props.load(in);
        } catch (IOException e) {
            log.warn("Failed to read config resource {}, using defaults. Error: {}", resource, e.getMessage());
            return defaults();
        }
        return fromProperties(props);
    }

    public static AppConfig fromProperties(Properties props) {
        AppConfig config = new AppConfig();

        config.storageRoot = props.getProperty("storage.root", config.storageRoot);
        config.databaseName = props.getProperty("storage.database", config.databaseName);

        config.batchSize = Integer.parseInt(
                props.getProperty("ingest.batch.size", "1000"));
        config.voltagePrecision = Integer.parseInt(
                props.getProperty("ingest.precision.voltage", "3"));
        config.currentPrecision = Integer.parseInt(
                props.getProperty("ingest.precision.current", "3"));
        config.temperaturePrecision = Integer.parseInt(
                props.getProperty("ingest.precision.temperature", "1"));
        config.capacityPrecision = Integer.parseInt(
                props.getProperty("ingest.precision.capacity", "3"));
        config.energyPrecision = Integer.parseInt(
                props.getProperty("ingest.precision.energy", "3"));
        config.socPrecision = Integer.parseInt(
                props.getProperty("ingest.precision.soc", "1"));
        config.defaultTemperature = Double.parseDouble(
                props.getProperty("ingest.default.temperature", "25.0"));

        config.intervalMinSeconds = Double.parseDouble(
                props.getProperty("filter.interval.min.seconds", "0"));
        config.intervalMaxSeconds = Double.parseDouble(
                props.getProperty("filter.interval.max.seconds", "3600"));

        config.stepRequiredColumns = splitList(
                props.getProperty("validation.step.required", DEFAULT_STEP_REQUIRED));
        config.detailRequiredColumns = splitList(
                props.getProperty("validation.detail.required", DEFAULT_DETAIL_REQUIRED));

        config.dedupRetryDelayMs = Long.parseLong(
                props.getProperty("dedup.retry.delay.ms", "500"));
        config.csvCharset = props.getProperty("csv.charset", config.csvCharset);

        config.syncSharedPath = emptyToNull(props.getProperty("sync.shared.path"));
        config.syncLocalPath = emptyToNull(props.getProperty("sync.local.path"));
        config.syncLockTimeoutSeconds = Long.parseLong(
                props.getProperty("sync.lock.timeout.seconds", "600"));

        if (config.batchSize <= 0) {
            throw new IllegalArgumentException("ingest.batch.size must be positive: " + config.batchSize);
        }
        if (config.intervalMinSeconds < 0 || config.intervalMaxSeconds < config.intervalMinSeconds) {
            throw new IllegalArgumentException("Invalid interval bounds: ["
                    + config.intervalMinSeconds + ", " + config.intervalMaxSeconds + "]");
        }
        return config;
    }

    private static List<String> splitList(String value) {
        List<String> items = new ArrayList<>();
        for (String item : value.split(",")) {
            if (!item.isBlank()) items.add(item.trim());
        }
        return items;
    }

    private static String emptyToNull(String value) {
        return (value == null || value.isBlank()) ? null : value.trim();
    }

    // ---- Getters ----
    public String getStorageRoot() { return storageRoot; }
    public String getDatabaseName() { return databaseName; }
    public int getBatchSize() { return batchSize; }
    public int getVoltagePrecision() { return voltagePrecision; }
    public int getCurrentPrecision() { return currentPrecision; }
    public int getTemperaturePrecision() { return temperaturePrecision; }
    public int getCapacityPrecision() { return capacityPrecision; }
    public int getEnergyPrecision() { return energyPrecision; }
    public int getSocPrecision() { return socPrecision; }
    public double getDefaultTemperature() { return defaultTemperature; }
    public double getIntervalMinSeconds() { return intervalMinSeconds; }
    public double getIntervalMaxSeconds() { return intervalMaxSeconds; }
    public List<String> getStepRequiredColumns() { return stepRequiredColumns; }
    public List<String> getDetailRequiredColumns() { return detailRequiredColumns; }
    public long getDedupRetryDelayMs() { return dedupRetryDelayMs; }
    public String getCsvCharset() { return csvCharset; }
    public String getSyncSharedPath() { return syncSharedPath; }
    public String getSyncLocalPath() { return syncLocalPath; }
    public long getSyncLockTimeoutSeconds() { return syncLockTimeoutSeconds; }

    public boolean isSyncEnabled() {
        return syncSharedPath != null && syncLocalPath != null;
    }

    @Override
    public String toString() {
        return "AppConfig{storage='" + storageRoot + "/" + databaseName + "'"
                + ", batchSize=" + batchSize
                + ", interval=[" + intervalMinSeconds + ", " + intervalMaxSeconds + "]"
                + ", csvCharset=" + csvCharset
                + ", sync=" + (isSyncEnabled() ? syncSharedPath : "off") + "}";
    }
}
