package com.pipeline.battery;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.pipeline.battery.core.IngestionPipeline;
import com.pipeline.battery.core.impl.DefaultFileIdentity;
import com.pipeline.battery.core.impl.DefaultIngestionPipeline;
import com.pipeline.battery.core.impl.DefaultMeasurementIngestor;
import com.pipeline.battery.core.impl.DefaultStepRegistrar;
import com.pipeline.battery.core.impl.DefaultValidationEngine;
import com.pipeline.battery.model.ExperimentMetadata;
import com.pipeline.battery.model.IngestionRequest;
import com.pipeline.battery.model.IngestionRun;
import com.pipeline.battery.model.IngestionStatus;
import com.pipeline.battery.model.UploadedFile;
import com.pipeline.battery.operators.ColumnNormalizer;
import com.pipeline.battery.operators.IntervalRecommender;
import com.pipeline.battery.operators.TimeIntervalFilter;
import com.pipeline.battery.reader.CsvFrameReader;
import com.pipeline.battery.storage.DbSyncManager;
import com.pipeline.battery.storage.SQLiteIngestionStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.Charset;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.time.LocalDateTime;

/**
 * 系统启动引导类。
 * 创建存储、组装流水线各环节，并提供命令行导入入口。
 *
 * 用法：java -jar battery-etl.jar &lt;配置文件&gt; &lt;step.csv&gt; &lt;detail.csv&gt; &lt;实验名称&gt; &lt;标称容量Ah&gt; [降采样间隔秒]
 */
public class BatteryEtlApplication {

    private static final Logger log = LoggerFactory.getLogger(BatteryEtlApplication.class);

    private SQLiteIngestionStore store;
    private IngestionPipeline pipeline;

    /**
     * 使用配置中的存储位置启动
     */
    public IngestionPipeline start(AppConfig config) {
        return start(config, Paths.get(config.getStorageRoot(), config.getDatabaseName()));
    }

    /**
     * 使用指定的数据库文件启动，共享库同步时指向本地副本
     */
    public IngestionPipeline start(AppConfig config, Path databaseFile) {
        log.info("=== Battery Test Data ETL ===");
        log.info("Starting with config: {}", config);

        // 1. 初始化存储层
        Path root = databaseFile.toAbsolutePath().getParent();
        store = new SQLiteIngestionStore(root.toString(), databaseFile.getFileName().toString());

        // 2. 组装各环节
        ObjectMapper objectMapper = new ObjectMapper();
        ColumnNormalizer normalizer = new ColumnNormalizer();
        pipeline = new DefaultIngestionPipeline(
                store,
                new DefaultFileIdentity(store, config.getDedupRetryDelayMs()),
                new CsvFrameReader(Charset.forName(config.getCsvCharset())),
                normalizer,
                new DefaultValidationEngine(
                        config.getStepRequiredColumns(),
                        config.getDetailRequiredColumns(),
                        normalizer),
                new DefaultStepRegistrar(store, objectMapper),
                new TimeIntervalFilter(config.getIntervalMinSeconds(), config.getIntervalMaxSeconds()),
                new IntervalRecommender(),
                new DefaultMeasurementIngestor(config),
                objectMapper,
                config.getBatchSize()
        );

        log.info("=== Pipeline ready ===");
        return pipeline;
    }

    public IngestionRun ingest(IngestionRequest request) {
        if (pipeline == null) {
            throw new IllegalStateException("Application has not been started");
        }
        return pipeline.run(request);
    }

    public void shutdown() {
        if (store != null) {
            store.shutdown();
            store = null;
        }
        pipeline = null;
        log.info("=== Battery ETL shut down ===");
    }

    /**
     * 执行一次导入。配置了共享库时在同步锁内完成。
     */
    static IngestionRun runOnce(AppConfig config, IngestionRequest request) throws IOException {
        BatteryEtlApplication app = new BatteryEtlApplication();
        if (!config.isSyncEnabled()) {
            app.start(config);
            try {
                return app.ingest(request);
            } finally {
                app.shutdown();
            }
        }

        DbSyncManager sync = new DbSyncManager(
                Paths.get(config.getSyncSharedPath()),
                Paths.get(config.getSyncLocalPath()),
                Duration.ofSeconds(config.getSyncLockTimeoutSeconds()));
        return sync.safeWrite(localDb -> {
            app.start(config, localDb);
            try {
                return app.ingest(request);
            } finally {
                app.shutdown();
            }
        });
    }

    static IngestionRequest parseRequest(String[] args) throws IOException {
        UploadedFile stepFile = UploadedFile.fromPath(Paths.get(args[1]));
        UploadedFile detailFile = UploadedFile.fromPath(Paths.get(args[2]));
        double nominalCapacity = Double.parseDouble(args[4]);

        IngestionRequest request = new IngestionRequest(stepFile, detailFile, nominalCapacity,
                new ExperimentMetadata(args[3], LocalDateTime.now()));
        if (args.length > 5) {
            request.setIntervalSeconds(Double.parseDouble(args[5]));
        }
        return request;
    }

    /**
     * 应用入口
     */
    public static void main(String[] args) {
        if (args.length < 5) {
            System.err.println("Usage: java -jar battery-etl.jar <config.properties> <step.csv> <detail.csv> "
                    + "<experiment-name> <nominal-capacity> [interval-seconds]");
            System.exit(2);
        }

        AppConfig config = AppConfig.load(args[0]);
        IngestionRun run;
        try {
            run = runOnce(config, parseRequest(args));
        } catch (IOException | RuntimeException e) {
            log.error("Ingestion failed: {}", e.getMessage(), e);
            System.exit(1);
            return;
        }

        System.out.println(run);
        boolean ok = run.getStatus() == IngestionStatus.COMPLETED || run.getStatus() == IngestionStatus.DUPLICATE;
        System.exit(ok ? 0 : 1);
    }
}
