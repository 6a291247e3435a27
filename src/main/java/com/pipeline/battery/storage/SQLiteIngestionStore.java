package com.pipeline.battery.storage;

import com.pipeline.battery.core.IngestionStore;
import com.pipeline.battery.core.StorageException;
import com.pipeline.battery.core.StoreSession;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.sql.Statement;

/**
 * 基于SQLite的导入存储实现。
 *
 * 核心设计：
 * - 单库文件，实验/工步/测量/已处理文件四张表
 * - 每个会话独占一条连接，关闭自动提交
 * - WAL模式 + busy_timeout，读写互不阻塞
 * - 外键级联删除，删除实验即可清理全部派生数据
 */
public class SQLiteIngestionStore implements IngestionStore {

    private static final Logger log = LoggerFactory.getLogger(SQLiteIngestionStore.class);

    private static final String[] SCHEMA = {
            "CREATE TABLE IF NOT EXISTS experiment ("
                    + "id INTEGER PRIMARY KEY AUTOINCREMENT, "
                    + "name TEXT NOT NULL, "
                    + "description TEXT, "
                    + "battery_type TEXT, "
                    + "nominal_capacity REAL NOT NULL, "
                    + "temperature_avg REAL, "
                    + "operator TEXT, "
                    + "start_date TEXT, "
                    + "end_date TEXT, "
                    + "cell_id INTEGER, "
                    + "machine_id INTEGER, "
                    + "validation_valid INTEGER DEFAULT 0, "
                    + "validation_report TEXT)",

            "CREATE TABLE IF NOT EXISTS step ("
                    + "id INTEGER PRIMARY KEY AUTOINCREMENT, "
                    + "experiment_id INTEGER NOT NULL REFERENCES experiment(id) ON DELETE CASCADE, "
                    + "step_number INTEGER NOT NULL, "
                    + "step_type TEXT NOT NULL, "
                    + "start_time TEXT, "
                    + "end_time TEXT, "
                    + "duration REAL DEFAULT 0.0, "
                    + "voltage_start REAL DEFAULT 0.0, "
                    + "voltage_end REAL DEFAULT 0.0, "
                    + "current REAL DEFAULT 0.0, "
                    + "capacity REAL DEFAULT 0.0, "
                    + "energy REAL DEFAULT 0.0, "
                    + "temperature_avg REAL, "
                    + "temperature_min REAL, "
                    + "temperature_max REAL, "
                    + "c_rate REAL DEFAULT 0.0, "
                    + "soc_start REAL, "
                    + "soc_end REAL, "
                    + "ocv REAL, "
                    + "data_meta TEXT, "
                    + "UNIQUE (experiment_id, step_number))",

            "CREATE TABLE IF NOT EXISTS measurement ("
                    + "id INTEGER PRIMARY KEY AUTOINCREMENT, "
                    + "step_id INTEGER NOT NULL REFERENCES step(id) ON DELETE CASCADE, "
                    + "execution_time REAL NOT NULL, "
                    + "timestamp TEXT, "
                    + "voltage REAL NOT NULL, "
                    + "current REAL NOT NULL, "
                    + "temperature REAL, "
                    + "capacity REAL, "
                    + "energy REAL, "
                    + "soc REAL)",

            "CREATE INDEX IF NOT EXISTS idx_measurement_step_time ON measurement (step_id, execution_time)",

            "CREATE TABLE IF NOT EXISTS processed_file ("
                    + "id INTEGER PRIMARY KEY AUTOINCREMENT, "
                    + "experiment_id INTEGER NOT NULL REFERENCES experiment(id) ON DELETE CASCADE, "
                    + "filename TEXT NOT NULL, "
                    + "file_type TEXT NOT NULL, "
                    + "file_hash TEXT NOT NULL UNIQUE, "
                    + "row_count INTEGER, "
                    + "processed_at TEXT, "
                    + "metadata TEXT)"
    };

    private final String jdbcUrl;

    public SQLiteIngestionStore(String storageRoot, String databaseName) {
        // 确保存储目录存在
        File dir = new File(storageRoot);
        if (!dir.exists() && !dir.mkdirs()) {
            throw new StorageException("Failed to create storage directory: " + storageRoot);
        }
        this.jdbcUrl = "jdbc:sqlite:" + storageRoot + File.separator + databaseName;

        initSchema();
        log.info("SQLiteIngestionStore initialized. Database: {}", jdbcUrl);
    }

    @Override
    public StoreSession openSession() {
        return new SQLiteStoreSession(openConnection());
    }

    @Override
    public void shutdown() {
        // 连接随会话关闭，这里没有常驻资源
        log.info("SQLiteIngestionStore shut down.");
    }

    private void initSchema() {
        try (Connection conn = openConnection(); Statement stmt = conn.createStatement()) {
            for (String ddl : SCHEMA) {
                stmt.execute(ddl);
            }
            conn.commit();
        } catch (SQLException e) {
            throw new StorageException("Failed to initialize schema at " + jdbcUrl, e);
        }
    }

    private Connection openConnection() {
        Connection conn;
        try {
            conn = DriverManager.getConnection(jdbcUrl);
        } catch (SQLException e) {
            throw new StorageException("Failed to open connection to " + jdbcUrl, e);
        }
        try {
            try (Statement stmt = conn.createStatement()) {
                stmt.execute("PRAGMA busy_timeout=30000");
                stmt.execute("PRAGMA foreign_keys=ON");
                stmt.execute("PRAGMA journal_mode=WAL");
                stmt.execute("PRAGMA synchronous=NORMAL");
            }
            conn.setAutoCommit(false);
            return conn;
        } catch (SQLException e) {
            try {
                conn.close();
            } catch (SQLException closeError) {
                e.addSuppressed(closeError);
            }
            throw new StorageException("Failed to configure connection to " + jdbcUrl, e);
        }
    }
}
