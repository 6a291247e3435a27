package com.pipeline.battery.storage;

import com.pipeline.battery.core.StorageException;
import com.pipeline.battery.core.StoreSession;
import com.pipeline.battery.model.Experiment;
import com.pipeline.battery.model.FileType;
import com.pipeline.battery.model.Measurement;
import com.pipeline.battery.model.ProcessedFile;
import com.pipeline.battery.model.Step;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Types;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;

/**
 * SQLite存储会话，持有一条关闭自动提交的连接
 */
class SQLiteStoreSession implements StoreSession {

    private static final Logger log = LoggerFactory.getLogger(SQLiteStoreSession.class);

    private final Connection conn;

    SQLiteStoreSession(Connection conn) {
        this.conn = conn;
    }

    // ==================== 实验 ====================

    @Override
    public long insertExperiment(Experiment experiment) {
        String sql = "INSERT INTO experiment (name, description, battery_type, nominal_capacity, temperature_avg, "
                + "operator, start_date, end_date, cell_id, machine_id, validation_valid, validation_report) "
                + "VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)";
        try (PreparedStatement stmt = conn.prepareStatement(sql)) {
            stmt.setString(1, experiment.getName());
            stmt.setString(2, experiment.getDescription());
            stmt.setString(3, experiment.getBatteryType());
            stmt.setDouble(4, experiment.getNominalCapacity());
            setDouble(stmt, 5, experiment.getTemperatureAvg());
            stmt.setString(6, experiment.getOperator());
            stmt.setString(7, formatTime(experiment.getStartDate()));
            stmt.setString(8, formatTime(experiment.getEndDate()));
            setLong(stmt, 9, experiment.getCellId());
            setLong(stmt, 10, experiment.getMachineId());
            stmt.setInt(11, experiment.isValidationValid() ? 1 : 0);
            stmt.setString(12, experiment.getValidationReport());
            stmt.executeUpdate();

            long id = lastInsertId();
            experiment.setId(id);
            return id;
        } catch (SQLException e) {
            throw new StorageException("Failed to insert experiment '" + experiment.getName() + "'", e);
        }
    }

    @Override
    public Experiment findExperiment(long experimentId) {
        try (PreparedStatement stmt = conn.prepareStatement("SELECT * FROM experiment WHERE id = ?")) {
            stmt.setLong(1, experimentId);
            try (ResultSet rs = stmt.executeQuery()) {
                return rs.next() ? mapExperiment(rs) : null;
            }
        } catch (SQLException e) {
            throw new StorageException("Failed to query experiment " + experimentId, e);
        }
    }

    @Override
    public void updateExperimentEndDate(long experimentId, LocalDateTime endDate) {
        try (PreparedStatement stmt = conn.prepareStatement("UPDATE experiment SET end_date = ? WHERE id = ?")) {
            stmt.setString(1, formatTime(endDate));
            stmt.setLong(2, experimentId);
            if (stmt.executeUpdate() == 0) {
                throw new StorageException("Experiment " + experimentId + " does not exist");
            }
        } catch (SQLException e) {
            throw new StorageException("Failed to update end date of experiment " + experimentId, e);
        }
    }

    @Override
    public boolean deleteExperiment(long experimentId) {
        try (PreparedStatement stmt = conn.prepareStatement("DELETE FROM experiment WHERE id = ?")) {
            stmt.setLong(1, experimentId);
            int affected = stmt.executeUpdate();
            if (affected > 0) {
                log.info("Experiment {} deleted with its steps, measurements and file records.", experimentId);
            }
            return affected > 0;
        } catch (SQLException e) {
            throw new StorageException("Failed to delete experiment " + experimentId, e);
        }
    }

    // ==================== 工步 ====================

    @Override
    public void insertSteps(List<Step> steps) {
        String sql = "INSERT INTO step (experiment_id, step_number, step_type, start_time, end_time, duration, "
                + "voltage_start, voltage_end, current, capacity, energy, temperature_avg, temperature_min, "
                + "temperature_max, c_rate, soc_start, soc_end, ocv, data_meta) "
                + "VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)";
        try (PreparedStatement stmt = conn.prepareStatement(sql)) {
            for (Step step : steps) {
                stmt.setLong(1, step.getExperimentId());
                stmt.setInt(2, step.getStepNumber());
                stmt.setString(3, step.getStepType());
                stmt.setString(4, formatTime(step.getStartTime()));
                stmt.setString(5, formatTime(step.getEndTime()));
                stmt.setDouble(6, step.getDuration());
                stmt.setDouble(7, step.getVoltageStart());
                stmt.setDouble(8, step.getVoltageEnd());
                stmt.setDouble(9, step.getCurrent());
                stmt.setDouble(10, step.getCapacity());
                stmt.setDouble(11, step.getEnergy());
                setDouble(stmt, 12, step.getTemperatureAvg());
                setDouble(stmt, 13, step.getTemperatureMin());
                setDouble(stmt, 14, step.getTemperatureMax());
                stmt.setDouble(15, step.getCRate());
                setDouble(stmt, 16, step.getSocStart());
                setDouble(stmt, 17, step.getSocEnd());
                setDouble(stmt, 18, step.getOcv());
                stmt.setString(19, step.getDataMeta());
                stmt.executeUpdate();
                step.setId(lastInsertId());
            }
        } catch (SQLException e) {
            throw new StorageException("Failed to insert steps", e);
        }
    }

    @Override
    public List<Step> findSteps(long experimentId) {
        List<Step> steps = new ArrayList<>();
        try (PreparedStatement stmt = conn.prepareStatement(
                "SELECT * FROM step WHERE experiment_id = ? ORDER BY step_number ASC")) {
            stmt.setLong(1, experimentId);
            try (ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    steps.add(mapStep(rs));
                }
            }
            return steps;
        } catch (SQLException e) {
            throw new StorageException("Failed to query steps of experiment " + experimentId, e);
        }
    }

    // ==================== 测量数据 ====================

    @Override
    public void insertMeasurements(List<Measurement> measurements) {
        if (measurements.isEmpty()) return;
        String sql = "INSERT INTO measurement (step_id, execution_time, timestamp, voltage, current, "
                + "temperature, capacity, energy, soc) VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?)";
        try (PreparedStatement stmt = conn.prepareStatement(sql)) {
            for (Measurement m : measurements) {
                stmt.setLong(1, m.getStepId());
                stmt.setDouble(2, m.getExecutionTime());
                stmt.setString(3, formatTime(m.getTimestamp()));
                stmt.setDouble(4, m.getVoltage());
                stmt.setDouble(5, m.getCurrent());
                stmt.setDouble(6, m.getTemperature());
                stmt.setDouble(7, m.getCapacity());
                stmt.setDouble(8, m.getEnergy());
                setDouble(stmt, 9, m.getSoc());
                stmt.addBatch();
            }
            stmt.executeBatch();
        } catch (SQLException e) {
            throw new StorageException("Failed to insert " + measurements.size() + " measurements", e);
        }
    }

    @Override
    public List<Measurement> findMeasurements(Collection<Long> stepIds) {
        if (stepIds.isEmpty()) return Collections.emptyList();
        String placeholders = String.join(", ", Collections.nCopies(stepIds.size(), "?"));
        String sql = "SELECT * FROM measurement WHERE step_id IN (" + placeholders + ") "
                + "ORDER BY step_id ASC, execution_time ASC, id ASC";
        List<Measurement> result = new ArrayList<>();
        try (PreparedStatement stmt = conn.prepareStatement(sql)) {
            int index = 1;
            for (Long stepId : stepIds) {
                stmt.setLong(index++, stepId);
            }
            try (ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    result.add(mapMeasurement(rs));
                }
            }
            return result;
        } catch (SQLException e) {
            throw new StorageException("Failed to query measurements", e);
        }
    }

    @Override
    public long countMeasurements(long experimentId) {
        String sql = "SELECT COUNT(*) FROM measurement m JOIN step s ON m.step_id = s.id WHERE s.experiment_id = ?";
        try (PreparedStatement stmt = conn.prepareStatement(sql)) {
            stmt.setLong(1, experimentId);
            try (ResultSet rs = stmt.executeQuery()) {
                return rs.next() ? rs.getLong(1) : 0L;
            }
        } catch (SQLException e) {
            throw new StorageException("Failed to count measurements of experiment " + experimentId, e);
        }
    }

    // ==================== 已处理文件 ====================

    @Override
    public void insertProcessedFile(ProcessedFile file) {
        String sql = "INSERT INTO processed_file (experiment_id, filename, file_type, file_hash, row_count, "
                + "processed_at, metadata) VALUES (?, ?, ?, ?, ?, ?, ?)";
        try (PreparedStatement stmt = conn.prepareStatement(sql)) {
            stmt.setLong(1, file.getExperimentId());
            stmt.setString(2, file.getFilename());
            stmt.setString(3, file.getFileType().getCode());
            stmt.setString(4, file.getFileHash());
            stmt.setInt(5, file.getRowCount());
            stmt.setString(6, formatTime(file.getProcessedAt()));
            stmt.setString(7, file.getMetadata());
            stmt.executeUpdate();
            file.setId(lastInsertId());
        } catch (SQLException e) {
            throw new StorageException("Failed to record processed file '" + file.getFilename() + "'", e);
        }
    }

    @Override
    public ProcessedFile findProcessedFile(String fileHash) {
        try (PreparedStatement stmt = conn.prepareStatement("SELECT * FROM processed_file WHERE file_hash = ?")) {
            stmt.setString(1, fileHash);
            try (ResultSet rs = stmt.executeQuery()) {
                return rs.next() ? mapProcessedFile(rs) : null;
            }
        } catch (SQLException e) {
            throw new StorageException("Failed to query processed file " + fileHash, e);
        }
    }

    // ==================== 事务 ====================

    @Override
    public void commit() {
        try {
            conn.commit();
        } catch (SQLException e) {
            throw new StorageException("Commit failed", e);
        }
    }

    @Override
    public void rollback() {
        try {
            conn.rollback();
        } catch (SQLException e) {
            throw new StorageException("Rollback failed", e);
        }
    }

    @Override
    public void close() {
        try {
            // 丢弃未提交的修改
            conn.rollback();
        } catch (SQLException e) {
            log.warn("Rollback on close failed: {}", e.getMessage());
        }
        try {
            conn.close();
        } catch (SQLException e) {
            log.warn("Failed to close connection: {}", e.getMessage());
        }
    }

    // ==================== 内部工具方法 ====================

    private long lastInsertId() throws SQLException {
        try (Statement stmt = conn.createStatement();
             ResultSet rs = stmt.executeQuery("SELECT last_insert_rowid()")) {
            if (!rs.next()) {
                throw new SQLException("last_insert_rowid() returned no row");
            }
            return rs.getLong(1);
        }
    }

    private static void setDouble(PreparedStatement stmt, int index, Double value) throws SQLException {
        if (value == null) {
            stmt.setNull(index, Types.REAL);
        } else {
            stmt.setDouble(index, value);
        }
    }

    private static void setLong(PreparedStatement stmt, int index, Long value) throws SQLException {
        if (value == null) {
            stmt.setNull(index, Types.INTEGER);
        } else {
            stmt.setLong(index, value);
        }
    }

    private static Double getDouble(ResultSet rs, String column) throws SQLException {
        double value = rs.getDouble(column);
        return rs.wasNull() ? null : value;
    }

    private static Long getLong(ResultSet rs, String column) throws SQLException {
        long value = rs.getLong(column);
        return rs.wasNull() ? null : value;
    }

    private static String formatTime(LocalDateTime time) {
        return time == null ? null : time.toString();
    }

    private static LocalDateTime parseTime(String text) {
        return text == null ? null : LocalDateTime.parse(text);
    }

    private Experiment mapExperiment(ResultSet rs) throws SQLException {
        Experiment e = new Experiment();
        e.setId(rs.getLong("id"));
        e.setName(rs.getString("name"));
        e.setDescription(rs.getString("description"));
        e.setBatteryType(rs.getString("battery_type"));
        e.setNominalCapacity(rs.getDouble("nominal_capacity"));
        e.setTemperatureAvg(getDouble(rs, "temperature_avg"));
        e.setOperator(rs.getString("operator"));
        e.setStartDate(parseTime(rs.getString("start_date")));
        e.setEndDate(parseTime(rs.getString("end_date")));
        e.setCellId(getLong(rs, "cell_id"));
        e.setMachineId(getLong(rs, "machine_id"));
        e.setValidationValid(rs.getInt("validation_valid") != 0);
        e.setValidationReport(rs.getString("validation_report"));
        return e;
    }

    private Step mapStep(ResultSet rs) throws SQLException {
        Step s = new Step();
        s.setId(rs.getLong("id"));
        s.setExperimentId(rs.getLong("experiment_id"));
        s.setStepNumber(rs.getInt("step_number"));
        s.setStepType(rs.getString("step_type"));
        s.setStartTime(parseTime(rs.getString("start_time")));
        s.setEndTime(parseTime(rs.getString("end_time")));
        s.setDuration(rs.getDouble("duration"));
        s.setVoltageStart(rs.getDouble("voltage_start"));
        s.setVoltageEnd(rs.getDouble("voltage_end"));
        s.setCurrent(rs.getDouble("current"));
        s.setCapacity(rs.getDouble("capacity"));
        s.setEnergy(rs.getDouble("energy"));
        s.setTemperatureAvg(getDouble(rs, "temperature_avg"));
        s.setTemperatureMin(getDouble(rs, "temperature_min"));
        s.setTemperatureMax(getDouble(rs, "temperature_max"));
        s.setCRate(rs.getDouble("c_rate"));
        s.setSocStart(getDouble(rs, "soc_start"));
        s.setSocEnd(getDouble(rs, "soc_end"));
        s.setOcv(getDouble(rs, "ocv"));
        s.setDataMeta(rs.getString("data_meta"));
        return s;
    }

    private Measurement mapMeasurement(ResultSet rs) throws SQLException {
        Measurement m = new Measurement();
        m.setId(rs.getLong("id"));
        m.setStepId(rs.getLong("step_id"));
        m.setExecutionTime(rs.getDouble("execution_time"));
        m.setTimestamp(parseTime(rs.getString("timestamp")));
        m.setVoltage(rs.getDouble("voltage"));
        m.setCurrent(rs.getDouble("current"));
        m.setTemperature(rs.getDouble("temperature"));
        m.setCapacity(rs.getDouble("capacity"));
        m.setEnergy(rs.getDouble("energy"));
        m.setSoc(getDouble(rs, "soc"));
        return m;
    }

    private ProcessedFile mapProcessedFile(ResultSet rs) throws SQLException {
        ProcessedFile f = new ProcessedFile();
        f.setId(rs.getLong("id"));
        f.setExperimentId(rs.getLong("experiment_id"));
        f.setFilename(rs.getString("filename"));
        f.setFileType(FileType.fromCode(rs.getString("file_type")));
        f.setFileHash(rs.getString("file_hash"));
        f.setRowCount(rs.getInt("row_count"));
        f.setProcessedAt(parseTime(rs.getString("processed_at")));
        f.setMetadata(rs.getString("metadata"));
        return f;
    }
}
