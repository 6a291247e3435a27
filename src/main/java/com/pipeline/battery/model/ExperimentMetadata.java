package com.pipeline.battery.model;

import java.io.Serializable;
import java.time.LocalDateTime;

/**
 * 由调用方提供的实验元数据
 */
public class ExperimentMetadata implements Serializable {
    private String name;
    private String description;
    private String operator;
    private LocalDateTime startDate;
    private String batteryType;
    private Long cellId;
    private Long machineId;

    public ExperimentMetadata() {}

    public ExperimentMetadata(String name, LocalDateTime startDate) {
        this.name = name;
        this.startDate = startDate;
    }

    public String getName() { return name; }
    public void setName(String name) { this.name = name; }
    public String getDescription() { return description; }
    public void setDescription(String description) { this.description = description; }
    public String getOperator() { return operator; }
    public void setOperator(String operator) { this.operator = operator; }
    public LocalDateTime getStartDate() { return startDate; }
    public void setStartDate(LocalDateTime startDate) { this.startDate = startDate; }
    public String getBatteryType() { return batteryType; }
    public void setBatteryType(String batteryType) { this.batteryType = batteryType; }
    public Long getCellId() { return cellId; }
    public void setCellId(Long cellId) { this.cellId = cellId; }
    public Long getMachineId() { return machineId; }
    public void setMachineId(Long machineId) { this.machineId = machineId; }
}
