package com.pipeline.battery.model;

import java.io.Serializable;
import java.time.LocalDateTime;

/**
 * 实验实体：一次上传对应一个实验，是步骤与测量数据的归属单元
 */
public class Experiment implements Serializable {
    private Long id;
    private String name;
    private String description;
    private String batteryType;
    /** 标称容量（Ah） */
    private double nominalCapacity;
    /** 平均测试温度（℃） */
    private Double temperatureAvg;
    private String operator;
    private LocalDateTime startDate;
    /** 导入完成后由最后一条测量时间回填 */
    private LocalDateTime endDate;
    private Long cellId;
    private Long machineId;
    private boolean validationValid;
    /** 校验报告（JSON） */
    private String validationReport;

    public Experiment() {}

    public Long getId() { return id; }
    public void setId(Long id) { this.id = id; }
    public String getName() { return name; }
    public void setName(String name) { this.name = name; }
    public String getDescription() { return description; }
    public void setDescription(String description) { this.description = description; }
    public String getBatteryType() { return batteryType; }
    public void setBatteryType(String batteryType) { this.batteryType = batteryType; }
    public double getNominalCapacity() { return nominalCapacity; }
    public void setNominalCapacity(double nominalCapacity) { this.nominalCapacity = nominalCapacity; }
    public Double getTemperatureAvg() { return temperatureAvg; }
    public void setTemperatureAvg(Double temperatureAvg) { this.temperatureAvg = temperatureAvg; }
    public String getOperator() { return operator; }
    public void setOperator(String operator) { this.operator = operator; }
    public LocalDateTime getStartDate() { return startDate; }
    public void setStartDate(LocalDateTime startDate) { this.startDate = startDate; }
    public LocalDateTime getEndDate() { return endDate; }
    public void setEndDate(LocalDateTime endDate) { this.endDate = endDate; }
    public Long getCellId() { return cellId; }
    public void setCellId(Long cellId) { this.cellId = cellId; }
    public Long getMachineId() { return machineId; }
    public void setMachineId(Long machineId) { this.machineId = machineId; }
    public boolean isValidationValid() { return validationValid; }
    public void setValidationValid(boolean validationValid) { this.validationValid = validationValid; }
    public String getValidationReport() { return validationReport; }
    public void setValidationReport(String validationReport) { this.validationReport = validationReport; }
}
