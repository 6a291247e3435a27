package com.pipeline.battery.model;

import java.io.Serializable;
import java.time.LocalDateTime;

/**
 * 单个测量采样点，隶属于某个工步
 */
public class Measurement implements Serializable {
    private Long id;
    private long stepId;
    /** 工步内执行时间（秒） */
    private double executionTime;
    /** 绝对采样时间，源文件无时间列时为null */
    private LocalDateTime timestamp;
    private double voltage;
    private double current;
    private double temperature;
    private double capacity;
    private double energy;
    private Double soc;

    public Measurement() {}

    public Measurement(long stepId, double executionTime, double voltage, double current) {
        this.stepId = stepId;
        this.executionTime = executionTime;
        this.voltage = voltage;
        this.current = current;
    }

    public Long getId() { return id; }
    public void setId(Long id) { this.id = id; }
    public long getStepId() { return stepId; }
    public void setStepId(long stepId) { this.stepId = stepId; }
    public double getExecutionTime() { return executionTime; }
    public void setExecutionTime(double executionTime) { this.executionTime = executionTime; }
    public LocalDateTime getTimestamp() { return timestamp; }
    public void setTimestamp(LocalDateTime timestamp) { this.timestamp = timestamp; }
    public double getVoltage() { return voltage; }
    public void setVoltage(double voltage) { this.voltage = voltage; }
    public double getCurrent() { return current; }
    public void setCurrent(double current) { this.current = current; }
    public double getTemperature() { return temperature; }
    public void setTemperature(double temperature) { this.temperature = temperature; }
    public double getCapacity() { return capacity; }
    public void setCapacity(double capacity) { this.capacity = capacity; }
    public double getEnergy() { return energy; }
    public void setEnergy(double energy) { this.energy = energy; }
    public Double getSoc() { return soc; }
    public void setSoc(Double soc) { this.soc = soc; }
}
