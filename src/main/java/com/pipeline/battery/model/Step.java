package com.pipeline.battery.model;

import java.io.Serializable;
import java.time.LocalDateTime;

/**
 * 工步实体：实验中的一个独立测试阶段（充电 / 放电 / 静置）。
 * step_number 仅在所属实验内唯一。
 */
public class Step implements Serializable {
    private Long id;
    private long experimentId;
    private int stepNumber;
    /** 归一化后的工步类型：charge / discharge / rest，无法识别的标签原样保留 */
    private String stepType;
    private LocalDateTime startTime;
    private LocalDateTime endTime;
    /** 持续时间（秒） */
    private double duration;
    private double voltageStart;
    private double voltageEnd;
    private double current;
    private double capacity;
    private double energy;
    private Double temperatureAvg;
    private Double temperatureMin;
    private Double temperatureMax;
    /** |current| / 标称容量；标称容量为0时为0 */
    private double cRate;
    private Double socStart;
    private Double socEnd;
    private Double ocv;
    /** 源数据行（JSON） */
    private String dataMeta;

    public Step() {}

    public Long getId() { return id; }
    public void setId(Long id) { this.id = id; }
    public long getExperimentId() { return experimentId; }
    public void setExperimentId(long experimentId) { this.experimentId = experimentId; }
    public int getStepNumber() { return stepNumber; }
    public void setStepNumber(int stepNumber) { this.stepNumber = stepNumber; }
    public String getStepType() { return stepType; }
    public void setStepType(String stepType) { this.stepType = stepType; }
    public LocalDateTime getStartTime() { return startTime; }
    public void setStartTime(LocalDateTime startTime) { this.startTime = startTime; }
    public LocalDateTime getEndTime() { return endTime; }
    public void setEndTime(LocalDateTime endTime) { this.endTime = endTime; }
    public double getDuration() { return duration; }
    public void setDuration(double duration) { this.duration = duration; }
    public double getVoltageStart() { return voltageStart; }
    public void setVoltageStart(double voltageStart) { this.voltageStart = voltageStart; }
    public double getVoltageEnd() { return voltageEnd; }
    public void setVoltageEnd(double voltageEnd) { this.voltageEnd = voltageEnd; }
    public double getCurrent() { return current; }
    public void setCurrent(double current) { this.current = current; }
    public double getCapacity() { return capacity; }
    public void setCapacity(double capacity) { this.capacity = capacity; }
    public double getEnergy() { return energy; }
    public void setEnergy(double energy) { this.energy = energy; }
    public Double getTemperatureAvg() { return temperatureAvg; }
    public void setTemperatureAvg(Double temperatureAvg) { this.temperatureAvg = temperatureAvg; }
    public Double getTemperatureMin() { return temperatureMin; }
    public void setTemperatureMin(Double temperatureMin) { this.temperatureMin = temperatureMin; }
    public Double getTemperatureMax() { return temperatureMax; }
    public void setTemperatureMax(Double temperatureMax) { this.temperatureMax = temperatureMax; }
    public double getCRate() { return cRate; }
    public void setCRate(double cRate) { this.cRate = cRate; }
    public Double getSocStart() { return socStart; }
    public void setSocStart(Double socStart) { this.socStart = socStart; }
    public Double getSocEnd() { return socEnd; }
    public void setSocEnd(Double socEnd) { this.socEnd = socEnd; }
    public Double getOcv() { return ocv; }
    public void setOcv(Double ocv) { this.ocv = ocv; }
    public String getDataMeta() { return dataMeta; }
    public void setDataMeta(String dataMeta) { this.dataMeta = dataMeta; }
}
