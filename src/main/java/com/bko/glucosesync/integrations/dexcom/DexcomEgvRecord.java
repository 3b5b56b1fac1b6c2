package com.bko.glucosesync.integrations.dexcom;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public class DexcomEgvRecord {
    private String recordId;
    private String systemTime;
    private String displayTime;
    private Integer value;
    private String status;
    private String trend;
    private Double trendRate;
    private String unit;
    private String displayDevice;
    private String transmitterGeneration;

    public String getRecordId() { return recordId; }
    public void setRecordId(String recordId) { this.recordId = recordId; }
    public String getSystemTime() { return systemTime; }
    public void setSystemTime(String systemTime) { this.systemTime = systemTime; }
    public String getDisplayTime() { return displayTime; }
    public void setDisplayTime(String displayTime) { this.displayTime = displayTime; }
    public Integer getValue() { return value; }
    public void setValue(Integer value) { this.value = value; }
    public String getStatus() { return status; }
    public void setStatus(String status) { this.status = status; }
    public String getTrend() { return trend; }
    public void setTrend(String trend) { this.trend = trend; }
    public Double getTrendRate() { return trendRate; }
    public void setTrendRate(Double trendRate) { this.trendRate = trendRate; }
    public String getUnit() { return unit; }
    public void setUnit(String unit) { this.unit = unit; }
    public String getDisplayDevice() { return displayDevice; }
    public void setDisplayDevice(String displayDevice) { this.displayDevice = displayDevice; }
    public String getTransmitterGeneration() { return transmitterGeneration; }
    public void setTransmitterGeneration(String transmitterGeneration) { this.transmitterGeneration = transmitterGeneration; }
}
