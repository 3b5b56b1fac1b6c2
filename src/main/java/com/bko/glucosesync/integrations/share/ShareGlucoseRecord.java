package com.bko.glucosesync.integrations.share;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonIgnoreProperties(ignoreUnknown = true)
public class ShareGlucoseRecord {
    @JsonProperty("WT")
    private String wallTime;
    @JsonProperty("ST")
    private String systemTime;
    @JsonProperty("DT")
    private String displayTime;
    @JsonProperty("Value")
    private Integer value;
    @JsonProperty("Trend")
    private String trend;

    public String getWallTime() { return wallTime; }
    public void setWallTime(String wallTime) { this.wallTime = wallTime; }
    public String getSystemTime() { return systemTime; }
    public void setSystemTime(String systemTime) { this.systemTime = systemTime; }
    public String getDisplayTime() { return displayTime; }
    public void setDisplayTime(String displayTime) { this.displayTime = displayTime; }
    public Integer getValue() { return value; }
    public void setValue(Integer value) { this.value = value; }
    public String getTrend() { return trend; }
    public void setTrend(String trend) { this.trend = trend; }
}
