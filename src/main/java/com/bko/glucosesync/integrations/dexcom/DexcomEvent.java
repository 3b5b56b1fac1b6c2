package com.bko.glucosesync.integrations.dexcom;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * User-logged event such as carbs, insulin or exercise.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class DexcomEvent {
    private String recordId;
    private String systemTime;
    private String displayTime;
    private String eventType;
    private String eventSubType;
    private Double value;
    private String unit;

    public String getRecordId() { return recordId; }
    public void setRecordId(String recordId) { this.recordId = recordId; }
    public String getSystemTime() { return systemTime; }
    public void setSystemTime(String systemTime) { this.systemTime = systemTime; }
    public String getDisplayTime() { return displayTime; }
    public void setDisplayTime(String displayTime) { this.displayTime = displayTime; }
    public String getEventType() { return eventType; }
    public void setEventType(String eventType) { this.eventType = eventType; }
    public String getEventSubType() { return eventSubType; }
    public void setEventSubType(String eventSubType) { this.eventSubType = eventSubType; }
    public Double getValue() { return value; }
    public void setValue(Double value) { this.value = value; }
    public String getUnit() { return unit; }
    public void setUnit(String unit) { this.unit = unit; }
}
