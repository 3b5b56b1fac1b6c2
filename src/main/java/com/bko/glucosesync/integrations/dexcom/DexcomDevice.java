package com.bko.glucosesync.integrations.dexcom;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public class DexcomDevice {
    private String lastUploadDate;
    private String transmitterId;
    private String transmitterGeneration;
    private String displayDevice;
    private String displayApp;
    private String unitDisplayMode;

    public String getLastUploadDate() { return lastUploadDate; }
    public void setLastUploadDate(String lastUploadDate) { this.lastUploadDate = lastUploadDate; }
    public String getTransmitterId() { return transmitterId; }
    public void setTransmitterId(String transmitterId) { this.transmitterId = transmitterId; }
    public String getTransmitterGeneration() { return transmitterGeneration; }
    public void setTransmitterGeneration(String transmitterGeneration) { this.transmitterGeneration = transmitterGeneration; }
    public String getDisplayDevice() { return displayDevice; }
    public void setDisplayDevice(String displayDevice) { this.displayDevice = displayDevice; }
    public String getDisplayApp() { return displayApp; }
    public void setDisplayApp(String displayApp) { this.displayApp = displayApp; }
    public String getUnitDisplayMode() { return unitDisplayMode; }
    public void setUnitDisplayMode(String unitDisplayMode) { this.unitDisplayMode = unitDisplayMode; }
}
