package com.bko.glucosesync.integrations.dexcom;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.ArrayList;
import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
public class DexcomDevicesResponse {
    private List<DexcomDevice> records = new ArrayList<>();

    public List<DexcomDevice> getRecords() { return records; }
    public void setRecords(List<DexcomDevice> records) { this.records = records; }
}
