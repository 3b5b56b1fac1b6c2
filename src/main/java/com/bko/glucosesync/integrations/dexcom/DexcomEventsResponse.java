package com.bko.glucosesync.integrations.dexcom;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.ArrayList;
import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
public class DexcomEventsResponse {
    private List<DexcomEvent> records = new ArrayList<>();

    public List<DexcomEvent> getRecords() { return records; }
    public void setRecords(List<DexcomEvent> records) { this.records = records; }
}
