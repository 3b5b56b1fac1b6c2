package com.bko.glucosesync.integrations.dexcom;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.ArrayList;
import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
public class DexcomEgvsResponse {
    private String recordType;
    private String userId;
    private List<DexcomEgvRecord> records = new ArrayList<>();

    public String getRecordType() { return recordType; }
    public void setRecordType(String recordType) { this.recordType = recordType; }
    public String getUserId() { return userId; }
    public void setUserId(String userId) { this.userId = userId; }
    public List<DexcomEgvRecord> getRecords() { return records; }
    public void setRecords(List<DexcomEgvRecord> records) { this.records = records; }
}
