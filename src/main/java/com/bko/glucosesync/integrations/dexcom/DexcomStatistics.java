package com.bko.glucosesync.integrations.dexcom;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonIgnoreProperties(ignoreUnknown = true)
public class DexcomStatistics {
    private String hypoglycemiaRisk;
    private Integer min;
    private Integer max;
    private Double mean;
    private Integer median;
    private Double variance;
    private Double stdDev;
    private Double utilizationPercent;
    @JsonProperty("nDays")
    private Integer dayCount;
    @JsonProperty("nValues")
    private Integer valueCount;
    @JsonProperty("nHypoglycemia")
    private Integer hypoglycemiaCount;
    @JsonProperty("nHyperglycemia")
    private Integer hyperglycemiaCount;

    public String getHypoglycemiaRisk() { return hypoglycemiaRisk; }
    public void setHypoglycemiaRisk(String hypoglycemiaRisk) { this.hypoglycemiaRisk = hypoglycemiaRisk; }
    public Integer getMin() { return min; }
    public void setMin(Integer min) { this.min = min; }
    public Integer getMax() { return max; }
    public void setMax(Integer max) { this.max = max; }
    public Double getMean() { return mean; }
    public void setMean(Double mean) { this.mean = mean; }
    public Integer getMedian() { return median; }
    public void setMedian(Integer median) { this.median = median; }
    public Double getVariance() { return variance; }
    public void setVariance(Double variance) { this.variance = variance; }
    public Double getStdDev() { return stdDev; }
    public void setStdDev(Double stdDev) { this.stdDev = stdDev; }
    public Double getUtilizationPercent() { return utilizationPercent; }
    public void setUtilizationPercent(Double utilizationPercent) { this.utilizationPercent = utilizationPercent; }
    public Integer getDayCount() { return dayCount; }
    public void setDayCount(Integer dayCount) { this.dayCount = dayCount; }
    public Integer getValueCount() { return valueCount; }
    public void setValueCount(Integer valueCount) { this.valueCount = valueCount; }
    public Integer getHypoglycemiaCount() { return hypoglycemiaCount; }
    public void setHypoglycemiaCount(Integer hypoglycemiaCount) { this.hypoglycemiaCount = hypoglycemiaCount; }
    public Integer getHyperglycemiaCount() { return hyperglycemiaCount; }
    public void setHyperglycemiaCount(Integer hyperglycemiaCount) { this.hyperglycemiaCount = hyperglycemiaCount; }
}
