package com.bko.glucosesync.integrations.dexcom;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public class DexcomDataRange {
    private Window calibrations;
    private Window egvs;
    private Window events;

    public Window getCalibrations() { return calibrations; }
    public void setCalibrations(Window calibrations) { this.calibrations = calibrations; }
    public Window getEgvs() { return egvs; }
    public void setEgvs(Window egvs) { this.egvs = egvs; }
    public Window getEvents() { return events; }
    public void setEvents(Window events) { this.events = events; }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Window {
        private Moment start;
        private Moment end;

        public Moment getStart() { return start; }
        public void setStart(Moment start) { this.start = start; }
        public Moment getEnd() { return end; }
        public void setEnd(Moment end) { this.end = end; }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Moment {
        private String systemTime;
        private String displayTime;

        public String getSystemTime() { return systemTime; }
        public void setSystemTime(String systemTime) { this.systemTime = systemTime; }
        public String getDisplayTime() { return displayTime; }
        public void setDisplayTime(String displayTime) { this.displayTime = displayTime; }
    }
}
