package com.bko.glucosesync.glucose;

import java.util.Locale;

public enum TrendDirection {
    DOUBLE_UP("DoubleUp", 3.0),
    SINGLE_UP("SingleUp", 2.0),
    FORTY_FIVE_UP("FortyFiveUp", 1.0),
    FLAT("Flat", 0.0),
    FORTY_FIVE_DOWN("FortyFiveDown", -1.0),
    SINGLE_DOWN("SingleDown", -2.0),
    DOUBLE_DOWN("DoubleDown", -3.0),
    UNKNOWN("Unknown", Double.NaN);

    private final String upstreamName;
    private final double approximateRate;

    TrendDirection(String upstreamName, double approximateRate) {
        this.upstreamName = upstreamName;
        this.approximateRate = approximateRate;
    }

    public String upstreamName() {
        return upstreamName;
    }

    /**
     * Approximate rate of change in mg/dL per minute, NaN when unknown.
     */
    public double approximateRate() {
        return approximateRate;
    }

    /**
     * Accepts the official API names in any case ({@code doubleUp}, {@code FortyFiveDown}), the Share numeric
     * codes 1 to 7 and the legacy {@code fortyUp}/{@code fortyDown} spellings.
     */
    public static TrendDirection fromUpstream(String raw) {
        if (raw == null) {
            return UNKNOWN;
        }
        String key = raw.trim().toLowerCase(Locale.ROOT).replace("_", "").replace(" ", "");
        switch (key) {
            case "doubleup":
            case "1":
                return DOUBLE_UP;
            case "singleup":
            case "2":
                return SINGLE_UP;
            case "fortyfiveup":
            case "fortyup":
            case "3":
                return FORTY_FIVE_UP;
            case "flat":
            case "none":
            case "4":
                return FLAT;
            case "fortyfivedown":
            case "fortydown":
            case "5":
                return FORTY_FIVE_DOWN;
            case "singledown":
            case "6":
                return SINGLE_DOWN;
            case "doubledown":
            case "7":
                return DOUBLE_DOWN;
            default:
                return UNKNOWN;
        }
    }
}
