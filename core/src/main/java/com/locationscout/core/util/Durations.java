package com.locationscout.core.util;

import java.util.Locale;

/** 사람이 읽는 경과 시간 표기: 12.3s / 4.5m / 1.2h */
public final class Durations {
    private Durations() {}

    public static String format(double seconds) {
        if (seconds < 60) return String.format(Locale.ROOT, "%.1fs", seconds);
        if (seconds < 3600) return String.format(Locale.ROOT, "%.1fm", seconds / 60.0);
        return String.format(Locale.ROOT, "%.1fh", seconds / 3600.0);
    }

    public static double round1(double seconds) {
        return Math.round(seconds * 10.0) / 10.0;
    }
}
