package com.locationscout.core.classifier.detectors;

import com.locationscout.core.classifier.PageContext;
import com.locationscout.core.classifier.SignalDetector;
import com.locationscout.core.model.Confidence;
import com.locationscout.core.model.Signal;
import com.locationscout.core.model.SignalKind;

import java.util.HashSet;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/** 페이지 소스 전체의 좌표 개수(lat: 값, LatLng(a, b)). 3개 이상이면 다중 마커 지도로 본다. */
public final class CoordinateDetector implements SignalDetector {

    static final Pattern LAT_VALUE = Pattern.compile(
            "(?:lat|latitude)[\"']?\\s*[:=]\\s*(-?\\d{1,3}\\.\\d{3,})", Pattern.CASE_INSENSITIVE);
    static final Pattern LAT_LNG = Pattern.compile(
            "LatLng\\s*\\(\\s*(-?\\d{1,3}\\.\\d+)\\s*,\\s*(-?\\d{1,3}\\.\\d+)\\s*\\)");

    public static final int MARKERS_MIN = 3;

    @Override
    public Optional<Signal> detect(PageContext page) {
        int n = countCoordinates(page.html());
        if (n >= MARKERS_MIN) {
            return Optional.of(Signal.of(SignalKind.COORDINATE_DATA, Confidence.HIGH, 8,
                    n + " coordinate markers found", "Multiple lat/lng coordinates"));
        }
        if (n >= 1) {
            return Optional.of(Signal.of(SignalKind.COORDINATE_DATA, Confidence.MEDIUM, 2,
                    n + " coordinate(s) found", "lat/lng data"));
        }
        return Optional.empty();
    }

    @Override
    public boolean qualifies(Signal signal) {
        return signal.points() >= 8;
    }

    /** 서로 다른 위도 값 수 + 서로 다른 LatLng 쌍 수 */
    static int countCoordinates(String html) {
        Set<String> lats = new HashSet<>();
        Matcher m = LAT_VALUE.matcher(html);
        while (m.find()) lats.add(m.group(1));

        Set<String> pairs = new HashSet<>();
        Matcher p = LAT_LNG.matcher(html);
        while (p.find()) pairs.add(p.group(1) + "," + p.group(2));

        return lats.size() + pairs.size();
    }
}
