package com.locationscout.core.classifier.detectors;

import com.locationscout.core.classifier.PageContext;
import com.locationscout.core.classifier.SignalDetector;
import com.locationscout.core.model.Confidence;
import com.locationscout.core.model.Signal;
import com.locationscout.core.model.SignalKind;
import org.jsoup.nodes.Element;

import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Google Maps 신호. 지도 하나(본사 위치)는 약한 증거로, 다중 마커/다중 링크만 강한 증거로 본다.
 * 판정 순서: embed iframe → 링크 3개 이상 → Maps JS API → 링크 1~2개.
 * 5점 이상이면 게이트 통과.
 */
public final class GoogleMapsDetector implements SignalDetector {

    static final List<String> EMBED_PATTERNS = List.of(
            "google.com/maps/embed",
            "/maps/d/embed",
            "maps.google.com/maps?",
            "google.com/maps?q=",
            "google.com/maps/place");

    /** 지도 아닌 Google 서비스(오탐) */
    static final List<String> NOT_A_MAP = List.of(
            "googletagmanager", "recaptcha", "analytics", "gtag", "fonts.googleapis", "ajax.googleapis");

    static final List<String> MAP_INIT = List.of(
            "new google.maps.map", "google.maps.marker", "google.maps.infowindow",
            "initmap", "mapinit", "loadmap");

    static final Pattern MAPS_HREF = Pattern.compile("google\\.com/maps|maps\\.google\\.com", Pattern.CASE_INSENSITIVE);
    static final Pattern LATLNG_CALL = Pattern.compile("latlng\\s*\\(");

    public static final int STRONG = 5;

    @Override
    public Optional<Signal> detect(PageContext page) {
        int links = countMapsLinks(page);

        for (Element f : page.document().select("iframe[src]")) {
            String src = f.attr("src").toLowerCase(Locale.ROOT);
            if (containsAny(src, EMBED_PATTERNS) && !containsAny(src, NOT_A_MAP)) {
                boolean multi = links >= 3;
                return Optional.of(Signal.of(SignalKind.GOOGLE_MAPS_EMBED,
                        multi ? Confidence.HIGH : Confidence.MEDIUM, multi ? STRONG : 3,
                        "Google Maps embed iframe (links=" + links + ")", Signal.clip(src, 80)));
            }
        }

        if (links >= 3) {
            return Optional.of(Signal.of(SignalKind.GOOGLE_MAPS_LINKS, Confidence.HIGH, STRONG,
                    links + " Google Maps links", "Multiple maps.google.com links"));
        }

        String h = page.htmlLower();
        if (h.contains("maps.googleapis.com/maps/api/js") && containsAny(h, MAP_INIT)) {
            int markers = count(h, "google.maps.marker") + count(h, "addmarker") + count(h, "new marker");
            int latLngs = 0;
            Matcher m = LATLNG_CALL.matcher(h);
            while (m.find()) latLngs++;
            if (markers >= 3 || latLngs >= 3) {
                return Optional.of(Signal.of(SignalKind.GOOGLE_MAPS_API, Confidence.HIGH, STRONG,
                        "Google Maps API with multiple markers (~" + Math.max(markers, latLngs) + ")",
                        "maps.googleapis.com with multiple markers"));
            }
            return Optional.of(Signal.of(SignalKind.GOOGLE_MAPS_API, Confidence.LOW, 2,
                    "Google Maps API (possibly single marker)", "maps.googleapis.com"));
        }

        if (links >= 1) {
            return Optional.of(Signal.of(SignalKind.GOOGLE_MAPS_LINK, Confidence.LOW, 1,
                    "Google Maps link (likely HQ only)", "maps.google.com link"));
        }
        return Optional.empty();
    }

    @Override
    public boolean qualifies(Signal signal) {
        return signal.points() >= STRONG;
    }

    static int countMapsLinks(PageContext page) {
        int n = 0;
        for (Element a : page.document().select("a[href]")) {
            if (MAPS_HREF.matcher(a.attr("href")).find()) n++;
        }
        return n;
    }

    private static boolean containsAny(String s, List<String> needles) {
        for (String n : needles) {
            if (s.contains(n)) return true;
        }
        return false;
    }

    private static int count(String s, String needle) {
        int n = 0;
        int i = s.indexOf(needle);
        while (i >= 0) {
            n++;
            i = s.indexOf(needle, i + needle.length());
        }
        return n;
    }
}
