package com.locationscout.core.classifier.detectors;

import com.locationscout.core.classifier.PageContext;
import com.locationscout.core.classifier.SignalDetector;
import com.locationscout.core.model.Confidence;
import com.locationscout.core.model.Signal;
import com.locationscout.core.model.SignalKind;

import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;

/** 인터랙티브 지도 라이브러리 지문(라이브러리당 인스턴스 1개, 3점). Google Maps 는 별도 탐지기. */
public final class MapLibraryDetector implements SignalDetector {

    private final SignalKind kind;
    private final String label;
    private final List<String> signatures;

    public MapLibraryDetector(SignalKind kind, String label, List<String> signatures) {
        if (!Objects.requireNonNull(kind, "kind").isMapLibrary())
            throw new IllegalArgumentException("not a map library kind: " + kind);
        this.kind = kind;
        this.label = label;
        this.signatures = signatures.stream().map(s -> s.toLowerCase(Locale.ROOT)).collect(Collectors.toList());
    }

    public static MapLibraryDetector mapbox() {
        return new MapLibraryDetector(SignalKind.MAP_MAPBOX, "Mapbox", List.of("mapbox.com", "mapboxgl", "mapbox-gl"));
    }

    public static MapLibraryDetector leaflet() {
        return new MapLibraryDetector(SignalKind.MAP_LEAFLET, "Leaflet", List.of("leafletjs.com", "L.map", "leaflet.js"));
    }

    public static MapLibraryDetector arcgis() {
        return new MapLibraryDetector(SignalKind.MAP_ARCGIS, "ArcGIS", List.of("arcgis.com", "esri.com", "FeatureServer", "MapServer"));
    }

    public SignalKind kind() { return kind; }

    @Override
    public Optional<Signal> detect(PageContext page) {
        String h = page.htmlLower();
        for (String sig : signatures) {
            if (h.contains(sig)) {
                return Optional.of(Signal.of(kind, Confidence.HIGH, 3, label + " map detected", sig));
            }
        }
        return Optional.empty();
    }
}
