package com.locationscout.core.model;

/** 대상 사이트 1건(이름 + 웹사이트 URL). website 는 비어 있을 수 있다(건너뜀 처리). */
public record Carrier(String name, String website) {
    public Carrier {
        name = (name == null || name.isBlank()) ? "Unknown" : name.trim();
        website = website == null ? "" : website.trim();
    }
}
