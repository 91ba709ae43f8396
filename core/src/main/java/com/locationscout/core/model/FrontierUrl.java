package com.locationscout.core.model;

import java.util.Objects;

/** 정규화된 절대 URL + 우선순위 태그 */
public record FrontierUrl(String url, FrontierPriority priority) {
    public FrontierUrl {
        Objects.requireNonNull(url, "url");
        Objects.requireNonNull(priority, "priority");
    }
}
