package com.locationscout.core.model;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * URL 발견 결과. priority 는 urls 의 부분집합(키워드 매칭, 순서 힌트일 뿐 필터 아님).
 */
public record DiscoveryResult(Set<String> urls, Set<String> priority) {
    public DiscoveryResult {
        urls = Collections.unmodifiableSet(new LinkedHashSet<>(urls));
        LinkedHashSet<String> p = new LinkedHashSet<>(priority);
        p.retainAll(urls);
        priority = Collections.unmodifiableSet(p);
    }

    public static DiscoveryResult rootOnly(String root) {
        return new DiscoveryResult(Set.of(root), Set.of());
    }
}
