package com.locationscout.core.crawler;

import com.locationscout.core.model.FrontierPriority;
import com.locationscout.core.model.ScoutConfig;

import java.net.URI;
import java.util.Locale;
import java.util.Objects;

/**
 * URL → 프론티어 우선순위 판정.
 * - 인덱스: 목록 페이지 접미사로 끝남(/locations, /terminals ...), 또는 servicemap PDF
 * - 문서: 위치 키워드가 든 PDF
 * - 도구 서브도메인: host 라벨이 tools./portal./locator. 등으로 시작
 */
public final class FrontierRules {
    private final ScoutConfig.Crawl cfg;

    public FrontierRules(ScoutConfig.Crawl cfg) {
        this.cfg = Objects.requireNonNull(cfg, "cfg");
    }

    public FrontierPriority priorityOf(String url) {
        if (isIndexPage(url)) return FrontierPriority.INDEX;
        if (isPdfOrMap(url)) return FrontierPriority.PDF_OR_MAP;
        if (isToolSubdomain(url)) return FrontierPriority.TOOL_SUBDOMAIN;
        return FrontierPriority.ORDINARY;
    }

    public boolean isIndexOrDocument(String url) {
        return priorityOf(url).isIndexOrDocument();
    }

    public boolean isIndexPage(String url) {
        String lower = stripTrailingSlash(url.toLowerCase(Locale.ROOT));
        for (String suffix : cfg.getIndexSuffixes()) {
            if (lower.endsWith(suffix.toLowerCase(Locale.ROOT))) return true;
        }
        return lower.contains("servicemap") && lower.contains(".pdf");
    }

    public boolean isPdfOrMap(String url) {
        String lower = url.toLowerCase(Locale.ROOT);
        if (!lower.contains(".pdf")) return false;
        for (String kw : cfg.getDocumentKeywords()) {
            if (lower.contains(kw.toLowerCase(Locale.ROOT))) return true;
        }
        return false;
    }

    public boolean isToolSubdomain(String url) {
        String host;
        try {
            host = URI.create(url).getHost();
        } catch (IllegalArgumentException e) {
            return false;
        }
        if (host == null) return false;
        String h = host.toLowerCase(Locale.ROOT);
        for (String marker : cfg.getToolMarkers()) {
            String m = marker.toLowerCase(Locale.ROOT);
            if (h.startsWith(m) || h.contains("." + m)) return true;
        }
        return false;
    }

    private static String stripTrailingSlash(String s) {
        String r = s;
        while (r.endsWith("/")) r = r.substring(0, r.length() - 1);
        return r;
    }
}
