package com.locationscout.core.classifier;

import com.locationscout.core.store.PageStore;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;

import java.util.Optional;

/**
 * 저장된 페이지의 실제 URL 복원.
 * 우선순위: crawler-final-url → crawler-original-url → canonical → og:url → twitter:url.
 * 모두 없으면 호출자가 파일명(stem)을 쓴다.
 */
public final class UrlRecovery {
    private UrlRecovery() {}

    private static final String[] SELECTORS = {
            "meta[name=" + PageStore.META_FINAL + "]",
            "meta[name=" + PageStore.META_ORIGINAL + "]",
            "link[rel=canonical]",
            "meta[property=og:url]",
            "meta[name=twitter:url]"
    };

    public static Optional<String> recover(Document doc) {
        for (String css : SELECTORS) {
            Element e = doc.selectFirst(css);
            if (e == null) continue;
            String v = e.tagName().equals("link") ? e.attr("href") : e.attr("content");
            if (v != null && !v.isBlank()) return Optional.of(v.trim());
        }
        return Optional.empty();
    }

    public static String recoverOr(Document doc, String fallback) {
        return recover(doc).orElse(fallback);
    }
}
