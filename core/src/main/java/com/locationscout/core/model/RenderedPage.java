package com.locationscout.core.model;

import java.util.List;

/**
 * 렌더 결과. links 는 렌더 후 보이는 a[href] 원문(절대/상대 혼재 가능), 정규화는 크롤러 몫.
 */
public record RenderedPage(int status, String finalUrl, String html, String title, List<String> links) {
    public RenderedPage {
        html = html == null ? "" : html;
        title = title == null ? "" : title;
        links = links == null ? List.of() : List.copyOf(links);
    }
}
