package com.locationscout.core.discovery;

import com.locationscout.core.api.ISiteDiscoverer;
import com.locationscout.core.model.DiscoveryResult;
import com.locationscout.core.model.ScoutConfig;
import com.locationscout.core.util.UrlUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.util.*;

/**
 * 사이트 루트에서 후보 URL 수집:
 *  1) 관례적 sitemap 경로를 순서대로 찔러 처음 성공(200 + XML)한 것만 파싱
 *  2) sitemap index 면 하위 sitemap 을 최대 N개까지 재귀 수집
 *  3) robots.txt 의 Sitemap: 지시어도 같은 방식으로 병합
 *  4) 루트는 결과와 무관하게 항상 포함
 * sitemap 항목에는 같은 도메인 조건만 건다. 차단 목록은 크롤러가 시드를 나눌 때 적용한다
 * (servicemap.pdf 같은 위치 문서는 거기서 살아남아야 한다).
 * sitemap 이 없거나 깨져도 실패가 아니다(루트만 남고 링크 추적이 이어받는다).
 */
public final class UrlDiscovery implements ISiteDiscoverer {

    private static final Logger LOG = LoggerFactory.getLogger(UrlDiscovery.class);

    /** index → index 무한 재귀 방지 */
    private static final int MAX_INDEX_DEPTH = 2;

    private final TextFetcher fetcher;
    private final ScoutConfig.Discovery cfg;

    public UrlDiscovery(TextFetcher fetcher, ScoutConfig.Discovery cfg) {
        this.fetcher = Objects.requireNonNull(fetcher, "fetcher");
        this.cfg = Objects.requireNonNull(cfg, "cfg");
    }

    @Override
    public DiscoveryResult discover(String siteRoot) {
        String root = UrlUtils.normalize(siteRoot, null);
        if (root == null) {
            throw new IllegalArgumentException("not an http(s) site root: " + siteRoot);
        }
        String domain = UrlUtils.extractDomain(root);
        String origin = origin(root);

        Set<String> urls = new LinkedHashSet<>();
        Set<String> seenSitemaps = new HashSet<>();

        // 1) 관례 경로: 첫 성공만 사용
        for (String path : cfg.getSitemapPaths()) {
            String sm = origin + (path.startsWith("/") ? path : "/" + path);
            if (collect(sm, domain, urls, seenSitemaps, 0)) break;
        }

        // 2) robots.txt Sitemap: 병합
        TextFetcher.Response robots = fetcher.fetch(URI.create(origin + "/robots.txt"));
        if (robots.isOk()) {
            for (String sm : RobotsSitemapParser.parse(robots.body)) {
                collect(sm, domain, urls, seenSitemaps, 0);
            }
        }

        // 3) 루트는 항상
        urls.add(root);

        Set<String> priority = new LinkedHashSet<>();
        for (String u : urls) {
            if (isPriority(u)) priority.add(u);
        }
        LOG.debug("Discovery done: root={}, urls={}, priority={}", root, urls.size(), priority.size());
        return new DiscoveryResult(urls, priority);
    }

    /** 위치 키워드가 URL 에 들어 있으면 우선 후보(순서 힌트) */
    public boolean isPriority(String url) {
        String lower = url.toLowerCase(Locale.ROOT);
        for (String kw : cfg.getPriorityKeywords()) {
            if (lower.contains(kw.toLowerCase(Locale.ROOT))) return true;
        }
        return false;
    }

    /**
     * sitemap 하나를 받아 파싱/병합.
     * @return 200 + XML 로 파싱까지 진행했으면 true
     */
    private boolean collect(String sitemapUrl, String domain, Set<String> urls, Set<String> seen, int depth) {
        if (!seen.add(sitemapUrl)) return false;
        URI uri;
        try {
            uri = URI.create(sitemapUrl.trim());
        } catch (IllegalArgumentException e) {
            LOG.debug("Bad sitemap url skipped: {}", sitemapUrl);
            return false;
        }

        TextFetcher.Response res = fetcher.fetch(uri);
        if (!res.isOk() || !SitemapParser.looksLikeXml(res.body)) {
            LOG.debug("Sitemap unavailable: {} status={} err={}", sitemapUrl, res.status, res.error.orElse(""));
            return false;
        }

        SitemapParser.Sitemap sm;
        try {
            sm = SitemapParser.parse(res.body);
        } catch (RuntimeException e) {
            LOG.debug("Malformed sitemap skipped: {} ({})", sitemapUrl, e.toString());
            return false;
        }

        if (sm.index()) {
            if (depth >= MAX_INDEX_DEPTH) return true;
            int limit = Math.min(cfg.getMaxChildSitemaps(), sm.locations().size());
            for (int i = 0; i < limit; i++) {
                collect(sm.locations().get(i), domain, urls, seen, depth + 1);
            }
            return true;
        }

        for (String loc : sm.locations()) {
            String n = UrlUtils.normalize(loc, sitemapUrl);
            if (n != null && UrlUtils.sameDomain(n, domain)) urls.add(n);
        }
        return true;
    }

    private static String origin(String root) {
        URI u = URI.create(root);
        String port = u.getPort() == -1 ? "" : ":" + u.getPort();
        return u.getScheme() + "://" + u.getHost() + port;
    }
}
