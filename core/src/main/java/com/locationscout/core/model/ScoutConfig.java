package com.locationscout.core.model;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Objects;

/**
 * 실행 설정 (locations.yml 매핑 대상). 순수 설정 보관용.
 * 각 컴포넌트는 자기 섹션만 생성자로 받는다(전역 상태 없음).
 */
public final class ScoutConfig {

    /** 크롤 경로 차단 목록(미디어/소셜/비HTTP 스킴/비관련 카테고리) */
    public static final List<String> DEFAULT_URL_DENYLIST = List.of(
            "/blog", "/news", "/press", "/career", "/job", "/apply",
            "/login", "/signin", "/register", "/cart", "/checkout",
            "/privacy", "/terms", "/legal", "/cookie",
            ".pdf", ".jpg", ".jpeg", ".png", ".gif", ".svg", ".webp",
            ".mp4", ".mp3", ".avi", ".mov", ".zip", ".rar", ".exe", ".dmg",
            "facebook.com", "twitter.com", "linkedin.com", "instagram.com", "youtube.com",
            "mailto:", "tel:", "javascript:");

    /** YAML `crawl:` 섹션 */
    public static final class Crawl {
        private int maxPagesPerSite = 200;
        private Duration pageTimeout = Duration.ofMillis(30_000);
        private Duration requestDelay = Duration.ZERO;
        private Duration settleDelay = Duration.ofMillis(2_000);
        private Duration scrollDelay = Duration.ofMillis(500);
        private int maxOtherSeeds = 50;
        private List<String> indexSuffixes = List.of(
                "/locations", "/locations.html", "/our-locations",
                "/terminals", "/terminal-locations", "/all-locations",
                "/service-centers", "/service-center", "/service-center-locator",
                "/service-locations", "/facilities", "/branches",
                "/find-us", "/find-location", "/branch-locator",
                "/load-board/map", "/loadboard/map", "/map", "/map.html",
                "/locator", "/store-locator", "/dealer-locator");
        private List<String> documentKeywords = List.of(
                "map", "service", "terminal", "location", "network", "coverage", "facility", "directory");
        private List<String> toolMarkers = List.of(
                "ext-web.", "tools.", "apps.", "app.", "my.", "portal.", "locator.", "finder.", "search.");
        private List<String> userAgents = List.of(
                "Mozilla/5.0 (Macintosh; Intel Mac OS X 10_15_7) AppleWebKit/537.36 (KHTML, like Gecko) Chrome/120.0.0.0 Safari/537.36",
                "Mozilla/5.0 (Windows NT 10.0; Win64; x64) AppleWebKit/537.36 (KHTML, like Gecko) Chrome/120.0.0.0 Safari/537.36",
                "Mozilla/5.0 (Macintosh; Intel Mac OS X 10_15_7) AppleWebKit/605.1.15 (KHTML, like Gecko) Version/17.0 Safari/605.1.15",
                "Mozilla/5.0 (Windows NT 10.0; Win64; x64; rv:121.0) Gecko/20100101 Firefox/121.0",
                "Mozilla/5.0 (Macintosh; Intel Mac OS X 10.15; rv:121.0) Gecko/20100101 Firefox/121.0");

        public int getMaxPagesPerSite() { return maxPagesPerSite; }
        public Crawl setMaxPagesPerSite(int v) { this.maxPagesPerSite = v; return this; }

        public Duration getPageTimeout() { return pageTimeout; }
        public Crawl setPageTimeout(Duration v) { this.pageTimeout = v; return this; }

        public Duration getRequestDelay() { return requestDelay; }
        public Crawl setRequestDelay(Duration v) { this.requestDelay = (v == null ? Duration.ZERO : v); return this; }

        public Duration getSettleDelay() { return settleDelay; }
        public Crawl setSettleDelay(Duration v) { this.settleDelay = (v == null ? Duration.ZERO : v); return this; }

        public Duration getScrollDelay() { return scrollDelay; }
        public Crawl setScrollDelay(Duration v) { this.scrollDelay = (v == null ? Duration.ZERO : v); return this; }

        public int getMaxOtherSeeds() { return maxOtherSeeds; }
        public Crawl setMaxOtherSeeds(int v) { this.maxOtherSeeds = Math.max(0, v); return this; }

        public List<String> getIndexSuffixes() { return indexSuffixes; }
        public Crawl setIndexSuffixes(List<String> v) { if (v != null && !v.isEmpty()) this.indexSuffixes = List.copyOf(v); return this; }

        public List<String> getDocumentKeywords() { return documentKeywords; }
        public Crawl setDocumentKeywords(List<String> v) { if (v != null && !v.isEmpty()) this.documentKeywords = List.copyOf(v); return this; }

        public List<String> getToolMarkers() { return toolMarkers; }
        public Crawl setToolMarkers(List<String> v) { if (v != null && !v.isEmpty()) this.toolMarkers = List.copyOf(v); return this; }

        public List<String> getUserAgents() { return userAgents; }
        public Crawl setUserAgents(List<String> v) { if (v != null && !v.isEmpty()) this.userAgents = List.copyOf(v); return this; }
    }

    /** YAML `discovery:` 섹션 */
    public static final class Discovery {
        private List<String> sitemapPaths = List.of("/sitemap.xml", "/sitemap_index.xml", "/sitemap/sitemap.xml");
        private int maxChildSitemaps = 10;
        private Duration fetchTimeout = Duration.ofSeconds(10);
        private List<String> priorityKeywords = List.of(
                "location", "terminal", "facilit", "service-center", "service_center",
                "coverage", "network", "find-us", "find_us", "where-we", "branch",
                "office", "warehouse", "yard", "depot", "hub", "contact", "about",
                "center", "site", "operation");

        public List<String> getSitemapPaths() { return sitemapPaths; }
        public Discovery setSitemapPaths(List<String> v) { if (v != null && !v.isEmpty()) this.sitemapPaths = List.copyOf(v); return this; }

        public int getMaxChildSitemaps() { return maxChildSitemaps; }
        public Discovery setMaxChildSitemaps(int v) { this.maxChildSitemaps = Math.max(0, v); return this; }

        public Duration getFetchTimeout() { return fetchTimeout; }
        public Discovery setFetchTimeout(Duration v) { this.fetchTimeout = v; return this; }

        public List<String> getPriorityKeywords() { return priorityKeywords; }
        public Discovery setPriorityKeywords(List<String> v) { if (v != null && !v.isEmpty()) this.priorityKeywords = List.copyOf(v); return this; }
    }

    /** YAML `classifier:` 섹션 */
    public static final class Classifier {
        private int acceptThreshold = 3;
        private int errorPageMinBytes = 2_000;
        private int topPagesLimit = 20;
        private List<String> nonUsUrlPatterns = List.of(
                "/eu/", "/europe/", "/fr/", "/de/", "/es/", "/uk/", "/gb/",
                "/global/", "/international/", "/asia/", "/apac/", "/latam/",
                "/fr-", "/de-", "/es-", "/it-", "/nl-", "/pt-",
                "\\.fr/", "\\.de/", "\\.es/", "\\.co\\.uk/", "\\.eu/",
                "europe\\.");
        private List<String> usUrlPatterns = List.of(
                "/us/", "/en-us/", "/united-states/", "/usa/", "/en/", "\\.com/", "\\.com$");
        private List<String> lowValueUrlPatterns = List.of(
                "investor", "career", "job", "blog", "news", "press", "\\bsec\\b", "earning", "stock",
                "annual.?report", "quarter", "privacy", "terms", "legal", "cookie",
                "login", "sign.?in", "cart", "checkout", "account");

        public int getAcceptThreshold() { return acceptThreshold; }
        public Classifier setAcceptThreshold(int v) { this.acceptThreshold = v; return this; }

        public int getErrorPageMinBytes() { return errorPageMinBytes; }
        public Classifier setErrorPageMinBytes(int v) { this.errorPageMinBytes = Math.max(0, v); return this; }

        public int getTopPagesLimit() { return topPagesLimit; }
        public Classifier setTopPagesLimit(int v) { this.topPagesLimit = v; return this; }

        public List<String> getNonUsUrlPatterns() { return nonUsUrlPatterns; }
        public Classifier setNonUsUrlPatterns(List<String> v) { if (v != null) this.nonUsUrlPatterns = List.copyOf(v); return this; }

        public List<String> getUsUrlPatterns() { return usUrlPatterns; }
        public Classifier setUsUrlPatterns(List<String> v) { if (v != null) this.usUrlPatterns = List.copyOf(v); return this; }

        public List<String> getLowValueUrlPatterns() { return lowValueUrlPatterns; }
        public Classifier setLowValueUrlPatterns(List<String> v) { if (v != null) this.lowValueUrlPatterns = List.copyOf(v); return this; }
    }

    /** YAML `run:` 섹션 */
    public static final class Run {
        private int concurrency = 8;
        private int batchSize = 20;
        private Path outputDir = Path.of("data");

        public int getConcurrency() { return concurrency; }
        public Run setConcurrency(int v) { this.concurrency = v; return this; }

        public int getBatchSize() { return batchSize; }
        public Run setBatchSize(int v) { this.batchSize = v; return this; }

        public Path getOutputDir() { return outputDir; }
        public Run setOutputDir(Path v) { this.outputDir = v; return this; }
    }

    private final Crawl crawl = new Crawl();
    private final Discovery discovery = new Discovery();
    private final Classifier classifier = new Classifier();
    private final Run run = new Run();
    private List<String> urlDenylist = DEFAULT_URL_DENYLIST;

    public Crawl crawl() { return crawl; }
    public Discovery discovery() { return discovery; }
    public Classifier classifier() { return classifier; }
    public Run run() { return run; }

    public List<String> getUrlDenylist() { return urlDenylist; }
    public ScoutConfig setUrlDenylist(List<String> v) {
        this.urlDenylist = (v == null ? List.of() : List.copyOf(v));
        return this;
    }

    // ---------- 유효성 검사 ----------
    public void validate() {
        if (crawl.maxPagesPerSite < 1) throw new IllegalStateException("crawl.maxPagesPerSite must be >= 1");
        Objects.requireNonNull(crawl.pageTimeout, "crawl.pageTimeout");
        if (crawl.pageTimeout.isNegative() || crawl.pageTimeout.isZero())
            throw new IllegalStateException("crawl.pageTimeout must be > 0");
        if (crawl.requestDelay.isNegative()) throw new IllegalStateException("crawl.requestDelay must be >= 0");
        if (discovery.fetchTimeout == null || discovery.fetchTimeout.isNegative() || discovery.fetchTimeout.isZero())
            throw new IllegalStateException("discovery.fetchTimeout must be > 0");
        if (classifier.acceptThreshold < 1) throw new IllegalStateException("classifier.acceptThreshold must be >= 1");
        if (classifier.topPagesLimit < 1) throw new IllegalStateException("classifier.topPagesLimit must be >= 1");
        if (run.concurrency < 1) throw new IllegalStateException("run.concurrency must be >= 1");
        if (run.batchSize < 1) throw new IllegalStateException("run.batchSize must be >= 1");
        Objects.requireNonNull(run.outputDir, "run.outputDir");
    }

    // ---------- 기본값 팩토리 ----------
    public static ScoutConfig defaults() {
        return new ScoutConfig();
    }

    @Override public String toString() {
        return "ScoutConfig{maxPagesPerSite=" + crawl.maxPagesPerSite +
                ", pageTimeout=" + crawl.pageTimeout +
                ", concurrency=" + run.concurrency +
                ", batchSize=" + run.batchSize +
                ", threshold=" + classifier.acceptThreshold +
                ", outputDir=" + run.outputDir + "}";
    }
}
