package com.locationscout.core.util;

import com.locationscout.core.model.ScoutConfig;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.*;
import java.util.function.Consumer;
import java.util.function.IntConsumer;

/**
 * locations.yml 을 읽어 ScoutConfig 로 변환.
 *
 * 예상 YAML 키(모두 옵션, 없으면 기본값):
 * crawl:
 *   maxPagesPerSite: 200
 *   pageTimeoutMs: 30000
 *   requestDelayMs: 0
 *   settleDelayMs: 2000
 *   scrollDelayMs: 500
 *   maxOtherSeeds: 50
 *   indexSuffixes: ["/locations", "/terminals"]
 *   documentKeywords: [...]
 *   toolMarkers: ["tools.", "portal."]
 *   userAgents: [...]
 * discovery:
 *   sitemapPaths: ["/sitemap.xml"]
 *   maxChildSitemaps: 10
 *   fetchTimeoutMs: 10000
 *   priorityKeywords: [...]
 * classifier:
 *   acceptThreshold: 3
 *   errorPageMinBytes: 2000
 *   topPagesLimit: 20
 *   nonUsUrlPatterns: [...]
 *   usUrlPatterns: [...]
 *   lowValueUrlPatterns: [...]
 * run:
 *   concurrency: 8
 *   batchSize: 20
 *   outputDir: "data"
 * urlDenylist: ["/blog", ".pdf", "mailto:"]
 */
public final class YamlConfigLoader {

    public static final String DEFAULT_FILE = "locations.yml";

    private YamlConfigLoader() {}

    public static ScoutConfig loadDefault() throws IOException {
        return load(Path.of(DEFAULT_FILE));
    }

    public static ScoutConfig load(Path yamlPath) throws IOException {
        Objects.requireNonNull(yamlPath, "yamlPath");
        if (!Files.exists(yamlPath)) {
            throw new IOException(DEFAULT_FILE + " not found at: " + yamlPath.toAbsolutePath());
        }
        try (InputStream in = Files.newInputStream(yamlPath)) {
            return fromStream(in);
        }
    }

    public static ScoutConfig fromStream(InputStream in) {
        LoaderOptions opts = new LoaderOptions();
        Yaml yaml = new Yaml(new SafeConstructor(opts));
        Object root = yaml.load(in);

        ScoutConfig cfg = ScoutConfig.defaults();

        if (!(root instanceof Map<?, ?> map)) {
            // 비어있거나 단순 스칼라면 defaults 유지
            cfg.validate();
            return cfg;
        }

        // 1) crawl.*
        Map<String, Object> crawl = getMap(map, "crawl");
        if (crawl != null) {
            var c = cfg.crawl();
            setInt(crawl, "maxPagesPerSite", c::setMaxPagesPerSite);
            setMillis(crawl, "pageTimeoutMs", c::setPageTimeout);
            setMillis(crawl, "requestDelayMs", c::setRequestDelay);
            setMillis(crawl, "settleDelayMs", c::setSettleDelay);
            setMillis(crawl, "scrollDelayMs", c::setScrollDelay);
            setInt(crawl, "maxOtherSeeds", c::setMaxOtherSeeds);
            setStringList(crawl, "indexSuffixes", c::setIndexSuffixes);
            setStringList(crawl, "documentKeywords", c::setDocumentKeywords);
            setStringList(crawl, "toolMarkers", c::setToolMarkers);
            setStringList(crawl, "userAgents", c::setUserAgents);
        }

        // 2) discovery.*
        Map<String, Object> disc = getMap(map, "discovery");
        if (disc != null) {
            var d = cfg.discovery();
            setStringList(disc, "sitemapPaths", d::setSitemapPaths);
            setInt(disc, "maxChildSitemaps", d::setMaxChildSitemaps);
            setMillis(disc, "fetchTimeoutMs", d::setFetchTimeout);
            setStringList(disc, "priorityKeywords", d::setPriorityKeywords);
        }

        // 3) classifier.*
        Map<String, Object> cls = getMap(map, "classifier");
        if (cls != null) {
            var k = cfg.classifier();
            setInt(cls, "acceptThreshold", k::setAcceptThreshold);
            setInt(cls, "errorPageMinBytes", k::setErrorPageMinBytes);
            setInt(cls, "topPagesLimit", k::setTopPagesLimit);
            setStringList(cls, "nonUsUrlPatterns", k::setNonUsUrlPatterns);
            setStringList(cls, "usUrlPatterns", k::setUsUrlPatterns);
            setStringList(cls, "lowValueUrlPatterns", k::setLowValueUrlPatterns);
        }

        // 4) run.*
        Map<String, Object> run = getMap(map, "run");
        if (run != null) {
            var r = cfg.run();
            setInt(run, "concurrency", r::setConcurrency);
            setInt(run, "batchSize", r::setBatchSize);
            setPath(run, "outputDir", r::setOutputDir);
        }

        // 5) 평면 키
        setStringList(map, "urlDenylist", cfg::setUrlDenylist);

        // 기본값/필수값 확인
        cfg.validate();
        return cfg;
    }

    // ------------ helpers ------------
    @SuppressWarnings("unchecked")
    private static Map<String, Object> getMap(Map<?, ?> map, String key) {
        Object v = map.get(key);
        if (v instanceof Map<?, ?> m) return (Map<String, Object>) m;
        return null;
    }

    private static void setStringList(Map<?, ?> map, String key, Consumer<List<String>> setter) {
        Object v = map.get(key);
        if (v == null) return;
        if (v instanceof List<?> list) {
            List<String> out = new ArrayList<>();
            for (Object o : list) if (o != null) out.add(String.valueOf(o));
            setter.accept(List.copyOf(out));
            return;
        }
        // "a,b,c" 형태 지원
        String s = String.valueOf(v).trim();
        List<String> out = new ArrayList<>();
        if (!s.isEmpty()) {
            for (String p : s.split("\\s*,\\s*")) if (!p.isEmpty()) out.add(p);
        }
        setter.accept(List.copyOf(out));
    }

    private static void setInt(Map<?, ?> map, String key, IntConsumer setter) {
        Object v = map.get(key);
        if (v instanceof Number n) setter.accept(n.intValue());
        else if (v != null) setter.accept(Integer.parseInt(String.valueOf(v).trim()));
    }

    /** 0 도 허용(지연 없음). 음수는 validate() 에서 거른다 */
    private static void setMillis(Map<?, ?> map, String key, Consumer<Duration> setter) {
        Object v = map.get(key);
        if (v == null) return;
        long ms = (v instanceof Number n) ? n.longValue() : Long.parseLong(String.valueOf(v).trim());
        setter.accept(Duration.ofMillis(ms));
    }

    private static void setPath(Map<?, ?> map, String key, Consumer<Path> setter) {
        Object v = map.get(key);
        if (v != null) setter.accept(Path.of(String.valueOf(v)));
    }
}
