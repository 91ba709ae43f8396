package com.locationscout.core.store;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.locationscout.core.model.CrawlSummary;
import com.locationscout.core.util.JsonSupport;
import com.locationscout.core.util.UrlUtils;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.*;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.*;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * 사이트 1개의 페이지 저장소: {@code <crawledRoot>/<domain_with_underscores>/}
 * - 페이지 1건 = 파일 1개, 이름은 요청 URL 의 MD5 앞 12자리 + ".html"
 * - &lt;head&gt; 직후에 원래 URL 표식(meta)을 주입해 순서 없이 읽어도 URL 복원 가능
 * - crawl_summary.json 은 같은 디렉터리에 둔다
 */
public final class PageStore {

    public static final String SUMMARY_FILE = "crawl_summary.json";
    public static final String META_ORIGINAL = "crawler-original-url";
    public static final String META_FINAL = "crawler-final-url";

    private static final Pattern HEAD_OPEN = Pattern.compile("(?i)<head(\\s[^>]*)?>");

    private final Path dir;
    private final ObjectMapper om = JsonSupport.mapper();

    public PageStore(Path dir) {
        this.dir = Objects.requireNonNull(dir, "dir");
    }

    public static PageStore forDomain(Path crawledRoot, String domain) {
        return new PageStore(crawledRoot.resolve(UrlUtils.siteDirName(domain)));
    }

    public Path dir() { return dir; }

    /** 이전 실행 결과를 지우고 빈 디렉터리로 시작(재실행 시 덮어쓰기) */
    public void reset() throws IOException {
        if (Files.exists(dir)) {
            try (Stream<Path> walk = Files.walk(dir)) {
                List<Path> all = walk.sorted(Comparator.reverseOrder()).collect(Collectors.toList());
                for (Path p : all) {
                    if (!p.equals(dir)) Files.deleteIfExists(p);
                }
            }
        }
        Files.createDirectories(dir);
    }

    /** HTML 저장(표식 주입 포함). 같은 URL 은 같은 파일을 덮어쓴다 */
    public Path save(String requestedUrl, String finalUrl, String html) throws IOException {
        Files.createDirectories(dir);
        Path file = dir.resolve(fileNameFor(requestedUrl));
        Files.writeString(file, injectMarkers(html, requestedUrl, finalUrl), StandardCharsets.UTF_8,
                StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING);
        return file;
    }

    /** 저장된 페이지 파일(이름순) */
    public List<Path> pageFiles() throws IOException {
        if (!Files.isDirectory(dir)) return List.of();
        try (Stream<Path> s = Files.list(dir)) {
            return s.filter(p -> p.getFileName().toString().endsWith(".html"))
                    .sorted()
                    .collect(Collectors.toList());
        }
    }

    public StoredPage read(Path file) throws IOException {
        String html = Files.readString(file, StandardCharsets.UTF_8);
        return new StoredPage(file, html);
    }

    public void writeSummary(CrawlSummary summary) throws IOException {
        Files.createDirectories(dir);
        Path tmp = dir.resolve(SUMMARY_FILE + ".tmp");
        om.writerWithDefaultPrettyPrinter().writeValue(tmp.toFile(), summary);
        Files.move(tmp, dir.resolve(SUMMARY_FILE), StandardCopyOption.REPLACE_EXISTING);
    }

    public Optional<CrawlSummary> readSummary() throws IOException {
        Path f = dir.resolve(SUMMARY_FILE);
        if (!Files.exists(f)) return Optional.empty();
        return Optional.of(om.readValue(f.toFile(), CrawlSummary.class));
    }

    // ===== helpers =====

    /** MD5(url) 앞 12자리 hex */
    public static String fileNameFor(String url) {
        try {
            MessageDigest md = MessageDigest.getInstance("MD5");
            byte[] d = md.digest(url.getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(d).substring(0, 12) + ".html";
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("MD5 not available", e);
        }
    }

    static String injectMarkers(String html, String requestedUrl, String finalUrl) {
        String src = html == null ? "" : html;
        if (src.contains("<meta name=\"" + META_ORIGINAL + "\"")) return src;

        String tags = "\n" + meta(META_ORIGINAL, requestedUrl)
                + (finalUrl == null ? "" : "\n" + meta(META_FINAL, finalUrl)) + "\n";

        Matcher m = HEAD_OPEN.matcher(src);
        if (m.find()) {
            return src.substring(0, m.end()) + tags + src.substring(m.end());
        }
        // head 가 없으면 맨 앞에 둔다(파서가 head 로 옮겨준다)
        return tags.substring(1) + src;
    }

    private static String meta(String name, String content) {
        return "<meta name=\"" + name + "\" content=\"" + escapeAttr(content) + "\">";
    }

    static String escapeAttr(String s) {
        if (s == null) return "";
        return s.replace("&", "&amp;")
                .replace("\"", "&quot;")
                .replace("<", "&lt;")
                .replace(">", "&gt;");
    }
}
