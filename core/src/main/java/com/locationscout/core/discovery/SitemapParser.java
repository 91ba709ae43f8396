package com.locationscout.core.discovery;

import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.parser.Parser;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * sitemap XML 파서 (jsoup XML 모드).
 * - sitemapindex: 하위 sitemap 의 loc 목록
 * - urlset: url > loc 목록
 * XML 로 보이지 않으면 빈 결과(잘못된 단위는 건너뛰고 진행).
 */
public final class SitemapParser {

    private SitemapParser() {}

    public record Sitemap(boolean index, List<String> locations) {
        public static final Sitemap EMPTY = new Sitemap(false, List.of());
    }

    /** "<?xml" 로 시작하거나 urlset/sitemapindex 태그가 있으면 XML 로 본다 */
    public static boolean looksLikeXml(String body) {
        if (body == null) return false;
        String head = body.stripLeading();
        if (head.startsWith("<?xml")) return true;
        String lower = body.toLowerCase(Locale.ROOT);
        return lower.contains("<urlset") || lower.contains("<sitemapindex");
    }

    public static Sitemap parse(String xml) {
        if (!looksLikeXml(xml)) return Sitemap.EMPTY;
        Document doc = Jsoup.parse(xml, "", Parser.xmlParser());

        boolean index = !doc.getElementsByTag("sitemapindex").isEmpty();
        List<String> out = new ArrayList<>();
        String container = index ? "sitemap" : "url";
        for (Element e : doc.getElementsByTag(container)) {
            Element loc = e.getElementsByTag("loc").first();
            if (loc == null) continue;
            String v = loc.text().trim();
            if (!v.isEmpty()) out.add(v);
        }
        return new Sitemap(index, List.copyOf(out));
    }
}
