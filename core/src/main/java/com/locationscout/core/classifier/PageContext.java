package com.locationscout.core.classifier;

import com.locationscout.core.util.UrlUtils;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;

import java.nio.charset.StandardCharsets;
import java.util.Locale;

/**
 * 분류 대상 페이지 1건(파싱 결과 + 자주 쓰는 소문자 사본).
 * 탐지기들이 같은 파싱 결과를 공유한다. 본문 텍스트는 처음 요청 시 한 번만 만든다.
 */
public final class PageContext {

    /** 본문 추출 시 제거할 보일러플레이트 영역(class 기준) */
    static final String BOILERPLATE_CLASS = "[class~=(?i)(footer|header|nav-|navbar|menu|copyright)]";

    private final String html;
    private final String htmlLower;
    private final String url;
    private final String urlLower;
    private final String pathLower;
    private final Document doc;
    private final String title;
    private String mainText;

    private PageContext(String html, String url) {
        this.html = html == null ? "" : html;
        this.htmlLower = this.html.toLowerCase(Locale.ROOT);
        this.url = url == null ? "" : url;
        this.urlLower = this.url.toLowerCase(Locale.ROOT);
        this.pathLower = UrlUtils.pathAndQuery(this.url);
        this.doc = Jsoup.parse(this.html, this.url);
        this.title = doc.title() == null ? "" : doc.title().trim();
    }

    public static PageContext of(String html, String url) {
        return new PageContext(html, url);
    }

    public String html() { return html; }
    public String htmlLower() { return htmlLower; }
    public String url() { return url; }
    public String urlLower() { return urlLower; }
    /** path + query (host 제외, 소문자) */
    public String pathLower() { return pathLower; }
    public Document document() { return doc; }
    public String title() { return title; }
    public String titleLower() { return title.toLowerCase(Locale.ROOT); }

    public int htmlBytes() {
        return html.getBytes(StandardCharsets.UTF_8).length;
    }

    /** &lt;html lang&gt; 값(소문자, 없으면 "") */
    public String declaredLang() {
        Element root = doc.selectFirst("html");
        return root == null ? "" : root.attr("lang").trim().toLowerCase(Locale.ROOT);
    }

    /** header/footer/nav 및 보일러플레이트 class 영역을 뺀 본문 텍스트 */
    public String mainText() {
        if (mainText == null) {
            Document copy = doc.clone();
            copy.select("header, footer, nav").remove();
            copy.select(BOILERPLATE_CLASS).remove();
            Element body = copy.body();
            mainText = body == null ? copy.text() : body.text();
        }
        return mainText;
    }
}
