package com.locationscout.core;

/** 테스트용 HTML 조립기. 기본 본문 패딩으로 오류 페이지 최소 크기(2000B)를 넘긴다. */
public final class TestPages {
    private TestPages() {}

    public static final String FILLER =
            "<div class=\"filler\"><p>" + "Lorem ipsum dolor sit amet consectetur adipiscing elit. ".repeat(40) + "</p></div>";

    public static final String FIVE_ADDRESSES = """
            <ul>
              <li>100 Main Street, Dallas, TX 75201</li>
              <li>200 Oak Avenue, Houston, TX 77002</li>
              <li>300 Pine Road, Austin, TX 73301</li>
              <li>400 Elm Drive, Denver, CO 80202</li>
              <li>500 Lake Boulevard, Chicago, IL 60601</li>
            </ul>
            """;

    /** lang="en", 제목 + 본문 + 패딩 */
    public static String page(String title, String body) {
        return page("en", title, body);
    }

    public static String page(String lang, String title, String body) {
        return "<!DOCTYPE html><html lang=\"" + lang + "\"><head><title>" + title + "</title></head><body>"
                + body + FILLER + "</body></html>";
    }

    /** 최소 크기 미만의 빈 껍데기 */
    public static String tiny(String title) {
        return "<html><head><title>" + title + "</title></head><body><p>Loading</p></body></html>";
    }
}
