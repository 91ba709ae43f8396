package com.locationscout.core.discovery;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * robots.txt 에서 Sitemap: 지시어만 뽑는다(키 대소문자 무시, 주석 제거).
 * Allow/Disallow 는 보지 않는다.
 */
public final class RobotsSitemapParser {

    private RobotsSitemapParser() {}

    private static final Pattern KV = Pattern.compile("^\\s*([A-Za-z-]+)\\s*:\\s*(.*?)\\s*$");

    public static List<String> parse(String robotsTxt) {
        List<String> out = new ArrayList<>();
        if (robotsTxt == null || robotsTxt.isEmpty()) return out;

        for (String rawLine : robotsTxt.split("\\r?\\n")) {
            String line = stripComment(rawLine).trim();
            if (line.isEmpty()) continue;

            Matcher m = KV.matcher(line);
            if (!m.matches()) continue;

            if ("sitemap".equals(m.group(1).toLowerCase(Locale.ROOT))) {
                String val = m.group(2).trim();
                if (!val.isEmpty() && !out.contains(val)) out.add(val);
            }
        }
        return out;
    }

    // "#" 이후는 주석. 단, URL 안의 fragment 와 구분하기 위해 공백 뒤 '#' 만 주석으로 본다
    private static String stripComment(String s) {
        if (s.startsWith("#")) return "";
        int i = s.indexOf(" #");
        return i >= 0 ? s.substring(0, i) : s;
    }
}
