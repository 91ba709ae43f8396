package com.locationscout.core.util;

import java.net.URI;
import java.util.Collection;
import java.util.List;
import java.util.Locale;

/** URL 정규화 + same-domain 판정 유틸 */
public final class UrlUtils {
    private UrlUtils(){}

    /** 루트 URL 등 차단 목록 없이 정규화할 때 사용 */
    public static String normalize(String raw, String base) {
        return normalize(raw, base, List.of());
    }

    /**
     * 정규화 규칙:
     * - 빈 문자열/공백 거부
     * - 차단 목록 거부: "/" 또는 "."로 시작하는 항목은 path+query에서, 나머지는 원문 전체에서 검사
     * - "//host/..." 는 https 로, 상대 경로는 base 기준으로 해석
     * - http/https 만 허용
     * - fragment 제거, host 소문자, 기본 포트 제거, query 유지
     * - 끝 슬래시 제거(루트 "/" 제외)
     *
     * @return 정규화된 절대 URL, 거부되면 null
     */
    public static String normalize(String raw, String base, Collection<String> denylist) {
        if (raw == null) return null;
        String s = raw.trim();
        if (s.isEmpty()) return null;

        String lowerRaw = s.toLowerCase(Locale.ROOT);
        if (denylist != null) {
            for (String d : denylist) {
                if (!isPathPattern(d) && lowerRaw.contains(d.toLowerCase(Locale.ROOT))) return null;
            }
        }

        if (s.startsWith("//")) s = "https:" + s;

        URI u;
        try {
            u = resolve(base, s.replace(" ", "%20"));
        } catch (IllegalArgumentException e) {
            return null; // 파싱 불가 링크
        }
        if (u == null) return null;

        String scheme = u.getScheme() == null ? "" : u.getScheme().toLowerCase(Locale.ROOT);
        if (!scheme.equals("http") && !scheme.equals("https")) return null;

        String host = u.getHost();
        if (host == null || host.isEmpty()) return null;
        host = host.toLowerCase(Locale.ROOT);

        int port = u.getPort();
        if ((scheme.equals("http") && port == 80) || (scheme.equals("https") && port == 443)) {
            port = -1; // 기본 포트 제거
        }

        String path = u.getRawPath();
        if (path == null || path.isEmpty()) path = "/";
        while (path.length() > 1 && path.endsWith("/")) {
            path = path.substring(0, path.length() - 1);
        }
        String query = u.getRawQuery();

        if (denylist != null) {
            String tail = (path + (query == null ? "" : "?" + query)).toLowerCase(Locale.ROOT);
            for (String d : denylist) {
                if (isPathPattern(d) && tail.contains(d.toLowerCase(Locale.ROOT))) return null;
            }
        }

        StringBuilder sb = new StringBuilder(scheme.length() + host.length() + path.length() + 16);
        sb.append(scheme).append("://").append(host);
        if (port != -1) sb.append(':').append(port);
        sb.append(path);
        if (query != null) sb.append('?').append(query);
        return sb.toString();
    }

    /** 이미 정규화된 URL 이 차단 목록에 걸리는지(normalize 와 같은 규칙) */
    public static boolean isDenied(String url, Collection<String> denylist) {
        if (denylist == null || denylist.isEmpty()) return false;
        return normalize(url, null, denylist) == null;
    }

    /** host 가 domain 과 같거나 그 서브도메인이면 true (양쪽 선행 "www." 무시) */
    public static boolean sameDomain(String url, String domain) {
        if (url == null || domain == null) return false;
        String host = hostOf(url);
        if (host == null) return false;
        String h = stripWww(host);
        String d = stripWww(domain.trim().toLowerCase(Locale.ROOT));
        if (d.isEmpty()) return false;
        return h.equals(d) || h.endsWith("." + d);
    }

    /** 사이트 도메인: 소문자 host, 선행 "www." 제거. 파싱 실패 시 빈 문자열 */
    public static String extractDomain(String url) {
        String host = hostOf(url);
        return host == null ? "" : stripWww(host);
    }

    /** 페이지 저장 디렉터리 이름: 도메인의 '.' → '_' */
    public static String siteDirName(String domain) {
        if (domain == null || domain.isBlank()) return "unknown-site";
        return domain.replace('.', '_').replace('/', '_');
    }

    /** http(s) 스킴과 host 를 가진 URL 인지 */
    public static boolean isHttpUrl(String url) {
        if (url == null || url.isBlank()) return false;
        String lower = url.trim().toLowerCase(Locale.ROOT);
        if (!lower.startsWith("http://") && !lower.startsWith("https://")) return false;
        return hostOf(url.trim()) != null;
    }

    /** path + query (소문자). 분류기의 카테고리 판정용 */
    public static String pathAndQuery(String url) {
        try {
            URI u = URI.create(url);
            String p = u.getRawPath() == null ? "" : u.getRawPath();
            String q = u.getRawQuery();
            return (q == null ? p : p + "?" + q).toLowerCase(Locale.ROOT);
        } catch (IllegalArgumentException e) {
            return url.toLowerCase(Locale.ROOT);
        }
    }

    // ===== helpers =====
    private static boolean isPathPattern(String d) {
        return d.startsWith("/") || d.startsWith(".");
    }

    private static URI resolve(String base, String s) {
        URI ref = URI.create(s);
        if (ref.isAbsolute() || base == null || base.isBlank()) return ref;
        URI b = URI.create(base.trim());
        // "https://x.com" 처럼 path 가 비면 resolve 결과가 깨지므로 "/" 보정
        if (b.getRawPath() == null || b.getRawPath().isEmpty()) {
            b = URI.create(base.trim() + "/");
        }
        return b.resolve(ref);
    }

    private static String hostOf(String url) {
        try {
            String h = URI.create(url.trim()).getHost();
            return (h == null || h.isEmpty()) ? null : h.toLowerCase(Locale.ROOT);
        } catch (IllegalArgumentException e) {
            return null;
        }
    }

    private static String stripWww(String host) {
        return host.startsWith("www.") ? host.substring(4) : host;
    }
}
