package com.goormthonuniv.groundedchat.util;

import org.apache.commons.text.similarity.LevenshteinDistance;

import java.net.URI;
import java.util.Locale;
import java.util.regex.Pattern;

public final class TextUtils {
    private static final Pattern WS = Pattern.compile("\\s+");
    private static final LevenshteinDistance NEAR = new LevenshteinDistance(3);

    private TextUtils() {}

    public static String safe(String s) { return s == null ? "" : s; }

    public static boolean isBlank(String s) { return s == null || s.isBlank(); }

    /** 연속 공백/개행을 공백 하나로 */
    public static String collapseWhitespace(String s) {
        if (s == null) return "";
        return WS.matcher(s).replaceAll(" ").strip();
    }

    public static String truncate(String s, int max) {
        if (s == null) return "";
        return s.length() <= max ? s : s.substring(0, max);
    }

    /** URL → 소문자 호스트 ("www." 제거). 파싱 실패 시 빈 문자열 */
    public static String domainOf(String url) {
        try {
            String h = URI.create(url.strip()).getHost();
            if (h == null) return "";
            h = h.toLowerCase(Locale.ROOT);
            return h.startsWith("www.") ? h.substring(4) : h;
        } catch (Exception e) {
            return "";
        }
    }

    /** 제목 중복 판정: 정규화 후 편집거리 3 이하 */
    public static boolean nearDuplicate(String a, String b) {
        String x = collapseWhitespace(a).toLowerCase(Locale.ROOT);
        String y = collapseWhitespace(b).toLowerCase(Locale.ROOT);
        if (x.isEmpty() || y.isEmpty()) return false;
        int d = NEAR.apply(x, y);
        return d >= 0 && d <= Math.min(3, Math.min(x.length(), y.length()) / 4);
    }
}
