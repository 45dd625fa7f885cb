package com.goormthonuniv.groundedchat.validate;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/** 뉴스 답변의 bullet / 선두 날짜 / 인용 번호 파싱 */
public final class NewsBullets {

    private static final Pattern BULLET = Pattern.compile("^\\s*(?:[-*•‧]|\\d{1,2}[.)、])\\s+(.*)$");
    private static final Pattern LEADING_DATE = Pattern.compile("^(?:\\*\\*)?\\s*(\\d{4}-\\d{2}-\\d{2}|\\[none])");
    private static final Pattern CITATION = Pattern.compile("\\[(\\d{1,3})]");

    private NewsBullets() {}

    public static List<String> bullets(String text) {
        List<String> out = new ArrayList<>();
        for (String line : lines(text)) {
            Matcher m = BULLET.matcher(line);
            if (m.matches()) out.add(m.group(1).strip());
        }
        return out;
    }

    public static Optional<String> leadingDate(String bullet) {
        Matcher m = LEADING_DATE.matcher(bullet == null ? "" : bullet.strip());
        return m.find() ? Optional.of(m.group(1)) : Optional.empty();
    }

    /** 1..sourceCount 범위의 인용 번호만, 등장 순서대로 */
    public static Set<Integer> citations(String text, int sourceCount) {
        Set<Integer> out = new LinkedHashSet<>();
        Matcher m = CITATION.matcher(text == null ? "" : text);
        while (m.find()) {
            int n = Integer.parseInt(m.group(1));
            if (n >= 1 && n <= sourceCount) out.add(n);
        }
        return out;
    }

    /** 선두 날짜 토큰과 인용 표시를 떼어낸 본문 */
    public static String stripMarkers(String bullet) {
        String s = LEADING_DATE.matcher(bullet.strip()).replaceFirst("");
        s = CITATION.matcher(s).replaceAll("");
        return s.replaceAll("^[\\s:：|\\-*]+", "").strip();
    }

    /** limit 번째 이후 bullet 과 그 이어지는 줄을 지운다. 빈 줄 뒤 문단은 남긴다. */
    public static String cap(String text, int limit) {
        if (limit <= 0) return text;
        StringBuilder out = new StringBuilder();
        int seen = 0;
        boolean dropping = false;
        for (String line : lines(text)) {
            if (BULLET.matcher(line).matches()) {
                seen++;
                dropping = seen > limit;
            } else if (line.isBlank()) {
                dropping = false;
            }
            if (!dropping) out.append(line).append('\n');
        }
        return out.toString().replaceAll("\n{3,}", "\n\n").strip();
    }

    private static String[] lines(String text) {
        return (text == null ? "" : text).split("\\r?\\n", -1);
    }
}
