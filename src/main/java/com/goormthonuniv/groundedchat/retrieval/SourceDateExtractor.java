package com.goormthonuniv.groundedchat.retrieval;

import com.goormthonuniv.groundedchat.dto.FetchedPage;
import com.goormthonuniv.groundedchat.dto.SourceDateHints;
import com.goormthonuniv.groundedchat.search.SearchResult;

import java.time.Clock;
import java.time.DateTimeException;
import java.time.LocalDate;
import java.util.*;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 모델 생성과 무관하게 제목/설명/본문에서 게시일을 직접 뽑는다.
 * 출처마다 최선의 날짜 하나 + 그 합집합(허용 날짜 집합).
 */
public class SourceDateExtractor {

    // YYYY-MM-DD / YYYY/MM/DD / YYYY.MM.DD / YYYY年M月D日
    static final Pattern NUMERIC = Pattern.compile(
            "(?<!\\d)(20\\d{2})\\s*[./\\-年]\\s*(1[0-2]|0?[1-9])\\s*[./\\-月]\\s*(3[01]|[12]\\d|0?[1-9])(?!\\d)");

    // M月D日 (연도 없음)
    static final Pattern CJK_MONTH_DAY = Pattern.compile(
            "(?<![\\d年./\\-])(1[0-2]|0?[1-9])\\s*月\\s*(3[01]|[12]\\d|0?[1-9])\\s*[日號号]");

    private static final String MONTHS =
            "(Jan(?:uary)?|Feb(?:ruary)?|Mar(?:ch)?|Apr(?:il)?|May|June?|July?|Aug(?:ust)?|Sep(?:t(?:ember)?)?|Oct(?:ober)?|Nov(?:ember)?|Dec(?:ember)?)";

    // Feb 18, 2026
    static final Pattern MONTH_NAME_FIRST = Pattern.compile(
            "(?i)\\b" + MONTHS + "\\.?\\s+(\\d{1,2})(?:st|nd|rd|th)?,?\\s+(20\\d{2})\\b");

    // 18 February 2026
    static final Pattern DAY_FIRST = Pattern.compile(
            "(?i)\\b(\\d{1,2})\\s+" + MONTHS + "\\.?,?\\s+(20\\d{2})\\b");

    private final Clock clock;

    public SourceDateExtractor(Clock clock) {
        this.clock = clock;
    }

    /**
     * @param pages 검색 결과와 같은 순서(인덱스 정렬). 결과보다 짧을 수 있다.
     */
    public SourceDateHints extract(List<SearchResult> results, List<FetchedPage> pages) {
        Map<Integer, String> byIndex = new LinkedHashMap<>();
        Set<String> allowed = new LinkedHashSet<>();
        for (int i = 0; i < results.size(); i++) {
            SearchResult r = results.get(i);
            String pageText = i < pages.size() ? pages.get(i).text() : "";
            String hint = bestGuess(r.title() + " " + r.description(), pageText)
                    .map(LocalDate::toString)
                    .orElse(SourceDateHints.NO_DATE);
            byIndex.put(i + 1, hint);
            allowed.add(hint);
        }
        return new SourceDateHints(byIndex, allowed);
    }

    /** 제목/설명의 첫 날짜, 없으면 본문에서 미래가 아닌 가장 최근 날짜 */
    Optional<LocalDate> bestGuess(String headline, String body) {
        Optional<LocalDate> first = findAll(headline).stream().findFirst();
        if (first.isPresent()) return first;
        return findAll(body).stream().max(Comparator.naturalOrder());
    }

    /** 본문 순서대로, 미래 날짜(내일 이후)는 제외 */
    public List<LocalDate> findAll(String text) {
        if (text == null || text.isBlank()) return List.of();
        LocalDate today = LocalDate.now(clock);
        TreeMap<Integer, LocalDate> byPosition = new TreeMap<>();

        Matcher m = NUMERIC.matcher(text);
        while (m.find()) {
            toDate(Integer.parseInt(m.group(1)), Integer.parseInt(m.group(2)), Integer.parseInt(m.group(3)))
                    .ifPresent(d -> byPosition.putIfAbsent(m.start(), d));
        }
        Matcher c = CJK_MONTH_DAY.matcher(text);
        while (c.find()) {
            int mm = Integer.parseInt(c.group(1));
            int dd = Integer.parseInt(c.group(2));
            // 연도 없는 날짜는 올해로 보되, 미래로 넘어가면 작년으로
            Optional<LocalDate> d = toDate(today.getYear(), mm, dd);
            if (d.isPresent() && d.get().isAfter(today.plusDays(1))) d = toDate(today.getYear() - 1, mm, dd);
            d.ifPresent(x -> byPosition.putIfAbsent(c.start(), x));
        }
        Matcher a = MONTH_NAME_FIRST.matcher(text);
        while (a.find()) {
            toDate(Integer.parseInt(a.group(3)), month(a.group(1)), Integer.parseInt(a.group(2)))
                    .ifPresent(d -> byPosition.putIfAbsent(a.start(), d));
        }
        Matcher b = DAY_FIRST.matcher(text);
        while (b.find()) {
            toDate(Integer.parseInt(b.group(3)), month(b.group(2)), Integer.parseInt(b.group(1)))
                    .ifPresent(d -> byPosition.putIfAbsent(b.start(), d));
        }

        List<LocalDate> out = new ArrayList<>();
        for (LocalDate d : byPosition.values()) {
            if (!d.isAfter(today.plusDays(1))) out.add(d);
        }
        return out;
    }

    private static int month(String name) {
        return switch (name.substring(0, 3).toLowerCase(Locale.ROOT)) {
            case "jan" -> 1;
            case "feb" -> 2;
            case "mar" -> 3;
            case "apr" -> 4;
            case "may" -> 5;
            case "jun" -> 6;
            case "jul" -> 7;
            case "aug" -> 8;
            case "sep" -> 9;
            case "oct" -> 10;
            case "nov" -> 11;
            default -> 12;
        };
    }

    private static Optional<LocalDate> toDate(int y, int m, int d) {
        try {
            return Optional.of(LocalDate.of(y, m, d));
        } catch (DateTimeException e) {
            return Optional.empty();
        }
    }
}
