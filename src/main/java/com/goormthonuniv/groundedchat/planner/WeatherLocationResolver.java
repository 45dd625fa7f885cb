package com.goormthonuniv.groundedchat.planner;

import com.goormthonuniv.groundedchat.dto.Profile;

import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * 날씨 질문의 지역 해석: (a) 알려진 지역 목록 → (b) "지역 + 날씨명사" 패턴 → (c) 프로필 기본 지역.
 */
public class WeatherLocationResolver {

    private static final Pattern EN_WEATHER = Pattern.compile(
            "(?i)weather\\s+(?:in|for|at)\\s+([A-Za-z][A-Za-z .'-]{1,40}?)(?:\\s+(?:today|tomorrow|now)|[?.!,]|$)");

    private final HeuristicLexicon lexicon;
    private final Pattern cjkWeather;

    public WeatherLocationResolver(HeuristicLexicon lexicon) {
        this.lexicon = lexicon;
        String nouns = alternation(lexicon.weatherNouns());
        String times = alternation(lexicon.timeWords());
        this.cjkWeather = Pattern.compile(
                "([\\p{IsHan}]{2,8}?)\\s*(?:的)?\\s*(?:" + times + ")?\\s*(?:的)?\\s*(?:" + nouns + ")");
    }

    public Optional<String> resolve(String text, Profile profile) {
        Optional<String> explicit = fromText(text);
        if (explicit.isPresent()) return explicit;
        if (profile != null && profile.defaultWeatherLocation() != null && !profile.defaultWeatherLocation().isBlank()) {
            return Optional.of(profile.defaultWeatherLocation());
        }
        return Optional.empty();
    }

    /** 프로필을 보지 않고 본문에서만 지역을 찾는다. */
    public Optional<String> fromText(String text) {
        if (text == null || text.isBlank()) return Optional.empty();

        for (String loc : lexicon.knownLocations()) {
            if (text.contains(loc)) return Optional.of(loc);
        }

        Matcher m = cjkWeather.matcher(text);
        while (m.find()) {
            String candidate = cleanCandidate(m.group(1));
            if (candidate != null) return Optional.of(candidate);
        }

        Matcher en = EN_WEATHER.matcher(text);
        if (en.find()) {
            String c = en.group(1).strip();
            if (!c.isEmpty()) return Optional.of(c);
        }
        return Optional.empty();
    }

    /** 행정 접미사(市/縣) 제거 */
    public String normalize(String location) {
        String t = location == null ? "" : location.strip();
        for (String suffix : lexicon.locationSuffixes()) {
            if (t.length() > suffix.length() && t.endsWith(suffix)) {
                return t.substring(0, t.length() - suffix.length());
            }
        }
        return t;
    }

    private String cleanCandidate(String raw) {
        String c = raw.strip();
        boolean changed = true;
        while (changed) {
            changed = false;
            for (String filler : lexicon.locationFillerPrefixes()) {
                if (c.startsWith(filler)) {
                    c = c.substring(filler.length());
                    changed = true;
                }
            }
            for (String tw : lexicon.timeWords()) {
                if (c.startsWith(tw)) {
                    c = c.substring(tw.length());
                    changed = true;
                }
            }
        }
        for (String tw : lexicon.timeWords()) {
            if (c.endsWith(tw)) c = c.substring(0, c.length() - tw.length());
        }
        if (c.length() < 2 || lexicon.locationStopwords().contains(c)) return null;
        return c;
    }

    private static String alternation(List<String> words) {
        return words.stream().map(Pattern::quote).collect(Collectors.joining("|"));
    }
}
