package com.goormthonuniv.groundedchat.dto;

import java.util.Collections;
import java.util.Map;
import java.util.Set;

/**
 * 출처별 게시일 추정치 (인용 번호 → ISO 날짜 또는 "[none]")와 허용 날짜 집합.
 */
public record SourceDateHints(
        Map<Integer, String> byIndex,
        Set<String> allowed
) {
    public static final String NO_DATE = "[none]";

    public SourceDateHints {
        byIndex = byIndex == null ? Map.of() : Collections.unmodifiableMap(byIndex);
        allowed = allowed == null ? Set.of() : Collections.unmodifiableSet(allowed);
    }

    public static SourceDateHints empty() { return new SourceDateHints(Map.of(), Set.of()); }

    public String hintFor(int index) { return byIndex.getOrDefault(index, NO_DATE); }

    public boolean isAllowed(String token) { return allowed.contains(token); }
}
