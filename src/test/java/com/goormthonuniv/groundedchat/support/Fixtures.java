package com.goormthonuniv.groundedchat.support;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.goormthonuniv.groundedchat.dto.PlanDecision;
import com.goormthonuniv.groundedchat.planner.HeuristicLexicon;
import com.goormthonuniv.groundedchat.planner.IntentPlan;
import com.goormthonuniv.groundedchat.search.SearchResult;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;

public final class Fixtures {

    public static final ZoneId TAIPEI = ZoneId.of("Asia/Taipei");
    /** 2026-02-18 10:00 (Asia/Taipei) */
    public static final Clock CLOCK = Clock.fixed(Instant.parse("2026-02-18T02:00:00Z"), TAIPEI);

    private static HeuristicLexicon lexicon;

    private Fixtures() {}

    public static synchronized HeuristicLexicon lexicon() {
        if (lexicon == null) lexicon = HeuristicLexicon.load(new ObjectMapper());
        return lexicon;
    }

    public static IntentPlan newsPlan(int itemLimit, boolean recent) {
        return new IntentPlan(new PlanDecision(PlanDecision.Tool.WEB_SEARCH, "新聞"),
                false, itemLimit, false, null, false, true, recent, false, false);
    }

    public static IntentPlan plainSearchPlan(boolean wantsLinks) {
        return new IntentPlan(new PlanDecision(PlanDecision.Tool.WEB_SEARCH, "q"),
                false, 0, false, null, false, false, false, wantsLinks, false);
    }

    public static List<SearchResult> results(int n) {
        List<SearchResult> out = new ArrayList<>();
        for (int i = 1; i <= n; i++) {
            out.add(new SearchResult("標題" + i, "https://news" + i + ".example.com/a" + i, "摘要" + i));
        }
        return out;
    }
}
