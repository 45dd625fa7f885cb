package com.goormthonuniv.groundedchat.prompt;

import com.goormthonuniv.groundedchat.config.AssistantProperties;
import com.goormthonuniv.groundedchat.dto.FetchedPage;
import com.goormthonuniv.groundedchat.dto.Profile;
import com.goormthonuniv.groundedchat.dto.SourceDateHints;
import com.goormthonuniv.groundedchat.dto.Turn;
import com.goormthonuniv.groundedchat.llm.ChatMessage;
import com.goormthonuniv.groundedchat.planner.IntentPlan;
import com.goormthonuniv.groundedchat.retrieval.RetrievalBundle;
import com.goormthonuniv.groundedchat.search.SearchResult;
import com.goormthonuniv.groundedchat.util.TextUtils;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * 생성 호출에 넣을 system 지시문 스택을 고정 순서로 조립한다.
 * 페르소나 → 프로필 → 검색 블록 → 뉴스 → 날씨 → 근거(하나만) → 대화 기록
 */
@Component
public class PromptAssembler {

    static final String PERSONA = """
            You are a helpful chat assistant. Be concise and accurate.
            Reply in the user's language unless told otherwise.""";

    private final AssistantProperties props;

    public PromptAssembler(AssistantProperties props) {
        this.props = props;
    }

    public List<ChatMessage> assemble(IntentPlan plan, RetrievalBundle bundle, Profile profile, List<Turn> window) {
        List<ChatMessage> out = new ArrayList<>();
        out.add(ChatMessage.system(PERSONA));

        // 프로필
        if (profile != null) {
            if (!TextUtils.isBlank(profile.preferredLanguage())) {
                out.add(ChatMessage.system(LanguageDirectives.directive(profile.preferredLanguage())));
            }
            if (Boolean.TRUE.equals(profile.preferLinks())) {
                out.add(ChatMessage.system("The user likes to know where information comes from. "
                        + "Mark every sourced claim with its [n] citation; source links are appended separately."));
            } else if (Boolean.FALSE.equals(profile.preferLinks())) {
                out.add(ChatMessage.system("The user does not want links. Never include URLs in the answer."));
            }
            if (!TextUtils.isBlank(profile.conversationSummary())) {
                out.add(ChatMessage.system("Summary of the earlier conversation (context only, may be outdated):\n"
                        + profile.conversationSummary().strip()));
            }
        }

        if (plan.webSearch() && bundle.attempted()) {
            if (bundle.hasResults()) {
                out.add(ChatMessage.system(searchBlock(bundle, plan.news())));
                if (plan.news()) out.add(ChatMessage.system(newsDirective(plan, bundle)));
                if (plan.weather()) out.add(ChatMessage.system(weatherDirective(plan)));
                evidence(bundle).ifPresent(e -> out.add(ChatMessage.system(e)));
            } else {
                out.add(ChatMessage.system("Web search was requested, but no sources were found. "
                        + "Say briefly that you couldn't find sources, then answer from general knowledge."));
            }
        }

        for (Turn t : history(window, plan.recencySensitive())) {
            out.add(t.isUser() ? ChatMessage.user(t.content()) : ChatMessage.assistant(t.content()));
        }
        return out;
    }

    String searchBlock(RetrievalBundle bundle, boolean news) {
        StringBuilder sb = new StringBuilder()
                .append("Web search results are provided. Use them first.\n")
                .append("Do NOT paste URLs in the answer. Cite sources with [n] only.\n")
                .append("Web search results:\n");
        List<SearchResult> results = bundle.results();
        for (int i = 0; i < results.size(); i++) {
            SearchResult r = results.get(i);
            int n = i + 1;
            sb.append('[').append(n).append("] ").append(r.title())
                    .append("\nDomain: ").append(TextUtils.domainOf(r.url()));
            if (news) sb.append("\nDate: ").append(bundle.dateHints().hintFor(n));
            sb.append("\n\n");
        }
        return sb.toString().strip();
    }

    String newsDirective(IntentPlan plan, RetrievalBundle bundle) {
        int count = Math.min(plan.itemLimit() > 0 ? plan.itemLimit() : props.getNews().getMaxItems(),
                bundle.results().size());
        String allowed = String.join(", ", bundle.dateHints().allowed());
        StringBuilder sb = new StringBuilder()
                .append("The user is asking for news. ")
                .append("List ").append(count).append(" distinct news items if the sources allow. ")
                .append("Return a bullet list. Each bullet: the date, a short headline, a 1-2 sentence summary and a citation like [n]. ")
                .append("Start every bullet with the item's date as YYYY-MM-DD, or ").append(SourceDateHints.NO_DATE)
                .append(" when the source has no date.\n");
        if (!allowed.isEmpty()) {
            sb.append("Use ONLY these dates: ").append(allowed).append(". Never invent or shift a date.\n");
        }
        sb.append("Each bullet must cite a different source index when possible. Do NOT merge several news into one bullet.");
        if (plan.reuse()) {
            sb.append("\nThe user asked for more items from the same search. Prefer items you have not covered in earlier answers.");
        }
        return sb.toString();
    }

    String weatherDirective(IntentPlan plan) {
        String where = TextUtils.isBlank(plan.weatherLocation()) ? "" : " for " + plan.weatherLocation();
        return "This is a weather question" + where + ". You MUST answer from the provided web content. "
                + "Do NOT say you cannot provide real-time information. "
                + "Do NOT invent numbers that are not in the sources; if the sources lack them, say so "
                + "and suggest a narrower time window or district. "
                + "Structure: 概況 / 溫度範圍 / 降雨機率 / 注意事項. Cite sources with [n].";
    }

    /** 요약 > 수집 본문 > 검색 스니펫, 하나만 */
    Optional<String> evidence(RetrievalBundle bundle) {
        if (!bundle.summaries().isEmpty()) {
            String body = bundle.summaries().stream()
                    .map(s -> "[" + s.index() + "] " + s.title() + " (" + s.domain() + ")\n" + s.text())
                    .collect(Collectors.joining("\n\n"));
            return Optional.of("Per-source summaries are provided. Prefer them to answer. "
                    + "Cite sources with [n]. Do NOT include URLs.\nSource summaries:\n" + body);
        }
        if (bundle.hasPageText()) {
            List<String> blocks = new ArrayList<>();
            List<FetchedPage> pages = bundle.pages();
            for (int i = 0; i < pages.size(); i++) {
                FetchedPage p = pages.get(i);
                if (!p.hasText()) continue;
                blocks.add("[" + (i + 1) + "] " + p.title() + "\nDomain: " + TextUtils.domainOf(p.url())
                        + "\nContent:\n" + p.text());
            }
            return Optional.of("Fetched page contents are provided. Prefer them to answer. "
                    + "Cite sources with [n]. Do NOT include URLs.\nFetched contents:\n" + String.join("\n\n", blocks));
        }
        List<SearchResult> results = bundle.results();
        List<String> snippets = new ArrayList<>();
        for (int i = 0; i < results.size(); i++) {
            if (!results.get(i).description().isEmpty()) {
                snippets.add("[" + (i + 1) + "] " + results.get(i).description());
            }
        }
        if (snippets.isEmpty()) return Optional.empty();
        return Optional.of("Only search snippets are available. Answer from them and cite with [n].\nSnippets:\n"
                + String.join("\n", snippets));
    }

    /** 최신성 질문이면 이전 어시스턴트 답을 빼고 최근 사용자 턴 몇 개만 남긴다. */
    List<Turn> history(List<Turn> window, boolean recencySensitive) {
        if (window == null || window.isEmpty()) return List.of();
        if (!recencySensitive) return window;
        List<Turn> users = window.stream().filter(Turn::isUser).toList();
        int keep = Math.max(1, props.getMemory().getRecencyUserTurns());
        return users.size() <= keep ? users : users.subList(users.size() - keep, users.size());
    }
}
