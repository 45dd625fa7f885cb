package com.goormthonuniv.groundedchat.search;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * MCP 도구 응답의 text 블록을 검색 결과로 변환.
 * JSON(배열/객체)을 먼저 시도하고, 실패하면 "Title:/URL:/Description:" 줄 형식으로 읽는다.
 */
public final class SearchTextBlocks {

    private SearchTextBlocks() {}

    public static List<SearchResult> parse(String block, ObjectMapper om) {
        if (block == null || block.isBlank()) return List.of();
        String t = block.strip();
        if (t.startsWith("[") || t.startsWith("{")) {
            try {
                List<SearchResult> fromJson = fromJson(om.readTree(t));
                if (!fromJson.isEmpty()) return fromJson;
            } catch (IOException ignored) {
                // 줄 형식으로 진행
            }
        }
        return fromLines(t);
    }

    static List<SearchResult> fromJson(JsonNode root) {
        JsonNode items = root;
        if (root.isObject()) {
            if (root.path("web").path("results").isArray()) items = root.path("web").path("results");
            else if (root.path("results").isArray()) items = root.path("results");
            else items = JsonNodeFactory.instance.arrayNode().add(root);
        }
        List<SearchResult> out = new ArrayList<>();
        if (!items.isArray()) return out;
        for (JsonNode it : items) {
            String url = it.path("url").asText("");
            if (url.isBlank()) continue;
            out.add(new SearchResult(
                    it.path("title").asText(""),
                    url,
                    it.path("description").asText(it.path("snippet").asText(""))));
        }
        return out;
    }

    static List<SearchResult> fromLines(String text) {
        List<SearchResult> out = new ArrayList<>();
        String title = null, url = null, desc = null;
        for (String raw : text.split("\\r?\\n")) {
            String line = raw.strip();
            String lower = line.toLowerCase(Locale.ROOT);
            if (lower.startsWith("title:")) {
                if (url != null) out.add(new SearchResult(title, url, desc));
                title = line.substring(6).strip();
                url = null;
                desc = null;
            } else if (lower.startsWith("url:")) {
                url = line.substring(4).strip();
            } else if (lower.startsWith("description:")) {
                desc = line.substring(12).strip();
            } else if (!line.isEmpty() && desc != null) {
                desc = desc + " " + line;
            }
        }
        if (url != null) out.add(new SearchResult(title, url, desc));
        return out;
    }
}
