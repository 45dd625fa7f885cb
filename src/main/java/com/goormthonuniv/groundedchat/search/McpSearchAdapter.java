package com.goormthonuniv.groundedchat.search;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.*;

/**
 * MCP brave-search 서버(서브프로세스)를 통한 검색. 결과 형태는 {@link BraveSearchAdapter} 와 같다.
 */
@Slf4j
@Component
@ConditionalOnProperty(name = "assistant.search.backend", havingValue = "mcp")
public class McpSearchAdapter implements SearchAdapter {

    private final McpStdioClient client;
    private final String toolName;
    private final ObjectMapper om;

    public McpSearchAdapter(ObjectMapper om,
                            @Value("${assistant.adapters.mcp.command:npx}") String command,
                            @Value("${assistant.adapters.mcp.args:-y @modelcontextprotocol/server-brave-search}") String args,
                            @Value("${assistant.adapters.mcp.tool:brave_web_search}") String toolName,
                            @Value("${assistant.adapters.brave.apiKey:}") String apiKey) {
        List<String> cmd = new ArrayList<>();
        cmd.add(command);
        for (String a : args.split("\\s+")) if (!a.isBlank()) cmd.add(a);
        this.client = new McpStdioClient(cmd, Map.of("BRAVE_API_KEY", apiKey), Duration.ofSeconds(30), om);
        this.toolName = toolName;
        this.om = om;
    }

    McpSearchAdapter(McpStdioClient client, String toolName, ObjectMapper om) {
        this.client = client;
        this.toolName = toolName;
        this.om = om;
    }

    @Override public String name() { return "mcp_brave"; }

    @Override
    public List<SearchResult> search(String query, String country, String language, int count) {
        if (query == null || query.isBlank()) return List.of();
        try {
            JsonNode result = client.callTool(toolName, Map.of("query", query, "count", count));
            List<SearchResult> out = new ArrayList<>();
            for (JsonNode block : result.path("content")) {
                if (!"text".equals(block.path("type").asText())) continue;
                out.addAll(SearchTextBlocks.parse(block.path("text").asText(""), om));
            }
            return out.size() > count ? out.subList(0, count) : out;
        } catch (Exception e) {
            log.warn("[mcp] search failed query=\"{}\": {}", query, e.getMessage());
            return List.of();
        }
    }

    @PreDestroy
    public void shutdown() {
        client.close();
    }
}
