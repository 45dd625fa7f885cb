package com.goormthonuniv.groundedchat.search;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;
import org.springframework.web.util.UriComponentsBuilder;

import java.net.URI;
import java.util.*;

@Slf4j
@Component
@ConditionalOnProperty(name = "assistant.search.backend", havingValue = "brave", matchIfMissing = true)
public class BraveSearchAdapter implements SearchAdapter {

    private final RestClient rest;
    private final String endpoint;
    private final String apiKey;

    public BraveSearchAdapter(RestClient restClient,
                              @Value("${assistant.adapters.brave.endpoint:https://api.search.brave.com/res/v1/web/search}") String endpoint,
                              @Value("${assistant.adapters.brave.apiKey:}") String apiKey) {
        this.rest = restClient;
        this.endpoint = endpoint;
        this.apiKey = apiKey;
    }

    @Override public String name() { return "brave"; }

    @Override
    public List<SearchResult> search(String query, String country, String language, int count) {
        if (apiKey == null || apiKey.isBlank()) {
            log.warn("[brave] disabled: missing api key");
            return List.of();
        }
        if (query == null || query.isBlank()) return List.of();
        try {
            URI uri = UriComponentsBuilder.fromHttpUrl(endpoint)
                    .queryParam("q", query)
                    .queryParam("country", country)
                    .queryParam("search_lang", language)
                    .queryParam("count", count)
                    .queryParam("safesearch", "moderate")
                    .queryParam("text_decorations", "false")
                    .encode()
                    .build()
                    .toUri();

            Map<String, Object> res = rest.get().uri(uri)
                    .header("Accept", "application/json")
                    .header("X-Subscription-Token", apiKey)
                    .retrieve()
                    .body(new ParameterizedTypeReference<Map<String, Object>>() {});

            if (res == null) return List.of();

            Object web = res.get("web");
            Object raw = (web instanceof Map<?, ?> w) ? w.get("results") : null;
            List<?> list = (raw instanceof List<?> l) ? l : Collections.emptyList();

            List<SearchResult> out = new ArrayList<>();
            for (Object o : list) {
                if (!(o instanceof Map<?, ?> m)) continue;
                if (out.size() >= count) break;
                String title = Optional.ofNullable(m.get("title")).map(Object::toString).orElse("");
                String url   = Optional.ofNullable(m.get("url")).map(Object::toString).orElse("");
                String desc  = Optional.ofNullable(m.get("description")).map(Object::toString).orElse("");
                out.add(new SearchResult(title, url, desc));
            }
            return out;
        } catch (Exception e) {
            log.warn("[brave] search failed query=\"{}\": {}", query, e.getMessage());
            return List.of();
        }
    }
}
