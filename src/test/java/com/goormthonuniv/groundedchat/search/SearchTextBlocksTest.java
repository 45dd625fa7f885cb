package com.goormthonuniv.groundedchat.search;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class SearchTextBlocksTest {

    private final ObjectMapper om = new ObjectMapper();

    @Test
    void parseShouldReadLineOrientedBlocks() {
        String block = """
                Title: 颱風最新動態
                Description: 中央氣象署發布
                海上颱風警報
                URL: https://www.cwa.gov.tw/a

                Title: 台北天氣
                URL: https://weather.example.com/taipei
                Description: 午後雷陣雨
                """;

        List<SearchResult> results = SearchTextBlocks.parse(block, om);

        assertThat(results).containsExactly(
                new SearchResult("颱風最新動態", "https://www.cwa.gov.tw/a", "中央氣象署發布 海上颱風警報"),
                new SearchResult("台北天氣", "https://weather.example.com/taipei", "午後雷陣雨"));
    }

    @Test
    void parseShouldReadJsonShapes() {
        String web = "{\"web\":{\"results\":[{\"title\":\"A\",\"url\":\"https://a.example\",\"description\":\"d\"}]}}";
        String array = "[{\"title\":\"B\",\"url\":\"https://b.example\",\"snippet\":\"s\"},{\"title\":\"no url\"}]";
        String single = "{\"title\":\"C\",\"url\":\"https://c.example\"}";

        assertThat(SearchTextBlocks.parse(web, om)).containsExactly(new SearchResult("A", "https://a.example", "d"));
        assertThat(SearchTextBlocks.parse(array, om)).containsExactly(new SearchResult("B", "https://b.example", "s"));
        assertThat(SearchTextBlocks.parse(single, om)).containsExactly(new SearchResult("C", "https://c.example", ""));
    }

    @Test
    void parseShouldFallBackToLinesWhenJsonIsBroken() {
        assertThat(SearchTextBlocks.parse("{broken\nTitle: X\nURL: https://x.example", om))
                .containsExactly(new SearchResult("X", "https://x.example", ""));
        assertThat(SearchTextBlocks.parse("   ", om)).isEmpty();
    }
}
