package com.goormthonuniv.groundedchat.fetch;

import com.goormthonuniv.groundedchat.config.AssistantProperties;
import org.junit.jupiter.api.Test;
import org.springframework.web.client.RestClient;

import static org.assertj.core.api.Assertions.assertThat;

class PageFetcherTest {

    @Test
    void extractTextShouldDropScriptsAndCollapseWhitespace() {
        String html = """
                <html><head><style>body{color:red}</style><script>var x = 1;</script></head>
                <body><h1>颱風  動態</h1>
                <noscript>請開啟 JavaScript</noscript>
                <p>中央氣象署&nbsp;發布
                   海上警報</p></body></html>""";

        assertThat(PageFetcher.extractText(html, 100)).isEqualTo("颱風 動態 中央氣象署 發布 海上警報");
        assertThat(PageFetcher.extractText(html, 5)).hasSize(5);
        assertThat(PageFetcher.extractText("", 100)).isEmpty();
    }

    @Test
    void fetchTextShouldRejectPrivateUrlsWithoutCallingNetwork() {
        PageFetcher fetcher = new PageFetcher(RestClient.create(), new AssistantProperties());

        assertThat(fetcher.fetchText("http://192.168.0.1/")).isEmpty();
        assertThat(fetcher.fetchText("http://localhost/")).isEmpty();
    }
}
