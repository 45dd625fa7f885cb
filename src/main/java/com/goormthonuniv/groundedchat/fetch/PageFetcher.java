package com.goormthonuniv.groundedchat.fetch;

import com.goormthonuniv.groundedchat.config.AssistantProperties;
import com.goormthonuniv.groundedchat.util.TextUtils;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;

import java.net.URI;

@Slf4j
@Component
public class PageFetcher {

    private final RestClient rest;
    private final int maxChars;

    public PageFetcher(@Qualifier("pageRestClient") RestClient pageRestClient, AssistantProperties props) {
        this.rest = pageRestClient;
        this.maxChars = props.getFetch().getMaxChars();
    }

    /**
     * 공개 URL 의 본문 텍스트. 거부/실패 시 빈 문자열.
     */
    public String fetchText(String url) {
        if (!PublicUrlPolicy.isPublicHttpUrl(url)) {
            log.debug("[fetch] rejected non-public url={}", url);
            return "";
        }
        try {
            String html = rest.get().uri(URI.create(url.strip())).retrieve().body(String.class);
            return extractText(html, maxChars);
        } catch (Exception e) {
            log.debug("[fetch] failed url={}: {}", url, e.getMessage());
            return "";
        }
    }

    /** script/style/noscript 제거 후 공백 정리, 글자 수 제한 */
    public static String extractText(String html, int maxChars) {
        if (html == null || html.isBlank()) return "";
        Document doc = Jsoup.parse(html);
        doc.select("script,style,noscript").remove();
        String text = TextUtils.collapseWhitespace(doc.text().replace('\u00A0', ' '));
        return TextUtils.truncate(text, maxChars);
    }
}
