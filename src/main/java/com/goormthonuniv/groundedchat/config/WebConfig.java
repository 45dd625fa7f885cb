package com.goormthonuniv.groundedchat.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.goormthonuniv.groundedchat.planner.HeuristicLexicon;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;
import org.springframework.http.client.JdkClientHttpRequestFactory;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.web.client.RestClient;
import org.springframework.web.servlet.config.annotation.CorsRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

import java.net.http.HttpClient;
import java.time.Clock;
import java.time.Duration;
import java.time.ZoneId;

@Configuration
public class WebConfig {

    /** 모델/검색 API 호출용. 호출별 재시도 없음, 타임아웃만 둔다. */
    @Bean
    @Primary
    public RestClient restClient(RestClient.Builder builder,
                                 @Value("${assistant.http.timeout:60s}") Duration timeout) {
        HttpClient http = HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(10))
                .build();
        JdkClientHttpRequestFactory factory = new JdkClientHttpRequestFactory(http);
        factory.setReadTimeout(timeout);
        return builder.requestFactory(factory).build();
    }

    /** 페이지 수집용: 리다이렉트 추적 + 고정 타임아웃 */
    @Bean
    public RestClient pageRestClient(AssistantProperties props) {
        HttpClient http = HttpClient.newBuilder()
                .followRedirects(HttpClient.Redirect.NORMAL)
                .connectTimeout(props.getFetch().getTimeout())
                .build();
        JdkClientHttpRequestFactory factory = new JdkClientHttpRequestFactory(http);
        factory.setReadTimeout(props.getFetch().getTimeout());
        return RestClient.builder()
                .requestFactory(factory)
                .defaultHeader("User-Agent", props.getFetch().getUserAgent())
                .build();
    }

    /** 페이지 수집/출처 요약 팬아웃 전용 풀 */
    @Bean(destroyMethod = "shutdown")
    public ThreadPoolTaskExecutor retrievalExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(8);
        executor.setMaxPoolSize(16);
        executor.setQueueCapacity(200);
        executor.setThreadNamePrefix("retrieval-");
        executor.initialize();
        return executor;
    }

    @Bean
    public Clock clock(AssistantProperties props) {
        return Clock.system(ZoneId.of(props.getZone()));
    }

    @Bean
    public HeuristicLexicon heuristicLexicon(ObjectMapper objectMapper) {
        return HeuristicLexicon.load(objectMapper);
    }

    @Bean
    public WebMvcConfigurer corsConfigurer() {
        return new WebMvcConfigurer() {
            @Override public void addCorsMappings(CorsRegistry registry) {
                registry.addMapping("/api/**")
                        .allowedOrigins("*")
                        .allowedMethods("GET","POST","DELETE","OPTIONS");
            }
        };
    }
}
