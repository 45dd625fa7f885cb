package com.goormthonuniv.groundedchat.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * 파이프라인 튜닝 값 (application.yml 의 assistant.* 네임스페이스).
 * 어댑터 자격증명(api key 등)은 각 어댑터에서 @Value 로 직접 받는다.
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "assistant")
public class AssistantProperties {

    /** 프로필에 언어가 없을 때 쓰는 기본 출력 언어 (zh-Hant | zh-Hans | en) */
    private String defaultLanguage = "zh-Hant";

    /** 시간대: 날짜 힌트/오래된 연도 판정 기준 */
    private String zone = "Asia/Taipei";

    private final Model model = new Model();
    private final Search search = new Search();
    private final Fetch fetch = new Fetch();
    private final News news = new News();
    private final Memory memory = new Memory();
    private final Summary summary = new Summary();
    private final Transport transport = new Transport();

    @Getter
    @Setter
    public static class Model {
        private String chat = "qwen/qwen2.5-coder-14b";
        /** 비어 있으면 chat 모델을 그대로 사용 */
        private String planner = "";
        private double temperature = 0.3;
        private int newsMaxTokens = 900;
        private double summarizerTemperature = 0.2;
        private int summarizerMaxTokens = 450;

        public String plannerOrChat() {
            return planner == null || planner.isBlank() ? chat : planner;
        }
    }

    @Getter
    @Setter
    public static class Search {
        /** brave | mcp */
        private String backend = "brave";
        private String country = "TW";
        private String language = "zh-hant";
        private int count = 10;
    }

    @Getter
    @Setter
    public static class Fetch {
        private int topN = 10;
        private int maxChars = 8000;
        private Duration timeout = Duration.ofSeconds(12);
        private String userAgent = "grounded-chat/1.0";
    }

    @Getter
    @Setter
    public static class News {
        private int followupDefaultCount = 5;
        private int maxItems = 8;
        /** 링크 부록에서 인용이 하나도 없을 때 보여줄 기본 개수 */
        private int appendixDefaultLinks = 10;
        private int rawLinkCount = 5;
    }

    @Getter
    @Setter
    public static class Memory {
        private String dir = "memory";
        /** per_chat_daily | per_chat */
        private String mode = "per_chat_daily";
        private int days = 1;
        /** 윈도우 용량 = recentTurns * 2 */
        private int recentTurns = 6;
        /** 최신성 질문에서 남길 사용자 턴 수 */
        private int recencyUserTurns = 3;
        private Duration stateIdleTtl = Duration.ofHours(24);
    }

    @Getter
    @Setter
    public static class Summary {
        /** 요약 접기 후 윈도우에 남기는 꼬리 턴 수 */
        private int keepTurns = 4;
        private double temperature = 0.1;
        private int maxTokens = 300;
        private int maxLines = 8;
    }

    @Getter
    @Setter
    public static class Transport {
        /** 그룹 채팅에서 요구하는 멘션 핸들 (@ 제외) */
        private String handle = "grounded_chat_bot";
    }
}
