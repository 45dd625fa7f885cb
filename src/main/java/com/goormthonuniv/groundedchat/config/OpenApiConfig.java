package com.goormthonuniv.groundedchat.config;

import io.swagger.v3.oas.models.ExternalDocumentation;
import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.*;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OpenApiConfig {
    @Bean
    public OpenAPI openAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("Grounded Chat API")
                        .description("검색 근거 기반 대화형 어시스턴트: 메시지 수신/응답, 채팅 프로필 관리")
                        .version("v0.1.0")
                        .contact(new Contact().name("GroundedChat").email("team@grounded.chat")))
                .externalDocs(new ExternalDocumentation().description("Swagger UI").url("/swagger-ui.html"));
    }
}
