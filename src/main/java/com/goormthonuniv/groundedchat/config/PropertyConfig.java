package com.goormthonuniv.groundedchat.config;

import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.PropertySource;

// 로컬 비밀값(BRAVE_API_KEY 등) 오버레이. 파일이 없으면 환경변수만 사용
@Configuration
@PropertySource(
        value = "classpath:properties/env.properties",
        ignoreResourceNotFound = true
)
public class PropertyConfig {

}
