package com.example.shortlink.config;

import com.example.shortlink.cache.CacheStore;
import com.example.shortlink.cache.RedisCacheStore;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.core.StringRedisTemplate;

@Configuration
public class RedisConfig {

    /**
     * 캐시 계층 설정
     * 카운터는 원시 숫자 문자열로, 링크는 JSON 문자열로 저장
     */
    @Bean
    public CacheStore cacheStore(StringRedisTemplate stringRedisTemplate) {
        // ObjectMapper 설정 (LocalDateTime 지원)
        ObjectMapper objectMapper = new ObjectMapper();
        objectMapper.registerModule(new JavaTimeModule());
        objectMapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        objectMapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);

        return new RedisCacheStore(stringRedisTemplate, objectMapper);
    }
}
