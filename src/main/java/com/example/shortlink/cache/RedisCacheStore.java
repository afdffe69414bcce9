package com.example.shortlink.cache;

import com.example.shortlink.exception.DependencyException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.RedisCallback;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.DefaultRedisScript;
import org.springframework.data.redis.core.script.RedisScript;

import java.time.Duration;
import java.util.Collections;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.function.Supplier;

/**
 * Redis 기반 {@link CacheStore}
 */
@RequiredArgsConstructor
@Slf4j
public class RedisCacheStore implements CacheStore {

    private static final String DEPENDENCY = "redis";

    /**
     * 키가 있을 때만 INCR, 없으면 -1 (INCR이 0부터 키를 새로 만드는 것을 막기 위함)
     */
    static final RedisScript<Long> INCREMENT_IF_PRESENT_SCRIPT = new DefaultRedisScript<>(
            "if redis.call('EXISTS', KEYS[1]) == 0 then " +
            "    return -1 " +
            "end " +
            "return redis.call('INCR', KEYS[1])",
            Long.class);

    private final StringRedisTemplate redisTemplate;
    private final ObjectMapper objectMapper;

    @Override
    public boolean exists(String key) {
        return execute("exists", () -> Boolean.TRUE.equals(redisTemplate.hasKey(key)));
    }

    @Override
    public boolean writeIfAbsent(String key, long value) {
        return execute("writeIfAbsent",
                () -> Boolean.TRUE.equals(redisTemplate.opsForValue().setIfAbsent(key, Long.toString(value))));
    }

    @Override
    public OptionalLong readCounter(String key) {
        String raw = execute("readCounter", () -> redisTemplate.opsForValue().get(key));
        if (raw == null) {
            return OptionalLong.empty();
        }
        try {
            return OptionalLong.of(Long.parseLong(raw));
        } catch (NumberFormatException e) {
            throw new IllegalStateException("숫자가 아닌 카운터 값: key=" + key + ", value=" + raw, e);
        }
    }

    @Override
    public OptionalLong increment(String key) {
        Long result = execute("increment",
                () -> redisTemplate.execute(INCREMENT_IF_PRESENT_SCRIPT, Collections.singletonList(key)));
        if (result == null || result < 0) {
            return OptionalLong.empty();
        }
        return OptionalLong.of(result);
    }

    @Override
    public <T> Optional<T> read(String key, Class<T> type) {
        String json = execute("read", () -> redisTemplate.opsForValue().get(key));
        if (json == null) {
            log.debug("❌ Redis 캐시 MISS: {}", key);
            return Optional.empty();
        }

        try {
            T value = objectMapper.readValue(json, type);
            log.debug("🎯 Redis 캐시 HIT: {}", key);
            return Optional.of(value);
        } catch (JsonProcessingException e) {
            // 손상된 항목은 지우고 MISS로 처리
            log.warn("⚠️ Redis 캐시 역직렬화 실패, 항목 삭제: key={}, error={}", key, e.getOriginalMessage());
            execute("delete", () -> redisTemplate.delete(key));
            return Optional.empty();
        }
    }

    @Override
    public <T> void write(String key, T value, Duration ttl) {
        String json;
        try {
            json = objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("캐시 직렬화 실패: key=" + key, e);
        }

        execute("write", () -> {
            redisTemplate.opsForValue().set(key, json, ttl);
            return null;
        });
        log.debug("💾 Redis 캐시 저장: {} (TTL: {})", key, ttl);
    }

    @Override
    public void clear() {
        execute("clear", () -> redisTemplate.execute((RedisCallback<Void>) connection -> {
            connection.serverCommands().flushDb();
            return null;
        }));
        log.info("🧹 Redis 캐시 전체 클리어 완료");
    }

    private <T> T execute(String operation, Supplier<T> action) {
        try {
            return action.get();
        } catch (DataAccessException e) {
            log.error("❌ Redis {} 실패: {}", operation, e.getMessage());
            throw new DependencyException(DEPENDENCY, operation, e);
        }
    }
}
