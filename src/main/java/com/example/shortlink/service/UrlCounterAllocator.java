package com.example.shortlink.service;

import com.example.shortlink.cache.CacheStore;
import com.example.shortlink.config.ShortLinkProperties;
import com.example.shortlink.exception.CounterNotInitializedException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.OptionalLong;

/**
 * 캐시 계층의 공유 카운터에서 단조 증가하는 값을 발급
 *
 * 모든 원자성은 캐시 계층(SETNX, INCR)에 있으며 프로세스 내부 잠금은 사용하지 않는다.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class UrlCounterAllocator {

    private final CacheStore cacheStore;
    private final ShortLinkProperties properties;

    /**
     * 카운터가 없을 때만 초기값으로 설정 (여러 번, 동시에 호출해도 한 번만 기록됨)
     */
    public void initialize() {
        ShortLinkProperties.Counter counter = properties.getCounter();
        if (cacheStore.writeIfAbsent(counter.getKey(), counter.getInitialValue())) {
            log.info("✅ URL 카운터 초기화: key={}, value={}", counter.getKey(), counter.getInitialValue());
        } else {
            log.debug("URL 카운터가 이미 존재함: key={}", counter.getKey());
        }
    }

    /**
     * 카운터를 원자적으로 1 증가시킨 값 반환
     *
     * @throws CounterNotInitializedException 카운터가 초기화되지 않은 경우
     */
    public long incrementAndGet() {
        String key = properties.getCounter().getKey();
        return cacheStore.increment(key)
            .orElseThrow(() -> new CounterNotInitializedException(key));
    }

    public OptionalLong currentValue() {
        return cacheStore.readCounter(properties.getCounter().getKey());
    }
}
