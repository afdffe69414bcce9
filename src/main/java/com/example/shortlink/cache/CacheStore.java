package com.example.shortlink.cache;

import com.example.shortlink.exception.DependencyException;

import java.time.Duration;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.function.Supplier;

/**
 * 캐시 계층 계약 (카운터 저장 + cache-aside 조회)
 *
 * 모든 메서드는 캐시 장애 시 {@link DependencyException}을 던진다.
 */
public interface CacheStore {

    boolean exists(String key);

    /**
     * 키가 없을 때만 원시 숫자 값을 기록
     *
     * @return 이번 호출이 값을 기록했으면 true, 이미 존재하면 false
     */
    boolean writeIfAbsent(String key, long value);

    /**
     * 원시 숫자 값 조회
     */
    OptionalLong readCounter(String key);

    /**
     * 원자적으로 1 증가시킨 값 반환
     *
     * @return 증가된 값, 키가 없으면 empty (키를 새로 만들지 않는다)
     */
    OptionalLong increment(String key);

    <T> Optional<T> read(String key, Class<T> type);

    <T> void write(String key, T value, Duration ttl);

    /**
     * cache-aside 조회
     * 캐시 HIT이면 그대로 반환하고, MISS이면 loader 결과를 ttl로 저장한 뒤 반환한다.
     * loader가 empty를 반환하면 아무것도 저장하지 않는다.
     */
    default <T> Optional<T> fetch(String key, Duration ttl, Class<T> type, Supplier<Optional<T>> loader) {
        Optional<T> cached = read(key, type);
        if (cached.isPresent()) {
            return cached;
        }

        Optional<T> loaded = loader.get();
        loaded.ifPresent(value -> write(key, value, ttl));
        return loaded;
    }

    /**
     * 전체 캐시 삭제 (관리/테스트 용도, 카운터도 함께 삭제됨)
     */
    void clear();
}
