package com.example.shortlink.cache;

import com.example.shortlink.config.ShortLinkProperties;
import com.example.shortlink.entity.Link;
import com.example.shortlink.repository.LinkStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * 단축 코드 조회용 cache-aside 계층
 *
 * 캐시 HIT이면 저장소에 접근하지 않고, MISS이면 저장소에서 찾아 TTL 동안 캐시한다.
 * 저장소에도 없는 코드는 캐시하지 않으므로 같은 코드를 다시 조회하면 매번 저장소를 조회한다.
 * 만료는 Redis TTL에 맡긴다.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class LinkResolutionCache {

    private final CacheStore cacheStore;
    private final LinkStore linkStore;
    private final ShortLinkProperties properties;

    public Optional<Link> resolve(String shortCode) {
        ShortLinkProperties.Cache cache = properties.getCache();
        return cacheStore.fetch(cacheKey(shortCode), cache.getTtl(), Link.class, () -> {
            log.debug("캐시 MISS, DB에서 조회: {}", shortCode);
            return linkStore.findByShortCode(shortCode);
        });
    }

    public String cacheKey(String shortCode) {
        return properties.getCache().getKeyPrefix() + shortCode;
    }
}
