package com.example.shortlink.support;

import com.example.shortlink.entity.Link;
import com.example.shortlink.exception.ShortCodeCollisionException;
import com.example.shortlink.repository.LinkStore;

import java.time.LocalDateTime;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * 테스트용 {@link LinkStore}, short_code 유니크 제약과 호출 횟수를 흉내낸다
 */
public class InMemoryLinkStore implements LinkStore {

    private final Map<String, Link> links = new ConcurrentHashMap<>();
    private final AtomicLong sequence = new AtomicLong();
    private final AtomicInteger insertCalls = new AtomicInteger();
    private final AtomicInteger findCalls = new AtomicInteger();

    @Override
    public Link insert(String originalUrl, String shortCode) {
        insertCalls.incrementAndGet();
        Link link = new Link(sequence.incrementAndGet(), originalUrl, shortCode, LocalDateTime.now());
        if (links.putIfAbsent(shortCode, link) != null) {
            throw new ShortCodeCollisionException(shortCode, null);
        }
        return link;
    }

    @Override
    public Optional<Link> findByShortCode(String shortCode) {
        findCalls.incrementAndGet();
        return Optional.ofNullable(links.get(shortCode));
    }

    public int insertCalls() {
        return insertCalls.get();
    }

    public int findCalls() {
        return findCalls.get();
    }

    public int size() {
        return links.size();
    }
}
