package com.example.shortlink.service;

import com.example.shortlink.entity.Link;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * 단축 코드 발급 1회 시도 결과
 */
@Getter
@RequiredArgsConstructor(access = AccessLevel.PRIVATE)
final class AllocationAttempt {

    enum Outcome {
        CREATED,
        COLLISION
    }

    private final Outcome outcome;
    private final long counterValue;
    private final String shortCode;
    private final Link link;

    static AllocationAttempt created(long counterValue, Link link) {
        return new AllocationAttempt(Outcome.CREATED, counterValue, link.getShortCode(), link);
    }

    static AllocationAttempt collision(long counterValue, String shortCode) {
        return new AllocationAttempt(Outcome.COLLISION, counterValue, shortCode, null);
    }

    boolean isCreated() {
        return outcome == Outcome.CREATED;
    }
}
