package com.example.shortlink.service;

import com.example.shortlink.config.ShortLinkProperties;
import com.example.shortlink.entity.Link;
import com.example.shortlink.exception.AllocationFailedException;
import com.example.shortlink.exception.ShortCodeCollisionException;
import com.example.shortlink.repository.LinkStore;
import com.example.shortlink.util.Base62Encoder;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * 카운터 + Base62 인코딩으로 단축 코드를 발급하고 링크를 저장
 *
 * 중복 판단은 저장소의 유니크 제약에 맡기고, 충돌하면 새 카운터 값으로 다시 시도한다.
 * 전체를 하나의 트랜잭션으로 묶지 않는다 (충돌한 INSERT가 다음 시도를 롤백시키지 않도록).
 * 실패하거나 중단된 시도가 소모한 카운터 값은 재사용되지 않고 건너뛴다.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ShortLinkGenerator {

    private final UrlCounterAllocator urlCounterAllocator;
    private final Base62Encoder base62Encoder;
    private final LinkStore linkStore;
    private final ShortLinkProperties properties;

    /**
     * 원본 URL에 대한 새 단축 링크 생성 (원본 URL은 호출 전에 검증되어 있어야 함)
     *
     * @throws AllocationFailedException 재시도 한도 초과, 카운터 범위 초과, 카운터 미초기화
     */
    public Link generate(String originalUrl) {
        int maxAttempts = properties.getGenerator().getMaxAttempts();

        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            AllocationAttempt result = attempt(originalUrl);
            if (result.isCreated()) {
                log.info("새로운 단축 URL 생성: {} -> {} (counter: {})",
                        originalUrl, result.getShortCode(), result.getCounterValue());
                return result.getLink();
            }

            log.warn("⚠️ 단축 코드 충돌, 새 카운터로 재시도: shortCode={}, counter={}, attempt={}/{}",
                    result.getShortCode(), result.getCounterValue(), attempt, maxAttempts);
        }

        log.error("❌ 단축 코드 발급 실패: {}회 연속 충돌, url={}", maxAttempts, originalUrl);
        throw new AllocationFailedException("단축 코드 발급 실패: " + maxAttempts + "회 연속 충돌");
    }

    private AllocationAttempt attempt(String originalUrl) {
        long counter = urlCounterAllocator.incrementAndGet();
        String shortCode = toShortCode(counter);

        try {
            return AllocationAttempt.created(counter, linkStore.insert(originalUrl, shortCode));
        } catch (ShortCodeCollisionException e) {
            return AllocationAttempt.collision(counter, shortCode);
        }
    }

    private String toShortCode(long counter) {
        String shortCode = base62Encoder.encode(counter)
            .orElseThrow(() -> new AllocationFailedException("음수 카운터 값: " + counter));

        // 카운터가 6자리 범위(62^5 ~ 62^6 - 1)를 벗어나면 재시도해도 복구되지 않는다
        if (shortCode.length() != Base62Encoder.CODE_LENGTH) {
            log.error("❌ 카운터가 {}자리 코드 범위를 벗어남: counter={}, 허용 범위=[{}, {}]",
                    Base62Encoder.CODE_LENGTH, counter,
                    Base62Encoder.MIN_SIX_SYMBOL_VALUE, Base62Encoder.MAX_SIX_SYMBOL_VALUE);
            throw new AllocationFailedException("카운터 값 " + counter + "이(가) "
                    + Base62Encoder.CODE_LENGTH + "자리 단축 코드 범위를 벗어났습니다");
        }

        return shortCode;
    }
}
