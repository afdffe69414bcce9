package com.example.shortlink.service;

import com.example.shortlink.cache.LinkResolutionCache;
import com.example.shortlink.dto.LinkRequest;
import com.example.shortlink.entity.Link;
import com.example.shortlink.exception.AllocationFailedException;
import com.example.shortlink.exception.DependencyException;
import com.example.shortlink.exception.LinkNotFoundException;
import com.example.shortlink.exception.LinkValidationException;
import com.example.shortlink.util.Base62Encoder;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * 단축 URL 생성/조회
 *
 * 캐시와 DB 장애는 {@link DependencyException}으로 그대로 전달된다.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class LinkService {

    private final Validator validator;
    private final ShortLinkGenerator shortLinkGenerator;
    private final LinkResolutionCache linkResolutionCache;
    private final Base62Encoder base62Encoder;

    /**
     * URL 단축
     * 검증에 실패하면 카운터를 소모하지 않는다.
     *
     * @throws LinkValidationException 비어 있거나 http/https 절대 URL이 아닌 경우
     * @throws AllocationFailedException 단축 코드를 발급할 수 없는 경우
     */
    public Link createShortenedFor(String originalUrl) {
        LinkRequest request = new LinkRequest(originalUrl);
        Set<ConstraintViolation<LinkRequest>> violations = validator.validate(request);
        if (!violations.isEmpty()) {
            List<String> details = violations.stream()
                .map(ConstraintViolation::getMessage)
                .sorted()
                .collect(Collectors.toList());
            log.debug("URL 검증 실패: url={}, details={}", originalUrl, details);
            throw new LinkValidationException(details);
        }

        return shortLinkGenerator.generate(request.getOriginalUrl());
    }

    /**
     * 단축 코드로 링크 조회 (Redis 캐시 우선)
     *
     * @throws LinkValidationException 단축 코드 형식이 아닌 경우
     * @throws LinkNotFoundException 존재하지 않는 단축 코드
     */
    public Link resolve(String shortCode) {
        if (!base62Encoder.isValidShortCode(shortCode)) {
            throw new LinkValidationException("올바른 단축 코드 형식이 아닙니다: " + shortCode);
        }

        return linkResolutionCache.resolve(shortCode)
            .orElseThrow(() -> {
                log.warn("존재하지 않는 단축 URL 조회: {}", shortCode);
                return new LinkNotFoundException(shortCode);
            });
    }
}
