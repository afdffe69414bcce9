package com.example.shortlink.repository;

import com.example.shortlink.entity.Link;
import com.example.shortlink.exception.DependencyException;
import com.example.shortlink.exception.ShortCodeCollisionException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Spring Data JPA 기반 {@link LinkStore}
 *
 * insert는 saveAndFlush로 즉시 INSERT를 실행해 유니크 제약 위반을 호출 안에서 확인한다.
 * 각 호출은 리포지토리 자체 트랜잭션에서 실행되므로 충돌 후 재시도가 가능하다.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class JpaLinkStore implements LinkStore {

    private static final String DEPENDENCY = "database";

    private final LinkRepository linkRepository;

    @Override
    public Link insert(String originalUrl, String shortCode) {
        try {
            return linkRepository.saveAndFlush(Link.of(originalUrl, shortCode));
        } catch (DataIntegrityViolationException e) {
            // 입력은 사전 검증되므로 무결성 위반은 short_code 유니크 제약뿐이다
            throw new ShortCodeCollisionException(shortCode, e);
        } catch (DataAccessException e) {
            log.error("❌ 링크 저장 실패: shortCode={}, error={}", shortCode, e.getMessage());
            throw new DependencyException(DEPENDENCY, "insert", e);
        }
    }

    @Override
    public Optional<Link> findByShortCode(String shortCode) {
        try {
            return linkRepository.findByShortCode(shortCode);
        } catch (DataAccessException e) {
            log.error("❌ 링크 조회 실패: shortCode={}, error={}", shortCode, e.getMessage());
            throw new DependencyException(DEPENDENCY, "findByShortCode", e);
        }
    }
}
