package com.example.shortlink.repository;

import com.example.shortlink.entity.Link;
import com.example.shortlink.exception.DependencyException;
import com.example.shortlink.exception.ShortCodeCollisionException;

import java.util.Optional;

/**
 * 영속 저장소 계약
 *
 * short_code 유니크 제약은 저장소가 트랜잭션 단위로 강제해야 하며,
 * 코드 생성기는 이 제약을 유일한 중복 판단 기준으로 사용한다.
 */
public interface LinkStore {

    /**
     * 링크 저장
     *
     * @return id, createdAt이 채워진 저장된 링크
     * @throws ShortCodeCollisionException shortCode가 이미 존재하는 경우
     * @throws DependencyException 저장소 장애
     */
    Link insert(String originalUrl, String shortCode);

    /**
     * 단축 코드 정확히 일치하는 링크 조회
     *
     * @throws DependencyException 저장소 장애
     */
    Optional<Link> findByShortCode(String shortCode);
}
