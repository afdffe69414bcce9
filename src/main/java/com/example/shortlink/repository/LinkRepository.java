package com.example.shortlink.repository;

import com.example.shortlink.entity.Link;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface LinkRepository extends JpaRepository<Link, Long> {

    /**
     * 단축 코드로 링크 찾기
     */
    Optional<Link> findByShortCode(String shortCode);
}
