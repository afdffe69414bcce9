package com.example.shortlink.entity;

import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.ToString;
import org.hibernate.annotations.Immutable;

import java.time.LocalDateTime;

@Entity
@Immutable
@Table(name = "links",
       uniqueConstraints = @UniqueConstraint(name = "uk_links_short_code", columnNames = "short_code"))
@Getter
@ToString
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor
public class Link {

    /**
     * DB가 발급하는 식별자 (short_code와 무관)
     */
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "original_url", nullable = false, length = 2048, updatable = false)
    private String originalUrl;

    /**
     * 카운터 값을 Base62로 인코딩한 6자리 코드, 유니크 제약은 DB가 보장
     */
    @Column(name = "short_code", nullable = false, length = 6, updatable = false)
    private String shortCode;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    /**
     * 아직 저장되지 않은 링크 생성 (id, createdAt은 저장 시점에 채워짐)
     */
    public static Link of(String originalUrl, String shortCode) {
        Link link = new Link();
        link.originalUrl = originalUrl;
        link.shortCode = shortCode;
        return link;
    }

    @PrePersist
    protected void onCreate() {
        createdAt = LocalDateTime.now();
    }
}
