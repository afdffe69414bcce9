package com.example.shortlink.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * shortlink.* 설정
 */
@Getter
@Setter
@Validated
@ConfigurationProperties(prefix = "shortlink")
public class ShortLinkProperties {

    @Valid
    private final Counter counter = new Counter();

    @Valid
    private final Cache cache = new Cache();

    @Valid
    private final Generator generator = new Generator();

    @Getter
    @Setter
    public static class Counter {

        /**
         * Redis에 저장되는 카운터 키
         */
        @NotBlank
        private String key = "url_counter";

        /**
         * 카운터 초기값, 10억부터 시작하면 발급 코드가 항상 6자리가 된다
         */
        @Min(0)
        private long initialValue = 1_000_000_000L;
    }

    @Getter
    @Setter
    public static class Cache {

        @NotBlank
        private String keyPrefix = "link:";

        @NotNull
        private Duration ttl = Duration.ofHours(12);
    }

    @Getter
    @Setter
    public static class Generator {

        /**
         * short_code 충돌 시 최대 시도 횟수 (첫 시도 포함)
         */
        @Min(1)
        private int maxAttempts = 5;
    }
}
