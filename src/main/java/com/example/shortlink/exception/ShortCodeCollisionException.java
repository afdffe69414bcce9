package com.example.shortlink.exception;

import lombok.Getter;

/**
 * 저장소의 short_code 유니크 제약 위반
 * 코드 생성기 내부에서 새 카운터 값으로 재시도하며 호출자에게는 노출되지 않는다.
 */
@Getter
public class ShortCodeCollisionException extends ShortLinkException {

    private final String shortCode;

    public ShortCodeCollisionException(String shortCode, Throwable cause) {
        super("이미 사용 중인 단축 코드입니다: " + shortCode, cause);
        this.shortCode = shortCode;
    }
}
