package com.example.shortlink.exception;

import lombok.Getter;

import java.util.List;

/**
 * 입력값(원본 URL, 단축 코드 형식) 검증 실패
 * 재시도 대상이 아니며 카운터를 소모하지 않는다.
 */
@Getter
public class LinkValidationException extends ShortLinkException {

    private final List<String> details;

    public LinkValidationException(List<String> details) {
        super("유효하지 않은 요청입니다: " + String.join(", ", details));
        this.details = List.copyOf(details);
    }

    public LinkValidationException(String detail) {
        this(List.of(detail));
    }
}
