package com.example.shortlink.exception;

/**
 * 단축 코드를 발급할 수 없는 치명적 상황 (재시도 한도 초과, 카운터 범위 초과 등)
 */
public class AllocationFailedException extends ShortLinkException {

    public AllocationFailedException(String message) {
        super(message);
    }

    public AllocationFailedException(String message, Throwable cause) {
        super(message, cause);
    }
}
