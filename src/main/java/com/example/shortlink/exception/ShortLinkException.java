package com.example.shortlink.exception;

/**
 * 단축 URL 코어에서 발생하는 모든 예외의 상위 타입
 */
public abstract class ShortLinkException extends RuntimeException {

    protected ShortLinkException(String message) {
        super(message);
    }

    protected ShortLinkException(String message, Throwable cause) {
        super(message, cause);
    }
}
