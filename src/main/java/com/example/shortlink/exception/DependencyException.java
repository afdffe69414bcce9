package com.example.shortlink.exception;

import lombok.Getter;

/**
 * 캐시(Redis) 또는 저장소(DB) 장애
 * "찾을 수 없음"으로 바꾸지 않고 그대로 호출자에게 전달한다.
 */
@Getter
public class DependencyException extends ShortLinkException {

    private final String dependency;

    public DependencyException(String dependency, String operation, Throwable cause) {
        super(dependency + " 호출 실패 (" + operation + "): " + cause.getMessage(), cause);
        this.dependency = dependency;
    }
}
