package com.example.shortlink.exception;

import lombok.Getter;

@Getter
public class CounterNotInitializedException extends AllocationFailedException {

    private final String counterKey;

    public CounterNotInitializedException(String counterKey) {
        super("URL 카운터가 초기화되지 않았습니다: key=" + counterKey);
        this.counterKey = counterKey;
    }
}
