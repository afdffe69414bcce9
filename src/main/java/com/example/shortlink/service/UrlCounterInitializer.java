package com.example.shortlink.service;

import lombok.RequiredArgsConstructor;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

/**
 * 애플리케이션 기동 시 URL 카운터 초기화
 */
@Component
@RequiredArgsConstructor
public class UrlCounterInitializer implements ApplicationRunner {

    private final UrlCounterAllocator urlCounterAllocator;

    @Override
    public void run(ApplicationArguments args) {
        urlCounterAllocator.initialize();
    }
}
