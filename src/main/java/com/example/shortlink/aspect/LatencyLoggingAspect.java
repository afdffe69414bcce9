package com.example.shortlink.aspect;

import lombok.extern.slf4j.Slf4j;
import org.aspectj.lang.ProceedingJoinPoint;
import org.aspectj.lang.annotation.Around;
import org.aspectj.lang.annotation.Aspect;
import org.springframework.stereotype.Component;

@Aspect
@Component
@Slf4j
public class LatencyLoggingAspect {

    /**
     * 저장소(LinkStore 구현체) 모든 메서드 실행 시간 측정
     */
    @Around("execution(* com.example.shortlink.repository.LinkStore+.*(..))")
    public Object measureStoreLatency(ProceedingJoinPoint joinPoint) throws Throwable {
        long startTime = System.nanoTime();
        String methodName = joinPoint.getSignature().getName();

        try {
            Object result = joinPoint.proceed();
            log.debug("🗄️ DB 호출 성능 - {}: {}ms", methodName, elapsedMillis(startTime));
            return result;
        } catch (Throwable e) {
            log.warn("❌ DB 호출 실패 - {}: {}ms, 오류: {}", methodName, elapsedMillis(startTime), e.getMessage());
            throw e;
        }
    }

    /**
     * 단축 코드 조회 전체 실행 시간 측정
     */
    @Around("execution(* com.example.shortlink.service.LinkService.resolve(..))")
    public Object measureResolveLatency(ProceedingJoinPoint joinPoint) throws Throwable {
        long startTime = System.nanoTime();
        Object shortCode = joinPoint.getArgs()[0];

        try {
            Object result = joinPoint.proceed();
            log.debug("🚀 단축 코드 조회 성능 - shortCode: {}, 총 소요시간: {}ms", shortCode, elapsedMillis(startTime));
            return result;
        } catch (Throwable e) {
            log.debug("단축 코드 조회 실패 - shortCode: {}, 소요시간: {}ms, 오류: {}",
                    shortCode, elapsedMillis(startTime), e.getMessage());
            throw e;
        }
    }

    private static double elapsedMillis(long startTime) {
        return (System.nanoTime() - startTime) / 1_000_000.0;
    }
}
