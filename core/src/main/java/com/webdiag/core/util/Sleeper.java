package com.webdiag.core.util;

import java.time.Duration;

/** 재시도 대기 추상화 (테스트에서 가짜로 교체) */
@FunctionalInterface
public interface Sleeper {
    void sleep(Duration d) throws InterruptedException;
}
