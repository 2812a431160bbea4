package com.docgraph.core.store;

/** 캐시 만료 계산용 시계(테스트에서 고정 시계 주입). */
@FunctionalInterface
public interface CacheClock {
    long nowMillis();

    CacheClock SYSTEM = System::currentTimeMillis;
}
