package com.docgraph.core.util;

import java.util.concurrent.TimeUnit;
import java.util.function.LongSupplier;

/**
 * 문서 사이트 한 곳에 보내는 fetch 간격 조절기.
 * 호출마다 다음 발송 슬롯을 예약하고 그 시각까지 기다린다.
 * 쉬고 있던 동안 쌓인 여유는 burst 개까지만 인정한다(첫 burst 건은 바로 나감).
 */
public final class RateLimiter {

    /** 대기 구현(테스트에서 시간을 건너뛰기 위해 분리) */
    @FunctionalInterface
    public interface Sleeper {
        void sleepNanos(long nanos) throws InterruptedException;

        Sleeper SYSTEM = TimeUnit.NANOSECONDS::sleep;
    }

    private final long intervalNs;
    private final long burstNs;
    private final LongSupplier clock;
    private final Sleeper sleeper;
    private long nextSlotNs;

    public RateLimiter(int permitsPerSecond, int burst, LongSupplier nanoClock, Sleeper sleeper) {
        if (permitsPerSecond < 1) throw new IllegalArgumentException("permitsPerSecond must be >= 1");
        if (burst < 1) throw new IllegalArgumentException("burst must be >= 1");
        this.intervalNs = TimeUnit.SECONDS.toNanos(1) / permitsPerSecond;
        this.burstNs = intervalNs * burst;
        this.clock = nanoClock;
        this.sleeper = sleeper;
        this.nextSlotNs = floor(nanoClock.getAsLong());
    }

    /** rps 하나로 구성: 초당 rps건, 여유 rps건 */
    public static RateLimiter perSecond(int rps) {
        return new RateLimiter(rps, rps, System::nanoTime, Sleeper.SYSTEM);
    }

    /** 슬롯이 올 때까지 블록 */
    public void acquire() throws InterruptedException {
        long waitNs = reserve();
        if (waitNs > 0) sleeper.sleepNanos(waitNs);
    }

    /** 슬롯 예약 후 기다려야 할 시간(ns) */
    synchronized long reserve() {
        long now = clock.getAsLong();
        long slot = Math.max(nextSlotNs, floor(now));
        nextSlotNs = slot + intervalNs;
        return Math.max(0, slot - now);
    }

    // 지금 바로 나갈 수 있는 슬롯이 burst개가 되는 가장 이른 예약 시각
    private long floor(long now) {
        return now - burstNs + intervalNs;
    }
}
