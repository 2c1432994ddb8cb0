package com.my.ingest.adapter.out.clock;

import com.my.ingest.domain.port.out.ClockPort;

import java.time.Clock;
import java.time.Instant;

/**
 * 왜: 시스템 시간을 주입형으로 제공해 토큰 만료 계산과 이벤트 시각 기록을 테스트에서 고정할 수 있게 하기 위함.
 */
public class SystemClockAdapter implements ClockPort {

    private final Clock clock;

    public SystemClockAdapter(Clock clock) {
        this.clock = clock;
    }

    public static SystemClockAdapter system() {
        return new SystemClockAdapter(Clock.systemUTC());
    }

    @Override
    public Instant now() {
        return clock.instant();
    }
}
