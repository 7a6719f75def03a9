package com.kotsin.ledger.service;

import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

@Service
@Slf4j
@RequiredArgsConstructor
public class ErrorMonitoringService {

    private final MeterRegistry meterRegistry;

    public void recordError(String area, String message, Throwable t) {
        meterRegistry.counter("ledger.errors", "area", area).increment();
        log.error("Error area={} msg={}", area, message, t);
    }
}
