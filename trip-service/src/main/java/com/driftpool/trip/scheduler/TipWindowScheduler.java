package com.driftpool.trip.scheduler;

import com.driftpool.trip.lifecycle.TripLifecycleService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Closes tip windows the rider never answered. Finalization is a conditional write, so running on
 * several instances at once completes each trip once.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class TipWindowScheduler {

    private final TripLifecycleService lifecycleService;

    @Scheduled(fixedDelayString = "${driftpool.lifecycle.tip-check-ms:300000}")
    public void finalizeLapsedTipWindows() {
        int finalized = lifecycleService.finalizeExpiredTipWindows();
        log.debug("Tip window check finalized {} trip(s)", finalized);
    }
}
