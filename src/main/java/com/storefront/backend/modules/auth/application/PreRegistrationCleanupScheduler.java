package com.storefront.backend.modules.auth.application;

import java.time.Clock;
import java.time.OffsetDateTime;

import com.storefront.backend.modules.auth.infrastructure.persistence.PreRegistrationRepository;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

@Component
public class PreRegistrationCleanupScheduler {

    private static final Logger log = LoggerFactory.getLogger(PreRegistrationCleanupScheduler.class);

    private final PreRegistrationRepository preRegistrationRepository;
    private final Clock clock;

    public PreRegistrationCleanupScheduler(PreRegistrationRepository preRegistrationRepository, Clock clock) {
        this.preRegistrationRepository = preRegistrationRepository;
        this.clock = clock;
    }

    @Scheduled(fixedDelayString = "${app.auth.pre-registration-cleanup-interval:PT1H}")
    @Transactional
    public int purgeExpired() {
        int removed = preRegistrationRepository.deleteExpired(OffsetDateTime.now(clock));
        if (removed > 0) {
            log.info("Purged {} expired pre-registration(s)", removed);
        }
        return removed;
    }
}
