package io.github.samzhu.prism.apikey;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * 定時清除閒置的限流窗口
 */
@Component
public class RateLimitWindowJanitor {

    private static final Logger log = LoggerFactory.getLogger(RateLimitWindowJanitor.class);

    private final SlidingWindowRateLimiter rateLimiter;

    public RateLimitWindowJanitor(SlidingWindowRateLimiter rateLimiter) {
        this.rateLimiter = rateLimiter;
    }

    @Scheduled(fixedDelayString = "${prism.api-keys.cleanup-interval:PT5M}",
        initialDelayString = "${prism.api-keys.cleanup-interval:PT5M}")
    public void purgeIdleWindows() {
        int purged = rateLimiter.purgeIdle();
        if (purged > 0) {
            log.info("Rate limit cleanup: purged={}, tracked={}", purged, rateLimiter.trackedKeys());
        }
    }
}
