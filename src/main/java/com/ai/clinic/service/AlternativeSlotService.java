package com.ai.clinic.service;

import com.ai.clinic.time.SlotInterval;
import com.ai.clinic.time.TemporalNormalizer;
import com.ai.clinic.time.WorkingHoursPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * Looks for free slots near one that was rejected. Candidates are scanned in a
 * fixed order (two slots earlier, then forward) and returned in that order.
 */
@Service
public class AlternativeSlotService {

    private static final Logger log = LoggerFactory.getLogger(AlternativeSlotService.class);

    static final int[] SCAN_OFFSETS = {-2, -1, 1, 2, 3, 4, 5, 6, 7, 8};

    private final AvailabilityService availabilityService;
    private final WorkingHoursPolicy workingHoursPolicy;
    private final TemporalNormalizer normalizer;

    public AlternativeSlotService(AvailabilityService availabilityService,
                                  WorkingHoursPolicy workingHoursPolicy,
                                  TemporalNormalizer normalizer) {
        this.availabilityService = availabilityService;
        this.workingHoursPolicy = workingHoursPolicy;
        this.normalizer = normalizer;
    }

    public List<SlotInterval> findAlternatives(OffsetDateTime requestedStart, Duration duration, int maxResults) {
        return findAlternatives(SlotInterval.of(requestedStart, duration), maxResults, null);
    }

    public List<SlotInterval> findAlternatives(SlotInterval rejected, int maxResults, String ignoredEventId) {
        List<SlotInterval> found = new ArrayList<>();
        if (maxResults <= 0) return found;

        OffsetDateTime now = normalizer.now();
        Duration step = rejected.duration();

        for (int offset : SCAN_OFFSETS) {
            SlotInterval candidate = rejected.shift(step.multipliedBy(offset));
            if (candidate.start().isBefore(now)) continue;
            if (!workingHoursPolicy.allows(candidate)) continue;

            try {
                if (availabilityService.isFree(candidate, ignoredEventId)) {
                    found.add(candidate);
                    if (found.size() >= maxResults) break;
                }
            } catch (RuntimeException e) {
                log.warn("Skipping candidate {}: availability check failed: {}", candidate.start(), e.getMessage());
            }
        }
        log.info("Found {} alternative(s) near {}", found.size(), rejected.start());
        return found;
    }
}
