package com.ai.clinic.service;

import com.ai.clinic.component.ResponsePhrases;
import com.ai.clinic.dto.WorkflowResponse;
import com.ai.clinic.dto.WorkflowStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Escalation counter for flagged turns, one per session. The caller decides
 * what counts as flagged; this only counts and picks the reply.
 * Two warnings, then the session is locked until reset.
 */
@Service
public class ModerationGuardService {

    private static final Logger log = LoggerFactory.getLogger(ModerationGuardService.class);

    static final int BLOCK_THRESHOLD = 3;

    private final Map<String, AtomicInteger> violations = new ConcurrentHashMap<>();
    private final ResponsePhrases phrases;

    public ModerationGuardService(ResponsePhrases phrases) {
        this.phrases = phrases;
    }

    public WorkflowResponse recordViolation(String sessionId) {
        int count = violations.computeIfAbsent(sessionId, key -> new AtomicInteger()).incrementAndGet();
        Map<String, Object> payload = Map.of(WorkflowResponse.VIOLATIONS, count);

        if (count >= BLOCK_THRESHOLD) {
            log.warn("[{}] Session locked after {} flagged turns", sessionId, count);
            return WorkflowResponse.of(WorkflowStatus.BLOCKED, phrases.conversationLocked(), payload);
        }
        log.info("[{}] Flagged turn #{}", sessionId, count);
        String message = count == 1 ? phrases.moderationWarning() : phrases.moderationFinalWarning();
        return WorkflowResponse.of(WorkflowStatus.WARN, message, payload);
    }

    public boolean isBlocked(String sessionId) {
        AtomicInteger count = violations.get(sessionId);
        return count != null && count.get() >= BLOCK_THRESHOLD;
    }

    public int violations(String sessionId) {
        AtomicInteger count = violations.get(sessionId);
        return count == null ? 0 : count.get();
    }

    public WorkflowResponse blockedResponse() {
        return WorkflowResponse.of(WorkflowStatus.BLOCKED, phrases.conversationLocked());
    }

    public void reset(String sessionId) {
        if (violations.remove(sessionId) != null) {
            log.info("[{}] Moderation counter reset", sessionId);
        }
    }
}
