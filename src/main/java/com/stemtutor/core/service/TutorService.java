package com.stemtutor.core.service;

import com.stemtutor.core.collaborators.StepExplainer;
import com.stemtutor.core.engine.TutorEngine;
import com.stemtutor.core.model.StepExplanation;
import com.stemtutor.core.ratelimit.QuotaStatus;
import com.stemtutor.core.ratelimit.RateLimitExceededException;
import com.stemtutor.core.ratelimit.TokenBucketRateLimiter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Transport-agnostic entry point shared by the REST API and the CLI.
 * <p>
 * Analyze is the only rate-limited operation: a throttled request never
 * reaches the engine.
 */
@Service
public class TutorService {

    private static final Logger log = LoggerFactory.getLogger(TutorService.class);

    private final TutorEngine engine;
    private final TokenBucketRateLimiter rateLimiter;
    private final StepExplainer stepExplainer;

    public TutorService(TutorEngine engine, TokenBucketRateLimiter rateLimiter, StepExplainer stepExplainer) {
        this.engine = engine;
        this.rateLimiter = rateLimiter;
        this.stepExplainer = stepExplainer;
    }

    /**
     * @throws RateLimitExceededException if the identity has no tokens left
     */
    public TutorResponse analyze(ProblemSubmission submission) {
        var decision = rateLimiter.check(submission.identity());
        if (!decision.allowed()) {
            throw new RateLimitExceededException(submission.identity(), decision);
        }

        String sessionId = submission.sessionId() != null && !submission.sessionId().isBlank()
                ? submission.sessionId()
                : engine.generateSessionId();
        var state = engine.run(sessionId, submission.identity(), submission.inputKind(), submission.payload());
        return TutorResponse.from(state);
    }

    public TutorResponse resume(String sessionId, String selectedTopic) {
        return TutorResponse.from(engine.resume(sessionId, selectedTopic));
    }

    public TutorResponse session(String sessionId) {
        return TutorResponse.from(engine.getState(sessionId).state());
    }

    public QuotaStatus quota(String identity) {
        return rateLimiter.quota(identity);
    }

    public void resetQuota(String identity) {
        rateLimiter.reset(identity);
    }

    public StepExplanation explainStep(String stepText, String context, String topic) {
        var result = stepExplainer.explain(stepText, context, topic);
        if (result.degraded()) {
            log.warn("Step explanation degraded for topic '{}'", topic);
        }
        return result.value();
    }
}
