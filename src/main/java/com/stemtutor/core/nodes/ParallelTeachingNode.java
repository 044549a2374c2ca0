package com.stemtutor.core.nodes;

import com.stemtutor.core.collaborators.CollaboratorProperties;
import com.stemtutor.core.logging.MdcContext;
import com.stemtutor.core.metrics.TutorMetrics;
import com.stemtutor.core.state.TutorState;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs every registered {@link TeachingBranch} concurrently and joins on all of them.
 * <p>
 * Each branch sees the same input state. Deltas are merged in registration
 * order with override semantics, except {@code degradedSteps}, which is
 * unioned so no branch hides another's degradation. A branch that throws
 * contributes its own fallback delta, so the join always completes.
 */
@Component
public class ParallelTeachingNode {

    private static final Logger log = LoggerFactory.getLogger(ParallelTeachingNode.class);

    private final List<TeachingBranch> branches;
    private final ExecutorService executor;
    private final TutorMetrics metrics;

    @Autowired
    public ParallelTeachingNode(List<TeachingBranch> branches, CollaboratorProperties properties,
                                TutorMetrics metrics) {
        this(branches, properties.getFanOutPoolSize(), metrics);
    }

    ParallelTeachingNode(List<TeachingBranch> branches, int poolSize, TutorMetrics metrics) {
        this.branches = List.copyOf(branches);
        this.executor = Executors.newFixedThreadPool(Math.max(1, poolSize), threadFactory());
        this.metrics = metrics;
    }

    public Map<String, Object> apply(TutorState state) {
        String sessionId = state.sessionId();
        log.info("Running {} teaching branches concurrently", branches.size());

        var futures = new ArrayList<CompletableFuture<Map<String, Object>>>();
        for (var branch : branches) {
            futures.add(CompletableFuture.supplyAsync(() -> runBranch(branch, state, sessionId), executor));
        }
        CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();

        var merged = new HashMap<String, Object>();
        var degraded = new LinkedHashSet<>(state.degradedSteps());
        for (var future : futures) {
            Map<String, Object> delta = future.join();
            delta.forEach((key, value) -> {
                if ("degradedSteps".equals(key) && value instanceof List<?> steps) {
                    steps.forEach(s -> degraded.add(String.valueOf(s)));
                } else if (value != null) {
                    merged.put(key, value);
                }
            });
        }
        if (!degraded.isEmpty()) {
            merged.put("degradedSteps", List.copyOf(degraded));
        }
        return merged;
    }

    private Map<String, Object> runBranch(TeachingBranch branch, TutorState state, String sessionId) {
        MdcContext.setStep(sessionId, branch.name());
        long startMs = System.currentTimeMillis();
        try {
            return branch.apply(state);
        } catch (RuntimeException e) {
            log.error("Teaching branch {} failed, using fallback: {}", branch.name(), e.getMessage(), e);
            return branch.fallback(state);
        } finally {
            if (metrics != null) {
                metrics.recordStepDuration(branch.name(), System.currentTimeMillis() - startMs);
            }
            MdcContext.clear();
        }
    }

    @PreDestroy
    void shutdown() {
        executor.shutdown();
    }

    private static ThreadFactory threadFactory() {
        var counter = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, "teaching-branch-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }
}
