package com.stemtutor.core.graph;

import com.stemtutor.core.collaborators.*;
import com.stemtutor.core.llm.LlmService;
import com.stemtutor.core.metrics.TutorMetrics;
import com.stemtutor.core.model.*;
import com.stemtutor.core.nodes.*;
import com.stemtutor.core.routing.RoutingProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.bsc.langgraph4j.checkpoint.BaseCheckpointSaver;

import java.util.List;

import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

/**
 * Builds a real {@link TutorGraph} over a mocked {@link LlmService}.
 * <p>
 * The mocked classifier recognises three canned problems: a cross product
 * (clear, teaches), "hello" (unclear, asks for details) and a vague motion
 * question (mid confidence, asks for a topic).
 */
public class TutorGraphFixture {

    public static final String CLEAR_PROBLEM = "Find the cross product of [1,2,3] and [4,5,6]";
    public static final String UNCLEAR_PROBLEM = "hello";
    public static final String VAGUE_PROBLEM = "Help me with the motion problem";

    public final LlmService llm = mock(LlmService.class);
    public final SimpleMeterRegistry registry = new SimpleMeterRegistry();
    public final TutorMetrics metrics = new TutorMetrics(registry);
    public final RoutingProperties routing = new RoutingProperties();
    public final CollaboratorProperties collaboratorProperties = new CollaboratorProperties();

    public TutorGraphFixture() {
        collaboratorProperties.setMaxAttempts(2);
        collaboratorProperties.setInitialBackoffMs(1);
        collaboratorProperties.setFanOutPoolSize(2);

        when(llm.structuredCall(anyString(), contains(CLEAR_PROBLEM), eq(TopicClassification.class)))
                .thenReturn(new TopicClassification("Math", "Linear Algebra", "Cross Product",
                        1.0, false, List.of(), ""));
        when(llm.structuredCall(anyString(), contains(UNCLEAR_PROBLEM), eq(TopicClassification.class)))
                .thenReturn(new TopicClassification("Unknown", "Unknown", "Unknown",
                        0.0, true, List.of(), ""));
        when(llm.structuredCall(anyString(), contains(VAGUE_PROBLEM), eq(TopicClassification.class)))
                .thenReturn(new TopicClassification("Physics", "Mechanics", null,
                        0.6, false, List.of(), ""));

        when(llm.structuredCall(anyString(), anyString(), eq(TeachingPlan.class)))
                .thenReturn(new TeachingPlan("<h3>Plan</h3><ol><li>Set up the determinant</li></ol>",
                        List.of("determinant")));
        when(llm.structuredCall(anyString(), anyString(), eq(WorkedSolution.class)))
                .thenReturn(new WorkedSolution(
                        "Compute a x b",
                        List.of(new SolutionStep(1, "Set up", "Write the determinant", "$\\det$"),
                                new SolutionStep(2, "Expand", "Expand along the first row", "")),
                        "(-3, 6, -3)",
                        List.of("cross product")));
        when(llm.structuredCall(anyString(), anyString(), eq(PracticeProblem.class)))
                .thenReturn(new PracticeProblem("## Try it yourself!\n\nFind [2,0,1] x [1,1,1]", "Use the determinant"));
    }

    public TutorGraph build(BaseCheckpointSaver saver) throws Exception {
        var invoker = new CollaboratorInvoker(collaboratorProperties, metrics);
        var classifier = new TopicClassifier(llm, invoker);
        var mediaFinder = new ReferenceMediaFinder(invoker, new MediaProperties(), new ObjectMapper());
        List<TeachingBranch> branches = List.of(
                new PracticeBranch(new PracticeGenerator(llm, invoker)),
                new ReferenceMediaBranch(mediaFinder));

        return new TutorGraph(
                new DispatchInputNode(),
                new ClassifyProblemNode(classifier, routing),
                new EvaluateConfidenceNode(routing),
                new ClarificationNode(),
                new DisambiguationNode(),
                new TeachingArchitectNode(new TeachingPlanGenerator(llm, invoker)),
                new StepSolverNode(new SolutionGenerator(llm, invoker)),
                new ParallelTeachingNode(branches, collaboratorProperties, metrics),
                new AssembleOutputNode(),
                metrics,
                saver);
    }
}
