package com.stemtutor.core.graph;

import com.stemtutor.core.logging.MdcContext;
import com.stemtutor.core.metrics.TutorMetrics;
import com.stemtutor.core.model.InputKind;
import com.stemtutor.core.model.Route;
import com.stemtutor.core.nodes.*;
import com.stemtutor.core.state.TutorState;
import org.bsc.langgraph4j.CompileConfig;
import org.bsc.langgraph4j.CompiledGraph;
import org.bsc.langgraph4j.StateGraph;
import org.bsc.langgraph4j.action.AsyncNodeAction;
import org.bsc.langgraph4j.action.NodeAction;
import org.bsc.langgraph4j.checkpoint.BaseCheckpointSaver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.Map;

import static org.bsc.langgraph4j.StateGraph.END;
import static org.bsc.langgraph4j.StateGraph.START;
import static org.bsc.langgraph4j.action.AsyncEdgeAction.edge_async;
import static org.bsc.langgraph4j.action.AsyncNodeAction.node_async;

/**
 * Builds and holds the compiled LangGraph4j {@link StateGraph} that drives
 * a tutoring session.
 * <p>
 * Graph topology:
 * <pre>
 *   START -> dispatch_input -> [routeInput]
 *            -> text_classifier   -> evaluate_confidence
 *            -> vision_classifier -> evaluate_confidence
 *            -> evaluate_confidence  (resume: classification skipped)
 *   evaluate_confidence -> [routeAfterEvaluation]
 *            -> clarification  -> END   (halted, awaiting details)
 *            -> disambiguation -> END   (halted, awaiting topic choice)
 *            -> teaching_architect -> step_solver -> parallel_teaching -> assembler -> END
 * </pre>
 * With a checkpoint saver attached, the runtime writes one checkpoint per
 * completed step before the next step starts.
 */
@Component
public class TutorGraph {

    private static final Logger log = LoggerFactory.getLogger(TutorGraph.class);

    private final CompiledGraph<TutorState> compiledGraph;
    private final TutorMetrics metrics;

    public TutorGraph(
            DispatchInputNode dispatchNode,
            ClassifyProblemNode classifyNode,
            EvaluateConfidenceNode evaluateNode,
            ClarificationNode clarificationNode,
            DisambiguationNode disambiguationNode,
            TeachingArchitectNode architectNode,
            StepSolverNode solverNode,
            ParallelTeachingNode parallelNode,
            AssembleOutputNode assembleNode,
            TutorMetrics metrics,
            @Autowired(required = false) BaseCheckpointSaver checkpointSaver) throws Exception {
        this.metrics = metrics;

        var graph = new StateGraph<>(TutorState.SCHEMA, TutorState::new)
                .addNode(StepName.DISPATCH_INPUT.id(), step(StepName.DISPATCH_INPUT, dispatchNode::apply))
                .addNode(StepName.TEXT_CLASSIFIER.id(), step(StepName.TEXT_CLASSIFIER, classifyNode::classifyText))
                .addNode(StepName.VISION_CLASSIFIER.id(), step(StepName.VISION_CLASSIFIER, classifyNode::classifyImage))
                .addNode(StepName.EVALUATE_CONFIDENCE.id(), step(StepName.EVALUATE_CONFIDENCE, evaluateNode::apply))
                .addNode(StepName.CLARIFICATION.id(), step(StepName.CLARIFICATION, clarificationNode::apply))
                .addNode(StepName.DISAMBIGUATION.id(), step(StepName.DISAMBIGUATION, disambiguationNode::apply))
                .addNode(StepName.TEACHING_ARCHITECT.id(), step(StepName.TEACHING_ARCHITECT, architectNode::apply))
                .addNode(StepName.STEP_SOLVER.id(), step(StepName.STEP_SOLVER, solverNode::apply))
                .addNode(StepName.PARALLEL_TEACHING.id(), step(StepName.PARALLEL_TEACHING, parallelNode::apply))
                .addNode(StepName.ASSEMBLER.id(), step(StepName.ASSEMBLER, assembleNode::apply))
                .addEdge(START, StepName.DISPATCH_INPUT.id())
                .addConditionalEdges(StepName.DISPATCH_INPUT.id(),
                        edge_async(this::routeInput),
                        Map.of(StepName.TEXT_CLASSIFIER.id(), StepName.TEXT_CLASSIFIER.id(),
                                StepName.VISION_CLASSIFIER.id(), StepName.VISION_CLASSIFIER.id(),
                                StepName.EVALUATE_CONFIDENCE.id(), StepName.EVALUATE_CONFIDENCE.id()))
                .addEdge(StepName.TEXT_CLASSIFIER.id(), StepName.EVALUATE_CONFIDENCE.id())
                .addEdge(StepName.VISION_CLASSIFIER.id(), StepName.EVALUATE_CONFIDENCE.id())
                .addConditionalEdges(StepName.EVALUATE_CONFIDENCE.id(),
                        edge_async(this::routeAfterEvaluation),
                        Map.of(Route.CLARIFY.name(), StepName.CLARIFICATION.id(),
                                Route.DISAMBIGUATE.name(), StepName.DISAMBIGUATION.id(),
                                Route.TEACH.name(), StepName.TEACHING_ARCHITECT.id()))
                .addEdge(StepName.CLARIFICATION.id(), END)
                .addEdge(StepName.DISAMBIGUATION.id(), END)
                .addEdge(StepName.TEACHING_ARCHITECT.id(), StepName.STEP_SOLVER.id())
                .addEdge(StepName.STEP_SOLVER.id(), StepName.PARALLEL_TEACHING.id())
                .addEdge(StepName.PARALLEL_TEACHING.id(), StepName.ASSEMBLER.id())
                .addEdge(StepName.ASSEMBLER.id(), END);

        var configBuilder = CompileConfig.builder();
        if (checkpointSaver != null) {
            configBuilder.checkpointSaver(checkpointSaver);
            log.info("Graph compiled with checkpoint saver: {}", checkpointSaver.getClass().getSimpleName());
        } else {
            log.info("Graph compiled without checkpoint saver (sessions cannot be resumed)");
        }
        this.compiledGraph = graph.compile(configBuilder.build());
    }

    /**
     * A resumed session already carries the selected topic, so classification
     * is skipped and the router re-evaluates the overridden values.
     */
    String routeInput(TutorState state) {
        if (state.resumeSelection().isPresent()) {
            return StepName.EVALUATE_CONFIDENCE.id();
        }
        return state.inputKind() == InputKind.IMAGE
                ? StepName.VISION_CLASSIFIER.id()
                : StepName.TEXT_CLASSIFIER.id();
    }

    String routeAfterEvaluation(TutorState state) {
        return state.route()
                .orElseThrow(() -> new IllegalStateException("No route recorded for session " + state.sessionId()))
                .name();
    }

    private AsyncNodeAction<TutorState> step(StepName name, NodeAction<TutorState> action) {
        return node_async(state -> {
            MdcContext.setStep(state.sessionId(), name.id());
            long startMs = System.currentTimeMillis();
            try {
                return action.apply(state);
            } finally {
                metrics.recordStepDuration(name.id(), System.currentTimeMillis() - startMs);
                MdcContext.clearStep();
            }
        });
    }

    public CompiledGraph<TutorState> getCompiledGraph() {
        return compiledGraph;
    }
}
