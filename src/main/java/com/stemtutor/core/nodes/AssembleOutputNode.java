package com.stemtutor.core.nodes;

import com.stemtutor.core.model.SessionStatus;
import com.stemtutor.core.model.SolutionStep;
import com.stemtutor.core.state.TutorState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Map;

import static org.springframework.web.util.HtmlUtils.htmlEscape;

/**
 * Compiles the teaching artifacts into the final lesson HTML and completes the session.
 * <p>
 * The teaching plan is model-authored HTML and is embedded as is; every other
 * value is escaped.
 */
@Component
public class AssembleOutputNode {

    private static final Logger log = LoggerFactory.getLogger(AssembleOutputNode.class);

    public Map<String, Object> apply(TutorState state) {
        String html = render(state);
        if (!state.degradedSteps().isEmpty()) {
            log.warn("Lesson assembled with degraded steps: {}", state.degradedSteps());
        } else {
            log.info("Lesson assembled ({} chars)", html.length());
        }
        return Map.of(
                "finalOutput", html,
                "haltedAwaitingInput", false,
                "status", SessionStatus.COMPLETED.name()
        );
    }

    static String render(TutorState state) {
        var sb = new StringBuilder();
        sb.append("<article class='lesson'>");
        sb.append("<h1>").append(htmlEscape(state.lessonTopic())).append("</h1>");

        if (!state.teachingPlan().isBlank()) {
            sb.append("<section class='plan'>").append(state.teachingPlan()).append("</section>");
        }

        var steps = state.solutionSteps();
        if (!steps.isEmpty() || !state.workedSolution().isBlank()) {
            sb.append("<section class='solution'><h2>Worked solution</h2><ol>");
            for (SolutionStep step : steps) {
                sb.append("<li data-step='").append(step.index()).append("'>");
                sb.append("<h4>").append(htmlEscape(nullToEmpty(step.title()))).append("</h4>");
                sb.append("<p>").append(htmlEscape(nullToEmpty(step.explanation()))).append("</p>");
                if (step.expression() != null && !step.expression().isBlank()) {
                    sb.append("<div class='math'>").append(htmlEscape(step.expression())).append("</div>");
                }
                sb.append("</li>");
            }
            sb.append("</ol>");
            if (!state.workedSolution().isBlank()) {
                sb.append("<p class='final-answer'><strong>Answer:</strong> ")
                        .append(htmlEscape(state.workedSolution())).append("</p>");
            }
            sb.append("</section>");
        }

        if (!state.practiceContent().isBlank()) {
            sb.append("<section class='practice'><pre class='markdown'>")
                    .append(htmlEscape(state.practiceContent())).append("</pre></section>");
        }

        if (!state.referenceMediaUrl().isBlank()) {
            sb.append("<section class='media'><a href='").append(htmlEscape(state.referenceMediaUrl()))
                    .append("'>Watch a walkthrough</a></section>");
        }

        sb.append("</article>");
        return sb.toString();
    }

    private static String nullToEmpty(String s) {
        return s != null ? s : "";
    }
}
