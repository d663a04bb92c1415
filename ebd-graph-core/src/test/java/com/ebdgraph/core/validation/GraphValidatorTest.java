package com.ebdgraph.core.validation;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import com.ebdgraph.core.graph.AnnotationNode;
import com.ebdgraph.core.graph.DecisionNode;
import com.ebdgraph.core.graph.EbdGraph;
import com.ebdgraph.core.graph.EmptyNode;
import com.ebdgraph.core.graph.EndNode;
import com.ebdgraph.core.graph.GraphEdge;
import com.ebdgraph.core.graph.GraphNode;
import com.ebdgraph.core.graph.OutcomeNode;
import com.ebdgraph.core.graph.StartNode;
import com.ebdgraph.core.graph.TransitionNode;
import com.ebdgraph.core.graph.TransitionalOutcomeNode;
import com.ebdgraph.core.table.EbdTableMetadata;
import com.ebdgraph.core.table.StepNumber;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link GraphValidator} on hand-built graphs.
 */
class GraphValidatorTest {

    private static final EbdTableMetadata METADATA = EbdTableMetadata.of("E_0100", "NB");

    private GraphValidator validator;

    @BeforeEach
    void setUp() {
        validator = new GraphValidator();
    }

    @Test
    void validate_wellFormedGraph_returnsNoFindings() {
        EbdGraph graph = graph(
            List.of(new StartNode(), decision("1", "ja", "nein"), new EndNode(), new OutcomeNode("A01", "A01", null)),
            List.of(GraphEdge.start("1"), GraphEdge.outcome("1", "Ende", "ja"), GraphEdge.outcome("1", "A01", "nein")));

        assertThat(validator.validate(graph)).isEmpty();
    }

    @Test
    void validate_withoutStartNode_reportsFatalFinding() {
        EbdGraph graph = graph(
            List.of(decision("1", "ja"), new EndNode()),
            List.of(GraphEdge.outcome("1", "Ende", "ja")));

        List<Finding> findings = validator.validate(graph);

        assertThat(findings).extracting(Finding::kind).containsExactly(FindingKind.MISSING_START_NODE);
        assertThat(findings.get(0).isFatal()).isTrue();
        assertThat(findings.get(0).elementId()).isEqualTo("graph");
    }

    @Test
    void validate_unreachableDecision_reportsEachUnreachableNode() {
        EbdGraph graph = graph(
            List.of(new StartNode(), decision("1", "ja"), decision("2", "ja"), new EndNode(),
                new AnnotationNode(StepNumber.of("2"), "hinweis", null)),
            List.of(GraphEdge.start("1"), GraphEdge.outcome("1", "Ende", "ja"), GraphEdge.outcome("2", "Ende", "ja"),
                GraphEdge.annotates("msi_2", "2")));

        List<Finding> findings = validator.validate(graph);

        assertThat(findings).extracting(Finding::kind)
            .containsExactly(FindingKind.UNREACHABLE_NODE, FindingKind.UNREACHABLE_NODE);
        assertThat(findings).extracting(Finding::elementId).containsExactly("2", "msi_2");
    }

    @Test
    void validate_annotationOfReachableStep_isReachable() {
        EbdGraph graph = graph(
            List.of(new StartNode(), decision("1", "ja"), new EndNode(),
                new AnnotationNode(StepNumber.of("1"), "hinweis", null)),
            List.of(GraphEdge.start("1"), GraphEdge.outcome("1", "Ende", "ja"), GraphEdge.annotates("msi_1", "1")));

        assertThat(validator.validate(graph)).isEmpty();
    }

    @Test
    void validate_missingOutcomeEdge_reportsMalformedOutcomeSet() {
        EbdGraph graph = graph(
            List.of(new StartNode(), decision("1", "ja", "nein"), new EndNode()),
            List.of(GraphEdge.start("1"), GraphEdge.outcome("1", "Ende", "ja")));

        List<Finding> findings = validator.validate(graph);

        assertThat(findings).extracting(Finding::kind).containsExactly(FindingKind.MALFORMED_OUTCOME_SET);
        assertThat(findings.get(0).elementId()).isEqualTo("1");
    }

    @Test
    void validate_duplicateOutcomeLabel_reportsIt() {
        EbdGraph graph = graph(
            List.of(new StartNode(), decision("1", "ja"), new EndNode(), new OutcomeNode("A01", "A01", null)),
            List.of(GraphEdge.start("1"), GraphEdge.outcome("1", "Ende", "ja"), GraphEdge.outcome("1", "A01", "ja")));

        List<Finding> findings = validator.validate(graph);

        assertThat(findings).extracting(Finding::kind).containsExactly(FindingKind.DUPLICATE_OUTCOME_LABEL);
        assertThat(findings.get(0).message()).contains("'ja'");
    }

    @Test
    void validate_branchEdges_areDistinctIdentities() {
        EbdGraph graph = graph(
            List.of(new StartNode(), decision("1", "ja"), new EndNode(), new OutcomeNode("A01", "A01", null)),
            List.of(GraphEdge.start("1"), GraphEdge.branch("1", "Ende", "ja", 0), GraphEdge.branch("1", "A01", "ja", 1)));

        assertThat(validator.validate(graph)).isEmpty();
    }

    @Test
    void validate_loop_isWarningPerBackEdge() {
        EbdGraph graph = graph(
            List.of(new StartNode(), decision("1", "ja", "nein"), decision("2", "ja", "nein"), new EndNode()),
            List.of(GraphEdge.start("1"),
                GraphEdge.outcome("1", "2", "ja"), GraphEdge.outcome("1", "1", "nein"),
                GraphEdge.outcome("2", "Ende", "ja"), GraphEdge.outcome("2", "1", "nein")));

        List<Finding> findings = validator.validate(graph);

        assertThat(findings).extracting(Finding::severity).containsOnly(Severity.WARNING);
        assertThat(findings).extracting(Finding::elementId)
            .containsExactlyInAnyOrder("1-[nein]->1", "2-[nein]->1");
    }

    @Test
    void requireRenderable_malformedOutcomeSet_throwsMalformedOutcomeSetException() {
        EbdGraph graph = graph(
            List.of(new StartNode(), decision("1", "ja", "nein"), new EndNode()),
            List.of(GraphEdge.start("1"), GraphEdge.outcome("1", "Ende", "ja")));

        assertThatThrownBy(() -> validator.requireRenderable(graph))
            .isInstanceOfSatisfying(MalformedOutcomeSetException.class,
                e -> assertThat(e.getFindings()).extracting(Finding::kind)
                    .containsExactly(FindingKind.MALFORMED_OUTCOME_SET));
    }

    @Test
    void requireRenderable_otherFatalFinding_throwsGraphValidationException() {
        EbdGraph graph = graph(
            List.of(decision("1", "ja"), new EndNode()),
            List.of(GraphEdge.outcome("1", "Ende", "ja")));

        assertThatThrownBy(() -> validator.requireRenderable(graph))
            .isInstanceOf(GraphValidationException.class)
            .isNotInstanceOf(MalformedOutcomeSetException.class)
            .hasMessageContaining("E_0100");
    }

    @Test
    void requireRenderable_onlyWarnings_returnsReport() {
        EbdGraph graph = graph(
            List.of(new StartNode(), decision("1", "ja", "nein"), new EndNode()),
            List.of(GraphEdge.start("1"), GraphEdge.outcome("1", "Ende", "ja"), GraphEdge.outcome("1", "1", "nein")));

        ValidationReport report = validator.requireRenderable(graph);

        assertThat(report.hasFatal()).isFalse();
        assertThat(report.warnings()).hasSize(1);
    }

    @Test
    void validate_loopClosedAtEndOfLongChain_isFoundWithoutExhaustingTheStack() {
        int length = 20_000;
        List<GraphNode> nodes = new ArrayList<>(List.of(new StartNode(), new EndNode()));
        List<GraphEdge> edges = new ArrayList<>(List.of(GraphEdge.start("1")));
        for (int step = 1; step < length; step++) {
            nodes.add(decision(String.valueOf(step), "ja"));
            edges.add(GraphEdge.outcome(String.valueOf(step), String.valueOf(step + 1), "ja"));
        }
        nodes.add(decision(String.valueOf(length), "ja", "nein"));
        edges.add(GraphEdge.outcome(String.valueOf(length), "Ende", "ja"));
        edges.add(GraphEdge.outcome(String.valueOf(length), "1", "nein"));

        List<Finding> findings = validator.validate(graph(nodes, edges));

        assertThat(findings).extracting(Finding::elementId).containsExactly(length + "-[nein]->1");
        assertThat(findings.get(0).message()).isEqualTo("Step 20000 loops back to step 1 for outcome 'nein'");
    }

    @Test
    void validate_transitionLoop_namesNoOutcome() {
        EbdGraph graph = graph(
            List.of(new StartNode(), decision("1", "ja", "nein"), transition("2"), new EndNode()),
            List.of(GraphEdge.start("1"), GraphEdge.outcome("1", "2", "ja"), GraphEdge.outcome("1", "Ende", "nein"),
                GraphEdge.transition("2", "1")));

        List<Finding> findings = validator.validate(graph);

        assertThat(findings).extracting(Finding::kind).containsExactly(FindingKind.CYCLE);
        assertThat(findings.get(0).message()).isEqualTo("Step 2 loops back to step 1");
    }

    @Test
    void validate_wellFormedTransitions_returnNoFindings() {
        EbdGraph graph = graph(
            List.of(new StartNode(), decision("1", "ja", "nein"), transition("2"), decision("3", "ja"),
                new TransitionalOutcomeNode("A90_3", "A90", "nachfragen", StepNumber.of("3"), null), new EndNode()),
            List.of(GraphEdge.start("1"), GraphEdge.outcome("1", "2", "ja"), GraphEdge.outcome("1", "A90_3", "nein"),
                GraphEdge.transition("A90_3", "3"), GraphEdge.transition("2", "3"), GraphEdge.outcome("3", "Ende", "ja")));

        assertThat(validator.validate(graph)).isEmpty();
    }

    @Test
    void validate_transitionWithoutNextStep_reportsMalformedTransition() {
        EbdGraph graph = graph(
            List.of(new StartNode(), transition("1")),
            List.of(GraphEdge.start("1")));

        List<Finding> findings = validator.validate(graph);

        assertThat(findings).extracting(Finding::kind).containsExactly(FindingKind.MALFORMED_TRANSITION);
        assertThat(findings.get(0).elementId()).isEqualTo("1");
        assertThat(findings.get(0).isFatal()).isTrue();
    }

    @Test
    void validate_decisionWithTransitionEdge_reportsMalformedTransition() {
        EbdGraph graph = graph(
            List.of(new StartNode(), decision("1", "ja"), new EndNode()),
            List.of(GraphEdge.start("1"), GraphEdge.outcome("1", "Ende", "ja"), GraphEdge.transition("1", "Ende")));

        assertThat(validator.validate(graph)).extracting(Finding::kind)
            .containsExactly(FindingKind.MALFORMED_TRANSITION);
    }

    @Test
    void validate_transitionalOutcomeLeadingElsewhere_reportsMalformedTransition() {
        EbdGraph graph = graph(
            List.of(new StartNode(), decision("1", "ja"), decision("2", "ja"), decision("3", "ja"), new EndNode(),
                new TransitionalOutcomeNode("A90_3", "A90", null, StepNumber.of("3"), null)),
            List.of(GraphEdge.start("1"), GraphEdge.outcome("1", "A90_3", "ja"), GraphEdge.transition("A90_3", "2"),
                GraphEdge.outcome("2", "3", "ja"), GraphEdge.outcome("3", "Ende", "ja")));

        assertThat(validator.validate(graph)).extracting(Finding::kind, Finding::elementId)
            .containsExactly(tuple(FindingKind.MALFORMED_TRANSITION, "A90_3"));
    }

    @Test
    void validate_emptyNodeAlone_returnsNoFindings() {
        EbdGraph graph = graph(List.of(new StartNode(), new EmptyNode()), List.of(GraphEdge.start(EmptyNode.ID)));

        assertThat(validator.validate(graph)).isEmpty();
    }

    @Test
    void validate_emptyNodeNextToSteps_reportsUnexpectedEmptyNode() {
        EbdGraph graph = graph(
            List.of(new StartNode(), new EmptyNode(), decision("1", "ja"), new EndNode()),
            List.of(GraphEdge.start(EmptyNode.ID), GraphEdge.start("1"), GraphEdge.outcome("1", "Ende", "ja")));

        List<Finding> findings = validator.validate(graph);

        assertThat(findings).extracting(Finding::kind).containsExactly(FindingKind.UNEXPECTED_EMPTY_NODE);
        assertThat(findings.get(0).message()).isEqualTo("Empty-table node next to 2 other nodes");
    }

    @Test
    void requireRenderable_warnings_areLeftToTheCaller() {
        EbdGraph graph = graph(
            List.of(new StartNode(), decision("1", "ja", "nein"), new EndNode()),
            List.of(GraphEdge.start("1"), GraphEdge.outcome("1", "Ende", "ja"), GraphEdge.outcome("1", "1", "nein")));
        Logger logger = (Logger) LoggerFactory.getLogger(GraphValidator.class);
        ListAppender<ILoggingEvent> appender = new ListAppender<>();
        appender.start();
        logger.addAppender(appender);

        try {
            ValidationReport report = validator.requireRenderable(graph);

            assertThat(report.warnings()).hasSize(1);
            assertThat(appender.list).noneMatch(event -> event.getLevel().isGreaterOrEqual(Level.WARN));
        } finally {
            logger.detachAppender(appender);
        }
    }

    private static EbdGraph graph(List<GraphNode> nodes, List<GraphEdge> edges) {
        return new EbdGraph(METADATA, nodes, edges);
    }

    private static DecisionNode decision(String step, String... outcomeCodes) {
        return new DecisionNode(StepNumber.of(step), "Prüfschritt " + step, null, List.of(outcomeCodes));
    }

    private static TransitionNode transition(String step) {
        return new TransitionNode(StepNumber.of(step), "Schritt " + step, null);
    }
}
