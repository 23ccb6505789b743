package io.arazzolens.core.graph;

import com.google.common.collect.ImmutableList;
import io.arazzolens.core.diagnostic.Diagnostic;
import io.arazzolens.core.diagnostic.DiagnosticCategory;
import io.arazzolens.core.model.Action;
import io.arazzolens.core.model.ActionKind;
import io.arazzolens.core.model.ActionType;
import io.arazzolens.core.model.ArazzoDocument;
import io.arazzolens.core.model.Step;
import io.arazzolens.core.model.TransferAction;
import io.arazzolens.core.model.Workflow;
import io.arazzolens.core.reference.ActionResolution;
import io.arazzolens.core.reference.ActionTargetResolver;
import io.arazzolens.core.tree.SourceRange;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Derives the control flow graph of one workflow.
 * <p>
 * Steps are chained in declaration order unless a step's success actions contain a {@code goto}
 * or {@code end}. Explicit actions add success and failure edges; {@code end} leads to the
 * output node on success and to the error sink on failure, {@code retry} loops back to its
 * target. Actions whose target does not exist produce no edge and a reference error.
 */
@Slf4j
public class TransitionGraphBuilder {

    private static final Set<String> RESERVED_IDS = Set.of(
            GraphNode.INPUT_ID, GraphNode.OUTPUT_ID, GraphNode.ERROR_SINK_ID
    );

    private final GraphOptions options;

    public TransitionGraphBuilder() {
        this(GraphOptions.ofDefault());
    }

    public TransitionGraphBuilder(final GraphOptions options) {
        this.options = Objects.requireNonNull(options);
    }

    public GraphBuildResult buildGraph(final Workflow workflow, final ArazzoDocument document) {
        var state = new BuildState(workflow, document);

        assignStepNodes(state);
        addDefaultEdges(state);
        for (Step step : workflow.getSteps()) {
            addActionEdges(state, step, ActionKind.SUCCESS);
            addActionEdges(state, step, ActionKind.FAILURE);
        }
        if (options.isReportUnreachableSteps()) {
            reportUnreachableSteps(state);
        }

        TransitionGraph graph = assemble(state);
        log.debug("Built graph of workflow '{}' with {} node(s) and {} edge(s)",
                workflow.displayName(), graph.getNodes().size(), graph.getEdges().size());
        return new GraphBuildResult(graph, ImmutableList.copyOf(state.diagnostics));
    }

    private void assignStepNodes(final BuildState state) {
        Set<String> usedIds = new HashSet<>();
        for (Step step : state.workflow.getSteps()) {
            String stepId = step.getStepId();
            String id;
            if (Objects.isNull(stepId)) {
                id = "steps[%d]".formatted(step.getIndex());
            } else if (isReserved(stepId)) {
                id = "step:" + stepId;
                state.diagnostics.add(Diagnostic.warning(DiagnosticCategory.GRAPH_WARNING,
                        "Step id '%s' collides with a reserved node id; the node is named '%s'".formatted(stepId, id),
                        step.rangeOf("stepId")));
            } else {
                id = stepId;
            }
            // duplicate ids are reported by the validator, the graph keeps every step
            if (!usedIds.add(id)) {
                id = "%s#%d".formatted(id, step.getIndex());
                usedIds.add(id);
            }
            GraphNode node = new GraphNode(id, GraphNodeKind.STEP, stepId, step.getIndex(), step.getOperationId(), step.getRange());
            state.stepNodes.add(node);
            if (Objects.nonNull(stepId)) state.nodeIdByStepId.putIfAbsent(stepId, id);
        }
    }

    private boolean isReserved(final String stepId) {
        return RESERVED_IDS.contains(stepId) || stepId.startsWith(GraphNode.WORKFLOW_ID_PREFIX) || stepId.startsWith("step:");
    }

    private void addDefaultEdges(final BuildState state) {
        List<Step> steps = state.workflow.getSteps();
        if (steps.isEmpty()) return;

        state.edges.add(GraphEdge.sequential(GraphNode.INPUT_ID, state.stepNodes.get(0).getId()));

        for (int i = 0; i < steps.size() - 1; i++) {
            Step step = steps.get(i);
            List<Action> suppressing = suppressingActions(state, step);
            if (suppressing.isEmpty()) {
                state.edges.add(GraphEdge.sequential(state.stepNodes.get(i).getId(), state.stepNodes.get(i + 1).getId()));
            } else if (options.isWarnOnConditionalSuppression() && suppressing.stream().allMatch(Action::isConditional)) {
                state.diagnostics.add(Diagnostic.warning(DiagnosticCategory.GRAPH_WARNING,
                        "Step '%s' has no unconditional transition: its goto/end success actions all carry criteria"
                                .formatted(step.displayName()),
                        step.getRange()));
            }
        }

        Step last = steps.get(steps.size() - 1);
        boolean endsExplicitly = effectiveActions(state, last, ActionKind.SUCCESS).stream()
                .map(ActionResolution::getEffective)
                .filter(Objects::nonNull)
                .anyMatch(action -> action.getType() == ActionType.END);
        if (state.workflow.declaresOutputs() && !endsExplicitly) {
            state.requireOutput();
            state.edges.add(GraphEdge.sequential(state.stepNodes.get(steps.size() - 1).getId(), GraphNode.OUTPUT_ID));
        }
    }

    private List<Action> suppressingActions(final BuildState state, final Step step) {
        List<Action> suppressing = new ArrayList<>();
        for (ActionResolution resolution : effectiveActions(state, step, ActionKind.SUCCESS)) {
            Action action = resolution.getEffective();
            if (Objects.nonNull(action) && (action.getType() == ActionType.GOTO || action.getType() == ActionType.END)) {
                suppressing.add(action);
            }
        }
        return suppressing;
    }

    private void addActionEdges(final BuildState state, final Step step, final ActionKind kind) {
        String from = state.stepNodes.get(step.getIndex()).getId();
        GraphEdgeKind edgeKind = kind == ActionKind.SUCCESS ? GraphEdgeKind.SUCCESS : GraphEdgeKind.FAILURE;

        for (ActionResolution resolution : effectiveActions(state, step, kind)) {
            state.diagnostics.addAll(resolution.getDiagnostics());
            if (!resolution.isResolved()) continue;

            Action action = resolution.getEffective();
            ActionType type = action.getType();
            if (type == ActionType.END) {
                String sink = kind == ActionKind.SUCCESS ? state.requireOutput() : state.requireErrorSink();
                state.edges.add(new GraphEdge(from, sink, edgeKind, label(action, "end")));
            } else if (type == ActionType.GOTO && ((TransferAction) action).targetCount() > 0) {
                String target = targetNode(state, (TransferAction) action, from);
                state.edges.add(new GraphEdge(from, target, edgeKind, label(action, kind == ActionKind.SUCCESS ? "success" : "failure")));
            } else if (type == ActionType.RETRY && kind == ActionKind.FAILURE) {
                String target = targetNode(state, (TransferAction) action, from);
                state.edges.add(new GraphEdge(from, target, GraphEdgeKind.FAILURE, label(action, "retry")));
            }
        }
    }

    private String targetNode(final BuildState state, final TransferAction action, final String self) {
        if (Objects.nonNull(action.getStepId())) {
            return state.nodeIdByStepId.get(action.getStepId());
        }
        if (Objects.nonNull(action.getWorkflowId())) {
            return state.requireWorkflowPlaceholder(action.getWorkflowId(), action.rangeOf("workflowId"));
        }
        // a retry without target repeats the current step
        return self;
    }

    private static String label(final Action action, final String fallback) {
        return Objects.nonNull(action.getName()) ? action.getName() : fallback;
    }

    private List<ActionResolution> effectiveActions(final BuildState state, final Step step, final ActionKind kind) {
        return state.resolutions.computeIfAbsent(step.getIndex() + ":" + kind.getValue(), key -> {
            List<Action> declared = kind == ActionKind.SUCCESS ? step.getOnSuccess() : step.getOnFailure();
            if (declared.isEmpty()) {
                // workflow level defaults apply to steps without actions of their own
                declared = kind == ActionKind.SUCCESS
                        ? state.workflow.getSuccessActions()
                        : state.workflow.getFailureActions();
            }
            List<ActionResolution> resolutions = new ArrayList<>();
            for (Action action : declared) {
                if (!action.isValid()) continue;
                resolutions.add(ActionTargetResolver.resolve(action, state.workflow, state.document));
            }
            return resolutions;
        });
    }

    private void reportUnreachableSteps(final BuildState state) {
        Map<String, List<String>> successors = new HashMap<>();
        for (GraphEdge edge : state.edges) {
            successors.computeIfAbsent(edge.getFrom(), key -> new ArrayList<>()).add(edge.getTo());
        }

        Set<String> visited = new HashSet<>();
        Deque<String> queue = new ArrayDeque<>();
        queue.add(GraphNode.INPUT_ID);
        visited.add(GraphNode.INPUT_ID);
        while (!queue.isEmpty()) {
            String current = queue.poll();
            for (String next : successors.getOrDefault(current, List.of())) {
                if (visited.add(next)) queue.add(next);
            }
        }

        for (GraphNode node : state.stepNodes) {
            if (!visited.contains(node.getId())) {
                state.diagnostics.add(Diagnostic.warning(DiagnosticCategory.GRAPH_WARNING,
                        "Step '%s' is not reachable from the workflow inputs".formatted(node.getId()), node.getRange()));
            }
        }
    }

    private TransitionGraph assemble(final BuildState state) {
        List<GraphEdge> edges = new ArrayList<>(state.edges);
        if (!options.isIncludeFailureEdges()) {
            edges.removeIf(edge -> edge.getKind() == GraphEdgeKind.FAILURE);
        }
        Set<String> referenced = new HashSet<>();
        edges.forEach(edge -> {
            referenced.add(edge.getFrom());
            referenced.add(edge.getTo());
        });

        ImmutableList.Builder<GraphNode> nodes = ImmutableList.builder();
        nodes.add(GraphNode.input(state.workflow.rangeOf("inputs")));
        nodes.addAll(state.stepNodes);
        if (state.outputRequired) {
            nodes.add(GraphNode.output(state.workflow.rangeOf("outputs")));
        }
        if (state.errorSinkRequired && referenced.contains(GraphNode.ERROR_SINK_ID)) {
            nodes.add(GraphNode.errorSink(state.workflow.getRange()));
        }
        state.placeholders.values().stream()
                .filter(placeholder -> referenced.contains(placeholder.getId()))
                .forEach(nodes::add);

        return new TransitionGraph(state.workflow.getWorkflowId(),
                ImmutableList.copyOf(state.workflow.getInputProperties()),
                ImmutableList.copyOf(state.workflow.getOutputs().keySet()),
                nodes.build(),
                ImmutableList.copyOf(edges));
    }

    private static final class BuildState {
        private final Workflow workflow;
        private final ArazzoDocument document;
        private final List<GraphNode> stepNodes = new ArrayList<>();
        private final Map<String, String> nodeIdByStepId = new HashMap<>();
        private final Map<String, GraphNode> placeholders = new LinkedHashMap<>();
        private final Map<String, List<ActionResolution>> resolutions = new HashMap<>();
        private final List<GraphEdge> edges = new ArrayList<>();
        // the same dangling default action is resolved once per step
        private final Set<Diagnostic> diagnostics = new LinkedHashSet<>();
        private boolean outputRequired;
        private boolean errorSinkRequired;

        private BuildState(final Workflow workflow, final ArazzoDocument document) {
            this.workflow = workflow;
            this.document = document;
            this.outputRequired = workflow.declaresOutputs();
        }

        String requireOutput() {
            outputRequired = true;
            return GraphNode.OUTPUT_ID;
        }

        String requireErrorSink() {
            errorSinkRequired = true;
            return GraphNode.ERROR_SINK_ID;
        }

        String requireWorkflowPlaceholder(final String workflowId, final SourceRange range) {
            return placeholders.computeIfAbsent(workflowId, id -> GraphNode.workflow(id, range)).getId();
        }
    }
}
