package io.arazzolens.core.reference;

import com.google.common.base.Strings;
import com.google.common.collect.ImmutableList;
import io.arazzolens.core.diagnostic.Diagnostic;
import io.arazzolens.core.diagnostic.DiagnosticCategory;
import io.arazzolens.core.model.Action;
import io.arazzolens.core.model.ArazzoDocument;
import io.arazzolens.core.model.Components.ComponentCategory;
import io.arazzolens.core.model.ReferencedAction;
import io.arazzolens.core.model.TransferAction;
import io.arazzolens.core.model.Workflow;
import io.arazzolens.core.tree.SourceRange;
import org.apache.commons.lang3.StringUtils;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Resolves reusable action references and goto/retry targets. Both the validator and the graph
 * builder go through here so a dangling target is reported with the same message and range.
 */
public final class ActionTargetResolver {

    public static final String COMPONENTS_PREFIX = "$components.";
    public static final String SOURCE_DESCRIPTIONS_PREFIX = "$sourceDescriptions.";

    public static ActionResolution resolve(final Action declared,
                                           final Workflow workflow,
                                           final ArazzoDocument document) {
        List<Diagnostic> diagnostics = new ArrayList<>();
        Action effective = declared;
        if (declared instanceof ReferencedAction referencedAction) {
            effective = resolveReference(referencedAction, document, diagnostics);
        }

        boolean targetResolved = true;
        if (effective instanceof TransferAction transferAction) {
            // report at the reference site when the action came from components
            SourceRange stepIdRange = declared == effective ? transferAction.rangeOf("stepId") : declared.rangeOf("reference");
            SourceRange workflowIdRange = declared == effective ? transferAction.rangeOf("workflowId") : declared.rangeOf("reference");
            targetResolved = resolveTarget(transferAction, workflow, document, stepIdRange, workflowIdRange, diagnostics);
        }
        return new ActionResolution(declared, effective, targetResolved, ImmutableList.copyOf(diagnostics));
    }

    private static Action resolveReference(final ReferencedAction action,
                                           final ArazzoDocument document,
                                           final List<Diagnostic> diagnostics) {
        String reference = action.getReference();
        SourceRange range = action.rangeOf("reference");
        ComponentCategory expected = action.getKind().getComponentCategory();
        String expectedPrefix = COMPONENTS_PREFIX + expected.getValue() + ".";
        if (Strings.isNullOrEmpty(reference) || !reference.startsWith(expectedPrefix)) {
            diagnostics.add(Diagnostic.error(DiagnosticCategory.REFERENCE_ERROR,
                    "Reusable action reference '%s' must point into components.%s".formatted(reference, expected.getValue()),
                    range));
            return null;
        }
        String name = StringUtils.removeStart(reference, expectedPrefix);
        Action resolved = (Action) document.getComponentsOrEmpty().entries(expected).get(name);
        if (Objects.isNull(resolved)) {
            diagnostics.add(Diagnostic.error(DiagnosticCategory.REFERENCE_ERROR,
                    "Component '%s' is not declared in components.%s".formatted(name, expected.getValue()), range));
        }
        return resolved;
    }

    private static boolean resolveTarget(final TransferAction action,
                                         final Workflow workflow,
                                         final ArazzoDocument document,
                                         final SourceRange stepIdRange,
                                         final SourceRange workflowIdRange,
                                         final List<Diagnostic> diagnostics) {
        boolean resolved = true;
        String stepId = action.getStepId();
        if (Objects.nonNull(stepId) && Objects.nonNull(workflow) && workflow.findStep(stepId).isEmpty()) {
            diagnostics.add(Diagnostic.error(DiagnosticCategory.REFERENCE_ERROR,
                    "Action '%s' targets step '%s' which does not exist in workflow '%s'"
                            .formatted(action.displayName(), stepId, workflow.displayName()),
                    stepIdRange));
            resolved = false;
        }

        String workflowId = action.getWorkflowId();
        if (Objects.nonNull(workflowId)) {
            if (workflowId.startsWith(SOURCE_DESCRIPTIONS_PREFIX)) {
                String sourceName = StringUtils.substringBefore(
                        StringUtils.removeStart(workflowId, SOURCE_DESCRIPTIONS_PREFIX), ".");
                if (document.findSourceDescription(sourceName).isEmpty()) {
                    diagnostics.add(Diagnostic.error(DiagnosticCategory.REFERENCE_ERROR,
                            "Source description '%s' is not declared".formatted(sourceName), workflowIdRange));
                    resolved = false;
                }
            } else if (document.findWorkflow(workflowId).isEmpty()) {
                diagnostics.add(Diagnostic.error(DiagnosticCategory.REFERENCE_ERROR,
                        "Action '%s' targets workflow '%s' which does not exist".formatted(action.displayName(), workflowId),
                        workflowIdRange));
                resolved = false;
            }
        }
        return resolved;
    }

    private ActionTargetResolver() {}
}
