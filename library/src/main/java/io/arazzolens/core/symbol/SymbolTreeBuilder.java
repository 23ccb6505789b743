package io.arazzolens.core.symbol;

import com.google.common.base.Strings;
import com.google.common.collect.ImmutableList;
import io.arazzolens.core.model.ArazzoDocument;
import io.arazzolens.core.model.ArazzoElement;
import io.arazzolens.core.model.Components;
import io.arazzolens.core.model.Info;
import io.arazzolens.core.model.SourceDescription;
import io.arazzolens.core.model.Step;
import io.arazzolens.core.model.Workflow;
import io.arazzolens.core.tree.SourceRange;
import lombok.extern.slf4j.Slf4j;

import java.util.Map;
import java.util.Objects;

/**
 * Builds the document outline: source descriptions as interfaces of a module, workflows as
 * classes whose steps are functions, info and components as fields and modules.
 * <p>
 * Entities without an identifier are listed under their index. Nothing is validated here.
 */
@Slf4j
public class SymbolTreeBuilder {

    private static final String INFO = "info";
    private static final String SOURCE_DESCRIPTIONS = "sourceDescriptions";
    private static final String WORKFLOWS = "workflows";
    private static final String STEPS = "steps";
    private static final String COMPONENTS = "components";

    public ImmutableList<SymbolNode> buildSymbols(final ArazzoDocument document) {
        ImmutableList.Builder<SymbolNode> symbols = ImmutableList.builder();
        if (Objects.isNull(document) || !document.isValid()) return symbols.build();

        if (Objects.nonNull(document.getInfo())) {
            symbols.add(infoSymbol(document.getInfo(), document));
        }
        if (document.has(SOURCE_DESCRIPTIONS)) {
            ImmutableList.Builder<SymbolNode> children = ImmutableList.builder();
            var sourceDescriptions = document.getSourceDescriptions();
            for (int i = 0; i < sourceDescriptions.size(); i++) {
                children.add(sourceDescriptionSymbol(sourceDescriptions.get(i), i));
            }
            symbols.add(new SymbolNode(SOURCE_DESCRIPTIONS, "", SymbolKind.MODULE,
                    document.rangeOf(SOURCE_DESCRIPTIONS), children.build()));
        }
        if (document.has(WORKFLOWS)) {
            ImmutableList.Builder<SymbolNode> children = ImmutableList.builder();
            document.getWorkflows().forEach(workflow -> children.add(workflowSymbol(workflow)));
            symbols.add(new SymbolNode(WORKFLOWS, "", SymbolKind.CLASS,
                    document.rangeOf(WORKFLOWS), children.build()));
        }
        if (Objects.nonNull(document.getComponents())) {
            symbols.add(componentsSymbol(document.getComponents(), document));
        }

        ImmutableList<SymbolNode> result = symbols.build();
        log.debug("Built {} top level symbol(s)", result.size());
        return result;
    }

    private SymbolNode infoSymbol(final Info info, final ArazzoDocument document) {
        return SymbolNode.leaf(INFO, Strings.nullToEmpty(info.getTitle()), SymbolKind.FIELD, document.rangeOf(INFO));
    }

    private SymbolNode sourceDescriptionSymbol(final SourceDescription sourceDescription, final int index) {
        if (Strings.isNullOrEmpty(sourceDescription.getName())) {
            return SymbolNode.leaf(String.valueOf(index), "", SymbolKind.ARRAY, sourceDescription.getRange());
        }
        return SymbolNode.leaf(sourceDescription.getName(), Strings.nullToEmpty(sourceDescription.getUrl()),
                SymbolKind.INTERFACE, sourceDescription.getRange());
    }

    private SymbolNode workflowSymbol(final Workflow workflow) {
        ImmutableList.Builder<SymbolNode> children = ImmutableList.builder();
        if (workflow.has(STEPS)) {
            ImmutableList.Builder<SymbolNode> steps = ImmutableList.builder();
            workflow.getSteps().forEach(step -> steps.add(stepSymbol(step)));
            children.add(new SymbolNode(STEPS, "", SymbolKind.METHOD, workflow.rangeOf(STEPS), steps.build()));
        }
        if (Strings.isNullOrEmpty(workflow.getWorkflowId())) {
            return new SymbolNode(String.valueOf(workflow.getIndex()), "", SymbolKind.ARRAY,
                    workflow.getRange(), children.build());
        }
        return new SymbolNode(workflow.getWorkflowId(), Strings.nullToEmpty(workflow.getSummary()), SymbolKind.CLASS,
                workflow.getRange(), children.build());
    }

    private SymbolNode stepSymbol(final Step step) {
        if (Strings.isNullOrEmpty(step.getStepId())) {
            return SymbolNode.leaf(String.valueOf(step.getIndex()), "", SymbolKind.ARRAY, step.getRange());
        }
        return SymbolNode.leaf(step.getStepId(), Strings.nullToEmpty(step.getDescription()), SymbolKind.FUNCTION, step.getRange());
    }

    private SymbolNode componentsSymbol(final Components components, final ArazzoDocument document) {
        ImmutableList.Builder<SymbolNode> children = ImmutableList.builder();
        for (Components.ComponentCategory category : Components.ComponentCategory.values()) {
            if (!components.has(category.getValue())) continue;
            ImmutableList.Builder<SymbolNode> entries = ImmutableList.builder();
            for (Map.Entry<String, ?> entry : components.entries(category).entrySet()) {
                entries.add(SymbolNode.leaf(entry.getKey(), "", SymbolKind.FIELD,
                        entryRange(entry.getValue(), components, category)));
            }
            children.add(new SymbolNode(category.getValue(), "", SymbolKind.MODULE,
                    components.rangeOf(category.getValue()), entries.build()));
        }
        return new SymbolNode(COMPONENTS, "", SymbolKind.MODULE, document.rangeOf(COMPONENTS), children.build());
    }

    private static SourceRange entryRange(final Object entry,
                                          final Components components,
                                          final Components.ComponentCategory category) {
        // input schemas keep no range of their own
        return entry instanceof ArazzoElement element
                ? element.getRange()
                : components.rangeOf(category.getValue());
    }
}
