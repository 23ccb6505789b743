package io.arazzolens;

import com.google.common.collect.ImmutableList;
import io.arazzolens.core.diagnostic.Diagnostic;
import io.arazzolens.core.expression.ArazzoExpressionResolver;
import io.arazzolens.core.expression.ExpressionResolver;
import io.arazzolens.core.expression.ResolutionContext;
import io.arazzolens.core.expression.ResolutionResult;
import io.arazzolens.core.graph.GraphBuildResult;
import io.arazzolens.core.graph.TransitionGraph;
import io.arazzolens.core.graph.TransitionGraphBuilder;
import io.arazzolens.core.ir.GraphIr;
import io.arazzolens.core.ir.GraphIrEmitter;
import io.arazzolens.core.model.Workflow;
import io.arazzolens.core.symbol.SymbolNode;
import io.arazzolens.core.symbol.SymbolTreeBuilder;
import io.arazzolens.infrastructure.parsing.ArazzoModelBuilder;
import io.arazzolens.infrastructure.parsing.ModelBuildResult;
import io.arazzolens.infrastructure.parsing.ParsedDocument;
import io.arazzolens.infrastructure.parsing.RangedNodeReader;
import io.arazzolens.infrastructure.validation.ArazzoValidationResult;
import io.arazzolens.infrastructure.validation.ArazzoValidatorRegistry;
import lombok.extern.slf4j.Slf4j;

import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

/**
 * Runs the whole pipeline on the text of one document: read, build the model, validate, derive a
 * transition graph and its IR per workflow, build the outline.
 * <p>
 * No stage stops the pipeline; entities that could not be interpreted are carried as stubs.
 * The {@code checkpoint} passed to {@link #analyze(String, Runnable)} runs between stages and may
 * abort the build by throwing {@link io.arazzolens.core.exception.ArazzoBuildCancelledException}.
 */
@Slf4j
public class ArazzoAnalyzer {

    private final ArazzoAnalyzerOptions options;
    private final RangedNodeReader reader = new RangedNodeReader();
    private final ArazzoModelBuilder modelBuilder;
    private final ArazzoValidatorRegistry validatorRegistry;
    private final TransitionGraphBuilder graphBuilder;
    private final GraphIrEmitter irEmitter = new GraphIrEmitter();
    private final SymbolTreeBuilder symbolTreeBuilder = new SymbolTreeBuilder();
    private final ExpressionResolver expressionResolver = new ArazzoExpressionResolver();

    public ArazzoAnalyzer() {
        this(ArazzoAnalyzerOptions.ofDefault());
    }

    public ArazzoAnalyzer(final ArazzoAnalyzerOptions options) {
        this(options, new ArazzoValidatorRegistry());
    }

    public ArazzoAnalyzer(final ArazzoAnalyzerOptions options, final ArazzoValidatorRegistry validatorRegistry) {
        this.options = Objects.requireNonNull(options);
        this.validatorRegistry = Objects.requireNonNull(validatorRegistry);
        this.modelBuilder = new ArazzoModelBuilder(options.getParseOptions());
        this.graphBuilder = new TransitionGraphBuilder(options.getGraphOptions());
    }

    public ArazzoAnalysis analyze(final String content) {
        return analyze(content, () -> { });
    }

    public ArazzoAnalysis analyze(final String content, final Runnable checkpoint) {
        // validator and graph builder report the same dangling action targets
        Set<Diagnostic> diagnostics = new LinkedHashSet<>();

        ParsedDocument parsed = reader.read(content);
        diagnostics.addAll(parsed.getSyntaxErrors());
        checkpoint.run();

        ModelBuildResult model = modelBuilder.build(parsed.getRoot());
        diagnostics.addAll(model.getDiagnostics());
        checkpoint.run();

        ArazzoValidationResult validation = validatorRegistry.validate(model.getDocument(), options.getValidationOptions());
        diagnostics.addAll(validation.getDiagnostics());
        checkpoint.run();

        ImmutableList.Builder<TransitionGraph> graphs = ImmutableList.builder();
        ImmutableList.Builder<GraphIr> graphIrs = ImmutableList.builder();
        for (Workflow workflow : model.getDocument().getWorkflows()) {
            if (!workflow.isValid()) continue;
            GraphBuildResult graphResult = graphBuilder.buildGraph(workflow, model.getDocument());
            diagnostics.addAll(graphResult.getDiagnostics());
            graphs.add(graphResult.getGraph());
            graphIrs.add(irEmitter.toIr(graphResult.getGraph()));
        }
        checkpoint.run();

        ImmutableList<SymbolNode> symbols = symbolTreeBuilder.buildSymbols(model.getDocument());

        var analysis = new ArazzoAnalysis(
                model.getDocument(),
                ImmutableList.copyOf(diagnostics),
                model.getStubs(),
                graphs.build(),
                graphIrs.build(),
                symbols);
        log.debug("Analyzed document: {} diagnostic(s), {} graph(s), {} stub(s)",
                analysis.getDiagnostics().size(), analysis.getGraphs().size(), analysis.getStubs().size());
        return analysis;
    }

    public ResolutionResult resolve(final String expression, final ResolutionContext context) {
        return expressionResolver.resolve(expression, context);
    }
}
