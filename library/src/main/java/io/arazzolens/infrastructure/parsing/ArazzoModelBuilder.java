package io.arazzolens.infrastructure.parsing;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import io.arazzolens.core.diagnostic.Diagnostic;
import io.arazzolens.core.diagnostic.DiagnosticCategory;
import io.arazzolens.core.model.Action;
import io.arazzolens.core.model.ActionKind;
import io.arazzolens.core.model.ActionType;
import io.arazzolens.core.model.ArazzoDocument;
import io.arazzolens.core.model.ArazzoElement;
import io.arazzolens.core.model.Components;
import io.arazzolens.core.model.Criterion;
import io.arazzolens.core.model.EndAction;
import io.arazzolens.core.model.EntityRef;
import io.arazzolens.core.model.EntityType;
import io.arazzolens.core.model.GotoAction;
import io.arazzolens.core.model.Info;
import io.arazzolens.core.model.InvalidAction;
import io.arazzolens.core.model.Located;
import io.arazzolens.core.model.Parameter;
import io.arazzolens.core.model.PayloadReplacement;
import io.arazzolens.core.model.ReferencedAction;
import io.arazzolens.core.model.RequestBody;
import io.arazzolens.core.model.RetryAction;
import io.arazzolens.core.model.SourceDescription;
import io.arazzolens.core.model.Step;
import io.arazzolens.core.model.TransferAction;
import io.arazzolens.core.model.Workflow;
import io.arazzolens.core.tree.MapNode;
import io.arazzolens.core.tree.RangedNode;
import io.arazzolens.core.tree.SourceRange;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.BiConsumer;
import java.util.function.BiFunction;

/**
 * Turns a {@link RangedNode} tree into the typed model. Never fails: nodes of the wrong kind are
 * reported and become stubs ({@code valid == false}) that keep their range.
 */
@Slf4j
@SuppressWarnings("java:S1192") // magic strings
public class ArazzoModelBuilder {

    protected static final Set<String> RESERVED_KEYWORDS = Set.of("x-oai-", "x-oas-");
    protected static final Set<String> ROOT_KEYS = Set.of(
            "arazzo", "info", "sourceDescriptions", "workflows", "components"
    );
    protected static final Set<String> INFO_KEYS = Set.of(
            "title", "summary", "description", "version"
    );
    protected static final Set<String> SOURCE_DESCRIPTION_KEYS = Set.of(
            "name", "url", "type"
    );
    protected static final Set<String> WORKFLOW_KEYS = Set.of(
            "workflowId", "summary", "description", "inputs",
            "dependsOn", "steps", "successActions", "failureActions",
            "outputs", "parameters"
    );
    protected static final Set<String> STEP_KEYS = Set.of(
            "description", "stepId", "operationId", "operationPath",
            "workflowId", "parameters", "requestBody", "successCriteria",
            "onSuccess", "onFailure", "outputs"
    );
    protected static final Set<String> COMPONENTS_KEYS = Set.of(
            "inputs", "parameters", "successActions", "failureActions"
    );
    protected static final Set<String> PARAMETER_KEYS = Set.of(
            "name", "in", "value"
    );
    protected static final Set<String> SUCCESS_ACTION_KEYS = Set.of(
            "name", "type", "workflowId", "stepId", "criteria", "outputs"
    );
    protected static final Set<String> FAILURE_ACTION_KEYS = Set.of(
            "name", "type", "workflowId", "stepId", "criteria", "retryAfter", "retryLimit", "outputs"
    );
    protected static final Set<String> CRITERION_KEYS = Set.of(
            "context", "condition", "type"
    );
    protected static final Set<String> CRITERION_EXPRESSION_TYPE_KEYS = Set.of(
            "type", "version"
    );
    protected static final Set<String> REQUEST_BODY_KEYS = Set.of(
            "contentType", "payload", "replacements"
    );
    protected static final Set<String> PAYLOAD_REPLACEMENT_OBJECT_KEYS = Set.of(
            "target", "value"
    );
    protected static final Set<String> REUSABLE_OBJECT_KEYS = Set.of(
            "reference", "value"
    );

    public static final String COMPONENTS_INPUTS_REF_PREFIX = "#/components/inputs/";

    private final ArazzoParseOptions options;

    public ArazzoModelBuilder() {
        this(ArazzoParseOptions.ofDefault());
    }

    public ArazzoModelBuilder(final ArazzoParseOptions options) {
        this.options = Objects.requireNonNull(options);
    }

    public ModelBuildResult build(final RangedNode tree) {
        ParseResult parseResult = new ParseResult();
        ArazzoDocument document = parseRoot(tree, parseResult);
        log.debug("Built model with {} workflow(s), {} stub(s) and {} diagnostic(s)",
                document.getWorkflows().size(), parseResult.stubs.size(), parseResult.diagnostics.size());
        return new ModelBuildResult(
                document,
                ImmutableList.copyOf(parseResult.stubs),
                ImmutableList.copyOf(parseResult.diagnostics));
    }

    private ArazzoDocument parseRoot(final RangedNode rootNode, final ParseResult parseResult) {
        if (!rootNode.isMap()) {
            parseResult.diagnostics.add(Diagnostic.error(DiagnosticCategory.STRUCTURAL_ERROR,
                    "Arazzo description must be an object", rootNode.range()));
            parseResult.stub(EntityType.DOCUMENT, "", rootNode.range());
            return ArazzoDocument.builder().range(rootNode.range()).valid(false).build();
        }
        EntityFields fields = new EntityFields((MapNode) rootNode, "", ROOT_KEYS, parseResult);
        ArazzoDocument.ArazzoDocumentBuilder<?, ?> builder = ArazzoDocument.builder();
        builder.arazzo(fields.getString("arazzo"));

        RangedNode infoNode = fields.get("info");
        if (!infoNode.isMissing()) {
            builder.info(getInfo(infoNode, "info", parseResult));
        }

        builder.sourceDescriptions(fields.getList("sourceDescriptions",
                (item, location) -> getSourceDescription(item, location, parseResult)));

        // components first: workflow inputs may point into them
        Components components = null;
        RangedNode componentsNode = fields.get("components");
        if (!componentsNode.isMissing()) {
            components = getComponents(componentsNode, "components", parseResult);
            builder.components(components);
        }
        Components resolvedComponents = components;
        List<Workflow> workflows = new ArrayList<>();
        fields.forEachItem("workflows", (item, location) ->
                workflows.add(getWorkflow(item, workflows.size(), location, resolvedComponents, parseResult)));
        builder.workflows(ImmutableList.copyOf(workflows));

        fields.applyTo(builder);
        return builder.build();
    }

    private Info getInfo(final RangedNode node, final String location, final ParseResult parseResult) {
        if (!node.isMap()) {
            parseResult.invalidType(location, "an object", node);
            parseResult.stub(EntityType.INFO, location, node.range());
            return Info.builder().range(node.range()).valid(false).build();
        }
        EntityFields fields = new EntityFields((MapNode) node, location, INFO_KEYS, parseResult);
        Info.InfoBuilder<?, ?> builder = Info.builder()
                .title(fields.getString("title"))
                .summary(fields.getString("summary"))
                .description(fields.getString("description"))
                .version(fields.getString("version"));
        fields.applyTo(builder);
        return builder.build();
    }

    private SourceDescription getSourceDescription(final RangedNode node, final String location, final ParseResult parseResult) {
        if (!node.isMap()) {
            parseResult.invalidType(location, "an object", node);
            parseResult.stub(EntityType.SOURCE_DESCRIPTION, location, node.range());
            return SourceDescription.builder().range(node.range()).valid(false).build();
        }
        EntityFields fields = new EntityFields((MapNode) node, location, SOURCE_DESCRIPTION_KEYS, parseResult);
        String type = fields.getString("type");
        SourceDescription.SourceDescriptionBuilder<?, ?> builder = SourceDescription.builder()
                .name(fields.getString("name"))
                .url(fields.getString("url"))
                .typeValue(type)
                .type(SourceDescription.SourceDescriptionType.fromValue(type).orElse(null));
        fields.applyTo(builder);
        return builder.build();
    }

    private Components getComponents(final RangedNode node, final String location, final ParseResult parseResult) {
        if (!node.isMap()) {
            parseResult.invalidType(location, "an object", node);
            parseResult.stub(EntityType.COMPONENTS, location, node.range());
            return Components.builder().range(node.range()).valid(false).build();
        }
        EntityFields fields = new EntityFields((MapNode) node, location, COMPONENTS_KEYS, parseResult);
        Components.ComponentsBuilder<?, ?> builder = Components.builder()
                .inputs(fields.getMap("inputs", (schema, itemLocation) -> {
                    if (!schema.isMap()) {
                        parseResult.invalidType(itemLocation, "an object", schema);
                        return ImmutableList.of();
                    }
                    return ImmutableList.copyOf(schema.get("properties").keys());
                }))
                .parameters(fields.getMap("parameters",
                        (item, itemLocation) -> getParameter(item, itemLocation, parseResult)))
                .successActions(fields.getMap("successActions",
                        (item, itemLocation) -> getAction(item, ActionKind.SUCCESS, itemLocation, parseResult)))
                .failureActions(fields.getMap("failureActions",
                        (item, itemLocation) -> getAction(item, ActionKind.FAILURE, itemLocation, parseResult)));
        fields.applyTo(builder);
        return builder.build();
    }

    private Workflow getWorkflow(final RangedNode node,
                                 final int index,
                                 final String location,
                                 final Components components,
                                 final ParseResult parseResult) {
        if (!node.isMap()) {
            parseResult.invalidType(location, "an object", node);
            parseResult.stub(EntityType.WORKFLOW, location, node.range());
            return Workflow.builder().index(index).range(node.range()).valid(false).build();
        }
        EntityFields fields = new EntityFields((MapNode) node, location, WORKFLOW_KEYS, parseResult);
        Workflow.WorkflowBuilder<?, ?> builder = Workflow.builder()
                .index(index)
                .workflowId(fields.getString("workflowId"))
                .summary(fields.getString("summary"))
                .description(fields.getString("description"))
                .inputProperties(getInputProperties(fields, components, parseResult))
                .dependsOn(fields.getList("dependsOn", (item, itemLocation) -> fields.located(item, itemLocation)))
                .successActions(fields.getList("successActions",
                        (item, itemLocation) -> getAction(item, ActionKind.SUCCESS, itemLocation, parseResult)))
                .failureActions(fields.getList("failureActions",
                        (item, itemLocation) -> getAction(item, ActionKind.FAILURE, itemLocation, parseResult)))
                .outputs(fields.getOutputs("outputs"))
                .parameters(fields.getList("parameters",
                        (item, itemLocation) -> getParameter(item, itemLocation, parseResult)));

        List<Step> steps = new ArrayList<>();
        fields.forEachItem("steps", (item, itemLocation) ->
                steps.add(getStep(item, steps.size(), itemLocation, parseResult)));
        builder.steps(ImmutableList.copyOf(steps));

        fields.applyTo(builder);
        return builder.build();
    }

    private ImmutableList<String> getInputProperties(final EntityFields fields,
                                                     final Components components,
                                                     final ParseResult parseResult) {
        RangedNode inputs = fields.get("inputs");
        if (inputs.isMissing()) return ImmutableList.of();
        if (!inputs.isMap()) {
            fields.malformed("inputs", "an object", inputs);
            return ImmutableList.of();
        }
        RangedNode ref = inputs.get("$ref");
        if (!ref.isScalar()) {
            return ImmutableList.copyOf(inputs.get("properties").keys());
        }

        String reference = ref.text();
        String name = StringUtils.removeStart(reference, COMPONENTS_INPUTS_REF_PREFIX);
        ImmutableList<String> properties = Objects.nonNull(components) && Objects.nonNull(reference)
                && reference.startsWith(COMPONENTS_INPUTS_REF_PREFIX)
                ? components.getInputs().get(name)
                : null;
        if (Objects.isNull(properties)) {
            parseResult.diagnostics.add(Diagnostic.error(DiagnosticCategory.REFERENCE_ERROR,
                    "Inputs reference '%s' does not resolve to an entry of components.inputs".formatted(reference),
                    ref.range()));
            return ImmutableList.of();
        }
        return properties;
    }

    private Step getStep(final RangedNode node, final int index, final String location, final ParseResult parseResult) {
        if (!node.isMap()) {
            parseResult.invalidType(location, "an object", node);
            parseResult.stub(EntityType.STEP, location, node.range());
            return Step.builder().index(index).range(node.range()).valid(false).build();
        }
        EntityFields fields = new EntityFields((MapNode) node, location, STEP_KEYS, parseResult);
        Step.StepBuilder<?, ?> builder = Step.builder()
                .index(index)
                .stepId(fields.getString("stepId"))
                .description(fields.getString("description"))
                .operationId(fields.getString("operationId"))
                .operationPath(fields.getString("operationPath"))
                .workflowId(fields.getString("workflowId"))
                .parameters(fields.getList("parameters",
                        (item, itemLocation) -> getParameter(item, itemLocation, parseResult)))
                .successCriteria(fields.getList("successCriteria",
                        (item, itemLocation) -> getCriterion(item, itemLocation, parseResult)))
                .onSuccess(fields.getList("onSuccess",
                        (item, itemLocation) -> getAction(item, ActionKind.SUCCESS, itemLocation, parseResult)))
                .onFailure(fields.getList("onFailure",
                        (item, itemLocation) -> getAction(item, ActionKind.FAILURE, itemLocation, parseResult)))
                .outputs(fields.getOutputs("outputs"));

        RangedNode requestBody = fields.get("requestBody");
        if (!requestBody.isMissing()) {
            builder.requestBody(getRequestBody(requestBody, location + ".requestBody", parseResult));
        }

        fields.applyTo(builder);
        return builder.build();
    }

    private Parameter getParameter(final RangedNode node, final String location, final ParseResult parseResult) {
        if (!node.isMap()) {
            parseResult.invalidType(location, "an object", node);
            parseResult.stub(EntityType.PARAMETER, location, node.range());
            return Parameter.builder().range(node.range()).valid(false).build();
        }
        boolean reusable = node.has("reference");
        EntityFields fields = new EntityFields((MapNode) node, location,
                reusable ? REUSABLE_OBJECT_KEYS : PARAMETER_KEYS, parseResult);
        Parameter.ParameterBuilder<?, ?> builder = Parameter.builder()
                .value(fields.getAnyType("value"));
        if (reusable) {
            builder.reference(fields.getString("reference"));
        } else {
            builder.name(fields.getString("name"))
                    .in(fields.getString("in"));
        }
        fields.applyTo(builder);
        return builder.build();
    }

    private RequestBody getRequestBody(final RangedNode node, final String location, final ParseResult parseResult) {
        if (!node.isMap()) {
            parseResult.invalidType(location, "an object", node);
            parseResult.stub(EntityType.REQUEST_BODY, location, node.range());
            return RequestBody.builder().range(node.range()).valid(false).build();
        }
        EntityFields fields = new EntityFields((MapNode) node, location, REQUEST_BODY_KEYS, parseResult);
        List<Located<String>> payloadStrings = new ArrayList<>();
        collectStrings(fields.get("payload"), payloadStrings);

        RequestBody.RequestBodyBuilder<?, ?> builder = RequestBody.builder()
                .contentType(fields.getString("contentType"))
                .payloadStrings(ImmutableList.copyOf(payloadStrings))
                .replacements(fields.getList("replacements",
                        (item, itemLocation) -> getPayloadReplacement(item, itemLocation, parseResult)));
        fields.applyTo(builder);
        return builder.build();
    }

    private void collectStrings(final RangedNode node, final List<Located<String>> strings) {
        if (node.isScalar()) {
            if (node.value() instanceof String text) {
                strings.add(Located.of(text, node.range()));
            }
        } else if (node.isMap()) {
            for (String key : node.keys()) {
                collectStrings(node.get(key), strings);
            }
        } else if (node.isSeq()) {
            node.items().forEach(item -> collectStrings(item, strings));
        }
    }

    private PayloadReplacement getPayloadReplacement(final RangedNode node, final String location, final ParseResult parseResult) {
        if (!node.isMap()) {
            parseResult.invalidType(location, "an object", node);
            parseResult.stub(EntityType.PAYLOAD_REPLACEMENT, location, node.range());
            return PayloadReplacement.builder().range(node.range()).valid(false).build();
        }
        EntityFields fields = new EntityFields((MapNode) node, location, PAYLOAD_REPLACEMENT_OBJECT_KEYS, parseResult);
        PayloadReplacement.PayloadReplacementBuilder<?, ?> builder = PayloadReplacement.builder()
                .target(fields.getString("target"))
                .value(fields.getAnyType("value"));
        fields.applyTo(builder);
        return builder.build();
    }

    private Criterion getCriterion(final RangedNode node, final String location, final ParseResult parseResult) {
        if (!node.isMap()) {
            parseResult.invalidType(location, "an object", node);
            parseResult.stub(EntityType.CRITERION, location, node.range());
            return Criterion.builder().range(node.range()).valid(false).build();
        }
        EntityFields fields = new EntityFields((MapNode) node, location, CRITERION_KEYS, parseResult);
        Criterion.CriterionBuilder<?, ?> builder = Criterion.builder()
                .condition(fields.getString("condition"))
                .context(fields.getString("context"));

        RangedNode type = fields.get("type");
        if (type.isScalar()) {
            String typeValue = fields.getString("type");
            builder.typeValue(typeValue)
                    .type(Criterion.CriterionType.fromValue(typeValue).orElse(null));
        } else if (type.isMap()) {
            EntityFields typeFields = new EntityFields((MapNode) type, location + ".type",
                    CRITERION_EXPRESSION_TYPE_KEYS, parseResult);
            String typeValue = typeFields.getString("type");
            builder.expressionTypeObject(true)
                    .typeValue(typeValue)
                    .type(Criterion.CriterionType.fromValue(typeValue).orElse(null))
                    .version(typeFields.getString("version"));
        } else if (!type.isMissing()) {
            fields.malformed("type", "a string or an object", type);
        }

        fields.applyTo(builder);
        return builder.build();
    }

    private Action getAction(final RangedNode node,
                             final ActionKind kind,
                             final String location,
                             final ParseResult parseResult) {
        if (!node.isMap()) {
            parseResult.invalidType(location, "an object", node);
            parseResult.stub(EntityType.ACTION, location, node.range());
            return InvalidAction.builder().kind(kind).range(node.range()).valid(false).build();
        }

        if (node.has("reference")) {
            EntityFields fields = new EntityFields((MapNode) node, location, REUSABLE_OBJECT_KEYS, parseResult);
            ReferencedAction.ReferencedActionBuilder<?, ?> builder = ReferencedAction.builder()
                    .kind(kind)
                    .reference(fields.getString("reference"));
            fields.applyTo(builder);
            return builder.build();
        }

        EntityFields fields = new EntityFields((MapNode) node, location,
                kind == ActionKind.SUCCESS ? SUCCESS_ACTION_KEYS : FAILURE_ACTION_KEYS, parseResult);
        String typeValue = fields.getString("type");
        ActionType type = ActionType.fromValue(typeValue).orElse(null);

        Action.ActionBuilder<?, ?> builder;
        if (type == ActionType.END) {
            builder = EndAction.builder();
        } else if (type == ActionType.GOTO) {
            builder = transfer(GotoAction.builder(), fields);
        } else if (type == ActionType.RETRY) {
            RetryAction.RetryActionBuilder<?, ?> retry = RetryAction.builder()
                    .retryAfter(fields.getBigDecimal("retryAfter"));
            Integer retryLimit = fields.getInteger("retryLimit");
            if (Objects.nonNull(retryLimit)) {
                retry.retryLimit(retryLimit);
            }
            builder = transfer(retry, fields);
        } else {
            builder = InvalidAction.builder().typeValue(typeValue);
        }

        builder.kind(kind)
                .name(fields.getString("name"))
                .criteria(fields.getList("criteria",
                        (item, itemLocation) -> getCriterion(item, itemLocation, parseResult)))
                .outputs(fields.getOutputs("outputs"));
        fields.applyTo(builder);
        return builder.build();
    }

    private static <B extends TransferAction.TransferActionBuilder<?, ?>> B transfer(final B builder, final EntityFields fields) {
        builder.stepId(fields.getString("stepId"));
        builder.workflowId(fields.getString("workflowId"));
        return builder;
    }

    /**
     * Typed accessors over the entries of one map node. Records which keys were declared and
     * which had a value of the wrong kind.
     */
    private final class EntityFields {
        private final MapNode node;
        private final String location;
        private final ParseResult parseResult;
        private final Set<String> malformedKeys = new LinkedHashSet<>();

        private EntityFields(final MapNode node,
                             final String location,
                             final Set<String> knownKeys,
                             final ParseResult parseResult) {
            this.node = node;
            this.location = location;
            this.parseResult = parseResult;
            for (String key : node.keys()) {
                if (RESERVED_KEYWORDS.stream().anyMatch(key::startsWith)) {
                    if (!options.isOaiAuthor()) parseResult.reserved(qualify(key), node.keyRange(key));
                } else if (options.isReportUnexpectedAttributes() && !knownKeys.contains(key) && !key.startsWith("x-")) {
                    parseResult.extra(qualify(key), node.keyRange(key));
                }
            }
        }

        RangedNode get(final String key) {
            return node.get(key);
        }

        void malformed(final String key, final String expected, final RangedNode value) {
            malformedKeys.add(key);
            parseResult.invalidType(key, expected, value);
        }

        String getString(final String key) {
            RangedNode value = node.get(key);
            if (value.isMissing()) return null;
            if (!value.isScalar()) {
                malformed(key, "a string", value);
                return null;
            }
            return text(value);
        }

        String text(final RangedNode value) {
            String text = value.text();
            if (Objects.isNull(text)) return null;
            if (!options.isAllowEmptyStrings() && StringUtils.isBlank(text)) return null;
            return text;
        }

        Object getAnyType(final String key) {
            RangedNode value = node.get(key);
            if (value.isMissing()) return null;
            return value.isScalar() ? value.value() : value;
        }

        BigDecimal getBigDecimal(final String key) {
            RangedNode value = node.get(key);
            if (value.isMissing()) return null;
            if (!(value.value() instanceof Number number)) {
                malformed(key, "a number", value);
                return null;
            }
            return new BigDecimal(number.toString());
        }

        Integer getInteger(final String key) {
            RangedNode value = node.get(key);
            if (value.isMissing()) return null;
            Object number = value.value();
            if (number instanceof Integer || number instanceof Long || number instanceof BigInteger) {
                BigInteger integer = new BigInteger(number.toString());
                if (integer.bitLength() < Integer.SIZE) return integer.intValue();
                malformed(key, "an integer between %d and %d".formatted(Integer.MIN_VALUE, Integer.MAX_VALUE), value);
                return null;
            }
            malformed(key, "an integer", value);
            return null;
        }

        Located<String> located(final RangedNode item, final String itemLocation) {
            if (!item.isScalar()) {
                parseResult.invalidType(itemLocation, "a string", item);
                return null;
            }
            String text = text(item);
            if (Objects.isNull(text)) {
                parseResult.invalidType(itemLocation, "a non-empty string", item);
                return null;
            }
            return Located.of(text, item.range());
        }

        <T> ImmutableList<T> getList(final String key, final BiFunction<RangedNode, String, T> itemParser) {
            List<T> items = new ArrayList<>();
            forEachItem(key, (item, itemLocation) -> {
                T parsed = itemParser.apply(item, itemLocation);
                if (Objects.nonNull(parsed)) items.add(parsed);
            });
            return ImmutableList.copyOf(items);
        }

        void forEachItem(final String key, final BiConsumer<RangedNode, String> consumer) {
            RangedNode value = node.get(key);
            if (value.isMissing()) return;
            if (!value.isSeq()) {
                malformed(key, "an array", value);
                return;
            }
            List<RangedNode> items = value.items();
            for (int i = 0; i < items.size(); i++) {
                consumer.accept(items.get(i), "%s[%d]".formatted(qualify(key), i));
            }
        }

        <T> ImmutableMap<String, T> getMap(final String key, final BiFunction<RangedNode, String, T> valueParser) {
            RangedNode value = node.get(key);
            if (value.isMissing()) return ImmutableMap.of();
            if (!value.isMap()) {
                malformed(key, "an object", value);
                return ImmutableMap.of();
            }
            Map<String, T> entries = new LinkedHashMap<>();
            for (String name : value.keys()) {
                T parsed = valueParser.apply(value.get(name), qualify(key) + "." + name);
                if (Objects.nonNull(parsed)) entries.put(name, parsed);
            }
            return ImmutableMap.copyOf(entries);
        }

        ImmutableMap<String, Located<String>> getOutputs(final String key) {
            return getMap(key, (value, itemLocation) -> {
                if (!value.isScalar()) {
                    parseResult.invalidType(itemLocation, "a string", value);
                    return null;
                }
                if (Objects.isNull(value.text())) {
                    parseResult.invalidType(itemLocation, "a string", value);
                    return null;
                }
                return Located.of(value.text(), value.range());
            });
        }

        void applyTo(final ArazzoElement.ArazzoElementBuilder<?, ?> builder) {
            ImmutableMap.Builder<String, SourceRange> keyRanges = ImmutableMap.builder();
            node.entries().forEach((key, value) -> keyRanges.put(key, value.range()));
            builder.range(node.range());
            builder.keyRanges(keyRanges.build());
            builder.malformedKeys(ImmutableSet.copyOf(malformedKeys));
        }

        private String qualify(final String key) {
            return location.isEmpty() ? key : location + "." + key;
        }
    }

    /**
     * Collects what the builder reports while walking the tree.
     */
    private static final class ParseResult {
        private final List<EntityRef> stubs = new ArrayList<>();
        private final List<Diagnostic> diagnostics = new ArrayList<>();

        void stub(final EntityType type, final String path, final SourceRange range) {
            stubs.add(new EntityRef(type, path, range));
        }

        void invalidType(final String key, final String expected, final RangedNode value) {
            diagnostics.add(Diagnostic.error(DiagnosticCategory.STRUCTURAL_ERROR,
                    "'%s' must be %s".formatted(key, expected), value.range()));
        }

        void extra(final String path, final SourceRange range) {
            diagnostics.add(Diagnostic.warning(DiagnosticCategory.STRUCTURAL_ERROR,
                    "Attribute '%s' is unexpected".formatted(path), range));
        }

        void reserved(final String path, final SourceRange range) {
            diagnostics.add(Diagnostic.warning(DiagnosticCategory.STRUCTURAL_ERROR,
                    "Attribute '%s' uses a prefix reserved by the OpenAPI Initiative".formatted(path), range));
        }
    }
}
