package io.arazzolens.infrastructure.parsing;

import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonLocation;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.JsonToken;
import com.fasterxml.jackson.core.json.JsonReadFeature;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.google.common.collect.ImmutableList;
import io.arazzolens.core.diagnostic.Diagnostic;
import io.arazzolens.core.diagnostic.DiagnosticCategory;
import io.arazzolens.core.tree.MapNode;
import io.arazzolens.core.tree.MissingNode;
import io.arazzolens.core.tree.RangedNode;
import io.arazzolens.core.tree.ScalarNode;
import io.arazzolens.core.tree.SeqNode;
import io.arazzolens.core.tree.SourceRange;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;

import java.io.IOException;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Reads YAML or JSON text into a {@link RangedNode} tree with character offsets, using Jackson's
 * streaming parsers. A syntax error stops reading but every node completed before it is kept;
 * open containers are closed at the error position.
 */
@Slf4j
public class RangedNodeReader {

    private final JsonFactory yamlFactory = new YAMLFactory();
    private final JsonFactory jsonFactory = JsonFactory.builder()
            .enable(JsonReadFeature.ALLOW_JAVA_COMMENTS)
            .build();

    public ParsedDocument read(final String content) {
        boolean json = StringUtils.stripStart(Objects.toString(content, ""), null).startsWith("{");
        return json ? readJson(content) : readYaml(content);
    }

    public ParsedDocument readYaml(final String content) {
        return read(yamlFactory, Objects.toString(content, ""));
    }

    public ParsedDocument readJson(final String content) {
        return read(jsonFactory, Objects.toString(content, ""));
    }

    private ParsedDocument read(final JsonFactory factory, final String content) {
        List<Diagnostic> diagnostics = new ArrayList<>();
        Deque<Frame> stack = new ArrayDeque<>();
        RangedNode[] root = new RangedNode[1];
        int lastOffset = 0;

        try (JsonParser parser = factory.createParser(content)) {
            JsonToken token;
            while ((token = parser.nextToken()) != null) {
                int start = offset(parser.currentTokenLocation(), lastOffset);
                int end = Math.max(start, offset(parser.currentLocation(), start));
                lastOffset = end;

                switch (token) {
                    case START_OBJECT:
                        stack.push(new MapFrame(start));
                        break;
                    case START_ARRAY:
                        stack.push(new SeqFrame(start));
                        break;
                    case END_OBJECT:
                    case END_ARRAY:
                        attach(stack.pop().close(end), stack, root, diagnostics);
                        break;
                    case FIELD_NAME:
                        if (stack.peek() instanceof MapFrame mapFrame) {
                            String name = parser.currentName();
                            mapFrame.key(name, SourceRange.of(start, start + name.length()));
                        }
                        break;
                    default:
                        attach(scalar(parser, token, SourceRange.of(start, end)), stack, root, diagnostics);
                        break;
                }
                // first document only
                if (Objects.nonNull(root[0]) && stack.isEmpty()) break;
            }
        } catch (JsonProcessingException e) {
            int errorOffset = offset(e.getLocation(), lastOffset);
            log.debug("Syntax error at offset {}: {}", errorOffset, e.getOriginalMessage());
            diagnostics.add(Diagnostic.error(DiagnosticCategory.SYNTAX_ERROR, e.getOriginalMessage(),
                    SourceRange.of(errorOffset, errorOffset + 1)));
            lastOffset = Math.max(lastOffset, errorOffset);
        } catch (IOException e) {
            diagnostics.add(Diagnostic.error(DiagnosticCategory.SYNTAX_ERROR,
                    "Unreadable document: %s".formatted(e.getMessage()), SourceRange.EMPTY));
        }

        while (!stack.isEmpty()) {
            attach(stack.pop().close(lastOffset), stack, root, diagnostics);
        }
        RangedNode rootNode = Objects.nonNull(root[0]) ? root[0] : MissingNode.at(SourceRange.EMPTY);
        return new ParsedDocument(rootNode, ImmutableList.copyOf(diagnostics));
    }

    private static void attach(final RangedNode node,
                               final Deque<Frame> stack,
                               final RangedNode[] root,
                               final List<Diagnostic> diagnostics) {
        Frame parent = stack.peek();
        if (Objects.isNull(parent)) {
            root[0] = node;
        } else {
            parent.add(node, diagnostics);
        }
    }

    private static RangedNode scalar(final JsonParser parser, final JsonToken token, final SourceRange range) throws IOException {
        switch (token) {
            case VALUE_NUMBER_INT:
                return new ScalarNode(parser.getNumberValue(), parser.getText(), range);
            case VALUE_NUMBER_FLOAT:
                return new ScalarNode(parser.getDecimalValue(), parser.getText(), range);
            case VALUE_TRUE:
            case VALUE_FALSE:
                return new ScalarNode(parser.getBooleanValue(), parser.getText(), range);
            case VALUE_NULL:
                return new ScalarNode(null, null, range);
            case VALUE_EMBEDDED_OBJECT:
                return ScalarNode.of(parser.getEmbeddedObject(), range);
            default:
                return new ScalarNode(parser.getText(), parser.getText(), range);
        }
    }

    private static int offset(final JsonLocation location, final int fallback) {
        if (Objects.isNull(location) || location.getCharOffset() < 0) return fallback;
        return (int) location.getCharOffset();
    }

    private abstract static class Frame {
        protected final int start;

        protected Frame(final int start) {
            this.start = start;
        }

        abstract void add(RangedNode node, List<Diagnostic> diagnostics);

        abstract RangedNode close(int end);
    }

    private static final class MapFrame extends Frame {
        private final Map<String, RangedNode> entries = new LinkedHashMap<>();
        private final Map<String, SourceRange> keyRanges = new LinkedHashMap<>();
        private String key;
        private SourceRange keyRange;

        private MapFrame(final int start) {
            super(start);
        }

        void key(final String key, final SourceRange keyRange) {
            this.key = key;
            this.keyRange = keyRange;
        }

        @Override
        void add(final RangedNode node, final List<Diagnostic> diagnostics) {
            if (Objects.isNull(key)) return;
            if (entries.containsKey(key)) {
                diagnostics.add(Diagnostic.error(DiagnosticCategory.SYNTAX_ERROR,
                        "Duplicate key '%s'".formatted(key), keyRange));
            } else {
                entries.put(key, node);
                keyRanges.put(key, keyRange);
            }
            key = null;
        }

        @Override
        RangedNode close(final int end) {
            return new MapNode(entries, keyRanges, SourceRange.of(start, end));
        }
    }

    private static final class SeqFrame extends Frame {
        private final List<RangedNode> items = new ArrayList<>();

        private SeqFrame(final int start) {
            super(start);
        }

        @Override
        void add(final RangedNode node, final List<Diagnostic> diagnostics) {
            items.add(node);
        }

        @Override
        RangedNode close(final int end) {
            return new SeqNode(items, SourceRange.of(start, end));
        }
    }
}
