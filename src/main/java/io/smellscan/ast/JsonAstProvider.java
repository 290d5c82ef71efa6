package io.smellscan.ast;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Iterator;
import java.util.Map;

/**
 * Reads syntax trees from JSON dumps written by an external parser.
 * <p>
 * Dump format:
 * <pre>
 * {
 *   "source": "src/main/kotlin/Foo.kt",
 *   "parseError": "optional message, set when the parser failed",
 *   "root": {
 *     "kind": "FILE",
 *     "name": "optional",
 *     "range": {"startLine": 1, "startColumn": 1, "endLine": 10, "endColumn": 1},
 *     "text": "...",
 *     "annotations": ["@Suppress(\"no-empty-block\")"],
 *     "attributes": {"modifiers": "override"},
 *     "children": [ ... ]
 *   }
 * }
 * </pre>
 * When {@code source} is absent the dump file's own path is used.
 */
public class JsonAstProvider implements AstProvider {

    public static final String DUMP_SUFFIX = ".ast.json";

    private final ObjectMapper mapper;

    public JsonAstProvider() {
        this(new ObjectMapper());
    }

    public JsonAstProvider(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    @Override
    public SyntaxTree parse(Path file) throws ParseFailureException {
        JsonNode document;
        try (InputStream in = Files.newInputStream(file)) {
            document = mapper.readTree(in);
        } catch (JsonProcessingException e) {
            throw new ParseFailureException(file, "Malformed AST dump: " + e.getOriginalMessage(), e);
        } catch (IOException e) {
            throw new ParseFailureException(file, "Cannot read AST dump: " + e.getMessage(), e);
        }
        if (document == null || !document.isObject()) {
            throw new ParseFailureException(file, "AST dump is empty or not a JSON object");
        }

        JsonNode parseError = document.get("parseError");
        if (parseError != null && !parseError.isNull()) {
            throw new ParseFailureException(file, parseError.asText());
        }

        JsonNode root = document.get("root");
        if (root == null || !root.isObject()) {
            throw new ParseFailureException(file, "AST dump has no 'root' node");
        }

        String source = document.path("source").asText(null);
        try {
            Node tree = toNode(root);
            return source != null && !source.isBlank()
                    ? new SyntaxTree(source.replace('\\', '/'), tree)
                    : SyntaxTree.of(file, tree);
        } catch (IllegalArgumentException e) {
            throw new ParseFailureException(file, "Invalid node in AST dump: " + e.getMessage(), e);
        }
    }

    private Node toNode(JsonNode json) {
        TreeNode.Builder builder = TreeNode.builder(json.path("kind").asText(null))
                .name(json.path("name").asText(null))
                .text(json.path("text").asText(""))
                .range(toRange(json.path("range")));

        for (JsonNode annotation : json.path("annotations")) {
            builder.annotation(annotation.asText());
        }

        Iterator<Map.Entry<String, JsonNode>> fields = json.path("attributes").fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            builder.attribute(field.getKey(), field.getValue().asText());
        }

        for (JsonNode child : json.path("children")) {
            builder.child(toNode(child));
        }
        return builder.build();
    }

    private SourceRange toRange(JsonNode range) {
        if (range.isMissingNode() || range.isNull()) {
            throw new IllegalArgumentException("missing 'range'");
        }
        int startLine = range.path("startLine").asInt(1);
        int startColumn = range.path("startColumn").asInt(1);
        return new SourceRange(
                startLine,
                startColumn,
                range.path("endLine").asInt(startLine),
                range.path("endColumn").asInt(startColumn)
        );
    }
}
