package io.smellscan.suppress;

import io.smellscan.ast.Node;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Extracts suppression directives from the annotation and comment text attached to a node.
 * <p>
 * Recognized forms:
 * <ul>
 *   <li>{@code @Suppress("rule-a", "rule-b")} and {@code @SuppressWarnings("rule-a")}: node scope</li>
 *   <li>{@code @file:Suppress("rule-a")}: file scope</li>
 *   <li>{@code // smellscan:suppress rule-a, rule-b}: node scope, no ids means all rules</li>
 *   <li>{@code // smellscan:suppress-file rule-a}: file scope</li>
 * </ul>
 * Ids may carry a {@code detekt:}, {@code detekt.} or {@code smellscan:} prefix, which is dropped.
 * Annotations that name no rule of ours (e.g. {@code @Suppress("UNCHECKED_CAST")}) still produce a
 * directive; it simply matches no rule.
 */
public final class SuppressionParser {

    private static final Pattern ANNOTATION = Pattern.compile(
            "^\\s*@(file:)?(?:kotlin\\.|java\\.lang\\.)?(Suppress|SuppressWarnings)\\s*\\((.*)\\)\\s*$",
            Pattern.DOTALL);
    private static final Pattern STRING_LITERAL = Pattern.compile("\"([^\"]*)\"");
    private static final Pattern COMMENT = Pattern.compile("smellscan:suppress(-file)?\\b([^*\\n]*)");
    private static final Pattern ID_SEPARATOR = Pattern.compile("[,\\s]+");
    private static final List<String> PREFIXES = List.of("detekt:", "detekt.", "smellscan:");

    private SuppressionParser() {
    }

    public static List<SuppressionDirective> parse(Node node) {
        List<SuppressionDirective> directives = new ArrayList<>();
        for (String text : node.annotations()) {
            parseText(text, directives);
        }
        return directives;
    }

    static void parseText(String text, List<SuppressionDirective> directives) {
        Matcher annotation = ANNOTATION.matcher(text);
        if (annotation.matches()) {
            Set<String> ids = new LinkedHashSet<>();
            Matcher literal = STRING_LITERAL.matcher(annotation.group(3));
            while (literal.find()) {
                addId(literal.group(1), ids);
            }
            if (!ids.isEmpty()) {
                SuppressionDirective.Scope scope = annotation.group(1) != null
                        ? SuppressionDirective.Scope.FILE
                        : SuppressionDirective.Scope.NODE;
                directives.add(new SuppressionDirective(ids, scope));
            }
            return;
        }

        Matcher comment = COMMENT.matcher(text);
        while (comment.find()) {
            Set<String> ids = new LinkedHashSet<>();
            for (String token : ID_SEPARATOR.split(comment.group(2).trim())) {
                addId(token, ids);
            }
            if (ids.isEmpty()) {
                ids.add(SuppressionDirective.ALL);
            }
            SuppressionDirective.Scope scope = comment.group(1) != null
                    ? SuppressionDirective.Scope.FILE
                    : SuppressionDirective.Scope.NODE;
            directives.add(new SuppressionDirective(ids, scope));
        }
    }

    private static void addId(String raw, Set<String> ids) {
        String id = raw.trim();
        for (String prefix : PREFIXES) {
            if (id.startsWith(prefix)) {
                id = id.substring(prefix.length());
                break;
            }
        }
        if (!id.isEmpty()) {
            ids.add(id);
        }
    }
}
