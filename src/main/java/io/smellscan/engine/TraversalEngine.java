package io.smellscan.engine;

import io.smellscan.ast.Node;
import io.smellscan.ast.SourceRange;
import io.smellscan.ast.SyntaxTree;
import io.smellscan.config.EffectiveConfig;
import io.smellscan.config.RuleSetting;
import io.smellscan.model.Correction;
import io.smellscan.model.Diagnostic;
import io.smellscan.model.Finding;
import io.smellscan.model.SourceLocation;
import io.smellscan.rules.RuleContext;
import io.smellscan.rules.RuleDescriptor;
import io.smellscan.rules.RuleRegistry;
import io.smellscan.suppress.Fingerprint;
import io.smellscan.suppress.StructuralPath;
import io.smellscan.suppress.SuppressionDirective;
import io.smellscan.suppress.SuppressionParser;
import io.smellscan.suppress.Suppressions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Analyzes one file with a single pre-order walk of its syntax tree.
 * <p>
 * Before walking, the engine builds a node kind to rules table from the active configuration,
 * so each node is dispatched only to the rules interested in its kind, in ascending rule id
 * order. Suppression directives attached to a node are in scope for the node and its whole
 * subtree; file-scope directives on the root or its direct children are in scope everywhere.
 * <p>
 * Every rule visit runs inside its own error boundary: a rule that throws a runtime exception,
 * overflows the stack, hits a linkage problem or fails an assertion produces an
 * {@link Diagnostic.Kind#INTERNAL_RULE_ERROR} for that node and the walk continues.
 * Findings a visit reported before throwing are dropped.
 * <p>
 * The engine holds no state between calls and may be shared by all workers.
 */
public class TraversalEngine {

    private static final Logger log = LoggerFactory.getLogger(TraversalEngine.class);

    public FileAnalysis analyzeFile(SyntaxTree tree, EffectiveConfig config, RuleRegistry registry) {
        DispatchTable table = DispatchTable.build(config, registry, tree.path());
        Walk walk = new Walk(tree.path(), table, config);
        if (!table.isEmpty()) {
            walk.run(tree.root());
        }

        FileAnalysis analysis = new FileAnalysis(
                tree.path(),
                walk.findings,
                walk.diagnostics,
                walk.corrections,
                walk.suppressed
        );
        log.debug("Analyzed {}: {} finding(s), {} suppressed, {} rule error(s)",
                tree.path(), analysis.findings().size(), analysis.suppressedCount(), analysis.diagnostics().size());
        return analysis;
    }

    /**
     * Mutable state of one walk. Confined to the calling thread.
     */
    private static final class Walk {
        private final String file;
        private final DispatchTable table;
        private final EffectiveConfig config;

        // Directives in scope for the current node, innermost last
        private final List<SuppressionDirective> directives = new ArrayList<>();
        // Structural path segments from the root to the current node
        private final List<String> segments = new ArrayList<>();

        private final List<Finding> findings = new ArrayList<>();
        private final List<Diagnostic> diagnostics = new ArrayList<>();
        private final List<Correction> corrections = new ArrayList<>();
        private int suppressed;

        Walk(String file, DispatchTable table, EffectiveConfig config) {
            this.file = file;
            this.table = table;
            this.config = config;
        }

        void run(Node root) {
            directives.addAll(fileScopeDirectives(root));
            visit(root, StructuralPath.rootSegment(root));
        }

        private static List<SuppressionDirective> fileScopeDirectives(Node root) {
            List<SuppressionDirective> fileScope = new ArrayList<>();
            collectFileScope(root, fileScope);
            for (Node child : root.children()) {
                collectFileScope(child, fileScope);
            }
            return fileScope;
        }

        private static void collectFileScope(Node node, List<SuppressionDirective> into) {
            for (SuppressionDirective directive : SuppressionParser.parse(node)) {
                if (directive.scope() == SuppressionDirective.Scope.FILE) {
                    into.add(directive);
                }
            }
        }

        private void visit(Node node, String segment) {
            int mark = directives.size();
            directives.addAll(SuppressionParser.parse(node));
            segments.add(segment);

            for (RuleDescriptor rule : table.rulesFor(node.kind())) {
                dispatch(rule, node);
            }

            List<Node> children = node.children();
            if (!children.isEmpty()) {
                List<String> childSegments = StructuralPath.childSegments(node);
                for (int i = 0; i < children.size(); i++) {
                    visit(children.get(i), childSegments.get(i));
                }
            }

            segments.remove(segments.size() - 1);
            directives.subList(mark, directives.size()).clear();
        }

        private void dispatch(RuleDescriptor rule, Node node) {
            RuleSetting setting = config.setting(rule.id())
                    .orElseThrow(() -> new IllegalStateException("No setting resolved for rule " + rule.id()));
            VisitContext context = new VisitContext(rule, setting, node);
            try {
                rule.visitor().visit(node, context);
            } catch (RuntimeException | StackOverflowError | LinkageError | AssertionError e) {
                // VirtualMachineErrors other than stack overflow are left to end the file
                log.warn("Rule {} failed on {} at {}: {}", rule.id(), file, location(node).display(), e.toString());
                diagnostics.add(Diagnostic.ruleError(file, rule.id(), location(node), describe(e)));
                return;
            }
            findings.addAll(context.reported);
            corrections.addAll(context.corrected);
            suppressed += context.suppressed;
        }

        private SourceLocation location(Node node) {
            SourceRange range = node.range();
            return new SourceLocation(file, range.startLine(), range.startColumn(), range.endLine(), range.endColumn());
        }

        private static String describe(Throwable e) {
            return e.getMessage() != null
                    ? e.getClass().getSimpleName() + ": " + e.getMessage()
                    : e.getClass().getSimpleName();
        }

        /**
         * Context handed to one rule for one visit. Buffers its output until the visit returns.
         */
        private final class VisitContext implements RuleContext {
            private final RuleDescriptor rule;
            private final RuleSetting setting;
            private final Node current;

            private final List<Finding> reported = new ArrayList<>();
            private final List<Correction> corrected = new ArrayList<>();
            private int suppressed;

            VisitContext(RuleDescriptor rule, RuleSetting setting, Node current) {
                this.rule = rule;
                this.setting = setting;
                this.current = current;
            }

            @Override
            public String file() {
                return file;
            }

            @Override
            public Map<String, Object> parameters() {
                return setting.parameters();
            }

            @Override
            public void report(Node node, String message) {
                if (node == null) {
                    throw new IllegalArgumentException("Rule " + rule.id() + " reported a finding without a node");
                }
                List<SuppressionDirective> inScope = new ArrayList<>(directives);
                List<String> path = new ArrayList<>(segments);
                if (node != current) {
                    descend(current, node, path, inScope);
                }

                if (Suppressions.isSuppressed(rule.id(), rule.ruleSetId(), inScope)) {
                    suppressed++;
                    return;
                }

                String signature = StructuralPath.signature(file, path);
                Finding finding = Finding.builder()
                        .ruleId(rule.id())
                        .severity(setting.severity())
                        .location(location(node))
                        .message(message)
                        .entitySignature(signature)
                        .fingerprint(Fingerprint.compute(rule.id(), signature, node.text()).value())
                        .debt(rule.debt())
                        .build();

                if (setting.autoCorrect() && rule.autoCorrectable()) {
                    Optional<String> replacement = rule.corrector().correct(node);
                    if (replacement.isPresent()) {
                        corrected.add(new Correction(rule.id(), finding.location(), replacement.get()));
                        finding = finding.withAutoCorrected(true);
                    }
                }
                reported.add(finding);
            }
        }

        /**
         * Extends {@code path} and {@code inScope} from {@code from} down to {@code target} when the
         * target is a descendant. Reports on other nodes keep the visited node's path.
         */
        private static boolean descend(Node from, Node target, List<String> path,
                                       List<SuppressionDirective> inScope) {
            List<Node> children = from.children();
            if (children.isEmpty()) {
                return false;
            }
            List<String> childSegments = StructuralPath.childSegments(from);
            for (int i = 0; i < children.size(); i++) {
                Node child = children.get(i);
                int pathMark = path.size();
                int scopeMark = inScope.size();
                path.add(childSegments.get(i));
                inScope.addAll(SuppressionParser.parse(child));
                if (child == target || descend(child, target, path, inScope)) {
                    return true;
                }
                path.subList(pathMark, path.size()).clear();
                inScope.subList(scopeMark, inScope.size()).clear();
            }
            return false;
        }
    }
}
