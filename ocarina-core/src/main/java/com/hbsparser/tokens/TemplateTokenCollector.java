package com.hbsparser.tokens;

import com.hbsparser.ast.*;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Walks a template tree in document order and collects the components, helpers and
 * modifiers it invokes.
 *
 * <p>The walk is iterative: pending nodes sit on an explicit work stack together with the
 * {@link BlockScope} they must be classified under, so template nesting depth never turns
 * into call-stack depth. A node's own token is emitted before any token of its descendants.</p>
 *
 * <p>Instances hold no per-walk state and may be shared between threads.</p>
 */
public final class TemplateTokenCollector {
    private static final Logger logger = LogManager.getLogger(TemplateTokenCollector.class);

    private final PathClassifier classifier;

    private record WorkItem(Node node, BlockScope scope) {}

    public TemplateTokenCollector() {
        this(CollectorOptions.DEFAULT);
    }

    public TemplateTokenCollector(CollectorOptions options) {
        this.classifier = new PathClassifier(options);
    }

    /**
     * Normalized invocation names under {@code root}, in document order.
     */
    public List<String> collect(Node root) {
        return collectOccurrences(root).stream().map(TokenOccurrence::name).toList();
    }

    /**
     * Invocations under {@code root} with their kind and location, in document order.
     */
    public List<TokenOccurrence> collectOccurrences(Node root) {
        List<TokenOccurrence> found = new ArrayList<>();
        Deque<WorkItem> work = new ArrayDeque<>();
        work.push(new WorkItem(root, BlockScope.empty()));

        while (!work.isEmpty()) {
            WorkItem item = work.pop();
            List<WorkItem> next = new ArrayList<>();
            visit(item.node(), item.scope(), found, next);
            // Reverse so the first child is popped first
            for (int i = next.size() - 1; i >= 0; i--) {
                work.push(next.get(i));
            }
        }
        return found;
    }

    private void visit(Node node, BlockScope scope, List<TokenOccurrence> found, List<WorkItem> next) {
        if (node instanceof Template template) {
            addAll(next, template.body(), scope);
        } else if (node instanceof ElementNode element) {
            Classification tag = classifier.classify(element.tag(), PathContext.TAG_NAME, scope);
            if (tag instanceof Classification.Component component) {
                found.add(new TokenOccurrence(component.normalizedPath(), TokenKind.ANGLE_BRACKET_COMPONENT, element.loc()));
            }
            // Attributes and modifiers are evaluated before the element's own block params exist
            addAll(next, element.attributes(), scope);
            addAll(next, element.modifiers(), scope);
            addAll(next, element.children(), scope.push(element.blockParams()));
        } else if (node instanceof AttrNode attr) {
            next.add(new WorkItem(attr.value(), scope));
        } else if (node instanceof ConcatStatement concat) {
            addAll(next, concat.parts(), scope);
        } else if (node instanceof MustacheStatement mustache) {
            emitInvocation(mustache.path(), TokenKind.MUSTACHE, scope, found);
            addCallArguments(next, mustache.params(), mustache.hash(), scope);
        } else if (node instanceof SubExpression subExpression) {
            emitInvocation(subExpression.path(), TokenKind.SUB_EXPRESSION, scope, found);
            addCallArguments(next, subExpression.params(), subExpression.hash(), scope);
        } else if (node instanceof ElementModifierStatement modifier) {
            emitInvocation(modifier.path(), TokenKind.MODIFIER, scope, found);
            addCallArguments(next, modifier.params(), modifier.hash(), scope);
        } else if (node instanceof BlockStatement block) {
            // One node for both delimiters, so one token
            emitInvocation(block.path(), TokenKind.BLOCK, scope, found);
            // The block's own arguments are evaluated in the caller's scope
            addCallArguments(next, block.params(), block.hash(), scope);
            next.add(new WorkItem(block.program(), scope.push(block.program().blockParams())));
            if (block.inverse() != null) {
                next.add(new WorkItem(block.inverse(), scope.push(block.inverse().blockParams())));
            }
        } else if (node instanceof Block body) {
            addAll(next, body.body(), scope);
        } else if (node instanceof Hash hash) {
            addAll(next, hash.pairs(), scope);
        } else if (node instanceof HashPair pair) {
            next.add(new WorkItem(pair.value(), scope));
        } else if (node instanceof ExtensionNode extension) {
            logger.trace("Descending into unrecognised node {} at {}", extension.type(), extension.loc());
            addAll(next, extension.children(), scope);
        }
        // Text, comments, literals and bare paths carry no invocation
    }

    private void emitInvocation(Expression path, TokenKind kind, BlockScope scope, List<TokenOccurrence> found) {
        if (!(path instanceof PathExpression pathExpression)) {
            return;
        }
        Classification result = classifier.classify(pathExpression.original(), PathContext.CURLY_PATH, scope);
        if (result instanceof Classification.Invocable invocable) {
            found.add(new TokenOccurrence(invocable.normalizedPath(), kind, pathExpression.loc()));
        }
    }

    private static void addCallArguments(List<WorkItem> next, List<Expression> params, Hash hash, BlockScope scope) {
        addAll(next, params, scope);
        if (hash != null) {
            next.add(new WorkItem(hash, scope));
        }
    }

    private static void addAll(List<WorkItem> next, List<? extends Node> nodes, BlockScope scope) {
        for (Node node : nodes) {
            next.add(new WorkItem(node, scope));
        }
    }
}
