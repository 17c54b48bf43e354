package com.hbsparser.tokens;

import com.hbsparser.Parser;
import com.hbsparser.ast.*;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Collector behaviour on trees built by hand, independent of the parser.
 */
public class TemplateTokenCollectorTest {

    private final TemplateTokenCollector collector = new TemplateTokenCollector();

    private record FragmentNode(List<Node> children) implements ExtensionNode {
        @Override
        public String type() {
            return "Fragment";
        }

        @Override
        public int start() {
            return 0;
        }

        @Override
        public int end() {
            return 0;
        }

        @Override
        public SourceLocation loc() {
            return new SourceLocation(new SourceLocation.Position(1, 0), new SourceLocation.Position(1, 0));
        }
    }

    private static MustacheStatement mustache(String path, Expression... params) {
        return new MustacheStatement(new PathExpression(path), List.of(params), Hash.empty(), false);
    }

    private static BlockStatement block(String path, List<String> blockParams, Statement... body) {
        return new BlockStatement(new PathExpression(path), List.of(), Hash.empty(),
            new Block(blockParams, List.of(body)), null);
    }

    private static ElementNode element(String tag, List<String> blockParams, Statement... children) {
        return new ElementNode(tag, List.of(), List.of(), blockParams, List.of(children), children.length == 0);
    }

    @Test
    void unknownNodeKindsAreTraversedNotFatal() {
        Template template = new Template(List.of(
            new FragmentNode(List.of(mustache("inside-extension"), new TextNode("text"))),
            new FragmentNode(List.of()),
            mustache("after")
        ));

        assertEquals(List.of("inside-extension", "after"), collector.collect(template));
    }

    @Test
    void extensionChildrenSeeTheEnclosingScope() {
        Template template = new Template(List.of(
            block("each", List.of("row"),
                new FragmentNode(List.of(mustache("row"), mustache("cell"))))
        ));

        assertEquals(List.of("each", "cell"), collector.collect(template));
    }

    @Test
    void programAndInverseAreScopedIndependently() {
        BlockStatement statement = new BlockStatement(
            new PathExpression("let"), List.of(), Hash.empty(),
            new Block(List.of("a"), List.of(mustache("a"), mustache("b"))),
            new Block(List.of("b"), List.of(mustache("a"), mustache("b"))));

        assertEquals(List.of("let", "b", "a"), collector.collect(new Template(List.of(statement))));
    }

    @Test
    void literalPathsAreIgnored() {
        MustacheStatement literal = new MustacheStatement(new StringLiteral("text"), List.of(), Hash.empty(), false);
        assertEquals(List.of(), collector.collect(new Template(List.of(literal))));
    }

    @Test
    void hashValuesFollowPositionalParams() {
        MustacheStatement statement = new MustacheStatement(
            new PathExpression("outer"),
            List.of(new SubExpression(new PathExpression("first"), List.of(), Hash.empty())),
            new Hash(List.of(
                new HashPair("x", new SubExpression(new PathExpression("second"), List.of(), Hash.empty())),
                new HashPair("y", new PathExpression("not-invoked")))),
            false);

        assertEquals(List.of("outer", "first", "second"), collector.collect(new Template(List.of(statement))));
    }

    @Test
    void collectingASubtreeStartsWithEmptyScope() {
        assertEquals(List.of("item"), collector.collect(mustache("item")));
    }

    @Test
    void deepNestingDoesNotExhaustTheCallStack() {
        int depth = 100_000;
        Statement innermost = element("Leaf", List.of());
        for (int i = 0; i < depth; i++) {
            innermost = (i % 2 == 0)
                ? block("wrap", List.of("w" + i), innermost)
                : element("div", List.of(), innermost);
        }

        List<String> tokens = collector.collect(new Template(List.of(innermost)));

        assertEquals(depth / 2 + 1, tokens.size());
        assertEquals("wrap", tokens.get(0));
        assertEquals("leaf", tokens.get(tokens.size() - 1));
    }

    @Test
    void identicalInputGivesIdenticalOutput() {
        Template template = Parser.parse(
            "{{#each items as |item|}}<Row @item={{item}} {{on \"click\" (fn select item)}} />{{/each}}");

        List<String> first = collector.collect(template);
        assertEquals(List.of("each", "row", "on", "fn"), first);
        assertEquals(first, collector.collect(template));
    }

    @Test
    void concurrentCollectionsDoNotInterfere() throws Exception {
        Template shadowing = Parser.parse("{{#a as |X|}}<X />{{x-helper}}{{/a}}");
        Template plain = Parser.parse("<X />{{x-helper}}");

        ExecutorService executor = Executors.newFixedThreadPool(8);
        try {
            List<Future<List<String>>> results = new ArrayList<>();
            for (int i = 0; i < 200; i++) {
                Template template = i % 2 == 0 ? shadowing : plain;
                results.add(executor.submit(() -> collector.collect(template)));
            }
            for (int i = 0; i < results.size(); i++) {
                List<String> expected = i % 2 == 0 ? List.of("a", "x-helper") : List.of("x", "x-helper");
                assertEquals(expected, results.get(i).get(10, TimeUnit.SECONDS));
            }
        } finally {
            executor.shutdownNow();
        }
    }
}
