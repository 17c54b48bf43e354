package com.hbsparser.tokens;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class PathClassifierTest {

    private final PathClassifier classifier = new PathClassifier();

    @ParameterizedTest
    @CsvSource({
        "MyComponent, my-component",
        "A::B::C, a/b/c",
        "MyComponent::Bar, my-component/bar",
        "Foo, foo",
        "UiKit::DataTable::HeaderCell, ui-kit/data-table/header-cell"
    })
    void tagNamesAreDasherized(String tag, String expected) {
        assertEquals(new Classification.Component(expected),
            classifier.classify(tag, PathContext.TAG_NAME, BlockScope.empty()));
    }

    @Test
    void lowercaseTagsAreMarkup() {
        assertSame(Classification.SKIP, classifier.classify("div", PathContext.TAG_NAME, BlockScope.empty()));
        assertSame(Classification.SKIP, classifier.classify("my-element", PathContext.TAG_NAME, BlockScope.empty()));
        assertSame(Classification.SKIP, classifier.classify("this.Component", PathContext.TAG_NAME, BlockScope.empty()));
    }

    @Test
    void argumentsAreSkippedInEveryContext() {
        for (PathContext context : PathContext.values()) {
            assertSame(Classification.SKIP, classifier.classify("@Foo", context, BlockScope.empty()));
            assertSame(Classification.SKIP, classifier.classify("@model.name", context, BlockScope.empty()));
        }
    }

    @Test
    void boundHeadsAreSkipped() {
        BlockScope scope = BlockScope.empty().push(List.of("item", "Card"));

        assertSame(Classification.SKIP, classifier.classify("item", PathContext.CURLY_PATH, scope));
        assertSame(Classification.SKIP, classifier.classify("item.title", PathContext.CURLY_PATH, scope));
        assertSame(Classification.SKIP, classifier.classify("item/title", PathContext.CURLY_PATH, scope));
        assertSame(Classification.SKIP, classifier.classify("Card", PathContext.TAG_NAME, scope));
        assertSame(Classification.SKIP, classifier.classify("Card::Header", PathContext.TAG_NAME, scope));
        assertSame(Classification.SKIP, classifier.classify("Card.Header", PathContext.TAG_NAME, scope));
        // Only the head segment is looked up
        assertEquals(new Classification.Invocable("items"), classifier.classify("items", PathContext.CURLY_PATH, scope));
        assertEquals(new Classification.Component("my-card"), classifier.classify("MyCard", PathContext.TAG_NAME, scope));
    }

    @Test
    void curlyPathsAreKeptVerbatim() {
        assertEquals(new Classification.Invocable("my-component/bar"),
            classifier.classify("my-component/bar", PathContext.CURLY_PATH, BlockScope.empty()));
        assertEquals(new Classification.Invocable("MyHelper"),
            classifier.classify("MyHelper", PathContext.CURLY_PATH, BlockScope.empty()));
    }

    @Test
    void thisPathsFollowOptions() {
        assertEquals(new Classification.Invocable("this.title"),
            classifier.classify("this.title", PathContext.CURLY_PATH, BlockScope.empty()));

        PathClassifier ignoring = new PathClassifier(new CollectorOptions(true));
        assertSame(Classification.SKIP, ignoring.classify("this.title", PathContext.CURLY_PATH, BlockScope.empty()));
        assertSame(Classification.SKIP, ignoring.classify("this", PathContext.CURLY_PATH, BlockScope.empty()));
        assertEquals(new Classification.Invocable("thistle"),
            ignoring.classify("thistle", PathContext.CURLY_PATH, BlockScope.empty()));
    }

    @Test
    void headSegment() {
        assertEquals("a", PathClassifier.headSegment("a.b/c", PathContext.CURLY_PATH));
        assertEquals("a", PathClassifier.headSegment("a/b.c", PathContext.CURLY_PATH));
        assertEquals("A", PathClassifier.headSegment("A::B", PathContext.TAG_NAME));
        assertEquals("plain", PathClassifier.headSegment("plain", PathContext.CURLY_PATH));
    }

    @Test
    void dasherize() {
        assertEquals("my-component", PathClassifier.dasherize("MyComponent"));
        assertEquals("x-y-z", PathClassifier.dasherize("XYZ"));
        assertEquals("already-dashed", PathClassifier.dasherize("already-dashed"));
    }
}
