package com.hbsparser.tokens;

import com.hbsparser.TemplateSyntaxException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;

import static com.hbsparser.tokens.TemplateTokens.extractTokensFromTemplate;
import static org.junit.jupiter.api.Assertions.*;

public class TemplateTokensTest {

    private static List<String> t(String template) {
        return extractTokensFromTemplate(template);
    }

    @Test
    @DisplayName("extract tokens from inline angle components")
    void inlineAngleComponent() {
        assertEquals(List.of("my-component"), t("<MyComponent />"));
    }

    @Test
    @DisplayName("extract tokens from nested inline angle components")
    void nestedInlineAngleComponent() {
        assertEquals(List.of("my-component/bar"), t("<MyComponent::Bar />"));
    }

    @Test
    @DisplayName("extract tokens from inline curly components")
    void inlineCurlyComponent() {
        assertEquals(List.of("my-component"), t("{{my-component}}"));
    }

    @Test
    @DisplayName("extract tokens from nested inline curly components")
    void nestedInlineCurlyComponent() {
        assertEquals(List.of("my-component/bar"), t("{{my-component/bar}}"));
    }

    @Test
    @DisplayName("extract tokens from modifiers in html tags")
    void modifierOnHtmlTag() {
        assertEquals(List.of("autocomplete"), t("<input {{autocomplete}} >"));
    }

    @Test
    @DisplayName("extract tokens from modifiers in angle components")
    void modifierOnAngleComponent() {
        assertEquals(List.of("my-component", "autocomplete"), t("<MyComponent {{autocomplete}} />"));
    }

    @Test
    @DisplayName("extract tokens from curly blocks")
    void curlyBlock() {
        assertEquals(List.of("my-component/foo"), t("{{#my-component/foo}} {{/my-component/foo}}"));
    }

    @Test
    @DisplayName("extract tokens from angle blocks")
    void angleBlock() {
        assertEquals(List.of("my-component/foo"), t("<MyComponent::Foo></MyComponent::Foo>"));
    }

    @Test
    @DisplayName("extract tokens from helpers in attributes")
    void helperInAttribute() {
        assertEquals(List.of("my-component/foo", "format-name"),
            t("<MyComponent::Foo @name={{format-name \"boo\"}}></MyComponent::Foo>"));
    }

    @Test
    @DisplayName("extract tokens from helpers composition in attributes")
    void helperCompositionInAttribute() {
        assertEquals(List.of("my-component/foo", "format-name", "to-uppercase"),
            t("<MyComponent::Foo @name={{format-name (to-uppercase \"boo\")}}></MyComponent::Foo>"));
    }

    @Test
    @DisplayName("extract tokens from helpers composition in params")
    void helperCompositionInHash() {
        assertEquals(List.of("my-component/foo", "format-name", "to-uppercase"),
            t("{{#my-component/foo name=(format-name (to-uppercase \"boo\"))}} {{/my-component/foo}}"));
    }

    @Test
    @DisplayName("skip local paths for angle blocks")
    void skipLocalPathsForAngleBlocks() {
        assertEquals(List.of("foo"), t("<Foo as |Bar|><Bar /></Foo>"));
    }

    @Test
    @DisplayName("skip local paths for curly blocks")
    void skipLocalPathsForCurlyBlocks() {
        assertEquals(List.of("foo-bar"), t("{{#foo-bar as |Bar|}}<Bar />{{/foo-bar}}"));
    }

    @Test
    @DisplayName("skip external arguments")
    void skipExternalArguments() {
        assertEquals(List.of(), t("<@Foo />"));
    }

    @Test
    @DisplayName("nested block params shadow at every level")
    void nestedShadowing() {
        assertEquals(List.of("a", "b"), t("{{#a as |X|}}{{#b as |Y|}}<X/><Y/>{{/b}}{{/a}}"));
    }

    @Test
    void shadowingEndsWhenTheBlockCloses() {
        assertEquals(List.of("Bar", "foo", "Bar"),
            t("{{Bar}}<Foo as |Bar|>{{Bar}}<Bar /></Foo>{{Bar}}"));
        assertEquals(List.of("bar", "each", "bar"),
            t("<Bar />{{#each items as |Bar|}}<Bar />{{/each}}<Bar />"));
    }

    @Test
    void blockParamsDoNotCoverTheBlocksOwnArguments() {
        // `item` in the argument list refers to the outer scope
        assertEquals(List.of("each", "item", "item"),
            t("{{#each (item) as |item|}}{{item}}{{/each}}{{item}}"));
    }

    @Test
    void elementBlockParamsDoNotCoverItsAttributes() {
        assertEquals(List.of("foo", "bar"), t("<Foo @value={{bar}} as |bar|>{{bar}}</Foo>"));
    }

    @Test
    void inverseGetsItsOwnScope() {
        assertEquals(List.of("each", "empty-state", "row"),
            t("{{#each rows as |row|}}{{row}}{{else}}{{empty-state}}{{row}}{{/each}}"));
    }

    @Test
    void argumentsAreNeverCollected() {
        assertEquals(List.of("if", "yield", "hash"),
            t("{{@title}}{{#if @show}}{{@model.name}}<@Slot />{{/if}}{{yield (hash a=@b)}}"));
        assertEquals(List.of(), t("{{@foo}}{{#@bar}}{{/@bar}}<input {{@mod}}>"));
    }

    @Test
    void plainMarkupProducesNothing() {
        assertEquals(List.of(),
            t("<div class=\"x\"><p>Hello <b>world</b></p><!-- note --><br></div>{{! comment }}{{!-- block --}}"));
    }

    @ParameterizedTest
    @ValueSource(strings = {"", "   ", "\n\t\n", "plain text only"})
    void emptyOrTextOnlyTemplatesYieldNoTokens(String template) {
        assertTrue(t(template).isEmpty());
    }

    @Test
    void literalMustachePathsAreNotInvocations() {
        assertEquals(List.of(), t("{{\"hello\"}}{{1}}{{true}}{{null}}{{undefined}}"));
    }

    @Test
    void subExpressionsAreOuterBeforeInner() {
        assertEquals(List.of("format-name", "to-uppercase"), t("{{format-name (to-uppercase \"boo\")}}"));
        assertEquals(List.of("a", "b", "c", "d"), t("{{a (b (c)) key=(d)}}"));
    }

    @Test
    void concatenatedAttributesAreVisited() {
        assertEquals(List.of("button-class", "t"),
            t("<button class=\"btn {{button-class}} {{t 'label'}}\">x</button>"));
    }

    @Test
    void elseIfChainsEmitEachBlockOnce() {
        assertEquals(List.of("if", "first", "if", "second", "third"),
            t("{{#if a}}{{first}}{{else if b}}{{second}}{{else}}{{third}}{{/if}}"));
    }

    @Test
    void duplicatesAcrossNodesAreKept() {
        assertEquals(List.of("t", "t"), t("{{t 'a'}}{{t 'b'}}"));
    }

    @Test
    void thisPathsAreCollectedByDefault() {
        assertEquals(List.of("this.title"), t("{{this.title}}"));
    }

    @Test
    void thisPathsCanBeIgnored() {
        CollectorOptions options = new CollectorOptions(true);
        assertEquals(List.of("format"), extractTokensFromTemplate("{{this.title}}{{format this.value}}", options));
    }

    @Test
    void namedBlocksAreNotComponents() {
        assertEquals(List.of("card"), t("<Card><:header>Title</:header><:body>Text</:body></Card>"));
    }

    @Test
    void parseErrorsProduceNoTokens() {
        TemplateSyntaxException error = assertThrows(TemplateSyntaxException.class,
            () -> t("<MyComponent>{{foo}}"));
        assertEquals(1, error.getLine());
        assertEquals(0, error.getColumn());
    }

    @Test
    void occurrencesCarryKindAndLocation() {
        List<TokenOccurrence> occurrences = TemplateTokens.extractTokenOccurrences(
            "<Foo {{bar}}>\n  {{#baz}}{{qux (quux)}}{{/baz}}\n</Foo>");

        assertEquals(List.of("foo", "bar", "baz", "qux", "quux"),
            occurrences.stream().map(TokenOccurrence::name).toList());
        assertEquals(List.of(TokenKind.ANGLE_BRACKET_COMPONENT, TokenKind.MODIFIER, TokenKind.BLOCK,
                TokenKind.MUSTACHE, TokenKind.SUB_EXPRESSION),
            occurrences.stream().map(TokenOccurrence::kind).toList());

        TokenOccurrence block = occurrences.get(2);
        assertEquals(2, block.loc().start().line());
        assertEquals(5, block.loc().start().column());
    }
}
