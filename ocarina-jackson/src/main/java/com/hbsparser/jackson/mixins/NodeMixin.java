package com.hbsparser.jackson.mixins;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import com.hbsparser.ast.*;

/**
 * Polymorphic type handling for template nodes, keyed by the {@code "type"} property.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "type")
@JsonSubTypes({
    @JsonSubTypes.Type(value = Template.class, name = "Template"),
    @JsonSubTypes.Type(value = ElementNode.class, name = "ElementNode"),
    @JsonSubTypes.Type(value = AttrNode.class, name = "AttrNode"),
    @JsonSubTypes.Type(value = ElementModifierStatement.class, name = "ElementModifierStatement"),
    @JsonSubTypes.Type(value = MustacheStatement.class, name = "MustacheStatement"),
    @JsonSubTypes.Type(value = BlockStatement.class, name = "BlockStatement"),
    @JsonSubTypes.Type(value = Block.class, name = "Block"),
    @JsonSubTypes.Type(value = TextNode.class, name = "TextNode"),
    @JsonSubTypes.Type(value = ConcatStatement.class, name = "ConcatStatement"),
    @JsonSubTypes.Type(value = MustacheCommentStatement.class, name = "MustacheCommentStatement"),
    @JsonSubTypes.Type(value = CommentStatement.class, name = "CommentStatement"),
    @JsonSubTypes.Type(value = PathExpression.class, name = "PathExpression"),
    @JsonSubTypes.Type(value = SubExpression.class, name = "SubExpression"),
    @JsonSubTypes.Type(value = StringLiteral.class, name = "StringLiteral"),
    @JsonSubTypes.Type(value = NumberLiteral.class, name = "NumberLiteral"),
    @JsonSubTypes.Type(value = BooleanLiteral.class, name = "BooleanLiteral"),
    @JsonSubTypes.Type(value = NullLiteral.class, name = "NullLiteral"),
    @JsonSubTypes.Type(value = UndefinedLiteral.class, name = "UndefinedLiteral"),
    @JsonSubTypes.Type(value = Hash.class, name = "Hash"),
    @JsonSubTypes.Type(value = HashPair.class, name = "HashPair")
})
public abstract class NodeMixin {
}
