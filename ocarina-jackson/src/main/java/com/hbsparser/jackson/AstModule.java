package com.hbsparser.jackson;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.Version;
import com.fasterxml.jackson.databind.*;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import com.fasterxml.jackson.databind.deser.BeanDeserializerModifier;
import com.fasterxml.jackson.databind.deser.ResolvableDeserializer;
import com.fasterxml.jackson.databind.module.SimpleModule;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.ser.BeanPropertyWriter;
import com.fasterxml.jackson.databind.ser.BeanSerializerModifier;
import com.hbsparser.ast.*;
import com.hbsparser.jackson.mixins.NodeMixin;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Jackson module for the template AST.
 *
 * <ul>
 *   <li>polymorphic nodes through {@link NodeMixin}</li>
 *   <li>a {@code loc} object in place of startLine/startCol/endLine/endCol</li>
 *   <li>integral number literals written without a fraction</li>
 *   <li>{@code loc} folded back into the flat fields when reading</li>
 * </ul>
 */
public class AstModule extends SimpleModule {

    // Replaced by loc in the JSON form
    private static final Set<String> EXCLUDED_FIELDS = Set.of("startLine", "startCol", "endLine", "endCol");

    private static final List<Class<? extends Node>> NODE_CLASSES = List.of(
        Template.class, ElementNode.class, AttrNode.class, ElementModifierStatement.class,
        MustacheStatement.class, Block.class, TextNode.class, ConcatStatement.class,
        MustacheCommentStatement.class, CommentStatement.class, PathExpression.class,
        SubExpression.class, StringLiteral.class, BooleanLiteral.class, NullLiteral.class,
        UndefinedLiteral.class, Hash.class, HashPair.class
    );

    public AstModule() {
        super("AstModule", new Version(0, 1, 0, "SNAPSHOT", "com.hbsparser", "ocarina-jackson"));
    }

    @Override
    public void setupModule(SetupContext context) {
        super.setupModule(context);

        context.setMixInAnnotations(Node.class, NodeMixin.class);
        context.setMixInAnnotations(Statement.class, NodeMixin.class);
        context.setMixInAnnotations(Expression.class, NodeMixin.class);
        context.setMixInAnnotations(AttrValue.class, NodeMixin.class);

        // loc() is not a bean getter, so each record gets the mixin directly
        for (Class<? extends Node> nodeClass : NODE_CLASSES) {
            context.setMixInAnnotations(nodeClass, SerializationMixin.class);
        }
        context.setMixInAnnotations(NumberLiteral.class, NumberLiteralMixin.class);
        context.setMixInAnnotations(BlockStatement.class, BlockStatementMixin.class);

        context.addBeanSerializerModifier(new AstSerializerModifier());
        context.addBeanDeserializerModifier(new AstDeserializerModifier());
    }

    // ==================== Serialization Mixins ====================

    private abstract static class SerializationMixin {
        @JsonProperty("loc")
        abstract SourceLocation loc();
    }

    private abstract static class NumberLiteralMixin extends SerializationMixin {
        @JsonSerialize(using = NumberLiteralSerializer.class)
        abstract double value();
    }

    // A block without {{else}} writes "inverse": null
    private abstract static class BlockStatementMixin extends SerializationMixin {
        @JsonInclude(JsonInclude.Include.ALWAYS)
        abstract Block inverse();
    }

    // ==================== Serializer Modifier ====================

    private static class AstSerializerModifier extends BeanSerializerModifier {
        @Override
        public List<BeanPropertyWriter> changeProperties(SerializationConfig config,
                                                         BeanDescription beanDesc,
                                                         List<BeanPropertyWriter> beanProperties) {
            if (!Node.class.isAssignableFrom(beanDesc.getBeanClass())) {
                return beanProperties;
            }
            List<BeanPropertyWriter> filtered = new ArrayList<>();
            for (BeanPropertyWriter prop : beanProperties) {
                if (!EXCLUDED_FIELDS.contains(prop.getName())) {
                    filtered.add(prop);
                }
            }
            return filtered;
        }
    }

    // ==================== Deserializer Modifier ====================

    private static class AstDeserializerModifier extends BeanDeserializerModifier {
        @Override
        public JsonDeserializer<?> modifyDeserializer(DeserializationConfig config,
                                                      BeanDescription beanDesc,
                                                      JsonDeserializer<?> deserializer) {
            Class<?> beanClass = beanDesc.getBeanClass();
            if (Node.class.isAssignableFrom(beanClass) && beanClass.isRecord()) {
                return new AstNodeDeserializer(deserializer);
            }
            return deserializer;
        }
    }

    /**
     * Rewrites {@code loc} into the flat position fields for a whole subtree, once, at the
     * outermost node, then hands the rewritten tree to the record deserializer.
     */
    private static class AstNodeDeserializer extends JsonDeserializer<Object> implements ResolvableDeserializer {
        // Nesting of this deserializer on the current thread; only depth 0 rewrites
        private static final ThreadLocal<Integer> DEPTH = ThreadLocal.withInitial(() -> 0);

        private final JsonDeserializer<?> delegate;

        AstNodeDeserializer(JsonDeserializer<?> delegate) {
            this.delegate = delegate;
        }

        @Override
        public void resolve(DeserializationContext ctxt) throws JsonMappingException {
            if (delegate instanceof ResolvableDeserializer resolvable) {
                resolvable.resolve(ctxt);
            }
        }

        @Override
        public Object deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
            int depth = DEPTH.get();
            JsonNode node = p.readValueAsTree();
            if (depth == 0) {
                transformNode(node, true);
            }

            DEPTH.set(depth + 1);
            try {
                JsonParser jp = node.traverse(p.getCodec());
                jp.nextToken();
                return delegate.deserialize(jp, ctxt);
            } finally {
                DEPTH.set(depth);
            }
        }

        // Objects carrying "type" are nodes; the root has had its type id consumed already
        private void transformNode(JsonNode node, boolean isAstNode) {
            if (node == null || !node.isObject()) {
                return;
            }
            ObjectNode objNode = (ObjectNode) node;

            if (isAstNode) {
                JsonNode loc = objNode.remove("loc");
                objNode.put("startLine", loc != null ? loc.path("start").path("line").asInt() : 0);
                objNode.put("startCol", loc != null ? loc.path("start").path("column").asInt() : 0);
                objNode.put("endLine", loc != null ? loc.path("end").path("line").asInt() : 0);
                objNode.put("endCol", loc != null ? loc.path("end").path("column").asInt() : 0);
                if (!objNode.has("start")) objNode.put("start", 0);
                if (!objNode.has("end")) objNode.put("end", 0);
            }

            objNode.fields().forEachRemaining(entry -> {
                JsonNode value = entry.getValue();
                if (value.isObject()) {
                    transformNode(value, value.has("type"));
                } else if (value.isArray()) {
                    value.forEach(child -> transformNode(child, child.has("type")));
                }
            });
        }
    }
}
