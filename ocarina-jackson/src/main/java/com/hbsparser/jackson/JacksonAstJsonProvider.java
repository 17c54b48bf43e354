package com.hbsparser.jackson;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.hbsparser.ast.Node;
import com.hbsparser.ast.Template;
import com.hbsparser.json.AstJsonDeserializer;
import com.hbsparser.json.AstJsonException;
import com.hbsparser.json.AstJsonProvider;
import com.hbsparser.json.AstJsonSerializer;
import com.hbsparser.tokens.TokenOccurrence;

import java.util.List;

/**
 * Jackson-based implementation of AstJsonProvider, registered through
 * {@code META-INF/services}.
 */
public class JacksonAstJsonProvider implements AstJsonProvider {

    private final ObjectMapper mapper;
    private final AstJsonSerializer serializer;
    private final AstJsonDeserializer deserializer;

    public JacksonAstJsonProvider() {
        this.mapper = OcarinaJackson.createObjectMapper();
        this.serializer = new JacksonSerializer(mapper);
        this.deserializer = new JacksonDeserializer(mapper);
    }

    @Override
    public AstJsonSerializer getSerializer() {
        return serializer;
    }

    @Override
    public AstJsonDeserializer getDeserializer() {
        return deserializer;
    }

    @Override
    public String getName() {
        return "Jackson";
    }

    public ObjectMapper getObjectMapper() {
        return mapper;
    }

    // ==================== Inner Classes ====================

    private static class JacksonSerializer implements AstJsonSerializer {
        private final ObjectMapper mapper;

        JacksonSerializer(ObjectMapper mapper) {
            this.mapper = mapper;
        }

        @Override
        public String serialize(Node node) throws AstJsonException {
            try {
                return mapper.writeValueAsString(node);
            } catch (Exception e) {
                throw new AstJsonException("Failed to serialize " + node.type(), e);
            }
        }

        @Override
        public String serializePretty(Node node) throws AstJsonException {
            try {
                return mapper.writerWithDefaultPrettyPrinter().writeValueAsString(node);
            } catch (Exception e) {
                throw new AstJsonException("Failed to serialize " + node.type(), e);
            }
        }

        @Override
        public String serializeTokens(List<TokenOccurrence> occurrences) throws AstJsonException {
            try {
                return mapper.writeValueAsString(occurrences);
            } catch (Exception e) {
                throw new AstJsonException("Failed to serialize token list", e);
            }
        }
    }

    private static class JacksonDeserializer implements AstJsonDeserializer {
        private final ObjectMapper mapper;

        JacksonDeserializer(ObjectMapper mapper) {
            this.mapper = mapper;
        }

        @Override
        public Template deserializeTemplate(String json) throws AstJsonException {
            return deserialize(json, Template.class);
        }

        @Override
        public <T extends Node> T deserialize(String json, Class<T> type) throws AstJsonException {
            try {
                return mapper.readValue(json, type);
            } catch (Exception e) {
                throw new AstJsonException("Failed to deserialize " + type.getSimpleName(), e);
            }
        }
    }
}
