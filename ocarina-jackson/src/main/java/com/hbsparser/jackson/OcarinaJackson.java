package com.hbsparser.jackson;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.module.paramnames.ParameterNamesModule;

/**
 * Factory for ObjectMapper instances set up for template trees.
 *
 * <pre>
 * ObjectMapper mapper = OcarinaJackson.createObjectMapper();
 * String json = mapper.writeValueAsString(template);
 * Template template = mapper.readValue(json, Template.class);
 * </pre>
 */
public final class OcarinaJackson {

    private OcarinaJackson() {
        // Utility class
    }

    /**
     * Creates a mapper that writes nodes with a {@code "type"} discriminator and a
     * {@code loc} object in place of the flat line/column fields, omits absent
     * optional fields (except a block's {@code inverse}), and reads the same shape back.
     */
    public static ObjectMapper createObjectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new ParameterNamesModule());
        mapper.setSerializationInclusion(JsonInclude.Include.NON_NULL);
        mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        mapper.registerModule(new AstModule());
        return mapper;
    }
}
