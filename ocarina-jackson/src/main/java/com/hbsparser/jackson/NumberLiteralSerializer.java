package com.hbsparser.jackson;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.JsonSerializer;
import com.fasterxml.jackson.databind.SerializerProvider;

import java.io.IOException;

/**
 * Writes number literal values the way template source spells them: integral values
 * without a decimal point ({@code 1}, not {@code 1.0}).
 */
public class NumberLiteralSerializer extends JsonSerializer<Number> {
    // 2^53, beyond which a double no longer holds every integer
    private static final double MAX_SAFE_INTEGER = 9007199254740992.0;

    @Override
    public void serialize(Number value, JsonGenerator gen, SerializerProvider serializers) throws IOException {
        if (value == null) {
            gen.writeNull();
            return;
        }
        double d = value.doubleValue();
        if (Double.isNaN(d) || Double.isInfinite(d)) {
            gen.writeNull();
        } else if (d == Math.floor(d) && Math.abs(d) <= MAX_SAFE_INTEGER) {
            gen.writeNumber((long) d);
        } else {
            gen.writeNumber(d);
        }
    }
}
