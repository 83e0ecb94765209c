package com.trophykit.core.json;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.deser.std.StdScalarDeserializer;

import java.io.IOException;

/**
 * Float that vendors send either as a JSON number or as a quoted number ({@code "12.5"}).
 * Null and blank strings read as null, or 0 for the primitive variant.
 */
public class FlexibleFloatDeserializer extends StdScalarDeserializer<Float> {
    private final boolean primitive;

    public FlexibleFloatDeserializer() { this(false); }

    /** @param primitive true when bound to {@code float} fields, which cannot hold null */
    public FlexibleFloatDeserializer(boolean primitive) {
        super(primitive ? Float.TYPE : Float.class);
        this.primitive = primitive;
    }

    @Override
    public Float deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
        JsonToken t = p.currentToken();
        if (t == JsonToken.VALUE_NUMBER_FLOAT || t == JsonToken.VALUE_NUMBER_INT) {
            return p.getFloatValue();
        }
        if (t == JsonToken.VALUE_STRING) {
            String s = p.getText().trim();
            if (s.isEmpty()) return getNullValue(ctxt);
            try {
                return Float.parseFloat(s);
            } catch (NumberFormatException e) {
                return (Float) ctxt.handleWeirdStringValue(Float.class, s, "not a float");
            }
        }
        if (t == JsonToken.VALUE_NULL) return getNullValue(ctxt);
        return (Float) ctxt.handleUnexpectedToken(Float.class, p);
    }

    @Override
    public Float getNullValue(DeserializationContext ctxt) { return primitive ? 0f : null; }
}
