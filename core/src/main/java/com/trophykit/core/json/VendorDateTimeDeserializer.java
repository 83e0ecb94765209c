package com.trophykit.core.json;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.deser.std.StdScalarDeserializer;

import java.io.IOException;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;

/**
 * Reads {@code yyyy-MM-dd HH:mm:ss} timestamps. ISO-8601 is accepted as a fallback
 * (an offset, if present, is dropped). Null or blank gives null; anything else fails decoding.
 */
public class VendorDateTimeDeserializer extends StdScalarDeserializer<LocalDateTime> {
    public static final DateTimeFormatter VENDOR_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    public VendorDateTimeDeserializer() { super(LocalDateTime.class); }

    @Override
    public LocalDateTime deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
        JsonToken t = p.currentToken();
        if (t == JsonToken.VALUE_NULL) return null;
        if (t != JsonToken.VALUE_STRING) {
            return (LocalDateTime) ctxt.handleUnexpectedToken(LocalDateTime.class, p);
        }
        String s = p.getText().trim();
        if (s.isEmpty()) return null;
        LocalDateTime parsed = parse(s);
        if (parsed == null) {
            return (LocalDateTime) ctxt.handleWeirdStringValue(LocalDateTime.class, s,
                    "expected format yyyy-MM-dd HH:mm:ss");
        }
        return parsed;
    }

    static LocalDateTime parse(String s) {
        try {
            return LocalDateTime.parse(s, VENDOR_FORMAT);
        } catch (DateTimeParseException ignore) {
            // fall through to ISO
        }
        try {
            return LocalDateTime.parse(s, DateTimeFormatter.ISO_LOCAL_DATE_TIME);
        } catch (DateTimeParseException ignore) {
            // fall through to ISO with offset
        }
        try {
            return OffsetDateTime.parse(s, DateTimeFormatter.ISO_OFFSET_DATE_TIME).toLocalDateTime();
        } catch (DateTimeParseException e) {
            return null;
        }
    }

    @Override
    public LocalDateTime getNullValue(DeserializationContext ctxt) { return null; }
}
