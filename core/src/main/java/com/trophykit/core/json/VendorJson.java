package com.trophykit.core.json;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.deser.std.StdScalarDeserializer;
import com.fasterxml.jackson.databind.module.SimpleModule;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import java.time.LocalDateTime;

/** Shared Jackson setup for vendor payloads. */
public final class VendorJson {
    /** Module id under which the vendor converters are registered. */
    public static final String CONVERTER_MODULE = "trophykit-vendor-converters";

    private VendorJson() {}

    public static ObjectMapper newMapper() {
        return newMapper(new FlexibleFloatDeserializer(), new VendorDateTimeDeserializer());
    }

    /** Same mapper with caller-supplied converters for {@code float} and {@link LocalDateTime}. */
    public static ObjectMapper newMapper(StdScalarDeserializer<Float> floatConverter,
                                        StdScalarDeserializer<LocalDateTime> dateTimeConverter) {
        return new ObjectMapper()
                .registerModule(new JavaTimeModule())
                // registered after JavaTimeModule so LocalDateTime uses the vendor format
                .registerModule(converters(floatConverter, dateTimeConverter))
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
                .configure(DeserializationFeature.FAIL_ON_NULL_FOR_PRIMITIVES, false)
                // anything after the root value is a decode error
                .configure(DeserializationFeature.FAIL_ON_TRAILING_TOKENS, true)
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }

    /** {@code floatConverter} binds {@link Float}; primitive {@code float} always reads null as 0. */
    public static SimpleModule converters(StdScalarDeserializer<Float> floatConverter,
                                          StdScalarDeserializer<LocalDateTime> dateTimeConverter) {
        SimpleModule m = new SimpleModule(CONVERTER_MODULE);
        if (floatConverter != null) {
            m.addDeserializer(Float.class, floatConverter);
        }
        m.addDeserializer(Float.TYPE, new FlexibleFloatDeserializer(true));
        if (dateTimeConverter != null) {
            m.addDeserializer(LocalDateTime.class, dateTimeConverter);
        }
        return m;
    }
}
