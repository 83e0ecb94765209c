package com.trophykit.core.json;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.trophykit.core.error.ApiException;
import com.trophykit.core.http.RawResponse;
import com.trophykit.core.util.StructuredLogger;

import java.util.Objects;

/**
 * Maps response bodies onto typed values.
 * <ul>
 *   <li>204, empty or whitespace body, or literal {@code null}: empty list / map / Optional;
 *       an OBJECT shape fails with {@link ApiException.Kind#NO_CONTENT}.</li>
 *   <li>Malformed or mismatched JSON: {@link ApiException.Kind#DECODE} with the parser
 *       message and the raw body.</li>
 * </ul>
 */
public final class ResponseDecoder {
    private static final StructuredLogger log = StructuredLogger.get(ResponseDecoder.class);

    private final ObjectMapper mapper;

    public ResponseDecoder() { this(VendorJson.newMapper()); }

    public ResponseDecoder(ObjectMapper mapper) {
        this.mapper = Objects.requireNonNull(mapper, "mapper");
    }

    public ObjectMapper mapper() { return mapper; }

    public <T> T decode(RawResponse resp, ResponseShape<T> shape) {
        Objects.requireNonNull(resp, "resp");
        return decode(resp.getBody(), resp.getStatusCode(), shape);
    }

    public <T> T decode(String body, ResponseShape<T> shape) {
        return decode(body, 200, shape);
    }

    private <T> T decode(String body, int status, ResponseShape<T> shape) {
        Objects.requireNonNull(shape, "shape");
        if (status == 204 || body == null || body.isBlank()) {
            return emptyOrFail(status, shape);
        }
        try {
            JsonNode tree = mapper.readTree(body);
            if (tree == null || tree.isNull() || tree.isMissingNode()) {
                return emptyOrFail(status, shape);
            }
            Object value = mapper.readerFor(shape.javaType(mapper.getTypeFactory())).readValue(tree);
            return shape.wrap(value);
        } catch (JsonProcessingException e) {
            log.warn("decode.failed", "shape", shape.toString(), "reason", e.getOriginalMessage(),
                    "body", StructuredLogger.preview(body, 300));
            throw ApiException.decode(e.getOriginalMessage(), body, e);
        } catch (java.io.IOException e) {
            throw ApiException.decode(String.valueOf(e.getMessage()), body, e);
        }
    }

    private <T> T emptyOrFail(int status, ResponseShape<T> shape) {
        if (shape.requiresContent()) {
            throw ApiException.noContent(status, shape.toString());
        }
        return shape.emptyValue();
    }

    /** Parses a body that callers inspect field by field (auth hops, ad-hoc payloads). */
    public JsonNode tree(String body) {
        if (body == null || body.isBlank()) return mapper.missingNode();
        try {
            return mapper.readTree(body);
        } catch (JsonProcessingException e) {
            throw ApiException.decode(e.getOriginalMessage(), body, e);
        }
    }
}
