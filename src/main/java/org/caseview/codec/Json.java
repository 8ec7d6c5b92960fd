package org.caseview.codec;

import com.fasterxml.jackson.core.json.JsonReadFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;

/**
 * Shared Jackson mapper for stored JSON text.
 * <p>
 * Recorders write {@code NaN} and {@code Infinity} as bare tokens, so
 * non-numeric numbers are accepted.
 */
public final class Json {

    public static final ObjectMapper MAPPER = JsonMapper.builder()
        .enable(JsonReadFeature.ALLOW_NON_NUMERIC_NUMBERS)
        .build();

    private Json() {}
}
