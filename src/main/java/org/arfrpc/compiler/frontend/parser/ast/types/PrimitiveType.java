package org.arfrpc.compiler.frontend.parser.ast.types;

import java.util.Arrays;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * The fixed set of scalar types.
 */
public enum PrimitiveType {
    INT8("int8"),
    INT16("int16"),
    INT32("int32"),
    INT64("int64"),
    UINT8("uint8"),
    UINT16("uint16"),
    UINT32("uint32"),
    UINT64("uint64"),
    FLOAT32("float32"),
    FLOAT64("float64"),
    BOOL("bool"),
    STRING("string"),
    BYTES("bytes"),
    TIMESTAMP("timestamp");

    private static final Map<String, PrimitiveType> BY_KEYWORD = Arrays.stream(values())
            .collect(Collectors.toUnmodifiableMap(PrimitiveType::keyword, Function.identity()));

    private final String keyword;

    PrimitiveType(String keyword) {
        this.keyword = keyword;
    }

    public String keyword() {
        return keyword;
    }

    public static Optional<PrimitiveType> fromKeyword(String text) {
        return Optional.ofNullable(BY_KEYWORD.get(text));
    }
}
