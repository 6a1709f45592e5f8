package org.arfrpc.compiler.frontend.parser;

import org.arfrpc.compiler.frontend.parser.ast.types.PrimitiveType;

import java.util.Arrays;
import java.util.HashSet;
import java.util.Set;

/**
 * Reserved words of the IDL. Declaration keywords, type constructors and every
 * primitive type name are reserved and cannot be used as names.
 */
public final class Keywords {

    public static final String PACKAGE = "package";
    public static final String IMPORT = "import";
    public static final String AS = "as";
    public static final String STRUCT = "struct";
    public static final String ENUM = "enum";
    public static final String UNION = "union";
    public static final String SERVICE = "service";
    public static final String STREAM = "stream";
    public static final String MAP = "map";
    public static final String ARRAY = "array";
    public static final String OPTIONAL = "optional";

    private static final Set<String> RESERVED;

    static {
        Set<String> reserved = new HashSet<>(Set.of(
                PACKAGE, IMPORT, AS, STRUCT, ENUM, UNION, SERVICE, STREAM, MAP, ARRAY, OPTIONAL));
        Arrays.stream(PrimitiveType.values()).map(PrimitiveType::keyword).forEach(reserved::add);
        RESERVED = Set.copyOf(reserved);
    }

    private Keywords() {
        // Utility class
    }

    /**
     * @param name A candidate name.
     * @return true if the name is a reserved word.
     */
    public static boolean isReserved(String name) {
        return RESERVED.contains(name);
    }
}
