package io.xmin.replication.model.schema;

import java.nio.charset.StandardCharsets;
import java.util.Collection;
import java.util.stream.Collectors;

public final class Identifiers {
    private static final int MAX_IDENTIFIER_BYTES = 63;

    private Identifiers() {
    }

    public static String validate(String identifier) {
        if (identifier == null || identifier.isEmpty()) {
            throw new IllegalArgumentException("identifier must not be empty");
        }

        if (identifier.indexOf('\0') >= 0) {
            throw new IllegalArgumentException(String.format("identifier contains a NUL character: %s", identifier));
        }

        if (identifier.getBytes(StandardCharsets.UTF_8).length > Identifiers.MAX_IDENTIFIER_BYTES) {
            throw new IllegalArgumentException(String.format("identifier longer than %d bytes: %s", Identifiers.MAX_IDENTIFIER_BYTES, identifier));
        }

        return identifier;
    }

    public static String quote(String identifier) {
        return "\"" + Identifiers.validate(identifier).replace("\"", "\"\"") + "\"";
    }

    public static String quoteAll(Collection<String> identifiers) {
        return identifiers.stream().map(Identifiers::quote).collect(Collectors.joining(", "));
    }
}
