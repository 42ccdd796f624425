package io.mnet.rpc;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeType;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Expected values of one remote call. Each parameter names a comma-separated list of
 * accepted JSON types ({@code string}, {@code number}, {@code boolean}, {@code array},
 * {@code object}, {@code null}) or {@code any}. A null list leaves that side unchecked.
 *
 * <p>Read from JSON as {@code {"arguments": [{"name": "x", "types": "number"}], "results": null}}.
 */
public record CallDeclaration(List<Parameter> arguments, List<Parameter> results) {
    static final String ANY = "any";
    private static final Set<String> TYPE_NAMES = Set.of("string", "number", "boolean", "array", "object", "null");

    public CallDeclaration {
        arguments = arguments == null ? null : Collections.unmodifiableList(new ArrayList<>(arguments));
        results = results == null ? null : Collections.unmodifiableList(new ArrayList<>(results));
        validate(arguments, "argument");
        validate(results, "result");
    }

    public static CallDeclaration untyped() {
        return new CallDeclaration(null, null);
    }

    /**
     * Up to {@code count} arguments of any type, or any number of arguments for -1.
     */
    public static CallDeclaration ofArgumentCount(int count) {
        if (count < 0) {
            return untyped();
        }
        List<Parameter> arguments = new ArrayList<>(count);
        for (int i = 1; i <= count; i++) {
            arguments.add(new Parameter("arg" + i, ANY));
        }
        return new CallDeclaration(arguments, null);
    }

    void checkArguments(String callName, List<JsonNode> values) {
        check(callName, arguments, values, "argument");
    }

    void checkResults(String callName, List<JsonNode> values) {
        check(callName, results, values, "result");
    }

    private static void check(String callName, List<Parameter> expected, List<JsonNode> values, String kind) {
        if (expected == null) {
            return;
        }
        if (values.size() > expected.size()) {
            throw new IllegalArgumentException("Number of " + kind + "s for call to \"" + callName
                    + "\" is incorrect (" + expected.size() + " expected, got " + values.size() + ")");
        }
        for (int i = 0; i < expected.size(); i++) {
            Parameter parameter = expected.get(i);
            String actual = i < values.size() ? typeName(values.get(i)) : "null";
            if (!parameter.accepts(actual)) {
                throw new IllegalArgumentException("Bad " + kind + " for call to \"" + callName + "\" at index #"
                        + (i + 1) + " (" + parameter.types() + " expected, got " + actual + ")");
            }
        }
    }

    static String typeName(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return "null";
        }
        JsonNodeType type = node.getNodeType();
        return type == JsonNodeType.BINARY || type == JsonNodeType.POJO
                ? "object"
                : type.name().toLowerCase(Locale.ROOT);
    }

    private static void validate(List<Parameter> parameters, String kind) {
        if (parameters == null) {
            return;
        }
        for (int i = 0; i < parameters.size(); i++) {
            Parameter parameter = parameters.get(i);
            if (parameter == null || parameter.types() == null || parameter.types().isBlank()) {
                throw new IllegalArgumentException(kind + " definition at index #" + (i + 1) + " must name its types");
            }
            if (ANY.equals(parameter.types().trim())) {
                continue;
            }
            for (String token : parameter.types().split(",")) {
                if (!TYPE_NAMES.contains(token.trim())) {
                    throw new IllegalArgumentException("Unknown type \"" + token.trim() + "\" in " + kind
                            + " definition at index #" + (i + 1));
                }
            }
        }
    }

    /**
     * @param name describes the value, not checked
     */
    public record Parameter(String name, String types) {

        boolean accepts(String typeName) {
            String trimmed = types.trim();
            if (ANY.equals(trimmed)) {
                return true;
            }
            for (String token : trimmed.split(",")) {
                if (token.trim().equals(typeName)) {
                    return true;
                }
            }
            return false;
        }
    }
}
