package io.arazzolens.core.ir;

import com.google.common.base.Strings;
import org.apache.commons.lang3.StringUtils;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Guesses the HTTP method of an operation from the verbs commonly used in operationIds,
 * e.g. {@code findPetsByStatus} is a GET and {@code createUser} a POST.
 */
public final class HttpMethodHeuristic {

    // checked in order, the first match wins
    private static final List<Map.Entry<String, List<String>>> VERBS = List.of(
            Map.entry("GET", List.of("get", "find", "list", "search", "retrieve", "verify")),
            Map.entry("POST", List.of("post", "create", "place", "add", "log", "upsert")),
            Map.entry("PUT", List.of("put", "update")),
            Map.entry("DELETE", List.of("delete", "remove")),
            Map.entry("PATCH", List.of("patch"))
    );

    public static Optional<String> guess(final String operationId) {
        if (Strings.isNullOrEmpty(operationId)) return Optional.empty();
        // drop a source prefix such as petStore.findPets or $sourceDescriptions.petStore.findPets
        String operation = StringUtils.substringAfterLast(operationId, ".");
        if (operation.isEmpty()) operation = operationId;
        String lowerCase = operation.toLowerCase(Locale.ROOT);

        for (Map.Entry<String, List<String>> verbs : VERBS) {
            if (verbs.getValue().stream().anyMatch(lowerCase::contains)) {
                return Optional.of(verbs.getKey());
            }
        }
        return Optional.empty();
    }

    private HttpMethodHeuristic() {}
}
