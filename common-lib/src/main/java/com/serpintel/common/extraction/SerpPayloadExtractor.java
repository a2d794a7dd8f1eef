package com.serpintel.common.extraction;

import com.fasterxml.jackson.databind.JsonNode;
import com.serpintel.common.model.RankedResult;

import java.net.URI;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Pure stateless extraction of organic results and SERP feature tags from a
 * raw provider payload.
 *
 * <p>Two payload shapes are recognised, checked in order:
 * <ol>
 *   <li>provider {@code items[]}: organic entries have {@code type == "organic"}
 *       and a string {@code url}; every other item type is a feature tag</li>
 *   <li>simple {@code results[]} / {@code features[]}: any object with a string
 *       {@code url} is a result; features are strings or objects with a
 *       {@code type}</li>
 * </ol>
 *
 * <p>Results are ordered rank ascending (nulls last) then url ascending, and a
 * URL that appears twice keeps its first (lowest-rank) entry.
 *
 * <p>No logging. No side-effects.
 */
public final class SerpPayloadExtractor {

    private static final Comparator<RankedResult> RESULT_ORDER = Comparator
        .comparing(RankedResult::rank, Comparator.nullsLast(Comparator.<Integer>naturalOrder()))
        .thenComparing(RankedResult::url);

    private SerpPayloadExtractor() {}

    /**
     * Extract organic results.
     *
     * @param payload raw payload; null or non-object payloads yield a parse warning
     */
    public static ExtractionResult extractResults(JsonNode payload) {
        if (payload == null || !payload.isObject()) {
            return new ExtractionResult(List.of(), true);
        }

        JsonNode items = payload.get("items");
        if (items != null && items.isArray()) {
            List<RankedResult> organic = new ArrayList<>();
            for (JsonNode item : items) {
                if (item.isObject()
                        && "organic".equals(textOrNull(item.get("type")))
                        && isText(item.get("url"))) {
                    organic.add(toResult(item, "rank_absolute", "position"));
                }
            }
            boolean parseWarning = organic.isEmpty() && items.size() > 0;
            return new ExtractionResult(dedupe(organic), parseWarning);
        }

        JsonNode results = payload.get("results");
        if (results != null && results.isArray()) {
            List<RankedResult> simple = new ArrayList<>();
            for (JsonNode item : results) {
                if (item.isObject() && isText(item.get("url"))) {
                    simple.add(toResult(item, "rank", "position"));
                }
            }
            return new ExtractionResult(dedupe(simple), false);
        }

        return new ExtractionResult(List.of(), true);
    }

    /**
     * Extract the set of non-organic feature tags, ascending.
     */
    public static SortedSet<String> extractFeatures(JsonNode payload) {
        SortedSet<String> types = new TreeSet<>();
        if (payload == null || !payload.isObject()) {
            return types;
        }

        JsonNode items = payload.get("items");
        if (items != null && items.isArray()) {
            for (JsonNode item : items) {
                String type = item.isObject() ? textOrNull(item.get("type")) : null;
                if (type != null && !type.isEmpty() && !"organic".equals(type)) {
                    types.add(type);
                }
            }
            return types;
        }

        JsonNode features = payload.get("features");
        if (features != null && features.isArray()) {
            for (JsonNode f : features) {
                String type = f.isTextual() ? f.asText()
                    : f.isObject() ? textOrNull(f.get("type")) : null;
                if (type != null && !type.isEmpty()) {
                    types.add(type);
                }
            }
        }
        return types;
    }

    // ── helpers ────────────────────────────────────────────────────────────

    private static RankedResult toResult(JsonNode item, String primaryRank, String fallbackRank) {
        String url = item.get("url").asText();
        String domain = isText(item.get("domain")) ? item.get("domain").asText() : domainOf(url);
        Integer rank = rankOf(item.get(primaryRank));
        if (rank == null) {
            rank = rankOf(item.get(fallbackRank));
        }
        return new RankedResult(url, domain, rank, textOrNull(item.get("title")));
    }

    private static List<RankedResult> dedupe(List<RankedResult> results) {
        results.sort(RESULT_ORDER);
        Map<String, RankedResult> firstByUrl = new LinkedHashMap<>();
        for (RankedResult r : results) {
            firstByUrl.putIfAbsent(r.url(), r);
        }
        return new ArrayList<>(firstByUrl.values());
    }

    private static Integer rankOf(JsonNode node) {
        return node != null && node.isNumber() ? node.intValue() : null;
    }

    private static boolean isText(JsonNode node) {
        return node != null && node.isTextual();
    }

    private static String textOrNull(JsonNode node) {
        return isText(node) ? node.asText() : null;
    }

    private static String domainOf(String url) {
        try {
            return URI.create(url).getHost();
        } catch (IllegalArgumentException e) {
            return null;
        }
    }
}
