package com.tracker.resolution.api;

import com.tracker.resolution.core.model.Candidate;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.function.Function;

/**
 * Two-pass, case-insensitive name matching over a directory list: exact match
 * on any of an entry's keys first, then substring match on its name when the
 * exact pass found nothing. Candidates are deduplicated by ID.
 */
final class NameMatcher {

    private NameMatcher() {
    }

    /**
     * Result of a lookup.
     *
     * @param candidates matching entries, in directory order
     * @param exact      true if the candidates come from the exact pass
     */
    record Result(List<Candidate> candidates, boolean exact) {
    }

    static <T> Result match(List<T> entries, String query,
                            Function<T, Candidate> toCandidate,
                            Function<T, List<String>> exactKeys) {
        String needle = query.toLowerCase(Locale.ROOT);

        Map<Integer, Candidate> exact = new LinkedHashMap<>();
        for (T entry : entries) {
            for (String key : exactKeys.apply(entry)) {
                if (key != null && key.toLowerCase(Locale.ROOT).equals(needle)) {
                    Candidate candidate = toCandidate.apply(entry);
                    exact.putIfAbsent(candidate.id(), candidate);
                    break;
                }
            }
        }
        if (!exact.isEmpty()) {
            return new Result(new ArrayList<>(exact.values()), true);
        }

        Map<Integer, Candidate> partial = new LinkedHashMap<>();
        for (T entry : entries) {
            Candidate candidate = toCandidate.apply(entry);
            if (candidate.name() != null && candidate.name().toLowerCase(Locale.ROOT).contains(needle)) {
                partial.putIfAbsent(candidate.id(), candidate);
            }
        }
        return new Result(new ArrayList<>(partial.values()), false);
    }

    /**
     * Matches entries that are plain (id, name) pairs by name.
     */
    static Result byName(List<Candidate> entries, String query) {
        return match(entries, query, Function.identity(), c -> Collections.singletonList(c.name()));
    }

    /**
     * Exact pass only; used where no substring fallback applies.
     */
    static <T> List<Candidate> exactOnly(List<T> entries, String query, Function<T, Candidate> toCandidate) {
        String needle = query.toLowerCase(Locale.ROOT);
        Map<Integer, Candidate> exact = new LinkedHashMap<>();
        for (T entry : entries) {
            Candidate candidate = toCandidate.apply(entry);
            if (candidate.name() != null && candidate.name().toLowerCase(Locale.ROOT).equals(needle)) {
                exact.putIfAbsent(candidate.id(), candidate);
            }
        }
        return new ArrayList<>(exact.values());
    }
}
