package de.vzg.reposis.crossref.util;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.function.Function;

/**
 * Ordered list of tagged accessors. {@link #first(Object)} returns the value of the first accessor
 * that yields a non-empty string, together with its tag.
 *
 * @param <T> the type the accessors read from
 */
public final class PriorityList<T> {

    private final List<Candidate<T>> candidates;

    private PriorityList(List<Candidate<T>> candidates) {
        this.candidates = Collections.unmodifiableList(candidates);
    }

    public static <T> PriorityList<T> of(String tag, Function<T, String> accessor) {
        return new PriorityList<T>(new ArrayList<>()).then(tag, accessor);
    }

    /**
     * @return a new list with one more candidate at the lowest priority
     */
    public PriorityList<T> then(String tag, Function<T, String> accessor) {
        List<Candidate<T>> extended = new ArrayList<>(candidates);
        extended.add(new Candidate<>(tag, accessor));
        return new PriorityList<>(extended);
    }

    public Optional<TaggedValue> first(T source) {
        if (source == null) {
            return Optional.empty();
        }
        for (Candidate<T> candidate : candidates) {
            String value = candidate.accessor().apply(source);
            if (value != null && !value.isEmpty()) {
                return Optional.of(new TaggedValue(candidate.tag(), value));
            }
        }
        return Optional.empty();
    }

    public boolean anyPresent(T source) {
        return first(source).isPresent();
    }

    private record Candidate<T>(String tag, Function<T, String> accessor) {
    }

    public record TaggedValue(String tag, String value) {
    }
}
