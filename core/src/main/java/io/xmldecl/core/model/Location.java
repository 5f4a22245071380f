package io.xmldecl.core.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * The root-relative path of elements traversed so far, e.g. {@code
 * genre-authors/authors/author[1]/name}. Used for error attribution and exposed read-only to
 * hooks through {@link ProcessorState}.
 *
 * <p>Descending returns a new instance; a location captured in a failure never changes.
 *
 * <p>Thread-safe and immutable.
 */
public final class Location {

    private static final Location ROOT = new Location(List.of());

    private final List<String> segments;

    private Location(List<String> segments) {
        this.segments = segments;
    }

    /** The empty location, before the document root has been entered. */
    public static Location root() {
        return ROOT;
    }

    /** Returns a location one element deeper. */
    public Location child(String name) {
        List<String> next = new ArrayList<>(segments.size() + 1);
        next.addAll(segments);
        next.add(name);
        return new Location(Collections.unmodifiableList(next));
    }

    /** Returns a location for each step of {@code names}, in order. */
    public Location descend(List<String> names) {
        Location location = this;
        for (String name : names) {
            location = location.child(name);
        }
        return location;
    }

    /** Returns a location for the {@code index}-th array item element named {@code name}. */
    public Location item(String name, int index) {
        return child(name + "[" + index + "]");
    }

    /** The traversed segments, outermost first. */
    public List<String> segments() {
        return segments;
    }

    /** True if nothing has been traversed yet. */
    public boolean isEmpty() {
        return segments.isEmpty();
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof Location other && segments.equals(other.segments);
    }

    @Override
    public int hashCode() {
        return segments.hashCode();
    }

    /** Slash-joined rendering, e.g. {@code author/birth-year}. */
    @Override
    public String toString() {
        return String.join("/", segments);
    }
}
