package io.xmldecl.core.model;

import io.xmldecl.core.error.InvalidRootProcessorException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * A parsed element selector: either {@code "."} (the context element itself) or one or more
 * element names joined by {@code "/"} ({@code "location/coordinates/lat"}).
 *
 * <p>Constructed once when a processor is declared; never empty.
 *
 * <p>Thread-safe and immutable.
 */
public record PathExpression(List<Segment> segments) {

    private static final PathExpression SELF = new PathExpression(List.of(Segment.Self.INSTANCE));

    /** Canonical constructor with validation and a defensive copy. */
    public PathExpression {
        if (segments == null || segments.isEmpty()) {
            throw new InvalidRootProcessorException("Path expression must have at least one segment");
        }
        segments = List.copyOf(segments);
        if (segments.size() > 1 && segments.stream().anyMatch(s -> s instanceof Segment.Self)) {
            throw new InvalidRootProcessorException(
                    "'.' cannot be combined with named steps: " + render(segments));
        }
    }

    /**
     * Parses a selector string.
     *
     * @param path the selector, e.g. {@code "."}, {@code "author"} or {@code "root/places"}
     * @return the parsed expression
     * @throws InvalidRootProcessorException if the string is null, blank, or contains an empty step
     */
    public static PathExpression parse(String path) {
        if (path == null || path.isBlank()) {
            throw new InvalidRootProcessorException("Path must not be empty");
        }
        String trimmed = path.trim();
        if (trimmed.equals(".")) {
            return SELF;
        }
        List<Segment> segments = new ArrayList<>();
        for (String step : trimmed.split("/", -1)) {
            String name = step.trim();
            if (name.isEmpty()) {
                throw new InvalidRootProcessorException("Empty step in path: '" + path + "'");
            }
            segments.add(name.equals(".") ? Segment.Self.INSTANCE : new Segment.Named(name));
        }
        return new PathExpression(segments);
    }

    /** Returns the {@code "."} expression. */
    public static PathExpression self() {
        return SELF;
    }

    /** True if this expression is the self selector. */
    public boolean isSelf() {
        return segments.get(0) instanceof Segment.Self;
    }

    /** Returns the name of the last step, or empty for the self selector. */
    public Optional<String> lastName() {
        Segment last = segments.get(segments.size() - 1);
        return last instanceof Segment.Named named ? Optional.of(named.name()) : Optional.empty();
    }

    /** Returns the name of the first step, or empty for the self selector. */
    public Optional<String> firstName() {
        return segments.get(0) instanceof Segment.Named named ? Optional.of(named.name()) : Optional.empty();
    }

    /** Returns the named steps of this expression (empty for the self selector). */
    public List<String> names() {
        List<String> names = new ArrayList<>(segments.size());
        for (Segment segment : segments) {
            if (segment instanceof Segment.Named named) {
                names.add(named.name());
            }
        }
        return names;
    }

    @Override
    public String toString() {
        return render(segments);
    }

    private static String render(List<Segment> segments) {
        return segments.stream().map(Segment::text).collect(Collectors.joining("/"));
    }
}
