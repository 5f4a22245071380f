package io.xmldecl.core.engine;

import io.xmldecl.core.spi.TreeReader;
import io.xmldecl.core.spi.TreeWriter;
import java.util.List;
import java.util.Optional;

/**
 * Resolves the named steps of a {@link io.xmldecl.core.model.PathExpression} relative to a
 * context element. An empty step list (the {@code "."} selector) resolves to the context itself.
 *
 * <p>When several children share a name at a step, the first one wins; iteration over repeated
 * elements belongs to the array processor.
 *
 * <p>Thread-safe: stateless utility class.
 */
public final class PathResolver {

    private PathResolver() {}

    /**
     * Follows {@code names} from {@code context} for decoding.
     *
     * @return the target element, or empty if any step is missing
     */
    public static <N> Optional<N> resolve(TreeReader<N> reader, N context, List<String> names) {
        N current = context;
        for (String name : names) {
            Optional<N> next = reader.child(current, name);
            if (next.isEmpty()) {
                return Optional.empty();
            }
            current = next.get();
        }
        return Optional.of(current);
    }

    /**
     * Follows {@code names} from {@code context} for encoding, appending any element that does not
     * exist yet.
     *
     * @return the target element, never null
     */
    public static <N> N resolveOrCreate(TreeWriter<N> writer, N context, List<String> names) {
        N current = context;
        for (String name : names) {
            Optional<N> existing = writer.child(current, name);
            current = existing.isPresent() ? existing.get() : writer.appendChild(current, name);
        }
        return current;
    }

    /** All steps but the last; the steps leading to a repeated item element. */
    static List<String> parentSteps(List<String> names) {
        return names.isEmpty() ? names : names.subList(0, names.size() - 1);
    }

    /** The last step; the name of a repeated item element. */
    static String lastStep(List<String> names) {
        return names.get(names.size() - 1);
    }
}
