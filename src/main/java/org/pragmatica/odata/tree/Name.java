package org.pragmatica.odata.tree;

import java.util.List;

/**
 * Simple or namespace-qualified name.
 */
public sealed interface Name {

    /**
     * Name segments in source order.
     */
    List<String> segments();

    /**
     * Dot-joined form of the name.
     */
    default String fullName() {
        return String.join(".", segments());
    }

    /**
     * Build a name from its segments, collapsing a single segment to {@link Identifier}.
     */
    static Name of(List<String> segments) {
        if (segments.isEmpty()) {
            throw new IllegalArgumentException("Name requires at least one segment");
        }
        return segments.size() == 1
               ? new Identifier(segments.get(0))
               : new Qualified(segments);
    }

    record Identifier(String name) implements Name {
        public Identifier {
            if (name == null || name.isEmpty()) {
                throw new IllegalArgumentException("Identifier must not be empty");
            }
        }

        @Override
        public List<String> segments() {
            return List.of(name);
        }
    }

    /**
     * Two or more identifiers separated by dots.
     */
    record Qualified(List<String> segments) implements Name {
        public Qualified {
            if (segments == null || segments.size() < 2) {
                throw new IllegalArgumentException("Qualified name requires at least two segments");
            }
            segments = List.copyOf(segments);
        }

        public String namespace() {
            return String.join(".", segments.subList(0, segments.size() - 1));
        }

        public String name() {
            return segments.get(segments.size() - 1);
        }
    }
}
