package io.xmldecl.core.model;

import java.util.List;

/**
 * A processor whose value is composed of named child values: a map, a user object or a record.
 * All aggregates share the same traversal and differ only in how the value is built and read.
 */
public sealed interface AggregateProcessor extends Processor
        permits DictionaryProcessor, UserObjectProcessor, NamedTupleProcessor {

    /** Child processors in declaration order. */
    List<Processor> children();
}
