package io.xmldecl.core.engine;

import io.xmldecl.core.error.InvalidRootProcessorException;
import io.xmldecl.core.model.AggregateProcessor;
import io.xmldecl.core.model.ArrayProcessor;
import io.xmldecl.core.model.Processor;

/**
 * Checks that a processor can describe a whole document: an aggregate or a nested array whose
 * path starts with the name of the document's root element.
 */
final class RootValidator {

    private RootValidator() {}

    static void requireRoot(Processor processor) {
        if (processor == null) {
            throw new InvalidRootProcessorException("Root processor must not be null");
        }
        if (processor instanceof ArrayProcessor array && array.isEmbedded()) {
            throw new InvalidRootProcessorException(
                    "Non-nested array on '" + array.path() + "' cannot be the root processor");
        }
        if (!(processor instanceof ArrayProcessor) && !(processor instanceof AggregateProcessor)) {
            throw new InvalidRootProcessorException(
                    "Primitive processor on '" + processor.path() + "' cannot be the root processor");
        }
        if (processor.path().isSelf()) {
            throw new InvalidRootProcessorException("Root processor must name the root element, not '.'");
        }
    }
}
