package org.celconform.translate;

import java.util.Objects;

/**
 * The annotation an evaluation environment receives for one declared name.
 */
public sealed interface TypeAnnotation permits TypeAnnotation.Declared, TypeAnnotation.Prebuilt {

    /**
     * A type given by its textual identifier, e.g. {@code INT64} or {@code Map[STRING, INT64]}.
     * Interpreting the text is up to the evaluator.
     */
    record Declared(String text) implements TypeAnnotation {
        public Declared {
            Objects.requireNonNull(text, "text");
        }
    }

    /**
     * An opaque runtime value supplied in place of a type declaration.
     */
    record Prebuilt(Object instance) implements TypeAnnotation {
        public Prebuilt {
            Objects.requireNonNull(instance, "instance");
        }
    }
}
