package io.intellixity.nativa.idl.render;

import io.intellixity.nativa.idl.ast.Annotation;

import java.util.List;

/**
 * Formats the annotation block that trails a type reference.
 * <p>
 * Implementations return {@code ""} for a null or empty list and otherwise a single
 * parenthesized block, e.g. {@code (a = "b", c = "d")}, preserving list order. The separating
 * space is added by {@link TypeRenderer}.
 * <p>
 * Implementations can be registered in {@code META-INF/nativa-idl.factories} and picked up by
 * {@link TypeRenderer#discover()}.
 */
public interface AnnotationFormatter {
  String format(List<Annotation> annotations);
}
