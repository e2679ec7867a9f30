package io.intellixity.nativa.idl.render;

import io.intellixity.nativa.idl.ast.Annotation;

import java.util.List;
import java.util.stream.Collectors;

/** Registered in the test {@code nativa-idl.factories}; renders only annotation names. */
public final class KeysOnlyAnnotationFormatter implements AnnotationFormatter {
  @Override
  public String format(List<Annotation> annotations) {
    if (annotations == null || annotations.isEmpty()) return "";
    return annotations.stream().map(Annotation::name).collect(Collectors.joining(", ", "(", ")"));
  }
}
