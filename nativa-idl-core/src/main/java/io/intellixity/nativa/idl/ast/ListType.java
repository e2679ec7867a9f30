package io.intellixity.nativa.idl.ast;

import io.intellixity.nativa.idl.render.TypeRenderer;

import java.util.List;
import java.util.Objects;

/** {@code list<a>}, optionally annotated: {@code list<i64> (cpp.type = "vector")}. */
public record ListType(Type valueType, List<Annotation> annotations) implements Type {
  public ListType {
    Objects.requireNonNull(valueType, "valueType");
    annotations = Annotation.copyOf(annotations);
  }

  public ListType(Type valueType) {
    this(valueType, List.of());
  }

  @Override
  public <R> R accept(TypeVisitor<R> visitor) { return visitor.visit(this); }

  @Override
  public String toString() { return TypeRenderer.DEFAULT.render(this); }
}
