package io.intellixity.nativa.idl.ast;

import io.intellixity.nativa.idl.render.TypeRenderer;

import java.util.List;
import java.util.Objects;

/** {@code set<a>}, optionally annotated: {@code set<string> (js.type = "list")}. */
public record SetType(Type valueType, List<Annotation> annotations) implements Type {
  public SetType {
    Objects.requireNonNull(valueType, "valueType");
    annotations = Annotation.copyOf(annotations);
  }

  public SetType(Type valueType) {
    this(valueType, List.of());
  }

  @Override
  public <R> R accept(TypeVisitor<R> visitor) { return visitor.visit(this); }

  @Override
  public String toString() { return TypeRenderer.DEFAULT.render(this); }
}
