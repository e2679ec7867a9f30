package io.intellixity.nativa.idl.ast;

import io.intellixity.nativa.idl.render.TypeRenderer;

import java.util.List;
import java.util.Objects;

/** {@code map<k, v>}, optionally annotated: {@code map<string, list<i32>> (java.type = "MultiMap")}. */
public record MapType(Type keyType, Type valueType, List<Annotation> annotations) implements Type {
  public MapType {
    Objects.requireNonNull(keyType, "keyType");
    Objects.requireNonNull(valueType, "valueType");
    annotations = Annotation.copyOf(annotations);
  }

  public MapType(Type keyType, Type valueType) {
    this(keyType, valueType, List.of());
  }

  @Override
  public <R> R accept(TypeVisitor<R> visitor) { return visitor.visit(this); }

  @Override
  public String toString() { return TypeRenderer.DEFAULT.render(this); }
}
