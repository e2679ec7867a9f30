package io.intellixity.nativa.idl.ast;

import io.intellixity.nativa.idl.render.TypeRenderer;

import java.util.List;
import java.util.Objects;

/**
 * A reference to a Thrift base type.
 *
 * <pre>
 *   bool, byte, i16, i32, i64, double, string, binary
 * </pre>
 *
 * May be followed by type annotations: {@code bool (go.type = "int")}.
 */
public record BaseType(BaseTypeId id, List<Annotation> annotations) implements Type {
  public BaseType {
    Objects.requireNonNull(id, "id");
    annotations = Annotation.copyOf(annotations);
  }

  public BaseType(BaseTypeId id) {
    this(id, List.of());
  }

  @Override
  public <R> R accept(TypeVisitor<R> visitor) { return visitor.visit(this); }

  @Override
  public String toString() { return TypeRenderer.DEFAULT.render(this); }
}
