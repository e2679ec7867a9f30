package io.intellixity.nativa.idl.ast;

import java.util.Objects;

/** References a user-defined type (struct, enum, typedef, ...) by name. */
public record TypeReference(String name, int line) implements Type {
  public TypeReference {
    Objects.requireNonNull(name, "name");
  }

  @Override
  public <R> R accept(TypeVisitor<R> visitor) { return visitor.visit(this); }

  @Override
  public String toString() { return name; }
}
