package io.intellixity.nativa.idl.ast;

public interface TypeVisitor<R> {
  R visit(BaseType type);
  R visit(MapType type);
  R visit(ListType type);
  R visit(SetType type);
  R visit(TypeReference type);
}
