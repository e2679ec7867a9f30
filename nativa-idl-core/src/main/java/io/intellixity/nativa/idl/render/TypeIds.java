package io.intellixity.nativa.idl.render;

import io.intellixity.nativa.idl.ast.Type;

/** Canonical, annotation-free ids for {@link Type} shapes (used as lookup keys). */
public final class TypeIds {
  private static final TypeRenderer BARE = TypeRenderer.withoutAnnotations();

  private TypeIds() {}

  /** e.g. {@code map<list<i32>, string>} for {@code map<list<i32>, string> (java.type = "X")}. */
  public static String id(Type t) {
    return BARE.render(t);
  }
}
