package io.intellixity.nativa.idl.json;

/** Discriminator values of the {@code kind} field. */
final class TypeJson {
  static final String BASE = "base";
  static final String MAP = "map";
  static final String LIST = "list";
  static final String SET = "set";
  static final String REF = "ref";

  private TypeJson() {}
}
