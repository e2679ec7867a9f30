package io.intellixity.nativa.idl.ast;

/** Primitive types supported by Thrift, with their IDL keyword. */
public enum BaseTypeId {
  BOOL(1, "bool"),
  BYTE(2, "byte"),
  I16(3, "i16"),
  I32(4, "i32"),
  I64(5, "i64"),
  DOUBLE(6, "double"),
  STRING(7, "string"),
  BINARY(8, "binary");

  private final int code;
  private final String keyword;

  BaseTypeId(int code, String keyword) {
    this.code = code;
    this.keyword = keyword;
  }

  public int code() { return code; }
  public String keyword() { return keyword; }

  /**
   * Looks up an id by its numeric code.
   * <p>
   * Codes are produced by the parser, never by users, so an unknown code is a bug in the caller
   * and fails with an {@link AssertionError} rather than an exception meant to be handled.
   */
  public static BaseTypeId fromCode(int code) {
    for (BaseTypeId id : values()) {
      if (id.code == code) return id;
    }
    throw new AssertionError("unknown base type code " + code);
  }

  /** Inverse of {@link #keyword()}; used when reading external input such as JSON. */
  public static BaseTypeId fromKeyword(String keyword) {
    for (BaseTypeId id : values()) {
      if (id.keyword.equals(keyword)) return id;
    }
    throw new IllegalArgumentException("Unknown base type keyword: " + keyword);
  }
}
