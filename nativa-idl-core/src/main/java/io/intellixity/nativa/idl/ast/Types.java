package io.intellixity.nativa.idl.ast;

import java.util.List;

/** Static factories for building type trees by hand. */
public final class Types {
  private Types() {}

  public static BaseType bool() { return new BaseType(BaseTypeId.BOOL); }
  public static BaseType byteType() { return new BaseType(BaseTypeId.BYTE); }
  public static BaseType i16() { return new BaseType(BaseTypeId.I16); }
  public static BaseType i32() { return new BaseType(BaseTypeId.I32); }
  public static BaseType i64() { return new BaseType(BaseTypeId.I64); }
  public static BaseType doubleType() { return new BaseType(BaseTypeId.DOUBLE); }
  public static BaseType string() { return new BaseType(BaseTypeId.STRING); }
  public static BaseType binary() { return new BaseType(BaseTypeId.BINARY); }

  public static BaseType base(BaseTypeId id, Annotation... annotations) {
    return new BaseType(id, List.of(annotations));
  }

  public static MapType map(Type key, Type value, Annotation... annotations) {
    return new MapType(key, value, List.of(annotations));
  }

  public static ListType list(Type element, Annotation... annotations) {
    return new ListType(element, List.of(annotations));
  }

  public static SetType set(Type element, Annotation... annotations) {
    return new SetType(element, List.of(annotations));
  }

  public static TypeReference ref(String name) {
    return new TypeReference(name, 0);
  }

  public static TypeReference ref(String name, int line) {
    return new TypeReference(name, line);
  }

  public static Annotation annotation(String name, String value) {
    return new Annotation(name, value);
  }

  /** Annotations of the given type; {@link TypeReference} never carries any. */
  public static List<Annotation> annotationsOf(Type type) {
    return type.accept(new TypeVisitor<>() {
      @Override public List<Annotation> visit(BaseType t) { return t.annotations(); }
      @Override public List<Annotation> visit(MapType t) { return t.annotations(); }
      @Override public List<Annotation> visit(ListType t) { return t.annotations(); }
      @Override public List<Annotation> visit(SetType t) { return t.annotations(); }
      @Override public List<Annotation> visit(TypeReference t) { return List.of(); }
    });
  }
}
