package io.intellixity.nativa.idl.render;

import io.intellixity.nativa.idl.ast.*;
import org.junit.jupiter.api.Test;

import java.util.List;

import static io.intellixity.nativa.idl.ast.Types.*;
import static org.junit.jupiter.api.Assertions.*;

final class TypeRendererTest {
  private static final TypeRenderer R = TypeRenderer.DEFAULT;

  @Test
  void baseTypes_renderKeyword() {
    assertEquals("bool", R.render(bool()));
    assertEquals("byte", R.render(byteType()));
    assertEquals("i16", R.render(i16()));
    assertEquals("i32", R.render(i32()));
    assertEquals("i64", R.render(i64()));
    assertEquals("double", R.render(doubleType()));
    assertEquals("string", R.render(string()));
    assertEquals("binary", R.render(binary()));
  }

  @Test
  void baseType_withAnnotations_appendsBlock() {
    assertEquals("bool (go.type = \"int\")", R.render(base(BaseTypeId.BOOL, annotation("go.type", "int"))));
  }

  @Test
  void nestedContainers_preserveStructure() {
    assertEquals("map<list<i32>, string>", R.render(map(list(i32()), string())));
    assertEquals("list<map<string, set<UserProfile>>>", R.render(list(map(string(), set(ref("UserProfile"))))));
  }

  @Test
  void set_withAnnotation() {
    assertEquals("set<string> (js.type = \"list\")", R.render(set(string(), annotation("js.type", "list"))));
  }

  @Test
  void list_withAnnotation() {
    assertEquals("list<i64> (cpp.type = \"vector\")", R.render(list(i64(), annotation("cpp.type", "vector"))));
  }

  @Test
  void annotations_keepSourceOrder() {
    Type t = map(string(), i32(), annotation("z", "1"), annotation("a", "2"));
    assertEquals("map<string, i32> (z = \"1\", a = \"2\")", R.render(t));
  }

  @Test
  void innerAnnotations_stayOnInnerType() {
    Type t = list(set(i16(), annotation("inner", "x")), annotation("outer", "y"));
    assertEquals("list<set<i16> (inner = \"x\")> (outer = \"y\")", R.render(t));
  }

  @Test
  void typeReference_ignoresLine() {
    assertEquals("UserProfile", R.render(ref("UserProfile", 1)));
    assertEquals("UserProfile", R.render(ref("UserProfile", 999)));
  }

  @Test
  void emptyAnnotations_neverEmitBlock() {
    for (Type t : List.of(i32(), map(i32(), i32()), list(i32()), set(i32()),
        new ListType(i32(), List.of()))) {
      assertFalse(R.render(t).contains("("), t::toString);
    }
  }

  @Test
  void rendering_isDeterministic() {
    Type a = map(list(i32(), annotation("k", "v")), ref("X", 3));
    Type b = map(list(i32(), annotation("k", "v")), ref("X", 8));
    assertEquals(R.render(a), R.render(a));
    assertEquals(R.render(a), R.render(b));
  }

  @Test
  void customFormatter_isUsedForEveryLevel() {
    TypeRenderer keys = TypeRenderer.using(new KeysOnlyAnnotationFormatter());
    Type t = map(base(BaseTypeId.STRING, annotation("a", "1")), list(i32(), annotation("b", "2")), annotation("c", "3"));
    assertEquals("map<string (a), list<i32> (b)> (c)", keys.render(t));
  }

  @Test
  void formatterReturningEmpty_emitsNoSeparator() {
    TypeRenderer silent = TypeRenderer.using(annotations -> "");
    assertEquals("set<binary>", silent.render(set(binary(), annotation("k", "v"))));
  }
}
