package io.intellixity.nativa.idl.render;

import org.junit.jupiter.api.Test;

import static io.intellixity.nativa.idl.ast.Types.*;
import static org.junit.jupiter.api.Assertions.*;

final class TypeIdsTest {

  @Test
  void id_dropsAnnotationsAtEveryLevel() {
    assertEquals("map<list<i32>, string>",
        TypeIds.id(map(list(i32(), annotation("a", "1")), string(), annotation("java.type", "MultiMap"))));
  }

  @Test
  void id_matchesRenderingWhenUnannotated() {
    var t = set(map(ref("Key", 4), binary()));
    assertEquals(TypeRenderer.DEFAULT.render(t), TypeIds.id(t));
  }
}
