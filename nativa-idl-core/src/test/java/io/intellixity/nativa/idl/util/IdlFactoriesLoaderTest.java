package io.intellixity.nativa.idl.util;

import io.intellixity.nativa.idl.render.AnnotationFormatter;
import io.intellixity.nativa.idl.render.DefaultAnnotationFormatter;
import io.intellixity.nativa.idl.render.KeysOnlyAnnotationFormatter;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

final class IdlFactoriesLoaderTest {
  interface Probe {}
  interface Missing {}
  interface Unregistered {}

  private final ClassLoader cl = getClass().getClassLoader();

  @Test
  void load_dedupesAndKeepsOrder() {
    List<AnnotationFormatter> found = IdlFactoriesLoader.load(AnnotationFormatter.class, cl);
    assertEquals(2, found.size());
    assertInstanceOf(KeysOnlyAnnotationFormatter.class, found.get(0));
    assertInstanceOf(DefaultAnnotationFormatter.class, found.get(1));
  }

  @Test
  void load_unregisteredSpi_isEmpty() {
    assertTrue(IdlFactoriesLoader.load(Unregistered.class, cl).isEmpty());
  }

  @Test
  void load_wrongImplementationType_isRejected() {
    IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
        () -> IdlFactoriesLoader.load(Probe.class, cl));
    assertTrue(e.getMessage().contains("java.lang.String"));
  }

  @Test
  void load_missingClass_isReported() {
    IllegalStateException e = assertThrows(IllegalStateException.class,
        () -> IdlFactoriesLoader.load(Missing.class, cl));
    assertInstanceOf(ClassNotFoundException.class, e.getCause());
  }

  @Test
  void load_nullClassLoader_fallsBackToOwnLoader() {
    assertEquals(2, IdlFactoriesLoader.load(AnnotationFormatter.class, null).size());
  }
}
