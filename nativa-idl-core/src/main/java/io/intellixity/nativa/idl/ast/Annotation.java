package io.intellixity.nativa.idl.ast;

import java.util.List;
import java.util.Objects;

/**
 * A single type annotation, {@code name = "value"}.
 * <p>
 * {@code line} is where the annotation appeared in the source; it is kept for diagnostics only.
 */
public record Annotation(String name, String value, int line) {
  public Annotation {
    Objects.requireNonNull(name, "name");
    Objects.requireNonNull(value, "value");
  }

  public Annotation(String name, String value) {
    this(name, value, 0);
  }

  static List<Annotation> copyOf(List<Annotation> annotations) {
    return annotations == null ? List.of() : List.copyOf(annotations);
  }
}
