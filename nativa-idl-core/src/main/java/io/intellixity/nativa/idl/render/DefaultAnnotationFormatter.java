package io.intellixity.nativa.idl.render;

import io.intellixity.nativa.idl.ast.Annotation;

import java.util.List;

/** Renders each annotation as {@code name = "value"}, backslash-escaping the value. */
public final class DefaultAnnotationFormatter implements AnnotationFormatter {
  public static final DefaultAnnotationFormatter INSTANCE = new DefaultAnnotationFormatter();

  @Override
  public String format(List<Annotation> annotations) {
    if (annotations == null || annotations.isEmpty()) return "";

    StringBuilder sb = new StringBuilder("(");
    for (int i = 0; i < annotations.size(); i++) {
      if (i > 0) sb.append(", ");
      Annotation a = annotations.get(i);
      sb.append(a.name()).append(" = ");
      quote(a.value(), sb);
    }
    return sb.append(')').toString();
  }

  static void quote(String s, StringBuilder sb) {
    sb.append('"');
    for (int i = 0; i < s.length(); i++) {
      char c = s.charAt(i);
      switch (c) {
        case '"' -> sb.append("\\\"");
        case '\\' -> sb.append("\\\\");
        case '\n' -> sb.append("\\n");
        case '\r' -> sb.append("\\r");
        case '\t' -> sb.append("\\t");
        default -> sb.append(c);
      }
    }
    sb.append('"');
  }
}
