package io.intellixity.nativa.idl.render;

import io.intellixity.nativa.idl.ast.*;
import io.intellixity.nativa.idl.util.IdlFactoriesLoader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;

/**
 * Renders {@link Type} trees back into canonical IDL text.
 *
 * <pre>
 *   map&lt;list&lt;i32&gt;, string&gt;
 *   set&lt;string&gt; (js.type = "list")
 * </pre>
 *
 * Instances are immutable and safe to share between threads.
 */
public final class TypeRenderer implements TypeVisitor<String> {
  private static final Logger log = LoggerFactory.getLogger(TypeRenderer.class);

  /** Renderer used by {@code Type#toString()}. */
  public static final TypeRenderer DEFAULT = new TypeRenderer(DefaultAnnotationFormatter.INSTANCE, true);

  private final AnnotationFormatter formatter;
  private final boolean withAnnotations;

  private TypeRenderer(AnnotationFormatter formatter, boolean withAnnotations) {
    this.formatter = formatter;
    this.withAnnotations = withAnnotations;
  }

  public static TypeRenderer using(AnnotationFormatter formatter) {
    return new TypeRenderer(Objects.requireNonNull(formatter, "formatter"), true);
  }

  /** A renderer that omits every annotation block; see {@link TypeIds}. */
  static TypeRenderer withoutAnnotations() {
    return new TypeRenderer(DefaultAnnotationFormatter.INSTANCE, false);
  }

  /**
   * Uses the first {@link AnnotationFormatter} registered in {@code META-INF/nativa-idl.factories},
   * or the default formatter when none is registered.
   */
  public static TypeRenderer discover() {
    return discover(Thread.currentThread().getContextClassLoader());
  }

  public static TypeRenderer discover(ClassLoader cl) {
    List<AnnotationFormatter> found = IdlFactoriesLoader.load(AnnotationFormatter.class, cl);
    if (found.isEmpty()) {
      log.debug("nativa.idl no AnnotationFormatter registered, using {}", DefaultAnnotationFormatter.class.getName());
      return DEFAULT;
    }
    AnnotationFormatter f = found.get(0);
    log.debug("nativa.idl annotationFormatter={} candidates={}", f.getClass().getName(), found.size());
    return using(f);
  }

  public AnnotationFormatter formatter() { return formatter; }

  public String render(Type type) {
    return Objects.requireNonNull(type, "type").accept(this);
  }

  @Override
  public String visit(BaseType type) {
    return annotate(type.id().keyword(), type.annotations());
  }

  @Override
  public String visit(MapType type) {
    return annotate("map<" + render(type.keyType()) + ", " + render(type.valueType()) + ">", type.annotations());
  }

  @Override
  public String visit(ListType type) {
    return annotate("list<" + render(type.valueType()) + ">", type.annotations());
  }

  @Override
  public String visit(SetType type) {
    return annotate("set<" + render(type.valueType()) + ">", type.annotations());
  }

  @Override
  public String visit(TypeReference type) {
    // line is diagnostic metadata, never part of the text
    return type.name();
  }

  private String annotate(String name, List<Annotation> annotations) {
    if (!withAnnotations) return name;
    String block = formatter.format(annotations);
    if (block == null || block.isEmpty()) return name;
    return name + " " + block;
  }
}
