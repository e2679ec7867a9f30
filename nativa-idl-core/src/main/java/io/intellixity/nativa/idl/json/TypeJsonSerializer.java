package io.intellixity.nativa.idl.json;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.JsonSerializer;
import com.fasterxml.jackson.databind.SerializerProvider;
import io.intellixity.nativa.idl.ast.*;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.List;

/**
 * Canonical JSON serializer for {@link Type}.
 *
 * <pre>
 * {"kind":"map","key":{"kind":"base","id":"string"},"value":{"kind":"ref","name":"User","line":4}}
 * </pre>
 */
public final class TypeJsonSerializer extends JsonSerializer<Type> {
  @Override
  public void serialize(Type t, JsonGenerator g, SerializerProvider serializers) throws IOException {
    if (t == null) {
      g.writeNull();
      return;
    }
    try {
      t.accept(new Writer(g));
    } catch (UncheckedIOException e) {
      throw e.getCause();
    }
  }

  /** Visitor methods cannot throw IOException; it is tunnelled out and unwrapped above. */
  private static final class Writer implements TypeVisitor<Void> {
    private final JsonGenerator g;

    Writer(JsonGenerator g) {
      this.g = g;
    }

    @Override
    public Void visit(BaseType t) {
      try {
        g.writeStartObject();
        g.writeStringField("kind", TypeJson.BASE);
        g.writeStringField("id", t.id().keyword());
        writeAnnotations(t.annotations());
        g.writeEndObject();
      } catch (IOException e) {
        throw new UncheckedIOException(e);
      }
      return null;
    }

    @Override
    public Void visit(MapType t) {
      try {
        g.writeStartObject();
        g.writeStringField("kind", TypeJson.MAP);
        g.writeFieldName("key");
        t.keyType().accept(this);
        g.writeFieldName("value");
        t.valueType().accept(this);
        writeAnnotations(t.annotations());
        g.writeEndObject();
      } catch (IOException e) {
        throw new UncheckedIOException(e);
      }
      return null;
    }

    @Override
    public Void visit(ListType t) {
      return container(TypeJson.LIST, t.valueType(), t.annotations());
    }

    @Override
    public Void visit(SetType t) {
      return container(TypeJson.SET, t.valueType(), t.annotations());
    }

    @Override
    public Void visit(TypeReference t) {
      try {
        g.writeStartObject();
        g.writeStringField("kind", TypeJson.REF);
        g.writeStringField("name", t.name());
        g.writeNumberField("line", t.line());
        g.writeEndObject();
      } catch (IOException e) {
        throw new UncheckedIOException(e);
      }
      return null;
    }

    private Void container(String kind, Type element, List<Annotation> annotations) {
      try {
        g.writeStartObject();
        g.writeStringField("kind", kind);
        g.writeFieldName("value");
        element.accept(this);
        writeAnnotations(annotations);
        g.writeEndObject();
      } catch (IOException e) {
        throw new UncheckedIOException(e);
      }
      return null;
    }

    private void writeAnnotations(List<Annotation> annotations) throws IOException {
      if (annotations.isEmpty()) return;
      g.writeArrayFieldStart("annotations");
      for (Annotation a : annotations) {
        g.writeStartObject();
        g.writeStringField("name", a.name());
        g.writeStringField("value", a.value());
        g.writeNumberField("line", a.line());
        g.writeEndObject();
      }
      g.writeEndArray();
    }
  }
}
