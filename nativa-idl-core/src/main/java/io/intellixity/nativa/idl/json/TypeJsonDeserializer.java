package io.intellixity.nativa.idl.json;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonDeserializer;
import com.fasterxml.jackson.databind.JsonNode;
import io.intellixity.nativa.idl.ast.*;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/** Canonical JSON deserializer for {@link Type}; see {@link TypeJsonSerializer} for the format. */
public final class TypeJsonDeserializer extends JsonDeserializer<Type> {
  @Override
  public Type deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
    JsonNode root = p.getCodec().readTree(p);
    if (root == null || root.isNull()) return null;
    return parseType(root);
  }

  /** Converts an already-read JSON tree into a {@link Type}. */
  public static Type parseType(JsonNode n) {
    if (n == null || n.isNull()) throw new IllegalArgumentException("type is missing");
    if (!n.isObject()) throw new IllegalArgumentException("type JSON must be an object: " + n);

    String kind = textOrNull(n.get("kind"));
    if (kind == null) throw new IllegalArgumentException("type JSON requires a kind: " + n);

    return switch (kind) {
      case TypeJson.BASE -> {
        String id = textOrNull(n.get("id"));
        if (id == null) throw new IllegalArgumentException("base type requires an id: " + n);
        yield new BaseType(BaseTypeId.fromKeyword(id), parseAnnotations(n.get("annotations")));
      }
      case TypeJson.MAP -> new MapType(
          parseType(required(n, "key")),
          parseType(required(n, "value")),
          parseAnnotations(n.get("annotations")));
      case TypeJson.LIST -> new ListType(parseType(required(n, "value")), parseAnnotations(n.get("annotations")));
      case TypeJson.SET -> new SetType(parseType(required(n, "value")), parseAnnotations(n.get("annotations")));
      case TypeJson.REF -> {
        String name = textOrNull(n.get("name"));
        if (name == null) throw new IllegalArgumentException("type reference requires a name: " + n);
        yield new TypeReference(name, intOrDefault(n.get("line"), 0));
      }
      default -> throw new IllegalArgumentException("Unknown type kind: " + kind);
    };
  }

  private static JsonNode required(JsonNode n, String field) {
    JsonNode v = n.get(field);
    if (v == null || v.isNull()) {
      throw new IllegalArgumentException(textOrNull(n.get("kind")) + " type requires " + field + ": " + n);
    }
    return v;
  }

  private static List<Annotation> parseAnnotations(JsonNode arr) {
    if (arr == null || arr.isNull()) return List.of();
    if (!arr.isArray()) throw new IllegalArgumentException("annotations must be an array: " + arr);

    List<Annotation> out = new ArrayList<>(arr.size());
    for (JsonNode a : arr) {
      String name = a.isObject() ? textOrNull(a.get("name")) : null;
      String value = a.isObject() ? textOrNull(a.get("value")) : null;
      if (name == null || value == null) {
        throw new IllegalArgumentException("annotation requires name and value: " + a);
      }
      out.add(new Annotation(name, value, intOrDefault(a.get("line"), 0)));
    }
    return out;
  }

  private static String textOrNull(JsonNode n) {
    return (n == null || n.isNull() || !n.isTextual()) ? null : n.asText();
  }

  private static int intOrDefault(JsonNode n, int def) {
    return (n == null || !n.canConvertToInt()) ? def : n.asInt();
  }
}
