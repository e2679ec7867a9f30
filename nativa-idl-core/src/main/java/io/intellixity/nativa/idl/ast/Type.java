package io.intellixity.nativa.idl.ast;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import io.intellixity.nativa.idl.json.TypeJsonDeserializer;
import io.intellixity.nativa.idl.json.TypeJsonSerializer;

/**
 * A reference to a Thrift field type, as written in an IDL document.
 * <p>
 * The set of shapes is closed: every consumer that needs to look at all of them goes through
 * {@link TypeVisitor}, which gains a method whenever a shape is added.
 */
@JsonSerialize(using = TypeJsonSerializer.class)
@JsonDeserialize(using = TypeJsonDeserializer.class)
public sealed interface Type permits BaseType, MapType, ListType, SetType, TypeReference {
  <R> R accept(TypeVisitor<R> visitor);
}
