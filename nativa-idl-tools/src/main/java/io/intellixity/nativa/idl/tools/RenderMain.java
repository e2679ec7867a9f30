package io.intellixity.nativa.idl.tools;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.intellixity.nativa.idl.ast.Type;
import io.intellixity.nativa.idl.json.TypeJsonDeserializer;
import io.intellixity.nativa.idl.render.TypeRenderer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.*;
import java.util.*;

/**
 * CLI:
 *   RenderMain &lt;types.json&gt;...
 *
 * Each file holds one JSON-encoded type or an array of them; one canonical rendering is
 * printed per type.
 */
public final class RenderMain {
  private static final Logger log = LoggerFactory.getLogger(RenderMain.class);
  private static final ObjectMapper JSON = new ObjectMapper();

  private RenderMain() {}

  public static void main(String[] args) {
    System.exit(run(args, System.out, System.err));
  }

  static int run(String[] args, PrintStream out, PrintStream err) {
    if (args.length == 0) {
      err.println("Usage: RenderMain <types.json>...");
      return 2;
    }

    TypeRenderer renderer = TypeRenderer.discover();
    for (String arg : args) {
      Path file = Paths.get(arg);
      List<Type> types;
      try {
        types = readTypes(file);
      } catch (IOException | IllegalArgumentException e) {
        err.println("Failed to read " + file + ": " + e.getMessage());
        return 1;
      }
      log.debug("nativa.idl render file={} types={}", file, types.size());
      for (Type t : types) {
        out.println(renderer.render(t));
      }
    }
    return 0;
  }

  static List<Type> readTypes(Path file) throws IOException {
    JsonNode root = JSON.readTree(file.toFile());
    if (root == null || root.isMissingNode()) {
      throw new IllegalArgumentException("empty document");
    }
    if (!root.isArray()) return List.of(TypeJsonDeserializer.parseType(root));

    List<Type> out = new ArrayList<>(root.size());
    for (JsonNode n : root) out.add(TypeJsonDeserializer.parseType(n));
    return out;
  }
}
