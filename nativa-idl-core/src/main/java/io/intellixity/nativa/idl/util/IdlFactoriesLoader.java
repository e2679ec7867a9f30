package io.intellixity.nativa.idl.util;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.net.URL;
import java.util.*;

/**
 * Loads SPI implementations listed in {@code META-INF/nativa-idl.factories} resources.
 * <p>
 * Each resource is a Java Properties file keyed by SPI interface name:
 *
 * <pre>
 * io.intellixity.nativa.idl.render.AnnotationFormatter=com.acme.MyFormatter,com.acme.Other
 * </pre>
 *
 * Values may be comma-separated; whitespace is ignored. Duplicates keep their first position.
 */
public final class IdlFactoriesLoader {
  public static final String RESOURCE = "META-INF/nativa-idl.factories";

  private static final Logger log = LoggerFactory.getLogger(IdlFactoriesLoader.class);

  private IdlFactoriesLoader() {}

  public static <T> List<T> load(Class<T> spiType) {
    return load(spiType, Thread.currentThread().getContextClassLoader());
  }

  public static <T> List<T> load(Class<T> spiType, ClassLoader cl) {
    Objects.requireNonNull(spiType, "spiType");
    if (cl == null) cl = IdlFactoriesLoader.class.getClassLoader();

    List<String> implNames = implementationNames(spiType.getName(), cl);
    List<T> out = new ArrayList<>(implNames.size());
    for (String implName : implNames) {
      out.add(newInstance(implName, spiType, cl));
    }
    log.debug("nativa.idl factories spi={} implementations={}", spiType.getName(), implNames);
    return out;
  }

  static List<String> implementationNames(String key, ClassLoader cl) {
    Enumeration<URL> resources;
    try {
      resources = cl.getResources(RESOURCE);
    } catch (IOException e) {
      throw new IllegalStateException("Failed to enumerate " + RESOURCE, e);
    }

    LinkedHashSet<String> names = new LinkedHashSet<>();
    while (resources.hasMoreElements()) {
      URL url = resources.nextElement();
      Properties p = new Properties();
      try (InputStream in = url.openStream()) {
        p.load(in);
      } catch (IOException e) {
        throw new IllegalStateException("Failed to load " + RESOURCE + " from " + url, e);
      }

      String v = p.getProperty(key);
      if (v == null || v.isBlank()) continue;
      for (String part : v.split(",")) {
        String name = part.trim();
        if (!name.isEmpty()) names.add(name);
      }
    }
    return new ArrayList<>(names);
  }

  private static <T> T newInstance(String implName, Class<T> spiType, ClassLoader cl) {
    Class<?> raw;
    try {
      raw = Class.forName(implName, true, cl);
    } catch (ClassNotFoundException e) {
      throw new IllegalStateException("Class " + implName + " listed for " + spiType.getName() + " not found", e);
    }
    if (!spiType.isAssignableFrom(raw)) {
      throw new IllegalArgumentException("Class " + implName + " does not implement " + spiType.getName());
    }
    try {
      return spiType.cast(raw.getDeclaredConstructor().newInstance());
    } catch (ReflectiveOperationException e) {
      throw new IllegalStateException("Failed to instantiate " + implName + " for SPI " + spiType.getName(), e);
    }
  }
}
