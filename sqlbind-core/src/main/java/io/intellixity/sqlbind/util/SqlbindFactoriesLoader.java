package io.intellixity.sqlbind.util;

import java.io.IOException;
import java.io.InputStream;
import java.net.URL;
import java.util.*;

/**
 * Loads SPI implementations listed in {@code META-INF/sqlbind.factories} resources.\n
 *
 * Each resource is a Java Properties file keyed by SPI interface name:\n
 *\n
 * <pre>\n
 * io.intellixity.sqlbind.spi.bind.BinderProvider=com.acme.MyBinderProvider,com.acme.OtherProvider\n
 * </pre>\n
 *
 * Values may be comma-separated. Whitespace is ignored. Duplicates keep their first position.\n
 */
public final class SqlbindFactoriesLoader {
  public static final String RESOURCE = "META-INF/sqlbind.factories";

  private SqlbindFactoriesLoader() {}

  public static <T> List<T> load(Class<T> spiType) {
    return load(spiType, Thread.currentThread().getContextClassLoader());
  }

  public static <T> List<T> load(Class<T> spiType, ClassLoader cl) {
    Objects.requireNonNull(spiType, "spiType");
    if (cl == null) cl = SqlbindFactoriesLoader.class.getClassLoader();

    Set<String> implNames = new LinkedHashSet<>();
    Enumeration<URL> resources;
    try {
      resources = cl.getResources(RESOURCE);
    } catch (IOException e) {
      throw new IllegalStateException("Failed to enumerate " + RESOURCE, e);
    }

    while (resources.hasMoreElements()) {
      URL url = resources.nextElement();
      Properties p = new Properties();
      try (InputStream in = url.openStream()) {
        p.load(in);
      } catch (IOException e) {
        throw new IllegalStateException("Failed to load " + RESOURCE + " from " + url, e);
      }
      implNames.addAll(split(p.getProperty(spiType.getName())));
    }

    List<T> out = new ArrayList<>(implNames.size());
    for (String implName : implNames) {
      out.add(newInstance(implName, spiType, cl));
    }
    return out;
  }

  static List<String> split(String value) {
    if (value == null || value.isBlank()) return List.of();
    List<String> out = new ArrayList<>();
    for (String part : value.split(",")) {
      String name = part.trim();
      if (!name.isEmpty()) out.add(name);
    }
    return out;
  }

  private static <T> T newInstance(String implName, Class<T> spiType, ClassLoader cl) {
    Class<?> raw;
    try {
      raw = Class.forName(implName, true, cl);
    } catch (ClassNotFoundException e) {
      throw new IllegalStateException("Class " + implName + " listed for SPI " + spiType.getName() + " not found", e);
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
