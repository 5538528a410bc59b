package io.intellixity.sqlbuddy.util;

import java.io.IOException;
import java.io.InputStream;
import java.net.URL;
import java.util.*;

/**
 * spring.factories-style loader.\n
 *
 * Looks up all {@code META-INF/sqlbuddy.factories} resources on the classpath.\n
 * Each resource is a Java Properties file of the form:\n
 *
 * <pre>
 * io.intellixity.sqlbuddy.spi.sql.Dialect=com.acme.MyDialect,com.acme.OtherDialect
 * </pre>
 *
 * Values may be comma-separated. Whitespace is ignored.
 */
public final class SqlBuddyFactoriesLoader {
  public static final String RESOURCE = "META-INF/sqlbuddy.factories";

  private SqlBuddyFactoriesLoader() {}

  public static <T> List<T> load(Class<T> spiType) {
    return load(spiType, Thread.currentThread().getContextClassLoader());
  }

  public static <T> List<T> load(Class<T> spiType, ClassLoader cl) {
    Objects.requireNonNull(spiType, "spiType");
    if (cl == null) cl = SqlBuddyFactoriesLoader.class.getClassLoader();

    String key = spiType.getName();
    List<String> implNames = new ArrayList<>();

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

      String v = p.getProperty(key);
      if (v == null || v.isBlank()) continue;
      for (String part : v.split(",")) {
        String name = part.trim();
        if (!name.isEmpty()) implNames.add(name);
      }
    }

    // De-dupe while preserving order
    LinkedHashSet<String> uniq = new LinkedHashSet<>(implNames);
    List<T> out = new ArrayList<>(uniq.size());
    for (String implName : uniq) {
      out.add(newInstance(implName, spiType, cl));
    }
    return out;
  }

  private static <T> T newInstance(String implName, Class<T> spiType, ClassLoader cl) {
    try {
      Class<?> raw = Class.forName(implName, true, cl);
      if (!spiType.isAssignableFrom(raw)) {
        throw new IllegalArgumentException("Class " + implName + " does not implement " + spiType.getName());
      }
      return spiType.cast(raw.getDeclaredConstructor().newInstance());
    } catch (ReflectiveOperationException e) {
      throw new IllegalStateException("Failed to instantiate " + implName + " for SPI " + spiType.getName(), e);
    }
  }
}
