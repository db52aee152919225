package io.b2mash.schemaswitch.clone;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Environment handed to external commands: a fixed base (normally the JVM's own environment) plus
 * per-thread overrides. Overrides are applied for the lifetime of a {@link Scope} and the previous
 * values come back when it closes, whether or not the command succeeded.
 */
public final class CommandEnvironment {

  private final Map<String, String> base;
  private final ThreadLocal<Map<String, String>> overrides = ThreadLocal.withInitial(HashMap::new);

  public CommandEnvironment(Map<String, String> base) {
    this.base = Map.copyOf(base);
  }

  public static CommandEnvironment fromSystem() {
    return new CommandEnvironment(System.getenv());
  }

  /** The variables a command launched now from this thread would see. */
  public Map<String, String> snapshot() {
    var effective = new HashMap<>(base);
    overrides
        .get()
        .forEach(
            (name, value) -> {
              if (value == null) {
                effective.remove(name);
              } else {
                effective.put(name, value);
              }
            });
    return effective;
  }

  public String get(String name) {
    return snapshot().get(name);
  }

  /** Sets the variables until the returned scope is closed. {@code null} values are skipped. */
  public Scope apply(Map<String, String> variables) {
    Map<String, String> current = overrides.get();
    Map<String, String> previous = new LinkedHashMap<>();
    Map<String, Boolean> hadOverride = new LinkedHashMap<>();
    variables.forEach(
        (name, value) -> {
          if (value == null) {
            return;
          }
          hadOverride.put(name, current.containsKey(name));
          previous.put(name, current.get(name));
          current.put(name, value);
        });
    return () ->
        hadOverride.forEach(
            (name, existed) -> {
              if (existed) {
                current.put(name, previous.get(name));
              } else {
                current.remove(name);
              }
            });
  }

  @FunctionalInterface
  public interface Scope extends AutoCloseable {

    @Override
    void close();
  }
}
