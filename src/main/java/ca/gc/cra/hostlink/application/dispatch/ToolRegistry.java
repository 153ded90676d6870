package ca.gc.cra.hostlink.application.dispatch;

import ca.gc.cra.hostlink.application.port.ToolHandler;
import ca.gc.cra.hostlink.domain.tool.Tool;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * <strong>What:</strong> Immutable table from {@link Tool} to the {@link ToolHandler} that implements it.
 * <p><strong>Why:</strong> Dispatch by wire name goes through the closed {@link Tool} enumeration so a typo in a
 * client request can never select an arbitrary handler.</p>
 * <p><strong>Thread-safety:</strong> Immutable after {@link Builder#build()}; shared read-only by all workers.</p>
 *
 * @since 0.1.0
 */
public final class ToolRegistry {
  private final Map<Tool, ToolHandler> handlers;

  private ToolRegistry(Map<Tool, ToolHandler> handlers) {
    this.handlers = Collections.unmodifiableMap(new EnumMap<>(handlers));
  }

  /**
   * Starts an empty registry builder.
   *
   * @return new builder
   */
  public static Builder builder() {
    EnumMap<Tool, ToolHandler> initial = new EnumMap<>(Tool.class);
    return new Builder(initial);
  }

  /**
   * Resolves the handler for a wire name.
   *
   * @param wireName tool name from the request; may be {@code null}
   * @return handler, or empty when the name is unknown or the tool has no registered handler
   */
  public Optional<ToolHandler> lookup(String wireName) {
    return Tool.fromWireName(wireName).map(handlers::get);
  }

  /**
   * Resolves the handler for a tool constant.
   *
   * @param tool tool constant
   * @return handler, or empty when none is registered
   */
  public Optional<ToolHandler> lookup(Tool tool) {
    return Optional.ofNullable(handlers.get(Objects.requireNonNull(tool, "tool")));
  }

  /**
   * Lists the tools that have a handler.
   *
   * @return unmodifiable set in declaration order
   */
  public Set<Tool> tools() {
    return handlers.keySet();
  }

  /** Collects handlers before the server starts. Not thread-safe. */
  public static final class Builder {
    private final EnumMap<Tool, ToolHandler> handlers;

    private Builder(EnumMap<Tool, ToolHandler> handlers) {
      this.handlers = handlers;
    }

    /**
     * Registers a handler.
     *
     * @param tool tool constant
     * @param handler tool body
     * @return this builder
     * @throws IllegalStateException if {@code tool} already has a handler
     */
    public Builder register(Tool tool, ToolHandler handler) {
      Objects.requireNonNull(tool, "tool");
      Objects.requireNonNull(handler, "handler");
      if (handlers.putIfAbsent(tool, handler) != null) {
        throw new IllegalStateException("Handler already registered for " + tool.wireName());
      }
      return this;
    }

    /**
     * Registers every entry of {@code entries}.
     *
     * @param entries handlers keyed by tool
     * @return this builder
     */
    public Builder registerAll(Map<Tool, ToolHandler> entries) {
      Objects.requireNonNull(entries, "entries").forEach(this::register);
      return this;
    }

    /**
     * Freezes the registry.
     *
     * @return immutable registry
     */
    public ToolRegistry build() {
      return new ToolRegistry(handlers);
    }
  }
}
