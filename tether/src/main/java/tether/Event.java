/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package tether;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import tether.internal.Nullable;
import tether.internal.Platform;
import tether.internal.Throwables;
import tether.propagation.Identifier;

/**
 * A timestamped record of one point in a span's lifecycle.
 *
 * <p>Attributes may be added until the event is recorded. After that the event is immutable and
 * further writes are ignored.
 *
 * <p>The causal edge is the {@link Identifier} of the event that happened before this one in the
 * same flow. Holding the identifier, rather than the event, keeps a long trace from retaining
 * every event it ever recorded.
 */
public final class Event {
  public enum Label {
    ENTRY,
    EXIT,
    INFO,
    ERROR;

    /** Returns the lower-case name used on the wire, for example "entry". */
    @Override public String toString() {
      return name().toLowerCase(java.util.Locale.ROOT);
    }
  }

  final Identifier identifier;
  final Label label;
  final String layer;
  final Map<String, Object> attributes = new LinkedHashMap<>();
  @Nullable Identifier edge; // guarded by this
  long timestamp; // guarded by this
  boolean recorded; // guarded by this

  Event(Identifier identifier, Label label, String layer) {
    if (identifier == null) throw new NullPointerException("identifier == null");
    if (label == null) throw new NullPointerException("label == null");
    if (layer == null) throw new NullPointerException("layer == null");
    this.identifier = identifier;
    this.label = label;
    this.layer = layer;
  }

  public Identifier identifier() {
    return identifier;
  }

  public Label label() {
    return label;
  }

  /** The name of the span that owns this event. */
  public String layer() {
    return layer;
  }

  /** The identifier of the previous event in this flow, or null at the origin of a trace. */
  @Nullable public synchronized Identifier edge() {
    return edge;
  }

  /** Epoch microseconds when this event was recorded, or zero if it is not yet recorded. */
  public synchronized long timestamp() {
    return timestamp;
  }

  public synchronized boolean isRecorded() {
    return recorded;
  }

  /** Returns a copy of the attributes. */
  public synchronized Map<String, Object> attributes() {
    return Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
  }

  @Nullable public synchronized Object attribute(String key) {
    return attributes.get(key);
  }

  /**
   * Sets an attribute. Strings, numbers and booleans are kept as-is and other values are stored as
   * their {@link Object#toString()}. A null value is ignored.
   */
  public Event set(String key, @Nullable Object value) {
    if (key == null) throw new NullPointerException("key == null");
    if (value == null) return this;
    if (!(value instanceof String || value instanceof Number || value instanceof Boolean)) {
      value = value.toString();
    }
    synchronized (this) {
      if (recorded) {
        Platform.get().log("Ignoring attribute {0} on a recorded event", key, null);
        return this;
      }
      attributes.put(key, value);
    }
    return this;
  }

  /** Sets each entry as if by {@link #set(String, Object)}. */
  public Event set(@Nullable Map<String, ?> attributes) {
    if (attributes == null) return this;
    for (Map.Entry<String, ?> entry : attributes.entrySet()) {
      set(entry.getKey(), entry.getValue());
    }
    return this;
  }

  /** Attaches the class, message and stack trace of the error. */
  public Event error(Throwable error) {
    if (error == null) throw new NullPointerException("error == null");
    set(EventKeys.ERROR_CLASS, Throwables.simpleName(error));
    set(EventKeys.ERROR_MSG, Throwables.message(error));
    set(EventKeys.BACKTRACE, Platform.get().backtrace(error));
    return this;
  }

  /** Returns false if this event was already recorded. */
  synchronized boolean record(long timestamp, @Nullable Identifier edge) {
    if (recorded) return false;
    this.timestamp = timestamp;
    this.edge = edge;
    this.recorded = true;
    return true;
  }

  @Override public synchronized String toString() {
    StringBuilder result = new StringBuilder("Event{");
    result.append("label=").append(label);
    result.append(", layer=").append(layer);
    result.append(", id=").append(identifier);
    if (edge != null) result.append(", edge=").append(edge.opIdString());
    if (timestamp != 0L) result.append(", timestamp=").append(timestamp);
    if (!attributes.isEmpty()) result.append(", attributes=").append(attributes);
    return result.append('}').toString();
  }
}
