/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package tether;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.Consumer;
import tether.internal.Nullable;

/**
 * What a {@link SpanDescriptor.SpanBuilder} returns: the name of the span to create, attributes
 * for its entry event, and an optional hook run with the new span before the work starts.
 */
public final class SpanInfo {
  public static SpanInfo create(String name) {
    return newBuilder().name(name).build();
  }

  public static Builder newBuilder() {
    return new Builder();
  }

  public static final class Builder {
    String name;
    final Map<String, Object> attributes = new LinkedHashMap<>();
    Consumer<Span> customizer;

    /** When null, no span is created and the work runs as-is. */
    public Builder name(@Nullable String name) {
      this.name = name;
      return this;
    }

    public Builder attribute(String key, Object value) {
      if (key == null) throw new NullPointerException("key == null");
      if (value == null) throw new NullPointerException("value == null");
      attributes.put(key, value);
      return this;
    }

    public Builder attributes(Map<String, ?> attributes) {
      if (attributes == null) throw new NullPointerException("attributes == null");
      for (Map.Entry<String, ?> entry : attributes.entrySet()) {
        attribute(entry.getKey(), entry.getValue());
      }
      return this;
    }

    /** Called with the new span before it is entered. */
    public Builder customizer(Consumer<Span> customizer) {
      if (customizer == null) throw new NullPointerException("customizer == null");
      this.customizer = customizer;
      return this;
    }

    public SpanInfo build() {
      return new SpanInfo(this);
    }

    Builder() {
    }
  }

  @Nullable final String name;
  final Map<String, Object> attributes;
  @Nullable final Consumer<Span> customizer;

  SpanInfo(Builder builder) {
    this.name = builder.name;
    this.attributes = Collections.unmodifiableMap(new LinkedHashMap<>(builder.attributes));
    this.customizer = builder.customizer;
  }

  @Nullable public String name() {
    return name;
  }

  public Map<String, Object> attributes() {
    return attributes;
  }

  @Nullable public Consumer<Span> customizer() {
    return customizer;
  }

  @Override public String toString() {
    return "SpanInfo{name=" + name + ", attributes=" + attributes + "}";
  }
}
