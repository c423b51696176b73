/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package tether.sampler;

import java.util.Locale;
import tether.internal.Nullable;

/** Whether new traces may be started at all. */
public enum TraceMode {
  ALWAYS,
  NEVER;

  /**
   * Parses "always" or "never", or their aliases "enabled" and "disabled", ignoring case. Returns
   * null for anything else.
   */
  @Nullable public static TraceMode parse(@Nullable String value) {
    if (value == null) return null;
    switch (value.trim().toLowerCase(Locale.ROOT)) {
      case "always":
      case "enabled":
        return ALWAYS;
      case "never":
      case "disabled":
        return NEVER;
      default:
        return null;
    }
  }
}
