/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package tether.propagation;

import tether.internal.HexCodec;
import tether.internal.Nullable;
import tether.internal.Platform;

/**
 * Identifies an event within a trace, and carries the trace-wide sampling decision.
 *
 * <p>The external form is a 60 character upper-hex token: the header {@code "2B"}, a 40 character
 * task id shared by every event in the same logical request, a 16 character operation id unique
 * to one event, and a flags byte whose low bit is the sample flag.
 *
 * <p>Instances are immutable.
 */
public final class Identifier {
  public static final int TOKEN_LENGTH = 60;
  static final String HEADER = "2B";
  static final int TASK_ID_OFFSET = 2, TASK_ID_LENGTH = 40;
  static final int OP_ID_OFFSET = 42, OP_ID_LENGTH = 16;
  static final int FLAGS_OFFSET = 58;
  static final String ZERO_TASK_ID = "0000000000000000000000000000000000000000";

  /** The log form of the trace id when nothing is traced. */
  public static final String UNTRACED_LOG_STRING = ZERO_TASK_ID + "-0";

  /**
   * Parses a token, or returns null if it is malformed, or has an all-zero task or operation id.
   */
  @Nullable public static Identifier parse(@Nullable CharSequence token) {
    if (token == null) return null;
    if (token.length() != TOKEN_LENGTH) return invalid("length", token);
    if (token.charAt(0) != '2' || Character.toUpperCase(token.charAt(1)) != 'B') {
      return invalid("header", token);
    }
    if (!HexCodec.isHex(token, TASK_ID_OFFSET, TOKEN_LENGTH)) return invalid("characters", token);
    if (HexCodec.isZero(token, TASK_ID_OFFSET, OP_ID_OFFSET)) return invalid("task id", token);
    long opId = HexCodec.lenientHexToUnsignedLong(token, OP_ID_OFFSET, FLAGS_OFFSET);
    if (opId == 0L) return invalid("operation id", token);
    int flags = (int) HexCodec.lenientHexToUnsignedLong(token, FLAGS_OFFSET, TOKEN_LENGTH);
    String taskId = token.subSequence(TASK_ID_OFFSET, OP_ID_OFFSET).toString().toUpperCase();
    return new Identifier(taskId, opId, flags);
  }

  /** Returns true when the token is well-sized and its sample flag is set. */
  public static boolean isSampled(@Nullable String token) {
    return token != null && token.length() == TOKEN_LENGTH && token.charAt(TOKEN_LENGTH - 1) == '1';
  }

  /** Creates an identifier for a new logical request. */
  public static Identifier newRandom(boolean sampled) {
    Platform platform = Platform.get();
    char[] taskId = new char[TASK_ID_LENGTH];
    HexCodec.writeHexInt(taskId, 0, platform.randomInt());
    HexCodec.writeHexLong(taskId, 8, nextNonZero(platform));
    HexCodec.writeHexLong(taskId, 24, platform.randomLong());
    return new Identifier(new String(taskId), nextNonZero(platform), sampled ? 1 : 0);
  }

  static long nextNonZero(Platform platform) {
    long next = platform.randomLong();
    while (next == 0L) {
      next = platform.randomLong();
    }
    return next;
  }

  @Nullable static Identifier invalid(String reason, CharSequence token) {
    Platform.get().log("Invalid identifier {0}: bad " + reason, token, null);
    return null;
  }

  final String taskId;
  final long opId;
  final int flags;
  volatile String token; // lazily initialized

  Identifier(String taskId, long opId, int flags) {
    this.taskId = taskId;
    this.opId = opId;
    this.flags = flags;
  }

  /** The 40 character upper-hex id shared by all events in the same logical request. */
  public String taskId() {
    return taskId;
  }

  /** The non-zero id unique to one event. */
  public long opId() {
    return opId;
  }

  public String opIdString() {
    return HexCodec.toUpperHex(opId);
  }

  public boolean sampled() {
    return (flags & 1) == 1;
  }

  /** Returns an identifier in the same trace, with the same flags, and a fresh operation id. */
  public Identifier withNewOpId() {
    return new Identifier(taskId, nextNonZero(Platform.get()), flags);
  }

  /** Returns an identifier with the same ids and the sample flag set as specified. */
  public Identifier withSampled(boolean sampled) {
    if (sampled() == sampled) return this;
    return new Identifier(taskId, opId, sampled ? flags | 1 : flags & ~1);
  }

  /** Returns the trace id in log form: the task id, a hyphen, then the sample flag. */
  public String toLogString() {
    return taskId + (sampled() ? "-1" : "-0");
  }

  /** Returns the 60 character token. */
  @Override public String toString() {
    String result = token;
    if (result == null) {
      char[] data = new char[TOKEN_LENGTH];
      HEADER.getChars(0, 2, data, 0);
      taskId.getChars(0, TASK_ID_LENGTH, data, TASK_ID_OFFSET);
      HexCodec.writeHexLong(data, OP_ID_OFFSET, opId);
      HexCodec.writeHexByte(data, FLAGS_OFFSET, (byte) flags);
      token = result = new String(data);
    }
    return result;
  }

  @Override public boolean equals(Object o) {
    if (o == this) return true;
    if (!(o instanceof Identifier)) return false;
    Identifier that = (Identifier) o;
    return opId == that.opId && flags == that.flags && taskId.equals(that.taskId);
  }

  @Override public int hashCode() {
    int h = 1000003;
    h ^= taskId.hashCode();
    h *= 1000003;
    h ^= (int) ((opId >>> 32) ^ opId);
    h *= 1000003;
    h ^= flags;
    return h;
  }
}
