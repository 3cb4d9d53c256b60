package io.firebolt.client.core;

/** Lifecycle of a cursor. Every execute starts over from {@link #NONE}. */
public enum CursorState {
  NONE,
  DONE,
  ERROR,
  CLOSED
}
