package io.intellixity.vellum.persistence.jdbc.command;

import java.util.EnumSet;
import java.util.Set;

/** Lifecycle of one write: BUILDING, then EXECUTING, then exactly one terminal state. */
public enum WriteState {
  BUILDING,
  EXECUTING,
  COMMITTED,
  CONFLICT_DETECTED,
  NOT_FOUND,
  FAULTED;

  public boolean isTerminal() { return this != BUILDING && this != EXECUTING; }

  public boolean canTransitionTo(WriteState next) {
    return allowedFrom(this).contains(next);
  }

  private static Set<WriteState> allowedFrom(WriteState s) {
    switch (s) {
      case BUILDING: return EnumSet.of(EXECUTING, FAULTED);
      case EXECUTING: return EnumSet.of(COMMITTED, CONFLICT_DETECTED, NOT_FOUND, FAULTED);
      default: return EnumSet.noneOf(WriteState.class);
    }
  }
}
