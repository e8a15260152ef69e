package io.intellixity.vellum.persistence.jdbc.command;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

final class WriteTrackerTest {

  @Test
  void happyPath() {
    WriteTracker t = new WriteTracker("Customers", 1L);
    assertEquals(WriteState.BUILDING, t.state());
    t.executing();
    t.committed();
    assertEquals(WriteState.COMMITTED, t.state());
    assertTrue(t.state().isTerminal());
  }

  @Test
  void terminalStatesAreFinal() {
    WriteTracker t = new WriteTracker("Customers", 1L);
    t.executing();
    t.conflict();
    assertThrows(IllegalStateException.class, t::committed);
    t.faultIfOpen();
    assertEquals(WriteState.CONFLICT_DETECTED, t.state());
  }

  @Test
  void cannotCommitWithoutExecuting() {
    WriteTracker t = new WriteTracker("Customers", 1L);
    assertThrows(IllegalStateException.class, t::committed);
    t.faultIfOpen();
    assertEquals(WriteState.FAULTED, t.state());
  }

  @Test
  void transitionTable() {
    assertTrue(WriteState.EXECUTING.canTransitionTo(WriteState.NOT_FOUND));
    assertFalse(WriteState.BUILDING.canTransitionTo(WriteState.CONFLICT_DETECTED));
    assertFalse(WriteState.FAULTED.canTransitionTo(WriteState.EXECUTING));
    assertFalse(WriteState.EXECUTING.isTerminal());
  }
}
