package io.intellixity.vellum.persistence.query;

import io.intellixity.vellum.persistence.exec.PersistenceException;

/** A predicate node that cannot be rendered for the target mapping. */
public final class UnsupportedExpressionException extends PersistenceException {
  private final String nodeKind;

  public UnsupportedExpressionException(String nodeKind, String message) {
    super(nodeKind + ": " + message);
    this.nodeKind = nodeKind;
  }

  public String nodeKind() { return nodeKind; }
}
