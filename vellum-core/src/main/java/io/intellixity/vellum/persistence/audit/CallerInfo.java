package io.intellixity.vellum.persistence.audit;

/**
 * Who asked for a write: the calling code location plus an optional user id.
 *
 * @param line source line, or -1 when unknown
 */
public record CallerInfo(String userId, String className, String methodName, int line) {
  private static final StackWalker WALKER = StackWalker.getInstance();
  private static final CallerInfo UNKNOWN = new CallerInfo(null, null, null, -1);

  public static CallerInfo unknown() { return UNKNOWN; }

  /** Captures the frame that called this method. */
  public static CallerInfo capture(String userId) { return walk(userId); }

  public static CallerInfo capture() { return walk(null); }

  public static CallerInfo orUnknown(CallerInfo caller) { return caller == null ? UNKNOWN : caller; }

  // Skips walk() and the public capture overload
  private static CallerInfo walk(String userId) {
    return WALKER.walk(s -> s.skip(2).findFirst())
        .map(f -> new CallerInfo(userId, f.getClassName(), f.getMethodName(), f.getLineNumber()))
        .orElse(new CallerInfo(userId, null, null, -1));
  }
}
