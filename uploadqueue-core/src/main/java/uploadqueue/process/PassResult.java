package uploadqueue.process;

/**
 * Outcome of one pass over the store.
 *
 * @param success records delivered and deleted
 * @param failed  records whose handler failed; their retry count was incremented
 * @param skipped records left untouched (exhausted, unroutable or deferred)
 * @param ran     {@code false} if the pass was dropped because another was in flight
 */
public record PassResult(int success, int failed, int skipped, boolean ran) {
  private static final PassResult NOT_RUN = new PassResult(0, 0, 0, false);

  /**
   * Result of a pass request dropped because a pass was already running.
   *
   * @return the shared empty result
   */
  public static PassResult notRun() {
    return NOT_RUN;
  }

  public int attempted() {
    return success + failed;
  }
}
