package uploadqueue.process;

import uploadqueue.UploadType;

/**
 * Receives progress of a pass, for example to drive a progress bar.
 *
 * <p>Called before each record with {@code (index, total, type)} and once after the loop
 * with {@code (total, total, null)}, so the first argument increases strictly from
 * {@code 0} to {@code total}. Skipped records are reported like processed ones.
 */
@FunctionalInterface
public interface ProgressListener {

  ProgressListener NOOP = (processed, total, current) -> {
  };

  /**
   * @param processed number of records handled so far in this pass
   * @param total     number of records in the pass snapshot
   * @param current   type of the record about to be handled, or {@code null} at the end
   */
  void onProgress(int processed, int total, UploadType current);
}
