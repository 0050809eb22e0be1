package uploadqueue.spring.boot;

import org.springframework.context.SmartLifecycle;
import uploadqueue.UploadQueue;

import java.util.Objects;

/**
 * Starts the queue's scheduler once the application context is refreshed and stops it,
 * without interrupting a running pass, when the context shuts down.
 */
public class UploadQueueLifecycle implements SmartLifecycle {

  private final UploadQueue uploadQueue;
  private volatile boolean running;

  public UploadQueueLifecycle(UploadQueue uploadQueue) {
    this.uploadQueue = Objects.requireNonNull(uploadQueue, "uploadQueue");
  }

  @Override
  public void start() {
    uploadQueue.start();
    running = true;
  }

  @Override
  public void stop() {
    uploadQueue.stop();
    running = false;
  }

  @Override
  public boolean isRunning() {
    return running;
  }
}
