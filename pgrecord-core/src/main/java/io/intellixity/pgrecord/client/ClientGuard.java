package io.intellixity.pgrecord.client;

import java.util.Objects;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Function;

/**
 * Mutually exclusive access to one client.
 *
 * <p>The lock is fair so waiting callers are served in arrival order.</p>
 */
public final class ClientGuard<C> {
  private final C client;
  private final ReentrantLock lock = new ReentrantLock(true);

  public ClientGuard(C client) {
    this.client = Objects.requireNonNull(client, "client");
  }

  public <R> R withClient(Function<? super C, ? extends R> work) {
    lock.lock();
    try {
      return work.apply(client);
    } finally {
      lock.unlock();
    }
  }

  public boolean isHeldByCurrentThread() {
    return lock.isHeldByCurrentThread();
  }

  /** Number of threads waiting for the client. */
  public int queueLength() {
    return lock.getQueueLength();
  }
}
