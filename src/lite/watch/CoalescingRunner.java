package lite.watch;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Runs a task on a single worker thread on request. Requests made while the task is
 * running are merged into one more run after the current one, never interleaved with it.
 */
public class CoalescingRunner implements AutoCloseable {

	private static final Logger logger = Logger.getLogger("Lite Watcher");

	private final Runnable task;
	private final ExecutorService worker;

	// guarded by this
	private boolean running = false;
	private boolean pending = false;

	public CoalescingRunner(Runnable task) {
		this.task = task;
		this.worker = Executors.newSingleThreadExecutor(r -> {
			Thread t = new Thread(r, "lite-watch-cycle");
			t.setDaemon(true);
			return t;
		});
	}

	public synchronized void request() {
		if (running) {
			pending = true;
			return;
		}
		running = true;
		worker.execute(this::drain);
	}

	public synchronized boolean isIdle() {
		return !running;
	}

	private void drain() {
		while (true) {
			try {
				task.run();
			} catch (RuntimeException e) {
				logger.log(Level.SEVERE, "cycle failed", e);
			}
			synchronized (this) {
				if (!pending) {
					running = false;
					return;
				}
				pending = false;
			}
		}
	}

	/**
	 * Lets a running cycle, and the one it owes, finish before returning.
	 */
	@Override
	public void close() throws InterruptedException {
		worker.shutdown();
		if (!worker.awaitTermination(1, TimeUnit.MINUTES)) {
			logger.warning("gave up waiting for the running cycle");
			worker.shutdownNow();
		}
	}
}
