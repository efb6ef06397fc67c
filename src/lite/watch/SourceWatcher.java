package lite.watch;

import java.io.File;
import java.io.IOException;
import java.nio.file.Path;
import java.util.logging.Logger;

import org.apache.commons.io.filefilter.FileFilterUtils;
import org.apache.commons.io.filefilter.HiddenFileFilter;
import org.apache.commons.io.monitor.FileAlterationListenerAdaptor;
import org.apache.commons.io.monitor.FileAlterationMonitor;
import org.apache.commons.io.monitor.FileAlterationObserver;

/**
 * Polls the directory of a source file and runs a cycle once at start and again whenever
 * the file is created or modified.
 */
public class SourceWatcher implements AutoCloseable {

	private static final Logger logger = Logger.getLogger("Lite Watcher");

	private final Path file;
	private final FileAlterationMonitor monitor;
	private final CoalescingRunner runner;

	public SourceWatcher(Path file, long intervalMs, Runnable cycle) {
		this.file = file.toAbsolutePath();
		this.runner = new CoalescingRunner(cycle);
		File directory = this.file.getParent().toFile();
		FileAlterationObserver observer = new FileAlterationObserver(directory, FileFilterUtils.and(
				HiddenFileFilter.VISIBLE,
				FileFilterUtils.nameFileFilter(this.file.getFileName().toString())));
		observer.addListener(new FileAlterationListenerAdaptor() {
			@Override
			public void onFileCreate(File created) {
				changed(created);
			}

			@Override
			public void onFileChange(File modified) {
				changed(modified);
			}
		});
		this.monitor = new FileAlterationMonitor(intervalMs, observer);
	}

	private void changed(File changed) {
		logger.info("Change detected in " + changed);
		runner.request();
	}

	public void start() throws IOException {
		logger.info("Watching " + file);
		runner.request();
		try {
			monitor.start();
		} catch (Exception e) {
			throw new IOException("could not watch " + file, e);
		}
	}

	@Override
	public void close() throws Exception {
		try {
			monitor.stop();
		} finally {
			runner.close();
		}
	}
}
