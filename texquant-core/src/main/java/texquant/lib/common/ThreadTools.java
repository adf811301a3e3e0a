/*-
 * #%L
 * This file is part of TexQuant.
 * %%
 * Copyright (C) 2014 - 2016 The Queen's University of Belfast, Northern Ireland
 * Contact: IP Management (ipmanagement@qub.ac.uk)
 * Copyright (C) 2018 - 2020 QuPath developers, The University of Edinburgh
 * Copyright (C) 2024 TexQuant developers
 * %%
 * TexQuant is free software: you can redistribute it and/or modify
 * it under the terms of the GNU General Public License as
 * published by the Free Software Foundation, either version 3 of the
 * License, or (at your option) any later version.
 * 
 * TexQuant is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU General Public License for more details.
 * 
 * You should have received a copy of the GNU General Public License 
 * along with TexQuant.  If not, see <https://www.gnu.org/licenses/>.
 * #L%
 */

package texquant.lib.common;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Helper methods for multithreading.
 * <p>
 * This provides the parallelism setting used by the feature calculations, a thread factory that supports
 * adding a prefix to the name and setting daemon status, and a way to run a batch of tasks and wait for them.
 * <p>
 * Parallelism defaults to 1 (i.e. everything runs on the calling thread), unless the system property
 * {@code texquant.parallelism} is set when this class is loaded.
 *
 * @author Pete Bankhead
 *
 */
public class ThreadTools {

	private static final Logger logger = LoggerFactory.getLogger(ThreadTools.class);

	/**
	 * Name of the system property that can be used to set the initial parallelism.
	 */
	public static final String PROP_PARALLELISM = "texquant.parallelism";

	private static volatile int parallelism = readParallelismProperty();

	private static int readParallelismProperty() {
		String value = System.getProperty(PROP_PARALLELISM, "1").strip();
		try {
			return Math.max(1, Integer.parseInt(value));
		} catch (NumberFormatException e) {
			logger.warn("Invalid value for {} ({}), parallelism will be 1", PROP_PARALLELISM, value);
			return 1;
		}
	}

	/**
	 * Get the requested number of threads to use for parallelization.
	 * @return the parallelism, always at least 1
	 */
	public static int getParallelism() {
		return parallelism;
	}

	/**
	 * Set the requested number of threads. This will be clipped to be at least 1.
	 * @param n
	 */
	public static void setParallelism(int n) {
		parallelism = Math.max(1, n);
		logger.debug("Parallelism set to {}", parallelism);
	}

	/**
	 * Create a thread factory that names threads with a prefix followed by a counter.
	 *
	 * @param prefix
	 * @param daemon
	 * @return
	 */
	public static ThreadFactory createThreadFactory(String prefix, boolean daemon) {
		return new SimpleThreadFactory(prefix, daemon);
	}

	/**
	 * Run all the tasks and wait for them to complete.
	 * <p>
	 * If the parallelism (or the number of tasks) is 1, the tasks are run in order on the calling thread.
	 * Otherwise a temporary pool of daemon threads is used and shut down before returning.
	 * <p>
	 * Any unchecked exception thrown by a task is rethrown unchanged; the remaining tasks are cancelled.
	 *
	 * @param prefix name prefix for any threads that are created
	 * @param tasks the tasks to run
	 * @throws CancellationException if the calling thread is interrupted while waiting
	 */
	public static void runAll(String prefix, List<? extends Runnable> tasks) throws CancellationException {
		int n = Math.min(getParallelism(), tasks.size());
		if (n <= 1) {
			for (var task : tasks)
				task.run();
			return;
		}
		logger.trace("Running {} tasks with {} threads", tasks.size(), n);
		ExecutorService pool = Executors.newFixedThreadPool(n, createThreadFactory(prefix, true));
		try {
			List<Future<?>> futures = new ArrayList<>();
			for (var task : tasks)
				futures.add(pool.submit(task));
			for (var future : futures)
				future.get();
		} catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			var cancelled = new CancellationException("Interrupted while waiting for " + prefix + " tasks");
			cancelled.initCause(e);
			throw cancelled;
		} catch (ExecutionException e) {
			var cause = e.getCause();
			if (cause instanceof RuntimeException)
				throw (RuntimeException)cause;
			if (cause instanceof Error)
				throw (Error)cause;
			throw new IllegalStateException(cause);
		} finally {
			pool.shutdownNow();
		}
	}


	static class SimpleThreadFactory implements ThreadFactory {

		private final ThreadGroup group;
		private final AtomicInteger threadNumber = new AtomicInteger(1);
		private String prefix;
		private boolean daemon;

		SimpleThreadFactory(final String prefix, final boolean daemon) {
			this.group = Thread.currentThread().getThreadGroup();
			this.prefix = prefix;
			this.daemon = daemon;
		}

		@Override
		public Thread newThread(Runnable r) {
			String name = prefix + threadNumber.getAndIncrement();
			Thread t = new Thread(group, r, name, 0);
			t.setDaemon(daemon);
			if (t.getPriority() != Thread.NORM_PRIORITY)
				t.setPriority(Thread.NORM_PRIORITY);
			return t;
		}

	}

}
