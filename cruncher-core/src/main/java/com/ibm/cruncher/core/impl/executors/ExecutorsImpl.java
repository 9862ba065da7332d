/*
 * (C) Copyright 2012, IBM Corporation
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.ibm.cruncher.core.impl.executors;

import com.ibm.cruncher.core.executors.IExecutors;

import java.text.MessageFormat;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.logging.Level;
import java.util.logging.Logger;

public class ExecutorsImpl implements IExecutors {
	private static final String sourceClass = ExecutorsImpl.class.getName();
	private static final Logger log = Logger.getLogger(sourceClass);

	private static final String BUILDER_THREADNAME = "Cruncher Bundle Builder - {0}"; //$NON-NLS-1$
	private static final String WATCHER_THREADNAME = "Cruncher File Watcher - {0}"; //$NON-NLS-1$

	static final int DEFAULT_BUILD_THREADS = 4;

	/** seconds to wait for each round of termination */
	static final int SHUTDOWN_WAIT = 10;

	static final int SHUTDOWN_ROUNDS = 5;

	private final int buildThreads;

	private final AtomicInteger builderCount = new AtomicInteger();

	private final AtomicInteger watcherCount = new AtomicInteger();

	private ExecutorService buildExecutor;

	private boolean shutdown = false;

	public ExecutorsImpl() {
		this(DEFAULT_BUILD_THREADS);
	}

	/**
	 * @param buildThreads the size of the build pool
	 */
	public ExecutorsImpl(int buildThreads) {
		this.buildThreads = buildThreads;
	}

	/**
	 * Uses a caller supplied build pool. The pool is shut down by
	 * {@link #shutdown()}.
	 *
	 * @param buildExecutor the build pool
	 */
	public ExecutorsImpl(ExecutorService buildExecutor) {
		this(DEFAULT_BUILD_THREADS);
		this.buildExecutor = buildExecutor;
	}

	/* (non-Javadoc)
	 * @see com.ibm.cruncher.core.executors.IExecutors#getBuildExecutor()
	 */
	@Override
	public synchronized ExecutorService getBuildExecutor() {
		if (buildExecutor == null) {
			if (shutdown) {
				throw new IllegalStateException();
			}
			buildExecutor = Executors.newFixedThreadPool(buildThreads,
					newDaemonFactory(BUILDER_THREADNAME, builderCount, Thread.NORM_PRIORITY));
		}
		return buildExecutor;
	}

	/* (non-Javadoc)
	 * @see com.ibm.cruncher.core.executors.IExecutors#getWatcherThreadFactory()
	 */
	@Override
	public ThreadFactory getWatcherThreadFactory() {
		return newDaemonFactory(WATCHER_THREADNAME, watcherCount, Thread.MIN_PRIORITY);
	}

	/* (non-Javadoc)
	 * @see com.ibm.cruncher.core.executors.IExecutors#shutdown()
	 */
	@Override
	public void shutdown() {
		ExecutorService executor;
		synchronized (this) {
			shutdown = true;
			executor = buildExecutor;
		}
		if (executor == null) {
			return;
		}
		executor.shutdown();
		for (int i = 0; i < SHUTDOWN_ROUNDS && !executor.isTerminated(); i++) {
			try {
				if (!executor.awaitTermination(SHUTDOWN_WAIT, TimeUnit.SECONDS) && log.isLoggable(Level.WARNING)) {
					log.warning(Messages.ExecutorsImpl_0);
				}
			} catch (InterruptedException e) {
				log.log(Level.WARNING, e.getMessage(), e);
				Thread.currentThread().interrupt();
				break;
			}
		}
	}

	private static ThreadFactory newDaemonFactory(final String nameFormat, final AtomicInteger counter, final int priority) {
		return new ThreadFactory() {
			@Override
			public Thread newThread(Runnable r) {
				Thread t = new Thread(r, MessageFormat.format(nameFormat, counter.incrementAndGet()));
				t.setDaemon(true);
				t.setPriority(priority);
				return t;
			}
		};
	}
}
