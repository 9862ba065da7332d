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

package com.ibm.cruncher.core.executors;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.ThreadFactory;

/**
 * Supplies the threads that run work on behalf of a cruncher: the pool used
 * by {@link com.ibm.cruncher.core.ICruncher#prebuild} and the daemon threads
 * that poll the search roots for changes.
 */
public interface IExecutors {

	/**
	 * Returns the pool for background bundle builds. The pool is created on
	 * first use.
	 *
	 * @return the build executor
	 * @throws IllegalStateException if {@link #shutdown()} has been called
	 */
	public ExecutorService getBuildExecutor();

	/**
	 * @return the factory for file watcher threads
	 */
	public ThreadFactory getWatcherThreadFactory();

	/**
	 * Stops accepting builds and waits a bounded time for queued builds to
	 * finish.
	 */
	public void shutdown();
}
