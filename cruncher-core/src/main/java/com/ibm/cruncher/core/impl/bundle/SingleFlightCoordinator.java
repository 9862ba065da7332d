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

package com.ibm.cruncher.core.impl.bundle;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.text.MessageFormat;
import java.util.HashSet;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.FutureTask;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Ensures that at most one computation per key is in progress at any time.
 * <p>
 * The first caller for a key registers a {@link FutureTask} and runs it on
 * its own thread. Callers that arrive while it runs wait for the same task
 * and receive its result, or the exception it failed with. The task is
 * unregistered when it completes, so a later call for the key starts a new
 * computation. Computations for different keys run in parallel.
 */
public class SingleFlightCoordinator {
	private static final String sourceClass = SingleFlightCoordinator.class.getName();
	private static final Logger log = Logger.getLogger(sourceClass);

	private final ConcurrentMap<String, Future<?>> inFlight = new ConcurrentHashMap<String, Future<?>>();

	/** keys whose computation is running on the current thread */
	private final ThreadLocal<Set<String>> heldKeys = new ThreadLocal<Set<String>>() {
		@Override
		protected Set<String> initialValue() {
			return new HashSet<String>();
		}
	};

	/**
	 * Runs <code>callable</code> unless a computation for <code>key</code> is
	 * already in progress, in which case its result is awaited instead.
	 *
	 * @param key
	 *            the key
	 * @param callable
	 *            the computation
	 * @return the result of the computation
	 * @throws IOException
	 *             the exception thrown by the computation, rethrown to every
	 *             caller that shared it
	 * @throws IllegalStateException
	 *             if the current thread is already computing <code>key</code>
	 */
	public <T> T execute(String key, Callable<T> callable) throws IOException {
		final String sourceMethod = "execute"; //$NON-NLS-1$
		final boolean isTraceLogging = log.isLoggable(Level.FINER);
		if (isTraceLogging) {
			log.entering(sourceClass, sourceMethod, new Object[]{key});
		}
		Set<String> held = heldKeys.get();
		if (held.contains(key)) {
			throw new IllegalStateException(MessageFormat.format(Messages.SingleFlightCoordinator_0, key));
		}
		FutureTask<T> ticket = new FutureTask<T>(callable);
		@SuppressWarnings("unchecked")
		Future<T> existing = (Future<T>)inFlight.putIfAbsent(key, ticket);
		T result;
		if (existing == null) {
			held.add(key);
			try {
				ticket.run();
			} finally {
				held.remove(key);
				inFlight.remove(key, ticket);
			}
			result = getResult(ticket);
		} else {
			if (log.isLoggable(Level.FINE)) {
				log.fine("Waiting for in-flight computation of " + key); //$NON-NLS-1$
			}
			result = getResult(existing);
		}
		if (isTraceLogging) {
			log.exiting(sourceClass, sourceMethod);
		}
		return result;
	}

	/**
	 * @return the number of computations in progress
	 */
	public int getInFlightCount() {
		return inFlight.size();
	}

	private <T> T getResult(Future<T> future) throws IOException {
		try {
			return future.get();
		} catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			InterruptedIOException ex = new InterruptedIOException(e.getMessage());
			ex.initCause(e);
			throw ex;
		} catch (ExecutionException e) {
			Throwable cause = e.getCause();
			if (cause instanceof IOException) {
				throw (IOException)cause;
			} else if (cause instanceof RuntimeException) {
				throw (RuntimeException)cause;
			} else if (cause instanceof Error) {
				throw (Error)cause;
			}
			throw new IOException(cause);
		}
	}
}
