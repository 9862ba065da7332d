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

package com.ibm.cruncher.core.impl.watch;

import com.ibm.cruncher.core.util.PathUtil;
import com.ibm.cruncher.core.watch.IFileChangeListener;
import com.ibm.cruncher.core.watch.IFileWatcher;

import org.apache.commons.io.monitor.FileAlterationListenerAdaptor;
import org.apache.commons.io.monitor.FileAlterationMonitor;
import org.apache.commons.io.monitor.FileAlterationObserver;

import java.io.File;
import java.io.IOException;
import java.text.MessageFormat;
import java.util.concurrent.ThreadFactory;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * A polling file watcher based on the commons-io
 * {@link FileAlterationMonitor}.
 * <p>
 * The monitor thread is started when the first tree is watched. With a
 * polling interval of zero or less no thread is started and changes are
 * only detected by calls to {@link #checkNow()}.
 */
public class FileWatcherImpl implements IFileWatcher {
	private static final String sourceClass = FileWatcherImpl.class.getName();
	private static final Logger log = Logger.getLogger(sourceClass);

	private final FileAlterationMonitor monitor;

	private final boolean polling;

	private boolean started = false;

	private boolean stopped = false;

	/**
	 * @param interval
	 *            the polling interval in milliseconds
	 * @param threadFactory
	 *            the factory for the monitor thread
	 */
	public FileWatcherImpl(long interval, ThreadFactory threadFactory) {
		polling = interval > 0;
		monitor = new FileAlterationMonitor(polling ? interval : Long.MAX_VALUE);
		monitor.setThreadFactory(threadFactory);
	}

	/* (non-Javadoc)
	 * @see com.ibm.cruncher.core.watch.IFileWatcher#watchPath(java.io.File, com.ibm.cruncher.core.watch.IFileChangeListener)
	 */
	@Override
	public synchronized void watchPath(File root, IFileChangeListener listener) throws IOException {
		final String sourceMethod = "watchPath"; //$NON-NLS-1$
		final boolean isTraceLogging = log.isLoggable(Level.FINER);
		if (isTraceLogging) {
			log.entering(sourceClass, sourceMethod, new Object[]{root, listener});
		}
		if (stopped) {
			throw new IllegalStateException();
		}
		FileAlterationObserver observer = new FileAlterationObserver(root);
		observer.addListener(new ListenerAdaptor(listener));
		try {
			observer.initialize();
			monitor.addObserver(observer);
			if (polling && !started) {
				monitor.start();
				started = true;
			}
		} catch (IOException e) {
			throw e;
		} catch (Exception e) {
			throw new IOException(e);
		}
		if (log.isLoggable(Level.INFO)) {
			log.info(MessageFormat.format(Messages.FileWatcherImpl_0, root.getAbsolutePath()));
		}
		if (isTraceLogging) {
			log.exiting(sourceClass, sourceMethod);
		}
	}

	/* (non-Javadoc)
	 * @see com.ibm.cruncher.core.watch.IFileWatcher#checkNow()
	 */
	@Override
	public void checkNow() {
		for (FileAlterationObserver observer : monitor.getObservers()) {
			observer.checkAndNotify();
		}
	}

	/* (non-Javadoc)
	 * @see com.ibm.cruncher.core.watch.IFileWatcher#stop()
	 */
	@Override
	public synchronized void stop() {
		stopped = true;
		if (started) {
			started = false;
			try {
				monitor.stop();
			} catch (Exception e) {
				if (log.isLoggable(Level.WARNING)) {
					log.log(Level.WARNING, e.getMessage(), e);
				}
			}
		}
	}

	/**
	 * Reports every kind of change as a change of the normalized path.
	 */
	static class ListenerAdaptor extends FileAlterationListenerAdaptor {
		private final IFileChangeListener listener;

		ListenerAdaptor(IFileChangeListener listener) {
			this.listener = listener;
		}

		@Override
		public void onFileCreate(File file) {
			notifyListener(file);
		}

		@Override
		public void onFileChange(File file) {
			notifyListener(file);
		}

		@Override
		public void onFileDelete(File file) {
			notifyListener(file);
		}

		@Override
		public void onDirectoryCreate(File directory) {
			notifyListener(directory);
		}

		@Override
		public void onDirectoryDelete(File directory) {
			notifyListener(directory);
		}

		private void notifyListener(File file) {
			String path = PathUtil.normalize(file);
			if (log.isLoggable(Level.FINE)) {
				log.fine("Change detected: " + path); //$NON-NLS-1$
			}
			try {
				listener.fileChanged(path);
			} catch (RuntimeException e) {
				// keep the monitor thread alive
				if (log.isLoggable(Level.SEVERE)) {
					log.log(Level.SEVERE, e.getMessage(), e);
				}
			}
		}
	}
}
