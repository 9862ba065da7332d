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

package com.ibm.cruncher.core.watch;

import java.io.File;
import java.io.IOException;

/**
 * Watches directory trees for changes.
 */
public interface IFileWatcher {

	/**
	 * Starts watching the directory tree rooted at <code>root</code>. Changes
	 * are reported to <code>listener</code> on the watcher's own thread.
	 *
	 * @param root
	 *            the root directory
	 * @param listener
	 *            the listener to notify
	 * @throws IOException
	 *             if the tree cannot be scanned
	 */
	public void watchPath(File root, IFileChangeListener listener) throws IOException;

	/**
	 * Checks all watched trees for changes on the calling thread and notifies
	 * the listeners of any changes found.
	 */
	public void checkNow();

	/**
	 * Stops watching. The watcher cannot be restarted.
	 */
	public void stop();
}
