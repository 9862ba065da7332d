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

package com.ibm.cruncher.core.deps;

import com.ibm.cruncher.core.util.PathUtil;

import java.io.File;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Accumulates the files that were read, directly or through imports, while
 * building one bundle.
 * <p>
 * Each build owns its own tracker, so instances are not shared between
 * threads and need no locking. Paths are recorded in normalized absolute
 * form (see {@link PathUtil#normalize(File)}) in the order in which they are
 * first added. Once the build completes the tracker is frozen and its
 * {@link #contents()} become the dependency set of the cache entry.
 */
public class DependencyTracker {

	private final Set<String> paths = new LinkedHashSet<String>();

	private boolean frozen = false;

	/**
	 * Adds a file to the set. Adding a file that is already present has no
	 * effect.
	 *
	 * @param file the file
	 * @return true if the file was not already present
	 * @throws IllegalStateException if the tracker is frozen
	 */
	public boolean add(File file) {
		return add(PathUtil.normalize(file));
	}

	/**
	 * Adds a path to the set. The path is normalized first.
	 *
	 * @param path the path
	 * @return true if the path was not already present
	 * @throws IllegalStateException if the tracker is frozen
	 */
	public boolean add(String path) {
		if (frozen) {
			throw new IllegalStateException();
		}
		return paths.add(PathUtil.normalize(path));
	}

	/**
	 * @param path a path, normalized before the lookup
	 * @return true if the path has been added
	 */
	public boolean contains(String path) {
		return paths.contains(PathUtil.normalize(path));
	}

	public int size() {
		return paths.size();
	}

	/**
	 * Prevents further additions.
	 */
	public void freeze() {
		frozen = true;
	}

	public boolean isFrozen() {
		return frozen;
	}

	/**
	 * Returns an immutable snapshot of the paths, in the order they were
	 * first added.
	 *
	 * @return the paths
	 */
	public Set<String> contents() {
		return Collections.unmodifiableSet(new LinkedHashSet<String>(paths));
	}

	@Override
	public String toString() {
		return paths.toString();
	}
}
