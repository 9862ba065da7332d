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

package com.ibm.cruncher.core.cache;

import java.io.IOException;
import java.io.Writer;
import java.util.Collection;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * The store of built bundles. Each entry carries the set of files the
 * bundle was built from, and is removed as soon as any of those files is
 * reported changed through {@link #invalidateByPath(String)}.
 * <p>
 * All operations are thread safe.
 */
public interface IBundleCache {

	/**
	 * Returns the entry for the key. An expired entry is removed and null is
	 * returned.
	 *
	 * @param key the cache key
	 * @return the entry, or null
	 */
	public IBundleCacheEntry get(String key);

	/**
	 * Stores an entry, replacing any existing entry for the key.
	 *
	 * @param key
	 *            the cache key
	 * @param content
	 *            the bundle text
	 * @param dependencies
	 *            the normalized paths of the files the bundle was built from
	 * @param ttlDays
	 *            the time to live in days. Zero or less means the entry is
	 *            expired as soon as it is stored.
	 * @return the new entry
	 */
	public IBundleCacheEntry put(String key, String content, Collection<String> dependencies, int ttlDays);

	/**
	 * Removes every entry that depends on <code>path</code>, on a file or
	 * directory below <code>path</code>, or on a directory containing
	 * <code>path</code>.
	 *
	 * @param path the path of the changed file or directory
	 * @return the number of entries removed
	 */
	public int invalidateByPath(String path);

	/**
	 * @param key the cache key
	 * @return true if an entry was removed
	 */
	public boolean remove(String key);

	public void clear();

	public int size();

	/**
	 * @return a snapshot of the keys in the cache
	 */
	public Set<String> getKeys();

	/**
	 * Writes a description of the entries whose keys match
	 * <code>filter</code> to <code>writer</code>.
	 *
	 * @param writer
	 *            the target writer
	 * @param filter
	 *            the key filter, or null for all entries
	 * @throws IOException
	 */
	public void dump(Writer writer, Pattern filter) throws IOException;

	public CacheStats getStats();
}
