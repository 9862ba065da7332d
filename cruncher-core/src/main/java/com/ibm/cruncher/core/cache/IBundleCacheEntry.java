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

import java.util.Set;

/**
 * An immutable bundle cache entry.
 */
public interface IBundleCacheEntry {

	/**
	 * @return the cache key
	 */
	public String getKey();

	/**
	 * @return the bundle text
	 */
	public String getContent();

	/**
	 * @return the MD5 hash of the bundle text, as lower case hex
	 */
	public String getContentHash();

	/**
	 * @return the normalized paths of the files the bundle was built from
	 */
	public Set<String> getDependencies();

	/**
	 * @return the time the entry was created, in milliseconds since the epoch
	 */
	public long getCreated();

	/**
	 * @return the time after which the entry is no longer served
	 */
	public long getExpires();

	/**
	 * @param now the current time
	 * @return true if the entry has expired at <code>now</code>
	 */
	public boolean isExpired(long now);
}
