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

/**
 * A snapshot of the bundle cache counters.
 */
public class CacheStats {

	private final long hits;
	private final long misses;
	private final long invalidations;
	private final long evictions;

	public CacheStats(long hits, long misses, long invalidations, long evictions) {
		this.hits = hits;
		this.misses = misses;
		this.invalidations = invalidations;
		this.evictions = evictions;
	}

	public long getHits() {
		return hits;
	}

	/**
	 * @return the number of lookups that found no entry or an expired one
	 */
	public long getMisses() {
		return misses;
	}

	/**
	 * @return the number of entries removed because a file they depend on
	 *         changed
	 */
	public long getInvalidations() {
		return invalidations;
	}

	/**
	 * @return the number of entries removed to keep the cache within its
	 *         capacity
	 */
	public long getEvictions() {
		return evictions;
	}

	@Override
	public String toString() {
		return new StringBuffer("hits:").append(hits) //$NON-NLS-1$
				.append(", misses:").append(misses) //$NON-NLS-1$
				.append(", invalidations:").append(invalidations) //$NON-NLS-1$
				.append(", evictions:").append(evictions).toString(); //$NON-NLS-1$
	}
}
