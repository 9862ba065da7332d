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

package com.ibm.cruncher.core.impl.cache;

import com.ibm.cruncher.core.cache.CacheStats;
import com.ibm.cruncher.core.cache.IBundleCache;
import com.ibm.cruncher.core.cache.IBundleCacheEntry;
import com.ibm.cruncher.core.util.PathUtil;

import com.googlecode.concurrentlinkedhashmap.ConcurrentLinkedHashMap;
import com.googlecode.concurrentlinkedhashmap.EvictionListener;
import com.googlecode.concurrentlinkedhashmap.Weigher;

import java.io.File;
import java.io.IOException;
import java.io.Writer;
import java.text.MessageFormat;
import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Bundle cache implementation backed by a {@link ConcurrentLinkedHashMap}
 * whose capacity is measured in characters of bundle text, with LRU eviction
 * of entries when the capacity is exceeded.
 * <p>
 * A reverse index maps each dependency path to the keys of the entries that
 * depend on it, so that {@link #invalidateByPath(String)} only visits the
 * affected entries. The index is a sorted map, which lets the entries that
 * depend on anything below a directory be found with a range scan. Lookups
 * do not touch the index. Changes to the map and to the index are made
 * together while holding the index lock, so an entry in the map is always
 * indexed under all of its dependencies.
 */
public class BundleCacheImpl implements IBundleCache {
	private static final String sourceClass = BundleCacheImpl.class.getName();
	private static final Logger log = Logger.getLogger(sourceClass);

	static final long MILLIS_PER_DAY = TimeUnit.DAYS.toMillis(1);

	private final ConcurrentLinkedHashMap<String, BundleCacheEntry> cacheMap;

	/** dependency path to cache keys. Guarded by itself */
	private final TreeMap<String, Set<String>> index = new TreeMap<String, Set<String>>();

	private final AtomicLong hits = new AtomicLong();
	private final AtomicLong misses = new AtomicLong();
	private final AtomicLong invalidations = new AtomicLong();
	private final AtomicLong evictions = new AtomicLong();

	/**
	 * @param maxCapacity
	 *            the maximum number of characters of bundle text held in the
	 *            cache
	 */
	public BundleCacheImpl(long maxCapacity) {
		cacheMap = new ConcurrentLinkedHashMap.Builder<String, BundleCacheEntry>()
				.maximumWeightedCapacity(maxCapacity)
				.listener(newEvictionListener())
				.weigher(newWeigher())
				.build();
	}

	/* (non-Javadoc)
	 * @see com.ibm.cruncher.core.cache.IBundleCache#get(java.lang.String)
	 */
	@Override
	public IBundleCacheEntry get(String key) {
		BundleCacheEntry entry = cacheMap.get(key);
		if (entry != null && entry.isExpired(currentTimeMillis())) {
			if (log.isLoggable(Level.FINE)) {
				log.fine("Expired: " + key); //$NON-NLS-1$
			}
			synchronized (index) {
				if (cacheMap.remove(key, entry)) {
					unindexRemoved(key, entry);
				}
			}
			entry = null;
		}
		if (entry == null) {
			misses.incrementAndGet();
		} else {
			hits.incrementAndGet();
		}
		return entry;
	}

	/* (non-Javadoc)
	 * @see com.ibm.cruncher.core.cache.IBundleCache#put(java.lang.String, java.lang.String, java.util.Collection, int)
	 */
	@Override
	public IBundleCacheEntry put(String key, String content, Collection<String> dependencies, int ttlDays) {
		long now = currentTimeMillis();
		// a non-positive time to live expires the entry immediately
		long expires = ttlDays > 0 ? now + ttlDays * MILLIS_PER_DAY : now;
		BundleCacheEntry entry = new BundleCacheEntry(key, content, dependencies, now, expires);
		synchronized (index) {
			// index before storing so that an immediate eviction finds the entry indexed
			index(key, entry.getDependencies());
			BundleCacheEntry oldEntry = cacheMap.put(key, entry);
			if (oldEntry != null) {
				unindex(key, oldEntry.getDependencies(), entry.getDependencies());
			}
		}
		if (log.isLoggable(Level.FINE)) {
			log.fine("Cached " + key + ": " + entry); //$NON-NLS-1$ //$NON-NLS-2$
		}
		return entry;
	}

	/* (non-Javadoc)
	 * @see com.ibm.cruncher.core.cache.IBundleCache#invalidateByPath(java.lang.String)
	 */
	@Override
	public int invalidateByPath(String path) {
		final String sourceMethod = "invalidateByPath"; //$NON-NLS-1$
		final boolean isTraceLogging = log.isLoggable(Level.FINER);
		if (isTraceLogging) {
			log.entering(sourceClass, sourceMethod, new Object[]{path});
		}
		String normalized = PathUtil.normalize(path);
		Set<String> keys = new HashSet<String>();
		int count = 0;
		synchronized (index) {
			addKeys(keys, normalized);
			// directory bundles containing the path
			for (String ancestor : PathUtil.ancestors(normalized)) {
				addKeys(keys, ancestor);
			}
			// files and directories below the path
			String prefix = normalized.endsWith(File.separator) ? normalized : normalized + File.separator;
			for (Map.Entry<String, Set<String>> entry : index.tailMap(prefix, true).entrySet()) {
				if (!entry.getKey().startsWith(prefix)) {
					break;
				}
				keys.addAll(entry.getValue());
			}
			for (String key : keys) {
				BundleCacheEntry entry = cacheMap.remove(key);
				if (entry != null) {
					unindexRemoved(key, entry);
					count++;
				}
			}
		}
		invalidations.addAndGet(count);
		if (count > 0 && log.isLoggable(Level.INFO)) {
			log.info(MessageFormat.format(Messages.BundleCacheImpl_0, count, normalized));
		}
		if (isTraceLogging) {
			log.exiting(sourceClass, sourceMethod, count);
		}
		return count;
	}

	/* (non-Javadoc)
	 * @see com.ibm.cruncher.core.cache.IBundleCache#remove(java.lang.String)
	 */
	@Override
	public boolean remove(String key) {
		synchronized (index) {
			BundleCacheEntry entry = cacheMap.remove(key);
			if (entry != null) {
				unindexRemoved(key, entry);
			}
			return entry != null;
		}
	}

	/* (non-Javadoc)
	 * @see com.ibm.cruncher.core.cache.IBundleCache#clear()
	 */
	@Override
	public void clear() {
		synchronized (index) {
			cacheMap.clear();
			index.clear();
		}
		if (log.isLoggable(Level.INFO)) {
			log.info(Messages.BundleCacheImpl_1);
		}
	}

	@Override
	public int size() {
		return cacheMap.size();
	}

	@Override
	public Set<String> getKeys() {
		return Collections.unmodifiableSet(new LinkedHashSet<String>(cacheMap.ascendingKeySet()));
	}

	/* (non-Javadoc)
	 * @see com.ibm.cruncher.core.cache.IBundleCache#dump(java.io.Writer, java.util.regex.Pattern)
	 */
	@Override
	public void dump(Writer writer, Pattern filter) throws IOException {
		String linesep = System.getProperty("line.separator"); //$NON-NLS-1$
		for (Map.Entry<String, BundleCacheEntry> entry : cacheMap.entrySet()) {
			if (filter != null) {
				Matcher m = filter.matcher(entry.getKey());
				if (!m.find())
					continue;
			}
			writer.append("Bundle key: ").append(entry.getKey()).append(linesep); //$NON-NLS-1$
			writer.append(entry.getValue().toString()).append(linesep).append(linesep);
		}
		writer.append("Number of bundle cache entries = ").append(Integer.toString(cacheMap.size())).append(linesep); //$NON-NLS-1$
		writer.append("Bundle cache statistics = ").append(getStats().toString()).append(linesep); //$NON-NLS-1$
	}

	@Override
	public CacheStats getStats() {
		return new CacheStats(hits.get(), misses.get(), invalidations.get(), evictions.get());
	}

	/**
	 * @return the maximum number of characters of bundle text held
	 */
	public long getCapacity() {
		return cacheMap.capacity();
	}

	/**
	 * Returns the current time. Tests override this to control expiry.
	 *
	 * @return the current time in milliseconds
	 */
	protected long currentTimeMillis() {
		return System.currentTimeMillis();
	}

	/**
	 * @return the number of paths in the reverse index
	 */
	int getIndexSize() {
		synchronized (index) {
			return index.size();
		}
	}

	private void addKeys(Set<String> keys, String path) {
		Set<String> dependents = index.get(path);
		if (dependents != null) {
			keys.addAll(dependents);
		}
	}

	/**
	 * Unindexes an entry that is no longer in the map. If the key has been
	 * mapped to a newer entry in the meantime, the paths that the newer entry
	 * depends on stay indexed.
	 */
	private void unindexRemoved(String key, BundleCacheEntry removed) {
		synchronized (index) {
			BundleCacheEntry current = cacheMap.getQuietly(key);
			Set<String> retain = current == null || current == removed ?
					Collections.<String>emptySet() : current.getDependencies();
			unindex(key, removed.getDependencies(), retain);
		}
	}

	private void index(String key, Set<String> dependencies) {
		synchronized (index) {
			for (String path : dependencies) {
				Set<String> keys = index.get(path);
				if (keys == null) {
					keys = new HashSet<String>();
					index.put(path, keys);
				}
				keys.add(key);
			}
		}
	}

	/**
	 * Removes the key from the index entries of <code>dependencies</code>,
	 * except for the paths in <code>retain</code>.
	 */
	private void unindex(String key, Set<String> dependencies, Set<String> retain) {
		synchronized (index) {
			for (String path : dependencies) {
				if (retain.contains(path)) {
					continue;
				}
				Set<String> keys = index.get(path);
				if (keys != null) {
					keys.remove(key);
					if (keys.isEmpty()) {
						index.remove(path);
					}
				}
			}
		}
	}

	protected EvictionListener<String, BundleCacheEntry> newEvictionListener() {
		return new EvictionListener<String, BundleCacheEntry>() {
			@Override
			public void onEviction(String key, BundleCacheEntry entry) {
				evictions.incrementAndGet();
				unindexRemoved(key, entry);
				if (log.isLoggable(Level.INFO)) {
					log.info(MessageFormat.format(Messages.BundleCacheImpl_2, key, entry.getContent().length()));
				}
			}
		};
	}

	protected Weigher<BundleCacheEntry> newWeigher() {
		return new Weigher<BundleCacheEntry>() {
			@Override
			public int weightOf(BundleCacheEntry entry) {
				// ConcurrentLinkedHashMap barfs on size == 0
				int size = entry.getContent().length();
				return size > 0 ? size : 1;
			}
		};
	}
}
