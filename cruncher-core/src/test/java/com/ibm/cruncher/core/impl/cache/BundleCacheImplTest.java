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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotNull;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;

import com.ibm.cruncher.core.cache.CacheStats;
import com.ibm.cruncher.core.cache.IBundleCacheEntry;
import com.ibm.cruncher.core.util.FingerprintUtil;
import com.ibm.cruncher.core.util.PathUtil;

import org.apache.commons.lang3.mutable.MutableLong;
import org.junit.Before;
import org.junit.Test;

import java.io.File;
import java.io.StringWriter;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.CyclicBarrier;
import java.util.regex.Pattern;

public class BundleCacheImplTest {

	private static final String a = PathUtil.normalize(new File("root/css/a.css"));
	private static final String b = PathUtil.normalize(new File("root/css/b.css"));
	private static final String sub = PathUtil.normalize(new File("root/css/sub"));
	private static final String c = PathUtil.normalize(new File("root/css/sub/c.css"));

	private final MutableLong now = new MutableLong(1000000L);
	private BundleCacheImpl cache;

	class TestBundleCacheImpl extends BundleCacheImpl {
		TestBundleCacheImpl(long maxCapacity) {
			super(maxCapacity);
		}
		@Override
		protected long currentTimeMillis() {
			return now.longValue();
		}
	}

	@Before
	public void setUp() {
		cache = new TestBundleCacheImpl(1000);
	}

	@Test
	public void testPutGet() {
		IBundleCacheEntry entry = cache.put("k1", "body{margin:0}", Arrays.asList(a, b), 1);
		assertEquals("k1", entry.getKey());
		assertEquals(FingerprintUtil.contentHash("body{margin:0}"), entry.getContentHash());
		assertEquals(now.longValue(), entry.getCreated());
		assertEquals(now.longValue() + BundleCacheImpl.MILLIS_PER_DAY, entry.getExpires());
		assertSame(entry, cache.get("k1"));
		assertNull(cache.get("k2"));
		assertEquals(1, cache.size());
		CacheStats stats = cache.getStats();
		assertEquals(1, stats.getHits());
		assertEquals(1, stats.getMisses());
	}

	@Test
	public void testExpiry() {
		cache.put("k1", "x", Arrays.asList(a), 1);
		now.add(BundleCacheImpl.MILLIS_PER_DAY - 1);
		assertNotNull(cache.get("k1"));
		now.add(1);
		assertNull(cache.get("k1"));
		assertEquals(0, cache.size());
		assertEquals(0, cache.getIndexSize());
	}

	@Test
	public void testZeroTimeToLive() {
		IBundleCacheEntry entry = cache.put("k1", "x", Arrays.asList(a), 0);
		assertTrue(entry.isExpired(now.longValue()));
		assertNull(cache.get("k1"));
		cache.put("k2", "x", Arrays.asList(a), -5);
		assertNull(cache.get("k2"));
	}

	@Test
	public void testInvalidateFile() {
		cache.put("k1", "1", Arrays.asList(a, b), 1);
		cache.put("k2", "2", Arrays.asList(b), 1);
		cache.put("k3", "3", Arrays.asList(c), 1);
		assertEquals(1, cache.invalidateByPath(a));
		assertNull(cache.get("k1"));
		assertNotNull(cache.get("k2"));
		assertEquals(1, cache.invalidateByPath(new File("root/css/./b.css").getPath()));
		assertEquals(0, cache.invalidateByPath(b));
		assertNotNull(cache.get("k3"));
		assertEquals(2, cache.getStats().getInvalidations());
	}

	@Test
	public void testInvalidateDirectory() {
		// a bundle of a directory depends on the directory and its files
		cache.put("dir", "1", Arrays.asList(sub, c), 1);
		cache.put("file", "2", Arrays.asList(a), 1);
		// a new file in the directory
		assertEquals(1, cache.invalidateByPath(PathUtil.normalize(new File("root/css/sub/new.css"))));
		assertNull(cache.get("dir"));

		cache.put("file2", "3", Arrays.asList(c), 1);
		// removal of a whole directory tree
		assertEquals(2, cache.invalidateByPath(PathUtil.normalize(new File("root/css"))));
		assertEquals(0, cache.size());
		assertEquals(0, cache.getIndexSize());
	}

	@Test
	public void testInvalidateDoesNotMatchSiblingPrefix() {
		cache.put("k1", "1", Arrays.asList(PathUtil.normalize(new File("root/css/sub2/d.css"))), 1);
		assertEquals(0, cache.invalidateByPath(sub));
		assertEquals(1, cache.size());
	}

	@Test
	public void testReplaceKeepsIndexConsistent() {
		cache.put("k1", "1", Arrays.asList(a, b), 1);
		cache.put("k1", "2", Arrays.asList(b, c), 1);
		assertEquals(0, cache.invalidateByPath(a));
		assertEquals(1, cache.invalidateByPath(c));
		assertEquals(0, cache.getIndexSize());
	}

	@Test
	public void testEviction() {
		char[] chars = new char[400];
		Arrays.fill(chars, 'x');
		String content = new String(chars);
		cache.put("k1", content, Arrays.asList(a), 1);
		cache.put("k2", content, Arrays.asList(b), 1);
		cache.put("k3", content, Arrays.asList(c), 1);
		assertEquals(2, cache.size());
		assertNull(cache.get("k1"));
		assertEquals(1, cache.getStats().getEvictions());
		// the index entry of the evicted bundle is gone
		assertEquals(0, cache.invalidateByPath(a));
		assertEquals(2, cache.getIndexSize());
	}

	@Test
	public void testRemoveAndClear() {
		cache.put("k1", "1", Arrays.asList(a), 1);
		cache.put("k2", "2", Arrays.asList(b), 1);
		assertTrue(cache.remove("k1"));
		assertFalse(cache.remove("k1"));
		assertEquals(Collections.singleton("k2"), cache.getKeys());
		cache.clear();
		assertEquals(0, cache.size());
		assertEquals(0, cache.getIndexSize());
	}

	@Test
	public void testEmptyContent() {
		cache.put("k1", "", Collections.<String>emptyList(), 1);
		assertEquals("", cache.get("k1").getContent());
	}

	@Test
	public void testDump() throws Exception {
		cache.put("css:min:1", "1", Arrays.asList(a), 1);
		cache.put("js:min:2", "2", Arrays.asList(b), 1);
		StringWriter writer = new StringWriter();
		cache.dump(writer, Pattern.compile("^css:"));
		String dump = writer.toString();
		assertTrue(dump, dump.contains("Bundle key: css:min:1"));
		assertFalse(dump, dump.contains("Bundle key: js:min:2"));
		assertTrue(dump, dump.contains("Number of bundle cache entries = 2"));
	}

	@Test
	public void testConcurrentPutAndInvalidate() throws Exception {
		final BundleCacheImpl cache = new BundleCacheImpl(1000000);
		final CountDownLatch start = new CountDownLatch(1);
		final List<String> paths = Arrays.asList(a, b, c);
		Thread[] threads = new Thread[4];
		for (int i = 0; i < threads.length; i++) {
			final int id = i;
			threads[i] = new Thread(new Runnable() {
				@Override
				public void run() {
					try {
						start.await();
					} catch (InterruptedException e) {
						return;
					}
					for (int j = 0; j < 200; j++) {
						String path = paths.get(j % paths.size());
						if (id % 2 == 0) {
							cache.put("k" + id + "-" + j, "x", Collections.singletonList(path), 1);
						} else {
							cache.invalidateByPath(path);
						}
					}
				}
			});
			threads[i].start();
		}
		start.countDown();
		for (Thread thread : threads) {
			thread.join();
		}
		for (String path : paths) {
			cache.invalidateByPath(path);
		}
		assertEquals(0, cache.size());
		assertEquals(0, cache.getIndexSize());
	}

	@Test
	public void testConcurrentPutAndInvalidateSameKey() throws Exception {
		final BundleCacheImpl cache = new BundleCacheImpl(1000000);
		final CyclicBarrier barrier = new CyclicBarrier(2);
		for (int i = 0; i < 2000; i++) {
			cache.put("k", "old", Collections.singletonList(a), 1);
			Thread putter = new Thread(new Runnable() {
				@Override
				public void run() {
					try {
						barrier.await();
					} catch (Exception e) {
						return;
					}
					cache.put("k", "new", Collections.singletonList(a), 1);
				}
			});
			Thread invalidator = new Thread(new Runnable() {
				@Override
				public void run() {
					try {
						barrier.await();
					} catch (Exception e) {
						return;
					}
					cache.invalidateByPath(a);
				}
			});
			putter.start();
			invalidator.start();
			putter.join();
			invalidator.join();
			// whichever entry survived must still be reachable through its dependency
			assertTrue(cache.invalidateByPath(a) <= 1);
			assertNull("trial " + i, cache.get("k"));
			assertEquals("trial " + i, 0, cache.getIndexSize());
		}
	}

	@Test
	public void testReplacedEntryKeepsSharedDependencies() {
		cache.put("k1", "one", Arrays.asList(a, b), 1);
		cache.put("k1", "two", Arrays.asList(b, c), 1);
		assertEquals(2, cache.getIndexSize());
		assertEquals(0, cache.invalidateByPath(a));
		assertEquals(1, cache.invalidateByPath(c));
		assertNull(cache.get("k1"));
		assertEquals(0, cache.getIndexSize());
	}
}
