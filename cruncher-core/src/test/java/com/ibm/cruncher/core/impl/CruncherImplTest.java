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

package com.ibm.cruncher.core.impl;

import static org.easymock.EasyMock.anyInt;
import static org.easymock.EasyMock.anyLong;
import static org.easymock.EasyMock.createMock;
import static org.easymock.EasyMock.expect;
import static org.easymock.EasyMock.isA;
import static org.easymock.EasyMock.replay;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotNull;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import com.ibm.cruncher.core.AccessDeniedException;
import com.ibm.cruncher.core.BundleType;
import com.ibm.cruncher.core.CircularImportException;
import com.ibm.cruncher.core.ErrorKind;
import com.ibm.cruncher.core.IBundle;
import com.ibm.cruncher.core.fetch.IRemoteFetcher;
import com.ibm.cruncher.core.impl.executors.ExecutorsImpl;
import com.ibm.cruncher.core.options.IOptions;
import com.ibm.cruncher.core.test.TestUtils;
import com.ibm.cruncher.core.transformer.ITransformer;
import com.ibm.cruncher.core.transformer.TransformResult;
import com.ibm.cruncher.core.util.FingerprintUtil;
import com.ibm.cruncher.core.watch.IFileWatcher;

import com.google.common.io.Files;

import org.apache.commons.lang3.StringUtils;
import org.easymock.IAnswer;
import org.junit.After;
import org.junit.Before;
import org.junit.Test;

import java.io.File;
import java.io.IOException;
import java.net.URL;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.CyclicBarrier;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

public class CruncherImplTest {

	private File tmpdir;
	private File cssDir;
	private IRemoteFetcher fetcher;
	private CruncherImpl cruncher;

	@Before
	public void setUp() throws Exception {
		tmpdir = Files.createTempDir();
		cssDir = new File(tmpdir, "css");
		cssDir.mkdirs();
		fetcher = createMock(IRemoteFetcher.class);
	}

	@After
	public void tearDown() throws Exception {
		if (cruncher != null) {
			cruncher.shutdown();
		}
		TestUtils.deleteRecursively(tmpdir);
	}

	@Test
	public void testGetOrBuildBundle() throws Exception {
		File style = TestUtils.createTestFile(cssDir, "style.css", "body {\n  margin: 0;\n}\n");
		replay(fetcher);
		newCruncher();
		List<String> ids = Arrays.asList("style.css");

		IBundle bundle = cruncher.getOrBuildBundle(ids, BundleType.CSS, true);
		assertEquals("body{margin:0}", bundle.getContent());
		assertEquals(BundleType.CSS, bundle.getType());
		assertFalse(bundle.isFromCache());
		assertEquals(FingerprintUtil.fingerprint(ids), bundle.getFingerprint());
		assertEquals("\"" + FingerprintUtil.contentHash("body{margin:0}") + "\"", bundle.getETag());
		assertEquals(1, cruncher.getCache().size());
		assertTrue(cruncher.getCache().getKeys().contains("css:min:" + bundle.getFingerprint()));

		// served from the cache without reading the file
		style.delete();
		IBundle cached = cruncher.getOrBuildBundle(ids, BundleType.CSS, true);
		assertTrue(cached.isFromCache());
		assertEquals(bundle.getContent(), cached.getContent());
		assertEquals(bundle.getETag(), cached.getETag());

		// the unminified bundle has its own cache key
		try {
			cruncher.getOrBuildBundle(ids, BundleType.CSS, false);
			fail("Expected exception");
		} catch (IOException e) {
			assertEquals(ErrorKind.NOT_FOUND, ErrorKind.of(e));
		}
		assertEquals(1, cruncher.getCache().size());
		assertEquals(1, cruncher.getCache().getStats().getHits());
	}

	@Test
	public void testInvalidate() throws Exception {
		File a = TestUtils.createTestFile(cssDir, "a.css", "@import url(b.css);\n.a{}");
		File b = TestUtils.createTestFile(cssDir, "b.css", ".b{}");
		replay(fetcher);
		newCruncher();
		List<String> ids = Arrays.asList("a.css");
		assertEquals(".b{}\n.a{}", cruncher.getOrBuildBundle(ids, BundleType.CSS, false).getContent());

		TestUtils.updateTestFile(b, ".b{color:red}");
		assertTrue(cruncher.getOrBuildBundle(ids, BundleType.CSS, false).isFromCache());
		assertEquals(0, cruncher.invalidate(new File(cssDir, "other.css").getPath()));
		assertEquals(1, cruncher.invalidate(b.getPath()));

		IBundle rebuilt = cruncher.getOrBuildBundle(ids, BundleType.CSS, false);
		assertFalse(rebuilt.isFromCache());
		assertEquals(".b{color:red}\n.a{}", rebuilt.getContent());
		assertTrue(rebuilt.getLastModified() >= a.lastModified());
	}

	@Test
	public void testFileWatcher() throws Exception {
		File b = TestUtils.createTestFile(cssDir, "lib/b.css", ".b{}");
		replay(fetcher);
		newCruncher(IOptions.WATCH_FILES, "true", IOptions.WATCH_INTERVAL, "0");
		assertNotNull(cruncher.getFileWatcher());
		List<String> file = Arrays.asList("lib/b.css");
		List<String> dir = Arrays.asList("lib");
		cruncher.getOrBuildBundle(file, BundleType.CSS, false);
		cruncher.getOrBuildBundle(dir, BundleType.CSS, false);
		cruncher.getFileWatcher().checkNow();
		assertEquals(2, cruncher.getCache().size());

		TestUtils.updateTestFile(b, ".b{color:red}");
		cruncher.getFileWatcher().checkNow();
		assertEquals(0, cruncher.getCache().size());
		assertEquals(".b{color:red}", cruncher.getOrBuildBundle(file, BundleType.CSS, false).getContent());

		cruncher.getOrBuildBundle(dir, BundleType.CSS, false);
		TestUtils.createTestFile(cssDir, "lib/c.css", ".c{}");
		cruncher.getFileWatcher().checkNow();
		// only the directory bundle depends on the new file
		assertEquals(1, cruncher.getCache().size());
		assertEquals(".b{color:red}\n.c{}", cruncher.getOrBuildBundle(dir, BundleType.CSS, false).getContent());
	}

	@Test
	public void testCacheFilesDisabled() throws Exception {
		TestUtils.createTestFile(cssDir, "a.css", ".a{}");
		replay(fetcher);
		newCruncher(IOptions.CACHE_FILES, "false");
		List<String> ids = Arrays.asList("a.css");
		assertFalse(cruncher.getOrBuildBundle(ids, BundleType.CSS, false).isFromCache());
		IBundle bundle = cruncher.getOrBuildBundle(ids, BundleType.CSS, false);
		assertFalse(bundle.isFromCache());
		assertEquals(".a{}", bundle.getContent());
		assertEquals(0, cruncher.getCache().size());
	}

	@Test
	public void testConcurrentRequestsBuildOnce() throws Exception {
		final AtomicInteger fetches = new AtomicInteger();
		final CountDownLatch started = new CountDownLatch(1);
		final CountDownLatch release = new CountDownLatch(1);
		expect(fetcher.fetch(isA(URL.class), anyLong(), anyInt())).andAnswer(new IAnswer<String>() {
			@Override
			public String answer() throws Throwable {
				fetches.incrementAndGet();
				started.countDown();
				release.await(10, TimeUnit.SECONDS);
				return "var slow = 1;";
			}
		}).anyTimes();
		replay(fetcher);
		newCruncher(IOptions.ALLOW_REMOTE_DOWNLOADS, "true");

		final List<String> ids = Arrays.asList("http://cdn/slow.js");
		final int count = 8;
		final CyclicBarrier barrier = new CyclicBarrier(count);
		final IBundle[] results = new IBundle[count];
		final Throwable[] errors = new Throwable[count];
		Thread[] threads = new Thread[count];
		for (int i = 0; i < count; i++) {
			final int index = i;
			threads[i] = new Thread(new Runnable() {
				@Override
				public void run() {
					try {
						barrier.await();
						results[index] = cruncher.getOrBuildBundle(ids, BundleType.JS, false);
					} catch (Throwable t) {
						errors[index] = t;
					}
				}
			});
			threads[i].start();
		}
		assertTrue(started.await(10, TimeUnit.SECONDS));
		Thread.sleep(200);
		release.countDown();
		for (Thread thread : threads) {
			thread.join(10000);
		}
		assertEquals(1, fetches.get());
		for (int i = 0; i < count; i++) {
			assertNull(errors[i]);
			assertEquals("var slow = 1;", results[i].getContent());
		}
		assertEquals(1, cruncher.getCache().size());
	}

	@Test
	public void testPrebuild() throws Exception {
		TestUtils.createTestFile(cssDir, "a.css", ".a { color : red }");
		replay(fetcher);
		newCruncher();
		List<String> ids = Arrays.asList("a.css");
		Future<IBundle> future = cruncher.prebuild(ids, BundleType.CSS, true);
		assertEquals(".a{color:red}", future.get().getContent());
		assertTrue(cruncher.getOrBuildBundle(ids, BundleType.CSS, true).isFromCache());

		cruncher.shutdown();
		try {
			cruncher.prebuild(ids, BundleType.CSS, true);
			fail("Expected exception");
		} catch (RejectedExecutionException e) {
		}
		cruncher = null;
	}

	@Test
	public void testOptionsUpdateClearsCache() throws Exception {
		TestUtils.createTestFile(cssDir, "a.css", ".a{}");
		replay(fetcher);
		newCruncher();
		cruncher.getOrBuildBundle(Arrays.asList("a.css"), BundleType.CSS, false);
		assertEquals(1, cruncher.getCache().size());
		cruncher.getOptions().setOption(IOptions.CACHE_DAYS, "2");
		assertEquals(0, cruncher.getCache().size());
	}

	@Test
	public void testFailuresAreNotCached() throws Exception {
		TestUtils.createTestFile(cssDir, "a.css", "@import \"b.css\";");
		TestUtils.createTestFile(cssDir, "b.css", "@import \"a.css\";");
		TestUtils.createTestFile(tmpdir, "secret.css", ".secret{}");
		replay(fetcher);
		newCruncher();
		try {
			cruncher.getOrBuildBundle(Arrays.asList("a.css"), BundleType.CSS, false);
			fail("Expected exception");
		} catch (CircularImportException e) {
			assertEquals(3, e.getImportChain().size());
		}
		try {
			cruncher.getOrBuildBundle(Arrays.asList("../secret.css"), BundleType.CSS, false);
			fail("Expected exception");
		} catch (AccessDeniedException e) {
			assertEquals(403, ErrorKind.of(e).getStatus());
		}
		assertEquals(0, cruncher.getCache().size());
	}

	@Test
	public void testCoffeeScript() throws Exception {
		TestUtils.createTestFile(tmpdir, "js/app.coffee", "square = (x) -> x * x");
		replay(fetcher);
		newCruncher(IOptions.COFFEESCRIPT_COMPILER, "com/ibm/cruncher/core/impl/transformer/test-coffee-compiler.js");
		IBundle bundle = cruncher.getOrBuildBundle(Arrays.asList("app.coffee"), BundleType.JS, false);
		assertEquals("var square = function(x) { return x * x; };", bundle.getContent());
	}

	@Test
	public void testRegisteredTransformer() throws Exception {
		TestUtils.createTestFile(cssDir, "a.scss", "$c: red;");
		replay(fetcher);
		newCruncher();
		List<String> ids = Arrays.asList("a.scss");
		try {
			cruncher.getOrBuildBundle(ids, BundleType.CSS, false);
			fail("Expected exception");
		} catch (AccessDeniedException e) {
		}
		cruncher.getTransformers().register(new ITransformer() {
			@Override
			public Collection<String> getExtensions() {
				return Collections.singletonList(".scss");
			}
			@Override
			public BundleType getBundleType() {
				return BundleType.CSS;
			}
			@Override
			public TransformResult transform(String source, String path) {
				return new TransformResult(".compiled{}");
			}
		});
		assertEquals(".compiled{}", cruncher.getOrBuildBundle(ids, BundleType.CSS, false).getContent());
	}

	@Test
	public void testOptionsUpdateWatchesNewRoots() throws Exception {
		replay(fetcher);
		newCruncher(IOptions.WATCH_FILES, "true", IOptions.WATCH_INTERVAL, "0");
		IFileWatcher oldWatcher = cruncher.getFileWatcher();
		// created after the cruncher, so not watched until the options change
		File s = TestUtils.createTestFile(tmpdir, "styles/s.css", ".s{}");
		cruncher.getOptions().setOption(IOptions.CSS_PATHS, "styles");
		assertNotNull(cruncher.getFileWatcher());
		assertFalse(oldWatcher == cruncher.getFileWatcher());

		List<String> ids = Arrays.asList("s.css");
		assertEquals(".s{}", cruncher.getOrBuildBundle(ids, BundleType.CSS, false).getContent());
		assertEquals(1, cruncher.getCache().size());
		TestUtils.updateTestFile(s, ".s{color:red}");
		cruncher.getFileWatcher().checkNow();
		assertEquals(0, cruncher.getCache().size());
		assertEquals(".s{color:red}", cruncher.getOrBuildBundle(ids, BundleType.CSS, false).getContent());

		cruncher.getOptions().setOption(IOptions.WATCH_FILES, false);
		assertNull(cruncher.getFileWatcher());
	}

	@Test
	public void testIdentifierAboveFileSystemRoot() throws Exception {
		replay(fetcher);
		newCruncher();
		try {
			cruncher.getOrBuildBundle(Arrays.asList(StringUtils.repeat("../", 18) + "x.css"), BundleType.CSS, false);
			fail("Expected exception");
		} catch (AccessDeniedException e) {
			assertEquals(ErrorKind.ACCESS_DENIED, ErrorKind.of(e));
		}
	}

	@Test
	public void testAutoPrefixer() throws Exception {
		replay(fetcher);
		TestUtils.createTestFile(cssDir, "a.css", ".a{display:flex}");
		TestUtils.createTestFile(cssDir, "b.css", ".b{color:red}");
		newCruncher(IOptions.AUTOPREFIXER, "com/ibm/cruncher/core/impl/transformer/test-autoprefixer.js");
		List<String> ids = Arrays.asList("a.css", "b.css");
		assertEquals(".a{-webkit-display:flex;display:flex}\n.b{color:red}",
				cruncher.getOrBuildBundle(ids, BundleType.CSS, false).getContent());
		// prefixed before minification
		assertEquals(".a{-webkit-display:flex;display:flex}.b{color:red}",
				cruncher.getOrBuildBundle(ids, BundleType.CSS, true).getContent());
		TestUtils.createTestFile(tmpdir, "js/a.js", "var display = 'flex';");
		assertEquals("var display = 'flex';",
				cruncher.getOrBuildBundle(Arrays.asList("a.js"), BundleType.JS, false).getContent());
	}

	@Test
	public void testShutdown() throws Exception {
		replay(fetcher);
		newCruncher(IOptions.WATCH_FILES, "true", IOptions.WATCH_INTERVAL, "0");
		assertSame(tmpdir, cruncher.getBaseDir());
		IFileWatcher watcher = cruncher.getFileWatcher();
		cruncher.shutdown();
		assertNull(cruncher.getFileWatcher());
		try {
			watcher.watchPath(cssDir, cruncher);
			fail("Expected exception");
		} catch (IllegalStateException e) {
		}
		cruncher = null;
	}

	private CruncherImpl newCruncher(String... namesAndValues) throws IOException {
		String[] options = Arrays.copyOf(namesAndValues, namesAndValues.length + 2);
		if (!Arrays.asList(namesAndValues).contains(IOptions.WATCH_FILES)) {
			options[namesAndValues.length] = IOptions.WATCH_FILES;
			options[namesAndValues.length + 1] = "false";
		} else {
			options = namesAndValues;
		}
		cruncher = new CruncherImpl(tmpdir, TestUtils.createOptions(options), new ExecutorsImpl(), fetcher);
		return cruncher;
	}
}
