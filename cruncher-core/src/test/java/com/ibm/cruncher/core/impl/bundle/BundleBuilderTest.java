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

import static org.easymock.EasyMock.anyInt;
import static org.easymock.EasyMock.anyLong;
import static org.easymock.EasyMock.createMock;
import static org.easymock.EasyMock.expect;
import static org.easymock.EasyMock.getCurrentArguments;
import static org.easymock.EasyMock.isA;
import static org.easymock.EasyMock.replay;
import static org.easymock.EasyMock.verify;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import com.ibm.cruncher.core.AccessDeniedException;
import com.ibm.cruncher.core.BundleType;
import com.ibm.cruncher.core.NotFoundException;
import com.ibm.cruncher.core.RemoteFetchFailedException;
import com.ibm.cruncher.core.RemoteFetchRejectedException;
import com.ibm.cruncher.core.fetch.IRemoteFetcher;
import com.ibm.cruncher.core.impl.minifier.ClosureJavaScriptMinifier;
import com.ibm.cruncher.core.impl.minifier.CssMinifier;
import com.ibm.cruncher.core.impl.resolver.CssImportResolver;
import com.ibm.cruncher.core.impl.resolver.JavaScriptImportResolver;
import com.ibm.cruncher.core.impl.resolver.SassImportResolver;
import com.ibm.cruncher.core.impl.transformer.LessTransformer;
import com.ibm.cruncher.core.impl.transformer.TransformerRegistryImpl;
import com.ibm.cruncher.core.minifier.IMinifier;
import com.ibm.cruncher.core.options.IOptions;
import com.ibm.cruncher.core.resolver.IImportResolver;
import com.ibm.cruncher.core.test.TestUtils;
import com.ibm.cruncher.core.transformer.ITransformerRegistry;
import com.ibm.cruncher.core.util.PathUtil;

import com.google.common.io.Files;

import org.apache.commons.lang3.StringUtils;
import org.easymock.IAnswer;
import org.junit.After;
import org.junit.Before;
import org.junit.Test;

import java.io.File;
import java.net.URL;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

public class BundleBuilderTest {

	private File tmpdir;
	private IRemoteFetcher fetcher;
	/** Remote responses keyed by URL. A value is either the text or the exception to throw */
	private final Map<String, Object> responses = new HashMap<String, Object>();

	@Before
	public void setUp() throws Exception {
		tmpdir = Files.createTempDir();
		fetcher = createMock(IRemoteFetcher.class);
	}

	@After
	public void tearDown() throws Exception {
		TestUtils.deleteRecursively(tmpdir);
	}

	@Test
	public void testOrderAndJoin() throws Exception {
		File a = TestUtils.createTestFile(tmpdir, "css/a.css", ".a{}");
		File b = TestUtils.createTestFile(tmpdir, "css/b.css", ".b{}");
		BuildResult result = newBuilder().build(Arrays.asList("b.css", " /a.css "), BundleType.CSS, false);
		assertEquals(".b{}\n.a{}", result.getContent());
		assertEquals(Arrays.asList(PathUtil.normalize(b), PathUtil.normalize(a)),
				new ArrayList<String>(result.getDependencies()));
	}

	@Test
	public void testSearchRootOrder() throws Exception {
		TestUtils.createTestFile(tmpdir, "css/x.css", ".first{}");
		TestUtils.createTestFile(tmpdir, "shared/x.css", ".second{}");
		TestUtils.createTestFile(tmpdir, "shared/y.css", ".y{}");
		BuildResult result = newBuilder(IOptions.CSS_PATHS, "css,shared")
				.build(Arrays.asList("x.css", "y.css"), BundleType.CSS, false);
		assertEquals(".first{}\n.y{}", result.getContent());
	}

	@Test
	public void testDirectory() throws Exception {
		File b = TestUtils.createTestFile(tmpdir, "css/lib/b.css", ".b{}");
		File c = TestUtils.createTestFile(tmpdir, "css/lib/a/c.css", ".c{}");
		File readme = TestUtils.createTestFile(tmpdir, "css/lib/readme.txt", "not a style sheet");
		TestUtils.createTestFile(tmpdir, "css/main.css", ".main{}");
		new File(tmpdir, "css/empty").mkdirs();
		BuildResult result = newBuilder().build(Arrays.asList("empty", "lib", "main.css"), BundleType.CSS, false);
		assertEquals(".c{}\n.b{}\n.main{}", result.getContent());
		assertTrue(result.getDependencies().contains(PathUtil.normalize(new File(tmpdir, "css/lib"))));
		assertTrue(result.getDependencies().contains(PathUtil.normalize(new File(tmpdir, "css/empty"))));
		assertTrue(result.getDependencies().contains(PathUtil.normalize(b)));
		assertTrue(result.getDependencies().contains(PathUtil.normalize(c)));
		assertFalse(result.getDependencies().contains(PathUtil.normalize(readme)));
	}

	@Test(expected=NotFoundException.class)
	public void testNotFound() throws Exception {
		newBuilder().build(Arrays.asList("missing.css"), BundleType.CSS, false);
	}

	@Test(expected=AccessDeniedException.class)
	public void testDisallowedType() throws Exception {
		TestUtils.createTestFile(tmpdir, "css/notes.txt", "text");
		newBuilder().build(Arrays.asList("notes.txt"), BundleType.CSS, false);
	}

	@Test(expected=AccessDeniedException.class)
	public void testWrongBundleType() throws Exception {
		TestUtils.createTestFile(tmpdir, "js/app.js", "var a;");
		newBuilder(IOptions.CSS_PATHS, "js").build(Arrays.asList("app.js"), BundleType.CSS, false);
	}

	@Test
	public void testOutsideRoots() throws Exception {
		TestUtils.createTestFile(tmpdir, "secret.css", ".secret{}");
		new File(tmpdir, "css").mkdirs();
		try {
			newBuilder().build(Arrays.asList("../secret.css"), BundleType.CSS, false);
			fail("Expected exception");
		} catch (AccessDeniedException e) {
			assertFalse(e.getMessage().contains(".secret{}"));
		}
	}

	@Test(expected=AccessDeniedException.class)
	public void testAboveFileSystemRoot() throws Exception {
		new File(tmpdir, "css").mkdirs();
		newBuilder().build(Arrays.asList(StringUtils.repeat("../", 18) + "x.css"), BundleType.CSS, false);
	}

	@Test
	public void testStyleSheetPreprocessing() throws Exception {
		TestUtils.createTestFile(tmpdir, "css/a.css", ".a{}/* gone */\n.b{background:url({root}img/x.png)}");
		BuildResult result = newBuilder(IOptions.RELATIVE_CSS_ROOT, "/static/")
				.build(Arrays.asList("a.css"), BundleType.CSS, false);
		assertEquals(".a{} \n.b{background:url(/static/img/x.png)}", result.getContent());
	}

	@Test
	public void testSiteRoot() throws Exception {
		TestUtils.createTestFile(tmpdir, "css/sub/a.css", "@import url(b.css);\n.a{background:url(img/a.png)}");
		TestUtils.createTestFile(tmpdir, "css/sub/b.css", ".b{background:url('img/b.png')}");
		BuildResult result = newBuilder(IOptions.SITE_ROOT, ".")
				.build(Arrays.asList("sub/a.css"), BundleType.CSS, false);
		assertEquals(".b{background:url('/css/sub/img/b.png')}\n.a{background:url(/css/sub/img/a.png)}",
				result.getContent());
		assertEquals(2, result.getDependencies().size());
	}

	@Test
	public void testLess() throws Exception {
		File less = TestUtils.createTestFile(tmpdir, "css/a.less", "// width\n@w: 10px;\n.a { width: @w * 2; }");
		BuildResult result = newBuilder().build(Arrays.asList("a.less"), BundleType.CSS, false);
		assertEquals(".a{width:20px;}", result.getContent().trim());
		assertTrue(result.getDependencies().contains(PathUtil.normalize(less)));
	}

	@Test
	public void testMinify() throws Exception {
		TestUtils.createTestFile(tmpdir, "css/a.css", "body {\n  margin: 0;\n}\n");
		TestUtils.createTestFile(tmpdir, "css/b.css", ".b { color : red }");
		BuildResult result = newBuilder().build(Arrays.asList("a.css", "b.css"), BundleType.CSS, true);
		assertEquals("body{margin:0}.b{color:red}", result.getContent());
	}

	@Test
	public void testJavaScript() throws Exception {
		TestUtils.createTestFile(tmpdir, "js/lib.js", "var lib = {};");
		TestUtils.createTestFile(tmpdir, "js/app.js", "import \"lib.js\";\nvar app = lib;");
		BuildResult result = newBuilder().build(Arrays.asList("app.js"), BundleType.JS, false);
		assertEquals("var lib = {};\nvar app = lib;", result.getContent());
		assertEquals(2, result.getDependencies().size());
	}

	@Test
	public void testRemoteDisabled() throws Exception {
		replay(fetcher);
		try {
			newBuilder().build(Arrays.asList("http://cdn/r.css"), BundleType.CSS, false);
			fail("Expected exception");
		} catch (RemoteFetchRejectedException e) {
			assertTrue(e.getMessage().contains("http://cdn/r.css"));
		}
		verify(fetcher);
	}

	@Test
	public void testRemote() throws Exception {
		TestUtils.createTestFile(tmpdir, "css/a.css", ".a{}");
		responses.put("http://cdn/r.css", ".r{}");
		responses.put("http://cdn/down.css", new RemoteFetchFailedException("connection refused"));
		responses.put("http://cdn/r.less", "@w: 10px;\n.r { width: @w * 2; }");
		expectFetches();
		BuildResult result = newBuilder(IOptions.ALLOW_REMOTE_DOWNLOADS, "true")
				.build(Arrays.asList("http://cdn/r.css", "http://cdn/down.css", "a.css"), BundleType.CSS, false);
		assertEquals(".r{}\n.a{}", result.getContent());
		assertEquals(1, result.getDependencies().size());

		result = newBuilder(IOptions.ALLOW_REMOTE_DOWNLOADS, "true")
				.build(Arrays.asList("http://cdn/r.less"), BundleType.CSS, false);
		assertEquals(".r{width:20px;}", result.getContent().trim());
	}

	@Test(expected=RemoteFetchRejectedException.class)
	public void testRemoteRejected() throws Exception {
		responses.put("http://cdn/huge.css", new RemoteFetchRejectedException("too large"));
		expectFetches();
		newBuilder(IOptions.ALLOW_REMOTE_DOWNLOADS, "true")
				.build(Arrays.asList("http://cdn/huge.css"), BundleType.CSS, false);
	}

	@Test
	public void testWhitelist() throws Exception {
		TestUtils.createTestFile(tmpdir, "js/app.js", "var app = $;");
		responses.put("http://cdn/jquery.js", "var $ = {};");
		expectFetches();
		BuildResult result = newBuilder(
				IOptions.ALLOW_REMOTE_DOWNLOADS, "true",
				IOptions.REMOTE_WHITELIST, "jquery=http://cdn/jquery.js")
				.build(Arrays.asList("JQuery", "app.js"), BundleType.JS, false);
		assertEquals("var $ = {};\nvar app = $;", result.getContent());
	}

	@Test
	public void testGetRoots() throws Exception {
		File abs = new File(tmpdir, "elsewhere").getAbsoluteFile();
		BundleBuilder builder = newBuilder(IOptions.JS_PATHS, "scripts," + abs.getPath());
		assertEquals(Arrays.asList(new File(tmpdir, "scripts"), abs), builder.getRoots(BundleType.JS));
	}

	private void expectFetches() throws Exception {
		expect(fetcher.fetch(isA(URL.class), anyLong(), anyInt())).andAnswer(new IAnswer<String>() {
			@Override
			public String answer() throws Throwable {
				Object response = responses.get(getCurrentArguments()[0].toString());
				if (response instanceof Throwable) {
					throw (Throwable)response;
				}
				return (String)response;
			}
		}).anyTimes();
		replay(fetcher);
	}

	private BundleBuilder newBuilder(String... namesAndValues) {
		IOptions options = TestUtils.createOptions(namesAndValues);
		ITransformerRegistry transformers = new TransformerRegistryImpl();
		transformers.register(new LessTransformer());
		List<IImportResolver> resolvers = Arrays.<IImportResolver>asList(
				new CssImportResolver(), new SassImportResolver(), new JavaScriptImportResolver());
		Map<BundleType, IMinifier> minifiers = new EnumMap<BundleType, IMinifier>(BundleType.class);
		minifiers.put(BundleType.CSS, new CssMinifier());
		minifiers.put(BundleType.JS, new ClosureJavaScriptMinifier());
		return new BundleBuilder(tmpdir, options, transformers, resolvers, fetcher, minifiers);
	}
}
