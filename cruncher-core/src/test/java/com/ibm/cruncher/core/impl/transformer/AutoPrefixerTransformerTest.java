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

package com.ibm.cruncher.core.impl.transformer;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import com.ibm.cruncher.core.BundleType;
import com.ibm.cruncher.core.TransformFailedException;
import com.ibm.cruncher.core.options.IOptions;
import com.ibm.cruncher.core.test.TestUtils;

import org.junit.Before;
import org.junit.Test;

public class AutoPrefixerTransformerTest {

	static final String SCRIPT = "com/ibm/cruncher/core/impl/transformer/test-autoprefixer.js";

	private IOptions options;
	private AutoPrefixerTransformer transformer;

	@Before
	public void setUp() throws Exception {
		options = TestUtils.createOptions();
		transformer = AutoPrefixerTransformer.fromLocation(SCRIPT, options);
	}

	@Test
	public void testProcess() throws Exception {
		assertEquals(BundleType.CSS, transformer.getBundleType());
		assertTrue(transformer.getExtensions().isEmpty());
		assertEquals(".a{-webkit-display:flex;display:flex}\n.b{color:red}",
				transformer.transform(".a{display:flex}\n.b{color:red}", "a.css,b.css").getOutput());
	}

	@Test
	public void testOptionsArePassed() throws Exception {
		assertEquals("default|true", transformer.transform("options", "a.css").getOutput());
		options.setOption(IOptions.AUTOPREFIXER_BROWSERS, "last 2 versions, ie 9");
		options.setOption(IOptions.AUTOPREFIXER_CASCADE, false);
		assertEquals("last 2 versions,ie 9|false", transformer.transform("options", "a.css").getOutput());

		options.setOption(IOptions.AUTOPREFIXER_BROWSERS, "none");
		assertEquals(".a{display:flex}", transformer.transform(".a{display:flex}", "a.css").getOutput());
	}

	@Test
	public void testScriptError() throws Exception {
		try {
			transformer.transform(".a{color:red!!}", "a.css");
			fail("expected TransformFailedException");
		} catch (TransformFailedException e) {
			assertEquals("a.css", e.getPath());
			assertTrue(e.getDiagnostics(), e.getDiagnostics().contains("unexpected !!"));
		}
	}

	@Test(expected=TransformFailedException.class)
	public void testScriptWithoutAutoprefixer() throws Exception {
		new AutoPrefixerTransformer("empty.js", "var x = 1;", options).transform(".a{}", "a.css");
	}

	@Test(expected=TransformFailedException.class)
	public void testResultWithoutCss() throws Exception {
		new AutoPrefixerTransformer("bad.js", "var autoprefixer = {process: function(css) { return {}; }};", options)
				.transform(".a{}", "a.css");
	}
}
