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

package com.ibm.cruncher.core.readers;

import static org.junit.Assert.assertEquals;

import com.ibm.cruncher.core.util.CopyUtil;

import org.junit.Test;

import java.io.IOException;
import java.io.StringReader;

public class CommentStrippingReaderTest {

	private String strip(String text, boolean lineComments) throws IOException {
		return CopyUtil.readToString(new CommentStrippingReader(new StringReader(text), lineComments));
	}

	@Test
	public void testBlockComments() throws Exception {
		assertEquals(".a{ }", strip(".a{/* comment */}", false));
		assertEquals(".a{color:red} .b{}", strip(".a{color:red}/* one\n two */.b{}", false));
		assertEquals("", strip("/* unterminated", false));
	}

	@Test
	public void testLicenseCommentsKept() throws Exception {
		assertEquals("/*! (c) me */.a{}", strip("/*! (c) me */.a{}", false));
	}

	@Test
	public void testStringsKept() throws Exception {
		assertEquals(".a:after{content:\"/* not a comment */\"}", strip(".a:after{content:\"/* not a comment */\"}", false));
		assertEquals(".a{background:url('//host/x.png')}", strip(".a{background:url('//host/x.png')}", true));
	}

	@Test
	public void testLineComments() throws Exception {
		assertEquals("@x: 1; \n.a{}", strip("@x: 1; // the x\n.a{}", true));
		assertEquals(".a{} // kept in css", strip(".a{} // kept in css", false));
		assertEquals(".a{background:url(http://host/x.png)}", strip(".a{background:url(http://host/x.png)}", true));
	}
}
