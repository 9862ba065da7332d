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

package com.ibm.cruncher.core.util;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import com.ibm.cruncher.core.BundleType;

import org.junit.Test;

import java.util.Arrays;
import java.util.Collections;

public class FingerprintUtilTest {

	@Test
	public void testDeterministic() {
		String fp = FingerprintUtil.fingerprint(Arrays.asList("a.css", "b.css"));
		assertEquals(fp, FingerprintUtil.fingerprint(Arrays.asList("a.css", "b.css")));
		assertEquals(32, fp.length());
		assertTrue(fp.matches("[0-9a-f]{32}"));
	}

	@Test
	public void testOrderSensitive() {
		assertFalse(FingerprintUtil.fingerprint(Arrays.asList("a.css", "b.css")).equals(
				FingerprintUtil.fingerprint(Arrays.asList("b.css", "a.css"))));
	}

	@Test
	public void testNoConcatenationCollisions() {
		assertFalse(FingerprintUtil.fingerprint(Arrays.asList("ab", "c")).equals(
				FingerprintUtil.fingerprint(Arrays.asList("a", "bc"))));
		assertFalse(FingerprintUtil.fingerprint(Arrays.asList("abc")).equals(
				FingerprintUtil.fingerprint(Arrays.asList("abc", ""))));
	}

	@Test
	public void testEmptyList() {
		assertEquals(FingerprintUtil.EMPTY_FINGERPRINT, FingerprintUtil.fingerprint(Collections.<String>emptyList()));
		assertEquals(FingerprintUtil.EMPTY_FINGERPRINT, FingerprintUtil.fingerprint(null));
	}

	@Test(expected=NullPointerException.class)
	public void testNullIdentifier() {
		FingerprintUtil.fingerprint(Arrays.asList("a.css", null));
	}

	@Test
	public void testContentHash() {
		assertEquals(FingerprintUtil.EMPTY_FINGERPRINT, FingerprintUtil.contentHash(""));
		assertEquals("5d41402abc4b2a76b9719d911017c592", FingerprintUtil.contentHash("hello"));
	}

	@Test
	public void testCacheKey() {
		String fp = FingerprintUtil.fingerprint(Arrays.asList("x"));
		assertEquals("css:min:" + fp, FingerprintUtil.cacheKey(BundleType.CSS, true, fp));
		assertEquals("js:raw:" + fp, FingerprintUtil.cacheKey(BundleType.JS, false, fp));
	}
}
