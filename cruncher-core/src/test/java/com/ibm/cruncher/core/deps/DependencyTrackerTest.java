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

package com.ibm.cruncher.core.deps;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import com.ibm.cruncher.core.util.PathUtil;

import org.junit.Test;

import java.io.File;
import java.util.Arrays;
import java.util.ArrayList;
import java.util.Set;

public class DependencyTrackerTest {

	@Test
	public void testAdd() {
		DependencyTracker tracker = new DependencyTracker();
		assertTrue(tracker.add(new File("css/b.css")));
		assertTrue(tracker.add(new File("css/a.css")));
		assertFalse(tracker.add(new File("css/sub/../b.css")));
		assertFalse(tracker.add(new File("css/a.css").getAbsolutePath()));
		assertEquals(2, tracker.size());
		assertTrue(tracker.contains("css/./a.css"));
		assertEquals(Arrays.asList(PathUtil.normalize(new File("css/b.css")), PathUtil.normalize(new File("css/a.css"))),
				new ArrayList<String>(tracker.contents()));
	}

	@Test
	public void testContentsIsSnapshot() {
		DependencyTracker tracker = new DependencyTracker();
		tracker.add("a.css");
		Set<String> contents = tracker.contents();
		tracker.add("b.css");
		assertEquals(1, contents.size());
		try {
			contents.add("c.css");
			throw new AssertionError("contents must not be modifiable");
		} catch (UnsupportedOperationException expected) {
			assertEquals(1, contents.size());
		}
	}

	@Test(expected=IllegalStateException.class)
	public void testFreeze() {
		DependencyTracker tracker = new DependencyTracker();
		tracker.add("a.css");
		tracker.freeze();
		assertTrue(tracker.isFrozen());
		tracker.add("b.css");
	}
}
