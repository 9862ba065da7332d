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

import com.ibm.cruncher.core.deps.DependencyTracker;

import java.util.Set;

/**
 * The output of {@link BundleBuilder#build(java.util.List, com.ibm.cruncher.core.BundleType, boolean)}.
 */
public class BuildResult {

	private final String content;
	private final DependencyTracker dependencies;

	public BuildResult(String content, DependencyTracker dependencies) {
		if (!dependencies.isFrozen()) {
			throw new IllegalArgumentException();
		}
		this.content = content;
		this.dependencies = dependencies;
	}

	public String getContent() {
		return content;
	}

	public Set<String> getDependencies() {
		return dependencies.contents();
	}
}
