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

package com.ibm.cruncher.core.transformer;

import java.util.Collection;
import java.util.Collections;
import java.util.List;

import com.google.common.collect.ImmutableList;

/**
 * The output of an {@link ITransformer} together with any files the compiler
 * consumed that the import resolvers did not see (for example files pulled
 * in by a Sass compiler's own import handling). Those files are added to the
 * dependency set of the bundle being built.
 */
public class TransformResult {

	private final String output;
	private final List<String> consumedFiles;

	public TransformResult(String output) {
		this(output, Collections.<String>emptyList());
	}

	public TransformResult(String output, Collection<String> consumedFiles) {
		if (output == null) {
			throw new NullPointerException();
		}
		this.output = output;
		this.consumedFiles = ImmutableList.copyOf(consumedFiles);
	}

	public String getOutput() {
		return output;
	}

	public List<String> getConsumedFiles() {
		return consumedFiles;
	}
}
