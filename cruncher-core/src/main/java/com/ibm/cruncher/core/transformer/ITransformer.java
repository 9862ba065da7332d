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

import com.ibm.cruncher.core.BundleType;

import java.io.IOException;
import java.util.Collection;

/**
 * Converts a source language into CSS or JavaScript (LESS, Sass and
 * CoffeeScript compilers).
 * <p>
 * Implementations are registered with an {@link ITransformerRegistry}.
 * Registering a transformer also makes its extensions acceptable in bundles
 * of its {@link #getBundleType() type}. Implementations must be safe to call
 * from multiple threads.
 */
public interface ITransformer {

	/**
	 * @return the file extensions, including the leading dot and in lower
	 *         case, of the sources this transformer accepts
	 */
	public Collection<String> getExtensions();

	/**
	 * @return the type of bundle the output belongs in
	 */
	public BundleType getBundleType();

	/**
	 * Transforms the source.
	 *
	 * @param source
	 *            the source text, with imports already inlined
	 * @param path
	 *            the file path or URL of the source, used in diagnostics and
	 *            for resolving any imports the compiler handles itself
	 * @return the output text and the files the compiler read on its own
	 * @throws IOException
	 *             {@link com.ibm.cruncher.core.TransformFailedException} if the
	 *             source cannot be compiled
	 */
	public TransformResult transform(String source, String path) throws IOException;
}
