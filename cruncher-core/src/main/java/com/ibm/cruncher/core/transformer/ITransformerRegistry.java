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
import com.ibm.cruncher.core.deps.DependencyTracker;

import java.io.IOException;
import java.util.Set;

/**
 * Holds the registered {@link ITransformer}s and decides which resource
 * extensions may appear in each type of bundle. The plain
 * <code>.css</code> and <code>.js</code> extensions are always allowed.
 */
public interface ITransformerRegistry {

	/**
	 * Registers a transformer, replacing any transformer previously
	 * registered for the same extensions.
	 *
	 * @param transformer the transformer
	 */
	public void register(ITransformer transformer);

	/**
	 * @param extension an extension including the leading dot
	 * @return the transformer for the extension, or null
	 */
	public ITransformer getTransformer(String extension);

	/**
	 * @param type the bundle type
	 * @return the extensions allowed in bundles of the type
	 */
	public Set<String> getAllowedExtensions(BundleType type);

	/**
	 * @param name a file name, path or URL
	 * @param type the bundle type
	 * @return true if the extension of <code>name</code> is allowed in
	 *         bundles of the type
	 */
	public boolean isAllowed(String name, BundleType type);

	/**
	 * Runs the transformer registered for the extension of <code>path</code>,
	 * if any, and records the files it consumed in <code>dependencies</code>.
	 *
	 * @param source the source text
	 * @param path the file path or URL of the source
	 * @param dependencies the dependency tracker of the current build
	 * @return the transformed text, or <code>source</code> if no transformer
	 *         is registered for the extension
	 * @throws IOException
	 */
	public String transform(String source, String path, DependencyTracker dependencies) throws IOException;
}
