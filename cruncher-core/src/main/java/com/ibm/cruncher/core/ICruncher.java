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

package com.ibm.cruncher.core;

import com.ibm.cruncher.core.cache.IBundleCache;
import com.ibm.cruncher.core.options.IOptions;
import com.ibm.cruncher.core.transformer.ITransformerRegistry;

import java.io.IOException;
import java.util.List;
import java.util.concurrent.Future;

/**
 * The bundling engine. Builds bundles of CSS or JavaScript from ordered lists
 * of resource identifiers, caches them, and evicts them from the cache when
 * the files they were built from change.
 * <p>
 * A resource identifier is one of:
 * <ul>
 * <li>an http or https URL</li>
 * <li>a whitelist token, mapped to a URL by the <code>remoteWhitelist</code>
 * option</li>
 * <li>the path of a directory below a search root, which stands for all the
 * allowed files below it</li>
 * <li>the path of a file below a search root</li>
 * </ul>
 */
public interface ICruncher {

	/**
	 * Returns the bundle for the identifiers, from the cache if a fresh entry
	 * exists, otherwise by building it. Concurrent requests for the same
	 * uncached bundle share a single build.
	 *
	 * @param identifiers
	 *            the resource identifiers, in output order
	 * @param type
	 *            the bundle type
	 * @param minify
	 *            true to minify the bundle
	 * @return the bundle
	 * @throws IOException
	 *             one of the exception types classified by {@link ErrorKind}
	 */
	public IBundle getOrBuildBundle(List<String> identifiers, BundleType type, boolean minify) throws IOException;

	/**
	 * Builds the bundle on the build executor, so that it is cached by the time
	 * it is requested.
	 *
	 * @param identifiers
	 *            the resource identifiers
	 * @param type
	 *            the bundle type
	 * @param minify
	 *            true to minify the bundle
	 * @return the future bundle
	 */
	public Future<IBundle> prebuild(List<String> identifiers, BundleType type, boolean minify);

	/**
	 * Removes the cached bundles that depend on the path.
	 *
	 * @param path
	 *            the path of a changed file or directory
	 * @return the number of bundles removed
	 */
	public int invalidate(String path);

	public void clearCache();

	public IBundleCache getCache();

	public IOptions getOptions();

	/**
	 * @return the registry of source transformers. Transformers registered
	 *         here, such as a Sass compiler, extend the file types accepted in
	 *         bundles.
	 */
	public ITransformerRegistry getTransformers();

	/**
	 * Stops the file watcher and the executors.
	 */
	public void shutdown();
}
