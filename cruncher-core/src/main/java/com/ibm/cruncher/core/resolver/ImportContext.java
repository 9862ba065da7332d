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

package com.ibm.cruncher.core.resolver;

import com.ibm.cruncher.core.AccessDeniedException;
import com.ibm.cruncher.core.BundleType;
import com.ibm.cruncher.core.CircularImportException;
import com.ibm.cruncher.core.deps.DependencyTracker;
import com.ibm.cruncher.core.transformer.ITransformerRegistry;
import com.ibm.cruncher.core.util.PathUtil;

import java.io.File;
import java.text.MessageFormat;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;

/**
 * The state shared by the import resolvers during one bundle build: the
 * dependency tracker, the search roots, the transformer registry, the loader
 * used to read imported files, and the stack of files currently being
 * resolved.
 * <p>
 * Like the {@link DependencyTracker} it wraps, an import context belongs to a
 * single build and is not thread safe.
 */
public class ImportContext {

	private final BundleType bundleType;
	private final DependencyTracker dependencies;
	private final List<String> roots;
	private final ITransformerRegistry transformers;
	private final ISourceLoader loader;

	/** normalized paths of the files being resolved, innermost first */
	private final Deque<String> resolving = new ArrayDeque<String>();

	public ImportContext(BundleType bundleType, DependencyTracker dependencies, Collection<File> roots,
			ITransformerRegistry transformers, ISourceLoader loader) {
		this.bundleType = bundleType;
		this.dependencies = dependencies;
		List<String> normalized = new ArrayList<String>(roots.size());
		for (File root : roots) {
			normalized.add(PathUtil.normalize(root));
		}
		this.roots = Collections.unmodifiableList(normalized);
		this.transformers = transformers;
		this.loader = loader;
	}

	public BundleType getBundleType() {
		return bundleType;
	}

	public DependencyTracker getDependencies() {
		return dependencies;
	}

	/**
	 * @return the normalized search roots, in search order
	 */
	public List<String> getRoots() {
		return roots;
	}

	public ITransformerRegistry getTransformers() {
		return transformers;
	}

	public ISourceLoader getLoader() {
		return loader;
	}

	/**
	 * Pushes <code>file</code> onto the stack of files being resolved.
	 *
	 * @param file the file whose imports are about to be resolved
	 * @throws CircularImportException if the file is already on the stack
	 */
	public void enter(File file) throws CircularImportException {
		String path = PathUtil.normalize(file);
		if (resolving.contains(path)) {
			List<String> chain = getImportChain();
			chain.add(path);
			throw new CircularImportException(
					MessageFormat.format(Messages.ImportContext_0, path, chain), chain);
		}
		resolving.push(path);
	}

	/**
	 * Pops <code>file</code> off the stack of files being resolved.
	 *
	 * @param file the file passed to the matching {@link #enter(File)}
	 */
	public void exit(File file) {
		String path = PathUtil.normalize(file);
		if (!path.equals(resolving.peek())) {
			throw new IllegalStateException(path);
		}
		resolving.pop();
	}

	/**
	 * @return the files currently being resolved, outermost first
	 */
	public List<String> getImportChain() {
		List<String> result = new ArrayList<String>(resolving.size() + 1);
		for (Iterator<String> it = resolving.descendingIterator(); it.hasNext();) {
			result.add(it.next());
		}
		return result;
	}

	/**
	 * @param path a normalized path
	 * @return true if the path is one of the search roots or lies below one
	 */
	public boolean isUnderRoots(String path) {
		for (String root : roots) {
			if (PathUtil.isUnder(root, path)) {
				return true;
			}
		}
		return false;
	}

	/**
	 * Locates an imported file. Each candidate name is tried relative to
	 * <code>currentDir</code> first and then relative to each search root in
	 * order. The first existing file wins.
	 *
	 * @param candidates
	 *            the relative names to try, in order of preference
	 * @param currentDir
	 *            the directory of the importing file
	 * @return the file, or null if no candidate exists
	 * @throws AccessDeniedException
	 *             if the first existing candidate lies outside of the search
	 *             roots
	 */
	public File locate(List<String> candidates, File currentDir) throws AccessDeniedException {
		List<File> bases = new ArrayList<File>(roots.size() + 1);
		bases.add(currentDir);
		for (String root : roots) {
			bases.add(new File(root));
		}
		for (File base : bases) {
			for (String candidate : candidates) {
				File file = new File(base, candidate);
				if (!file.isFile()) {
					continue;
				}
				String path = PathUtil.tryNormalize(file);
				if (path == null || !isUnderRoots(path)) {
					throw new AccessDeniedException(MessageFormat.format(Messages.ImportContext_1,
							candidate, path != null ? path : file.getPath()));
				}
				return new File(path);
			}
		}
		return null;
	}
}
