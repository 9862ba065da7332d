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

package com.ibm.cruncher.core.impl;

import com.ibm.cruncher.core.BundleType;
import com.ibm.cruncher.core.IBundle;
import com.ibm.cruncher.core.ICruncher;
import com.ibm.cruncher.core.cache.IBundleCache;
import com.ibm.cruncher.core.cache.IBundleCacheEntry;
import com.ibm.cruncher.core.executors.IExecutors;
import com.ibm.cruncher.core.fetch.IRemoteFetcher;
import com.ibm.cruncher.core.impl.bundle.BuildResult;
import com.ibm.cruncher.core.impl.bundle.Bundle;
import com.ibm.cruncher.core.impl.bundle.BundleBuilder;
import com.ibm.cruncher.core.impl.bundle.SingleFlightCoordinator;
import com.ibm.cruncher.core.impl.cache.BundleCacheImpl;
import com.ibm.cruncher.core.impl.executors.ExecutorsImpl;
import com.ibm.cruncher.core.impl.fetch.RemoteFetcherImpl;
import com.ibm.cruncher.core.impl.minifier.ClosureJavaScriptMinifier;
import com.ibm.cruncher.core.impl.minifier.CssMinifier;
import com.ibm.cruncher.core.impl.resolver.CssImportResolver;
import com.ibm.cruncher.core.impl.resolver.JavaScriptImportResolver;
import com.ibm.cruncher.core.impl.resolver.SassImportResolver;
import com.ibm.cruncher.core.impl.transformer.AutoPrefixerTransformer;
import com.ibm.cruncher.core.impl.transformer.CoffeeScriptTransformer;
import com.ibm.cruncher.core.impl.transformer.LessTransformer;
import com.ibm.cruncher.core.impl.transformer.TransformerRegistryImpl;
import com.ibm.cruncher.core.impl.watch.FileWatcherImpl;
import com.ibm.cruncher.core.minifier.IMinifier;
import com.ibm.cruncher.core.options.IOptions;
import com.ibm.cruncher.core.options.IOptionsListener;
import com.ibm.cruncher.core.resolver.IImportResolver;
import com.ibm.cruncher.core.transformer.ITransformer;
import com.ibm.cruncher.core.transformer.ITransformerRegistry;
import com.ibm.cruncher.core.util.FingerprintUtil;
import com.ibm.cruncher.core.util.PathUtil;
import com.ibm.cruncher.core.watch.IFileChangeListener;
import com.ibm.cruncher.core.watch.IFileWatcher;

import com.google.common.collect.ImmutableList;

import java.io.File;
import java.io.IOException;
import java.text.MessageFormat;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.Future;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Default {@link ICruncher} implementation. Wires the options, transformer
 * registry, import resolvers, minifiers, bundle cache, single-flight
 * coordinator, file watcher and executors together.
 */
public class CruncherImpl implements ICruncher, IOptionsListener, IFileChangeListener {
	private static final String sourceClass = CruncherImpl.class.getName();
	private static final Logger log = Logger.getLogger(sourceClass);

	private final File baseDir;
	private final IOptions options;
	private final IExecutors executors;
	private final ITransformerRegistry transformers;
	private final BundleBuilder builder;
	private final IBundleCache cache;
	private final SingleFlightCoordinator coordinator = new SingleFlightCoordinator();
	/** Serializes starting and stopping the watcher */
	private final Object watcherLock = new Object();
	private volatile IFileWatcher watcher;

	/**
	 * Creates a cruncher with the default executors and remote fetcher.
	 *
	 * @param baseDir
	 *            the directory that relative search roots are resolved
	 *            against
	 * @param options
	 *            the options
	 * @throws IOException
	 */
	public CruncherImpl(File baseDir, IOptions options) throws IOException {
		this(baseDir, options, new ExecutorsImpl(), new RemoteFetcherImpl());
	}

	public CruncherImpl(File baseDir, IOptions options, IExecutors executors, IRemoteFetcher fetcher) throws IOException {
		final String sourceMethod = "<ctor>"; //$NON-NLS-1$
		final boolean isTraceLogging = log.isLoggable(Level.FINER);
		if (isTraceLogging) {
			log.entering(sourceClass, sourceMethod, new Object[]{baseDir, options.getOptionsMap()});
		}
		this.baseDir = baseDir;
		this.options = options;
		this.executors = executors;
		transformers = newTransformerRegistry();
		Map<BundleType, IMinifier> minifiers = new EnumMap<BundleType, IMinifier>(BundleType.class);
		minifiers.put(BundleType.CSS, new CssMinifier());
		minifiers.put(BundleType.JS, new ClosureJavaScriptMinifier());
		List<IImportResolver> resolvers = Arrays.<IImportResolver>asList(
				new CssImportResolver(),
				new SassImportResolver(),
				new JavaScriptImportResolver());
		builder = new BundleBuilder(baseDir, options, transformers, resolvers, fetcher, minifiers, newPostprocessors());
		cache = new BundleCacheImpl(options.getCacheCapacity());
		if (options.isWatchFiles()) {
			startWatcher();
		}
		options.addOptionsListener(this);
		if (isTraceLogging) {
			log.exiting(sourceClass, sourceMethod);
		}
	}

	/**
	 * Returns the transformer registry with the built-in transformers
	 * registered. The CoffeeScript transformer is registered only when a
	 * compiler script is configured.
	 *
	 * @return the registry
	 * @throws IOException
	 *             if the configured compiler script cannot be loaded
	 */
	protected ITransformerRegistry newTransformerRegistry() throws IOException {
		ITransformerRegistry result = new TransformerRegistryImpl();
		result.register(new LessTransformer());
		String coffee = options.getCoffeeScriptCompiler();
		if (coffee != null) {
			result.register(CoffeeScriptTransformer.fromLocation(coffee));
		}
		return result;
	}

	/**
	 * Returns the transformers run over whole bundles before minification.
	 * The Autoprefixer is included only when a script is configured.
	 *
	 * @return the postprocessors, in the order they run
	 * @throws IOException
	 *             if the configured Autoprefixer script cannot be loaded
	 */
	protected List<ITransformer> newPostprocessors() throws IOException {
		List<ITransformer> result = new ArrayList<ITransformer>();
		String autoPrefixer = options.getAutoPrefixer();
		if (autoPrefixer != null) {
			result.add(AutoPrefixerTransformer.fromLocation(autoPrefixer, options));
		}
		return result;
	}

	/**
	 * Starts watching the search roots that exist.
	 */
	protected void startWatcher() throws IOException {
		synchronized (watcherLock) {
			IFileWatcher newWatcher = new FileWatcherImpl(options.getWatchInterval(), executors.getWatcherThreadFactory());
			watcher = newWatcher;
			Set<File> roots = new LinkedHashSet<File>();
			roots.addAll(builder.getRoots(BundleType.CSS));
			roots.addAll(builder.getRoots(BundleType.JS));
			for (File root : roots) {
				if (root.isDirectory()) {
					newWatcher.watchPath(root, this);
				} else if (log.isLoggable(Level.WARNING)) {
					log.warning(MessageFormat.format(Messages.CruncherImpl_0, root));
				}
			}
		}
	}

	/**
	 * Stops the current watcher, if any, and starts a new one on the search
	 * roots of the current options if file watching is enabled.
	 */
	protected void restartWatcher() {
		synchronized (watcherLock) {
			stopWatcher();
			if (options.isWatchFiles()) {
				try {
					startWatcher();
				} catch (IOException e) {
					if (log.isLoggable(Level.SEVERE)) {
						log.log(Level.SEVERE, Messages.CruncherImpl_3, e);
					}
				}
			}
		}
	}

	private void stopWatcher() {
		synchronized (watcherLock) {
			if (watcher != null) {
				watcher.stop();
				watcher = null;
			}
		}
	}

	/* (non-Javadoc)
	 * @see com.ibm.cruncher.core.ICruncher#getOrBuildBundle(java.util.List, com.ibm.cruncher.core.BundleType, boolean)
	 */
	@Override
	public IBundle getOrBuildBundle(List<String> identifiers, final BundleType type, final boolean minify) throws IOException {
		final String sourceMethod = "getOrBuildBundle"; //$NON-NLS-1$
		final boolean isTraceLogging = log.isLoggable(Level.FINER);
		if (isTraceLogging) {
			log.entering(sourceClass, sourceMethod, new Object[]{identifiers, type, minify});
		}
		final List<String> ids = ImmutableList.copyOf(identifiers);
		final String fingerprint = FingerprintUtil.fingerprint(ids);
		final String key = FingerprintUtil.cacheKey(type, minify, fingerprint);
		IBundle result = fromCache(type, fingerprint, key);
		if (result == null) {
			result = coordinator.execute(key, new Callable<IBundle>() {
				@Override
				public IBundle call() throws Exception {
					// a build that finished while this caller was checking the cache
					IBundle cached = fromCache(type, fingerprint, key);
					if (cached != null) {
						return cached;
					}
					BuildResult built = builder.build(ids, type, minify);
					if (options.isCacheFiles()) {
						IBundleCacheEntry entry = cache.put(key, built.getContent(), built.getDependencies(), options.getCacheDays());
						return new Bundle(type, fingerprint, entry, false);
					}
					return new Bundle(type, fingerprint, built);
				}
			});
		}
		if (isTraceLogging) {
			log.exiting(sourceClass, sourceMethod, result);
		}
		return result;
	}

	private IBundle fromCache(BundleType type, String fingerprint, String key) {
		if (!options.isCacheFiles()) {
			return null;
		}
		IBundleCacheEntry entry = cache.get(key);
		return entry != null ? new Bundle(type, fingerprint, entry, true) : null;
	}

	/* (non-Javadoc)
	 * @see com.ibm.cruncher.core.ICruncher#prebuild(java.util.List, com.ibm.cruncher.core.BundleType, boolean)
	 */
	@Override
	public Future<IBundle> prebuild(final List<String> identifiers, final BundleType type, final boolean minify) {
		return executors.getBuildExecutor().submit(new Callable<IBundle>() {
			@Override
			public IBundle call() throws Exception {
				return getOrBuildBundle(identifiers, type, minify);
			}
		});
	}

	/* (non-Javadoc)
	 * @see com.ibm.cruncher.core.ICruncher#invalidate(java.lang.String)
	 */
	@Override
	public int invalidate(String path) {
		return cache.invalidateByPath(PathUtil.normalize(path));
	}

	/* (non-Javadoc)
	 * @see com.ibm.cruncher.core.watch.IFileChangeListener#fileChanged(java.lang.String)
	 */
	@Override
	public void fileChanged(String path) {
		int count = invalidate(path);
		if (count > 0 && log.isLoggable(Level.FINE)) {
			log.fine(MessageFormat.format(Messages.CruncherImpl_1, path, count));
		}
	}

	/* (non-Javadoc)
	 * @see com.ibm.cruncher.core.options.IOptionsListener#optionsUpdated(com.ibm.cruncher.core.options.IOptions, long)
	 */
	@Override
	public void optionsUpdated(IOptions options, long sequence) {
		if (log.isLoggable(Level.INFO)) {
			log.info(MessageFormat.format(Messages.CruncherImpl_2, sequence));
		}
		// the search roots may have changed
		restartWatcher();
		clearCache();
	}

	@Override
	public void clearCache() {
		cache.clear();
	}

	@Override
	public IBundleCache getCache() {
		return cache;
	}

	@Override
	public IOptions getOptions() {
		return options;
	}

	@Override
	public ITransformerRegistry getTransformers() {
		return transformers;
	}

	public File getBaseDir() {
		return baseDir;
	}

	/**
	 * @return the file watcher, or null if file watching is disabled
	 */
	public IFileWatcher getFileWatcher() {
		return watcher;
	}

	/* (non-Javadoc)
	 * @see com.ibm.cruncher.core.ICruncher#shutdown()
	 */
	@Override
	public void shutdown() {
		final String sourceMethod = "shutdown"; //$NON-NLS-1$
		final boolean isTraceLogging = log.isLoggable(Level.FINER);
		if (isTraceLogging) {
			log.entering(sourceClass, sourceMethod);
		}
		options.removeOptionsListener(this);
		stopWatcher();
		executors.shutdown();
		if (isTraceLogging) {
			log.exiting(sourceClass, sourceMethod);
		}
	}
}
