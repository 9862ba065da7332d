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

import com.ibm.cruncher.core.AccessDeniedException;
import com.ibm.cruncher.core.BundleType;
import com.ibm.cruncher.core.NotFoundException;
import com.ibm.cruncher.core.RemoteFetchFailedException;
import com.ibm.cruncher.core.RemoteFetchRejectedException;
import com.ibm.cruncher.core.deps.DependencyTracker;
import com.ibm.cruncher.core.fetch.IRemoteFetcher;
import com.ibm.cruncher.core.impl.resolver.CssImportResolver;
import com.ibm.cruncher.core.minifier.IMinifier;
import com.ibm.cruncher.core.options.IOptions;
import com.ibm.cruncher.core.readers.CommentStrippingReader;
import com.ibm.cruncher.core.resolver.IImportResolver;
import com.ibm.cruncher.core.resolver.ISourceLoader;
import com.ibm.cruncher.core.resolver.ImportContext;
import com.ibm.cruncher.core.transformer.ITransformer;
import com.ibm.cruncher.core.transformer.ITransformerRegistry;
import com.ibm.cruncher.core.transformer.TransformResult;
import com.ibm.cruncher.core.util.CopyUtil;
import com.ibm.cruncher.core.util.PathUtil;

import org.apache.commons.io.FileUtils;
import org.apache.commons.io.FilenameUtils;
import org.apache.commons.lang3.StringUtils;

import java.io.File;
import java.io.IOException;
import java.io.Reader;
import java.net.MalformedURLException;
import java.net.URL;
import java.text.MessageFormat;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Builds the text of a bundle from an ordered list of resource identifiers.
 * <p>
 * Each identifier is processed in order and the results are joined with
 * new lines:
 * <ol>
 * <li>an http or https URL is downloaded</li>
 * <li>an identifier without an extension that is a whitelist token is
 * replaced by the URL it stands for and downloaded</li>
 * <li>a directory below a search root is replaced by the allowed files below
 * it, in path order</li>
 * <li>a file is located below the search roots, read, its imports inlined
 * and its source transformed</li>
 * </ol>
 * The joined text is then run through the postprocessors for the bundle
 * type, such as the Autoprefixer for style sheets, and finally minified if
 * requested. A download that fails for network reasons is skipped. Every
 * other failure fails the build. A builder holds no per-build state and may be used by
 * several threads at once.
 */
public class BundleBuilder {
	private static final String sourceClass = BundleBuilder.class.getName();
	private static final Logger log = Logger.getLogger(sourceClass);

	static final String ROOT_TOKEN = "{root}"; //$NON-NLS-1$

	static final String SEPARATOR = "\n"; //$NON-NLS-1$

	/** extensions of style sheet languages that have <code>//</code> line comments */
	static final Collection<String> lineCommentExtensions = Arrays.asList(".less", ".scss", ".sass"); //$NON-NLS-1$ //$NON-NLS-2$ //$NON-NLS-3$

	private final File baseDir;
	private final IOptions options;
	private final ITransformerRegistry transformers;
	private final Map<String, IImportResolver> resolvers = new HashMap<String, IImportResolver>();
	private final IRemoteFetcher fetcher;
	private final Map<BundleType, IMinifier> minifiers;
	private final List<ITransformer> postprocessors;

	/**
	 * @param baseDir
	 *            the directory that relative search roots and the site root
	 *            are resolved against
	 * @param options
	 *            the options
	 * @param transformers
	 *            the transformer registry
	 * @param resolvers
	 *            the import resolvers, selected by the extension of the file
	 *            being processed
	 * @param fetcher
	 *            the remote resource fetcher
	 * @param minifiers
	 *            the minifier for each bundle type
	 */
	public BundleBuilder(File baseDir, IOptions options, ITransformerRegistry transformers,
			Collection<IImportResolver> resolvers, IRemoteFetcher fetcher, Map<BundleType, IMinifier> minifiers) {
		this(baseDir, options, transformers, resolvers, fetcher, minifiers, Collections.<ITransformer>emptyList());
	}

	/**
	 * @param postprocessors
	 *            transformers run, in order, over the joined text of the
	 *            bundles of their bundle type, before minification
	 * @see #BundleBuilder(File, IOptions, ITransformerRegistry, Collection, IRemoteFetcher, Map)
	 */
	public BundleBuilder(File baseDir, IOptions options, ITransformerRegistry transformers,
			Collection<IImportResolver> resolvers, IRemoteFetcher fetcher, Map<BundleType, IMinifier> minifiers,
			List<ITransformer> postprocessors) {
		this.baseDir = baseDir;
		this.options = options;
		this.transformers = transformers;
		for (IImportResolver resolver : resolvers) {
			for (String ext : resolver.getExtensions()) {
				this.resolvers.put(ext, resolver);
			}
		}
		this.fetcher = fetcher;
		this.minifiers = minifiers;
		this.postprocessors = new ArrayList<ITransformer>(postprocessors);
	}

	/**
	 * Builds a bundle.
	 *
	 * @param identifiers
	 *            the resource identifiers, in output order
	 * @param type
	 *            the bundle type
	 * @param minify
	 *            true to minify the joined output
	 * @return the bundle text and the frozen set of files it was built from
	 * @throws IOException
	 */
	public BuildResult build(List<String> identifiers, BundleType type, boolean minify) throws IOException {
		final String sourceMethod = "build"; //$NON-NLS-1$
		final boolean isTraceLogging = log.isLoggable(Level.FINER);
		if (isTraceLogging) {
			log.entering(sourceClass, sourceMethod, new Object[]{identifiers, type, minify});
		}
		DependencyTracker dependencies = new DependencyTracker();
		ImportContext context = new ImportContext(type, dependencies, getRoots(type), transformers, new SourceLoader(type));
		List<String> pieces = new ArrayList<String>(identifiers.size());
		for (String identifier : identifiers) {
			String piece = process(identifier.trim(), context);
			if (piece != null) {
				pieces.add(piece);
			}
		}
		String content = StringUtils.join(pieces, SEPARATOR);
		if (!pieces.isEmpty()) {
			content = postprocess(content, type, StringUtils.join(identifiers, ","), dependencies); //$NON-NLS-1$
		}
		if (minify) {
			IMinifier minifier = minifiers.get(type);
			if (minifier != null) {
				content = minifier.minify(content, StringUtils.join(identifiers, ",")); //$NON-NLS-1$
			}
		}
		dependencies.freeze();
		BuildResult result = new BuildResult(content, dependencies);
		if (isTraceLogging) {
			log.exiting(sourceClass, sourceMethod, dependencies);
		}
		return result;
	}

	/**
	 * Runs the postprocessors for the bundle type over the joined text.
	 */
	protected String postprocess(String content, BundleType type, String name, DependencyTracker dependencies) throws IOException {
		String result = content;
		for (ITransformer postprocessor : postprocessors) {
			if (postprocessor.getBundleType() != type) {
				continue;
			}
			TransformResult transformed = postprocessor.transform(result, name);
			for (String consumed : transformed.getConsumedFiles()) {
				dependencies.add(consumed);
			}
			result = transformed.getOutput();
		}
		return result;
	}

	/**
	 * Returns the search roots for the bundle type, resolved against the base
	 * directory.
	 *
	 * @param type the bundle type
	 * @return the search roots, in search order
	 */
	public List<File> getRoots(BundleType type) {
		List<String> paths = type == BundleType.CSS ? options.getCssPaths() : options.getJsPaths();
		List<File> result = new ArrayList<File>(paths.size());
		for (String path : paths) {
			result.add(resolve(path));
		}
		return result;
	}

	/**
	 * Processes one identifier.
	 *
	 * @return the text for the identifier, or null if it contributes nothing
	 */
	protected String process(String identifier, ImportContext context) throws IOException {
		if (identifier.length() == 0) {
			return null;
		}
		if (PathUtil.isRemote(identifier)) {
			return fetchRemote(identifier, identifier, context);
		}
		String relative = StringUtils.stripStart(FilenameUtils.separatorsToUnix(identifier), "/"); //$NON-NLS-1$
		if (PathUtil.getExtension(relative).length() == 0) {
			String url = options.getWhitelistUrl(relative);
			if (url != null) {
				return fetchRemote(identifier, url, context);
			}
		}
		File dir = locate(relative, context, true);
		if (dir != null) {
			return processDirectory(dir, context);
		}
		if (!transformers.isAllowed(relative, context.getBundleType())) {
			throw new AccessDeniedException(
					MessageFormat.format(Messages.BundleBuilder_0, identifier, context.getBundleType()));
		}
		File file = locate(relative, context, false);
		if (file == null) {
			throw new NotFoundException(identifier);
		}
		return processFile(file, context);
	}

	/**
	 * Reads a local file, inlines its imports and transforms it.
	 */
	protected String processFile(File file, ImportContext context) throws IOException {
		DependencyTracker dependencies = context.getDependencies();
		dependencies.add(file);
		String source = context.getLoader().load(file);
		IImportResolver resolver = resolvers.get(PathUtil.getExtension(file.getName()));
		if (resolver != null) {
			source = resolver.resolveImports(source, file, context);
		}
		String result = transformers.transform(source, file.getPath(), dependencies);
		String siteRoot = options.getSiteRoot();
		if (siteRoot != null && context.getBundleType() == BundleType.CSS) {
			result = rewriteSiteUrls(result, file, PathUtil.normalize(resolve(siteRoot)));
		}
		return result;
	}

	/**
	 * Rewrites the relative URLs of a style sheet below the site root to
	 * site-absolute paths. Imported files have already been rebased onto the
	 * directory of <code>file</code>.
	 */
	protected String rewriteSiteUrls(String css, File file, String siteRoot) {
		String dir = PathUtil.normalize(file.getParentFile());
		if (!PathUtil.isUnder(siteRoot, dir)) {
			return css;
		}
		String relative = FilenameUtils.separatorsToUnix(dir.substring(siteRoot.length()));
		if (!relative.endsWith("/")) { //$NON-NLS-1$
			relative += "/"; //$NON-NLS-1$
		}
		if (!relative.startsWith("/")) { //$NON-NLS-1$
			relative = "/" + relative; //$NON-NLS-1$
		}
		return CssImportResolver.rebaseUrls(css, relative);
	}

	/**
	 * Processes the allowed files below a directory in path order. The
	 * directory itself is added to the dependencies, so that adding or
	 * removing a file below it invalidates the bundle.
	 */
	protected String processDirectory(File dir, ImportContext context) throws IOException {
		context.getDependencies().add(dir);
		List<File> files = new ArrayList<File>();
		for (File file : FileUtils.listFiles(dir, null, true)) {
			if (transformers.isAllowed(file.getName(), context.getBundleType())) {
				files.add(new File(PathUtil.normalize(file)));
			}
		}
		Collections.sort(files);
		if (log.isLoggable(Level.FINE)) {
			log.fine("Directory " + dir + " contains " + files); //$NON-NLS-1$ //$NON-NLS-2$
		}
		List<String> pieces = new ArrayList<String>(files.size());
		for (File file : files) {
			pieces.add(processFile(file, context));
		}
		return pieces.isEmpty() ? null : StringUtils.join(pieces, SEPARATOR);
	}

	/**
	 * Downloads a remote resource. A download that fails for network reasons
	 * is logged and yields null.
	 */
	protected String fetchRemote(String identifier, String url, ImportContext context) throws IOException {
		if (!options.isAllowRemoteDownloads()) {
			throw new RemoteFetchRejectedException(MessageFormat.format(Messages.BundleBuilder_1, identifier));
		}
		URL remote;
		try {
			remote = new URL(url);
		} catch (MalformedURLException e) {
			throw new RemoteFetchRejectedException(MessageFormat.format(Messages.BundleBuilder_2, url), e);
		}
		String text;
		try {
			text = fetcher.fetch(remote, options.getRemoteMaxBytes(), options.getRemoteTimeout());
		} catch (RemoteFetchFailedException e) {
			if (log.isLoggable(Level.WARNING)) {
				log.log(Level.WARNING, MessageFormat.format(Messages.BundleBuilder_3, identifier, e.getMessage()), e);
			}
			return null;
		}
		ITransformer transformer = transformers.getTransformer(PathUtil.getExtension(remote.getPath()));
		if (transformer != null && transformer.getBundleType() == context.getBundleType()) {
			text = transformers.transform(text, remote.getPath(), context.getDependencies());
		}
		return text;
	}

	/**
	 * Locates a file or directory below the search roots. The first root
	 * containing it wins.
	 *
	 * @throws AccessDeniedException
	 *             if the relative path leads outside of the root
	 */
	protected File locate(String relative, ImportContext context, boolean directory) throws AccessDeniedException {
		for (String root : context.getRoots()) {
			String path = PathUtil.tryNormalize(new File(root, relative));
			if (path == null || !PathUtil.isUnder(root, path)) {
				throw new AccessDeniedException(MessageFormat.format(Messages.BundleBuilder_4, relative));
			}
			File candidate = new File(path);
			if (directory ? candidate.isDirectory() : candidate.isFile()) {
				return candidate;
			}
		}
		return null;
	}

	private File resolve(String path) {
		File file = new File(path);
		return file.isAbsolute() ? file : new File(baseDir, path);
	}

	/**
	 * Loads local sources as UTF-8. Style sheets are stripped of comments and
	 * have the <code>{root}</code> token replaced.
	 */
	class SourceLoader implements ISourceLoader {
		private final BundleType type;

		SourceLoader(BundleType type) {
			this.type = type;
		}

		@Override
		public String load(File file) throws IOException {
			Reader reader = CopyUtil.newReader(file);
			if (type == BundleType.CSS) {
				boolean lineComments = lineCommentExtensions.contains(PathUtil.getExtension(file.getName()));
				reader = new CommentStrippingReader(reader, lineComments);
			}
			String text = CopyUtil.readToString(reader);
			if (type == BundleType.CSS) {
				text = text.replace(ROOT_TOKEN, options.getRelativeCssRoot());
			}
			return text;
		}
	}
}
