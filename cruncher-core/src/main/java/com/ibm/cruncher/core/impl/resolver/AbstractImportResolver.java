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

package com.ibm.cruncher.core.impl.resolver;

import com.ibm.cruncher.core.AccessDeniedException;
import com.ibm.cruncher.core.resolver.IImportResolver;
import com.ibm.cruncher.core.resolver.ImportContext;
import com.ibm.cruncher.core.util.PathUtil;

import java.io.File;
import java.io.IOException;
import java.text.MessageFormat;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.regex.Pattern;

/**
 * Base class for import resolvers. Maintains the stack of files being
 * resolved for cycle detection and implements the lookup, dependency
 * tracking and transformation of imported files that is common to all
 * source languages.
 */
public abstract class AbstractImportResolver implements IImportResolver {
	private static final String sourceClass = AbstractImportResolver.class.getName();
	private static final Logger log = Logger.getLogger(sourceClass);

	static public final String BLANK = ""; //$NON-NLS-1$

	static final Pattern forwardSlashPattern = Pattern.compile("\\\\"); //$NON-NLS-1$

	/* (non-Javadoc)
	 * @see com.ibm.cruncher.core.resolver.IImportResolver#resolveImports(java.lang.String, java.io.File, com.ibm.cruncher.core.resolver.ImportContext)
	 */
	@Override
	public final String resolveImports(String source, File currentFile, ImportContext context) throws IOException {
		final String sourceMethod = "resolveImports"; //$NON-NLS-1$
		final boolean isTraceLogging = log.isLoggable(Level.FINER);
		if (isTraceLogging) {
			log.entering(sourceClass, sourceMethod, new Object[]{currentFile, context.getImportChain()});
		}
		context.enter(currentFile);
		String result;
		try {
			result = doResolveImports(source, currentFile, context);
		} finally {
			context.exit(currentFile);
		}
		if (isTraceLogging) {
			log.exiting(sourceClass, sourceMethod);
		}
		return result;
	}

	/**
	 * Replaces the import statements of <code>source</code>. Called with
	 * <code>currentFile</code> on the import stack of <code>context</code>.
	 *
	 * @param source the text of <code>currentFile</code>
	 * @param currentFile the importing file
	 * @param context the build state
	 * @return the source with imports inlined
	 * @throws IOException
	 */
	protected abstract String doResolveImports(String source, File currentFile, ImportContext context) throws IOException;

	/**
	 * Locates, loads and recursively processes an imported file.
	 * <p>
	 * The imported file is added to the dependency tracker. If its extension
	 * differs from the extension of the importing file, it is run through the
	 * transformer registered for its extension, so that, for example, a LESS
	 * file imported by a CSS file is inlined as CSS. Imports of the same
	 * language are inlined as source and compiled together with the importing
	 * file.
	 * <p>
	 * A missing import is logged and yields null. The path at which it was
	 * first expected is still added to the dependency tracker so that creating
	 * the file invalidates the bundle, unless that path climbs above the file
	 * system root and so can never be created.
	 *
	 * @param target
	 *            the import target, as written in the import statement
	 * @param candidates
	 *            the relative file names to try, in order of preference
	 * @param currentFile
	 *            the importing file
	 * @param context
	 *            the build state
	 * @return the processed content of the imported file, or null if it does
	 *         not exist
	 * @throws IOException
	 */
	protected String inlineImport(String target, List<String> candidates, File currentFile, ImportContext context) throws IOException {
		File currentDir = currentFile.getParentFile();
		File importFile = context.locate(candidates, currentDir);
		if (importFile == null) {
			if (log.isLoggable(Level.WARNING)) {
				log.warning(MessageFormat.format(Messages.AbstractImportResolver_0, target, currentFile.getPath()));
			}
			String expected = PathUtil.tryNormalize(new File(currentDir, candidates.get(0)));
			if (expected != null) {
				context.getDependencies().add(expected);
			}
			return null;
		}
		if (!context.getTransformers().isAllowed(importFile.getName(), context.getBundleType())) {
			throw new AccessDeniedException(MessageFormat.format(Messages.AbstractImportResolver_1,
					target, currentFile.getPath(), context.getBundleType()));
		}
		if (log.isLoggable(Level.FINE)) {
			log.fine("Inlining " + importFile + " into " + currentFile); //$NON-NLS-1$ //$NON-NLS-2$
		}
		context.getDependencies().add(importFile);
		String content = context.getLoader().load(importFile);
		content = resolveImports(content, importFile, context);
		if (!PathUtil.getExtension(importFile.getName()).equals(PathUtil.getExtension(currentFile.getName()))) {
			content = context.getTransformers().transform(content, importFile.getPath(), context.getDependencies());
		}
		return afterImport(content, importFile, currentFile);
	}

	/**
	 * Called with the processed content of each imported file before it is
	 * substituted for the import statement.
	 *
	 * @param content the processed content
	 * @param importFile the imported file
	 * @param currentFile the importing file
	 * @return the content to inline
	 */
	protected String afterImport(String content, File importFile, File currentFile) {
		return content;
	}

	/**
	 * Removes matching single or double quotes surrounding the value.
	 *
	 * @param in the possibly quoted value
	 * @return the unquoted value
	 */
	static String dequote(String in) {
		String result = in.trim();
		if (result.length() >= 2) {
			char first = result.charAt(0), last = result.charAt(result.length()-1);
			if ((first == '"' || first == '\'') && first == last) {
				result = result.substring(1, result.length()-1);
			}
		}
		return result;
	}

	/**
	 * Converts back slashes to forward slashes and removes any query or
	 * fragment from an import target.
	 *
	 * @param target the import target
	 * @return the file name part of the target
	 */
	static String toFileName(String target) {
		String result = forwardSlashPattern.matcher(target).replaceAll("/"); //$NON-NLS-1$
		int idx = result.indexOf('?');
		if (idx == -1) {
			idx = result.indexOf('#');
		}
		return idx == -1 ? result : result.substring(0, idx);
	}

	/**
	 * @param target an import target
	 * @return true if the target is a URL with a scheme or a root-absolute
	 *         path, neither of which is inlined
	 */
	static boolean isExternal(String target) {
		return target.startsWith("/") || PathUtil.protocolPattern.matcher(target).find(); //$NON-NLS-1$
	}
}
