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

import com.ibm.cruncher.core.resolver.ImportContext;
import com.ibm.cruncher.core.util.PathUtil;

import org.apache.commons.io.FilenameUtils;
import org.apache.commons.lang3.StringUtils;

import java.io.File;
import java.io.IOException;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Inlines <code>&#064;import</code> statements of CSS and LESS files.
 * <p>
 * The forms <code>&#064;import url(x.css);</code>,
 * <code>&#064;import "x.css";</code> and <code>&#064;import 'x.css';</code> are
 * recognized, optionally preceded by a LESS import option such as
 * <code>(less)</code> and followed by a media query. Imports with a media
 * query are inlined inside an <code>&#064;media</code> block. Imports of
 * remote URLs and of root-absolute paths are left in place.
 * <p>
 * Relative <code>url(...)</code> references in an imported file are
 * rewritten to be relative to the importing file. In a LESS file, an import
 * target without an extension names a LESS file.
 */
public class CssImportResolver extends AbstractImportResolver {

	static public final String LESS_EXTENSION = ".less"; //$NON-NLS-1$

	static final Pattern importPattern = Pattern.compile(
			"@import\\s*(?:\\([\\w\\s,]+\\)\\s*)?(?:url\\(\\s*([\"']?)([^\"')]+?)\\1\\s*\\)|([\"'])([^\"']+)\\3)\\s*([^;{}]*?)\\s*;"); //$NON-NLS-1$

	static final Pattern urlPattern = Pattern.compile("url\\((\\s*(('[^']*')|(\"[^\"]*\")|([^)]*))\\s*)\\)?"); //$NON-NLS-1$

	private static final Collection<String> extensions =
			Collections.unmodifiableList(Arrays.asList(".css", LESS_EXTENSION)); //$NON-NLS-1$

	@Override
	public Collection<String> getExtensions() {
		return extensions;
	}

	@Override
	protected String doResolveImports(String css, File currentFile, ImportContext context) throws IOException {
		boolean isLess = LESS_EXTENSION.equals(PathUtil.getExtension(currentFile.getName()));
		StringBuffer buf = new StringBuffer();
		Matcher m = importPattern.matcher(css);
		while (m.find()) {
			String fullMatch = m.group(0);
			String importNameMatch = m.group(2) != null ? m.group(2) : m.group(4);
			String mediaQuery = m.group(5);

			importNameMatch = toFileName(importNameMatch.trim());
			if (importNameMatch.length() == 0 || isExternal(importNameMatch)) {
				m.appendReplacement(buf, BLANK);
				buf.append(fullMatch);
				continue;
			}
			if (isLess && PathUtil.getExtension(importNameMatch).length() == 0) {
				importNameMatch += LESS_EXTENSION;
			}
			String importCss = inlineImport(importNameMatch, Collections.singletonList(importNameMatch), currentFile, context);
			if (importCss == null) {
				importCss = BLANK;
			} else if (mediaQuery.length() > 0) {
				importCss = "@media " + mediaQuery + "{\n" + importCss + "\n}"; //$NON-NLS-1$ //$NON-NLS-2$ //$NON-NLS-3$
			}
			m.appendReplacement(buf, BLANK);
			buf.append(importCss);
		}
		m.appendTail(buf);
		return buf.toString();
	}

	/**
	 * Rebases the relative URLs of the imported file onto the directory of
	 * the importing file.
	 */
	@Override
	protected String afterImport(String css, File importFile, File currentFile) {
		String relative = currentFile.getParentFile().toPath().relativize(importFile.getParentFile().toPath()).toString();
		relative = FilenameUtils.separatorsToUnix(relative);
		if (relative.length() == 0) {
			return css;
		}
		return rebaseUrls(css, relative + "/"); //$NON-NLS-1$
	}

	/**
	 * Prefixes each relative URL in <code>url(...)</code> references with
	 * <code>base</code> and collapses <code>.</code> and <code>..</code>
	 * segments of the result. URLs that are root-absolute, fragment-only or
	 * have a scheme (including <code>data:</code>) are not modified.
	 *
	 * @param css
	 *            the style sheet text
	 * @param base
	 *            the path to prefix, ending with a slash. May be
	 *            root-absolute.
	 * @return the rewritten text
	 */
	public static String rebaseUrls(String css, String base) {
		StringBuffer buf = new StringBuffer();
		Matcher m = urlPattern.matcher(css);
		while (m.find()) {
			String fullMatch = m.group(0);
			String urlMatch = StringUtils.trim(m.group(1).replace("\\", "/")); //$NON-NLS-1$ //$NON-NLS-2$
			String quoted = BLANK;
			if (urlMatch.length() >= 2 && urlMatch.charAt(0) == '"' && urlMatch.charAt(urlMatch.length()-1) == '"') {
				quoted = "\""; //$NON-NLS-1$
				urlMatch = urlMatch.substring(1, urlMatch.length()-1);
			} else if (urlMatch.length() >= 2 && urlMatch.charAt(0) == '\'' && urlMatch.charAt(urlMatch.length()-1) == '\'') {
				quoted = "'"; //$NON-NLS-1$
				urlMatch = urlMatch.substring(1, urlMatch.length()-1);
			}

			// Don't modify non-relative URLs
			if (urlMatch.length() == 0 || urlMatch.startsWith("/") || urlMatch.startsWith("#") //$NON-NLS-1$ //$NON-NLS-2$
					|| PathUtil.protocolPattern.matcher(urlMatch).find()) {
				m.appendReplacement(buf, BLANK);
				buf.append(fullMatch);
				continue;
			}
			m.appendReplacement(buf, BLANK);
			buf.append("url(") //$NON-NLS-1$
			.append(quoted)
			.append(PathUtil.collapse(base + urlMatch))
			.append(quoted)
			.append(")"); //$NON-NLS-1$
		}
		m.appendTail(buf);
		return buf.toString();
	}
}
