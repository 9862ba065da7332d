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
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Inlines the <code>&#064;import</code> statements of Sass and SCSS files.
 * <p>
 * A statement may list several targets separated by commas. Targets are
 * looked up as partials first, so <code>&#064;import "grid";</code> tries
 * <code>_grid.scss</code>, <code>grid.scss</code>, <code>_grid.sass</code>,
 * <code>grid.sass</code> and <code>grid.css</code>. Targets that Sass itself
 * compiles to plain CSS imports (a <code>url(...)</code>, a name ending in
 * <code>.css</code>, a remote URL or a target followed by a media query) are
 * kept in the statement.
 */
public class SassImportResolver extends AbstractImportResolver {

	static final Pattern importPattern = Pattern.compile("^([ \\t]*)@import\\s+([^;\\n]+?)\\s*(;|$)", Pattern.MULTILINE); //$NON-NLS-1$

	static final List<String> partialExtensions = Collections.unmodifiableList(Arrays.asList(".scss", ".sass")); //$NON-NLS-1$ //$NON-NLS-2$

	private static final Collection<String> extensions = partialExtensions;

	@Override
	public Collection<String> getExtensions() {
		return extensions;
	}

	@Override
	protected String doResolveImports(String source, File currentFile, ImportContext context) throws IOException {
		StringBuffer buf = new StringBuffer();
		Matcher m = importPattern.matcher(source);
		while (m.find()) {
			String indent = m.group(1);
			String terminator = m.group(3);
			List<String> kept = new ArrayList<String>();
			StringBuilder inlined = new StringBuilder();
			for (String item : splitImportList(m.group(2))) {
				if (isPlainCssImport(item)) {
					kept.add(item);
					continue;
				}
				String target = toFileName(dequote(item));
				String content = inlineImport(target, getCandidates(target), currentFile, context);
				if (content != null) {
					inlined.append(content).append('\n');
				}
			}
			m.appendReplacement(buf, BLANK);
			if (!kept.isEmpty()) {
				buf.append(indent).append("@import ").append(StringUtils.join(kept, ", ")).append(terminator).append('\n'); //$NON-NLS-1$ //$NON-NLS-2$
			}
			buf.append(inlined);
		}
		m.appendTail(buf);
		return buf.toString();
	}

	/**
	 * Returns the file names to try for an import target, partials first.
	 *
	 * @param target the import target
	 * @return the candidate file names
	 */
	static List<String> getCandidates(String target) {
		String name = FilenameUtils.getName(target);
		String dir = target.substring(0, target.length() - name.length());
		String ext = PathUtil.getExtension(name);
		List<String> result = new ArrayList<String>();
		if (partialExtensions.contains(ext)) {
			result.add(dir + "_" + name); //$NON-NLS-1$
			result.add(dir + name);
		} else {
			for (String partialExt : partialExtensions) {
				result.add(dir + "_" + name + partialExt); //$NON-NLS-1$
				result.add(dir + name + partialExt);
			}
			result.add(dir + name + ".css"); //$NON-NLS-1$
		}
		return result;
	}

	/**
	 * @param item one target of an import statement, possibly quoted
	 * @return true if Sass leaves the target as a CSS import
	 */
	static boolean isPlainCssImport(String item) {
		if (item.startsWith("url(")) { //$NON-NLS-1$
			return true;
		}
		String target = dequote(item);
		if (target.equals(item) ? StringUtils.containsWhitespace(item) : !isQuotedOnly(item)) {
			// media query
			return true;
		}
		return isExternal(target) || ".css".equals(PathUtil.getExtension(target)); //$NON-NLS-1$
	}

	private static boolean isQuotedOnly(String item) {
		char quote = item.charAt(0);
		return (quote == '"' || quote == '\'') && item.indexOf(quote, 1) == item.length() - 1;
	}

	/**
	 * Splits the comma separated target list of an import statement. Commas
	 * inside quotes or parentheses do not separate targets.
	 *
	 * @param list the target list
	 * @return the trimmed targets
	 */
	static List<String> splitImportList(String list) {
		List<String> result = new ArrayList<String>();
		StringBuilder current = new StringBuilder();
		char quote = 0;
		int depth = 0;
		for (int i = 0; i < list.length(); i++) {
			char ch = list.charAt(i);
			if (quote != 0) {
				if (ch == quote) {
					quote = 0;
				}
			} else if (ch == '"' || ch == '\'') {
				quote = ch;
			} else if (ch == '(') {
				depth++;
			} else if (ch == ')') {
				depth--;
			} else if (ch == ',' && depth == 0) {
				addItem(result, current);
				current.setLength(0);
				continue;
			}
			current.append(ch);
		}
		addItem(result, current);
		return result;
	}

	private static void addItem(List<String> result, StringBuilder item) {
		String trimmed = item.toString().trim();
		if (trimmed.length() > 0) {
			result.add(trimmed);
		}
	}
}
