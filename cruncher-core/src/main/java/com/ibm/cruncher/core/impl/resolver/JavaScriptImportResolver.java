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
 * Inlines the bare <code>import "x.js";</code> statements of JavaScript and
 * CoffeeScript files. The statement must start a line, the quotes are
 * optional and the target must name a <code>.js</code> or
 * <code>.coffee</code> file. Module imports that bind names, such as
 * <code>import x from "y.js";</code>, are not matched, and neither are
 * statements inside block comments.
 */
public class JavaScriptImportResolver extends AbstractImportResolver {

	static final Pattern importPattern = Pattern.compile(
			"^[ \\t]*import\\s*([\"']?)([^\"'\\s;]+\\.(?:js|coffee))\\1\\s*;", //$NON-NLS-1$
			Pattern.MULTILINE | Pattern.CASE_INSENSITIVE);

	private static final Collection<String> extensions =
			Collections.unmodifiableList(Arrays.asList(".js", ".coffee")); //$NON-NLS-1$ //$NON-NLS-2$

	@Override
	public Collection<String> getExtensions() {
		return extensions;
	}

	@Override
	protected String doResolveImports(String source, File currentFile, ImportContext context) throws IOException {
		StringBuffer buf = new StringBuffer();
		List<int[]> comments = null;
		Matcher m = importPattern.matcher(source);
		while (m.find()) {
			if (comments == null) {
				comments = findBlockComments(source);
			}
			String target = toFileName(m.group(2));
			if (isExternal(target) || isInside(comments, m.start())) {
				m.appendReplacement(buf, BLANK);
				buf.append(m.group(0));
				continue;
			}
			String js = inlineImport(target, Collections.singletonList(target), currentFile, context);
			m.appendReplacement(buf, BLANK);
			buf.append(js != null ? js : BLANK);
		}
		m.appendTail(buf);
		return buf.toString();
	}

	/**
	 * Returns the start and end offsets of the block comments of the source.
	 * Comment delimiters inside string literals and line comments are
	 * ignored. An unterminated comment extends to the end of the source.
	 */
	static List<int[]> findBlockComments(String source) {
		List<int[]> result = new ArrayList<int[]>();
		int len = source.length();
		int i = 0;
		while (i < len) {
			char c = source.charAt(i);
			char next = i + 1 < len ? source.charAt(i + 1) : 0;
			if (c == '/' && next == '*') {
				int end = source.indexOf("*/", i + 2); //$NON-NLS-1$
				end = end == -1 ? len : end + 2;
				result.add(new int[]{i, end});
				i = end;
			} else if (c == '/' && next == '/') {
				int end = source.indexOf('\n', i);
				i = end == -1 ? len : end;
			} else if (c == '"' || c == '\'' || c == '`') {
				i++;
				while (i < len && source.charAt(i) != c) {
					// template literals may span lines, other strings may not
					if (source.charAt(i) == '\n' && c != '`') {
						break;
					}
					i += source.charAt(i) == '\\' ? 2 : 1;
				}
				i++;
			} else {
				i++;
			}
		}
		return result;
	}

	private static boolean isInside(List<int[]> ranges, int offset) {
		for (int[] range : ranges) {
			if (offset >= range[0] && offset < range[1]) {
				return true;
			}
			if (range[0] > offset) {
				break;
			}
		}
		return false;
	}
}
