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

package com.ibm.cruncher.core.impl.minifier;

import com.ibm.cruncher.core.minifier.IMinifier;
import com.ibm.cruncher.core.readers.CommentStrippingReader;
import com.ibm.cruncher.core.util.CopyUtil;

import java.io.IOException;
import java.io.StringReader;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * A white space and comment removing CSS minifier.
 * <p>
 * Comments are removed except for <code>/*! ... *&#47;</code> license
 * comments. Runs of white space are collapsed to a single space, white space
 * next to <code>{ } ; , &gt;</code> is removed, as is white space following
 * a colon and white space preceding a colon in a declaration. The last
 * semicolon of a block is dropped. Quoted strings and license comments are
 * copied unchanged.
 */
public class CssMinifier implements IMinifier {
	private static final String sourceClass = CssMinifier.class.getName();
	private static final Logger log = Logger.getLogger(sourceClass);

	/** characters that need no white space on either side */
	static final String SEPARATORS = "{};,>"; //$NON-NLS-1$

	/* (non-Javadoc)
	 * @see com.ibm.cruncher.core.minifier.IMinifier#minify(java.lang.String, java.lang.String)
	 */
	@Override
	public String minify(String css, String name) throws IOException {
		final String sourceMethod = "minify"; //$NON-NLS-1$
		final boolean isTraceLogging = log.isLoggable(Level.FINER);
		if (isTraceLogging) {
			log.entering(sourceClass, sourceMethod, new Object[]{name, css.length()});
		}
		String stripped = CopyUtil.readToString(new CommentStrippingReader(new StringReader(css)));
		String result = compress(stripped);
		if (isTraceLogging) {
			log.exiting(sourceClass, sourceMethod, result.length());
		}
		return result;
	}

	static String compress(String css) {
		StringBuilder out = new StringBuilder(css.length());
		boolean pendingSpace = false;
		int len = css.length();
		for (int i = 0; i < len; i++) {
			char ch = css.charAt(i);
			if (Character.isWhitespace(ch)) {
				pendingSpace = true;
				continue;
			}
			if (ch == '"' || ch == '\'') {
				int end = skipString(css, i);
				appendSpace(out, pendingSpace, ch);
				out.append(css, i, end);
				i = end - 1;
				pendingSpace = false;
				continue;
			}
			if (ch == '/' && css.startsWith("/*!", i)) { //$NON-NLS-1$
				int end = css.indexOf("*/", i + 3); //$NON-NLS-1$
				end = end == -1 ? len : end + 2;
				appendSpace(out, pendingSpace, ch);
				out.append(css, i, end);
				i = end - 1;
				pendingSpace = false;
				continue;
			}
			if (pendingSpace && out.length() > 0) {
				char last = out.charAt(out.length()-1);
				boolean drop = SEPARATORS.indexOf(last) != -1 || last == ':'
						|| SEPARATORS.indexOf(ch) != -1
						|| (ch == ':' && !isInSelector(css, i));
				if (!drop) {
					out.append(' ');
				}
			}
			pendingSpace = false;
			if (ch == '}' && out.length() > 0 && out.charAt(out.length()-1) == ';') {
				out.setLength(out.length()-1);
			}
			out.append(ch);
		}
		return out.toString();
	}

	private static void appendSpace(StringBuilder out, boolean pendingSpace, char ch) {
		if (pendingSpace && out.length() > 0) {
			char last = out.charAt(out.length()-1);
			if (SEPARATORS.indexOf(last) == -1 && last != ':') {
				out.append(' ');
			}
		}
	}

	/**
	 * Returns the index following the string literal that starts at
	 * <code>start</code>.
	 */
	private static int skipString(String css, int start) {
		char quote = css.charAt(start);
		for (int i = start + 1; i < css.length(); i++) {
			char ch = css.charAt(i);
			if (ch == '\\') {
				i++;
			} else if (ch == quote || ch == '\n') {
				return i + 1;
			}
		}
		return css.length();
	}

	/**
	 * Returns true if the colon at <code>idx</code> belongs to a selector,
	 * such as <code>a :hover</code>, rather than to a declaration. A selector
	 * is followed by an opening brace before any semicolon or closing brace.
	 */
	static boolean isInSelector(String css, int idx) {
		for (int i = idx + 1; i < css.length(); i++) {
			char ch = css.charAt(i);
			if (ch == '"' || ch == '\'') {
				i = skipString(css, i) - 1;
			} else if (ch == '{') {
				return true;
			} else if (ch == ';' || ch == '}') {
				return false;
			}
		}
		return false;
	}
}
