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

package com.ibm.cruncher.core.readers;

import java.io.IOException;
import java.io.PushbackReader;
import java.io.Reader;

/**
 * A reader that filters out block comments and, optionally, line comments
 * from style sheets.
 * <p>
 * Block comments that start with <code>/*!</code> are license comments and
 * are passed through unchanged. Any other block comment is replaced by a
 * single space. Quoted strings are passed through unchanged.
 * <p>
 * Line comments (<code>//</code>) are only recognized when line comment
 * stripping is enabled (LESS and SCSS sources) and the <code>//</code>
 * starts a token, i.e. follows white space, a <code>;</code>, a brace, or
 * the start of the input. This keeps unquoted URLs such as
 * <code>url(http://host/x.png)</code> intact. The line terminator is kept.
 * <p>
 * Note: this is not a comment stripper for JavaScript. It knows nothing of
 * regular expression literals.
 */
public class CommentStrippingReader extends Reader {
	private final PushbackReader in;
	private final boolean stripLineComments;
	private boolean closed = false;

	/** quote character of the string being read, or 0 outside of strings */
	private int quote = 0;

	/** the last character returned */
	private int last = ' ';

	/** remainder of a license comment waiting to be returned */
	private final StringBuilder pending = new StringBuilder();

	/**
	 * Creates a reader that strips block comments only (plain CSS).
	 *
	 * @param reader the source reader
	 */
	public CommentStrippingReader(Reader reader) {
		this(reader, false);
	}

	/**
	 * @param reader the source reader
	 * @param stripLineComments true to also strip <code>//</code> line comments
	 */
	public CommentStrippingReader(Reader reader, boolean stripLineComments) {
		this.in = new PushbackReader(reader);
		this.stripLineComments = stripLineComments;
	}

	@Override
	public int read() throws IOException {
		if (closed) {
			throw new IOException("Attempt to read from a closed reader"); //$NON-NLS-1$
		}
		if (pending.length() > 0) {
			char c = pending.charAt(0);
			pending.deleteCharAt(0);
			return emit(c);
		}
		int c = in.read();
		if (c == -1) {
			return c;
		}
		if (quote != 0) {
			if (c == quote && last != '\\') {
				quote = 0;
			}
			return emit(c);
		}
		if (c == '"' || c == '\'') {
			quote = c;
			return emit(c);
		}
		if (c == '/') {
			int next = peek();
			if (next == '*') {
				in.read();
				return skipBlockComment();
			}
			if (next == '/' && stripLineComments && isTokenBoundary(last)) {
				in.read();
				return skipLineComment();
			}
		}
		return emit(c);
	}

	/**
	 * Called with the opening <code>/*</code> consumed.
	 *
	 * @return the character that replaces the comment, or -1 at end of input
	 */
	private int skipBlockComment() throws IOException {
		int c = in.read();
		boolean license = c == '!';
		if (license) {
			pending.append("*!"); //$NON-NLS-1$
		} else if (c != -1) {
			in.unread(c);
		}
		int prev = 0;
		while ((c = in.read()) != -1) {
			if (license) {
				pending.append((char)c);
			}
			if (prev == '*' && c == '/') {
				break;
			}
			prev = c;
		}
		if (license) {
			return emit('/');
		}
		// a removed comment separates tokens like white space does
		return c == -1 ? c : emit(' ');
	}

	/**
	 * Called with the opening <code>//</code> consumed.
	 *
	 * @return the line terminator, or -1 at end of input
	 */
	private int skipLineComment() throws IOException {
		int c;
		do {
			c = in.read();
		} while (c != -1 && c != '\n' && c != '\r');
		return c == -1 ? c : emit(c);
	}

	private int peek() throws IOException {
		int c = in.read();
		if (c != -1) {
			in.unread(c);
		}
		return c;
	}

	private int emit(int c) {
		last = c;
		return c;
	}

	private static boolean isTokenBoundary(int c) {
		return Character.isWhitespace(c) || c == ';' || c == '{' || c == '}';
	}

	@Override
	public int read(char[] cbuf, int off, int len) throws IOException {
		int i, ch = 0;
		for (i = 0; i < len; i++) {
			ch = read();
			if (ch == -1) {
				break;
			}
			cbuf[off+i] = (char)ch;
		}
		return (i == 0 && ch == -1) ? -1 : i;
	}

	@Override
	public void close() throws IOException {
		closed = true;
		in.close();
	}
}
