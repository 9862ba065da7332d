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

package com.ibm.cruncher.core.util;

import org.apache.commons.io.FilenameUtils;
import org.apache.commons.lang3.StringUtils;

import java.io.File;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

public class PathUtil {

	/** Matches identifiers that name a remote resource */
	public static final Pattern remotePattern = Pattern.compile("^https?://", Pattern.CASE_INSENSITIVE); //$NON-NLS-1$

	/** Matches any URL scheme, including <code>data:</code> */
	public static final Pattern protocolPattern = Pattern.compile("^[a-zA-Z][a-zA-Z0-9+.-]*:"); //$NON-NLS-1$

	private PathUtil() {}

	/**
	 * Returns the absolute, normalized path of the file, without a trailing
	 * separator. This is the form in which paths are recorded in dependency
	 * sets and compared during invalidation.
	 *
	 * @param file the file
	 * @return the normalized path
	 */
	public static String normalize(File file) {
		String path = tryNormalize(file);
		if (path == null) {
			throw new IllegalArgumentException(file.getPath());
		}
		return path;
	}

	/**
	 * Like {@link #normalize(File)}, but returns null instead of throwing for
	 * a path with more <code>..</code> segments than it has parents.
	 *
	 * @param file the file
	 * @return the normalized path, or null
	 */
	public static String tryNormalize(File file) {
		return FilenameUtils.normalizeNoEndSeparator(file.getAbsolutePath());
	}

	/**
	 * Normalizes a path string the same way as {@link #normalize(File)}.
	 *
	 * @param path the path
	 * @return the normalized path
	 */
	public static String normalize(String path) {
		return normalize(new File(path));
	}

	/**
	 * Returns true if <code>path</code> is <code>root</code> or lies below it.
	 * Both arguments must be normalized.
	 *
	 * @param root the root directory
	 * @param path the path to test
	 * @return true if the path is contained in the root
	 */
	public static boolean isUnder(String root, String path) {
		if (path.equals(root)) {
			return true;
		}
		String prefix = root.endsWith(File.separator) ? root : root + File.separator;
		return path.startsWith(prefix);
	}

	/**
	 * Returns the normalized parent directories of a normalized path, nearest
	 * first.
	 *
	 * @param path the path
	 * @return the list of ancestors
	 */
	public static List<String> ancestors(String path) {
		List<String> result = new ArrayList<String>();
		File parent = new File(path).getParentFile();
		while (parent != null) {
			result.add(parent.getPath());
			parent = parent.getParentFile();
		}
		return result;
	}

	/**
	 * Returns the extension of the name, including the leading dot, in lower
	 * case, or the empty string if the name has no extension.
	 *
	 * @param name a file name, path or URL path
	 * @return the extension
	 */
	public static String getExtension(String name) {
		int idx = name.indexOf('?');
		if (idx != -1) {
			name = name.substring(0, idx);
		}
		String ext = FilenameUtils.getExtension(name);
		return ext.length() == 0 ? ext : "." + ext.toLowerCase(Locale.ENGLISH); //$NON-NLS-1$
	}

	/**
	 * Returns true if the identifier names a remote http or https resource.
	 *
	 * @param id the identifier
	 * @return true if remote
	 */
	public static boolean isRemote(String id) {
		return remotePattern.matcher(id).find();
	}

	/**
	 * Collapses <code>.</code> and <code>..</code> segments of a forward slash
	 * delimited URL path. Leading <code>..</code> segments that cannot be
	 * collapsed are kept.
	 *
	 * @param path the URL path
	 * @return the collapsed path
	 */
	public static String collapse(String path) {
		boolean absolute = path.startsWith("/"); //$NON-NLS-1$
		List<String> parts = new ArrayList<String>();
		for (String part : path.split("/")) { //$NON-NLS-1$
			if (part.length() == 0 || ".".equals(part)) { //$NON-NLS-1$
				continue;
			}
			if ("..".equals(part) && !parts.isEmpty() && !"..".equals(parts.get(parts.size()-1))) { //$NON-NLS-1$ //$NON-NLS-2$
				parts.remove(parts.size()-1);
			} else if (!("..".equals(part) && absolute)) { //$NON-NLS-1$
				parts.add(part);
			}
		}
		String result = StringUtils.join(parts, "/"); //$NON-NLS-1$
		if (absolute) {
			result = "/" + result; //$NON-NLS-1$
		}
		if (path.endsWith("/") && !result.endsWith("/")) { //$NON-NLS-1$ //$NON-NLS-2$
			result += "/"; //$NON-NLS-1$
		}
		return result;
	}
}
