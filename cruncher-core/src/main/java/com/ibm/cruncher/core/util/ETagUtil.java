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

import com.ibm.cruncher.core.IBundle;

import com.google.common.base.Splitter;

/**
 * Conditional request support for the HTTP layer.
 */
public class ETagUtil {

	private static final Splitter tagSplitter = Splitter.on(',').trimResults().omitEmptyStrings();

	private static final String WEAK_PREFIX = "W/"; //$NON-NLS-1$

	private ETagUtil() {}

	/**
	 * Returns true if an <code>If-None-Match</code> header value matches the
	 * entity tag of the bundle. The value may be <code>*</code> or a comma
	 * separated list of strong or weak tags.
	 *
	 * @param ifNoneMatch
	 *            the header value, or null
	 * @param bundle
	 *            the bundle
	 * @return true if the client's copy is current
	 */
	public static boolean isNotModified(String ifNoneMatch, IBundle bundle) {
		if (ifNoneMatch == null) {
			return false;
		}
		String etag = bundle.getETag();
		for (String tag : tagSplitter.split(ifNoneMatch)) {
			if ("*".equals(tag)) { //$NON-NLS-1$
				return true;
			}
			if (tag.startsWith(WEAK_PREFIX)) {
				tag = tag.substring(WEAK_PREFIX.length());
			}
			if (tag.equals(etag)) {
				return true;
			}
		}
		return false;
	}

	/**
	 * Decides a conditional request from its <code>If-None-Match</code> and
	 * <code>If-Modified-Since</code> headers. <code>If-None-Match</code> takes
	 * precedence when present. Modification times are compared with one
	 * second precision.
	 *
	 * @param ifNoneMatch
	 *            the If-None-Match header value, or null
	 * @param ifModifiedSince
	 *            the If-Modified-Since header value in milliseconds, or -1
	 * @param bundle
	 *            the bundle
	 * @return true if a 304 response should be sent
	 */
	public static boolean isNotModified(String ifNoneMatch, long ifModifiedSince, IBundle bundle) {
		if (ifNoneMatch != null) {
			return isNotModified(ifNoneMatch, bundle);
		}
		long lastModified = bundle.getLastModified();
		return ifModifiedSince >= 0 && lastModified > 0 && lastModified / 1000 <= ifModifiedSince / 1000;
	}
}
