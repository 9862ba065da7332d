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

import com.ibm.cruncher.core.BundleType;

import org.apache.commons.codec.binary.Hex;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.List;
import java.util.Locale;

/**
 * Computes the stable identities used by the bundle cache and by HTTP
 * validation.
 * <p>
 * A fingerprint is the MD5 digest of the ordered list of resource
 * identifiers. Each identifier is followed by a NUL separator so that
 * <code>["ab", "c"]</code> and <code>["a", "bc"]</code> yield different
 * fingerprints. The digest is rendered as 32 lower case hex characters and
 * does not depend on any per-process state.
 */
public class FingerprintUtil {

	/** Fingerprint of the empty identifier list (the MD5 of no bytes) */
	public static final String EMPTY_FINGERPRINT = "d41d8cd98f00b204e9800998ecf8427e"; //$NON-NLS-1$

	private static final byte SEPARATOR = 0;

	private FingerprintUtil() {
	}

	/**
	 * Returns the fingerprint of the ordered list of identifiers.
	 *
	 * @param identifiers the resource identifiers, in request order
	 * @return the fingerprint
	 */
	public static String fingerprint(List<String> identifiers) {
		if (identifiers == null || identifiers.isEmpty()) {
			return EMPTY_FINGERPRINT;
		}
		MessageDigest md = newDigest();
		for (String id : identifiers) {
			if (id == null) {
				throw new NullPointerException();
			}
			md.update(id.getBytes(StandardCharsets.UTF_8));
			md.update(SEPARATOR);
		}
		return Hex.encodeHexString(md.digest());
	}

	/**
	 * Returns the MD5 hash of the content, used as the basis of ETags.
	 *
	 * @param content the bundle content
	 * @return the hash as lower case hex
	 */
	public static String contentHash(String content) {
		MessageDigest md = newDigest();
		return Hex.encodeHexString(md.digest(content.getBytes(StandardCharsets.UTF_8)));
	}

	/**
	 * Returns the bundle cache key for a fingerprint. Bundles built from the
	 * same identifiers as a different type, or with and without minification,
	 * have different keys.
	 *
	 * @param type the bundle type
	 * @param minify true if the bundle is minified
	 * @param fingerprint the identifier fingerprint
	 * @return the cache key
	 */
	public static String cacheKey(BundleType type, boolean minify, String fingerprint) {
		return new StringBuilder(type.name().toLowerCase(Locale.ENGLISH))
			.append(minify ? ":min:" : ":raw:") //$NON-NLS-1$ //$NON-NLS-2$
			.append(fingerprint)
			.toString();
	}

	private static MessageDigest newDigest() {
		try {
			return MessageDigest.getInstance("MD5"); //$NON-NLS-1$
		} catch (NoSuchAlgorithmException e) {
			// every JRE is required to provide MD5
			throw new IllegalStateException(e);
		}
	}
}
