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

import com.ibm.cruncher.core.BundleType;
import com.ibm.cruncher.core.IBundle;
import com.ibm.cruncher.core.cache.IBundleCacheEntry;
import com.ibm.cruncher.core.util.FingerprintUtil;

import java.io.File;
import java.util.Set;

public class Bundle implements IBundle {

	private final BundleType type;
	private final String fingerprint;
	private final String content;
	private final String contentHash;
	private final Set<String> dependencies;
	private final boolean fromCache;

	public Bundle(BundleType type, String fingerprint, IBundleCacheEntry entry, boolean fromCache) {
		this(type, fingerprint, entry.getContent(), entry.getContentHash(), entry.getDependencies(), fromCache);
	}

	public Bundle(BundleType type, String fingerprint, BuildResult result) {
		this(type, fingerprint, result.getContent(), FingerprintUtil.contentHash(result.getContent()),
				result.getDependencies(), false);
	}

	private Bundle(BundleType type, String fingerprint, String content, String contentHash,
			Set<String> dependencies, boolean fromCache) {
		this.type = type;
		this.fingerprint = fingerprint;
		this.content = content;
		this.contentHash = contentHash;
		this.dependencies = dependencies;
		this.fromCache = fromCache;
	}

	@Override
	public BundleType getType() {
		return type;
	}

	@Override
	public String getContent() {
		return content;
	}

	@Override
	public Set<String> getDependencies() {
		return dependencies;
	}

	@Override
	public boolean isFromCache() {
		return fromCache;
	}

	@Override
	public String getFingerprint() {
		return fingerprint;
	}

	@Override
	public String getETag() {
		return "\"" + contentHash + "\""; //$NON-NLS-1$ //$NON-NLS-2$
	}

	@Override
	public long getLastModified() {
		long result = 0;
		for (String path : dependencies) {
			result = Math.max(result, new File(path).lastModified());
		}
		return result;
	}

	@Override
	public String toString() {
		return new StringBuffer("Bundle[type:").append(type) //$NON-NLS-1$
				.append(", fingerprint:").append(fingerprint) //$NON-NLS-1$
				.append(", size:").append(content.length()) //$NON-NLS-1$
				.append(", fromCache:").append(fromCache) //$NON-NLS-1$
				.append("]").toString(); //$NON-NLS-1$
	}
}
