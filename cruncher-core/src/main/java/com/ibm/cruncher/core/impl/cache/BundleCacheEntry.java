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

package com.ibm.cruncher.core.impl.cache;

import com.ibm.cruncher.core.cache.IBundleCacheEntry;
import com.ibm.cruncher.core.util.FingerprintUtil;

import java.util.Collection;
import java.util.Collections;
import java.util.Date;
import java.util.LinkedHashSet;
import java.util.Set;

public class BundleCacheEntry implements IBundleCacheEntry {

	private final String key;
	private final String content;
	private final String contentHash;
	private final Set<String> dependencies;
	private final long created;
	private final long expires;

	BundleCacheEntry(String key, String content, Collection<String> dependencies, long created, long expires) {
		this.key = key;
		this.content = content;
		this.contentHash = FingerprintUtil.contentHash(content);
		this.dependencies = Collections.unmodifiableSet(new LinkedHashSet<String>(dependencies));
		this.created = created;
		this.expires = expires;
	}

	@Override
	public String getKey() {
		return key;
	}

	@Override
	public String getContent() {
		return content;
	}

	@Override
	public String getContentHash() {
		return contentHash;
	}

	@Override
	public Set<String> getDependencies() {
		return dependencies;
	}

	@Override
	public long getCreated() {
		return created;
	}

	@Override
	public long getExpires() {
		return expires;
	}

	@Override
	public boolean isExpired(long now) {
		return now >= expires;
	}

	@Override
	public String toString() {
		return new StringBuffer("BundleCacheEntry[size:").append(content.length()) //$NON-NLS-1$
				.append(", hash:").append(contentHash) //$NON-NLS-1$
				.append(", created:").append(new Date(created)) //$NON-NLS-1$
				.append(", expires:").append(new Date(expires)) //$NON-NLS-1$
				.append(", dependencies:").append(dependencies) //$NON-NLS-1$
				.append("]").toString(); //$NON-NLS-1$
	}
}
