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

package com.ibm.cruncher.core;

import java.util.Set;

/**
 * A built bundle, as returned by
 * {@link ICruncher#getOrBuildBundle(java.util.List, BundleType, boolean)}.
 * Provides what the HTTP layer needs to serve the bundle and to answer
 * conditional requests.
 */
public interface IBundle {

	public BundleType getType();

	/**
	 * @return the bundle text
	 */
	public String getContent();

	/**
	 * @return the normalized paths of the local files and directories the
	 *         bundle was built from
	 */
	public Set<String> getDependencies();

	/**
	 * @return true if the bundle was served from the bundle cache
	 */
	public boolean isFromCache();

	/**
	 * @return the fingerprint of the requested identifier list
	 */
	public String getFingerprint();

	/**
	 * @return the quoted entity tag of the bundle text
	 */
	public String getETag();

	/**
	 * @return the latest last-modified time of the dependencies, in
	 *         milliseconds since the epoch, or zero if there are none
	 */
	public long getLastModified();
}
