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

package com.ibm.cruncher.core.fetch;

import java.io.IOException;
import java.net.URL;

/**
 * Retrieves the text of remote resources.
 */
public interface IRemoteFetcher {

	/**
	 * Downloads the resource at <code>url</code> and returns it as text with
	 * line endings normalized to <code>\n</code>.
	 *
	 * @param url
	 *            an http or https URL
	 * @param maxBytes
	 *            the maximum size of the resource, or zero for no limit
	 * @param timeoutMs
	 *            the connect and read timeout in milliseconds, or zero for no
	 *            timeout
	 * @return the resource text
	 * @throws IOException
	 *             <ul>
	 *             <li>{@link com.ibm.cruncher.core.RemoteFetchRejectedException}
	 *             if the URL is not http or https, the resource is larger than
	 *             <code>maxBytes</code> or the server did not respond in
	 *             time</li>
	 *             <li>{@link com.ibm.cruncher.core.NotFoundException} if the
	 *             server responds with 404 or 410</li>
	 *             <li>{@link com.ibm.cruncher.core.RemoteFetchFailedException}
	 *             for any other failure</li>
	 *             </ul>
	 */
	public String fetch(URL url, long maxBytes, int timeoutMs) throws IOException;
}
