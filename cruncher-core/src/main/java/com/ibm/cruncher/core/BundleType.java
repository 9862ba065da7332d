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

/**
 * The kinds of bundle the engine produces. The type selects the search
 * roots, the import syntax, the transformers that may run and the minifier.
 */
public enum BundleType {
	CSS(".css", "text/css"), //$NON-NLS-1$ //$NON-NLS-2$
	JS(".js", "application/javascript"); //$NON-NLS-1$ //$NON-NLS-2$

	private final String extension;
	private final String contentType;

	private BundleType(String extension, String contentType) {
		this.extension = extension;
		this.contentType = contentType;
	}

	/**
	 * @return the extension, including the dot, of files that need no transform
	 */
	public String getExtension() {
		return extension;
	}

	/**
	 * @return the MIME type the HTTP layer should serve the bundle with
	 */
	public String getContentType() {
		return contentType;
	}
}
