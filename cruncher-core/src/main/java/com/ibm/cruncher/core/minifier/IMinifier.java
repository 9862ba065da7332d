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

package com.ibm.cruncher.core.minifier;

import java.io.IOException;

/**
 * Minifies the assembled text of a bundle.
 */
public interface IMinifier {

	/**
	 * @param text
	 *            the text to minify
	 * @param name
	 *            a name for the text, used in diagnostics
	 * @return the minified text
	 * @throws IOException
	 *             {@link com.ibm.cruncher.core.TransformFailedException} if
	 *             the text cannot be parsed
	 */
	public String minify(String text, String name) throws IOException;
}
