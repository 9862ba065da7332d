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

package com.ibm.cruncher.core.resolver;

import java.io.File;
import java.io.IOException;

/**
 * Loads the text of a source file for import processing. Implementations
 * apply the same charset and comment handling to imported files as to the
 * files requested directly.
 */
public interface ISourceLoader {
	/**
	 * @param file the file to load
	 * @return the file text
	 * @throws IOException
	 */
	public String load(File file) throws IOException;
}
