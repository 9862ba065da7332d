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
import java.util.Collection;

/**
 * Inlines the files referenced by the import statements of one source
 * language.
 */
public interface IImportResolver {

	/**
	 * @return the extensions, including the leading dot, of the host files
	 *         whose import statements this resolver processes
	 */
	public Collection<String> getExtensions();

	/**
	 * Replaces each import statement in <code>source</code> with the
	 * recursively processed content of the imported file. Every file read is
	 * added to the dependency tracker of <code>context</code>.
	 *
	 * @param source
	 *            the text of <code>currentFile</code>
	 * @param currentFile
	 *            the file containing <code>source</code>. Relative imports
	 *            are resolved against its directory.
	 * @param context
	 *            the state of the current build
	 * @return the source with imports inlined
	 * @throws IOException
	 *             {@link com.ibm.cruncher.core.CircularImportException} if a
	 *             file imports itself directly or indirectly,
	 *             {@link com.ibm.cruncher.core.AccessDeniedException} if an
	 *             import resolves outside of the search roots, or any error
	 *             raised while transforming an imported file
	 */
	public String resolveImports(String source, File currentFile, ImportContext context) throws IOException;
}
