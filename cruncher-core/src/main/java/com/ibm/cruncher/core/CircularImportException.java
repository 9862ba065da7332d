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

import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Thrown when import resolution re-enters a file that is already being
 * resolved further up the import chain. The exception carries the chain,
 * starting with the outermost file and ending with the file that was
 * imported a second time.
 */
public class CircularImportException extends IOException {

	private static final long serialVersionUID = -5320563287466121470L;

	private final List<String> importChain;

	/**
	 * @param message
	 *            the exception message
	 * @param importChain
	 *            the paths of the files in the cycle, outermost first
	 */
	public CircularImportException(String message, List<String> importChain) {
		super(message);
		this.importChain = Collections.unmodifiableList(new ArrayList<String>(importChain));
	}

	/**
	 * @return the import chain, outermost first, ending with the repeated path
	 */
	public List<String> getImportChain() {
		return importChain;
	}
}
