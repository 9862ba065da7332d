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

/**
 * Thrown when a transformer or minifier rejects its input, for example
 * because of a LESS or CoffeeScript syntax error. The compiler's own
 * diagnostic text is preserved in {@link #getDiagnostics()}.
 */
public class TransformFailedException extends IOException {

	private static final long serialVersionUID = 3340581740916457295L;

	private final String path;
	private final String diagnostics;

	public TransformFailedException(String message, String path, String diagnostics) {
		super(message);
		this.path = path;
		this.diagnostics = diagnostics;
	}

	public TransformFailedException(String message, String path, String diagnostics, Throwable rootCause) {
		super(message, rootCause);
		this.path = path;
		this.diagnostics = diagnostics;
	}

	/**
	 * @return the path or URL of the resource that failed to transform
	 */
	public String getPath() {
		return path;
	}

	/**
	 * @return the diagnostic text reported by the compiler
	 */
	public String getDiagnostics() {
		return diagnostics;
	}
}
