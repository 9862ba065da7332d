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
 * Thrown when a requested resource has an extension that is not allowed for
 * the bundle type, or resolves to a path outside of the configured search
 * roots. Fails the whole bundle.
 */
public class AccessDeniedException extends IOException {

	private static final long serialVersionUID = -2417709264325683510L;

	/**
	 * Constructs a new exception.
	 */
	public AccessDeniedException() {
	}

	/**
	 * Constructs a new exception with the specified message.
	 *
	 * @param message
	 *            a <code>String</code> specifying the text of the exception
	 *            message
	 */
	public AccessDeniedException(String message) {
		super(message);
	}

	/**
	 * Constructs a new exception with the specified root cause.
	 *
	 * @param rootCause
	 *            the <code>Throwable</code> that caused this exception
	 */
	public AccessDeniedException(Throwable rootCause) {
		super(rootCause);
	}

	/**
	 * Constructs a new exception with a message and root cause.
	 *
	 * @param message
	 *            a <code>String</code> specifying the text of the exception
	 *            message
	 * @param rootCause
	 *            the <code>Throwable</code> that caused this exception
	 */
	public AccessDeniedException(String message, Throwable rootCause) {
		super(message, rootCause);
	}

}
