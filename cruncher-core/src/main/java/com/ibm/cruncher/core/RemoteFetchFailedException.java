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
 * Thrown by the remote fetcher for network level failures (connection refused,
 * unknown host, server errors). Bundle builds treat it as recoverable: the
 * remote resource contributes no content and the build continues.
 */
public class RemoteFetchFailedException extends IOException {

	private static final long serialVersionUID = 6283315170385523011L;

	/**
	 * Constructs a new exception.
	 */
	public RemoteFetchFailedException() {
	}

	/**
	 * Constructs a new exception with the specified message.
	 *
	 * @param message
	 *            a <code>String</code> specifying the text of the exception
	 *            message
	 */
	public RemoteFetchFailedException(String message) {
		super(message);
	}

	/**
	 * Constructs a new exception with the specified root cause.
	 *
	 * @param rootCause
	 *            the <code>Throwable</code> that caused this exception
	 */
	public RemoteFetchFailedException(Throwable rootCause) {
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
	public RemoteFetchFailedException(String message, Throwable rootCause) {
		super(message, rootCause);
	}

}
