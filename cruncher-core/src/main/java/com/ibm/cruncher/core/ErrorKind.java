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

import java.util.concurrent.ExecutionException;

/**
 * Classifies bundle build failures for the HTTP layer.
 */
public enum ErrorKind {
	NOT_FOUND(404),
	ACCESS_DENIED(403),
	REMOTE_FETCH_FAILED(502),
	REMOTE_FETCH_REJECTED(403),
	CIRCULAR_IMPORT(500),
	TRANSFORM_FAILED(500),
	INTERNAL(500);

	private final int status;

	private ErrorKind(int status) {
		this.status = status;
	}

	/**
	 * @return the HTTP status code a handler should respond with
	 */
	public int getStatus() {
		return status;
	}

	/**
	 * Returns the kind of the specified failure. Wrapping
	 * {@link ExecutionException}s are unwrapped first.
	 *
	 * @param t the failure
	 * @return the error kind
	 */
	public static ErrorKind of(Throwable t) {
		while (t instanceof ExecutionException && t.getCause() != null) {
			t = t.getCause();
		}
		if (t instanceof NotFoundException) {
			return NOT_FOUND;
		} else if (t instanceof AccessDeniedException) {
			return ACCESS_DENIED;
		} else if (t instanceof RemoteFetchFailedException) {
			return REMOTE_FETCH_FAILED;
		} else if (t instanceof RemoteFetchRejectedException) {
			return REMOTE_FETCH_REJECTED;
		} else if (t instanceof CircularImportException) {
			return CIRCULAR_IMPORT;
		} else if (t instanceof TransformFailedException) {
			return TRANSFORM_FAILED;
		}
		return INTERNAL;
	}
}
