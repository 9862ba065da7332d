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

package com.ibm.cruncher.core.watch;

/**
 * Receives notification of changes to watched files.
 */
public interface IFileChangeListener {
	/**
	 * Called when a file below a watched root is created, changed or deleted,
	 * or when a directory below it is created or deleted.
	 *
	 * @param path the normalized absolute path of the file or directory
	 */
	public void fileChanged(String path);
}
