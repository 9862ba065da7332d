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


package com.ibm.cruncher.core.options;

/**
 * Listener interface for options changes. Listeners are registered with
 * {@link IOptions#addOptionsListener(IOptionsListener)}.
 */
public interface IOptionsListener {
	/**
	 * This method is called when the options are changed.
	 *
	 * @param options
	 *            The updated options.
	 * @param sequence
	 *            The change sequence number. Numbers increase with each
	 *            change made to the same options object.
	 */
	public void optionsUpdated(IOptions options, long sequence);
}
