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

package com.ibm.cruncher.core.util;

import org.apache.commons.io.IOUtils;
import org.apache.commons.io.input.BOMInputStream;

import java.io.File;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.Reader;
import java.io.StringWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;

/**
 * Reader copy utils that also close the readers when the copy is done.
 */
public class CopyUtil {

	public static int copy(Reader reader, Writer writer) throws IOException {
		try {
			return IOUtils.copy(reader, writer);
		} finally {
			IOUtils.closeQuietly(reader);
			IOUtils.closeQuietly(writer);
		}
	}

	/**
	 * Reads the reader to the end and closes it.
	 *
	 * @param reader the reader
	 * @return the characters read
	 * @throws IOException
	 */
	public static String readToString(Reader reader) throws IOException {
		StringWriter out = new StringWriter();
		copy(reader, out);
		return out.toString();
	}

	/**
	 * Returns a UTF-8 reader for the file. A leading byte order mark is
	 * dropped.
	 *
	 * @param file the file to read
	 * @return the reader
	 * @throws IOException
	 */
	public static Reader newReader(File file) throws IOException {
		return new InputStreamReader(new BOMInputStream(new FileInputStream(file)), StandardCharsets.UTF_8);
	}
}
