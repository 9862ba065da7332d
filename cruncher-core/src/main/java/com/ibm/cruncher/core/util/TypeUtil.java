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

import com.google.common.base.Splitter;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

public class TypeUtil {

	private static final Splitter listSplitter = Splitter.on(',').trimResults().omitEmptyStrings();

	public static Boolean asBoolean(Object obj) {
		Boolean result = Boolean.FALSE;
		if (obj != null) {
			if (obj instanceof Boolean) {
				result = (Boolean)obj;
			} else if (obj instanceof String) {
				result = Boolean.valueOf(
						"true".equalsIgnoreCase(((String)obj).trim()) || //$NON-NLS-1$
						"1".equals(((String)obj).trim())); //$NON-NLS-1$
			}
		}
		return result;
	}

	public static Boolean asBoolean(Object obj, boolean defaultValue) {
		if (obj == null) {
			return defaultValue;
		}
		return asBoolean(obj);
	}

	public static int asInt(Object obj, int defaultValue) {
		int result = defaultValue;
		if (obj != null) {
			if (obj instanceof Number) {
				result = ((Number)obj).intValue();
			} else if (obj instanceof String) {
				String str = ((String)obj).trim();
				if (str.matches("[-+]?\\d+")) { //$NON-NLS-1$
					try {
						result = Integer.parseInt(str);
					} catch (NumberFormatException e) {
						// out of range for an int
						result = str.startsWith("-") ? Integer.MIN_VALUE : Integer.MAX_VALUE; //$NON-NLS-1$
					}
				}
			}
		}
		return result;
	}

	public static long asLong(Object obj, long defaultValue) {
		long result = defaultValue;
		if (obj != null) {
			if (obj instanceof Number) {
				result = ((Number)obj).longValue();
			} else if (obj instanceof String) {
				String str = ((String)obj).trim();
				if (str.matches("[-+]?\\d{1,18}")) { //$NON-NLS-1$
					result = Long.parseLong(str);
				}
			}
		}
		return result;
	}

	/**
	 * Splits a comma delimited option value into its trimmed, non-empty
	 * elements.
	 *
	 * @param value the option value, may be null
	 * @return the list of values
	 */
	public static List<String> asList(String value) {
		if (value == null) {
			return Collections.emptyList();
		}
		return listSplitter.splitToList(value);
	}

	/**
	 * Parses a comma delimited list of <code>name=value</code> pairs. Names
	 * are converted to upper case so that lookups can be case-insensitive.
	 *
	 * @param value the option value, may be null
	 * @return an ordered map of the pairs
	 */
	public static Map<String, String> asUpperCaseKeyMap(String value) {
		Map<String, String> result = new LinkedHashMap<String, String>();
		for (String entry : asList(value)) {
			int idx = entry.indexOf('=');
			if (idx > 0 && idx < entry.length()-1) {
				result.put(entry.substring(0, idx).trim().toUpperCase(Locale.ENGLISH), entry.substring(idx+1).trim());
			}
		}
		return Collections.unmodifiableMap(result);
	}
}
