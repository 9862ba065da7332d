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

import java.lang.reflect.Field;
import java.lang.reflect.Modifier;
import java.text.MessageFormat;
import java.util.Locale;
import java.util.MissingResourceException;
import java.util.ResourceBundle;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Base class for the externalized message classes. Subclasses declare one
 * <code>public static String</code> field per message key and call
 * {@link #initializeMessages(String, Class)} from a static initializer to
 * populate the fields from the named resource bundle.
 */
public class NLS {
	private static final String sourceClass = NLS.class.getName();
	private static final Logger log = Logger.getLogger(sourceClass);

	static final String MISSING_MESSAGE = "NLS missing message: {0} in: {1}"; //$NON-NLS-1$

	protected NLS() {
	}

	/**
	 * Initializes the static String fields of <code>clazz</code> with the
	 * values of the like named keys in the resource bundle.
	 *
	 * @param bundleName
	 *            the fully qualified base name of the resource bundle
	 * @param clazz
	 *            the class whose fields are to be initialized
	 */
	public static void initializeMessages(String bundleName, Class<?> clazz) {
		ResourceBundle bundle = null;
		try {
			bundle = ResourceBundle.getBundle(bundleName, Locale.getDefault(), clazz.getClassLoader());
		} catch (MissingResourceException e) {
			if (log.isLoggable(Level.WARNING)) {
				log.log(Level.WARNING, e.getMessage(), e);
			}
		}
		for (Field field : clazz.getDeclaredFields()) {
			int modifiers = field.getModifiers();
			if (!Modifier.isStatic(modifiers) || Modifier.isFinal(modifiers)
					|| field.getType() != String.class) {
				continue;
			}
			String value = null;
			if (bundle != null && bundle.containsKey(field.getName())) {
				value = bundle.getString(field.getName());
			} else {
				value = MessageFormat.format(MISSING_MESSAGE, field.getName(), bundleName);
			}
			try {
				if (!Modifier.isPublic(modifiers)) {
					field.setAccessible(true);
				}
				field.set(null, value);
			} catch (IllegalAccessException e) {
				throw new IllegalStateException(e);
			}
		}
	}
}
