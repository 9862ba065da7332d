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

package com.ibm.cruncher.core.impl.transformer;

import com.ibm.cruncher.core.BundleType;
import com.ibm.cruncher.core.TransformFailedException;

import org.mozilla.javascript.Context;
import org.mozilla.javascript.Function;
import org.mozilla.javascript.Scriptable;
import org.mozilla.javascript.ScriptableObject;

import java.io.IOException;
import java.text.MessageFormat;
import java.util.Collection;
import java.util.Collections;

/**
 * Compiles CoffeeScript to JavaScript by calling
 * <code>CoffeeScript.compile(source, {bare: true})</code> in the CoffeeScript
 * compiler script.
 */
public class CoffeeScriptTransformer extends RhinoScriptTransformer {

	static final String COFFEESCRIPT = "CoffeeScript"; //$NON-NLS-1$
	static final String COMPILE = "compile"; //$NON-NLS-1$
	static final String BARE = "bare"; //$NON-NLS-1$

	private static final Collection<String> extensions = Collections.singletonList(".coffee"); //$NON-NLS-1$

	public CoffeeScriptTransformer(String scriptName, String compilerSource) {
		super(scriptName, compilerSource);
	}

	/**
	 * Creates a transformer from the compiler script at <code>location</code>.
	 *
	 * @param location a file path or class path resource name
	 * @return the transformer
	 * @throws IOException if the script cannot be read
	 */
	public static CoffeeScriptTransformer fromLocation(String location) throws IOException {
		return new CoffeeScriptTransformer(location, loadScript(location));
	}

	@Override
	public Collection<String> getExtensions() {
		return extensions;
	}

	@Override
	public BundleType getBundleType() {
		return BundleType.JS;
	}

	@Override
	protected String invoke(Context cx, Scriptable scope, String source, String path) throws IOException {
		Object coffee = ScriptableObject.getProperty(scope, COFFEESCRIPT);
		Object compile = coffee instanceof Scriptable ? ScriptableObject.getProperty((Scriptable)coffee, COMPILE) : null;
		if (!(compile instanceof Function)) {
			String message = MessageFormat.format(Messages.CoffeeScriptTransformer_0, getScriptName());
			throw new TransformFailedException(message, path, message);
		}
		Scriptable options = cx.newObject(scope);
		ScriptableObject.putProperty(options, BARE, Boolean.TRUE);
		Object result = ((Function)compile).call(cx, scope, (Scriptable)coffee, new Object[]{source, options});
		return Context.toString(result);
	}
}
