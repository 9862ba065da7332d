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
import com.ibm.cruncher.core.options.IOptions;

import org.mozilla.javascript.Context;
import org.mozilla.javascript.Function;
import org.mozilla.javascript.Scriptable;
import org.mozilla.javascript.ScriptableObject;
import org.mozilla.javascript.Undefined;

import java.io.IOException;
import java.text.MessageFormat;
import java.util.Collection;
import java.util.Collections;
import java.util.List;

/**
 * Adds vendor prefixes to style sheets by calling
 * <code>autoprefixer.process(css, {browsers: [...], cascade: ...})</code> in
 * an Autoprefixer script and returning the <code>css</code> property of the
 * result.
 * <p>
 * This transformer is not registered for any extension. The bundle builder
 * runs it over the joined text of each style sheet bundle, before
 * minification. The browser queries and the cascade flag are read from the
 * options on every call.
 */
public class AutoPrefixerTransformer extends RhinoScriptTransformer {

	static final String AUTOPREFIXER = "autoprefixer"; //$NON-NLS-1$
	static final String PROCESS = "process"; //$NON-NLS-1$
	static final String BROWSERS = "browsers"; //$NON-NLS-1$
	static final String CASCADE = "cascade"; //$NON-NLS-1$
	static final String CSS = "css"; //$NON-NLS-1$

	private final IOptions options;

	public AutoPrefixerTransformer(String scriptName, String scriptSource, IOptions options) {
		super(scriptName, scriptSource);
		this.options = options;
	}

	/**
	 * Creates a transformer from the Autoprefixer script at
	 * <code>location</code>.
	 *
	 * @param location a file path or class path resource name
	 * @param options the options supplying the browser queries
	 * @return the transformer
	 * @throws IOException if the script cannot be read
	 */
	public static AutoPrefixerTransformer fromLocation(String location, IOptions options) throws IOException {
		return new AutoPrefixerTransformer(location, loadScript(location), options);
	}

	@Override
	public Collection<String> getExtensions() {
		return Collections.emptyList();
	}

	@Override
	public BundleType getBundleType() {
		return BundleType.CSS;
	}

	@Override
	protected String invoke(Context cx, Scriptable scope, String source, String path) throws IOException {
		Object prefixer = ScriptableObject.getProperty(scope, AUTOPREFIXER);
		Object process = prefixer instanceof Scriptable ? ScriptableObject.getProperty((Scriptable)prefixer, PROCESS) : null;
		if (!(process instanceof Function)) {
			String message = MessageFormat.format(Messages.AutoPrefixerTransformer_0, getScriptName());
			throw new TransformFailedException(message, path, message);
		}
		Scriptable processOptions = cx.newObject(scope);
		List<String> browsers = options.getAutoPrefixerBrowsers();
		if (!browsers.isEmpty()) {
			ScriptableObject.putProperty(processOptions, BROWSERS, cx.newArray(scope, browsers.toArray()));
		}
		ScriptableObject.putProperty(processOptions, CASCADE, options.isAutoPrefixerCascade());
		Object result = ((Function)process).call(cx, scope, (Scriptable)prefixer, new Object[]{source, processOptions});
		Object css = result instanceof Scriptable ? ScriptableObject.getProperty((Scriptable)result, CSS) : null;
		if (css == null || css == Scriptable.NOT_FOUND || css instanceof Undefined) {
			String message = MessageFormat.format(Messages.AutoPrefixerTransformer_1, getScriptName());
			throw new TransformFailedException(message, path, message);
		}
		return Context.toString(css);
	}
}
