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

import com.ibm.cruncher.core.NotFoundException;
import com.ibm.cruncher.core.TransformFailedException;
import com.ibm.cruncher.core.transformer.ITransformer;
import com.ibm.cruncher.core.transformer.TransformResult;

import org.apache.commons.io.FileUtils;
import org.apache.commons.io.IOUtils;
import org.mozilla.javascript.Context;
import org.mozilla.javascript.RhinoException;
import org.mozilla.javascript.Script;
import org.mozilla.javascript.Scriptable;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.text.MessageFormat;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Base class for transformers whose compiler is a JavaScript program run in
 * Mozilla Rhino.
 * <p>
 * The compiler script is compiled once. Each thread evaluates it into a
 * scope of its own the first time it transforms a source, so that compiler
 * state is never shared between threads.
 */
public abstract class RhinoScriptTransformer implements ITransformer {
	private static final String sourceClass = RhinoScriptTransformer.class.getName();
	private static final Logger log = Logger.getLogger(sourceClass);

	private final String scriptName;

	private final Script compilerScript;

	private final ThreadLocal<Scriptable> threadScopes = new ThreadLocal<Scriptable>();

	/**
	 * @param scriptName
	 *            the name of the compiler script, used in diagnostics
	 * @param scriptSource
	 *            the compiler script
	 */
	protected RhinoScriptTransformer(String scriptName, String scriptSource) {
		this.scriptName = scriptName;
		Context cx = Context.enter();
		try {
			// compilers exceed the size limits of generated byte code
			cx.setOptimizationLevel(-1);
			compilerScript = cx.compileString(scriptSource, scriptName, 1, null);
		} finally {
			Context.exit();
		}
	}

	/* (non-Javadoc)
	 * @see com.ibm.cruncher.core.transformer.ITransformer#transform(java.lang.String, java.lang.String)
	 */
	@Override
	public TransformResult transform(String source, String path) throws IOException {
		final String sourceMethod = "transform"; //$NON-NLS-1$
		final boolean isTraceLogging = log.isLoggable(Level.FINER);
		if (isTraceLogging) {
			log.entering(sourceClass, sourceMethod, new Object[]{scriptName, path});
		}
		String result;
		Context cx = Context.enter();
		try {
			cx.setOptimizationLevel(-1);
			result = invoke(cx, getThreadScope(cx), source, path);
		} catch (RhinoException e) {
			throw new TransformFailedException(
					MessageFormat.format(Messages.RhinoScriptTransformer_0, path, scriptName),
					path, e.details(), e);
		} finally {
			Context.exit();
		}
		if (isTraceLogging) {
			log.exiting(sourceClass, sourceMethod);
		}
		return new TransformResult(result);
	}

	/**
	 * Runs the compiler on the source.
	 *
	 * @param cx
	 *            the current context
	 * @param scope
	 *            the scope of the current thread, in which the compiler script
	 *            has been evaluated
	 * @param source
	 *            the source text
	 * @param path
	 *            the path of the source
	 * @return the compiled text
	 * @throws IOException
	 *             {@link TransformFailedException} if the compiler reports an
	 *             error other than by throwing
	 */
	protected abstract String invoke(Context cx, Scriptable scope, String source, String path) throws IOException;

	protected String getScriptName() {
		return scriptName;
	}

	private Scriptable getThreadScope(Context cx) {
		Scriptable scope = threadScopes.get();
		if (scope == null) {
			if (log.isLoggable(Level.FINE)) {
				log.fine("Initializing " + scriptName + " for thread " + Thread.currentThread().getName()); //$NON-NLS-1$ //$NON-NLS-2$
			}
			scope = cx.initStandardObjects();
			compilerScript.exec(cx, scope);
			threadScopes.set(scope);
		}
		return scope;
	}

	/**
	 * Reads a compiler script from a file or, if no file exists at
	 * <code>location</code>, from a class path resource.
	 *
	 * @param location
	 *            a file path or class path resource name
	 * @return the script text
	 * @throws IOException
	 *             {@link NotFoundException} if the script cannot be found
	 */
	public static String loadScript(String location) throws IOException {
		File file = new File(location);
		if (file.isFile()) {
			return FileUtils.readFileToString(file, "UTF-8"); //$NON-NLS-1$
		}
		String resourceName = location.startsWith("/") ? location.substring(1) : location; //$NON-NLS-1$
		InputStream in = RhinoScriptTransformer.class.getClassLoader().getResourceAsStream(resourceName);
		if (in == null) {
			throw new NotFoundException(location);
		}
		try {
			return IOUtils.toString(in, "UTF-8"); //$NON-NLS-1$
		} finally {
			IOUtils.closeQuietly(in);
		}
	}
}
