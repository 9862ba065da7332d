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

package com.ibm.cruncher.core.impl.minifier;

import com.ibm.cruncher.core.TransformFailedException;
import com.ibm.cruncher.core.minifier.IMinifier;

import com.google.javascript.jscomp.CompilationLevel;
import com.google.javascript.jscomp.Compiler;
import com.google.javascript.jscomp.CompilerOptions;
import com.google.javascript.jscomp.CompilerOptions.LanguageMode;
import com.google.javascript.jscomp.JSError;
import com.google.javascript.jscomp.Result;
import com.google.javascript.jscomp.SourceFile;

import java.io.IOException;
import java.text.MessageFormat;
import java.util.Collections;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Minifies JavaScript with the Google Closure Compiler using simple
 * optimizations.
 */
public class ClosureJavaScriptMinifier implements IMinifier {
	private static final String sourceClass = ClosureJavaScriptMinifier.class.getName();
	private static final Logger log = Logger.getLogger(sourceClass);

	private static final List<SourceFile> externs = Collections.emptyList();

	static {
		Logger.getLogger("com.google.javascript.jscomp.Compiler").setLevel(Level.WARNING); //$NON-NLS-1$
		Logger.getLogger("com.google.javascript.jscomp.PhaseOptimizer").setLevel(Level.WARNING); //$NON-NLS-1$
	}

	/**
	 * Returns the compiler options used for each compilation. Subclasses may
	 * override to adjust them.
	 *
	 * @return new compiler options
	 */
	protected CompilerOptions getCompilerOptions() {
		CompilerOptions options = new CompilerOptions();
		options.setLanguageIn(LanguageMode.ECMASCRIPT_NEXT);
		options.setLanguageOut(LanguageMode.NO_TRANSPILE);
		options.setEmitUseStrict(false);
		CompilationLevel.SIMPLE_OPTIMIZATIONS.setOptionsForCompilationLevel(options);
		return options;
	}

	/* (non-Javadoc)
	 * @see com.ibm.cruncher.core.minifier.IMinifier#minify(java.lang.String, java.lang.String)
	 */
	@Override
	public String minify(String js, String name) throws IOException {
		final String sourceMethod = "minify"; //$NON-NLS-1$
		final boolean isTraceLogging = log.isLoggable(Level.FINER);
		if (isTraceLogging) {
			log.entering(sourceClass, sourceMethod, new Object[]{name, js.length()});
		}
		Compiler compiler = new Compiler();
		// we do our own threading, so disable compiler threads.
		compiler.disableThreads();
		List<SourceFile> sources = Collections.singletonList(SourceFile.fromCode(name, js));
		Result result = compiler.compile(externs, sources, getCompilerOptions());
		if (!result.success) {
			StringBuffer sb = new StringBuffer();
			for (JSError error : compiler.getErrors()) {
				sb.append("\r\n\t").append(error.getDescription()) //$NON-NLS-1$
				.append(" (").append(error.getLineNumber()).append(")."); //$NON-NLS-1$ //$NON-NLS-2$
			}
			throw new TransformFailedException(
					MessageFormat.format(Messages.ClosureJavaScriptMinifier_0, name) + sb, name, sb.toString().trim());
		}
		String output = compiler.toSource();
		if (isTraceLogging) {
			log.exiting(sourceClass, sourceMethod, output.length());
		}
		return output;
	}
}
