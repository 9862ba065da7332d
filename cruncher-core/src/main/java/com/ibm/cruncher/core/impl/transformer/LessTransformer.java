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
import com.ibm.cruncher.core.transformer.ITransformer;
import com.ibm.cruncher.core.transformer.TransformResult;

import org.lesscss.LessCompiler;
import org.lesscss.LessException;

import java.io.IOException;
import java.text.MessageFormat;
import java.util.Collection;
import java.util.Collections;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Compiles LESS to CSS.
 * <p>
 * Imports have been inlined by the time the source reaches the compiler, so
 * the compiler never reads files on its own and the result reports no
 * consumed files. The compiler instance is shared and compilations are
 * serialized on it.
 */
public class LessTransformer implements ITransformer {
	private static final String sourceClass = LessTransformer.class.getName();
	private static final Logger log = Logger.getLogger(sourceClass);

	private static final Collection<String> extensions = Collections.singletonList(".less"); //$NON-NLS-1$

	private final LessCompiler compiler;

	public LessTransformer() {
		this(new LessCompiler());
	}

	public LessTransformer(LessCompiler compiler) {
		this.compiler = compiler;
	}

	@Override
	public Collection<String> getExtensions() {
		return extensions;
	}

	@Override
	public BundleType getBundleType() {
		return BundleType.CSS;
	}

	/* (non-Javadoc)
	 * @see com.ibm.cruncher.core.transformer.ITransformer#transform(java.lang.String, java.lang.String)
	 */
	@Override
	public TransformResult transform(String source, String path) throws IOException {
		final String sourceMethod = "transform"; //$NON-NLS-1$
		final boolean isTraceLogging = log.isLoggable(Level.FINER);
		if (isTraceLogging) {
			log.entering(sourceClass, sourceMethod, new Object[]{path});
		}
		String css;
		try {
			synchronized (compiler) {
				css = compiler.compile(source);
			}
		} catch (LessException e) {
			throw new TransformFailedException(
					MessageFormat.format(Messages.LessTransformer_0, path), path, e.getMessage(), e);
		}
		if (isTraceLogging) {
			log.exiting(sourceClass, sourceMethod);
		}
		return new TransformResult(css);
	}
}
