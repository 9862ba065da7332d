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
import com.ibm.cruncher.core.deps.DependencyTracker;
import com.ibm.cruncher.core.transformer.ITransformer;
import com.ibm.cruncher.core.transformer.ITransformerRegistry;
import com.ibm.cruncher.core.transformer.TransformResult;
import com.ibm.cruncher.core.util.PathUtil;

import java.io.File;
import java.io.IOException;
import java.util.Collections;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.logging.Level;
import java.util.logging.Logger;

public class TransformerRegistryImpl implements ITransformerRegistry {
	private static final String sourceClass = TransformerRegistryImpl.class.getName();
	private static final Logger log = Logger.getLogger(sourceClass);

	private final Map<String, ITransformer> transformers = new ConcurrentHashMap<String, ITransformer>();

	/* (non-Javadoc)
	 * @see com.ibm.cruncher.core.transformer.ITransformerRegistry#register(com.ibm.cruncher.core.transformer.ITransformer)
	 */
	@Override
	public void register(ITransformer transformer) {
		for (String ext : transformer.getExtensions()) {
			ext = ext.toLowerCase(Locale.ENGLISH);
			if (ext.equals(BundleType.CSS.getExtension()) || ext.equals(BundleType.JS.getExtension())) {
				throw new IllegalArgumentException(ext);
			}
			ITransformer previous = transformers.put(ext, transformer);
			if (log.isLoggable(Level.CONFIG)) {
				log.config("Registered " + transformer.getClass().getSimpleName() + " for " + ext //$NON-NLS-1$ //$NON-NLS-2$
						+ (previous != null ? " replacing " + previous.getClass().getSimpleName() : "")); //$NON-NLS-1$ //$NON-NLS-2$
			}
		}
	}

	/* (non-Javadoc)
	 * @see com.ibm.cruncher.core.transformer.ITransformerRegistry#getTransformer(java.lang.String)
	 */
	@Override
	public ITransformer getTransformer(String extension) {
		return extension == null ? null : transformers.get(extension.toLowerCase(Locale.ENGLISH));
	}

	/* (non-Javadoc)
	 * @see com.ibm.cruncher.core.transformer.ITransformerRegistry#getAllowedExtensions(com.ibm.cruncher.core.BundleType)
	 */
	@Override
	public Set<String> getAllowedExtensions(BundleType type) {
		Set<String> result = new TreeSet<String>();
		result.add(type.getExtension());
		for (Map.Entry<String, ITransformer> entry : transformers.entrySet()) {
			if (entry.getValue().getBundleType() == type) {
				result.add(entry.getKey());
			}
		}
		return Collections.unmodifiableSet(result);
	}

	/* (non-Javadoc)
	 * @see com.ibm.cruncher.core.transformer.ITransformerRegistry#isAllowed(java.lang.String, com.ibm.cruncher.core.BundleType)
	 */
	@Override
	public boolean isAllowed(String name, BundleType type) {
		String ext = PathUtil.getExtension(name);
		if (ext.equals(type.getExtension())) {
			return true;
		}
		ITransformer transformer = transformers.get(ext);
		return transformer != null && transformer.getBundleType() == type;
	}

	/* (non-Javadoc)
	 * @see com.ibm.cruncher.core.transformer.ITransformerRegistry#transform(java.lang.String, java.lang.String, com.ibm.cruncher.core.deps.DependencyTracker)
	 */
	@Override
	public String transform(String source, String path, DependencyTracker dependencies) throws IOException {
		final String sourceMethod = "transform"; //$NON-NLS-1$
		final boolean isTraceLogging = log.isLoggable(Level.FINER);
		if (isTraceLogging) {
			log.entering(sourceClass, sourceMethod, new Object[]{path});
		}
		ITransformer transformer = getTransformer(PathUtil.getExtension(path));
		String result = source;
		if (transformer != null) {
			TransformResult transformed = transformer.transform(source, path);
			for (String consumed : transformed.getConsumedFiles()) {
				dependencies.add(new File(consumed));
			}
			result = transformed.getOutput();
		}
		if (isTraceLogging) {
			log.exiting(sourceClass, sourceMethod);
		}
		return result;
	}
}
