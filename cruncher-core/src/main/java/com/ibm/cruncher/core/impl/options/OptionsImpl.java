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

package com.ibm.cruncher.core.impl.options;

import com.ibm.cruncher.core.options.IOptions;
import com.ibm.cruncher.core.options.IOptionsListener;
import com.ibm.cruncher.core.util.TypeUtil;

import org.apache.commons.io.IOUtils;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.net.URL;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Properties;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicLong;
import java.util.logging.Level;
import java.util.logging.Logger;

public class OptionsImpl implements IOptions {
	private static final String sourceClass = OptionsImpl.class.getName();
	private static final Logger log = Logger.getLogger(sourceClass);

	private static final Map<String, String> defaults;

	static {
		Map<String, String> map = new HashMap<String, String>();
		map.put(CSS_PATHS,				"css"); //$NON-NLS-1$
		map.put(JS_PATHS,				"js"); //$NON-NLS-1$
		map.put(CACHE_FILES,			Boolean.TRUE.toString());
		map.put(CACHE_DAYS,				Integer.toString(DEFAULT_CACHE_DAYS));
		map.put(CACHE_CAPACITY,			Long.toString(DEFAULT_CACHE_CAPACITY));
		map.put(ALLOW_REMOTE_DOWNLOADS,	Boolean.FALSE.toString());
		map.put(REMOTE_MAX_BYTES,		Long.toString(DEFAULT_REMOTE_MAX_BYTES));
		map.put(REMOTE_TIMEOUT,			Integer.toString(DEFAULT_REMOTE_TIMEOUT));
		map.put(RELATIVE_CSS_ROOT,		"/css/"); //$NON-NLS-1$
		map.put(WATCH_FILES,			Boolean.TRUE.toString());
		map.put(WATCH_INTERVAL,			Integer.toString(DEFAULT_WATCH_INTERVAL));
		map.put(AUTOPREFIXER_CASCADE,	Boolean.TRUE.toString());
		defaults = Collections.unmodifiableMap(map);
	};

	/** Current values, backed by {@link #defaultOptions} for unset names */
	private Properties props;

	/** Read-only copy of {@link #props} handed to callers, replaced on every update */
	private volatile Map<String, String> shadowMap;

	/** Whitelist parsed from {@link #REMOTE_WHITELIST}, keyed by upper case token */
	private volatile Map<String, String> whitelist;

	private final Properties defaultOptions;

	private final List<IOptionsListener> listeners = new CopyOnWriteArrayList<IOptionsListener>();

	private final AtomicLong sequence = new AtomicLong();

	/**
	 * Creates an options object holding the defaults, overlaid with any
	 * <code>cruncher.properties</code> found at the root of the class path.
	 */
	public OptionsImpl() {
		this(null);
	}

	/**
	 * Creates an options object holding the defaults, overlaid with any
	 * <code>cruncher.properties</code> found at the root of the class path,
	 * overlaid with <code>overrides</code>.
	 *
	 * @param overrides
	 *            option values supplied by the embedding application. May be
	 *            null.
	 */
	public OptionsImpl(Properties overrides) {
		defaultOptions = initDefaultOptions();
		Properties props = new Properties(defaultOptions);
		if (overrides != null) {
			for (String name : overrides.stringPropertyNames()) {
				props.setProperty(name, overrides.getProperty(name));
			}
		}
		setProps(props);
	}

	/**
	 * Creates an options object from a properties file.
	 *
	 * @param propsFile the properties file to load
	 * @return the new options
	 * @throws IOException if the file cannot be read
	 */
	public static OptionsImpl fromFile(File propsFile) throws IOException {
		Properties props = new Properties();
		InputStream in = null;
		try {
			in = propsFile.toURI().toURL().openStream();
			props.load(in);
		} finally {
			IOUtils.closeQuietly(in);
		}
		return new OptionsImpl(props);
	}

	@Override
	public List<String> getCssPaths() {
		return TypeUtil.asList(getOption(CSS_PATHS));
	}

	@Override
	public List<String> getJsPaths() {
		return TypeUtil.asList(getOption(JS_PATHS));
	}

	@Override
	public boolean isCacheFiles() {
		return TypeUtil.asBoolean(getOption(CACHE_FILES), true);
	}

	@Override
	public int getCacheDays() {
		return TypeUtil.asInt(getOption(CACHE_DAYS), DEFAULT_CACHE_DAYS);
	}

	@Override
	public long getCacheCapacity() {
		return TypeUtil.asLong(getOption(CACHE_CAPACITY), DEFAULT_CACHE_CAPACITY);
	}

	@Override
	public boolean isAllowRemoteDownloads() {
		return TypeUtil.asBoolean(getOption(ALLOW_REMOTE_DOWNLOADS));
	}

	@Override
	public long getRemoteMaxBytes() {
		return TypeUtil.asLong(getOption(REMOTE_MAX_BYTES), DEFAULT_REMOTE_MAX_BYTES);
	}

	@Override
	public int getRemoteTimeout() {
		return TypeUtil.asInt(getOption(REMOTE_TIMEOUT), DEFAULT_REMOTE_TIMEOUT);
	}

	@Override
	public String getWhitelistUrl(String token) {
		return token == null ? null : whitelist.get(token.trim().toUpperCase(Locale.ENGLISH));
	}

	@Override
	public String getRelativeCssRoot() {
		String result = getOption(RELATIVE_CSS_ROOT);
		return result != null ? result : ""; //$NON-NLS-1$
	}

	@Override
	public String getSiteRoot() {
		String result = getOption(SITE_ROOT);
		return result != null && result.trim().length() > 0 ? result.trim() : null;
	}

	@Override
	public boolean isWatchFiles() {
		return TypeUtil.asBoolean(getOption(WATCH_FILES), true);
	}

	@Override
	public int getWatchInterval() {
		return TypeUtil.asInt(getOption(WATCH_INTERVAL), DEFAULT_WATCH_INTERVAL);
	}

	@Override
	public String getCoffeeScriptCompiler() {
		String result = getOption(COFFEESCRIPT_COMPILER);
		return result != null && result.trim().length() > 0 ? result.trim() : null;
	}

	@Override
	public String getAutoPrefixer() {
		String result = getOption(AUTOPREFIXER);
		return result != null && result.trim().length() > 0 ? result.trim() : null;
	}

	@Override
	public List<String> getAutoPrefixerBrowsers() {
		return TypeUtil.asList(getOption(AUTOPREFIXER_BROWSERS));
	}

	@Override
	public boolean isAutoPrefixerCascade() {
		return TypeUtil.asBoolean(getOption(AUTOPREFIXER_CASCADE), true);
	}

	/* (non-Javadoc)
	 * @see com.ibm.cruncher.core.options.IOptions#setOption(java.lang.String, boolean)
	 */
	@Override
	public void setOption(String name, boolean value) throws IOException {
		setOption(name, Boolean.toString(value));
	}

	/* (non-Javadoc)
	 * @see com.ibm.cruncher.core.options.IOptions#setOption(java.lang.String, java.lang.String)
	 */
	@Override
	public void setOption(String name, String value) throws IOException {
		long seq;
		synchronized (this) {
			// a null value reverts the option to its default
			Properties updated = new Properties(defaultOptions);
			for (String key : props.stringPropertyNames()) {
				if (!key.equals(name) && props.containsKey(key)) {
					updated.setProperty(key, props.getProperty(key));
				}
			}
			if (value != null) {
				updated.setProperty(name, value);
			}
			setProps(updated);
			seq = sequence.incrementAndGet();
		}
		if (log.isLoggable(Level.CONFIG)) {
			log.config("Option " + name + " set to " + value); //$NON-NLS-1$ //$NON-NLS-2$
		}
		updateNotify(seq);
	}

	/* (non-Javadoc)
	 * @see com.ibm.cruncher.core.options.IOptions#getOption(java.lang.String)
	 */
	@Override
	public String getOption(String name) {
		return getOptionsMap().get(name);
	}

	/* (non-Javadoc)
	 * @see com.ibm.cruncher.core.options.IOptions#getOptionsMap()
	 */
	@Override
	public Map<String, String> getOptionsMap() {
		return shadowMap;
	}

	@Override
	public void addOptionsListener(IOptionsListener listener) {
		listeners.add(listener);
	}

	@Override
	public void removeOptionsListener(IOptionsListener listener) {
		listeners.remove(listener);
	}

	/**
	 * Calls each listener in registration order. A listener that throws is
	 * logged and skipped.
	 *
	 * @param sequence the change sequence number
	 */
	protected void updateNotify(long sequence) {
		for (IOptionsListener listener : listeners) {
			try {
				listener.optionsUpdated(this, sequence);
			} catch (RuntimeException e) {
				if (log.isLoggable(Level.SEVERE)) {
					log.log(Level.SEVERE, e.getMessage(), e);
				}
			}
		}
	}

	/**
	 * Returns the built-in defaults, overlaid with the contents of a
	 * <code>cruncher.properties</code> at the root of the class path, if any.
	 * A class path file that cannot be read is logged and ignored.
	 *
	 * @return the default options
	 */
	protected Properties initDefaultOptions() {
		Properties result = new Properties();
		result.putAll(defaults);
		URL url = OptionsImpl.class.getClassLoader().getResource(propsFilename);
		if (url == null) {
			return result;
		}
		if (log.isLoggable(Level.CONFIG)) {
			log.config("Loading default options from " + url); //$NON-NLS-1$
		}
		InputStream in = null;
		try {
			in = url.openStream();
			result.load(in);
		} catch (IOException ex) {
			if (log.isLoggable(Level.WARNING)) {
				log.log(Level.WARNING, ex.getMessage(), ex);
			}
		} finally {
			IOUtils.closeQuietly(in);
		}
		return result;
	}

	private void setProps(Properties props) {
		Map<String, String> map = new HashMap<String, String>();
		for (String name : props.stringPropertyNames()) {
			map.put(name, props.getProperty(name));
		}
		this.props = props;
		shadowMap = Collections.unmodifiableMap(map);
		whitelist = TypeUtil.asUpperCaseKeyMap(map.get(REMOTE_WHITELIST));
	}
}
