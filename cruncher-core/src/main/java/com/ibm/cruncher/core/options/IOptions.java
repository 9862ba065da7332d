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

package com.ibm.cruncher.core.options;

import java.io.IOException;
import java.util.List;
import java.util.Map;
import java.util.Properties;

/**
 * This interface defines property names for the standard cruncher options.
 * It also provides convenience getters for those properties.
 * <p>
 * The options are backed by a {@link Properties} object, so any property,
 * including properties not defined by this interface, can be read using
 * {@link #getOption(String)} and set using
 * {@link #setOption(String, String)}.
 * <p>
 * Options are supplied to the cruncher when it is constructed. Defaults are
 * overlaid by a <code>cruncher.properties</code> file found at the root of
 * the class path, and then by any properties the embedding application
 * provides.
 */
public interface IOptions {

	/**
	 * Name of the properties file that is loaded from the class path to
	 * provide default values.
	 */
	public static final String propsFilename = "cruncher.properties"; //$NON-NLS-1$

	/**
	 * Name of property that specifies the comma delimited list of directories
	 * that are searched, in order, for CSS, LESS and Sass resources.
	 */
	public static final String CSS_PATHS = "cssPaths"; //$NON-NLS-1$

	/**
	 * Name of property that specifies the comma delimited list of directories
	 * that are searched, in order, for JavaScript and CoffeeScript resources.
	 */
	public static final String JS_PATHS = "jsPaths"; //$NON-NLS-1$

	/**
	 * Name of property that specifies if built bundles are stored in the
	 * bundle cache.
	 * <p>
	 * Valid values: <code>true/false</code>
	 */
	public static final String CACHE_FILES = "cacheFiles"; //$NON-NLS-1$

	/**
	 * Name of property that specifies the number of days a cached bundle
	 * lives. A value of zero or less causes bundles to expire as soon as
	 * they are stored, so every request rebuilds.
	 * <p>
	 * Valid values: Integer
	 * @see #DEFAULT_CACHE_DAYS
	 */
	public static final String CACHE_DAYS = "cacheDays"; //$NON-NLS-1$

	/**
	 * Name of property that specifies the maximum number of characters held
	 * by the bundle cache. The least recently used bundles are evicted when
	 * the capacity is exceeded.
	 */
	public static final String CACHE_CAPACITY = "cacheCapacity"; //$NON-NLS-1$

	/**
	 * Name of property that specifies if remote (http/https) resources may be
	 * downloaded.
	 * <p>
	 * Valid values: <code>true/false</code>
	 */
	public static final String ALLOW_REMOTE_DOWNLOADS = "allowRemoteDownloads"; //$NON-NLS-1$

	/**
	 * Name of property that specifies the maximum size, in bytes, of a
	 * remote resource.
	 */
	public static final String REMOTE_MAX_BYTES = "remoteMaxBytes"; //$NON-NLS-1$

	/**
	 * Name of property that specifies the connect and read timeout, in
	 * milliseconds, for remote resources.
	 */
	public static final String REMOTE_TIMEOUT = "remoteTimeout"; //$NON-NLS-1$

	/**
	 * Name of property that specifies the comma delimited list of
	 * <code>token=url</code> pairs. A bundle may name a token in place of the
	 * URL. Tokens are matched case-insensitively.
	 */
	public static final String REMOTE_WHITELIST = "remoteWhitelist"; //$NON-NLS-1$

	/**
	 * Name of property that specifies the value substituted for the
	 * <code>{root}</code> token in CSS resources.
	 */
	public static final String RELATIVE_CSS_ROOT = "relativeCssRoot"; //$NON-NLS-1$

	/**
	 * Name of property that specifies the directory that corresponds to the
	 * root of the web site. When set, relative <code>url()</code> references
	 * in local CSS resources are rewritten to site absolute paths.
	 */
	public static final String SITE_ROOT = "siteRoot"; //$NON-NLS-1$

	/**
	 * Name of property that specifies if the search roots are watched for
	 * changes that invalidate cached bundles.
	 * <p>
	 * Valid values: <code>true/false</code>
	 */
	public static final String WATCH_FILES = "watchFiles"; //$NON-NLS-1$

	/**
	 * Name of property that specifies the polling interval, in milliseconds,
	 * of the file watcher.
	 */
	public static final String WATCH_INTERVAL = "watchInterval"; //$NON-NLS-1$

	/**
	 * Name of property that specifies the file path or class path resource
	 * name of a CoffeeScript compiler script. <code>.coffee</code> resources
	 * are allowed only when this property is set.
	 */
	public static final String COFFEESCRIPT_COMPILER = "coffeeScriptCompiler"; //$NON-NLS-1$

	/**
	 * Name of property that specifies the file path or class path resource
	 * name of an Autoprefixer script. When set, style sheet bundles are run
	 * through <code>autoprefixer.process(css, options)</code> before they are
	 * minified.
	 */
	public static final String AUTOPREFIXER = "autoPrefixer"; //$NON-NLS-1$

	/**
	 * Name of property that specifies a comma separated list of browser
	 * queries passed to the Autoprefixer as its <code>browsers</code> option.
	 * The script's own defaults apply if not set.
	 */
	public static final String AUTOPREFIXER_BROWSERS = "autoPrefixerBrowsers"; //$NON-NLS-1$

	/**
	 * Name of property that specifies the Autoprefixer <code>cascade</code>
	 * option, which aligns prefixed declarations visually.
	 * <p>
	 * Valid values: <code>true/false</code>
	 */
	public static final String AUTOPREFIXER_CASCADE = "autoPrefixerCascade"; //$NON-NLS-1$

	/** The default value returned by {@link #getCacheDays()} */
	public static final int DEFAULT_CACHE_DAYS = 365;

	/** The default value returned by {@link #getCacheCapacity()} */
	public static final long DEFAULT_CACHE_CAPACITY = 50L*1024*1024;

	/** The default value returned by {@link #getRemoteMaxBytes()} */
	public static final long DEFAULT_REMOTE_MAX_BYTES = 4L*1024*1024;

	/** The default value returned by {@link #getRemoteTimeout()} */
	public static final int DEFAULT_REMOTE_TIMEOUT = 3000;

	/** The default value returned by {@link #getWatchInterval()} */
	public static final int DEFAULT_WATCH_INTERVAL = 1000;

	/**
	 * @return the directories listed by {@link #CSS_PATHS}
	 */
	public List<String> getCssPaths();

	/**
	 * @return the directories listed by {@link #JS_PATHS}
	 */
	public List<String> getJsPaths();

	public boolean isCacheFiles();

	/**
	 * Convenience method for reading the {@link #CACHE_DAYS} options
	 * property.
	 *
	 * @return the value of the property, or {@link #DEFAULT_CACHE_DAYS} if it
	 *         is not set or not a number
	 */
	public int getCacheDays();

	public long getCacheCapacity();

	public boolean isAllowRemoteDownloads();

	public long getRemoteMaxBytes();

	public int getRemoteTimeout();

	/**
	 * Returns the URL that a whitelist token stands for.
	 *
	 * @param token
	 *            the token, compared case-insensitively
	 * @return the URL, or null if the token is not in the whitelist
	 */
	public String getWhitelistUrl(String token);

	public String getRelativeCssRoot();

	/**
	 * @return the value of {@link #SITE_ROOT}, or null if not set
	 */
	public String getSiteRoot();

	public boolean isWatchFiles();

	public int getWatchInterval();

	/**
	 * @return the value of {@link #COFFEESCRIPT_COMPILER}, or null if not set
	 */
	public String getCoffeeScriptCompiler();

	/**
	 * @return the value of {@link #AUTOPREFIXER}, or null if not set
	 */
	public String getAutoPrefixer();

	/**
	 * @return the browser queries listed by {@link #AUTOPREFIXER_BROWSERS}
	 */
	public List<String> getAutoPrefixerBrowsers();

	public boolean isAutoPrefixerCascade();

	/**
	 * Returns the value of the specified option
	 *
	 * @param name The option name
	 * @return The option value
	 */
	public String getOption(String name);

	/**
	 * Sets the named option to the specified value. Registered
	 * {@link IOptionsListener}s are notified of the change.
	 *
	 * @param name
	 *            The option name
	 * @param value
	 *            The option value, or null to restore the default
	 * @throws IOException
	 */
	public void setOption(String name, String value) throws IOException;

	/**
	 * Convenience form of {@link #setOption(String, String)} for boolean values.
	 *
	 * @param name The option name
	 * @param value The option value
	 * @throws IOException
	 */
	public void setOption(String name, boolean value) throws IOException;

	/**
	 * Returns an unmodifiable view of the current options.
	 *
	 * @return the options map
	 */
	public Map<String, String> getOptionsMap();

	public void addOptionsListener(IOptionsListener listener);

	public void removeOptionsListener(IOptionsListener listener);
}
