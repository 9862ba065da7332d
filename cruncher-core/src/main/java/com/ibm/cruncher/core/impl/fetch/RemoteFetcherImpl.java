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

package com.ibm.cruncher.core.impl.fetch;

import com.ibm.cruncher.core.NotFoundException;
import com.ibm.cruncher.core.RemoteFetchFailedException;
import com.ibm.cruncher.core.RemoteFetchRejectedException;
import com.ibm.cruncher.core.fetch.IRemoteFetcher;

import org.apache.commons.io.IOUtils;
import org.apache.commons.io.input.BoundedInputStream;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.net.HttpURLConnection;
import java.net.SocketTimeoutException;
import java.net.URL;
import java.nio.charset.Charset;
import java.nio.charset.IllegalCharsetNameException;
import java.nio.charset.StandardCharsets;
import java.nio.charset.UnsupportedCharsetException;
import java.text.MessageFormat;
import java.util.Locale;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.zip.GZIPInputStream;

/**
 * Fetches remote resources with {@link HttpURLConnection}.
 */
public class RemoteFetcherImpl implements IRemoteFetcher {
	private static final String sourceClass = RemoteFetcherImpl.class.getName();
	private static final Logger log = Logger.getLogger(sourceClass);

	static final String GZIP = "gzip"; //$NON-NLS-1$

	static final int BUFFER_SIZE = 4096;

	static final Pattern charsetPattern = Pattern.compile("charset\\s*=\\s*\"?([^\";\\s]+)", Pattern.CASE_INSENSITIVE); //$NON-NLS-1$

	static final Pattern lineEndingPattern = Pattern.compile("\\r\\n?"); //$NON-NLS-1$

	/* (non-Javadoc)
	 * @see com.ibm.cruncher.core.fetch.IRemoteFetcher#fetch(java.net.URL, long, int)
	 */
	@Override
	public String fetch(URL url, long maxBytes, int timeoutMs) throws IOException {
		final String sourceMethod = "fetch"; //$NON-NLS-1$
		final boolean isTraceLogging = log.isLoggable(Level.FINER);
		if (isTraceLogging) {
			log.entering(sourceClass, sourceMethod, new Object[]{url, maxBytes, timeoutMs});
		}
		String protocol = url.getProtocol().toLowerCase(Locale.ENGLISH);
		if (!"http".equals(protocol) && !"https".equals(protocol)) { //$NON-NLS-1$ //$NON-NLS-2$
			throw new RemoteFetchRejectedException(MessageFormat.format(Messages.RemoteFetcherImpl_0, url));
		}
		// bounds the whole download, where the read timeout bounds each read
		long deadline = System.currentTimeMillis() + timeoutMs;
		String result;
		HttpURLConnection conn = null;
		try {
			conn = (HttpURLConnection)url.openConnection();
			conn.setInstanceFollowRedirects(true);
			conn.setConnectTimeout(timeoutMs);
			conn.setReadTimeout(timeoutMs);
			conn.setRequestProperty("Accept-Encoding", GZIP); //$NON-NLS-1$
			int status = conn.getResponseCode();
			if (status == HttpURLConnection.HTTP_NOT_FOUND || status == HttpURLConnection.HTTP_GONE) {
				throw new NotFoundException(url.toString());
			}
			if (status < 200 || status >= 300) {
				throw new RemoteFetchFailedException(MessageFormat.format(Messages.RemoteFetcherImpl_1, url, status));
			}
			long contentLength = conn.getContentLengthLong();
			if (maxBytes > 0 && contentLength > maxBytes) {
				throw new RemoteFetchRejectedException(
						MessageFormat.format(Messages.RemoteFetcherImpl_2, url, contentLength, maxBytes));
			}
			byte[] bytes = readBody(conn, url, maxBytes, timeoutMs, deadline);
			result = new String(bytes, getCharset(conn.getContentType()));
		} catch (SocketTimeoutException e) {
			throw new RemoteFetchRejectedException(MessageFormat.format(Messages.RemoteFetcherImpl_3, url, timeoutMs), e);
		} catch (NotFoundException e) {
			throw e;
		} catch (RemoteFetchRejectedException e) {
			throw e;
		} catch (RemoteFetchFailedException e) {
			throw e;
		} catch (IOException e) {
			// unknown host, connection refused or reset
			throw new RemoteFetchFailedException(MessageFormat.format(Messages.RemoteFetcherImpl_4, url, e.toString()), e);
		} finally {
			if (conn != null) {
				conn.disconnect();
			}
		}
		result = lineEndingPattern.matcher(result).replaceAll("\n"); //$NON-NLS-1$
		if (isTraceLogging) {
			log.exiting(sourceClass, sourceMethod, result.length());
		}
		return result;
	}

	/**
	 * Reads the response body, decompressing it if the server sent it gzip
	 * encoded. Reads at most one byte more than <code>maxBytes</code> of
	 * uncompressed data, which is enough to detect an oversized body. A body
	 * still arriving at <code>deadline</code> is rejected.
	 */
	private byte[] readBody(HttpURLConnection conn, URL url, long maxBytes, int timeoutMs, long deadline) throws IOException {
		InputStream in = conn.getInputStream();
		try {
			if (GZIP.equalsIgnoreCase(conn.getContentEncoding())) {
				in = new GZIPInputStream(in);
			}
			if (maxBytes > 0) {
				in = new BoundedInputStream(in, maxBytes + 1);
			}
			ByteArrayOutputStream out = new ByteArrayOutputStream();
			byte[] buffer = new byte[BUFFER_SIZE];
			int n;
			while ((n = in.read(buffer)) != -1) {
				out.write(buffer, 0, n);
				if (timeoutMs > 0 && System.currentTimeMillis() > deadline) {
					throw new RemoteFetchRejectedException(MessageFormat.format(Messages.RemoteFetcherImpl_3, url, timeoutMs));
				}
			}
			if (maxBytes > 0 && out.size() > maxBytes) {
				throw new RemoteFetchRejectedException(
						MessageFormat.format(Messages.RemoteFetcherImpl_2, url, "> " + maxBytes, maxBytes)); //$NON-NLS-1$
			}
			return out.toByteArray();
		} finally {
			IOUtils.closeQuietly(in);
		}
	}

	static Charset getCharset(String contentType) {
		if (contentType != null) {
			Matcher m = charsetPattern.matcher(contentType);
			if (m.find()) {
				try {
					return Charset.forName(m.group(1));
				} catch (IllegalCharsetNameException e) {
					if (log.isLoggable(Level.WARNING)) {
						log.log(Level.WARNING, e.getMessage(), e);
					}
				} catch (UnsupportedCharsetException e) {
					if (log.isLoggable(Level.WARNING)) {
						log.log(Level.WARNING, e.getMessage(), e);
					}
				}
			}
		}
		return StandardCharsets.UTF_8;
	}
}
