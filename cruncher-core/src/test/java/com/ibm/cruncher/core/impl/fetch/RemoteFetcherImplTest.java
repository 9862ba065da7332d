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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import com.ibm.cruncher.core.NotFoundException;
import com.ibm.cruncher.core.RemoteFetchFailedException;
import com.ibm.cruncher.core.RemoteFetchRejectedException;

import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpHandler;
import com.sun.net.httpserver.HttpServer;

import org.junit.After;
import org.junit.Before;
import org.junit.Test;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.net.URL;
import java.nio.charset.StandardCharsets;
import java.util.zip.GZIPOutputStream;

public class RemoteFetcherImplTest {

	private HttpServer server;
	private String base;
	private final RemoteFetcherImpl fetcher = new RemoteFetcherImpl();

	@Before
	public void setUp() throws Exception {
		server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
		server.createContext("/style.css", new Responder(200, "text/css", ".a{color:red}\r\n.b{}\r.c{}".getBytes(StandardCharsets.UTF_8), false));
		server.createContext("/latin1.css", new Responder(200, "text/css; charset=ISO-8859-1", ".a:after{content:\"é\"}".getBytes(StandardCharsets.ISO_8859_1), false));
		server.createContext("/gzip.js", new Responder(200, "application/javascript", "var a = 1;".getBytes(StandardCharsets.UTF_8), true));
		server.createContext("/big.js", new Responder(200, "application/javascript", new byte[2048], false));
		server.createContext("/missing.js", new Responder(404, "text/plain", "not here".getBytes(StandardCharsets.UTF_8), false));
		server.createContext("/error.js", new Responder(503, "text/plain", "busy".getBytes(StandardCharsets.UTF_8), false));
		server.createContext("/slow.js", new HttpHandler() {
			@Override
			public void handle(HttpExchange exchange) throws IOException {
				try {
					Thread.sleep(2000);
				} catch (InterruptedException e) {
					Thread.currentThread().interrupt();
				}
				new Responder(200, "application/javascript", "var slow;".getBytes(StandardCharsets.UTF_8), false).handle(exchange);
			}
		});
		server.createContext("/drip.js", new HttpHandler() {
			@Override
			public void handle(HttpExchange exchange) throws IOException {
				exchange.getResponseHeaders().set("Content-Type", "application/javascript");
				exchange.sendResponseHeaders(200, 0);
				OutputStream os = exchange.getResponseBody();
				try {
					// each byte arrives well within the read timeout
					for (int i = 0; i < 30; i++) {
						os.write(' ');
						os.flush();
						Thread.sleep(100);
					}
				} catch (InterruptedException e) {
					Thread.currentThread().interrupt();
				} catch (IOException e) {
					// client gave up
				} finally {
					exchange.close();
				}
			}
		});
		server.start();
		base = "http://127.0.0.1:" + server.getAddress().getPort();
	}

	@After
	public void tearDown() throws Exception {
		server.stop(0);
	}

	@Test
	public void testFetch() throws Exception {
		assertEquals(".a{color:red}\n.b{}\n.c{}", fetcher.fetch(new URL(base + "/style.css"), 1024, 3000));
	}

	@Test
	public void testCharset() throws Exception {
		assertEquals(".a:after{content:\"é\"}", fetcher.fetch(new URL(base + "/latin1.css"), 1024, 3000));
	}

	@Test
	public void testGzip() throws Exception {
		assertEquals("var a = 1;", fetcher.fetch(new URL(base + "/gzip.js"), 1024, 3000));
	}

	@Test(expected=RemoteFetchRejectedException.class)
	public void testTooLarge() throws Exception {
		fetcher.fetch(new URL(base + "/big.js"), 1024, 3000);
	}

	@Test
	public void testSizeLimitIsInclusive() throws Exception {
		assertEquals(2048, fetcher.fetch(new URL(base + "/big.js"), 2048, 3000).length());
	}

	@Test(expected=NotFoundException.class)
	public void testNotFound() throws Exception {
		fetcher.fetch(new URL(base + "/missing.js"), 1024, 3000);
	}

	@Test(expected=RemoteFetchFailedException.class)
	public void testServerError() throws Exception {
		fetcher.fetch(new URL(base + "/error.js"), 1024, 3000);
	}

	@Test(expected=RemoteFetchRejectedException.class)
	public void testTimeout() throws Exception {
		fetcher.fetch(new URL(base + "/slow.js"), 1024, 200);
	}

	@Test
	public void testSlowBody() throws Exception {
		long start = System.currentTimeMillis();
		try {
			fetcher.fetch(new URL(base + "/drip.js"), 1024, 500);
			fail("Expected exception");
		} catch (RemoteFetchRejectedException e) {
			assertTrue(System.currentTimeMillis() - start < 2500);
		}
	}

	@Test(expected=RemoteFetchFailedException.class)
	public void testConnectionRefused() throws Exception {
		int port;
		ServerSocket socket = new ServerSocket(0);
		try {
			port = socket.getLocalPort();
		} finally {
			socket.close();
		}
		fetcher.fetch(new URL("http://127.0.0.1:" + port + "/x.js"), 1024, 3000);
	}

	@Test(expected=RemoteFetchRejectedException.class)
	public void testUnsupportedProtocol() throws Exception {
		fetcher.fetch(new URL("file:///etc/passwd"), 1024, 3000);
	}

	static class Responder implements HttpHandler {
		private final int status;
		private final String contentType;
		private final byte[] body;
		private final boolean gzip;

		Responder(int status, String contentType, byte[] body, boolean gzip) {
			this.status = status;
			this.contentType = contentType;
			this.body = body;
			this.gzip = gzip;
		}

		@Override
		public void handle(HttpExchange exchange) throws IOException {
			byte[] bytes = body;
			exchange.getResponseHeaders().set("Content-Type", contentType);
			if (gzip && "gzip".equals(exchange.getRequestHeaders().getFirst("Accept-Encoding"))) {
				ByteArrayOutputStream bos = new ByteArrayOutputStream();
				GZIPOutputStream zos = new GZIPOutputStream(bos);
				zos.write(bytes);
				zos.close();
				bytes = bos.toByteArray();
				exchange.getResponseHeaders().set("Content-Encoding", "gzip");
			}
			exchange.sendResponseHeaders(status, bytes.length);
			OutputStream os = exchange.getResponseBody();
			try {
				os.write(bytes);
			} finally {
				os.close();
			}
		}
	}
}
