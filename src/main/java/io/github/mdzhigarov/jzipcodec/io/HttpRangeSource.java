/*
 * Copyright 2024 mdzhigarov
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

package io.github.mdzhigarov.jzipcodec.io;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.net.URI;
import java.net.URL;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Base64;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A {@link SeekableSource} over a remote file, read with HTTP Range requests.
 * The size is fetched once with a HEAD request when the source is built; every
 * {@link #read} is one {@code Range: bytes=a-b} GET. Servers that answer a
 * range request with the whole file (200 instead of 206) are rejected.
 */
public class HttpRangeSource implements SeekableSource {

    private static final Logger logger = LoggerFactory.getLogger(HttpRangeSource.class);

    private static final String USER_AGENT = "jZipCodec/1.0.0";
    private static final Pattern CONTENT_RANGE = Pattern.compile("bytes (\\d+)-(\\d+)/(\\d+|\\*)");

    private final URI uri;
    private final HttpClient httpClient;
    private final String basicAuth;
    private final long size;
    private volatile boolean closed = false;

    private HttpRangeSource(URI uri, HttpClient httpClient, String basicAuth, long size) {
        this.uri = uri;
        this.httpClient = httpClient;
        this.basicAuth = basicAuth;
        this.size = size;
    }

    public static Builder newBuilder(URL url) {
        return new Builder(url);
    }

    @Override
    public long size() {
        return size;
    }

    @Override
    public int read(long position, byte[] buf, int off, int len) throws IOException {
        if (closed) {
            throw new IOException("HttpRangeSource is closed");
        }
        if (position >= size) {
            return -1;
        }
        if (len == 0) {
            return 0;
        }
        long end = Math.min(position + len, size) - 1;
        byte[] body = fetchRange(position, end);
        int n = Math.min(body.length, len);
        System.arraycopy(body, 0, buf, off, n);
        return n;
    }

    @Override
    public void close() {
        closed = true;
    }

    /**
     * Fetches a range of bytes from the remote file using HTTP Range request.
     */
    private byte[] fetchRange(long start, long end) throws IOException {
        String rangeHeader = "bytes=" + start + "-" + end;
        logger.debug("HTTP Range request: {} (HTTP {})", rangeHeader, httpClient.version());

        HttpRequest.Builder requestBuilder = HttpRequest.newBuilder()
            .uri(uri)
            .header("Range", rangeHeader)
            .header("User-Agent", USER_AGENT)
            .header("Accept", "*/*");

        if (basicAuth != null) {
            requestBuilder.header("Authorization", "Basic " + basicAuth);
        }

        HttpResponse<byte[]> response = send(httpClient, requestBuilder.build(), HttpResponse.BodyHandlers.ofByteArray());
        logger.debug("HTTP Range response: {} (Server HTTP version: {}, Content-Length: {})",
                    response.statusCode(), response.version(),
                    response.headers().firstValue("Content-Length").orElse("unknown"));

        if (response.statusCode() == 206) { // Partial Content
            checkContentRange(response, start, end);
            byte[] body = response.body();
            long expected = end - start + 1;
            if (body == null || body.length != expected) {
                throw new IOException("HTTP range request " + rangeHeader + " returned "
                    + (body == null ? 0 : body.length) + " bytes, expected " + expected);
            }
            return body;
        } else if (response.statusCode() == 200) {
            logger.error("Server doesn't support HTTP Range requests (returned 200 instead of 206)");
            throw new IOException("Server doesn't support HTTP Range requests (returned 200 instead of 206). "
                    + "Random access to remote archives requires servers that support HTTP Range requests.");
        } else {
            throw new IOException("HTTP range request failed with status: " + response.statusCode());
        }
    }

    /**
     * A 206 that covers a different range than requested would hand back the wrong bytes.
     */
    private static void checkContentRange(HttpResponse<?> response, long start, long end) throws IOException {
        String contentRange = response.headers().firstValue("Content-Range").orElse(null);
        if (contentRange == null) {
            return;
        }
        Matcher matcher = CONTENT_RANGE.matcher(contentRange.trim());
        if (!matcher.matches()) {
            throw new IOException("Malformed Content-Range header: " + contentRange);
        }
        long actualStart = Long.parseLong(matcher.group(1));
        long actualEnd = Long.parseLong(matcher.group(2));
        if (actualStart != start || actualEnd != end) {
            throw new IOException("Server returned range " + actualStart + "-" + actualEnd
                + " for requested range " + start + "-" + end);
        }
    }

    private static <T> HttpResponse<T> send(HttpClient client, HttpRequest request,
                                            HttpResponse.BodyHandler<T> handler) throws IOException {
        try {
            return client.send(request, handler);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            InterruptedIOException interrupted = new InterruptedIOException("Interrupted during " + request.method()
                + " " + request.uri());
            interrupted.initCause(e);
            throw interrupted;
        }
    }

    /**
     * Builder class for creating HttpRangeSource instances.
     */
    public static class Builder {
        private final URL url;
        private HttpClient httpClient;
        private String username;
        private String password;

        Builder(URL url) {
            this.url = url;
        }

        /**
         * (Optional) Sets basic authentication credentials.
         */
        public Builder withBasicAuth(String username, String password) {
            this.username = username;
            this.password = password;
            return this;
        }

        /**
         * (Optional) Provide a custom HttpClient instance. If not provided, a default one is created.
         */
        public Builder withHttpClient(HttpClient client) {
            this.httpClient = client;
            return this;
        }

        /**
         * Performs the HEAD request that fetches the remote file size.
         */
        public HttpRangeSource build() throws IOException {
            if (url == null) {
                throw new IllegalArgumentException("URL must not be null");
            }
            HttpClient client = this.httpClient != null ? this.httpClient :
                HttpClient.newBuilder()
                    .version(HttpClient.Version.HTTP_1_1)  // Explicitly use HTTP/1.1 for Range request support
                    .connectTimeout(Duration.ofSeconds(30))
                    .build();
            String basicAuth = (username != null && password != null) ?
                Base64.getEncoder().encodeToString((username + ":" + password).getBytes(StandardCharsets.UTF_8)) : null;

            URI uri;
            try {
                uri = url.toURI();
            } catch (java.net.URISyntaxException e) {
                throw new IllegalArgumentException("Invalid URL: " + url, e);
            }
            long size = getFileSize(client, basicAuth, uri);
            return new HttpRangeSource(uri, client, basicAuth, size);
        }

        /**
         * Gets the file size using HTTP HEAD request.
         */
        private long getFileSize(HttpClient client, String basicAuth, URI uri) throws IOException {
            logger.debug("Getting file size via HTTP HEAD request using HTTP version: {}", client.version());
            HttpRequest.Builder requestBuilder = HttpRequest.newBuilder()
                .uri(uri)
                .method("HEAD", HttpRequest.BodyPublishers.noBody())
                .header("User-Agent", USER_AGENT)
                .header("Accept", "*/*");

            if (basicAuth != null) {
                requestBuilder.header("Authorization", "Basic " + basicAuth);
            }

            HttpResponse<Void> response = send(client, requestBuilder.build(), HttpResponse.BodyHandlers.discarding());
            logger.debug("HTTP HEAD response status: {} (Server HTTP version: {})", response.statusCode(), response.version());
            if (response.statusCode() != 200) {
                throw new IOException("Failed to get file size. HTTP status: " + response.statusCode());
            }

            String contentLength = response.headers().firstValue("Content-Length").orElse(null);
            if (contentLength == null) {
                throw new IOException("Server did not provide Content-Length header");
            }

            try {
                long size = Long.parseLong(contentLength);
                logger.debug("File size: {} bytes ({} MB)", size, size / 1024 / 1024);
                return size;
            } catch (NumberFormatException e) {
                throw new IOException("Invalid Content-Length header: " + contentLength, e);
            }
        }
    }
}
