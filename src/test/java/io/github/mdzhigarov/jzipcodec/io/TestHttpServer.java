package io.github.mdzhigarov.jzipcodec.io;

import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpHandler;
import com.sun.net.httpserver.HttpServer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Test HTTP server serving archives over HEAD and Range GET requests.
 * Each file is served in a {@link RangeMode}, so misbehaving servers can be imitated.
 */
public class TestHttpServer {
    private static final Logger logger = LoggerFactory.getLogger(TestHttpServer.class);

    private final HttpServer server;
    private final int port;
    private final Map<String, byte[]> files = new ConcurrentHashMap<>();
    private final Map<String, RangeMode> modes = new ConcurrentHashMap<>();
    private final AtomicInteger rangeRequests = new AtomicInteger();

    public TestHttpServer() throws IOException {
        server = HttpServer.create(new InetSocketAddress("localhost", 0), 0);
        port = server.getAddress().getPort();
        server.setExecutor(Executors.newCachedThreadPool());
        server.createContext("/", new FileHandler());
        logger.info("Test HTTP server created on port {}", port);
    }

    public void start() {
        server.start();
        logger.info("Test HTTP server started on port {}", port);
    }

    public void stop() {
        server.stop(0);
        logger.info("Test HTTP server stopped");
    }

    public String getBaseUrl() {
        return "http://localhost:" + port;
    }

    /**
     * How GET requests with a Range header are answered.
     */
    public enum RangeMode {
        /** 206 with the requested bytes. */
        NORMAL,
        /** 200 with the whole file. */
        IGNORED,
        /** 206 with an empty body. */
        EMPTY,
        /** 206 with the bytes one position further than requested. */
        SHIFTED
    }

    public void addFile(String path, byte[] content) {
        addFile(path, content, RangeMode.NORMAL);
    }

    public void addFile(String path, byte[] content, RangeMode mode) {
        files.put(path, content);
        modes.put(path, mode);
        logger.debug("Added file {} with {} bytes ({})", path, content.length, mode);
    }

    public int getRangeRequestCount() {
        return rangeRequests.get();
    }

    private class FileHandler implements HttpHandler {
        @Override
        public void handle(HttpExchange exchange) throws IOException {
            String requestMethod = exchange.getRequestMethod();
            String requestPath = exchange.getRequestURI().getPath();
            logger.debug("HTTP {} request for path: {}", requestMethod, requestPath);

            byte[] content = files.get(requestPath);
            if (content == null) {
                exchange.sendResponseHeaders(404, -1);
                exchange.close();
                return;
            }

            if ("HEAD".equals(requestMethod)) {
                exchange.getResponseHeaders().set("Content-Length", String.valueOf(content.length));
                exchange.getResponseHeaders().set("Accept-Ranges",
                    modes.get(requestPath) == RangeMode.IGNORED ? "none" : "bytes");
                exchange.sendResponseHeaders(200, -1);
                exchange.close();
            } else if ("GET".equals(requestMethod)) {
                String rangeHeader = exchange.getRequestHeaders().getFirst("Range");
                RangeMode mode = modes.get(requestPath);
                if (mode != RangeMode.IGNORED && rangeHeader != null && rangeHeader.startsWith("bytes=")) {
                    handleRangeRequest(exchange, content, rangeHeader, mode);
                } else {
                    send(exchange, 200, content);
                }
            } else {
                exchange.sendResponseHeaders(405, -1);
                exchange.close();
            }
        }

        private void handleRangeRequest(HttpExchange exchange, byte[] content, String rangeHeader, RangeMode mode)
                throws IOException {
            rangeRequests.incrementAndGet();
            String[] parts = rangeHeader.substring(6).split("-");
            int start;
            int end;
            try {
                start = Integer.parseInt(parts[0]);
                end = parts.length > 1 && !parts[1].isEmpty() ? Integer.parseInt(parts[1]) : content.length - 1;
            } catch (NumberFormatException e) {
                exchange.sendResponseHeaders(400, -1);
                exchange.close();
                return;
            }
            if (start < 0 || start > end || start >= content.length) {
                exchange.sendResponseHeaders(416, -1);
                exchange.close();
                return;
            }
            end = Math.min(end, content.length - 1);
            if (mode == RangeMode.EMPTY) {
                exchange.sendResponseHeaders(206, -1);
                exchange.close();
                return;
            }
            if (mode == RangeMode.SHIFTED && end + 1 < content.length) {
                start++;
                end++;
            }
            byte[] range = new byte[end - start + 1];
            System.arraycopy(content, start, range, 0, range.length);
            exchange.getResponseHeaders().set("Content-Range",
                String.format("bytes %d-%d/%d", start, end, content.length));
            send(exchange, 206, range);
            logger.debug("Served range request: bytes {}-{} of {}", start, end, content.length);
        }

        private void send(HttpExchange exchange, int status, byte[] body) throws IOException {
            exchange.sendResponseHeaders(status, body.length);
            try (OutputStream os = exchange.getResponseBody()) {
                os.write(body);
            }
        }
    }
}
