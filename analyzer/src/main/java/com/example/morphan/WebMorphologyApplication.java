package com.example.morphan;

import com.google.gson.Gson;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.OutputStream;
import java.io.Reader;
import java.net.InetSocketAddress;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * HTTP facade over {@link MorphologyService}:
 *
 * <pre>
 *   GET|POST /          {"morphan_version": ...}
 *   POST /api/text      {"text": ...}            best segmentation
 *   POST /api/nbest     {"text": ..., "n": 3}    n best segmentations (n defaults to the limit)
 *   POST /api/morphs    {"text": ...}            every candidate with its best-path cost
 * </pre>
 *
 * Any response is wrapped as JSONP when the query string carries a {@code callback} parameter.
 */
public class WebMorphologyApplication {

    private static final Logger log = Logger.getLogger(WebMorphologyApplication.class.getName());

    private static final String CALLBACK_PARAM = "callback";
    private static final String JSON = "application/json; charset=utf-8";
    private static final String JAVASCRIPT = "application/javascript; charset=utf-8";

    private final MorphologyService service;
    private final Gson gson = new Gson();

    public WebMorphologyApplication(MorphologyService service) {
        this.service = service;
    }

    /**
     * Binds the endpoints and starts serving.
     *
     * @param port port to listen on; {@code 0} picks a free one
     * @return the running server, to be stopped by the caller
     * @throws IOException when the port cannot be bound
     */
    public HttpServer start(int port) throws IOException {
        HttpServer server = HttpServer.create(new InetSocketAddress(port), 0);
        server.createContext("/", this::handleRoot);
        server.createContext("/api/text", exchange -> handleAnalysis(exchange,
                request -> service.analyzeText(text(request))));
        server.createContext("/api/nbest", exchange -> handleAnalysis(exchange,
                request -> service.analyzeNBest(text(request),
                        request.has("n") ? request.get("n").getAsInt() : service.nBestLimit())));
        server.createContext("/api/morphs", exchange -> handleAnalysis(exchange,
                request -> service.analyzeAllMorphs(text(request))));
        server.start();
        log.log(Level.FINE, () -> "Listening on port " + server.getAddress().getPort());
        return server;
    }

    /** Computes the response payload of one analysis endpoint. */
    @FunctionalInterface
    private interface Analysis {
        JsonObject apply(JsonObject request);
    }

    private void handleRoot(HttpExchange exchange) throws IOException {
        try {
            String method = exchange.getRequestMethod().toUpperCase(Locale.ROOT);
            if (!method.equals("GET") && !method.equals("POST")) {
                rejectMethod(exchange, "GET, POST");
            } else if (!"/".equals(exchange.getRequestURI().getPath())) {
                respondError(exchange, 404, "Not Found: " + exchange.getRequestURI().getPath());
            } else {
                JsonObject version = new JsonObject();
                version.addProperty("morphan_version", service.getVersion());
                respond(exchange, 200, version);
            }
        } finally {
            exchange.close();
        }
    }

    private void handleAnalysis(HttpExchange exchange, Analysis analysis) throws IOException {
        try {
            if (!"POST".equals(exchange.getRequestMethod().toUpperCase(Locale.ROOT))) {
                rejectMethod(exchange, "POST");
                return;
            }
            JsonObject request = readRequest(exchange);
            if (request == null || !request.has("text")) {
                respondError(exchange, 403, "request data doesn`t have `text` field");
                return;
            }
            respond(exchange, 200, analysis.apply(request));
        } catch (InvalidInputException ex) {
            respondError(exchange, 400, ex.getMessage());
        } catch (JsonParseException | IllegalStateException | UnsupportedOperationException
                | NumberFormatException ex) {
            respondError(exchange, 400, "Malformed request: " + ex.getMessage());
        } catch (MorphologyException ex) {
            log.log(Level.WARNING, "Analysis failed", ex);
            respondError(exchange, 500, ex.getMessage());
        } finally {
            exchange.close();
        }
    }

    private static String text(JsonObject request) {
        return request.get("text").getAsString();
    }

    /**
     * @return the request body as a JSON object, or {@code null} when it is empty or not an object
     */
    private static JsonObject readRequest(HttpExchange exchange) throws IOException {
        byte[] body = exchange.getRequestBody().readAllBytes();
        if (body.length == 0) {
            return null;
        }
        try (Reader reader = new InputStreamReader(new ByteArrayInputStream(body), StandardCharsets.UTF_8)) {
            JsonElement element = JsonParser.parseReader(reader);
            return element.isJsonObject() ? element.getAsJsonObject() : null;
        }
    }

    private void respond(HttpExchange exchange, int status, JsonElement payload) throws IOException {
        String json = gson.toJson(payload);
        String callback = queryParameters(exchange.getRequestURI().getRawQuery()).get(CALLBACK_PARAM);
        boolean jsonp = callback != null && !callback.isEmpty();
        byte[] bytes = (jsonp ? callback + "(" + json + ")" : json).getBytes(StandardCharsets.UTF_8);
        exchange.getResponseHeaders().set("Content-Type", jsonp ? JAVASCRIPT : JSON);
        exchange.sendResponseHeaders(status, bytes.length);
        try (OutputStream out = exchange.getResponseBody()) {
            out.write(bytes);
        }
    }

    private void respondError(HttpExchange exchange, int status, String message) throws IOException {
        JsonObject error = new JsonObject();
        error.addProperty("status", status);
        error.addProperty("message", message);
        respond(exchange, status, error);
    }

    private void rejectMethod(HttpExchange exchange, String allowed) throws IOException {
        exchange.getResponseHeaders().set("Allow", allowed);
        respondError(exchange, 405, "Method Not Allowed");
    }

    private static Map<String, String> queryParameters(String rawQuery) {
        Map<String, String> parameters = new HashMap<>();
        if (rawQuery == null || rawQuery.isEmpty()) {
            return parameters;
        }
        for (String pair : rawQuery.split("&")) {
            int separator = pair.indexOf('=');
            if (separator > 0) {
                parameters.put(URLDecoder.decode(pair.substring(0, separator), StandardCharsets.UTF_8),
                        URLDecoder.decode(pair.substring(separator + 1), StandardCharsets.UTF_8));
            }
        }
        return parameters;
    }
}
