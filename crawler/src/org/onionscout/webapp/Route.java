package org.onionscout.webapp;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.exc.UnrecognizedPropertyException;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.OutputStream;
import java.lang.annotation.Annotation;
import java.lang.annotation.Retention;
import java.lang.annotation.Target;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.util.*;
import java.util.zip.GZIPOutputStream;

import static java.lang.annotation.ElementType.METHOD;
import static java.lang.annotation.ElementType.TYPE;
import static java.lang.annotation.RetentionPolicy.RUNTIME;
import static java.nio.charset.StandardCharsets.UTF_8;

/**
 * Dispatches requests for one path to the controller method annotated for the request's HTTP method. Parameters
 * are bound from the query string for GET and from a JSON body for POST and PUT. Exceptions thrown by the method
 * become error responses, with the status taken from an {@link HttpError} annotation on the exception class.
 */
public class Route implements HttpHandler {
    private static final Logger log = LoggerFactory.getLogger(Route.class);
    private final Object controller;
    final Map<String, Method> methods = new HashMap<>();

    public Route(Object controller) {
        this.controller = controller;
    }

    static Map<String, Route> buildMap(Object controller) {
        var routes = new HashMap<String, Route>();
        for (var method : controller.getClass().getDeclaredMethods()) {
            for (var annotation : method.getDeclaredAnnotations()) {
                String path = pathOf(annotation);
                if (path == null) continue;
                Route route = routes.computeIfAbsent(path, k -> new Route(controller));
                route.methods.put(annotation.annotationType().getSimpleName(), method);
            }
        }
        log.debug("Routes: {}", routes.keySet());
        return routes;
    }

    private static String pathOf(Annotation annotation) {
        if (annotation instanceof GET get) return get.value();
        if (annotation instanceof POST post) return post.value();
        if (annotation instanceof PUT put) return put.value();
        return null;
    }

    @Override
    public void handle(HttpExchange exchange) throws IOException {
        Method method = methods.get(exchange.getRequestMethod());
        if (method == null) {
            exchange.getResponseHeaders().add("Allow", String.join(", ", new TreeSet<>(methods.keySet())));
            exchange.sendResponseHeaders(405, -1);
            return;
        }
        var args = new ArrayList<>();
        for (var type : method.getParameterTypes()) {
            if (type == HttpExchange.class) {
                args.add(exchange);
                continue;
            }
            try {
                String requestMethod = exchange.getRequestMethod();
                if (requestMethod.equals("POST") || requestMethod.equals("PUT")) {
                    String contentType = exchange.getRequestHeaders().getFirst("Content-Type");
                    if (contentType == null || contentType.replaceFirst("\\s*;.*", "")
                            .equals("application/json")) {
                        args.add(Webapp.JSON.readerFor(type).readValue(exchange.getRequestBody()));
                    } else {
                        exchange.getResponseHeaders().set("Accept", "application/json");
                        exchange.sendResponseHeaders(415, -1);
                        return;
                    }
                } else {
                    args.add(QueryMapper.parse(exchange.getRequestURI().getRawQuery(), type));
                }
            } catch (UnrecognizedPropertyException e) {
                sendText(exchange, 400, "Unknown parameter: " + e.getPropertyName() + "\n" +
                                        "Known parameters: " + e.getKnownPropertyIds());
                return;
            } catch (JsonProcessingException e) {
                sendText(exchange, 400, "Invalid request: " + e.getOriginalMessage());
                return;
            }
        }
        Object result;
        try {
            result = method.invoke(controller, args.toArray());
        } catch (InvocationTargetException e) {
            var cause = e.getCause();
            if (cause instanceof IOException && "Broken pipe".equals(cause.getMessage())) {
                return; // client closed the connection
            }
            sendError(exchange, method, cause);
            return;
        } catch (IllegalAccessException e) {
            throw new RuntimeException(e);
        }
        if (result != null) {
            exchange.getResponseHeaders().set("Content-Type", "application/json");
            try (var bodyStream = encodeResponse(exchange, 200, 0)) {
                Webapp.JSON.writeValue(bodyStream, result);
            }
        } else {
            try {
                exchange.sendResponseHeaders(200, -1);
            } catch (IOException e) {
                if (e.getMessage() == null || !e.getMessage().contains("headers already sent")) {
                    throw e;
                }
            }
        }
    }

    private static void sendError(HttpExchange exchange, Method method, Throwable cause) throws IOException {
        int status = 500;
        var errorAnnotation = cause.getClass().getAnnotation(HttpError.class);
        if (errorAnnotation != null) {
            status = errorAnnotation.value();
        } else if (cause instanceof IllegalArgumentException) {
            status = 400;
        }
        if (status >= 500) {
            log.error("Error invoking " + method, cause);
        }
        String message = cause.getMessage() == null ? cause.getClass().getSimpleName() : cause.getMessage();
        sendText(exchange, status, message);
    }

    static void sendText(HttpExchange exchange, int status, String text) throws IOException {
        byte[] body = (text + "\n").getBytes(UTF_8);
        exchange.getResponseHeaders().set("Content-Type", "text/plain; charset=utf-8");
        exchange.sendResponseHeaders(status, body.length);
        exchange.getResponseBody().write(body);
    }

    public static OutputStream encodeResponse(HttpExchange exchange, int status, long length) throws IOException {
        String contentType = exchange.getResponseHeaders().getFirst("Content-Type");
        if (length != -1 && getAcceptedEncodings(exchange).contains("gzip") && contentType != null) {
            exchange.getResponseHeaders().add("Content-Encoding", "gzip");
            exchange.sendResponseHeaders(status, 0);
            return new GZIPOutputStream(exchange.getResponseBody());
        } else {
            exchange.sendResponseHeaders(status, length);
            return exchange.getResponseBody();
        }
    }

    private static Set<String> getAcceptedEncodings(HttpExchange exchange) {
        var header = exchange.getRequestHeaders().getFirst("Accept-Encoding");
        if (header == null) return Set.of();
        return Set.of(header.split("\\s*,\\s*"));
    }

    @Target(METHOD)
    @Retention(RUNTIME)
    public @interface GET {
        String value();
    }

    @Target(METHOD)
    @Retention(RUNTIME)
    public @interface POST {
        String value();
    }

    @Target(METHOD)
    @Retention(RUNTIME)
    public @interface PUT {
        String value();
    }

    @Target(TYPE)
    @Retention(RUNTIME)
    public @interface HttpError {
        int value();
    }
}
