package org.probenet.server.vertx.httpclient;

import io.vertx.core.Future;
import io.vertx.core.MultiMap;
import io.vertx.core.Promise;
import io.vertx.core.Vertx;
import io.vertx.core.http.HttpClientRequest;
import io.vertx.core.http.HttpMethod;
import io.vertx.core.http.RequestOptions;
import org.probenet.server.vertx.httpclient.model.HttpClientResponse;

import java.util.Objects;
import java.util.concurrent.TimeoutException;

/**
 * Simple wrapper around {@link io.vertx.core.http.HttpClient} bounding every request by the given timeout.
 * <p>
 * The timeout limits the whole exchange: a timer resets the request when the response body has not been
 * received in time, even if the server keeps sending data.
 */
public class BasicHttpClient implements HttpClient {

    private final Vertx vertx;
    private final io.vertx.core.http.HttpClient httpClient;

    public BasicHttpClient(Vertx vertx, io.vertx.core.http.HttpClient httpClient) {
        this.vertx = Objects.requireNonNull(vertx);
        this.httpClient = Objects.requireNonNull(httpClient);
    }

    @Override
    public Future<HttpClientResponse> request(HttpMethod method,
                                              String url,
                                              MultiMap headers,
                                              String body,
                                              long timeoutMs) {

        if (timeoutMs <= 0) {
            return Future.failedFuture(new TimeoutException("Timeout has been exceeded"));
        }

        final RequestOptions options;
        try {
            options = makeRequestOptions(method, url, headers, timeoutMs);
        } catch (Exception e) {
            return Future.failedFuture(e);
        }

        final Promise<HttpClientResponse> promise = Promise.promise();
        final long timerId = vertx.setTimer(timeoutMs, ignored -> promise.tryFail(
                new TimeoutException("Timeout period of %dms has been exceeded".formatted(timeoutMs))));

        httpClient.request(options)
                .compose(request -> {
                    promise.future().onFailure(error -> request.reset(0, error));
                    return send(request, body);
                })
                .compose(response -> response.body()
                        .map(buffer -> HttpClientResponse.of(
                                response.statusCode(),
                                response.headers(),
                                buffer.toString())))
                .onComplete(result -> {
                    vertx.cancelTimer(timerId);
                    if (result.succeeded()) {
                        promise.tryComplete(result.result());
                    } else {
                        promise.tryFail(result.cause());
                    }
                });

        return promise.future();
    }

    private static RequestOptions makeRequestOptions(HttpMethod method,
                                                     String url,
                                                     MultiMap headers,
                                                     long timeoutMs) {

        final RequestOptions options = new RequestOptions()
                .setMethod(method)
                .setAbsoluteURI(url)
                .setConnectTimeout(timeoutMs)
                .setIdleTimeout(timeoutMs);

        if (headers != null) {
            options.setHeaders(headers);
        }

        return options;
    }

    private static Future<io.vertx.core.http.HttpClientResponse> send(HttpClientRequest request, String body) {
        return body != null ? request.send(body) : request.send();
    }
}
