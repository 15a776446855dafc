package org.probenet.server.spring.config;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import io.vertx.core.Vertx;
import io.vertx.core.VertxOptions;
import io.vertx.core.http.HttpClientOptions;
import org.probenet.server.execution.timeout.TimeoutFactory;
import org.probenet.server.json.JacksonMapper;
import org.probenet.server.json.ObjectMapperProvider;
import org.probenet.server.metric.Metrics;
import org.probenet.server.vertx.httpclient.BasicHttpClient;
import org.probenet.server.vertx.httpclient.HttpClient;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
public class ApplicationConfiguration {

    @Bean
    Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    TimeoutFactory timeoutFactory(Clock clock) {
        return new TimeoutFactory(clock);
    }

    @Bean
    JacksonMapper jacksonMapper() {
        return new JacksonMapper(ObjectMapperProvider.mapper());
    }

    @Bean
    @ConditionalOnMissingBean
    MeterRegistry meterRegistry() {
        return new SimpleMeterRegistry();
    }

    @Bean
    Metrics metrics(MeterRegistry meterRegistry) {
        return new Metrics(meterRegistry);
    }

    @Bean(destroyMethod = "close")
    Vertx vertx(@Value("${vertx.worker-pool-size:20}") int workerPoolSize) {
        return Vertx.vertx(new VertxOptions().setWorkerPoolSize(workerPoolSize));
    }

    @Bean
    HttpClient httpClient(Vertx vertx,
                          @Value("${http-client.max-pool-size:100}") int maxPoolSize,
                          @Value("${http-client.connect-timeout-ms:1000}") int connectTimeoutMs) {

        final HttpClientOptions options = new HttpClientOptions()
                .setMaxPoolSize(maxPoolSize)
                .setConnectTimeout(connectTimeoutMs)
                .setKeepAlive(true);

        return new BasicHttpClient(vertx, vertx.createHttpClient(options));
    }
}
