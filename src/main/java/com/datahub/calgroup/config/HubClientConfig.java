package com.datahub.calgroup.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;
import org.springframework.web.client.RestTemplate;

import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;

@Configuration
public class HubClientConfig {

    private static final Logger logger = LoggerFactory.getLogger(HubClientConfig.class);

    @Bean
    @Qualifier("hubRestTemplate")
    public RestTemplate hubRestTemplate(RestTemplateBuilder builder,
                                        @Value("${calgroup.hub.request-timeout-seconds:60}") long timeoutSeconds) {
        // GET /users may be slow with thousands of users and no server side filtering,
        // so the read timeout is generous.
        logger.info("Initializing hubRestTemplate with {}s timeouts", timeoutSeconds);
        return builder
                .setConnectTimeout(Duration.ofSeconds(timeoutSeconds))
                .setReadTimeout(Duration.ofSeconds(timeoutSeconds))
                .additionalInterceptors((request, body, execution) -> {
                    logger.debug("Making hub API request: {} {}", request.getMethod(), request.getURI());
                    var response = execution.execute(request, body);
                    logger.debug("Hub API response status: {}", response.getStatusCode());
                    return response;
                })
                .build();
    }

    @Bean
    @Qualifier("grouperRestTemplate")
    public RestTemplate grouperRestTemplate(RestTemplateBuilder builder,
                                            @Value("${calgroup.grouper.request-timeout-seconds:60}") long timeoutSeconds) {
        logger.info("Initializing grouperRestTemplate with {}s timeouts", timeoutSeconds);
        return builder
                .setConnectTimeout(Duration.ofSeconds(timeoutSeconds))
                .setReadTimeout(Duration.ofSeconds(timeoutSeconds))
                .build();
    }

    @Bean(destroyMethod = "shutdown")
    @Qualifier("hubFetchExecutor")
    public ExecutorService hubFetchExecutor(@Value("${calgroup.hub.concurrency:10}") int concurrency) {
        CustomizableThreadFactory threadFactory = new CustomizableThreadFactory("hub-fetch-");
        if (concurrency <= 0) {
            return Executors.newCachedThreadPool(threadFactory);
        }
        // one thread per fetch slot; requests beyond that wait in the fetcher's queue
        ThreadPoolExecutor pool = new ThreadPoolExecutor(concurrency, concurrency, 60L, TimeUnit.SECONDS,
                new LinkedBlockingQueue<>(), threadFactory);
        pool.allowCoreThreadTimeOut(true);
        logger.info("Initializing hubFetchExecutor with {} threads", concurrency);
        return pool;
    }
}
