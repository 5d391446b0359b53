package com.spiderstream.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

@Configuration
public class SpiderConfig {

    @Bean(name = "sessionExecutor", destroyMethod = "shutdownNow")
    public ExecutorService sessionExecutor() {
        return Executors.newCachedThreadPool();
    }

    @Bean(name = "derivationExecutor", destroyMethod = "shutdown")
    public ExecutorService derivationExecutor(SpiderProperties properties) {
        int size = Math.max(2, properties.getLimit().getParallelism());
        return Executors.newFixedThreadPool(size);
    }

    @Bean(name = "httpExecutor", destroyMethod = "shutdown")
    public ExecutorService httpExecutor(SpiderProperties properties) {
        int size = Math.max(4, properties.getHttp().getGlobalConcurrency() * 2);
        return Executors.newFixedThreadPool(size);
    }

    @Bean
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.disable(SerializationFeature.FAIL_ON_EMPTY_BEANS);
        return mapper;
    }
}
