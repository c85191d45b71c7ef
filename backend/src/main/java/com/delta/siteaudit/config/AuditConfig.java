package com.delta.siteaudit.config;

import com.delta.siteaudit.access.AccessPolicy;
import com.delta.siteaudit.crawl.http.AddressPolicy;
import com.delta.siteaudit.crawl.http.HostResolver;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.net.InetAddress;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

@Configuration
public class AuditConfig {

    @Bean(name = "fetchExecutor", destroyMethod = "shutdownNow")
    public ExecutorService fetchExecutor(CrawlerProperties properties) {
        return Executors.newFixedThreadPool(properties.getFetchConcurrency());
    }

    @Bean
    public HostResolver hostResolver() {
        return InetAddress::getAllByName;
    }

    @Bean
    public AddressPolicy addressPolicy() {
        return AddressPolicy.publicOnly();
    }

    @Bean
    public AccessPolicy accessPolicy() {
        return AccessPolicy.defaults();
    }

    @Bean
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        mapper.setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE);
        return mapper;
    }
}
