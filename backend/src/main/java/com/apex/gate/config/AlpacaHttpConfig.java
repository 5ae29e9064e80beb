package com.apex.gate.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestTemplate;

@Configuration
public class AlpacaHttpConfig {

    @Bean
    public RestTemplate alpacaRestTemplate(AlpacaProperties alpacaProperties) {
        return restTemplate(alpacaProperties.getHttp());
    }

    public static RestTemplate restTemplate(AlpacaProperties.Http http) {
        SimpleClientHttpRequestFactory factory = new SimpleClientHttpRequestFactory();
        factory.setConnectTimeout(http.getConnectTimeoutMs());
        factory.setReadTimeout(http.getReadTimeoutMs());
        return new RestTemplate(factory);
    }
}
