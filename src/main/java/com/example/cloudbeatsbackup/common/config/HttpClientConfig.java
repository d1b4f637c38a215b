package com.example.cloudbeatsbackup.common.config;

import org.apache.http.client.config.RequestConfig;
import org.apache.http.impl.client.CloseableHttpClient;
import org.apache.http.impl.client.HttpClients;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class HttpClientConfig {

    /**
     * Shared transport for every Dropbox call of a run; closed with the context.
     */
    @Bean(destroyMethod = "close")
    public CloseableHttpClient dropboxHttpClient(AppDropboxProperties properties) {
        RequestConfig requestConfig = RequestConfig.custom()
                .setConnectTimeout(properties.getConnectTimeoutMs())
                .setConnectionRequestTimeout(properties.getConnectTimeoutMs())
                .setSocketTimeout(properties.getSocketTimeoutMs())
                .build();
        return HttpClients.custom()
                .setDefaultRequestConfig(requestConfig)
                .useSystemProperties()
                .build();
    }
}
