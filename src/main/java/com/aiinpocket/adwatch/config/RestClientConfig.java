package com.aiinpocket.adwatch.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestClient;

/**
 * REST 客戶端配置。
 *
 * <ul>
 *   <li>{@code searchRestClient}：Blocket 搜尋 API 專用（預設 baseUrl 和 header）</li>
 *   <li>{@code restClient}：通用 RestClient（Discord Webhook 等外部呼叫）</li>
 * </ul>
 */
@Configuration
public class RestClientConfig {

    @Bean
    public RestClient searchRestClient(AdWatchProperties props) {
        return RestClient.builder()
                .baseUrl(props.search().baseUrl())
                .defaultHeader("Accept", "application/json")
                .build();
    }

    @Bean
    public RestClient restClient() {
        return RestClient.builder().build();
    }
}
