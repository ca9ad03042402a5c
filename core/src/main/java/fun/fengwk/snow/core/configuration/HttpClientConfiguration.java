package fun.fengwk.snow.core.configuration;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.net.ProxySelector;
import java.net.http.HttpClient;
import java.time.Duration;

/**
 * Process-wide HttpClient shared by the completion and store clients.
 *
 * @author fengwk
 */
@Slf4j
@Configuration
public class HttpClientConfiguration {

    @Bean
    public HttpClient snowHttpClient(HttpClientProxyProperties proxyProperties) {
        HttpClient.Builder builder = HttpClient.newBuilder()
            .followRedirects(HttpClient.Redirect.NORMAL)
            .connectTimeout(Duration.ofMillis(Math.max(1, proxyProperties.getConnectTimeoutMs())));
        ProxySelector proxySelector = proxyProperties.resolveProxySelector();
        if (proxySelector != null) {
            builder.proxy(proxySelector);
            log.info("http proxy configured: {}", proxyProperties.getHttpProxy());
        }
        return builder.build();
    }

}
