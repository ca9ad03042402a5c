package fun.fengwk.snow.core.configuration;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.net.InetSocketAddress;
import java.net.ProxySelector;
import java.net.URI;

/**
 * Proxy configuration for the shared HttpClient.
 *
 * @author fengwk
 */
@Data
@Component
@ConfigurationProperties(prefix = "snow.http.proxy")
public class HttpClientProxyProperties {

    /**
     * Proxy in URL form, e.g. http://host:port or host:port. Blank means direct connection.
     */
    private String httpProxy;

    /**
     * Connect timeout in milliseconds.
     */
    private int connectTimeoutMs = 15000;

    /**
     * Build a proxy selector from {@link #httpProxy}, or null when no proxy is configured.
     */
    public ProxySelector resolveProxySelector() {
        if (!StringUtils.hasText(httpProxy)) {
            return null;
        }
        try {
            String uriStr = httpProxy.trim();
            if (!uriStr.contains("://")) {
                uriStr = "http://" + uriStr;
            }
            URI uri = new URI(uriStr);
            String host = uri.getHost();
            int port = uri.getPort();
            if (host == null) {
                throw new IllegalArgumentException("missing proxy host");
            }
            if (port == -1) {
                port = 80;
            }
            return ProxySelector.of(new InetSocketAddress(host, port));
        } catch (Exception ex) {
            throw new IllegalArgumentException("invalid proxy: " + httpProxy, ex);
        }
    }

}
