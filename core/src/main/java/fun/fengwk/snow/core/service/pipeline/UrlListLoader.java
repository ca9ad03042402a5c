package fun.fengwk.snow.core.service.pipeline;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.FileSystemResource;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Reads the newline delimited url list, one url per non-blank line.
 *
 * @author fengwk
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class UrlListLoader {

    private final ResourceLoader resourceLoader;

    /**
     * @throws IllegalStateException when the list cannot be found or read
     */
    public List<String> load(String location) {
        if (!StringUtils.hasText(location)) {
            throw new IllegalStateException("url list location is blank");
        }
        Resource resource = resolve(location.trim());
        if (!resource.exists()) {
            throw new IllegalStateException("url list not found: " + location);
        }

        try (BufferedReader reader = new BufferedReader(
            new InputStreamReader(resource.getInputStream(), StandardCharsets.UTF_8))) {
            List<String> urls = reader.lines()
                .map(String::trim)
                .filter(line -> !line.isEmpty())
                .collect(Collectors.toList());
            log.info("loaded url list, location={}, urls={}", location, urls.size());
            return urls;
        } catch (IOException ex) {
            throw new IllegalStateException("failed to read url list: " + location, ex);
        }
    }

    private Resource resolve(String location) {
        // A bare path is a file relative to the working directory, not a classpath entry.
        if (!location.contains(":") || location.matches("^[a-zA-Z]:[\\\\/].*")) {
            return new FileSystemResource(location);
        }
        return resourceLoader.getResource(location);
    }

}
