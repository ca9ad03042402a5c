package fun.fengwk.snow.core.service.pipeline;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.core.io.DefaultResourceLoader;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * @author fengwk
 */
public class UrlListLoaderTest {

    @TempDir
    Path tempDir;

    private final UrlListLoader loader = new UrlListLoader(new DefaultResourceLoader());

    @Test
    public void shouldReadTrimmedNonBlankLines() throws Exception {
        Path file = tempDir.resolve("urls.txt");
        Files.writeString(file, "https://s/a\n\n   \n  https://s/b  \r\nhttps://s/a\n");

        List<String> urls = loader.load("file:" + file.toAbsolutePath());

        assertThat(urls).containsExactly("https://s/a", "https://s/b", "https://s/a");
    }

    @Test
    public void shouldAcceptPlainFilePath() throws Exception {
        Path file = tempDir.resolve("USACANADA.txt");
        Files.writeString(file, "https://s/a");

        assertThat(loader.load(file.toAbsolutePath().toString())).containsExactly("https://s/a");
    }

    @Test
    public void shouldReadClasspathResource() {
        assertThat(loader.load("classpath:fixtures/urls.txt"))
            .containsExactly("https://www.onthesnow.com/colorado/vail/skireport",
                "https://www.onthesnow.com/british-columbia/whistler-blackcomb/skireport");
    }

    @Test
    public void shouldReturnEmptyListForEmptyFile() throws Exception {
        Path file = tempDir.resolve("empty.txt");
        Files.writeString(file, "\n\n");

        assertThat(loader.load(file.toAbsolutePath().toString())).isEmpty();
    }

    @Test
    public void shouldFailWhenListMissing() {
        String location = tempDir.resolve("missing.txt").toAbsolutePath().toString();

        assertThatThrownBy(() -> loader.load(location))
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("url list not found");
        assertThatThrownBy(() -> loader.load(" "))
            .isInstanceOf(IllegalStateException.class);
    }

}
