package fun.fengwk.snow.cli.crawl;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * @author fengwk
 */
@SpringBootApplication(scanBasePackages = "fun.fengwk.snow")
public class CliCrawlApplication {

    public static void main(String[] args) {
        SpringApplication.run(CliCrawlApplication.class, args);
    }

}
