package fun.fengwk.snow.core;

import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * @author fengwk
 */
@SpringBootApplication
public class CoreTestApplication {
}
