package fun.fengwk.snow.core.scheduler;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * @author fengwk
 */
@Configuration
@EnableScheduling
@ConditionalOnProperty(prefix = "snow.schedule", name = "enabled", havingValue = "true")
public class SchedulingConfiguration {
}
