package guraa.pdfdiff;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.event.ContextClosedEvent;
import org.springframework.context.event.EventListener;

import java.time.Duration;
import java.time.Instant;

/**
 * Main application class for the PDF diff engine.
 */
@Slf4j
@SpringBootApplication
public class PDFDiffApplication {

    public static void main(String[] args) {
        Instant startTime = Instant.now();

        System.getProperties().putIfAbsent("java.awt.headless", "true");

        SpringApplication.run(PDFDiffApplication.class, args);

        Duration startupTime = Duration.between(startTime, Instant.now());
        log.info("==========================================================");
        log.info("PDF Diff started in {} ms", startupTime.toMillis());
        log.info("  Java: {}", System.getProperty("java.version"));
        log.info("  Available processors: {}", Runtime.getRuntime().availableProcessors());
        log.info("==========================================================");
    }

    /**
     * Event listener for application shutdown.
     *
     * @param event The context closed event
     */
    @EventListener
    public void onApplicationEvent(ContextClosedEvent event) {
        log.info("Application is shutting down");
    }
}
