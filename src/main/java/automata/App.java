package automata;

import automata.engine.config.Dependencies;
import automata.engine.config.EngineConfig;
import automata.engine.integration.Collaborators;
import automata.engine.integration.HttpWebScraper;
import automata.engine.integration.LoggingEmailSender;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.util.concurrent.CountDownLatch;

/**
 * Standalone entry point: starts the scheduler worker and runs until the JVM is asked to stop.
 * <p>
 * Configuration comes from the INI file given as the first argument, or from
 * {@code AUTOMATA_*} environment variables.
 */
public class App {

    private static final Logger log = LoggerFactory.getLogger(App.class);

    public static void main(String[] args) throws IOException, InterruptedException {
        EngineConfig config = args.length > 0
                ? EngineConfig.fromIni(new File(args[0]))
                : EngineConfig.fromEnv();

        Collaborators collaborators = Collaborators.builder()
                .emailSender(new LoggingEmailSender())
                .webScraper(new HttpWebScraper(config.webhookTimeout(), config.scrapeContentLimit()))
                .build();

        Dependencies deps = Dependencies.create(config, collaborators);
        CountDownLatch stopped = new CountDownLatch(1);

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            log.info("Shutdown requested");
            deps.close();
            stopped.countDown();
        }, "automata-shutdown"));

        deps.worker().cleanup();
        deps.startWorker();

        log.info("Automata engine running (worker {})", config.workerId());
        stopped.await();
    }
}
