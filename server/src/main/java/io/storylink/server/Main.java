package io.storylink.server;

import io.storylink.storage.FilePageStore;
import io.storylink.storage.InMemoryPageStore;
import io.storylink.storage.PageStore;

import java.nio.file.Path;
import java.util.function.Function;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Entry point for a link server.
 *
 * Responsibilities:
 *  - Parse configuration from CLI.
 *  - Pick the page store per story (in memory, or a write-ahead log under the data dir).
 *  - Create the LinkService and WebServer.
 *  - Close every link and store on shutdown.
 */
public final class Main {
    private static final Logger log = Logger.getLogger(Main.class.getName());

    private Main() {
        // no-op
    }

    public static void main(String[] args) {
        var cfg = ServerConfig.fromArgs(args);

        // ------ Storage Layer -------
        Function<String, PageStore> stores = storeFactory(cfg);
        var service = new LinkService(stores);

        // ------ HTTP layer ------
        var web = new WebServer(cfg.httpPort(), service);
        web.start();

        System.out.printf(
                "Link server listening on http://%s:%d (%s)%n",
                "localhost", cfg.httpPort(),
                cfg.inMemory() ? "in memory" : "data in " + Path.of(cfg.dataDir()).toAbsolutePath()
        );

        // Shutdown hook
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            try {
                web.stop();
            } finally {
                service.close();
                log.log(Level.INFO, "link server stopped");
            }
        }));
    }

    static Function<String, PageStore> storeFactory(ServerConfig cfg) {
        if (cfg.inMemory()) {
            return storyId -> new InMemoryPageStore();
        }
        Path root = Path.of(cfg.dataDir());
        return storyId -> new FilePageStore(root.resolve(storyId), cfg.walRotateBytes());
    }
}
