package io.storylink.server;

/**
 * Server configuration parsed from CLI args.
 *
 * Supports:
 *  - httpPort:       external HTTP API port
 *  - dataDir:        root directory; each story keeps its write-ahead log in dataDir/{storyId}
 *  - inMemory:       keep every story in memory only (nothing survives a restart)
 *  - walRotateBytes: size at which a log segment is closed and a new one started
 */
public record ServerConfig(
        int httpPort,
        String dataDir,
        boolean inMemory,
        long walRotateBytes
) {

    public ServerConfig {
        if (httpPort < 0 || httpPort > 65535) {
            throw new IllegalArgumentException("httpPort out of range: " + httpPort);
        }
        if (walRotateBytes <= 0) {
            throw new IllegalArgumentException("walRotateBytes must be > 0");
        }
    }

    /**
     * Very small CLI parser.
     *
     * Supported flags:
     *   --http-port, -p   <port>
     *   --data-dir,  -d   <path>
     *   --in-memory
     *   --wal-rotate-bytes <bytes>
     *   --help,      -h
     *
     * All flags are optional; defaults are reasonable for local dev.
     */
    public static ServerConfig fromArgs(String[] args) {
        // Defaults
        int httpPort = 8080;
        String dataDir = "./data/stories";
        boolean inMemory = false;
        long walRotateBytes = 64L * 1024 * 1024; // rotate ~64MB

        for (int i = 0; i < args.length; i++) {
            switch (args[i]) {
                case "--help", "-h" -> printHelpAndExit();

                case "--http-port", "-p" -> {
                    ensureValue(args, i);
                    try {
                        httpPort = Integer.parseInt(args[++i]);
                    } catch (NumberFormatException e) {
                        System.err.println("Invalid http-port: " + args[i]);
                        System.exit(1);
                    }
                }

                case "--data-dir", "-d" -> {
                    ensureValue(args, i);
                    dataDir = args[++i];
                }

                case "--in-memory" -> inMemory = true;

                case "--wal-rotate-bytes" -> {
                    ensureValue(args, i);
                    try {
                        walRotateBytes = Long.parseLong(args[++i]);
                    } catch (NumberFormatException e) {
                        System.err.println("Invalid wal-rotate-bytes: " + args[i]);
                        System.exit(1);
                    }
                }

                default -> {
                    System.err.println("Unknown option: " + args[i]);
                    printHelpAndExit();
                }
            }
        }
        return new ServerConfig(httpPort, dataDir, inMemory, walRotateBytes);
    }

    private static void ensureValue(String[] args, int i) {
        if (i + 1 >= args.length) {
            System.err.println("Missing value for option: " + args[i]);
            System.exit(1);
        }
    }

    private static void printHelpAndExit() {
        System.out.println("""
            Usage: server [options]

            Options:
              --http-port,      -p   HTTP port (default: 8080)
              --data-dir,       -d   Root directory for story logs (default: ./data/stories)
              --in-memory            Keep stories in memory only
              --wal-rotate-bytes     Log segment size before rotation (default: 67108864)
              --help,           -h   Show this help message
            """);
        System.exit(0);
    }
}
