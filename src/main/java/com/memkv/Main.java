package com.memkv;

import com.memkv.client.ConsoleClient;
import com.memkv.client.KvClient;
import com.memkv.config.Config;
import com.memkv.server.KvServer;
import com.memkv.util.Logger;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.Callable;

@Command(name = "memkv",
         mixinStandardHelpOptions = true,
         version = "memkv 1.0.0",
         description = "In-memory key-value store over a line-based TCP protocol")
public class Main implements Callable<Integer> {
    private static final Logger logger = new Logger(Main.class, "main");

    @Option(names = "--mode",
            description = "either 'server' or 'client'")
    String mode;

    @Option(names = "--address",
            description = "host and port to listen for connections (server mode) or to connect to (client mode)",
            defaultValue = Config.DEFAULT_ADDRESS)
    String address;

    @Option(names = "--max-connections",
            description = "maximum concurrent client connections in server mode, 0 for no limit",
            defaultValue = "0")
    int maxConnections;

    public static void main(String[] args) {
        int exitCode = new CommandLine(new Main()).execute(args);
        System.exit(exitCode);
    }

    @Override
    public Integer call() throws IOException {
        String selected = mode == null ? "" : mode;
        switch (selected) {
            case "server":
                return runServer(Config.of(address, maxConnections));
            case "client":
                return runClient(Config.of(address, maxConnections));
            default:
                logger.warn("unknown mode '{}', valid values are: 'server', 'client'", selected);
                return 0;
        }
    }

    private int runServer(Config config) throws IOException {
        logger.info("Listening {}", config.getAddress());
        KvServer server = new KvServer(config);
        server.start();
        Runtime.getRuntime().addShutdownHook(new Thread(server::stop, "memkv-shutdown"));

        try {
            server.serve();
        } catch (IOException e) {
            logger.error("Accepting connections failed, shutting down", e);
            server.stop();
            return 1;
        }
        return 0;
    }

    private int runClient(Config config) throws IOException {
        logger.info("Connecting to {}", config.getAddress());
        try (KvClient client = KvClient.connect(config.getHost(), config.getPort())) {
            BufferedReader stdin = new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8));
            new ConsoleClient(client, stdin, System.out, config.getAddress()).run();
        }
        return 0;
    }
}
