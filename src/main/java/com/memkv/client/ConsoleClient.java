package com.memkv.client;

import com.memkv.util.Logger;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.PrintStream;

public class ConsoleClient {
    private final KvClient client;
    private final BufferedReader input;
    private final PrintStream output;
    private final Logger logger;

    public ConsoleClient(KvClient client, BufferedReader input, PrintStream output, String address) {
        this.client = client;
        this.input = input;
        this.output = output;
        this.logger = new Logger(ConsoleClient.class, address);
    }

    public void run() throws IOException {
        while (true) {
            output.print("> ");
            output.flush();

            String line = input.readLine();
            if (line == null) {
                output.println();
                logger.info("Disconnecting");
                return;
            }
            if (line.isBlank()) {
                continue;
            }

            output.println("< " + client.send(line));
        }
    }
}
