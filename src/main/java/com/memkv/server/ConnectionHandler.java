package com.memkv.server;

import com.memkv.protocol.MalformedRequestException;
import com.memkv.protocol.Request;
import com.memkv.protocol.WireCodec;
import com.memkv.storage.LookupResult;
import com.memkv.storage.StorageEngine;
import com.memkv.storage.StorageUnavailableException;
import com.memkv.util.Logger;

import java.io.BufferedInputStream;
import java.io.BufferedOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.Socket;

public class ConnectionHandler implements Runnable {
    private final Socket socket;
    private final StorageEngine engine;
    private final long maxValueLength;
    private final Runnable onClose;
    private final Logger logger;

    public ConnectionHandler(Socket socket, StorageEngine engine, long maxValueLength, Runnable onClose) {
        this.socket = socket;
        this.engine = engine;
        this.maxValueLength = maxValueLength;
        this.onClose = onClose;
        this.logger = new Logger(ConnectionHandler.class, String.valueOf(socket.getRemoteSocketAddress()));
    }

    @Override
    public void run() {
        logger.info("Serving connection");
        try (Socket s = socket) {
            serve(new BufferedInputStream(s.getInputStream()), new BufferedOutputStream(s.getOutputStream()));
            logger.info("Disconnecting");
        } catch (IOException e) {
            logger.warn("Disconnecting due to error: {}", e.getMessage());
        } catch (StorageUnavailableException e) {
            logger.warn("Disconnecting, storage unavailable: {}", e.getMessage());
        } catch (InterruptedException e) {
            logger.warn("Disconnecting, handler interrupted");
            Thread.currentThread().interrupt();
        } finally {
            onClose.run();
        }
    }

    void serve(InputStream in, OutputStream out) throws IOException, InterruptedException {
        while (true) {
            String response;
            try {
                String line = WireCodec.readLine(in, maxValueLength);
                if (line == null) {
                    return;
                }
                response = respond(line);
            } catch (MalformedRequestException e) {
                response = e.getMessage();
            }
            logger.debug("Responding '{}'", response);
            WireCodec.writeFrame(out, response);
        }
    }

    String respond(String line) throws InterruptedException {
        Request request;
        try {
            request = WireCodec.parse(line, maxValueLength);
        } catch (MalformedRequestException e) {
            return e.getMessage();
        }

        switch (request.getOperation()) {
            case SET:
                engine.set(request.getKey(), request.getValue());
                return WireCodec.OK;
            case GET:
                LookupResult result = engine.get(request.getKey());
                return result.isFound() ? WireCodec.found(result.getValue()) : WireCodec.NOT_FOUND;
            case DELETE:
                engine.delete(request.getKey());
                return WireCodec.OK;
            default:
                throw new IllegalStateException("Unhandled operation " + request.getOperation());
        }
    }
}
