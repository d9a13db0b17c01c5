package com.memkv.client;

import com.memkv.protocol.WireCodec;

import java.io.BufferedInputStream;
import java.io.BufferedOutputStream;
import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.Socket;
import java.nio.charset.StandardCharsets;

public class KvClient implements Closeable {
    private final Socket socket;
    private final InputStream in;
    private final OutputStream out;

    private KvClient(Socket socket) throws IOException {
        this.socket = socket;
        this.in = new BufferedInputStream(socket.getInputStream());
        this.out = new BufferedOutputStream(socket.getOutputStream());
    }

    public static KvClient connect(String host, int port) throws IOException {
        Socket socket = new Socket();
        try {
            socket.connect(new InetSocketAddress(host, port));
            return new KvClient(socket);
        } catch (IOException e) {
            socket.close();
            throw e;
        }
    }

    public String send(String line) throws IOException {
        out.write((line + "\n").getBytes(StandardCharsets.UTF_8));
        out.flush();
        return new String(WireCodec.readFrame(in), StandardCharsets.UTF_8);
    }

    public String set(String key, String value) throws IOException {
        return send("set " + key + " " + value);
    }

    public String get(String key) throws IOException {
        return send("get " + key);
    }

    public String delete(String key) throws IOException {
        return send("del " + key);
    }

    @Override
    public void close() throws IOException {
        socket.close();
    }
}
