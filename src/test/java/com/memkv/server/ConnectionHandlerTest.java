package com.memkv.server;

import com.memkv.protocol.WireCodec;
import com.memkv.storage.StorageEngine;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.InputStream;
import java.net.Socket;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verifyNoInteractions;

class ConnectionHandlerTest {
    private StorageEngine engine;

    @BeforeEach
    void setUp() {
        engine = new StorageEngine(1024, "test");
        engine.start();
    }

    @AfterEach
    void tearDown() {
        engine.shutdown();
    }

    @Test
    void answersEachLineWithOneFrame() throws Exception {
        List<String> responses = serve(handler(engine, 0xFFFFFFFFL),
                "set a 1\nget a\ndel a\nget a\nfrobnicate x\n");

        assertThat(responses).containsExactly(
                "ok",
                "found: 1",
                "ok",
                "not found",
                "unknown command 'frobnicate'");
    }

    @Test
    void malformedLineLeavesConnectionUsable() throws Exception {
        List<String> responses = serve(handler(engine, 0xFFFFFFFFL),
                "set onlykey\nget\nset onlykey now\nget onlykey\n");

        assertThat(responses).containsExactly(
                "parse error: missing value for key 'onlykey'",
                "parse error: missing argument for command 'get'",
                "ok",
                "found: now");
    }

    @Test
    void oversizedValueKeepsPriorValue() throws Exception {
        List<String> responses = serve(handler(engine, 4),
                "set k 1234\nset k 12345\nget k\n");

        assertThat(responses).containsExactly(
                "ok",
                "value is too long, max allowed length is 4 bytes",
                "found: 1234");
    }

    @Test
    void oversizedValueNeverReachesEngine() throws Exception {
        StorageEngine mocked = mock(StorageEngine.class);

        String response = handler(mocked, 4).respond("set k 12345");

        assertThat(response).isEqualTo("value is too long, max allowed length is 4 bytes");
        verifyNoInteractions(mocked);
    }

    @Test
    void unknownCommandNeverReachesEngine() throws Exception {
        StorageEngine mocked = mock(StorageEngine.class);

        assertThat(handler(mocked, 4).respond("frobnicate x")).isEqualTo("unknown command 'frobnicate'");
        verifyNoInteractions(mocked);
    }

    @Test
    void unterminatedTrailingLineIsIgnored() throws Exception {
        List<String> responses = serve(handler(engine, 0xFFFFFFFFL), "set a 1\nget a");

        assertThat(responses).containsExactly("ok");
    }

    @Test
    void valueBytesComeBackUnchanged() throws Exception {
        ByteArrayOutputStream request = new ByteArrayOutputStream();
        request.write("set k ".getBytes(StandardCharsets.US_ASCII));
        request.write(new byte[]{(byte) 0xff, (byte) 0xfe});
        request.write("\nget k\n".getBytes(StandardCharsets.US_ASCII));

        List<byte[]> payloads = serve(handler(engine, 0xFFFFFFFFL), request.toByteArray());

        assertThat(payloads).hasSize(2);
        assertThat(new String(payloads.get(0), StandardCharsets.US_ASCII)).isEqualTo("ok");
        assertThat(payloads.get(1)).containsExactly('f', 'o', 'u', 'n', 'd', ':', ' ', 0xff, 0xfe);
    }

    @Test
    void utf8ValueComesBackAsUtf8() throws Exception {
        assertThat(serve(handler(engine, 0xFFFFFFFFL), "set ключ значение\nget ключ\n"))
                .containsExactly("ok", "found: значение");
    }

    @Test
    void overlongLineIsAnsweredAndConnectionContinues() throws Exception {
        String tooLong = "set k " + "x".repeat(2000);

        List<String> responses = serve(handler(engine, 4), "set k 1234\n" + tooLong + "\nget k\n");

        assertThat(responses).containsExactly(
                "ok",
                "value is too long, max allowed length is 4 bytes",
                "found: 1234");
    }

    @Test
    void runClosesSocketAndReportsCloseWhenStreamFails() {
        AtomicBoolean closed = new AtomicBoolean(false);
        Socket unconnected = new Socket();

        new ConnectionHandler(unconnected, engine, 0xFFFFFFFFL, () -> closed.set(true)).run();

        assertThat(closed).isTrue();
        assertThat(unconnected.isClosed()).isTrue();
    }

    private static ConnectionHandler handler(StorageEngine engine, long maxValueLength) {
        return new ConnectionHandler(new Socket(), engine, maxValueLength, () -> {
        });
    }

    private static List<String> serve(ConnectionHandler handler, String input) throws Exception {
        List<String> responses = new ArrayList<>();
        for (byte[] payload : serve(handler, input.getBytes(StandardCharsets.UTF_8))) {
            responses.add(new String(payload, StandardCharsets.UTF_8));
        }
        return responses;
    }

    private static List<byte[]> serve(ConnectionHandler handler, byte[] input) throws Exception {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        handler.serve(new ByteArrayInputStream(input), out);

        InputStream frames = new ByteArrayInputStream(out.toByteArray());
        List<byte[]> payloads = new ArrayList<>();
        while (frames.available() > 0) {
            payloads.add(WireCodec.readFrame(frames));
        }
        return payloads;
    }
}
