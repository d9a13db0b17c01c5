package com.memkv.protocol;

import java.io.ByteArrayOutputStream;
import java.io.DataInputStream;
import java.io.EOFException;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;

/**
 * Request and response encoding.
 *
 * <p>Requests are {@code \n}-terminated lines:
 * <pre>
 * request  := command SP argument-body LF
 * command  := "set" | "get" | "del"
 * set-body := key SP value
 * get-body := key
 * del-body := key
 * </pre>
 *
 * <p>Responses are framed: a 4-byte little-endian unsigned length followed by
 * that many payload bytes, with no trailing newline.
 *
 * <p>On the server side lines are decoded as ISO-8859-1, one char per byte,
 * and frames are encoded the same way, so keys and values travel as the exact
 * bytes the client sent whether or not they are valid UTF-8.
 */
public final class WireCodec {
    public static final String OK = "ok";
    public static final String NOT_FOUND = "not found";

    static final int HEADER_LENGTH = Integer.BYTES;
    static final int MAX_LINE_LENGTH = Integer.MAX_VALUE - 8;
    // room for "set ", the key and the separator on top of the value
    static final int LINE_OVERHEAD = 1024;

    private WireCodec() {
    }

    /**
     * Reads one line, without its terminator and stripped of surrounding whitespace.
     *
     * <p>A line longer than {@link #maxLineLength(long)} is read up to its
     * {@code \n} without being buffered and then rejected, leaving the stream
     * positioned at the next line.
     *
     * @return the line, or {@code null} once the stream ends; bytes after the
     *         last {@code \n} are dropped
     * @throws MalformedRequestException with the "value is too long" response
     */
    public static String readLine(InputStream in, long maxValueLength) throws IOException, MalformedRequestException {
        long limit = maxLineLength(maxValueLength);
        ByteArrayOutputStream line = new ByteArrayOutputStream(64);
        long length = 0;
        int b;
        while ((b = in.read()) != -1) {
            if (b == '\n') {
                if (length > limit) {
                    throw new MalformedRequestException(valueTooLong(maxValueLength));
                }
                return line.toString(StandardCharsets.ISO_8859_1).strip();
            }
            length++;
            if (length <= limit) {
                line.write(b);
            } else if (line.size() > 0) {
                line = new ByteArrayOutputStream(0);
            }
        }
        return null;
    }

    static long maxLineLength(long maxValueLength) {
        return Math.min(MAX_LINE_LENGTH, maxValueLength + LINE_OVERHEAD);
    }

    /**
     * Parses a stripped request line.
     *
     * @param maxValueLength largest byte length accepted for a {@code set} value
     * @throws MalformedRequestException with the response text for a missing
     *         argument, a missing value, an oversized value or an unknown command
     */
    public static Request parse(String line, long maxValueLength) throws MalformedRequestException {
        int space = line.indexOf(' ');
        if (space < 0) {
            throw new MalformedRequestException(missingArgument(line));
        }
        String command = line.substring(0, space);
        String body = line.substring(space + 1);

        switch (command) {
            case "set": {
                int separator = body.indexOf(' ');
                if (separator < 0) {
                    throw new MalformedRequestException(missingValue(body));
                }
                String key = body.substring(0, separator);
                String value = body.substring(separator + 1);
                if (value.length() > maxValueLength) {
                    throw new MalformedRequestException(valueTooLong(maxValueLength));
                }
                return Request.set(key, value);
            }
            case "get":
                return Request.get(body);
            case "del":
                return Request.delete(body);
            default:
                throw new MalformedRequestException(unknownCommand(command));
        }
    }

    public static void writeFrame(OutputStream out, String payload) throws IOException {
        byte[] bytes = payload.getBytes(StandardCharsets.ISO_8859_1);
        ByteBuffer frame = ByteBuffer.allocate(HEADER_LENGTH + bytes.length).order(ByteOrder.LITTLE_ENDIAN);
        frame.putInt(bytes.length);
        frame.put(bytes);
        out.write(frame.array());
        out.flush();
    }

    /**
     * Reads one framed response payload.
     *
     * @throws EOFException if the stream ends before a whole frame arrived
     */
    public static byte[] readFrame(InputStream in) throws IOException {
        DataInputStream data = new DataInputStream(in);
        byte[] header = new byte[HEADER_LENGTH];
        data.readFully(header);
        long length = Integer.toUnsignedLong(ByteBuffer.wrap(header).order(ByteOrder.LITTLE_ENDIAN).getInt());
        if (length > MAX_LINE_LENGTH) {
            throw new IOException("Frame of " + length + " bytes exceeds " + MAX_LINE_LENGTH);
        }
        byte[] payload = new byte[(int) length];
        data.readFully(payload);
        return payload;
    }

    public static String found(String value) {
        return "found: " + value;
    }

    public static String unknownCommand(String command) {
        return "unknown command '" + command + "'";
    }

    public static String missingArgument(String command) {
        return "parse error: missing argument for command '" + command + "'";
    }

    public static String missingValue(String key) {
        return "parse error: missing value for key '" + key + "'";
    }

    public static String valueTooLong(long maxValueLength) {
        return "value is too long, max allowed length is " + maxValueLength + " bytes";
    }
}
