package com.planwright.dispatch.ipc;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.planwright.core.control.ControlRequest;
import com.planwright.core.control.ControlResponse;
import com.planwright.core.model.ErrorKind;
import com.planwright.core.model.ObjectMappers;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.OutputStreamWriter;
import java.io.Writer;
import java.net.InetSocketAddress;
import java.net.Socket;
import java.net.SocketTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.UUID;

/**
 * Sends one control request over a fresh connection and reads its response line.
 */
public class IpcClient {

    private static final Duration CONNECT_TIMEOUT = Duration.ofSeconds(2);

    private final String host;
    private final int port;
    private final Duration timeout;
    private final ObjectMapper mapper = ObjectMappers.create();

    public IpcClient(String host, int port, Duration timeout) {
        this.host = host;
        this.port = port;
        this.timeout = timeout;
    }

    /**
     * @throws IOException when no listener accepts the connection
     */
    public ControlResponse send(ControlRequest request) throws IOException {
        var withId = request.id() == null ? request.withId(UUID.randomUUID().toString()) : request;
        var line = mapper.writeValueAsString(withId);
        if (line.getBytes(StandardCharsets.UTF_8).length >= IpcServer.MAX_MESSAGE_BYTES) {
            return ControlResponse.failure(withId.id(), ErrorKind.INVALID_ARGUMENT,
                    "Message exceeds " + IpcServer.MAX_MESSAGE_BYTES + " bytes");
        }
        try (var socket = new Socket()) {
            socket.connect(new InetSocketAddress(host, port), (int) CONNECT_TIMEOUT.toMillis());
            socket.setSoTimeout((int) timeout.toMillis());
            Writer out = new OutputStreamWriter(socket.getOutputStream(), StandardCharsets.UTF_8);
            out.write(line);
            out.write('\n');
            out.flush();
            var in = new BufferedReader(new InputStreamReader(socket.getInputStream(), StandardCharsets.UTF_8));
            var reply = in.readLine();
            if (reply == null) {
                throw new IOException("Connection closed by " + host + ":" + port + " without a response");
            }
            return mapper.readValue(reply, ControlResponse.class);
        } catch (SocketTimeoutException e) {
            return ControlResponse.failure(withId.id(), ErrorKind.IPC_TIMEOUT,
                    "No response within " + timeout.toMillis() + "ms");
        }
    }
}
