package com.planwright.dispatch.ipc;

import com.planwright.config.PlanwrightProperties;
import com.planwright.core.control.ControlDispatcher;
import com.planwright.core.control.ControlRequest;
import com.planwright.core.control.ControlResponse;
import com.planwright.core.model.ErrorKind;
import com.planwright.core.model.ObjectMappers;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.OutputStreamWriter;
import java.net.InetAddress;
import java.net.ServerSocket;
import java.net.Socket;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class IpcServerTest {

    private ControlDispatcher dispatcher;
    private IpcServer server;
    private int port;

    @BeforeEach
    void setUp() {
        dispatcher = mock(ControlDispatcher.class);
        when(dispatcher.handle(any())).thenAnswer(inv -> {
            ControlRequest request = inv.getArgument(0);
            return ControlResponse.ok(request.id(), Map.of("command", request.command()));
        });
        var settings = new PlanwrightProperties.Ipc();
        settings.setPort(0);
        server = new IpcServer(dispatcher, settings);
        port = server.start().orElseThrow().getPort();
    }

    @AfterEach
    void tearDown() {
        server.stop();
    }

    private String exchangeRaw(String payload) throws IOException {
        try (var socket = new Socket("127.0.0.1", port)) {
            socket.setSoTimeout(5000);
            var out = new OutputStreamWriter(socket.getOutputStream(), StandardCharsets.UTF_8);
            out.write(payload);
            out.flush();
            return new BufferedReader(new InputStreamReader(socket.getInputStream(), StandardCharsets.UTF_8))
                    .readLine();
        }
    }

    @Test
    void clientRoundTripThroughTheDispatcher() throws Exception {
        var client = new IpcClient("127.0.0.1", port, Duration.ofSeconds(5));

        var response = client.send(ControlRequest.of("demo", "status", Map.of()).withId("req-1"));

        assertTrue(response.success());
        assertEquals("req-1", response.id());
        assertEquals("status", response.data().get("command"));
        verify(dispatcher).handle(any());
    }

    @Test
    void clientAssignsAnIdWhenMissing() throws Exception {
        var client = new IpcClient("127.0.0.1", port, Duration.ofSeconds(5));
        var response = client.send(ControlRequest.of(null, "ping", null));
        assertNotNull(response.id());
    }

    @Test
    void malformedLineGetsAnErrorResponse() throws Exception {
        var reply = exchangeRaw("this is not json\n");

        var response = ObjectMappers.create().readValue(reply, ControlResponse.class);
        assertFalse(response.success());
        assertTrue(response.hasError(ErrorKind.INVALID_ARGUMENT));
    }

    @Test
    void oversizedLineIsRejected() throws Exception {
        var reply = exchangeRaw("x".repeat(IpcServer.MAX_MESSAGE_BYTES + 10) + "\n");

        var response = ObjectMappers.create().readValue(reply, ControlResponse.class);
        assertTrue(response.hasError(ErrorKind.INVALID_ARGUMENT));
    }

    @Test
    void secondStartReturnsTheSameAddress() {
        assertEquals(port, server.start().orElseThrow().getPort());
    }

    @Test
    void bindFailureLeavesTheProcessWithoutIpc() throws Exception {
        try (var occupied = new ServerSocket(0, 50, InetAddress.getLoopbackAddress())) {
            var settings = new PlanwrightProperties.Ipc();
            settings.setPort(occupied.getLocalPort());
            var other = new IpcServer(dispatcher, settings);
            assertTrue(other.start().isEmpty());
            assertTrue(other.boundAddress().isEmpty());
        }
    }

    @Test
    void unreachableListenerIsAnIoError() throws Exception {
        int closedPort;
        try (var probe = new ServerSocket(0)) {
            closedPort = probe.getLocalPort();
        }
        var client = new IpcClient("127.0.0.1", closedPort, Duration.ofSeconds(1));
        assertThrows(IOException.class, () -> client.send(ControlRequest.of("demo", "status", null)));
    }
}
