package com.planwright.dispatch.ipc;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.planwright.core.control.ControlDispatcher;
import com.planwright.core.control.ControlRequest;
import com.planwright.core.control.ControlResponse;
import com.planwright.core.model.ErrorKind;
import io.netty.channel.ChannelHandler;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.handler.codec.TooLongFrameException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads one JSON control request per line and writes one JSON response per line.
 * Runs on a separate executor group because dispatching may wait for a run's
 * coordinator.
 */
@ChannelHandler.Sharable
public class IpcChannelHandler extends SimpleChannelInboundHandler<String> {

    private static final Logger log = LoggerFactory.getLogger(IpcChannelHandler.class);

    private final ControlDispatcher dispatcher;
    private final ObjectMapper mapper;

    public IpcChannelHandler(ControlDispatcher dispatcher, ObjectMapper mapper) {
        this.dispatcher = dispatcher;
        this.mapper = mapper;
    }

    @Override
    protected void channelRead0(ChannelHandlerContext ctx, String line) {
        if (line.isBlank()) {
            return;
        }
        ControlResponse response;
        try {
            var request = mapper.readValue(line, ControlRequest.class);
            response = dispatcher.handle(request);
        } catch (JsonProcessingException e) {
            log.warn("Malformed control message from {}: {}", ctx.channel().remoteAddress(), e.getOriginalMessage());
            response = ControlResponse.failure(null, ErrorKind.INVALID_ARGUMENT,
                    "Malformed message: " + e.getOriginalMessage());
        }
        write(ctx, response);
    }

    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
        if (cause instanceof TooLongFrameException) {
            log.warn("Oversized control message from {}: {}", ctx.channel().remoteAddress(), cause.getMessage());
            write(ctx, ControlResponse.failure(null, ErrorKind.INVALID_ARGUMENT,
                    "Message exceeds " + IpcServer.MAX_MESSAGE_BYTES + " bytes"));
            return;
        }
        log.error("IPC connection {} failed: {}", ctx.channel().remoteAddress(), cause.getMessage(), cause);
        ctx.close();
    }

    private void write(ChannelHandlerContext ctx, ControlResponse response) {
        try {
            ctx.writeAndFlush(mapper.writeValueAsString(response) + "\n");
        } catch (JsonProcessingException e) {
            log.error("Cannot serialize control response {}: {}", response.id(), e.getMessage(), e);
            ctx.close();
        }
    }
}
