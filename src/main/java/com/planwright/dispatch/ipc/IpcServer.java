package com.planwright.dispatch.ipc;

import com.planwright.config.PlanwrightProperties;
import com.planwright.core.control.ControlDispatcher;
import com.planwright.core.model.ObjectMappers;
import io.netty.bootstrap.ServerBootstrap;
import io.netty.channel.Channel;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioServerSocketChannel;
import io.netty.handler.codec.LineBasedFrameDecoder;
import io.netty.handler.codec.string.StringDecoder;
import io.netty.handler.codec.string.StringEncoder;
import io.netty.util.concurrent.DefaultEventExecutorGroup;
import io.netty.util.concurrent.EventExecutorGroup;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.Optional;

/**
 * NDJSON control listener on a local TCP port. Started explicitly by the commands
 * that host runs ({@code run}, {@code serve}); a failed bind is logged and the
 * process continues without IPC.
 */
@Component
public class IpcServer {

    private static final Logger log = LoggerFactory.getLogger(IpcServer.class);

    public static final int MAX_MESSAGE_BYTES = 65536;

    private final ControlDispatcher dispatcher;
    private final PlanwrightProperties.Ipc settings;

    private EventLoopGroup bossGroup;
    private EventLoopGroup workerGroup;
    private EventExecutorGroup handlerGroup;
    private Channel channel;

    @Autowired
    public IpcServer(ControlDispatcher dispatcher, PlanwrightProperties properties) {
        this(dispatcher, properties.getIpc());
    }

    public IpcServer(ControlDispatcher dispatcher, PlanwrightProperties.Ipc settings) {
        this.dispatcher = dispatcher;
        this.settings = settings;
    }

    /**
     * Binds the listener unless IPC is disabled or already running.
     *
     * @return the bound address, empty when not listening
     */
    public synchronized Optional<InetSocketAddress> start() {
        if (channel != null) {
            return boundAddress();
        }
        if (!settings.isEnabled()) {
            log.info("IPC listener disabled (planwright.ipc.enabled=false)");
            return Optional.empty();
        }
        bossGroup = new NioEventLoopGroup(1);
        workerGroup = new NioEventLoopGroup(2);
        handlerGroup = new DefaultEventExecutorGroup(4);
        var handler = new IpcChannelHandler(dispatcher, ObjectMappers.create());

        var bootstrap = new ServerBootstrap();
        bootstrap.group(bossGroup, workerGroup)
                .channel(NioServerSocketChannel.class)
                .option(ChannelOption.SO_BACKLOG, 64)
                .childHandler(new ChannelInitializer<SocketChannel>() {
                    @Override
                    protected void initChannel(SocketChannel ch) {
                        ch.pipeline()
                                .addLast(new LineBasedFrameDecoder(MAX_MESSAGE_BYTES))
                                .addLast(new StringDecoder(StandardCharsets.UTF_8))
                                .addLast(new StringEncoder(StandardCharsets.UTF_8))
                                .addLast(handlerGroup, handler);
                    }
                });
        try {
            channel = bootstrap.bind(settings.getHost(), settings.getPort()).sync().channel();
            log.info("IPC listening on {}", channel.localAddress());
            return boundAddress();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while binding IPC listener");
            stop();
            return Optional.empty();
        } catch (Exception e) {
            log.warn("IPC listener could not bind {}:{}; continuing without IPC: {}",
                    settings.getHost(), settings.getPort(), e.getMessage());
            stop();
            return Optional.empty();
        }
    }

    public synchronized Optional<InetSocketAddress> boundAddress() {
        return channel == null ? Optional.empty() : Optional.of((InetSocketAddress) channel.localAddress());
    }

    @PreDestroy
    public synchronized void stop() {
        if (channel != null) {
            channel.close().syncUninterruptibly();
            channel = null;
            log.info("IPC listener stopped");
        }
        if (bossGroup != null) {
            bossGroup.shutdownGracefully();
            workerGroup.shutdownGracefully();
            handlerGroup.shutdownGracefully();
            bossGroup = null;
            workerGroup = null;
            handlerGroup = null;
        }
    }
}
