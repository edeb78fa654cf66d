package com.wangbin.plc.core.connection.adapter;

import com.google.common.util.concurrent.ThreadFactoryBuilder;
import com.wangbin.plc.common.exception.NetworkException;
import io.netty.bootstrap.Bootstrap;
import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelInboundHandlerAdapter;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioSocketChannel;
import lombok.extern.slf4j.Slf4j;

import java.nio.channels.ClosedChannelException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * 基于 Netty 的请求/应答 TCP 通道
 * <p>
 * 同一时刻只有一个未完成请求，响应帧的边界由调用方提供的 {@link FrameLengthResolver} 判断。
 */
@Slf4j
public class FrameChannel {

    private final String name;
    private final String host;
    private final int port;
    private final Object requestLock = new Object();

    private EventLoopGroup workerGroup;
    private volatile Channel channel;
    private volatile PendingRequest pending;
    private ByteBuf cumulation;

    public FrameChannel(String name, String host, int port) {
        this.name = name;
        this.host = host;
        this.port = port;
    }

    public void connect(int connectTimeoutMs) {
        close();
        workerGroup = new NioEventLoopGroup(1, new ThreadFactoryBuilder()
                .setNameFormat("plc-io-" + name + "-%d")
                .setDaemon(true)
                .build());
        synchronized (this) {
            cumulation = Unpooled.buffer(256);
        }
        Bootstrap bootstrap = new Bootstrap()
                .group(workerGroup)
                .channel(NioSocketChannel.class)
                .option(ChannelOption.TCP_NODELAY, true)
                .option(ChannelOption.SO_KEEPALIVE, true)
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, connectTimeoutMs)
                .handler(new ChannelInitializer<SocketChannel>() {
                    @Override
                    protected void initChannel(SocketChannel ch) {
                        ch.pipeline().addLast(new ResponseHandler());
                    }
                });

        ChannelFuture future = bootstrap.connect(host, port);
        if (!future.awaitUninterruptibly(connectTimeoutMs + 500L)) {
            future.cancel(true);
            close();
            throw new NetworkException(String.format("连接超时(%dms): %s:%d", connectTimeoutMs, host, port), name);
        }
        if (!future.isSuccess()) {
            Throwable cause = future.cause();
            close();
            throw new NetworkException(String.format("连接失败 %s:%d: %s", host, port,
                    cause != null ? cause.getMessage() : "未知原因"), name, cause);
        }
        channel = future.channel();
        log.debug("TCP通道建立成功: {} {}:{}", name, host, port);
    }

    /**
     * 发送请求并等待一个完整响应帧
     */
    public byte[] request(byte[] frame, FrameLengthResolver resolver, long timeoutMs) {
        synchronized (requestLock) {
            Channel current = channel;
            if (current == null || !current.isActive()) {
                throw new NetworkException("连接未建立或已关闭", name);
            }
            PendingRequest request = new PendingRequest(resolver);
            synchronized (this) {
                if (cumulation != null) {
                    cumulation.clear();
                }
                pending = request;
            }
            try {
                current.writeAndFlush(Unpooled.wrappedBuffer(frame));
                return request.future.get(timeoutMs, TimeUnit.MILLISECONDS);
            } catch (TimeoutException e) {
                throw new NetworkException(String.format("响应超时(%dms)", timeoutMs), name, e);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new NetworkException("等待响应被中断", name, e);
            } catch (ExecutionException e) {
                throw new NetworkException("通道异常: " + e.getCause(), name, e.getCause());
            } finally {
                synchronized (this) {
                    pending = null;
                }
            }
        }
    }

    public boolean isActive() {
        Channel current = channel;
        return current != null && current.isActive();
    }

    public void close() {
        Channel current = channel;
        channel = null;
        if (current != null) {
            current.close().awaitUninterruptibly(1000);
        }
        if (workerGroup != null) {
            workerGroup.shutdownGracefully(0, 1, TimeUnit.SECONDS);
            workerGroup = null;
        }
        synchronized (this) {
            if (pending != null) {
                pending.future.completeExceptionally(new ClosedChannelException());
            }
            if (cumulation != null) {
                cumulation.release();
                cumulation = null;
            }
        }
    }

    private static final class PendingRequest {
        private final FrameLengthResolver resolver;
        private final CompletableFuture<byte[]> future = new CompletableFuture<>();

        private PendingRequest(FrameLengthResolver resolver) {
            this.resolver = resolver;
        }
    }

    /**
     * 累积收到的字节，凑满一帧后交给等待中的请求
     */
    private class ResponseHandler extends ChannelInboundHandlerAdapter {

        @Override
        public void channelRead(ChannelHandlerContext ctx, Object msg) {
            ByteBuf in = (ByteBuf) msg;
            try {
                synchronized (FrameChannel.this) {
                    if (cumulation == null) {
                        return;
                    }
                    cumulation.writeBytes(in);
                    PendingRequest request = pending;
                    if (request == null) {
                        log.debug("丢弃无请求对应的数据: {} {} bytes", name, cumulation.readableBytes());
                        cumulation.clear();
                        return;
                    }
                    int length = request.resolver.frameLength(cumulation);
                    if (length > 0 && cumulation.readableBytes() >= length) {
                        byte[] frame = new byte[length];
                        cumulation.readBytes(frame);
                        cumulation.discardReadBytes();
                        request.future.complete(frame);
                    }
                }
            } finally {
                in.release();
            }
        }

        @Override
        public void channelInactive(ChannelHandlerContext ctx) {
            log.debug("TCP通道关闭: {}", name);
            synchronized (FrameChannel.this) {
                if (pending != null) {
                    pending.future.completeExceptionally(new ClosedChannelException());
                }
            }
        }

        @Override
        public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
            log.error("TCP连接异常: {}", name, cause);
            synchronized (FrameChannel.this) {
                if (pending != null) {
                    pending.future.completeExceptionally(cause);
                }
            }
            ctx.close();
        }
    }
}
