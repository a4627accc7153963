package automata.engine.support;

import io.netty.bootstrap.ServerBootstrap;
import io.netty.buffer.Unpooled;
import io.netty.channel.Channel;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelPipeline;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioServerSocketChannel;
import io.netty.handler.codec.http.DefaultFullHttpResponse;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.FullHttpResponse;
import io.netty.handler.codec.http.HttpHeaderNames;
import io.netty.handler.codec.http.HttpObjectAggregator;
import io.netty.handler.codec.http.HttpResponseStatus;
import io.netty.handler.codec.http.HttpServerCodec;

import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import static io.netty.handler.codec.http.HttpVersion.HTTP_1_1;

/**
 * Minimal HTTP endpoint for webhook tests: records every request and answers
 * with a configurable status, content type and body.
 */
public final class TestWebhookServer implements AutoCloseable {

    public record Received(String method, String uri, String contentType, String header, String body) {
    }

    private final EventLoopGroup bossGroup = new NioEventLoopGroup(1);
    private final EventLoopGroup workerGroup = new NioEventLoopGroup(1);
    private final List<Received> received = new CopyOnWriteArrayList<>();
    private final Channel serverChannel;

    private volatile int status = 200;
    private volatile String contentType = "application/json";
    private volatile String responseBody = "{}";
    private volatile String recordedHeader = "X-Test";

    public TestWebhookServer() {
        ServerBootstrap b = new ServerBootstrap()
                .group(bossGroup, workerGroup)
                .channel(NioServerSocketChannel.class)
                .childHandler(new ChannelInitializer<SocketChannel>() {
                    @Override
                    protected void initChannel(SocketChannel ch) {
                        ChannelPipeline p = ch.pipeline();
                        p.addLast(new HttpServerCodec());
                        p.addLast(new HttpObjectAggregator(1024 * 1024));
                        p.addLast(new RecordingHandler());
                    }
                });
        this.serverChannel = b.bind("127.0.0.1", 0).syncUninterruptibly().channel();
    }

    public TestWebhookServer respondWith(int status, String contentType, String body) {
        this.status = status;
        this.contentType = contentType;
        this.responseBody = body;
        return this;
    }

    /** Name of the request header to capture in {@link Received#header()}. */
    public TestWebhookServer recordHeader(String name) {
        this.recordedHeader = name;
        return this;
    }

    public String url(String path) {
        int port = ((InetSocketAddress) serverChannel.localAddress()).getPort();
        return "http://127.0.0.1:" + port + path;
    }

    public List<Received> received() {
        return received;
    }

    @Override
    public void close() {
        serverChannel.close().syncUninterruptibly();
        workerGroup.shutdownGracefully();
        bossGroup.shutdownGracefully();
    }

    private final class RecordingHandler extends SimpleChannelInboundHandler<FullHttpRequest> {

        @Override
        protected void channelRead0(ChannelHandlerContext ctx, FullHttpRequest request) {
            received.add(new Received(
                    request.method().name(),
                    request.uri(),
                    request.headers().get(HttpHeaderNames.CONTENT_TYPE),
                    request.headers().get(recordedHeader),
                    request.content().toString(StandardCharsets.UTF_8)));

            byte[] bytes = responseBody.getBytes(StandardCharsets.UTF_8);
            FullHttpResponse response = new DefaultFullHttpResponse(HTTP_1_1,
                    HttpResponseStatus.valueOf(status), Unpooled.wrappedBuffer(bytes));
            response.headers().set(HttpHeaderNames.CONTENT_TYPE, contentType + "; charset=utf-8");
            response.headers().setInt(HttpHeaderNames.CONTENT_LENGTH, bytes.length);
            ctx.writeAndFlush(response);
        }
    }
}
