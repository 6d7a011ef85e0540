package conveyor.orchestrator.server;

import conveyor.orchestrator.api.Controller;
import conveyor.orchestrator.graph.GraphValidationException;
import io.netty.channel.embedded.EmbeddedChannel;
import io.netty.handler.codec.http.DefaultFullHttpRequest;
import io.netty.handler.codec.http.FullHttpResponse;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpResponseStatus;
import io.netty.handler.codec.http.HttpVersion;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.function.Supplier;

import static org.junit.jupiter.api.Assertions.*;

class RouterHandlerTest {

    private static Controller controller(String path, Supplier<Controller.ControllerResponse> body) {
        return new Controller() {
            @Override
            public boolean matches(HttpMethod method, String requestPath) {
                return method.equals(HttpMethod.GET) && requestPath.equals(path);
            }

            @Override
            public ControllerResponse handle(io.netty.channel.ChannelHandlerContext ctx,
                    io.netty.handler.codec.http.FullHttpRequest req, String requestPath) {
                return body.get();
            }
        };
    }

    private static FullHttpResponse send(RouterHandler router, String uri) {
        EmbeddedChannel channel = new EmbeddedChannel(router);
        channel.writeInbound(new DefaultFullHttpRequest(HttpVersion.HTTP_1_1, HttpMethod.GET, uri));
        FullHttpResponse response = channel.readOutbound();
        channel.finishAndReleaseAll();
        return response;
    }

    private static String body(FullHttpResponse response) {
        try {
            return response.content().toString(StandardCharsets.UTF_8);
        } finally {
            response.release();
        }
    }

    @Test
    void routesByPathIgnoringQueryString() {
        RouterHandler router = new RouterHandler()
                .registerController(controller("/api/v1/ping", () -> Controller.ControllerResponse.json("{\"ok\":true}")));

        FullHttpResponse response = send(router, "/api/v1/ping?verbose=1");

        assertEquals(HttpResponseStatus.OK, response.status());
        assertEquals("application/json; charset=utf-8", response.headers().get("Content-Type"));
        assertEquals("{\"ok\":true}", body(response));
        assertEquals(1, router.controllerCount());
    }

    @Test
    void unmatchedPathIsNotFound() {
        FullHttpResponse response = send(new RouterHandler(), "/api/v1/missing");

        assertEquals(HttpResponseStatus.NOT_FOUND, response.status());
        assertEquals("{\"error\":\"not found\"}", body(response));
    }

    @Test
    void controllerExceptionsAreMappedToStatusCodes() {
        RouterHandler router = new RouterHandler()
                .registerController(controller("/invalid", () -> {
                    throw new GraphValidationException("task 'x' is \"broken\"");
                }))
                .registerController(controller("/bad", () -> {
                    throw new IllegalArgumentException("limit must be positive");
                }))
                .registerController(controller("/boom", () -> {
                    throw new IllegalStateException("store down");
                }));

        FullHttpResponse invalid = send(router, "/invalid");
        assertEquals(HttpResponseStatus.BAD_REQUEST, invalid.status());
        assertEquals("{\"error\":\"Invalid pipeline: task 'x' is \\\"broken\\\"\"}", body(invalid));

        FullHttpResponse bad = send(router, "/bad");
        assertEquals(HttpResponseStatus.BAD_REQUEST, bad.status());
        body(bad);

        FullHttpResponse boom = send(router, "/boom");
        assertEquals(HttpResponseStatus.INTERNAL_SERVER_ERROR, boom.status());
        assertEquals("{\"error\":\"internal error\"}", body(boom));
    }
}
