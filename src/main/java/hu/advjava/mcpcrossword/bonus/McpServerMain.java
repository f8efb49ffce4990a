package hu.advjava.mcpcrossword.bonus;

import java.net.URI;
import java.util.Map;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.glassfish.grizzly.http.server.HttpServer;
import org.glassfish.jersey.grizzly2.httpserver.GrizzlyHttpServerFactory;
import org.glassfish.jersey.jsonp.JsonProcessingFeature;
import org.glassfish.jersey.media.sse.SseFeature;
import org.glassfish.jersey.server.ResourceConfig;
import org.glassfish.jersey.server.ServerProperties;

public class McpServerMain {
    private static final Logger log = LogManager.getLogger(McpServerMain.class);

    static final String BASE_URI_ENV = "CROSSWORD_MCP_BASE_URI";
    static final String DEFAULT_BASE_URI = "http://127.0.0.1:8080";

    record ServerConfig(URI baseUri) {}

    public static void main(String[] args) throws Exception {
        var cfg = loadConfig(System.getenv());

        HttpServer server = runServer(cfg);
        Runtime.getRuntime().addShutdownHook(new Thread(server::shutdownNow));
        log.info("Crossword MCP server listening on {}/mcp", cfg.baseUri());

        Thread.currentThread().join();
    }

    static ServerConfig loadConfig(Map<String, String> env) {
        String baseUri = env.get(BASE_URI_ENV);
        if (baseUri == null || baseUri.isBlank()) {
            baseUri = DEFAULT_BASE_URI;
        }
        try {
            return new ServerConfig(URI.create(baseUri.strip()));
        } catch (IllegalArgumentException e) {
            throw new IllegalStateException("Set " + BASE_URI_ENV + " to a valid URI, got: " + baseUri, e);
        }
    }

    static ResourceConfig resourceConfig() {
        return new ResourceConfig()
                .register(McpResource.class) // registered explicitly, no package scanning
                .register(SseFeature.class)
                .register(JsonProcessingFeature.class)
                .property(ServerProperties.WADL_FEATURE_DISABLE, true);
    }

    static HttpServer runServer(ServerConfig cfg) {
        return GrizzlyHttpServerFactory.createHttpServer(cfg.baseUri(), resourceConfig());
    }
}
