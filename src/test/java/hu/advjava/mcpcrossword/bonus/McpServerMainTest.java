package hu.advjava.mcpcrossword.bonus;

import static org.junit.jupiter.api.Assertions.*;

import java.net.URI;
import java.util.Map;

import org.glassfish.jersey.server.ResourceConfig;
import org.junit.jupiter.api.Test;

public class McpServerMainTest {

    @Test
    public void defaultsToLocalhost() {
        assertEquals(URI.create(McpServerMain.DEFAULT_BASE_URI), McpServerMain.loadConfig(Map.of()).baseUri());
        assertEquals(URI.create(McpServerMain.DEFAULT_BASE_URI),
                McpServerMain.loadConfig(Map.of(McpServerMain.BASE_URI_ENV, "  ")).baseUri());
    }

    @Test
    public void readsBaseUriFromEnvironment() {
        var cfg = McpServerMain.loadConfig(Map.of(McpServerMain.BASE_URI_ENV, "http://0.0.0.0:9090"));
        assertEquals(9090, cfg.baseUri().getPort());
    }

    @Test
    public void rejectsMalformedBaseUri() {
        assertThrows(IllegalStateException.class,
                () -> McpServerMain.loadConfig(Map.of(McpServerMain.BASE_URI_ENV, "http://bad host:80")));
    }

    @Test
    public void registersMcpResource() {
        ResourceConfig rc = McpServerMain.resourceConfig();
        assertTrue(rc.isRegistered(McpResource.class));
    }
}
