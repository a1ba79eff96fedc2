package io.hearthwarrio.pagelens.jsoup;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sun.net.httpserver.HttpServer;
import io.hearthwarrio.pagelens.core.config.ConfigLoader;
import io.hearthwarrio.pagelens.core.config.PagelensConfig;
import io.hearthwarrio.pagelens.core.task.PagelensAgent;
import io.hearthwarrio.pagelens.core.task.TaskExecutor;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.OutputStream;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.MessageDigest;
import java.util.HexFormat;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

import static org.junit.jupiter.api.Assertions.*;

public class JsoupDownloadTest {

    private static final String PAGE_URL = "https://shop.example/support";
    private static final byte[] MANUAL = "%PDF-1.4 kettle manual".getBytes(StandardCharsets.UTF_8);

    private final ObjectMapper mapper = new ObjectMapper();
    private final Map<String, String> seenHeaders = new ConcurrentHashMap<>();

    @TempDir
    Path dir;

    private HttpServer server;
    private PagelensAgent agent;
    private TaskExecutor executor;

    @BeforeEach
    void setUp() throws Exception {
        server = HttpServer.create(new InetSocketAddress(InetAddress.getLoopbackAddress(), 0), 0);
        server.createContext("/files/manual.pdf", exchange -> {
            String cookie = exchange.getRequestHeaders().getFirst("Cookie");
            String referer = exchange.getRequestHeaders().getFirst("Referer");
            seenHeaders.put("cookie", cookie == null ? "" : cookie);
            seenHeaders.put("referer", referer == null ? "" : referer);
            exchange.getResponseHeaders().add("Content-Type", "application/pdf");
            exchange.sendResponseHeaders(200, MANUAL.length);
            try (OutputStream out = exchange.getResponseBody()) {
                out.write(MANUAL);
            }
        });
        server.start();
        String fileUrl = "http://127.0.0.1:" + server.getAddress().getPort() + "/files/manual.pdf";

        ConfigLoader loader = new ConfigLoader();
        PagelensConfig config = loader.withOverrides(loader.defaults(), mapper.readTree("{"
                + "\"self_healing\": {\"cache_file\": \"\"},"
                + "\"sessions\": {\"directory\": " + mapper.writeValueAsString(dir.resolve("sessions").toString()) + "},"
                + "\"downloads\": {\"directory\": " + mapper.writeValueAsString(dir.resolve("downloads").toString()) + ","
                + " \"allow_private_hosts\": true}"
                + "}"));
        JsoupPageProvider provider = PagelensJsoup.provider(config).register(PAGE_URL,
                "<html><body><h1>Support</h1>"
                        + "<a id=\"manual\" href=\"" + fileUrl + "\">Kettle manual</a>"
                        + "<a id=\"nowhere\">Coming soon</a>"
                        + "</body></html>");
        agent = PagelensJsoup.agent(config, provider).build();
        executor = new TaskExecutor(agent);
    }

    @AfterEach
    void tearDown() {
        executor.close();
        agent.close();
        server.stop(0);
    }

    private JsonNode run(String json) {
        return executor.execute(json.replace('\'', '"'));
    }

    @Test
    void downloadsLinkWithPageCookiesAndReferer() throws Exception {
        agent.sessions().save("support", "{\"cookies\": {\"sid\": \"s-42\"}}".getBytes(StandardCharsets.UTF_8));
        run("{'action': 'navigate', 'target': {'url': '" + PAGE_URL + "'}}");
        assertEquals("ok", run("{'action': 'load_session', 'target': {'session_name': 'support'}}").path("status").asText());

        JsonNode envelope = run("{'action': 'download', 'target': {'selector': '#manual', 'subdirectory': 'manuals'}}");

        assertEquals("ok", envelope.path("status").asText(), envelope.toString());
        JsonNode result = envelope.path("result");
        Path saved = dir.resolve("downloads").resolve("manuals").resolve("manual.pdf");
        assertEquals(saved.toString(), result.path("path").asText());
        assertEquals("manual.pdf", result.path("filename").asText());
        assertEquals(MANUAL.length, result.path("size_bytes").asLong());
        assertEquals(HexFormat.of().formatHex(MessageDigest.getInstance("SHA-256").digest(MANUAL)),
                result.path("sha256").asText());
        assertEquals("application/pdf", result.path("content_type").asText());
        assertArrayEquals(MANUAL, Files.readAllBytes(saved));

        assertEquals("sid=s-42", seenHeaders.get("cookie"));
        assertEquals(PAGE_URL, seenHeaders.get("referer"));
    }

    @Test
    void elementWithoutLinkIsInvalidTask() {
        run("{'action': 'navigate', 'target': {'url': '" + PAGE_URL + "'}}");

        JsonNode envelope = run("{'action': 'download', 'target': {'selector': '#nowhere'}}");

        assertEquals("InvalidTask", envelope.path("error").path("kind").asText(), envelope.toString());
        assertTrue(envelope.path("error").path("message").asText().contains("href/src"));
    }

    @Test
    void privateHostsStayBlockedByDefault() {
        String url = "http://127.0.0.1:" + server.getAddress().getPort() + "/files/manual.pdf";

        JsonNode envelope = run("{'action': 'download', 'target': {'url': '" + url + "'},"
                + " 'config_overrides': {'downloads': {'allow_private_hosts': false}}}");

        assertEquals("InvalidTask", envelope.path("error").path("kind").asText(), envelope.toString());
        assertFalse(envelope.path("error").path("retryable").asBoolean());
        assertTrue(seenHeaders.isEmpty());
    }
}
