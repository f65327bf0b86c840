package com.agenthost.client.transport;

import com.agenthost.client.error.TransportException;
import com.agenthost.common.config.AgentHostConfig;
import okhttp3.OkHttpClient;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class AgentSessionApiTest {

    private MockWebServer server;
    private OkHttpClient httpClient;
    private AgentSessionApi api;

    @BeforeEach
    void setUp() throws Exception {
        server = new MockWebServer();
        server.start();
        httpClient = new OkHttpClient();
        AgentHostConfig.ServerConfig config = new AgentHostConfig.ServerConfig();
        config.setBaseUrl(server.url("/api").toString());
        api = new AgentSessionApi(httpClient, new Endpoints(config), "tok");
    }

    @AfterEach
    void tearDown() throws Exception {
        httpClient.dispatcher().executorService().shutdown();
        server.close();
    }

    @Test
    void endSession_sendsDeleteWithReason() throws Exception {
        server.enqueue(new MockResponse().setResponseCode(204));

        api.endSession("a1", "user ended").get(5, TimeUnit.SECONDS);

        RecordedRequest request = server.takeRequest(5, TimeUnit.SECONDS);
        assertEquals("DELETE", request.getMethod());
        assertEquals("/api/agents/a1/sessions/current", request.getPath());
        assertEquals("{\"reason\":\"user ended\"}", request.getBody().readUtf8());
        assertEquals("Bearer tok", request.getHeader("Authorization"));
    }

    @Test
    void endSession_alreadyGoneIsSuccess() throws Exception {
        server.enqueue(new MockResponse().setResponseCode(404));

        assertNull(api.endSession("a1", "user ended").get(5, TimeUnit.SECONDS));
    }

    @Test
    void endSession_serverErrorFails() {
        server.enqueue(new MockResponse().setResponseCode(500));

        ExecutionException e = assertThrows(ExecutionException.class,
                () -> api.endSession("a1", "x").get(5, TimeUnit.SECONDS));
        assertEquals(500, assertInstanceOf(TransportException.class, e.getCause()).getHttpStatus());
    }
}
