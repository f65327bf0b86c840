package com.agenthost.client.history;

import com.agenthost.client.error.TransportException;
import com.agenthost.client.message.MessageSnapshot;
import com.agenthost.client.transport.Endpoints;
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

class ConversationHistoryClientTest {

    private MockWebServer server;
    private OkHttpClient httpClient;
    private ConversationHistoryClient client;

    @BeforeEach
    void setUp() throws Exception {
        server = new MockWebServer();
        server.start();
        httpClient = new OkHttpClient();
        AgentHostConfig.ServerConfig config = new AgentHostConfig.ServerConfig();
        config.setBaseUrl(server.url("/api").toString());
        client = new ConversationHistoryClient(httpClient, new Endpoints(config), "tok");
    }

    @AfterEach
    void tearDown() throws Exception {
        httpClient.dispatcher().executorService().shutdown();
        server.close();
    }

    @Test
    void loadsConversationAndMergesToolOnlyMessages() throws Exception {
        server.enqueue(new MockResponse().setBody("""
                {
                  "id": "c1",
                  "title": "Weather",
                  "definition_id": "d1",
                  "unknown": true,
                  "messages": [
                    {"id": "m1", "role": "user", "content": "Weather in Oslo?"},
                    {"id": "m2", "role": "assistant", "content": "",
                     "tool_calls": [{"id": "t1", "name": "weather", "status": "completed"}],
                     "tool_results": [{"tool_call_id": "t1", "name": "weather", "success": true,
                                       "result": {"temp": 3}}]},
                    {"id": "m3", "role": "assistant", "content": "It is 3 degrees."}
                  ]
                }
                """));

        Conversation conversation = client.getConversation("c1").get(5, TimeUnit.SECONDS);

        assertEquals("c1", conversation.id());
        assertEquals("Weather", conversation.title());
        assertEquals("d1", conversation.definitionId());
        assertEquals(2, conversation.messages().size());
        MessageSnapshot answer = conversation.messages().get(1);
        assertEquals("m3", answer.id());
        assertEquals("It is 3 degrees.", answer.content());
        assertEquals("t1", answer.toolCalls().get(0).callId());
        assertEquals("t1", answer.toolResults().get(0).callId());

        RecordedRequest request = server.takeRequest(5, TimeUnit.SECONDS);
        assertEquals("GET", request.getMethod());
        assertEquals("/api/chat/conversations/c1", request.getPath());
        assertEquals("Bearer tok", request.getHeader("Authorization"));
    }

    @Test
    void missingIdAndMessages_fallBackToRequest() throws Exception {
        server.enqueue(new MockResponse().setBody("{\"title\":\"Empty\"}"));

        Conversation conversation = client.getConversation("c9").get(5, TimeUnit.SECONDS);

        assertEquals("c9", conversation.id());
        assertTrue(conversation.messages().isEmpty());
    }

    @Test
    void httpErrorCarriesStatus() {
        server.enqueue(new MockResponse().setResponseCode(404));

        ExecutionException e = assertThrows(ExecutionException.class,
                () -> client.getConversation("gone").get(5, TimeUnit.SECONDS));

        TransportException cause = assertInstanceOf(TransportException.class, e.getCause());
        assertEquals(404, cause.getHttpStatus());
    }

    @Test
    void malformedBody_failsTheFuture() {
        server.enqueue(new MockResponse().setBody("not json"));

        ExecutionException e = assertThrows(ExecutionException.class,
                () -> client.getConversation("c1").get(5, TimeUnit.SECONDS));

        assertInstanceOf(TransportException.class, e.getCause());
    }
}
