package com.apifarm.ai.client;

import com.apifarm.common.dto.ChatCompletionRequest;
import com.apifarm.common.dto.ChatCompletionResponse;
import com.apifarm.common.dto.ChatMessage;
import com.apifarm.common.exception.UpstreamRejectedException;
import com.apifarm.common.exception.UpstreamTimeoutException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import okhttp3.OkHttpClient;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import okhttp3.mockwebserver.SocketPolicy;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class OpenAiChatClientTest {

    private static final String OK_BODY = """
            {
              "id": "chatcmpl-1",
              "choices": [{"index": 0, "message": {"role": "assistant", "content": "Hello there"}}],
              "usage": {"prompt_tokens": 5, "completion_tokens": 2, "total_tokens": 7}
            }
            """;

    private MockWebServer server;
    private OpenAiChatClient client;
    private final ObjectMapper objectMapper = new ObjectMapper();

    @BeforeEach
    void setUp() throws IOException {
        server = new MockWebServer();
        server.start();
        OkHttpClient httpClient = new OkHttpClient.Builder()
                .callTimeout(Duration.ofMillis(500))
                .readTimeout(Duration.ofMillis(500))
                .build();
        client = new OpenAiChatClient(httpClient);
    }

    @AfterEach
    void tearDown() throws IOException {
        server.shutdown();
    }

    @Test
    @DisplayName("should normalize content and usage from a successful response")
    void shouldParseSuccessfulResponse() throws InterruptedException {
        server.enqueue(new MockResponse().setBody(OK_BODY).addHeader("Content-Type", "application/json"));

        ChatCompletionResponse response = client.complete(request(null), "sk-test-123456", baseUrl());

        assertThat(response.getContent()).isEqualTo("Hello there");
        assertThat(response.getUsage().getPromptTokens()).isEqualTo(5);
        assertThat(response.getUsage().getCompletionTokens()).isEqualTo(2);
        assertThat(response.getUsage().getTotalTokens()).isEqualTo(7);

        RecordedRequest recorded = server.takeRequest();
        assertThat(recorded.getPath()).isEqualTo("/v1/chat/completions");
        assertThat(recorded.getHeader("Authorization")).isEqualTo("Bearer sk-test-123456");
    }

    @Test
    @DisplayName("should forward only the sampling parameters that were supplied")
    void shouldForwardOptionalParametersOnlyWhenSet() throws Exception {
        server.enqueue(new MockResponse().setBody(OK_BODY));
        server.enqueue(new MockResponse().setBody(OK_BODY));

        client.complete(request(null), "sk-1", baseUrl());
        ChatCompletionRequest withParams = request(0.2);
        withParams.setTopP(0.9);
        withParams.setMaxTokens(64);
        client.complete(withParams, "sk-1", baseUrl() + "/");

        JsonNode bare = objectMapper.readTree(server.takeRequest().getBody().readUtf8());
        assertThat(bare.path("model").asText()).isEqualTo("test-model");
        assertThat(bare.path("messages").get(0).path("content").asText()).isEqualTo("hi");
        assertThat(bare.has("temperature")).isFalse();
        assertThat(bare.has("top_p")).isFalse();
        assertThat(bare.has("max_tokens")).isFalse();

        RecordedRequest second = server.takeRequest();
        assertThat(second.getPath()).isEqualTo("/v1/chat/completions");
        JsonNode full = objectMapper.readTree(second.getBody().readUtf8());
        assertThat(full.path("temperature").asDouble()).isEqualTo(0.2);
        assertThat(full.path("top_p").asDouble()).isEqualTo(0.9);
        assertThat(full.path("max_tokens").asInt()).isEqualTo(64);
    }

    @Test
    @DisplayName("should treat 401 and 403 as a definitive rejection")
    void shouldRejectOnAuthErrors() {
        server.enqueue(new MockResponse().setResponseCode(401).setBody("{\"error\":\"invalid api key\"}"));
        server.enqueue(new MockResponse().setResponseCode(403));

        assertThatThrownBy(() -> client.complete(request(null), "sk-1", baseUrl()))
                .isInstanceOf(UpstreamRejectedException.class);
        assertThatThrownBy(() -> client.complete(request(null), "sk-1", baseUrl()))
                .isInstanceOf(UpstreamRejectedException.class);
    }

    @Test
    @DisplayName("should treat a quota 429 as definitive and a plain 429 as transient")
    void shouldDistinguishQuotaFromRateLimit() {
        server.enqueue(new MockResponse().setResponseCode(429)
                .setBody("{\"error\":{\"code\":\"insufficient_quota\"}}"));
        server.enqueue(new MockResponse().setResponseCode(429).setBody("{\"error\":\"slow down\"}"));

        assertThatThrownBy(() -> client.complete(request(null), "sk-1", baseUrl()))
                .isInstanceOf(UpstreamRejectedException.class);
        assertThatThrownBy(() -> client.complete(request(null), "sk-1", baseUrl()))
                .isInstanceOf(UpstreamTimeoutException.class);
    }

    @Test
    @DisplayName("should keep a rate-limit 429 transient even when its message mentions quota")
    void shouldNotDisableOnRateLimitQuotaWording() {
        server.enqueue(new MockResponse().setResponseCode(429).setBody("""
                {"error": {"message": "You exceeded your requests per minute quota, retry in 20s",
                           "type": "requests", "code": "rate_limit_exceeded"}}
                """));
        server.enqueue(new MockResponse().setResponseCode(429).setBody("""
                {"error": {"message": "You exceeded your current quota", "type": "insufficient_quota"}}
                """));
        server.enqueue(new MockResponse().setResponseCode(429).setBody("Insufficient_Quota"));

        assertThatThrownBy(() -> client.complete(request(null), "sk-1", baseUrl()))
                .isInstanceOf(UpstreamTimeoutException.class);
        assertThatThrownBy(() -> client.complete(request(null), "sk-1", baseUrl()))
                .isInstanceOf(UpstreamRejectedException.class);
        assertThatThrownBy(() -> client.complete(request(null), "sk-1", baseUrl()))
                .isInstanceOf(UpstreamRejectedException.class);
    }

    @Test
    @DisplayName("should treat 5xx as transient")
    void shouldTreatServerErrorsAsTransient() {
        server.enqueue(new MockResponse().setResponseCode(503));

        assertThatThrownBy(() -> client.complete(request(null), "sk-1", baseUrl()))
                .isInstanceOf(UpstreamTimeoutException.class);
    }

    @Test
    @DisplayName("should treat a call timeout as transient")
    void shouldTreatTimeoutAsTransient() {
        server.enqueue(new MockResponse().setSocketPolicy(SocketPolicy.NO_RESPONSE));

        assertThatThrownBy(() -> client.complete(request(null), "sk-1", baseUrl()))
                .isInstanceOf(UpstreamTimeoutException.class);
    }

    @Test
    @DisplayName("should treat an unparseable body as transient")
    void shouldTreatGarbageAsTransient() {
        server.enqueue(new MockResponse().setBody("<html>gateway</html>"));

        assertThatThrownBy(() -> client.complete(request(null), "sk-1", baseUrl()))
                .isInstanceOf(UpstreamTimeoutException.class);
    }

    private String baseUrl() {
        String url = server.url("/v1").toString();
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }

    private static ChatCompletionRequest request(Double temperature) {
        return ChatCompletionRequest.builder()
                .model("test-model")
                .messages(List.of(new ChatMessage("user", "hi")))
                .temperature(temperature)
                .build();
    }
}
