package com.apifarm.dispatcher.service;

import com.apifarm.ai.client.ChatCompletionClient;
import com.apifarm.ai.config.UpstreamProperties;
import com.apifarm.common.dto.ChatCompletionRequest;
import com.apifarm.common.dto.ChatCompletionResponse;
import com.apifarm.common.dto.ChatMessage;
import com.apifarm.common.dto.TokenUsage;
import com.apifarm.common.exception.KeyPoolExhaustedException;
import com.apifarm.common.exception.UpstreamRejectedException;
import com.apifarm.common.exception.UpstreamTimeoutException;
import com.apifarm.common.exception.UpstreamUnavailableException;
import com.apifarm.dispatcher.config.DispatcherProperties;
import com.apifarm.dispatcher.pool.CredentialStatus;
import com.apifarm.dispatcher.pool.InMemoryCredentialStore;
import com.apifarm.dispatcher.pool.MutableClock;
import com.apifarm.dispatcher.pool.RoundRobinCredentialPool;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ProxyRouterTest {

    private static final Long OWNER = 1L;

    @Mock
    private ChatCompletionClient client;

    private InMemoryCredentialStore store;
    private RoundRobinCredentialPool pool;
    private UpstreamProperties upstreamProperties;
    private ProxyRouter router;

    @BeforeEach
    void setUp() {
        store = new InMemoryCredentialStore();
        pool = new RoundRobinCredentialPool(store, new DispatcherProperties(),
                new MutableClock(Instant.parse("2026-01-01T00:00:00Z")));
        upstreamProperties = new UpstreamProperties();
        upstreamProperties.setDefaultBaseUrl("https://default.example.com/v1");
        router = new ProxyRouter(pool, client, upstreamProperties);
    }

    @Test
    @DisplayName("should fail fast with PoolExhausted when the pool is empty")
    void shouldFailFastWhenPoolEmpty() {
        assertThatThrownBy(() -> router.inference(request()))
                .isInstanceOf(KeyPoolExhaustedException.class);
        verify(client, never()).complete(any(), anyString(), anyString());
    }

    @Test
    @DisplayName("should return the upstream response and mark the key healthy")
    void shouldReturnResponseOnSuccess() {
        Long id = pool.add(OWNER, "sk-1", null);
        when(client.complete(any(), eq("sk-1"), eq("https://default.example.com/v1")))
                .thenReturn(response("hello"));

        ChatCompletionResponse result = router.inference(request());

        assertThat(result.getContent()).isEqualTo("hello");
        assertThat(result.getUsage().getTotalTokens()).isEqualTo(7);
        assertThat(store.row(id).getLastUsedAt()).isNotNull();
    }

    @Test
    @DisplayName("should use the credential's own endpoint when set")
    void shouldUseCredentialEndpoint() {
        pool.add(OWNER, "sk-1", "https://custom.example.com/v1");
        when(client.complete(any(), eq("sk-1"), eq("https://custom.example.com/v1")))
                .thenReturn(response("ok"));

        assertThat(router.inference(request()).getContent()).isEqualTo("ok");
    }

    @Test
    @DisplayName("should fail over to the next key on a transient failure")
    void shouldFailOverOnTransientFailure() {
        Long flaky = pool.add(OWNER, "sk-flaky", null);
        pool.add(OWNER, "sk-good", null);
        when(client.complete(any(), eq("sk-flaky"), anyString()))
                .thenThrow(new UpstreamTimeoutException("timeout"));
        when(client.complete(any(), eq("sk-good"), anyString()))
                .thenReturn(response("from good"));

        ChatCompletionResponse result = router.inference(request());

        assertThat(result.getContent()).isEqualTo("from good");
        assertThat(store.row(flaky).getFailureCount()).isEqualTo(1);
        assertThat(store.row(flaky).getStatus()).isEqualTo(CredentialStatus.ACTIVE);
    }

    @Test
    @DisplayName("should spread failover traffic over the remaining keys")
    void shouldSpreadFailoverTraffic() {
        pool.add(OWNER, "sk-a", null);
        pool.add(OWNER, "sk-b", null);
        pool.add(OWNER, "sk-c", null);
        when(client.complete(any(), eq("sk-a"), anyString()))
                .thenThrow(new UpstreamTimeoutException("timeout"));
        when(client.complete(any(), eq("sk-b"), anyString())).thenReturn(response("b"));
        when(client.complete(any(), eq("sk-c"), anyString())).thenReturn(response("c"));

        List<String> served = new ArrayList<>();
        for (int i = 0; i < 4; i++) {
            served.add(router.inference(request()).getContent());
        }

        assertThat(served).containsExactly("b", "c", "b", "c");
    }

    @Test
    @DisplayName("should treat an unexpected client error as transient and try the next key")
    void shouldFailOverOnUnexpectedError() {
        Long broken = pool.add(OWNER, "sk-broken", null);
        pool.add(OWNER, "sk-good", null);
        when(client.complete(any(), eq("sk-broken"), anyString()))
                .thenThrow(new IllegalStateException("connection pool shut down"));
        when(client.complete(any(), eq("sk-good"), anyString())).thenReturn(response("ok"));

        assertThat(router.inference(request()).getContent()).isEqualTo("ok");
        assertThat(store.row(broken).getFailureCount()).isEqualTo(1);
        assertThat(store.row(broken).getStatus()).isEqualTo(CredentialStatus.ACTIVE);
    }

    @Test
    @DisplayName("should isolate a key that is always rejected")
    void shouldIsolateRejectedKey() {
        Long bad = pool.add(OWNER, "sk-bad", null);
        pool.add(OWNER, "sk-good-1", null);
        pool.add(OWNER, "sk-good-2", null);
        when(client.complete(any(), eq("sk-bad"), anyString()))
                .thenThrow(new UpstreamRejectedException("401"));
        when(client.complete(any(), eq("sk-good-1"), anyString())).thenReturn(response("1"));
        when(client.complete(any(), eq("sk-good-2"), anyString())).thenReturn(response("2"));

        for (int i = 0; i < 10; i++) {
            assertThat(router.inference(request()).getContent()).isIn("1", "2");
        }

        verify(client, times(1)).complete(any(), eq("sk-bad"), anyString());
        assertThat(store.row(bad).getStatus()).isEqualTo(CredentialStatus.DISABLED);
        assertThat(pool.size()).isEqualTo(2);
    }

    @Test
    @DisplayName("should try each key at most once and then report UpstreamUnavailable")
    void shouldGiveUpAfterAllKeysFail() {
        pool.add(OWNER, "sk-1", null);
        pool.add(OWNER, "sk-2", null);
        pool.add(OWNER, "sk-3", null);
        when(client.complete(any(), anyString(), anyString()))
                .thenThrow(new UpstreamTimeoutException("503"));

        assertThatThrownBy(() -> router.inference(request()))
                .isInstanceOf(UpstreamUnavailableException.class);

        for (String key : List.of("sk-1", "sk-2", "sk-3")) {
            verify(client, times(1)).complete(any(), eq(key), anyString());
        }
    }

    @Test
    @DisplayName("should report UpstreamUnavailable once every key has been disabled")
    void shouldReportUnavailableWhenAllRejected() {
        pool.add(OWNER, "sk-1", null);
        pool.add(OWNER, "sk-2", null);
        when(client.complete(any(), anyString(), anyString()))
                .thenThrow(new UpstreamRejectedException("quota"));

        assertThatThrownBy(() -> router.inference(request()))
                .isInstanceOf(UpstreamUnavailableException.class);

        assertThat(pool.size()).isZero();
        assertThatThrownBy(() -> router.inference(request()))
                .isInstanceOf(KeyPoolExhaustedException.class);
    }

    private static ChatCompletionRequest request() {
        return ChatCompletionRequest.builder()
                .model("meta/llama-3.1-8b-instruct")
                .messages(List.of(new ChatMessage("user", "hi")))
                .build();
    }

    private static ChatCompletionResponse response(String content) {
        return new ChatCompletionResponse(content, new TokenUsage(3, 4, 7));
    }
}
