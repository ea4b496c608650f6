package com.apifarm.dispatcher.service;

import com.apifarm.ai.client.ChatCompletionClient;
import com.apifarm.ai.config.UpstreamProperties;
import com.apifarm.common.dto.ChatCompletionRequest;
import com.apifarm.common.dto.ChatCompletionResponse;
import com.apifarm.common.exception.KeyPoolExhaustedException;
import com.apifarm.common.exception.UpstreamRejectedException;
import com.apifarm.common.exception.UpstreamTimeoutException;
import com.apifarm.common.exception.UpstreamUnavailableException;
import com.apifarm.common.util.IdGenerator;
import com.apifarm.common.util.Secrets;
import com.apifarm.dispatcher.pool.Credential;
import com.apifarm.dispatcher.pool.CredentialPool;
import com.apifarm.dispatcher.pool.Outcome;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.LinkedHashSet;
import java.util.Set;

/**
 * 推理请求路由：从共享池选 Key、转发上游、按结果回写健康状态，失败时换下一个 Key。
 * <p>
 * 核心策略：
 * - 单次请求最多尝试 {@code pool.size()} 个互不相同的 Key
 * - 池锁只在选择和上报时短暂持有，上游网络调用在锁外进行
 * - 调用方只看到最终结果，不暴露逐次尝试的细节
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ProxyRouter {

    private final CredentialPool credentialPool;
    private final ChatCompletionClient chatCompletionClient;
    private final UpstreamProperties upstreamProperties;

    /**
     * 转发一次推理请求。
     *
     * @throws KeyPoolExhaustedException    池中没有任何可用 Key
     * @throws UpstreamUnavailableException 所有候选 Key 均失败
     */
    public ChatCompletionResponse inference(ChatCompletionRequest request) {
        String requestId = IdGenerator.withPrefix("req");
        int maxAttempts = credentialPool.size();
        if (maxAttempts == 0) {
            throw new KeyPoolExhaustedException("API Key 池为空，请先添加 Key");
        }

        Set<Long> tried = new LinkedHashSet<>();
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            Credential credential;
            try {
                credential = credentialPool.selectForUse(tried);
            } catch (KeyPoolExhaustedException e) {
                if (tried.isEmpty()) {
                    throw e;
                }
                // 剩余的 Key 都在冷却或已停用
                break;
            }
            tried.add(credential.getId());

            String endpoint = resolveEndpoint(credential);
            long start = System.currentTimeMillis();
            try {
                ChatCompletionResponse response = chatCompletionClient.complete(
                        request, credential.getValue(), endpoint);
                credentialPool.reportOutcome(credential.getId(), Outcome.SUCCESS);
                log.info("[{}] 推理完成, model={}, Key {}, 尝试 {}/{}, 耗时 {}ms",
                        requestId, request.getModel(), Secrets.mask(credential.getValue()),
                        attempt, maxAttempts, System.currentTimeMillis() - start);
                return response;

            } catch (UpstreamRejectedException e) {
                log.warn("[{}] Key {} 被拒绝 (尝试 {}/{}): {}", requestId,
                        Secrets.mask(credential.getValue()), attempt, maxAttempts, e.getMessage());
                credentialPool.reportOutcome(credential.getId(), Outcome.DEFINITIVE_FAILURE);

            } catch (UpstreamTimeoutException e) {
                log.warn("[{}] Key {} 暂时失败 (尝试 {}/{}): {}", requestId,
                        Secrets.mask(credential.getValue()), attempt, maxAttempts, e.getMessage());
                credentialPool.reportOutcome(credential.getId(), Outcome.TRANSIENT_FAILURE);

            } catch (RuntimeException e) {
                // 客户端意外错误按暂时性失败计，换下一个 Key
                log.error("[{}] 调用 Key {} 时发生意外错误 (尝试 {}/{})", requestId,
                        Secrets.mask(credential.getValue()), attempt, maxAttempts, e);
                credentialPool.reportOutcome(credential.getId(), Outcome.TRANSIENT_FAILURE);
            }
        }

        log.error("[{}] 推理失败, 已尝试 {} 个 Key", requestId, tried.size());
        throw new UpstreamUnavailableException("所有可用 API Key 均调用失败，请稍后重试");
    }

    private String resolveEndpoint(Credential credential) {
        String endpoint = credential.getEndpoint();
        return endpoint != null && !endpoint.isBlank() ? endpoint : upstreamProperties.getDefaultBaseUrl();
    }
}
