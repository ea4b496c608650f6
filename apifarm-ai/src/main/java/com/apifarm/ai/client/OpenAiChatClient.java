package com.apifarm.ai.client;

import com.apifarm.common.dto.ChatCompletionRequest;
import com.apifarm.common.dto.ChatCompletionResponse;
import com.apifarm.common.dto.ChatMessage;
import com.apifarm.common.dto.TokenUsage;
import com.apifarm.common.exception.UpstreamRejectedException;
import com.apifarm.common.exception.UpstreamTimeoutException;
import com.apifarm.common.util.Secrets;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.Locale;

/**
 * OpenAI 兼容 API 实现（阻塞式）。
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class OpenAiChatClient implements ChatCompletionClient {

    private final OkHttpClient upstreamHttpClient;
    private final ObjectMapper objectMapper = new ObjectMapper();

    private static final MediaType JSON_MEDIA = MediaType.parse("application/json; charset=utf-8");

    private static final String QUOTA_ERROR_CODE = "insufficient_quota";

    @Override
    public ChatCompletionResponse complete(ChatCompletionRequest request, String apiKey, String baseUrl) {
        String url = stripTrailingSlash(baseUrl) + "/chat/completions";
        Request httpRequest;
        try {
            httpRequest = new Request.Builder()
                    .url(url)
                    .addHeader("Authorization", "Bearer " + apiKey)
                    .addHeader("Content-Type", "application/json")
                    .post(RequestBody.create(buildRequestBody(request), JSON_MEDIA))
                    .build();
        } catch (IllegalArgumentException e) {
            // 非法 URL，换时间重试同一个 Key 也不会成功
            throw new UpstreamRejectedException("上游地址无效: " + url, e);
        }

        try (Response response = upstreamHttpClient.newCall(httpRequest).execute()) {
            String body = response.body() != null ? response.body().string() : "";

            if (!response.isSuccessful()) {
                log.warn("上游调用失败: {} - Key {} - {}", response.code(), Secrets.mask(apiKey), abbreviate(body));
                throw classifyError(response.code(), body);
            }

            return parseResponse(body);

        } catch (UpstreamRejectedException | UpstreamTimeoutException e) {
            throw e;
        } catch (IOException e) {
            // 包含 InterruptedIOException（callTimeout 触发）
            throw new UpstreamTimeoutException("调用上游时发生网络错误或超时: " + e.getMessage(), e);
        }
    }

    /**
     * 按状态码归类上游错误。
     * <p>
     * 401/402/403 以及带额度错误的 429 视为对该 Key 的明确拒绝；
     * 其余（5xx、普通限流 429、其他 4xx）视为暂时性失败。
     */
    RuntimeException classifyError(int statusCode, String body) {
        if (statusCode == 401 || statusCode == 402 || statusCode == 403) {
            return new UpstreamRejectedException("上游拒绝该 Key: HTTP " + statusCode);
        }
        if (statusCode == 429 && isQuotaError(body)) {
            return new UpstreamRejectedException("上游额度已耗尽: HTTP 429");
        }
        return new UpstreamTimeoutException("上游返回错误: HTTP " + statusCode);
    }

    /**
     * 只认额度错误码 {@code insufficient_quota}，不按 message 文本匹配，
     * 按分钟计的限流提示里同样会出现 "quota" 字样。
     */
    private boolean isQuotaError(String body) {
        if (body == null || body.isBlank()) return false;
        JsonNode error;
        try {
            error = objectMapper.readTree(body).path("error");
        } catch (IOException e) {
            log.debug("429 响应体不是 JSON，按错误码文本判断: {}", e.getMessage());
            return body.toLowerCase(Locale.ROOT).contains(QUOTA_ERROR_CODE);
        }
        if (error.isTextual()) {
            return QUOTA_ERROR_CODE.equals(error.asText().toLowerCase(Locale.ROOT));
        }
        return QUOTA_ERROR_CODE.equals(error.path("code").asText("").toLowerCase(Locale.ROOT))
                || QUOTA_ERROR_CODE.equals(error.path("type").asText("").toLowerCase(Locale.ROOT));
    }

    private ChatCompletionResponse parseResponse(String body) {
        JsonNode json;
        try {
            json = objectMapper.readTree(body);
        } catch (IOException e) {
            throw new UpstreamTimeoutException("上游响应不是合法 JSON", e);
        }

        JsonNode message = json.path("choices").path(0).path("message");
        if (message.isMissingNode()) {
            throw new UpstreamTimeoutException("上游响应缺少 choices[0].message");
        }

        JsonNode usage = json.path("usage");
        TokenUsage tokenUsage = TokenUsage.builder()
                .promptTokens(usage.path("prompt_tokens").asInt(0))
                .completionTokens(usage.path("completion_tokens").asInt(0))
                .totalTokens(usage.path("total_tokens").asInt(0))
                .build();

        String content = message.path("content").asText("");
        log.debug("上游响应长度: {} 字符, total_tokens={}", content.length(), tokenUsage.getTotalTokens());
        return ChatCompletionResponse.builder()
                .content(content)
                .usage(tokenUsage)
                .build();
    }

    /**
     * 构建 Chat Completions 请求体，可选采样参数仅在调用方提供时写入。
     */
    private String buildRequestBody(ChatCompletionRequest request) {
        ObjectNode root = objectMapper.createObjectNode();
        root.put("model", request.getModel());

        ArrayNode messages = root.putArray("messages");
        for (ChatMessage message : request.getMessages()) {
            ObjectNode node = messages.addObject();
            node.put("role", message.getRole());
            node.put("content", message.getContent());
        }

        if (request.getTemperature() != null) {
            root.put("temperature", request.getTemperature());
        }
        if (request.getTopP() != null) {
            root.put("top_p", request.getTopP());
        }
        if (request.getMaxTokens() != null) {
            root.put("max_tokens", request.getMaxTokens());
        }
        root.put("stream", false);

        try {
            return objectMapper.writeValueAsString(root);
        } catch (IOException e) {
            throw new IllegalStateException("构建请求体失败", e);
        }
    }

    private static String stripTrailingSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }

    private static String abbreviate(String body) {
        return body.length() > 200 ? body.substring(0, 200) + "..." : body;
    }
}
