package com.apifarm.ai.client;

import com.apifarm.common.dto.ChatCompletionRequest;
import com.apifarm.common.dto.ChatCompletionResponse;

/**
 * 上游 Chat Completions 调用接口。
 * <p>
 * 实现方负责把上游的各种失败归为两类，供路由层决定凭证的健康状态：
 * <ul>
 *   <li>{@link com.apifarm.common.exception.UpstreamTimeoutException}：超时、网络错误、5xx 等暂时性失败</li>
 *   <li>{@link com.apifarm.common.exception.UpstreamRejectedException}：鉴权失败、额度耗尽等针对该 Key 的明确拒绝</li>
 * </ul>
 */
public interface ChatCompletionClient {

    /**
     * 使用指定 Key 发起一次阻塞式调用。
     *
     * @param request 已校验的推理请求
     * @param apiKey  上游 API Key
     * @param baseUrl 上游地址，不含 {@code /chat/completions}
     * @return 归一化后的响应
     */
    ChatCompletionResponse complete(ChatCompletionRequest request, String apiKey, String baseUrl);
}
