package com.apifarm.web.controller;

import com.apifarm.common.dto.ChatCompletionRequest;
import com.apifarm.common.dto.ChatCompletionResponse;
import com.apifarm.dispatcher.service.ProxyRouter;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

/**
 * 推理接口。公开访问，使用共享池而不是调用方自己的 Key。
 */
@Slf4j
@RestController
@RequiredArgsConstructor
public class ChatController {

    private final ProxyRouter proxyRouter;

    @PostMapping("/chat/completions")
    public ChatCompletionResponse chatCompletions(@Valid @RequestBody ChatCompletionRequest request) {
        log.info("收到推理请求, model={}, 消息数: {}", request.getModel(), request.getMessages().size());
        return proxyRouter.inference(request);
    }
}
