package com.apifarm.web.controller;

import com.apifarm.common.dto.AddKeyRequest;
import com.apifarm.common.dto.AddKeyResponse;
import com.apifarm.common.dto.KeyListResponse;
import com.apifarm.common.dto.RemoveKeyRequest;
import com.apifarm.dispatcher.pool.CredentialPool;
import com.apifarm.dispatcher.pool.PoolStats;
import com.apifarm.web.security.SessionAuthInterceptor;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.*;

/**
 * API Key 管理接口。所有操作只作用于当前登录用户名下的 Key。
 */
@RestController
@RequestMapping("/keys")
@RequiredArgsConstructor
public class KeyController {

    private final CredentialPool credentialPool;

    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    public AddKeyResponse addKey(@RequestAttribute(SessionAuthInterceptor.USER_ID_ATTRIBUTE) Long userId,
                                 @Valid @RequestBody AddKeyRequest request) {
        String endpoint = request.getEndpoint() != null && !request.getEndpoint().isBlank()
                ? request.getEndpoint().trim()
                : null;
        return new AddKeyResponse(credentialPool.add(userId, request.getValue().trim(), endpoint));
    }

    @GetMapping
    public KeyListResponse listKeys(@RequestAttribute(SessionAuthInterceptor.USER_ID_ATTRIBUTE) Long userId) {
        return new KeyListResponse(credentialPool.list(userId));
    }

    @DeleteMapping
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public void removeKey(@RequestAttribute(SessionAuthInterceptor.USER_ID_ATTRIBUTE) Long userId,
                          @Valid @RequestBody RemoveKeyRequest request) {
        credentialPool.remove(userId, request.getValue().trim());
    }

    /**
     * 全池各状态数量，不含任何 Key 值。
     */
    @GetMapping("/stats")
    public PoolStats stats() {
        return credentialPool.stats();
    }
}
