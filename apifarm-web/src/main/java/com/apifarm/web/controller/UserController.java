package com.apifarm.web.controller;

import com.apifarm.common.dto.LoginResponse;
import com.apifarm.common.dto.RegisterResponse;
import com.apifarm.common.dto.UserAuthRequest;
import com.apifarm.web.security.SessionAuthInterceptor;
import com.apifarm.web.service.SessionStore;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.*;

/**
 * 用户注册、登录、注销接口。
 */
@RestController
@RequestMapping("/users")
@RequiredArgsConstructor
public class UserController {

    private final SessionStore sessionStore;

    @PostMapping("/register")
    public RegisterResponse register(@Valid @RequestBody UserAuthRequest request) {
        return new RegisterResponse(sessionStore.register(request.getUsername(), request.getPassword()));
    }

    @PostMapping("/login")
    public LoginResponse login(@Valid @RequestBody UserAuthRequest request) {
        return sessionStore.login(request.getUsername(), request.getPassword());
    }

    /**
     * 注销当前令牌（需要认证，令牌由拦截器校验后放入请求属性）。
     */
    @PostMapping("/logout")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public void logout(@RequestAttribute(SessionAuthInterceptor.TOKEN_ATTRIBUTE) String token) {
        sessionStore.logout(token);
    }
}
