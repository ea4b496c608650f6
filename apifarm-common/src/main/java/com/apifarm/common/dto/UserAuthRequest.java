package com.apifarm.common.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 注册与登录共用的请求体。
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class UserAuthRequest {

    @NotBlank
    @Size(max = 64)
    private String username;

    @NotBlank
    @Size(max = 128)
    private String password;

    @Override
    public String toString() {
        return "UserAuthRequest(username=" + username + ")";
    }
}
