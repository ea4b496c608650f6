package com.apifarm.common.dto;

import com.fasterxml.jackson.annotation.JsonAlias;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 添加 API Key 请求。
 * <p>
 * 兼容旧版客户端的字段名 {@code api_key} / {@code base_url}。
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class AddKeyRequest {

    @NotBlank
    @Size(max = 512)
    @JsonAlias("api_key")
    private String value;

    /** 自定义上游地址（可选），为空时使用默认地址 */
    @Pattern(regexp = "^$|^https?://\\S+$", message = "必须是 http(s) 地址")
    @JsonAlias("base_url")
    private String endpoint;
}
