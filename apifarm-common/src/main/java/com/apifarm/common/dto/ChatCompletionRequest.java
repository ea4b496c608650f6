package com.apifarm.common.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * 推理请求。在接口边界做一次校验，之后各组件不再重复检查。
 * <p>
 * 采样参数均为可选，未填写时不转发给上游，由上游使用自身默认值。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ChatCompletionRequest {

    @NotBlank
    private String model;

    @NotEmpty
    private List<@Valid @NotNull ChatMessage> messages;

    @DecimalMin("0.0")
    @DecimalMax("2.0")
    private Double temperature;

    @JsonProperty("top_p")
    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private Double topP;

    @JsonProperty("max_tokens")
    @Positive
    private Integer maxTokens;
}
