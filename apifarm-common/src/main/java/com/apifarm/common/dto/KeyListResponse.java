package com.apifarm.common.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * 当前用户名下的 Key 列表（按添加顺序）。
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class KeyListResponse {

    private List<String> keys;
}
