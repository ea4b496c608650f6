package com.apifarm.common.util;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class SecretsTest {

    @Test
    void shouldKeepOnlyThePrefix() {
        assertThat(Secrets.mask("nvapi-abcdef123456")).isEqualTo("nvapi-ab***");
    }

    @Test
    void shouldHideShortAndMissingValues() {
        assertThat(Secrets.mask("sk-1")).isEqualTo("***");
        assertThat(Secrets.mask("12345678")).isEqualTo("***");
        assertThat(Secrets.mask(null)).isEqualTo("***");
    }
}
