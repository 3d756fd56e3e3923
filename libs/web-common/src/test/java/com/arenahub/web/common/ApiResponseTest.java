package com.arenahub.web.common;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class ApiResponseTest {

    private final ObjectMapper mapper = new ObjectMapper();

    @Test
    void successCarriesDataAndOkCode() {
        ApiResponse<String> r = ApiResponse.success("payload");
        assertThat(r.code()).isEqualTo(200);
        assertThat(r.isOk()).isTrue();
        assertThat(r.data()).isEqualTo("payload");
    }

    @Test
    void errorFactoriesHaveNoData() {
        assertThat(ApiResponse.notFound("会话不存在").code()).isEqualTo(404);
        assertThat(ApiResponse.conflict("x").isOk()).isFalse();
        assertThat(ApiResponse.badRequest("x").data()).isNull();
    }

    @Test
    void nullDataIsOmittedFromJson() throws Exception {
        String json = mapper.writeValueAsString(ApiResponse.badRequest("参数错误"));
        assertThat(json).doesNotContain("data").doesNotContain("ok").contains("\"code\":400");
    }
}
