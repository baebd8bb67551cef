package net.keygate.web.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

public class AcquireRequest {

    @NotNull(message = "productId is required")
    private Long productId;

    /** 설치 대상 호스트 식별자 */
    @NotBlank(message = "holder is required")
    private String holder;

    public Long getProductId() {
        return productId;
    }

    public void setProductId(Long productId) {
        this.productId = productId;
    }

    public String getHolder() {
        return holder;
    }

    public void setHolder(String holder) {
        this.holder = holder;
    }
}
