package org.nowstart.perpbot.data.property;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "perpbot.exchange")
public record ExchangeProperties(
        // Hyperliquid REST API 기본 URL
        @NotBlank @DefaultValue("https://api.hyperliquid.xyz") String baseUrl,
        // 테스트넷 여부(서명 source 값에 반영)
        @DefaultValue("false") boolean testnet,
        // 주문 서명용 secp256k1 개인키(hex)
        @DefaultValue("") String privateKey,
        // 포지션/잔고 조회 대상 계정 주소
        @DefaultValue("") String accountAddress,
        // 시장가 주문 슬리피지(bps)
        @Min(0) @DefaultValue("50") int slippageBps
) {

    public boolean hasCredentials() {
        return !privateKey.isBlank() && !accountAddress.isBlank();
    }
}
