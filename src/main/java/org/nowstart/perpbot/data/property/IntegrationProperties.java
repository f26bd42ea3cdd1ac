package org.nowstart.perpbot.data.property;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "perpbot.integration")
public record IntegrationProperties(
        @Valid @NotNull @DefaultValue Sentiment sentiment,
        @Valid @NotNull @DefaultValue MlScorer mlScorer,
        @Valid @NotNull @DefaultValue TradeLog tradeLog,
        @Valid @NotNull @DefaultValue Ntfy ntfy
) {

    public record Sentiment(
            // LunarCrush 감성 데이터 사용 여부
            @DefaultValue("false") boolean enabled,
            // LunarCrush API 기본 URL
            @NotBlank @DefaultValue("https://lunarcrush.com") String baseUrl,
            // LunarCrush Bearer API 키
            @DefaultValue("") String apiKey
    ) {
        public boolean usable() {
            return enabled && !apiKey.isBlank();
        }
    }

    public record MlScorer(
            // ML 신뢰도 스코어러 사용 여부
            @DefaultValue("false") boolean enabled,
            // ML 스코어러 기본 URL
            @NotBlank @DefaultValue("http://localhost:8100") String baseUrl
    ) {
    }

    public record TradeLog(
            // 거래/세션 기록 백엔드 사용 여부
            @DefaultValue("true") boolean enabled,
            // 거래 기록 백엔드 기본 URL
            @NotBlank @DefaultValue("http://localhost:3000") String baseUrl,
            // 세션 등록 시 사용하는 환경 이름
            @NotBlank @DefaultValue("mainnet") String env
    ) {
    }

    public record Ntfy(
            // 푸시 알림 사용 여부
            @DefaultValue("false") boolean enabled,
            // ntfy 서버 기본 URL
            @NotBlank @DefaultValue("https://ntfy.sh") String baseUrl,
            // ntfy 토픽 이름
            @DefaultValue("") String topic
    ) {
        public boolean usable() {
            return enabled && !topic.isBlank();
        }
    }
}
