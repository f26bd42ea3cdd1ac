package org.nowstart.perpbot.data.property;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import java.time.Duration;
import java.util.List;
import org.nowstart.perpbot.data.type.ExecutionMode;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "perpbot.agent")
public record AgentProperties(
        // 주문 실행 모드(LIVE 또는 PAPER, PAPER는 주문 없이 가상 체결)
        @NotNull @DefaultValue("PAPER") ExecutionMode executionMode,
        // 루프 기본 실행 주기
        @NotNull @DefaultValue("5m") Duration interval,
        // 스캔 대상 코인 목록
        @NotEmpty @DefaultValue({"BTC", "ETH", "SOL", "SUI", "DOGE"}) List<String> coins,
        // 동시 보유 가능한 최대 포지션 수
        @Positive @DefaultValue("3") int maxPositions,
        // 진입 1건당 가용 잔고 대비 최대 증거금 비율(%)
        @DecimalMin(value = "0", inclusive = false) @DecimalMax("100") @DefaultValue("20") double maxAllocPct,
        // 기본 레버리지(코인별 최대 레버리지로 제한)
        @Positive @DefaultValue("3") int leverage,
        // 세션 누적 실현 손실 한도(USD)
        @DecimalMin(value = "0", inclusive = false) @DefaultValue("30") double circuitBreakerUsd,
        // 세션 최대 실행 시간
        @DecimalMin(value = "0", inclusive = false) @DefaultValue("24") double sessionHours,
        // 역추세(contrarian) 전환 확률(%), 0이면 비활성
        @DecimalMin("0") @DecimalMax("100") @DefaultValue("20") double contrarianPct,
        // 변동성 기반 주기 단축 사용 여부
        @DefaultValue("true") boolean volatilityDetection,
        // PAPER 모드 시작 가상 잔고(USD)
        @DecimalMin(value = "0", inclusive = false) @DefaultValue("200") double paperBalance,
        // contrarian 난수 시드(미설정 시 비결정적)
        Long contrarianSeed,
        // 니어미스 교훈 마크다운 저장 경로
        @NotBlank @DefaultValue("knowledge/live-trading-lessons.md") String lessonsFile,
        // 청산 거래 학습 데이터(JSONL) 저장 경로
        @NotBlank @DefaultValue("ml/data/live_trades.jsonl") String trainingDataFile,
        // 세션 ID 접두사
        @NotBlank @DefaultValue("agent") String sessionPrefix,
        // 연속 실패 시 휴지 시간
        @NotNull @DefaultValue("5m") Duration errorCooldown,
        // 외부 호출 재시도 횟수(첫 시도 제외)
        @Min(0) @DefaultValue("2") int retryAttempts,
        // 외부 호출 재시도 간격
        @NotNull @DefaultValue("3s") Duration retryDelay
) {

    public long contrarianSlots() {
        return (long) Math.ceil(maxPositions * contrarianPct / 100.0);
    }
}
