package org.nowstart.perpbot.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.nowstart.perpbot.data.dto.IndicatorSnapshot;
import org.nowstart.perpbot.data.dto.MlScore;
import org.nowstart.perpbot.data.dto.MlScoreRequest;
import org.nowstart.perpbot.data.dto.MlScoreResponse;
import org.nowstart.perpbot.data.type.TradeSide;
import org.nowstart.perpbot.fixture.IndicatorFixtures;
import org.nowstart.perpbot.fixture.PropertyFixtures;
import org.nowstart.perpbot.repository.MlScorerFeignClient;

@ExtendWith(MockitoExtension.class)
class ConfidenceScoringServiceTest {

    private static final IndicatorSnapshot ETH = IndicatorFixtures.quiet("ETH", 2000, 25);

    @Mock
    private MlScorerFeignClient mlScorerFeignClient;

    @Test
    void scoreSignal_disabled_isUnavailableWithoutCall() {
        ConfidenceScoringService service = new ConfidenceScoringService(
                mlScorerFeignClient,
                PropertyFixtures.integration(false, false, false, false)
        );

        MlScore score = service.scoreSignal("ETH", TradeSide.LONG, "R1-mean-reversion", ETH, null);

        assertThat(score.isPresent()).isFalse();
        verifyNoInteractions(mlScorerFeignClient);
    }

    @Test
    void scoreSignal_scorerAnswers_returnsScoreAndSamples() {
        when(mlScorerFeignClient.score(any())).thenReturn(new MlScoreResponse(0.71, 240, null));

        MlScore score = enabledService().scoreSignal("ETH", TradeSide.LONG, "R1-mean-reversion", ETH, null);

        assertThat(score.score()).isEqualTo(0.71);
        assertThat(score.modelSamples()).isEqualTo(240);
    }

    @Test
    void scoreSignal_scorerReportsError_isUnavailable() {
        when(mlScorerFeignClient.score(any())).thenReturn(new MlScoreResponse(null, null, "model not trained"));

        assertThat(enabledService().scoreSignal("ETH", TradeSide.LONG, "R1-mean-reversion", ETH, null).isPresent()).isFalse();
    }

    @Test
    void scoreSignal_scorerTimesOut_isUnavailable() {
        when(mlScorerFeignClient.score(any())).thenThrow(new IllegalStateException("Read timed out"));

        assertThat(enabledService().scoreSignal("ETH", TradeSide.LONG, "R1-mean-reversion", ETH, null).isPresent()).isFalse();
    }

    @Test
    void toRequest_withSentiment_carriesSocialFeatures() {
        MlScoreRequest request = ConfidenceScoringService.toRequest(
                "ETH",
                TradeSide.SHORT,
                "R2-mean-reversion",
                ETH,
                IndicatorFixtures.sentiment("ETH", 64, 38, 1000, 12)
        );

        assertThat(request.side()).isEqualTo("short");
        assertThat(request.regime()).isEqualTo("quiet");
        assertThat(request.atr_pct()).isCloseTo(0.01, within(1e-12));
        assertThat(request.galaxy_score()).isEqualTo(64);
        assertThat(request.sentiment_pct()).isEqualTo(38);
        assertThat(request.alt_rank()).isEqualTo(12);
    }

    private ConfidenceScoringService enabledService() {
        return new ConfidenceScoringService(mlScorerFeignClient, PropertyFixtures.integration(false, true, false, false));
    }
}
