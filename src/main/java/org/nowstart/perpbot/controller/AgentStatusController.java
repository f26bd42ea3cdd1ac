package org.nowstart.perpbot.controller;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import java.util.List;
import org.nowstart.perpbot.data.dto.AgentStatusDto;
import org.nowstart.perpbot.data.dto.NearMiss;
import org.nowstart.perpbot.data.dto.RuleStats;
import org.nowstart.perpbot.service.AgentStatusService;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/agent")
@Tag(name = "Agent", description = "트레이딩 에이전트 세션 상태, 니어미스, 규칙별 성과 조회 API")
public class AgentStatusController {

    private final AgentStatusService agentStatusService;

    public AgentStatusController(AgentStatusService agentStatusService) {
        this.agentStatusService = agentStatusService;
    }

    @GetMapping("/status")
    @Operation(summary = "세션 상태 조회", description = "실행 모드, 사이클 수, 보유 코인, 실현 손익, 변동성 상태를 조회합니다.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "조회 성공")
    })
    public AgentStatusDto getStatus() {
        return agentStatusService.status();
    }

    @GetMapping("/near-misses")
    @Operation(summary = "니어미스 조회", description = "차단된 진입 후보를 최신순으로 조회합니다. limit은 1~100입니다.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "조회 성공"),
            @ApiResponse(responseCode = "400", description = "limit 범위 오류")
    })
    public List<NearMiss> getNearMisses(@RequestParam(value = "limit", defaultValue = "20") int limit) {
        return agentStatusService.recentNearMisses(limit);
    }

    @GetMapping("/rules")
    @Operation(summary = "규칙별 성과 조회", description = "진입 규칙별 승/패, 누적 손익을 조회합니다.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "조회 성공")
    })
    public List<RuleStats> getRules() {
        return agentStatusService.ruleStats();
    }
}
