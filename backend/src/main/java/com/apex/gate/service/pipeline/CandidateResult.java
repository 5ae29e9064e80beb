package com.apex.gate.service.pipeline;

import com.apex.gate.model.BacktestResult;
import com.apex.gate.model.Fill;
import com.apex.gate.model.GatingResult;
import com.apex.gate.model.Order;
import com.apex.gate.model.QualityReport;
import com.apex.gate.model.RiskAssessment;
import com.apex.gate.model.StrategySpec;
import com.apex.gate.model.WalkForwardResult;

import java.util.List;
import java.util.Map;

/**
 * Everything a run produced. Later stages failing never clears the results of earlier ones.
 */
public record CandidateResult(
        String runId,
        StrategySpec strategy,
        Map<String, QualityReport> dataQuality,
        BacktestResult backtest,
        WalkForwardResult validation,
        GatingResult gating,
        List<Order> proposedOrders,
        RiskAssessment risk,
        String broker,
        List<Fill> executionFills,
        String executionError
) {

    public CandidateResult {
        dataQuality = dataQuality == null ? Map.of() : dataQuality;
        proposedOrders = proposedOrders == null ? List.of() : List.copyOf(proposedOrders);
        executionFills = executionFills == null ? List.of() : List.copyOf(executionFills);
    }

    public boolean executed() {
        return !executionFills.isEmpty();
    }
}
