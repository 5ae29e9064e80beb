package com.apex.gate.service.risk;

import com.apex.gate.model.Order;
import com.apex.gate.model.PortfolioState;
import com.apex.gate.model.RiskAssessment;
import com.apex.gate.model.StrategySpec;

import java.util.List;
import java.util.Map;

public interface RiskEngine {

    RiskAssessment assess(RiskRequest request);

    default RiskAssessment assess(PortfolioState portfolio, List<Order> proposedOrders,
                                  Map<String, Double> latestPrices, List<Double> equityCurve) {
        return assess(new RiskRequest(portfolio, proposedOrders, latestPrices, equityCurve, null));
    }

    /**
     * Re-checks the risk-relevant fields of a strategy that was validated upstream.
     */
    List<String> checkStrategy(StrategySpec strategy);
}
