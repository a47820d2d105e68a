package com.screening.engine;

import com.screening.model.DecisionStatus;
import com.screening.model.RiskTier;

public record Classification(RiskTier tier, DecisionStatus decision) {
}
