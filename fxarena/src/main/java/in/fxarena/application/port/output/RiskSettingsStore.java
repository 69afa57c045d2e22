package in.fxarena.application.port.output;

import in.fxarena.domain.risk.RiskThresholds;

public interface RiskSettingsStore {
    RiskThresholds getRiskThresholds();
}
