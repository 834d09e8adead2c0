package com.portfolio.analytics.pulse.service.risk;

import com.portfolio.analytics.pulse.dto.risk.Risk;
import com.portfolio.analytics.pulse.dto.risk.RiskCategory;
import com.portfolio.analytics.pulse.model.Project;

import java.time.LocalDate;
import java.util.List;

/**
 * A side-effect-free heuristic that scans one project and reports zero or more risks.
 * Implementations return their findings sorted worst first.
 */
public interface RiskDetector {

    RiskCategory category();

    List<Risk> detect(Project project, LocalDate referenceDate);
}
