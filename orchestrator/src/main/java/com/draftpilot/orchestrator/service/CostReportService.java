package com.draftpilot.orchestrator.service;

import com.draftpilot.orchestrator.model.CostLedgerEntry;
import com.draftpilot.orchestrator.model.PipelinePhase;
import com.draftpilot.orchestrator.model.QualityPreference;
import com.draftpilot.orchestrator.provider.Backend;
import com.draftpilot.orchestrator.provider.CostTable;
import com.draftpilot.orchestrator.provider.ProviderRouter;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Cost reporting: per-job spend from the ledger and up-front estimates from
 * the router's static tables.
 */
@Service
public class CostReportService {

    private static final BigDecimal RANGE = new BigDecimal("0.20");

    private static final List<PipelinePhase> GENERATING_PHASES =
            List.of(PipelinePhase.RESEARCH, PipelinePhase.DRAFT, PipelinePhase.FORMAT);

    private final JobStore       store;
    private final ProviderRouter router;

    public CostReportService(JobStore store, ProviderRouter router) {
        this.store  = store;
        this.router = router;
    }

    /** Soft-deleted jobs are included: their ledger is kept for billing. */
    public CostBreakdown breakdown(UUID jobId) {
        if (store.findIncludingDeleted(jobId).isEmpty()) {
            throw new JobNotFoundException(jobId);
        }
        List<CostLedgerEntry> entries = store.ledger(jobId);

        BigDecimal total = zero();
        Map<String, BigDecimal> byPhase   = new LinkedHashMap<>();
        Map<String, BigDecimal> byBackend = new LinkedHashMap<>();
        long tokens = 0;
        int estimated = 0;
        for (CostLedgerEntry e : entries) {
            total = total.add(e.getCost());
            byPhase.merge(e.getPhase().name(), e.getCost(), BigDecimal::add);
            byBackend.merge(e.getBackend(), e.getCost(), BigDecimal::add);
            tokens += e.totalTokens();
            if (e.isEstimated()) {
                estimated++;
            }
        }
        return new CostBreakdown(jobId, total, byPhase, byBackend, tokens, entries.size(), estimated);
    }

    /**
     * Estimate for one pass through research, draft and format with the
     * first-choice backend of each, ignoring refinement rounds.
     */
    public CostEstimate estimate(QualityPreference preference) {
        QualityPreference pref = preference == null ? QualityPreference.BALANCED : preference;
        Map<String, String>     backends = new LinkedHashMap<>();
        Map<String, BigDecimal> costs    = new LinkedHashMap<>();
        BigDecimal total = zero();

        for (PipelinePhase phase : GENERATING_PHASES) {
            Backend first = router.select(phase, null, pref).get(0);
            BigDecimal cost = router.estimateCost(phase, first, null);
            backends.put(phase.name(), first.id());
            costs.put(phase.name(), cost);
            total = total.add(cost);
        }

        BigDecimal low  = total.multiply(BigDecimal.ONE.subtract(RANGE)).setScale(CostTable.COST_SCALE, RoundingMode.HALF_UP);
        BigDecimal high = total.multiply(BigDecimal.ONE.add(RANGE)).setScale(CostTable.COST_SCALE, RoundingMode.HALF_UP);
        return new CostEstimate(pref, backends, costs, total, low, high);
    }

    private static BigDecimal zero() {
        return BigDecimal.ZERO.setScale(CostTable.COST_SCALE);
    }
}
