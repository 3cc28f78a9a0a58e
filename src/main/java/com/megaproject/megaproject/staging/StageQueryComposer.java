package com.megaproject.megaproject.staging;

import com.megaproject.megaproject.query.AliasGenerator;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Chains the pipeline steps into one query. Each call gets its own {@link AliasGenerator}.
 */
@Component
public class StageQueryComposer {

    private final UnionReconciler unionReconciler;
    private final ScheduleReconciler scheduleReconciler;
    private final ReferenceNormalizer referenceNormalizer;
    private final RatioDeriver ratioDeriver;
    private final CitationAggregator citationAggregator;

    public StageQueryComposer(UnionReconciler unionReconciler,
                              ScheduleReconciler scheduleReconciler,
                              ReferenceNormalizer referenceNormalizer,
                              RatioDeriver ratioDeriver,
                              CitationAggregator citationAggregator) {
        this.unionReconciler = unionReconciler;
        this.scheduleReconciler = scheduleReconciler;
        this.referenceNormalizer = referenceNormalizer;
        this.ratioDeriver = ratioDeriver;
        this.citationAggregator = citationAggregator;
    }

    /**
     * Union, schedule fill, cost normalization, ratios and citations over the raw tables of one asset class.
     */
    public ReconciledQuery composeStage(List<SourceTable> rawTables) {
        AliasGenerator aliases = new AliasGenerator();
        ReconciledQuery query = unionReconciler.reconcile(rawTables, aliases);
        query = scheduleReconciler.reconcile(query, aliases);
        query = referenceNormalizer.normalize(query, aliases);
        query = ratioDeriver.derive(query, aliases);
        return citationAggregator.aggregate(query, aliases);
    }

    /**
     * Union of all staged tables of one status, tagged with the asset class each row came from.
     */
    public ReconciledQuery composeProduction(List<SourceTable> stagedTables) {
        return unionReconciler.reconcile(stagedTables, StagingConstants.PROVENANCE_COLUMN, new AliasGenerator());
    }
}
