package org.endlesssource.playtally.sync;

/**
 * Summary of one reconciliation pass.
 *
 * @param tracksProcessed     catalog tracks examined
 * @param tracksCreated       tracks seen for the first time (no play facts created for them)
 * @param playFactsCreated    new counter-sync play facts
 * @param liveCreditsAbsorbed counter increments matched to earlier live plays
 * @param counterResets       tracks whose system counter went backwards
 * @param batchesCommitted    store commits performed
 */
public record ReconciliationReport(int tracksProcessed,
                                   int tracksCreated,
                                   int playFactsCreated,
                                   int liveCreditsAbsorbed,
                                   int counterResets,
                                   int batchesCommitted) {

    public static ReconciliationReport empty() {
        return new ReconciliationReport(0, 0, 0, 0, 0, 0);
    }

    public boolean createdPlayFacts() {
        return playFactsCreated > 0;
    }
}
