package org.tanzu.commcellsdk.activate;

/**
 * States reported by the eDiscovery crawl job status.
 */
public enum CrawlJobState {
    RUNNING(0, false),
    COMPLETE(1, true),
    COMPLETE_WITH_ERROR(2, true),
    STOPPING(3, true),
    STOPPED(4, true),
    ABORTING(5, true),
    ABORTED(6, true),
    EXCEPTION(7, true),
    UNKNOWN(8, true),
    SYNCING(9, true),
    PENDING(10, true);

    private final int code;
    private final boolean terminal;

    CrawlJobState(int code, boolean terminal) {
        this.code = code;
        this.terminal = terminal;
    }

    public int getCode() {
        return code;
    }

    public boolean isTerminal() {
        return terminal;
    }

    public boolean isFailed() {
        return code >= STOPPING.code;
    }

    /**
     * @return the state, or {@link #RUNNING} for codes without a terminal meaning
     */
    public static CrawlJobState fromCode(int code) {
        for (CrawlJobState state : values()) {
            if (state.code == code) {
                return state;
            }
        }
        return RUNNING;
    }
}
