package ai.proofs.prover.search;

/**
 * Counters collected over one top-level search.
 */
public final class SearchStats {
    private int statesEntered;
    private int statesDominated;
    private int branchesTried;
    private int branchesSucceeded;
    private int oracleCalls;

    void stateEntered() {
        statesEntered++;
    }

    void stateDominated() {
        statesDominated++;
    }

    void branchTried() {
        branchesTried++;
    }

    void branchSucceeded() {
        branchesSucceeded++;
    }

    void oracleCalled() {
        oracleCalls++;
    }

    public int getStatesEntered() {
        return statesEntered;
    }

    public int getStatesDominated() {
        return statesDominated;
    }

    public int getBranchesTried() {
        return branchesTried;
    }

    public int getBranchesSucceeded() {
        return branchesSucceeded;
    }

    public int getOracleCalls() {
        return oracleCalls;
    }

    @Override
    public String toString() {
        return "states=" + statesEntered
                + ", dominated=" + statesDominated
                + ", branches=" + branchesSucceeded + "/" + branchesTried
                + ", oracleCalls=" + oracleCalls;
    }
}
