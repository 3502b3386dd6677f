package me.golemcore.toolrouter.domain.model;

import me.golemcore.toolrouter.domain.exception.NoEligibleCandidateException;

import java.util.List;

/**
 * Output of the policy filter: surviving candidates in their original order and
 * the reason each removed candidate was dropped.
 */
public record PolicyFilterResult(String capability, List<Candidate> eligible, List<PolicyRejection> rejections) {

    public boolean isEmpty() {
        return eligible.isEmpty();
    }

    /**
     * Returns the eligible candidates, or throws when the filter removed all of
     * them.
     *
     * @throws NoEligibleCandidateException
     *             if no candidate survived
     */
    public List<Candidate> orElseThrow() {
        if (eligible.isEmpty()) {
            throw new NoEligibleCandidateException(capability, rejections);
        }
        return eligible;
    }
}
