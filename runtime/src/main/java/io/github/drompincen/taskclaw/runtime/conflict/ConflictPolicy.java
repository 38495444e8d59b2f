package io.github.drompincen.taskclaw.runtime.conflict;

import io.github.drompincen.taskclaw.persistence.document.SessionConfigDocument;
import io.github.drompincen.taskclaw.protocol.error.ErrorCode;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Decides whether a classified conflict blocks a claim, given the registry's config.
 */
@Component
public class ConflictPolicy {

    public PolicyDecision evaluate(ConflictVerdict verdict, SessionConfigDocument config) {
        return switch (verdict.type()) {
            case NONE -> PolicyDecision.allow(verdict);
            case HARD -> PolicyDecision.block(ErrorCode.TASK_CLAIMED, verdict);
            case IDENTICAL -> PolicyDecision.block(ErrorCode.SCOPE_CONFLICT, verdict);
            case NESTED -> config.isAllowNestedScopes()
                    ? PolicyDecision.warn(verdict)
                    : PolicyDecision.block(ErrorCode.SCOPE_CONFLICT, verdict);
            case PARTIAL -> config.isAllowScopeOverlap()
                    ? PolicyDecision.warn(verdict)
                    : PolicyDecision.block(ErrorCode.SCOPE_CONFLICT, verdict);
        };
    }

    /**
     * Evaluates verdicts against several sessions. The first refusal wins; otherwise the
     * claim is allowed with the warnings of every tolerated overlap.
     */
    public List<PolicyDecision> evaluateAll(List<ConflictVerdict> verdicts, SessionConfigDocument config) {
        List<PolicyDecision> decisions = new ArrayList<>();
        for (ConflictVerdict verdict : verdicts) {
            PolicyDecision decision = evaluate(verdict, config);
            if (!decision.allowed()) {
                return List.of(decision);
            }
            decisions.add(decision);
        }
        return decisions;
    }
}
