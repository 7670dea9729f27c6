package com.parley.messages.pipeline.check;

import com.parley.messages.model.Message;
import com.parley.messages.pipeline.MessageCheck;
import com.parley.messages.pipeline.PipelineContext;
import com.parley.messages.pipeline.Veto;
import com.parley.messages.pipeline.VetoKind;
import lombok.extern.slf4j.Slf4j;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Applies the constraint policy named by the current config snapshot.
 * Unknown policy names are logged once and treated as {@code none}.
 */
@Slf4j
public class ConstraintCheck implements MessageCheck {

    private final Map<String, ConstraintPolicy> policies = new LinkedHashMap<>();
    private final Set<String> reportedUnknown = ConcurrentHashMap.newKeySet();

    public ConstraintCheck(List<ConstraintPolicy> policies) {
        for (ConstraintPolicy policy : policies) {
            this.policies.put(policy.name(), policy);
        }
    }

    /**
     * The built-in policies: none, max-length and send-rate.
     */
    public static ConstraintCheck withDefaultPolicies() {
        return new ConstraintCheck(List.of(new NoConstraintPolicy(), new MaxLengthPolicy(), new SendRatePolicy()));
    }

    public Set<String> policyNames() {
        return policies.keySet();
    }

    @Override
    public CompletableFuture<Optional<Veto>> check(Message message, PipelineContext context) {
        String name = context.config().getConstraintPolicy();
        ConstraintPolicy policy = policies.get(name);
        if (policy == null) {
            if (reportedUnknown.add(name)) {
                log.warn("Unknown constraint policy '{}', not enforcing any constraint", name);
            }
            return CompletableFuture.completedFuture(Optional.empty());
        }
        Optional<Veto> veto = policy.evaluate(message, context)
                .map(v -> new Veto(VetoKind.CONSTRAINT_EXCEEDED, v.code(), v.reason()));
        return CompletableFuture.completedFuture(veto);
    }
}
