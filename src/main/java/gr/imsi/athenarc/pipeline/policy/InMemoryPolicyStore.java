package gr.imsi.athenarc.pipeline.policy;

import java.util.Collection;
import java.util.List;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableListMultimap;

/**
 * Immutable policy store holding its policies indexed by datasource.
 */
public class InMemoryPolicyStore implements PolicyStore {

    private final ImmutableListMultimap<String, RowLevelPolicy> policies;

    public InMemoryPolicyStore(Collection<RowLevelPolicy> policies) {
        ImmutableListMultimap.Builder<String, RowLevelPolicy> builder = ImmutableListMultimap.builder();
        for (RowLevelPolicy policy : policies) {
            builder.put(policy.getDatasourceId(), policy);
        }
        this.policies = builder.build();
    }

    public static InMemoryPolicyStore of(RowLevelPolicy... policies) {
        return new InMemoryPolicyStore(ImmutableList.copyOf(policies));
    }

    public static InMemoryPolicyStore empty() {
        return new InMemoryPolicyStore(ImmutableList.of());
    }

    @Override
    public List<RowLevelPolicy> listPolicies(String datasourceId) {
        return policies.get(datasourceId);
    }
}
