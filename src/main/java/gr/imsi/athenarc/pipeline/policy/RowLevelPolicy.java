package gr.imsi.athenarc.pipeline.policy;

import java.util.Objects;
import java.util.Set;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableSet;

/**
 * A mandatory predicate template attached to a datasource and to the roles it
 * constrains. Templates reference context attributes as {@code {name}}, e.g.
 * {@code region = {user_region}}.
 */
public final class RowLevelPolicy {

    private final String name;
    private final String datasourceId;
    private final String predicateTemplate;
    private final Set<String> roles;

    public RowLevelPolicy(String name, String datasourceId, String predicateTemplate, Set<String> roles) {
        Preconditions.checkArgument(name != null && !name.isBlank(), "Policy name is required");
        Preconditions.checkArgument(datasourceId != null, "Policy %s has no datasource", name);
        Preconditions.checkArgument(predicateTemplate != null && !predicateTemplate.isBlank(),
            "Policy %s has an empty predicate", name);
        this.name = name;
        this.datasourceId = datasourceId;
        this.predicateTemplate = predicateTemplate;
        this.roles = roles == null ? ImmutableSet.of() : ImmutableSet.copyOf(roles);
    }

    public static RowLevelPolicy of(String name, String datasourceId, String predicateTemplate, String... roles) {
        return new RowLevelPolicy(name, datasourceId, predicateTemplate, ImmutableSet.copyOf(roles));
    }

    public String getName() {
        return name;
    }

    public String getDatasourceId() {
        return datasourceId;
    }

    public String getPredicateTemplate() {
        return predicateTemplate;
    }

    public Set<String> getRoles() {
        return roles;
    }

    public boolean appliesTo(String datasource, Set<String> principalRoles) {
        if (!datasourceId.equals(datasource)) {
            return false;
        }
        for (String role : principalRoles) {
            if (roles.contains(role)) {
                return true;
            }
        }
        return false;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof RowLevelPolicy)) return false;
        RowLevelPolicy that = (RowLevelPolicy) o;
        return name.equals(that.name) && datasourceId.equals(that.datasourceId)
            && predicateTemplate.equals(that.predicateTemplate) && roles.equals(that.roles);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, datasourceId, predicateTemplate, roles);
    }

    @Override
    public String toString() {
        return "RowLevelPolicy{" + name + " on " + datasourceId + " for " + roles + '}';
    }
}
