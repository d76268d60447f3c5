package gr.imsi.athenarc.pipeline.security;

import java.util.Collection;
import java.util.Set;

import com.google.common.collect.ImmutableSetMultimap;

/**
 * Permission store mapping role names to grants. A datasource grant gives access
 * to every column and metric of that datasource; column and metric grants give
 * access to the named resource only (and, through it, to the datasource).
 * Immutable once built.
 */
public class RoleBasedPermissionStore implements PermissionStore {

    private final ImmutableSetMultimap<String, Grant> grantsByRole;

    private RoleBasedPermissionStore(ImmutableSetMultimap<String, Grant> grantsByRole) {
        this.grantsByRole = grantsByRole;
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public boolean canReadDatasource(SecurityContext context, String datasourceId) {
        return context.getRoles().stream()
            .flatMap(role -> grantsByRole.get(role).stream())
            .anyMatch(grant -> grant.appliesTo(datasourceId));
    }

    @Override
    public boolean canReadColumn(SecurityContext context, String datasourceId, String column) {
        return hasGrant(context, datasourceId, Grant.Scope.COLUMN, column);
    }

    @Override
    public boolean canReadMetric(SecurityContext context, String datasourceId, String metric) {
        return hasGrant(context, datasourceId, Grant.Scope.METRIC, metric);
    }

    public Set<Grant> getGrants(String role) {
        return grantsByRole.get(role);
    }

    private boolean hasGrant(SecurityContext context, String datasourceId, Grant.Scope scope, String resource) {
        for (String role : context.getRoles()) {
            for (Grant grant : grantsByRole.get(role)) {
                if (!grant.appliesTo(datasourceId)) {
                    continue;
                }
                if (grant.getScope() == Grant.Scope.DATASOURCE) {
                    return true;
                }
                if (grant.getScope() == scope && grant.getResource().equals(resource)) {
                    return true;
                }
            }
        }
        return false;
    }

    public static class Builder {
        private final ImmutableSetMultimap.Builder<String, Grant> grants = ImmutableSetMultimap.builder();

        public Builder grant(String role, Grant grant) {
            grants.put(role, grant);
            return this;
        }

        public Builder grant(String role, Collection<Grant> roleGrants) {
            grants.putAll(role, roleGrants);
            return this;
        }

        public Builder grantDatasource(String role, String datasourceId) {
            return grant(role, Grant.datasource(datasourceId));
        }

        public Builder grantColumns(String role, String datasourceId, String... columns) {
            for (String column : columns) {
                grant(role, Grant.column(datasourceId, column));
            }
            return this;
        }

        public Builder grantMetrics(String role, String datasourceId, String... metrics) {
            for (String metric : metrics) {
                grant(role, Grant.metric(datasourceId, metric));
            }
            return this;
        }

        public Builder grantAll(String role) {
            return grant(role, Grant.all());
        }

        public RoleBasedPermissionStore build() {
            return new RoleBasedPermissionStore(grants.build());
        }
    }
}
