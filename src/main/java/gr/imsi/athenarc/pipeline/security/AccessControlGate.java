package gr.imsi.athenarc.pipeline.security;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import gr.imsi.athenarc.pipeline.datasource.DatasourceSchema;
import gr.imsi.athenarc.pipeline.query.Filter;
import gr.imsi.athenarc.pipeline.query.Metric;
import gr.imsi.athenarc.pipeline.query.OrderBy;
import gr.imsi.athenarc.pipeline.query.QueryDescriptor;

/**
 * Checks that a principal may read every resource a descriptor references.
 * Resources are checked in a fixed order (datasource, dimensions, metrics,
 * filter columns, having and order-by columns, time column) and the first
 * failing one is reported. Only identifiers are inspected, never values.
 *
 * <p>A time grain or time range without an explicit time column reads the
 * datasource's main temporal column, which only the schema knows. That column is
 * checked separately by {@link #authorizeImplicitTimeColumn} once the schema has
 * been described.
 */
public class AccessControlGate {

    private static final Logger LOG = LoggerFactory.getLogger(AccessControlGate.class);

    private final PermissionStore permissionStore;

    public AccessControlGate(PermissionStore permissionStore) {
        this.permissionStore = permissionStore;
    }

    public AuthorizationDecision authorize(QueryDescriptor descriptor, SecurityContext context) {
        AuthorizationDecision decision = check(descriptor, context);
        if (decision.isAllowed()) {
            LOG.debug("Principal {} authorized on {}", context.getPrincipalId(), descriptor.getDatasource());
        } else {
            LOG.info("Principal {} denied on {}: {}", context.getPrincipalId(), descriptor.getDatasource(), decision.getReason());
        }
        return decision;
    }

    private AuthorizationDecision check(QueryDescriptor descriptor, SecurityContext context) {
        String datasource = descriptor.getDatasource().getId();
        if (!permissionStore.canReadDatasource(context, datasource)) {
            return AuthorizationDecision.denied("datasource:" + datasource, "No access to datasource " + datasource);
        }

        for (String dimension : descriptor.getDimensions()) {
            if (!permissionStore.canReadColumn(context, datasource, dimension)) {
                return deniedColumn(datasource, dimension);
            }
        }

        for (Metric metric : descriptor.getMetrics()) {
            if (metric.isSaved()) {
                if (!permissionStore.canReadMetric(context, datasource, metric.getLabel())) {
                    return AuthorizationDecision.denied("metric:" + datasource + "." + metric.getLabel(),
                        "No access to metric " + metric.getLabel());
                }
            } else if (metric.getColumn() != null && !permissionStore.canReadColumn(context, datasource, metric.getColumn())) {
                return deniedColumn(datasource, metric.getColumn());
            }
        }

        for (Filter filter : descriptor.getFilters()) {
            // row-level predicates are injected after this gate and carry no column
            if (!filter.isRowLevel() && !permissionStore.canReadColumn(context, datasource, filter.getColumn())) {
                return deniedColumn(datasource, filter.getColumn());
            }
        }

        Set<String> outputLabels = new HashSet<>(descriptor.getMetricLabels());
        if (descriptor.getTimeGrain().isPresent()) {
            // the bucket reads the time column, checked below
            outputLabels.add(QueryDescriptor.TIMESTAMP_LABEL);
        }
        for (String column : postAggregationColumns(descriptor)) {
            if (!outputLabels.contains(column) && !permissionStore.canReadColumn(context, datasource, column)) {
                return deniedColumn(datasource, column);
            }
        }

        if (descriptor.getTimeColumn().isPresent()) {
            String timeColumn = descriptor.getTimeColumn().get();
            if (!permissionStore.canReadColumn(context, datasource, timeColumn)) {
                return deniedColumn(datasource, timeColumn);
            }
        }
        return AuthorizationDecision.allowed();
    }

    /**
     * Checks the schema's main temporal column when the descriptor buckets or
     * restricts by time without naming a time column itself.
     */
    public AuthorizationDecision authorizeImplicitTimeColumn(QueryDescriptor descriptor, DatasourceSchema schema,
                                                             SecurityContext context) {
        boolean readsTime = descriptor.getTimeGrain().isPresent() || descriptor.getTimeRange().isPresent();
        if (!readsTime || descriptor.getTimeColumn().isPresent()) {
            return AuthorizationDecision.allowed();
        }
        Optional<String> timeColumn = schema.getMainTemporalColumn();
        if (timeColumn.isEmpty()) {
            return AuthorizationDecision.allowed();
        }
        String datasource = descriptor.getDatasource().getId();
        if (permissionStore.canReadColumn(context, datasource, timeColumn.get())) {
            return AuthorizationDecision.allowed();
        }
        AuthorizationDecision decision = deniedColumn(datasource, timeColumn.get());
        LOG.info("Principal {} denied on {}: {}", context.getPrincipalId(), descriptor.getDatasource(), decision.getReason());
        return decision;
    }

    private static List<String> postAggregationColumns(QueryDescriptor descriptor) {
        List<String> columns = new ArrayList<>();
        for (Filter having : descriptor.getHaving()) {
            columns.add(having.getColumn());
        }
        for (OrderBy orderBy : descriptor.getOrderBy()) {
            columns.add(orderBy.getColumn());
        }
        return columns;
    }

    private static AuthorizationDecision deniedColumn(String datasource, String column) {
        return AuthorizationDecision.denied("column:" + datasource + "." + column, "No access to column " + column);
    }
}
