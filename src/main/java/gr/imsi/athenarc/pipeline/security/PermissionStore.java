package gr.imsi.athenarc.pipeline.security;

/**
 * Read-only view of the permissions held by principals. Passed explicitly to the
 * {@link AccessControlGate}; implementations must be safe for concurrent reads.
 */
public interface PermissionStore {

    /**
     * @return true if the principal may read anything at all from the datasource
     */
    boolean canReadDatasource(SecurityContext context, String datasourceId);

    boolean canReadColumn(SecurityContext context, String datasourceId, String column);

    boolean canReadMetric(SecurityContext context, String datasourceId, String metric);
}
