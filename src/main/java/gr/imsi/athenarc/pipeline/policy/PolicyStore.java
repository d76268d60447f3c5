package gr.imsi.athenarc.pipeline.policy;

import java.util.List;

/**
 * Read-only source of row-level policies. Implementations backed by remote
 * storage may throw any runtime exception; callers treat failures as denial.
 */
public interface PolicyStore {

    List<RowLevelPolicy> listPolicies(String datasourceId);
}
