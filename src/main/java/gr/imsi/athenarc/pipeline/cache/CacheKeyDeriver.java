package gr.imsi.athenarc.pipeline.cache;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.hash.Hashing;

import gr.imsi.athenarc.pipeline.query.DatasourceRef;
import gr.imsi.athenarc.pipeline.query.Filter;
import gr.imsi.athenarc.pipeline.query.Metric;
import gr.imsi.athenarc.pipeline.query.OrderBy;
import gr.imsi.athenarc.pipeline.query.PostProcessingOperation;
import gr.imsi.athenarc.pipeline.query.QueryDescriptor;
import gr.imsi.athenarc.pipeline.security.SecurityContext;

/**
 * Derives cache fingerprints. A fingerprint is
 * {@code qp:<kind>:<datasourceId>:<sha256>} where the hash covers a canonical JSON
 * rendering of the pipeline version, the datasource, the principal, its sorted
 * roles and every field of the (policy-augmented) descriptor in a fixed order.
 * Extras are rendered with sorted keys; post-processing options keep their
 * order because it can be significant (sort keys, column renames).
 */
public class CacheKeyDeriver {

    public static final String PREFIX = "qp";

    private final ObjectMapper mapper;

    public CacheKeyDeriver() {
        this(new ObjectMapper());
    }

    public CacheKeyDeriver(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    public String deriveKey(QueryDescriptor descriptor, DatasourceRef datasource, SecurityContext context, int pipelineVersion) {
        String canonical = canonicalForm(descriptor, datasource, context, pipelineVersion);
        String hash = Hashing.sha256().hashUnencodedChars(canonical).toString();
        return prefixOf(datasource) + hash;
    }

    /**
     * @return the fingerprint prefix shared by every key of the datasource
     */
    public static String prefixOf(DatasourceRef datasource) {
        return PREFIX + ":" + datasource.getKind() + ":" + datasource.getId() + ":";
    }

    String canonicalForm(QueryDescriptor descriptor, DatasourceRef datasource, SecurityContext context, int pipelineVersion) {
        Map<String, Object> document = new LinkedHashMap<>();
        document.put("version", pipelineVersion);
        document.put("datasource_kind", datasource.getKind());
        document.put("datasource", datasource.getId());
        document.put("principal", context.getPrincipalId());
        document.put("roles", new ArrayList<>(context.getSortedRoles()));

        document.put("dimensions", descriptor.getDimensions());
        List<Object> metrics = new ArrayList<>();
        for (Metric metric : descriptor.getMetrics()) {
            Map<String, Object> node = new LinkedHashMap<>();
            node.put("label", metric.getLabel());
            node.put("column", metric.getColumn());
            node.put("aggregate", metric.getAggregation() == null ? null : metric.getAggregation().name());
            metrics.add(node);
        }
        document.put("metrics", metrics);
        document.put("filters", filters(descriptor.getFilters()));
        document.put("where", descriptor.getWhere().orElse(null));
        document.put("having", filters(descriptor.getHaving()));
        List<Object> orderBy = new ArrayList<>();
        for (OrderBy order : descriptor.getOrderBy()) {
            orderBy.add(List.of(order.getColumn(), order.getDirection().name()));
        }
        document.put("orderby", orderBy);
        document.put("row_limit", descriptor.getRowLimit().orElse(null));
        document.put("row_offset", descriptor.getRowOffset().orElse(null));
        document.put("time_column", descriptor.getTimeColumn().orElse(null));
        document.put("time_grain", descriptor.getTimeGrain().map(Enum::name).orElse(null));
        document.put("time_from", descriptor.getTimeRange().map(range -> canonicalValue(range.getFrom(), true)).orElse(null));
        document.put("time_to", descriptor.getTimeRange().map(range -> canonicalValue(range.getTo(), true)).orElse(null));
        document.put("extras", canonicalValue(descriptor.getExtras(), true));
        List<Object> operations = new ArrayList<>();
        for (PostProcessingOperation operation : descriptor.getPostProcessing()) {
            Map<String, Object> node = new LinkedHashMap<>();
            node.put("operation", operation.getOperation());
            node.put("options", canonicalValue(operation.getOptions(), false));
            operations.add(node);
        }
        document.put("post_processing", operations);
        document.put("result_format", descriptor.getResultFormat().name());
        document.put("result_type", descriptor.getResultType().name());

        try {
            return mapper.writeValueAsString(document);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Could not render canonical form of " + descriptor, e);
        }
    }

    private static List<Object> filters(List<Filter> filters) {
        List<Object> nodes = new ArrayList<>(filters.size());
        for (Filter filter : filters) {
            Map<String, Object> node = new LinkedHashMap<>();
            if (filter.isRowLevel()) {
                node.put("policy", filter.getPolicyName());
                node.put("clause", filter.getValue());
            } else {
                node.put("col", filter.getColumn());
                node.put("op", filter.getOperator().name());
                node.put("val", canonicalValue(filter.getValue(), true));
            }
            nodes.add(node);
        }
        return nodes;
    }

    private static Object canonicalValue(Object value, boolean sortKeys) {
        if (value == null) {
            return null;
        }
        if (value instanceof Instant) {
            return value.toString();
        }
        if (value instanceof Map) {
            Map<String, Object> copy = sortKeys ? new TreeMap<>() : new LinkedHashMap<>();
            for (Map.Entry<?, ?> entry : ((Map<?, ?>) value).entrySet()) {
                copy.put(String.valueOf(entry.getKey()), canonicalValue(entry.getValue(), sortKeys));
            }
            return copy;
        }
        if (value instanceof Collection) {
            List<Object> copy = new ArrayList<>();
            for (Object element : (Collection<?>) value) {
                copy.add(canonicalValue(element, sortKeys));
            }
            return copy;
        }
        if (value instanceof Number || value instanceof Boolean || value instanceof String) {
            return value;
        }
        return value.toString();
    }
}
