package gr.imsi.athenarc.pipeline.policy;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import gr.imsi.athenarc.pipeline.exception.PipelineStage;
import gr.imsi.athenarc.pipeline.exception.QueryForbiddenException;
import gr.imsi.athenarc.pipeline.query.Filter;
import gr.imsi.athenarc.pipeline.query.QueryDescriptor;
import gr.imsi.athenarc.pipeline.security.SecurityContext;

/**
 * Adds the row-level predicates that apply to a principal to a descriptor.
 * Matching policies are rendered in name order and appended to the filter list,
 * so they are combined with the caller's filters (and with each other) by AND.
 */
public class RowLevelPolicyInjector {

    private static final Logger LOG = LoggerFactory.getLogger(RowLevelPolicyInjector.class);

    public static final String CURRENT_PRINCIPAL_ID = "current_principal_id";

    private static final Pattern PLACEHOLDER = Pattern.compile("\\{([A-Za-z_][A-Za-z0-9_]*)}");

    /**
     * @return a descriptor carrying the matching policies as row-level filters,
     * or {@code descriptor} itself when none applies
     * @throws QueryForbiddenException if a template references an attribute the context lacks
     */
    public QueryDescriptor apply(QueryDescriptor descriptor, SecurityContext context, List<RowLevelPolicy> policies) {
        String datasource = descriptor.getDatasource().getId();
        List<RowLevelPolicy> matching = policies.stream()
            .filter(policy -> policy.appliesTo(datasource, context.getRoles()))
            .sorted(Comparator.comparing(RowLevelPolicy::getName))
            .collect(Collectors.toList());
        if (matching.isEmpty()) {
            return descriptor;
        }

        List<Filter> predicates = new ArrayList<>(matching.size());
        for (RowLevelPolicy policy : matching) {
            predicates.add(Filter.rowLevel(policy.getName(), render(policy, context)));
        }
        LOG.debug("Applied row-level policies {} for principal {}",
            matching.stream().map(RowLevelPolicy::getName).collect(Collectors.toList()), context.getPrincipalId());
        return descriptor.withAdditionalFilters(predicates);
    }

    String render(RowLevelPolicy policy, SecurityContext context) {
        Matcher matcher = PLACEHOLDER.matcher(policy.getPredicateTemplate());
        StringBuilder rendered = new StringBuilder();
        while (matcher.find()) {
            String name = matcher.group(1);
            Object value = resolve(name, context).orElseThrow(() -> new QueryForbiddenException(
                PipelineStage.POLICY_APPLIED, "policy:" + policy.getName(),
                "Row-level policy " + policy.getName() + " references unknown attribute " + name));
            matcher.appendReplacement(rendered, Matcher.quoteReplacement(literal(value, policy, name)));
        }
        matcher.appendTail(rendered);
        return rendered.toString();
    }

    private static Optional<Object> resolve(String name, SecurityContext context) {
        if (CURRENT_PRINCIPAL_ID.equals(name)) {
            return Optional.of(context.getPrincipalId());
        }
        return context.getAttribute(name);
    }

    private static String literal(Object value, RowLevelPolicy policy, String attribute) {
        if (value instanceof Number || value instanceof Boolean) {
            return value.toString();
        }
        if (value instanceof Collection) {
            Collection<?> values = (Collection<?>) value;
            if (values.isEmpty()) {
                throw new QueryForbiddenException(PipelineStage.POLICY_APPLIED, "policy:" + policy.getName(),
                    "Row-level policy " + policy.getName() + " resolved attribute " + attribute + " to an empty list");
            }
            List<String> literals = new ArrayList<>(values.size());
            for (Object element : values) {
                if (element == null || element instanceof Collection) {
                    throw new QueryForbiddenException(PipelineStage.POLICY_APPLIED, "policy:" + policy.getName(),
                        "Row-level policy " + policy.getName() + " cannot render attribute " + attribute);
                }
                literals.add(literal(element, policy, attribute));
            }
            return String.join(", ", literals);
        }
        return "'" + value.toString().replace("'", "''") + "'";
    }
}
