package gr.imsi.athenarc.pipeline.security;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.ImmutableSortedSet;

/**
 * The authenticated principal of one request: its id, the roles it holds and the
 * attributes row-level policies substitute into their templates. Built once per
 * request by the caller and passed by reference; never persisted.
 */
public final class SecurityContext {

    private final String principalId;
    private final Set<String> roles;
    private final Map<String, Object> attributes;

    public SecurityContext(String principalId, Set<String> roles, Map<String, ?> attributes) {
        Preconditions.checkArgument(principalId != null && !principalId.isBlank(), "Principal id is required");
        this.principalId = principalId;
        this.roles = roles == null ? ImmutableSet.of() : ImmutableSet.copyOf(roles);
        this.attributes = attributes == null ? ImmutableMap.of() : ImmutableMap.copyOf(attributes);
    }

    public static SecurityContext of(String principalId, String... roles) {
        return new SecurityContext(principalId, ImmutableSet.copyOf(roles), null);
    }

    public String getPrincipalId() {
        return principalId;
    }

    public Set<String> getRoles() {
        return roles;
    }

    /**
     * @return the role names in natural order, as used for cache fingerprints
     */
    public ImmutableSortedSet<String> getSortedRoles() {
        return ImmutableSortedSet.copyOf(roles);
    }

    public Map<String, Object> getAttributes() {
        return attributes;
    }

    public Optional<Object> getAttribute(String name) {
        return Optional.ofNullable(attributes.get(name));
    }

    public SecurityContext withAttribute(String name, Object value) {
        ImmutableMap.Builder<String, Object> copy = ImmutableMap.builder();
        attributes.forEach((key, existing) -> {
            if (!key.equals(name)) {
                copy.put(key, existing);
            }
        });
        copy.put(name, value);
        return new SecurityContext(principalId, roles, copy.build());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SecurityContext)) return false;
        SecurityContext that = (SecurityContext) o;
        return principalId.equals(that.principalId) && roles.equals(that.roles) && attributes.equals(that.attributes);
    }

    @Override
    public int hashCode() {
        return Objects.hash(principalId, roles, attributes);
    }

    @Override
    public String toString() {
        // attribute values may be sensitive
        return "SecurityContext{principal=" + principalId + ", roles=" + getSortedRoles() + ", attributes=" + attributes.keySet() + '}';
    }
}
