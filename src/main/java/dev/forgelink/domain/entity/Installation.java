package dev.forgelink.domain.entity;

import jakarta.persistence.*;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;
import java.time.Instant;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;

/**
 * One connected Gitea account on one Gitea instance.
 *
 * <p>{@code externalId} is {@code "<host>:<user id>"}. {@code metadata} carries at least
 * {@code instance} (host), {@code base_url}, {@code domain_name} and {@code webhook_secret}.
 * Provisioned by onboarding; read-only from the webhook pipeline's perspective.
 */
@Entity
@Table(name = "installations", uniqueConstraints = {
        @UniqueConstraint(name = "uk_installations_provider_external_id",
                columnNames = {"provider", "external_id"})
})
public class Installation {

    public static final String PROVIDER_GITEA = "gitea";

    public static final String META_INSTANCE = "instance";
    public static final String META_BASE_URL = "base_url";
    public static final String META_DOMAIN_NAME = "domain_name";
    public static final String META_WEBHOOK_SECRET = "webhook_secret";

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "provider", nullable = false, length = 32)
    private String provider;

    @Column(name = "external_id", nullable = false)
    private String externalId;

    @Column(name = "name", nullable = false)
    private String name;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "metadata", columnDefinition = "jsonb", nullable = false)
    private Map<String, Object> metadata = new HashMap<>();

    @Column(name = "access_token", length = 512)
    private String accessToken;

    @ManyToMany(fetch = FetchType.LAZY)
    @JoinTable(name = "organization_installations",
            joinColumns = @JoinColumn(name = "installation_id"),
            inverseJoinColumns = @JoinColumn(name = "organization_id"))
    private Set<Organization> organizations = new HashSet<>();

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    protected Installation() {
    }

    public static Installation create(String provider, String externalId, String name,
            Map<String, Object> metadata, String accessToken) {
        Installation i = new Installation();
        i.provider = provider;
        i.externalId = externalId;
        i.name = name;
        i.metadata = new HashMap<>(metadata);
        i.accessToken = accessToken;
        i.createdAt = Instant.now();
        return i;
    }

    public void addOrganization(Organization organization) {
        organizations.add(organization);
    }

    public boolean isLinkedTo(long organizationId) {
        return organizations.stream().anyMatch(o -> o.getId() != null && o.getId() == organizationId);
    }

    public String metadataValue(String key) {
        Object value = metadata.get(key);
        return value != null ? value.toString() : null;
    }

    public String getInstance() {
        return metadataValue(META_INSTANCE);
    }

    public String getBaseUrl() {
        return metadataValue(META_BASE_URL);
    }

    public String getDomainName() {
        return metadataValue(META_DOMAIN_NAME);
    }

    public String getWebhookSecret() {
        return metadataValue(META_WEBHOOK_SECRET);
    }

    /** The value Gitea is told to send back in every delivery's {@code secret} field. */
    public String compositeWebhookSecret() {
        return externalId + "#" + getWebhookSecret();
    }

    public Long getId() {
        return id;
    }

    public String getProvider() {
        return provider;
    }

    public String getExternalId() {
        return externalId;
    }

    public String getName() {
        return name;
    }

    public Map<String, Object> getMetadata() {
        return Collections.unmodifiableMap(metadata);
    }

    public String getAccessToken() {
        return accessToken;
    }

    public Set<Organization> getOrganizations() {
        return Set.copyOf(organizations);
    }

    public Instant getCreatedAt() {
        return createdAt;
    }
}
