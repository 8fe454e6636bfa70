package dev.forgelink.domain.entity;

import jakarta.persistence.*;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;
import java.time.Instant;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Local record of a tracked Gitea repository.
 *
 * <p>Identity is {@code externalId} ({@code "<instance>:<full name>"}), never the name: upstream
 * renames update {@code name}, {@code url} and {@code config} in place so commit and pull request
 * history stays attached.
 */
@Entity
@Table(name = "repositories", uniqueConstraints = {
        @UniqueConstraint(name = "uk_repositories_org_provider_external_id",
                columnNames = {"organization_id", "provider", "external_id"})
})
public class SourceRepository {

    public static final String PROVIDER_GITEA = "integrations:gitea";

    public static final String CONFIG_REPO = "repo";
    public static final String CONFIG_PATH = "path";
    public static final String CONFIG_INSTANCE = "instance";
    public static final String CONFIG_WEBHOOK_ID = "webhook_id";

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "organization_id", nullable = false)
    private Long organizationId;

    @Column(name = "installation_id")
    private Long installationId;

    @Column(name = "provider", nullable = false, length = 64)
    private String provider;

    @Column(name = "external_id", nullable = false)
    private String externalId;

    @Column(name = "name", nullable = false)
    private String name;

    @Column(name = "url", length = 1024)
    private String url;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "config", columnDefinition = "jsonb", nullable = false)
    private Map<String, Object> config = new HashMap<>();

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    protected SourceRepository() {
    }

    public static SourceRepository create(long organizationId, Long installationId, String provider,
            String externalId, String name, String url, Map<String, Object> config) {
        SourceRepository r = new SourceRepository();
        r.organizationId = organizationId;
        r.installationId = installationId;
        r.provider = provider;
        r.externalId = externalId;
        r.name = name;
        r.url = url;
        r.config = new HashMap<>(config);
        r.createdAt = Instant.now();
        return r;
    }

    /**
     * Whether the upstream name or URL reported by an event differ from what is stored.
     */
    public boolean isStale(String upstreamName, String upstreamUrl) {
        return !Objects.equals(name, upstreamName)
                || !Objects.equals(url, upstreamUrl)
                || !Objects.equals(config.get(CONFIG_REPO), upstreamName);
    }

    public void applyUpstreamRename(String upstreamName, String upstreamUrl) {
        Map<String, Object> updated = new HashMap<>(config);
        updated.put(CONFIG_REPO, upstreamName);
        updated.put(CONFIG_PATH, upstreamName);
        this.name = upstreamName;
        this.url = upstreamUrl;
        this.config = updated;
    }

    /** {@code "<instance>:<full name>"}. */
    public static String externalIdFor(String instance, String fullName) {
        return instance + ":" + fullName;
    }

    public String configValue(String key) {
        Object value = config.get(key);
        return value != null ? value.toString() : null;
    }

    /** Full name used against the Gitea API; falls back to the display name. */
    public String getRepoPath() {
        String repo = configValue(CONFIG_REPO);
        return repo != null ? repo : name;
    }

    public Long getId() {
        return id;
    }

    public Long getOrganizationId() {
        return organizationId;
    }

    public Long getInstallationId() {
        return installationId;
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

    public String getUrl() {
        return url;
    }

    public Map<String, Object> getConfig() {
        return Collections.unmodifiableMap(config);
    }

    public Instant getCreatedAt() {
        return createdAt;
    }
}
