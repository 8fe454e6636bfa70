package dev.forgelink.domain.entity;

import jakarta.persistence.*;
import java.time.Instant;

/**
 * Local tenant. The webhook pipeline only reads its identifier.
 */
@Entity
@Table(name = "organizations")
public class Organization {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "slug", nullable = false, unique = true, length = 64)
    private String slug;

    @Column(name = "name", nullable = false)
    private String name;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    protected Organization() {
    }

    public static Organization create(String slug, String name) {
        Organization o = new Organization();
        o.slug = slug;
        o.name = name;
        o.createdAt = Instant.now();
        return o;
    }

    public Long getId() {
        return id;
    }

    public String getSlug() {
        return slug;
    }

    public String getName() {
        return name;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }
}
