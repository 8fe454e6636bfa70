package dev.forgelink.domain.valueobject;

/**
 * Issue identifier in {@code "<owner>/<repo>#<index>"} form, as shown to users and stored as link key.
 */
public record IssueReference(String repo, String index) {

    public IssueReference {
        if (repo == null || repo.isBlank()) throw new IllegalArgumentException("repo must be provided");
        if (index == null || index.isBlank()) throw new IllegalArgumentException("issue must be provided");
    }

    public static IssueReference parse(String value) {
        if (value == null) throw new IllegalArgumentException("Repo and Issue index must be provided");
        int idx = value.lastIndexOf('#');
        if (idx < 0) throw new IllegalArgumentException("Repo and Issue index must be provided");
        return new IssueReference(value.substring(0, idx), value.substring(idx + 1));
    }

    public String key() {
        return repo + "#" + index;
    }

    /** Globally unique key: {@code "<domain_name>:<repo>#<index>"}. */
    public String externalKey(String domainName) {
        return domainName + ":" + key();
    }

    public String url(String baseUrl) {
        return baseUrl + "/" + repo + "/issues/" + index;
    }
}
