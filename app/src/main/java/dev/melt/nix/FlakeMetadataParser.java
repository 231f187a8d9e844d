package dev.melt.nix;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.melt.forge.RepoLocator;
import dev.melt.model.FlakeData;
import dev.melt.model.FlakeInput;
import dev.melt.model.ForgeType;
import dev.melt.model.GitInput;
import dev.melt.model.OtherInput;
import dev.melt.model.PathInput;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

/** Turns the JSON printed by {@code nix flake metadata --json} into a {@link FlakeData} snapshot. */
public final class FlakeMetadataParser {
    private static final Logger logger = LogManager.getLogger(FlakeMetadataParser.class);
    private static final ObjectMapper objectMapper = new ObjectMapper();

    @JsonIgnoreProperties(ignoreUnknown = true)
    record Metadata(@Nullable String description, @Nullable Locks locks) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    record Locks(@Nullable Map<String, Node> nodes, @Nullable String root) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    record Node(@Nullable Map<String, JsonNode> inputs, @Nullable Source locked, @Nullable Source original) {}

    /** Shared shape of the {@code locked} and {@code original} entries of a lock node. */
    @JsonIgnoreProperties(ignoreUnknown = true)
    record Source(
            @JsonProperty("type") @Nullable String type,
            @Nullable String owner,
            @Nullable String repo,
            @Nullable String rev,
            @JsonProperty("ref") @Nullable String reference,
            @Nullable Long lastModified,
            @Nullable String url,
            @Nullable String path,
            @Nullable String host) {}

    private FlakeMetadataParser() {}

    public static FlakeData parse(Path flakePath, String json) throws NixException.MetadataParse {
        Metadata metadata;
        try {
            metadata = objectMapper.readValue(json, Metadata.class);
        } catch (JsonProcessingException e) {
            throw new NixException.MetadataParse(e.getOriginalMessage(), e);
        }
        if (metadata == null) {
            throw new NixException.MetadataParse("empty document", new IllegalArgumentException(json));
        }

        var inputs = new ArrayList<FlakeInput>();
        var locks = metadata.locks();
        if (locks != null && locks.nodes() != null) {
            var nodes = locks.nodes();
            var root = nodes.get(locks.root() == null ? "root" : locks.root());
            if (root != null && root.inputs() != null) {
                for (var entry : root.inputs().entrySet()) {
                    nodeName(entry.getValue())
                            .map(nodes::get)
                            .flatMap(node -> parseInput(entry.getKey(), node))
                            .ifPresent(inputs::add);
                }
            }
        }
        inputs.sort(Comparator.comparing(i -> i.name().toLowerCase(Locale.ROOT)));
        logger.debug("Parsed {} inputs for {}", inputs.size(), flakePath);
        return new FlakeData(flakePath, metadata.description(), inputs);
    }

    /** Root inputs reference a node by name, or by a "follows" path whose first element names the node. */
    private static Optional<String> nodeName(JsonNode value) {
        if (value.isTextual()) {
            return Optional.of(value.asText());
        }
        if (value.isArray() && !value.isEmpty() && value.get(0).isTextual()) {
            return Optional.of(value.get(0).asText());
        }
        return Optional.empty();
    }

    static Optional<FlakeInput> parseInput(String name, Node node) {
        var locked = node.locked();
        if (locked == null) {
            return Optional.empty();
        }
        var original = node.original();
        var type = firstNonNull(locked.type(), original == null ? null : original.type());
        if (type == null) {
            type = "other";
        }
        long lastModified = locked.lastModified() == null ? 0L : locked.lastModified();
        var rev = locked.rev() == null ? "" : locked.rev();
        var url = firstNonNull(locked.url(), original == null ? null : original.url());

        return switch (type) {
            case "github", "gitlab", "sourcehut", "git" -> Optional.of(
                    parseGit(name, type, locked, original, rev, lastModified, url));
            case "path" -> Optional.of(new PathInput(
                    name,
                    Optional.ofNullable(firstNonNull(locked.path(), original == null ? null : original.path()))
                            .orElse("")));
            default -> Optional.of(new OtherInput(name, url == null ? "unknown" : url, rev, lastModified));
        };
    }

    private static FlakeInput parseGit(
            String name,
            String type,
            Source locked,
            @Nullable Source original,
            String rev,
            long lastModified,
            @Nullable String url) {
        var owner = firstNonNull(locked.owner(), original == null ? null : original.owner());
        var repo = firstNonNull(locked.repo(), original == null ? null : original.repo());
        var host = firstNonNull(locked.host(), original == null ? null : original.host());
        var reference = original == null ? null : original.reference();

        if (owner == null || owner.isEmpty() || repo == null || repo.isEmpty()) {
            var location = RepoLocator.parse(url);
            if (location.isEmpty()) {
                logger.debug("Cannot determine owner/repo of {} from {}", name, url);
                return new OtherInput(name, url == null ? "unknown" : url, rev, lastModified);
            }
            owner = location.get().owner();
            repo = location.get().repo();
            if (host == null) {
                host = location.get().host();
            }
        }

        var forge = ForgeType.resolve(type, url);
        var display = switch (type) {
            case "github" -> "github:" + owner + "/" + repo;
            case "gitlab" -> host != null && !host.equals(ForgeType.DEFAULT_GITLAB_HOST)
                    ? "gitlab:" + owner + "/" + repo + " (" + host + ")"
                    : "gitlab:" + owner + "/" + repo;
            case "sourcehut" -> "sourcehut:" + ForgeType.tilde(owner) + "/" + repo;
            default -> url == null ? "git:" + owner + "/" + repo : url;
        };
        return new GitInput(name, owner, repo, forge, host, reference, rev, lastModified, display);
    }

    private static @Nullable String firstNonNull(@Nullable String a, @Nullable String b) {
        return a != null ? a : b;
    }
}
