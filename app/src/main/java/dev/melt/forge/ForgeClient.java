package dev.melt.forge;

import dev.melt.config.ServiceConfig;
import dev.melt.git.ChangelogAssembler;
import dev.melt.git.GitServiceException;
import dev.melt.model.ChangelogData;
import dev.melt.model.GitInput;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Answers "how many commits ahead" and "what is the changelog" for a {@link GitInput}, trying the provider's REST
 * API first and falling back to a local mirror when the API cannot answer. Codeberg, Gitea and generic remotes
 * always use the mirror.
 */
public final class ForgeClient {
    private static final Logger logger = LogManager.getLogger(ForgeClient.class);

    /** Local answer to the same questions, used when no API is available or the API call failed. */
    public interface MirrorFallback {
        int countAhead(GitInput input) throws GitServiceException;

        ChangelogData changelog(GitInput input) throws GitServiceException;
    }

    private final GitHubApi github;
    private final GitLabApi gitlab;
    private final SourceHutApi sourcehut;
    private final MirrorFallback fallback;

    public ForgeClient(ServiceConfig config, MirrorFallback fallback) {
        var http = new ForgeHttp(config);
        this.github = new GitHubApi(http, config.githubApiBase(), config.githubToken());
        this.gitlab = new GitLabApi(http, config.forgeScheme());
        this.sourcehut = new SourceHutApi(http, config.forgeScheme());
        this.fallback = fallback;
    }

    public int countAhead(GitInput input) throws GitServiceException {
        try {
            return switch (input.forge()) {
                case GITHUB -> github.countAhead(input);
                case GITLAB -> gitlab.countAhead(input);
                case SOURCEHUT -> sourcehut.countAhead(input);
                case CODEBERG, GITEA, GENERIC -> fallback.countAhead(input);
            };
        } catch (ForgeApiException e) {
            logger.debug("API update check for {} failed, using mirror: {}", input.name(), e.getMessage());
            return fallback.countAhead(input);
        }
    }

    public ChangelogData changelog(GitInput input) throws GitServiceException {
        try {
            return switch (input.forge()) {
                case GITHUB -> ChangelogAssembler.fromListing(github.listCommits(input), input);
                case GITLAB -> ChangelogAssembler.fromListing(gitlab.listCommits(input), input);
                case SOURCEHUT -> ChangelogAssembler.fromListing(sourcehut.listCommits(input), input);
                case CODEBERG, GITEA, GENERIC -> fallback.changelog(input);
            };
        } catch (ForgeApiException e) {
            logger.debug("API changelog for {} failed, using mirror: {}", input.name(), e.getMessage());
            return fallback.changelog(input);
        }
    }
}
