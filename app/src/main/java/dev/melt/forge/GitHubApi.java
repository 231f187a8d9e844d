package dev.melt.forge;

import com.fasterxml.jackson.databind.JsonNode;
import dev.melt.git.GitServiceException;
import dev.melt.model.Commit;
import dev.melt.model.GitInput;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.jetbrains.annotations.Nullable;

/** GitHub REST API: compare for update counts, commit listing for changelogs. */
final class GitHubApi {
    private final ForgeHttp http;
    private final String apiBase;
    private final @Nullable String token;

    GitHubApi(ForgeHttp http, String apiBase, @Nullable String token) {
        this.http = http;
        this.apiBase = apiBase;
        this.token = token;
    }

    int countAhead(GitInput input) throws ForgeApiException, GitServiceException.RateLimited {
        var url = "%s/repos/%s/%s/compare/%s...%s"
                .formatted(apiBase, input.owner(), input.repo(), input.rev(), input.referenceOrHead());
        var json = http.getJson(url, headers(), true);
        var aheadBy = json.get("ahead_by");
        if (aheadBy == null || !aheadBy.canConvertToInt()) {
            throw new ForgeApiException("GitHub compare response has no ahead_by");
        }
        return aheadBy.asInt();
    }

    List<Commit> listCommits(GitInput input) throws ForgeApiException, GitServiceException.RateLimited {
        var url = "%s/repos/%s/%s/commits?sha=%s&per_page=100"
                .formatted(apiBase, input.owner(), input.repo(), input.referenceOrHead());
        var json = http.getJson(url, headers(), true);
        if (!json.isArray()) {
            throw new ForgeApiException("GitHub commits response is not a list");
        }
        var commits = new ArrayList<Commit>(json.size());
        for (JsonNode node : json) {
            var sha = node.path("sha").asText("");
            var commit = node.path("commit");
            if (sha.isEmpty() || !commit.isObject()) {
                throw new ForgeApiException("GitHub commit entry without sha");
            }
            var author = commit.path("author");
            commits.add(new Commit(
                    sha,
                    Commit.firstLine(commit.path("message").asText("")),
                    author.path("name").asText("Unknown"),
                    ApiDates.parseOrNow(author.path("date").asText(null)),
                    input.isLockedRev(sha)));
        }
        return commits;
    }

    private Map<String, String> headers() {
        if (token == null) {
            return Map.of("Accept", "application/vnd.github+json");
        }
        return Map.of("Accept", "application/vnd.github+json", "Authorization", "Bearer " + token);
    }
}
