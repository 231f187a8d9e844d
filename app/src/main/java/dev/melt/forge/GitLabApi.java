package dev.melt.forge;

import com.fasterxml.jackson.databind.JsonNode;
import dev.melt.git.GitServiceException;
import dev.melt.model.Commit;
import dev.melt.model.ForgeType;
import dev.melt.model.GitInput;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/** GitLab v4 API, for gitlab.com and self-hosted instances alike. */
final class GitLabApi {
    private final ForgeHttp http;
    private final String scheme;

    GitLabApi(ForgeHttp http, String scheme) {
        this.http = http;
        this.scheme = scheme;
    }

    int countAhead(GitInput input) throws ForgeApiException, GitServiceException.RateLimited {
        var url = "%s/repository/compare?from=%s&to=%s"
                .formatted(projectUrl(input), input.rev(), encode(input.referenceOrHead()));
        var commits = http.getJson(url, Map.of(), false).get("commits");
        if (commits == null || !commits.isArray()) {
            throw new ForgeApiException("GitLab compare response has no commits list");
        }
        return commits.size();
    }

    List<Commit> listCommits(GitInput input) throws ForgeApiException, GitServiceException.RateLimited {
        var url = "%s/repository/commits?ref_name=%s&per_page=100"
                .formatted(projectUrl(input), encode(input.referenceOrHead()));
        var json = http.getJson(url, Map.of(), false);
        if (!json.isArray()) {
            throw new ForgeApiException("GitLab commits response is not a list");
        }
        var commits = new ArrayList<Commit>(json.size());
        for (JsonNode node : json) {
            var id = node.path("id").asText("");
            if (id.isEmpty()) {
                throw new ForgeApiException("GitLab commit entry without id");
            }
            commits.add(new Commit(
                    id,
                    Commit.firstLine(node.path("title").asText("")),
                    node.path("author_name").asText("Unknown"),
                    ApiDates.parseOrNow(node.path("created_at").asText(null)),
                    input.isLockedRev(id)));
        }
        return commits;
    }

    private String projectUrl(GitInput input) {
        var host = input.host() == null ? ForgeType.DEFAULT_GITLAB_HOST : input.host();
        return "%s://%s/api/v4/projects/%s".formatted(scheme, host, encode(input.owner() + "/" + input.repo()));
    }

    private static String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8);
    }
}
