package dev.melt.forge;

import com.fasterxml.jackson.databind.JsonNode;
import dev.melt.git.GitServiceException;
import dev.melt.model.Commit;
import dev.melt.model.ForgeType;
import dev.melt.model.GitInput;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/** git.sr.ht log API. Only the first page is read; both operations derive from the same listing. */
final class SourceHutApi {
    private final ForgeHttp http;
    private final String scheme;

    SourceHutApi(ForgeHttp http, String scheme) {
        this.http = http;
        this.scheme = scheme;
    }

    /**
     * Counts the entries newer than the locked revision. A page without the locked revision cannot tell how far
     * behind the input is, so it is rejected.
     */
    int countAhead(GitInput input) throws ForgeApiException, GitServiceException.RateLimited {
        var commits = listCommits(input);
        for (int i = 0; i < commits.size(); i++) {
            if (commits.get(i).locked()) {
                return i;
            }
        }
        throw new ForgeApiException("Locked revision not in first SourceHut log page");
    }

    List<Commit> listCommits(GitInput input) throws ForgeApiException, GitServiceException.RateLimited {
        var host = input.host() == null ? ForgeType.DEFAULT_SOURCEHUT_HOST : input.host();
        var url = "%s://%s/api/%s/%s/log/%s"
                .formatted(scheme, host, ForgeType.tilde(input.owner()), input.repo(), input.referenceOrHead());
        var results = http.getJson(url, Map.of(), false).get("results");
        if (results == null || !results.isArray()) {
            throw new ForgeApiException("SourceHut log response has no results");
        }
        var commits = new ArrayList<Commit>(results.size());
        for (JsonNode node : results) {
            var id = node.path("id").asText("");
            if (id.isEmpty()) {
                throw new ForgeApiException("SourceHut log entry without id");
            }
            commits.add(new Commit(
                    id,
                    Commit.firstLine(node.path("message").asText("")),
                    node.path("author").path("name").asText("Unknown"),
                    ApiDates.parseOrNow(node.path("timestamp").asText(null)),
                    input.isLockedRev(id)));
        }
        return commits;
    }
}
