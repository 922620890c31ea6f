package org.companyllm.rag.connectors.graph;

import java.util.ArrayList;

import org.companyllm.rag.connectors.http.QueryString;
import org.companyllm.rag.connectors.http.RestClient;
import org.companyllm.rag.connectors.paging.LinkPagination;
import org.companyllm.rag.connectors.paging.Paginator;
import org.companyllm.rag.pipeline.ir.RawRecord;
import org.companyllm.rag.pipeline.ir.SourceType;
import org.companyllm.rag.pipeline.source.RecordSource;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.node.TextNode;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Flux;

/**
 * Channel messages of Microsoft Teams, read through Microsoft Graph with replies expanded.
 *
 * A thread becomes one record for the root message followed by one record per reply;
 * replies keep Graph's {@code replyToId} so they can be tied back to their thread.
 * The lookback window is applied here, per message.
 */
@Slf4j
public class TeamsRecordSource implements RecordSource {
    static final String TEAM_FILTER = "resourceProvisioningOptions/Any(x:x eq 'Team')";
    public static final String TEAM_ID_CONTEXT = "team_id";
    public static final String TEAM_NAME_CONTEXT = "team_name";
    public static final String CHANNEL_ID_CONTEXT = "channel_id";
    public static final String CHANNEL_NAME_CONTEXT = "channel_name";

    private final RestClient client;
    private final TeamsConfig config;
    private final LookbackWindow lookback;

    public TeamsRecordSource(RestClient client, TeamsConfig config) {
        this.client = client;
        this.config = config.validate();
        this.lookback = LookbackWindow.of(config.getLookbackDays(), config.getClock());
    }

    @Override
    public String name() {
        return SourceType.TEAMS.wireName();
    }

    @Override
    public Flux<RawRecord> readRecords() {
        return teams().concatMap(team -> {
            var teamId = team.path("id").asText();
            var teamName = team.path("displayName").asText(teamId);
            return new Paginator(client, new LinkPagination("/teams/" + teamId + "/channels"), "channels of " + teamName)
                .fetchAll()
                .concatMap(channel -> channelRecords(teamId, teamName, channel));
        });
    }

    private Flux<JsonNode> teams() {
        if (config.getTeamNames().isEmpty()) {
            var discovery = QueryString.of("$filter", TEAM_FILTER).and("$select", "id,displayName").appendTo("/groups");
            return new Paginator(client, new LinkPagination(discovery), "teams").fetchAll();
        }
        return Flux.fromIterable(config.getTeamNames()).concatMap(teamName -> {
            var filter = "displayName eq '" + teamName.replace("'", "''") + "' and " + TEAM_FILTER;
            return client.getJson(QueryString.of("$filter", filter).and("$select", "id,displayName").appendTo("/groups"))
                .flatMapMany(result -> {
                    var groups = result.path("value");
                    if (groups.isEmpty()) {
                        log.warn("Team with display name '{}' not found, skipping", teamName);
                        return Flux.empty();
                    }
                    return Flux.just(groups.get(0));
                });
        });
    }

    private Flux<RawRecord> channelRecords(String teamId, String teamName, JsonNode channel) {
        var channelId = channel.path("id").asText();
        var channelName = channel.path("displayName").asText(channelId);
        var messages = QueryString.of("$expand", "replies")
            .appendTo("/teams/" + teamId + "/channels/" + channelId + "/messages");
        return new Paginator(client, new LinkPagination(messages), "messages of " + teamName + "/" + channelName)
            .fetchAll()
            .filter(JsonNode::isObject)
            .concatMapIterable(message -> {
                var root = ((ObjectNode) message).deepCopy();
                var replies = root.remove("replies");
                var thread = new ArrayList<ObjectNode>();
                thread.add(root);
                if (replies != null) {
                    for (var reply : replies) {
                        if (reply.isObject()) {
                            var copy = ((ObjectNode) reply).deepCopy();
                            if (!copy.hasNonNull("replyToId")) {
                                copy.put("replyToId", root.path("id").asText());
                            }
                            thread.add(copy);
                        }
                    }
                }
                return thread;
            })
            .filter(lookback::includes)
            .map(payload -> new RawRecord(SourceType.TEAMS, payload)
                .withContext(TEAM_ID_CONTEXT, TextNode.valueOf(teamId))
                .withContext(TEAM_NAME_CONTEXT, TextNode.valueOf(teamName))
                .withContext(CHANNEL_ID_CONTEXT, TextNode.valueOf(channelId))
                .withContext(CHANNEL_NAME_CONTEXT, TextNode.valueOf(channelName)));
    }
}
